package net.salescoach.application.research;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.annotation.Nullable;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;

/**
 * Rep-supplied context for a streamed account research brief.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AccountResearchRequest(
    String companyName,
    @Nullable String website,
    @Nullable String industry,
    @Nullable List<StakeholderHint> stakeholders,
    @Nullable String productPitch,
    @Nullable String dealStage,
    @Nullable String knownChallenges,
    @Nullable String additionalNotes
) {

    static final int MAX_COMPANY_NAME = 200;
    static final int MAX_SHORT_FIELD = 100;
    static final int MAX_STAKEHOLDERS = 20;
    static final int MAX_PRODUCT_PITCH = 1000;
    static final int MAX_LONG_FIELD = 2000;

    public AccountResearchRequest {
        stakeholders = stakeholders == null ? List.of() : List.copyOf(stakeholders);
    }

    /**
     * A person the rep expects to meet.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record StakeholderHint(String name, @Nullable String title, @Nullable String role) {
    }

    /**
     * Checks field presence and length limits.
     *
     * @return one entry per violation, as {@code path: message}; empty when valid
     */
    public List<String> violations() {
        List<String> violations = new ArrayList<>();
        if (companyName == null || companyName.isBlank()) {
            violations.add("companyName: Company name is required");
        } else {
            maxLength(violations, "companyName", companyName, MAX_COMPANY_NAME);
        }
        if (website != null && !isHttpUrl(website)) {
            violations.add("website: Invalid website URL");
        }
        maxLength(violations, "industry", industry, MAX_SHORT_FIELD);
        if (stakeholders.size() > MAX_STAKEHOLDERS) {
            violations.add("stakeholders: Maximum " + MAX_STAKEHOLDERS + " stakeholders allowed");
        }
        for (int i = 0; i < stakeholders.size(); i++) {
            StakeholderHint hint = stakeholders.get(i);
            String path = "stakeholders." + i;
            if (hint == null || hint.name() == null || hint.name().isBlank()) {
                violations.add(path + ".name: Stakeholder name is required");
                continue;
            }
            maxLength(violations, path + ".name", hint.name(), MAX_SHORT_FIELD);
            maxLength(violations, path + ".title", hint.title(), MAX_SHORT_FIELD);
            maxLength(violations, path + ".role", hint.role(), MAX_SHORT_FIELD);
        }
        maxLength(violations, "productPitch", productPitch, MAX_PRODUCT_PITCH);
        maxLength(violations, "dealStage", dealStage, MAX_SHORT_FIELD);
        maxLength(violations, "knownChallenges", knownChallenges, MAX_LONG_FIELD);
        maxLength(violations, "additionalNotes", additionalNotes, MAX_LONG_FIELD);
        return violations;
    }

    private static void maxLength(List<String> violations, String path, @Nullable String value, int max) {
        if (value != null && value.length() > max) {
            violations.add(path + ": must be at most " + max + " characters");
        }
    }

    private static boolean isHttpUrl(String value) {
        try {
            URI uri = new URI(value.trim());
            String scheme = uri.getScheme();
            return uri.getHost() != null
                && ("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme));
        } catch (URISyntaxException ex) {
            return false;
        }
    }
}
