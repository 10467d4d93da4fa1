package net.salescoach.application.insight;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Industry codes accepted on an account.
 */
final class IndustryCatalog {

    static final List<String> CODES = List.of(
        "education", "local_government", "state_government", "federal_government", "healthcare",
        "msp", "technology", "finance", "manufacturing", "retail", "nonprofit", "other");

    private static final Set<String> KNOWN = Set.copyOf(CODES);

    private IndustryCatalog() {
    }

    static Optional<String> normalize(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return Optional.empty();
        }
        String normalized = candidate.trim().toLowerCase(Locale.ROOT);
        return KNOWN.contains(normalized) ? Optional.of(normalized) : Optional.empty();
    }
}
