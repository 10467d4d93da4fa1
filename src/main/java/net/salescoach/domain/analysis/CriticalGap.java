package net.salescoach.domain.analysis;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.annotation.Nullable;

/**
 * Missing deal-qualification information surfaced by the strategy analysis.
 *
 * <p>{@code structured} is {@code false} when the gap was normalized from a legacy
 * bare-string entry, in which case only {@code description} is known.</p>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CriticalGap(
    @Nullable GapCategory category,
    String description,
    @Nullable GapImpact impact,
    @JsonProperty("suggested_question") @Nullable String suggestedQuestion,
    boolean structured
) {

    public static CriticalGap fromPlainText(String text) {
        return new CriticalGap(null, text, null, null, false);
    }

    /**
     * Deduplication key: category plus trimmed description.
     */
    @JsonIgnore
    public DedupKey dedupKey() {
        return new DedupKey(category, description == null ? "" : description.trim());
    }

    public record DedupKey(@Nullable GapCategory category, String description) {
    }
}
