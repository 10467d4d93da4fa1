package net.salescoach.domain.analysis;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.annotation.Nullable;

/**
 * One factor moving deal heat up ("Positive") or down ("Negative").
 *
 * <p>Legacy payloads stored factors as {@code {positive: [...], negative: [...]}} string
 * lists; those normalize with {@code structured=false} and no reasoning.</p>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record HeatFactor(String factor, @Nullable String impact, @Nullable String reasoning, boolean structured) {
}
