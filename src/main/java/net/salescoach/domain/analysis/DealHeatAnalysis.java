package net.salescoach.domain.analysis;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.annotation.Nullable;
import java.util.List;

/**
 * Deal temperature assessment for one call.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record DealHeatAnalysis(
    @JsonProperty("heat_score") @Nullable Double heatScore,
    @Nullable String temperature,
    @Nullable String trend,
    @JsonProperty("key_factors") List<HeatFactor> keyFactors,
    @JsonProperty("winning_probability") @Nullable String winningProbability,
    @JsonProperty("recommended_action") @Nullable String recommendedAction
) {
    public DealHeatAnalysis {
        keyFactors = keyFactors == null ? List.of() : List.copyOf(keyFactors);
    }
}
