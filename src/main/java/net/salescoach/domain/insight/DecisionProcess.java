package net.salescoach.domain.insight;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.annotation.Nullable;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record DecisionProcess(
    List<String> stakeholders,
    @Nullable String timeline,
    @JsonProperty("budget_signals") @Nullable String budgetSignals
) {
    public DecisionProcess {
        stakeholders = stakeholders == null ? List.of() : List.copyOf(stakeholders);
    }
}
