package net.salescoach.domain.analysis;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.annotation.Nullable;

public record CallParticipant(
    String name,
    @Nullable String role,
    @JsonProperty("is_decision_maker") @Nullable Boolean decisionMaker,
    @Nullable String sentiment
) {
}
