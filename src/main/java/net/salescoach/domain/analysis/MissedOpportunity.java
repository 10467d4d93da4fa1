package net.salescoach.domain.analysis;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.annotation.Nullable;

public record MissedOpportunity(
    String pain,
    @Nullable String severity,
    @JsonProperty("suggested_pitch") @Nullable String suggestedPitch,
    @JsonProperty("talk_track") @Nullable String talkTrack,
    boolean structured
) {
}
