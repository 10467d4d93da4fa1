package net.salescoach.domain.analysis;

import jakarta.annotation.Nullable;
import java.util.List;

public record CallMetadataAnalysis(
    @Nullable String summary,
    List<String> topics,
    @Nullable Double durationMinutes,
    List<CallParticipant> participants
) {
    public CallMetadataAnalysis {
        topics = topics == null ? List.of() : List.copyOf(topics);
        participants = participants == null ? List.of() : List.copyOf(participants);
    }
}
