package net.salescoach.domain.analysis;

import jakarta.annotation.Nullable;
import java.util.List;

public record CoachingAnalysis(
    @Nullable String overallGrade,
    @Nullable String executiveSummary,
    @Nullable String primaryFocusArea,
    List<String> strengths,
    List<String> improvements,
    @Nullable String coachingPrescription,
    @Nullable String immediateAction
) {
    public CoachingAnalysis {
        strengths = strengths == null ? List.of() : List.copyOf(strengths);
        improvements = improvements == null ? List.of() : List.copyOf(improvements);
    }
}
