package net.salescoach.domain.analysis;

import jakarta.annotation.Nullable;

/**
 * Behavioral scoring for one call: patience, talk/listen balance, next steps, question quality.
 */
public record BehaviorAnalysis(
    @Nullable Double overallScore,
    @Nullable String grade,
    @Nullable Double patienceScore,
    @Nullable Integer interruptionCount,
    @Nullable Double talkListenScore,
    @Nullable Double repTalkPercentage,
    @Nullable Double nextStepsScore,
    @Nullable Boolean nextStepsSecured,
    @Nullable Double questionQualityScore
) {
}
