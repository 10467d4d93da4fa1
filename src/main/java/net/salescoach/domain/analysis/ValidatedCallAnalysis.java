package net.salescoach.domain.analysis;

import jakarta.annotation.Nullable;
import java.time.LocalDate;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Every analysis kind of one call after schema validation.
 *
 * <p>Kinds that were never analysed are present as {@code Degraded(null, not_yet_analyzed)}
 * so consumers never need to null-check the components themselves.</p>
 */
public record ValidatedCallAnalysis(
    UUID callId,
    @Nullable LocalDate callDate,
    ValidatedAnalysis<BehaviorAnalysis> behavior,
    ValidatedAnalysis<StrategyAnalysis> strategy,
    ValidatedAnalysis<CallMetadataAnalysis> metadata,
    ValidatedAnalysis<PsychologyAnalysis> psychology,
    ValidatedAnalysis<CoachingAnalysis> coaching,
    ValidatedAnalysis<DealHeatAnalysis> dealHeat,
    ValidatedAnalysis<CompetitiveIntelAnalysis> competitiveIntel
) {
    public ValidatedCallAnalysis {
        Objects.requireNonNull(callId, "callId");
        Objects.requireNonNull(behavior, "behavior");
        Objects.requireNonNull(strategy, "strategy");
        Objects.requireNonNull(metadata, "metadata");
        Objects.requireNonNull(psychology, "psychology");
        Objects.requireNonNull(coaching, "coaching");
        Objects.requireNonNull(dealHeat, "dealHeat");
        Objects.requireNonNull(competitiveIntel, "competitiveIntel");
    }

    public Optional<StrategyAnalysis> strategyValue() {
        return strategy.usableValue();
    }

    public Optional<CallMetadataAnalysis> metadataValue() {
        return metadata.usableValue();
    }

    public Optional<PsychologyAnalysis> psychologyValue() {
        return psychology.usableValue();
    }

    public Optional<CoachingAnalysis> coachingValue() {
        return coaching.usableValue();
    }

    public Optional<DealHeatAnalysis> dealHeatValue() {
        return dealHeat.usableValue();
    }

    public Optional<CompetitiveIntelAnalysis> competitiveIntelValue() {
        return competitiveIntel.usableValue();
    }
}
