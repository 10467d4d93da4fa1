package net.salescoach.application.insight;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Stream;
import net.salescoach.domain.analysis.CoachingAnalysis;
import net.salescoach.domain.analysis.CompetitorMention;
import net.salescoach.domain.analysis.CriticalGap;
import net.salescoach.domain.analysis.DealHeatAnalysis;
import net.salescoach.domain.analysis.PsychologyAnalysis;
import net.salescoach.domain.analysis.ValidatedCallAnalysis;
import net.salescoach.domain.insight.CoachingTrend;
import net.salescoach.domain.insight.StructuredInsights;
import org.springframework.stereotype.Component;

/**
 * Deterministic fold of validated per-call analyses into account-level structured insights.
 *
 * <p>Input must be ordered newest call first. Every "latest" value is the first match in that
 * order, and every deduplication keeps the first occurrence, so the most recent call wins.
 * Degraded analyses contribute whatever partial value they carry.</p>
 */
@Component
public class InsightAggregator {

    static final int MAX_CRITICAL_GAPS = 5;
    static final int MAX_COMPETITORS = 5;

    /**
     * Folds the analyses of one account.
     *
     * @param newestFirst validated analyses ordered by call date, newest first, undated calls last
     * @throws IllegalArgumentException when the input is not ordered newest first
     */
    public StructuredInsights aggregate(List<ValidatedCallAnalysis> newestFirst) {
        Objects.requireNonNull(newestFirst, "newestFirst");
        requireNewestFirst(newestFirst);

        List<CriticalGap> gaps = firstDistinct(
            newestFirst.stream()
                .flatMap(call -> call.strategyValue().stream())
                .flatMap(strategy -> strategy.criticalGaps().stream()),
            CriticalGap::dedupKey,
            MAX_CRITICAL_GAPS);

        List<CompetitorMention> competitors = firstDistinct(
            newestFirst.stream().flatMap(InsightAggregator::competitorsOf),
            CompetitorMention::dedupKey,
            MAX_COMPETITORS);

        String prospectPersona = firstPresent(newestFirst,
            call -> call.psychologyValue().map(PsychologyAnalysis::prospectPersona));
        DealHeatAnalysis latestHeat = firstPresent(newestFirst, ValidatedCallAnalysis::dealHeatValue);

        return new StructuredInsights(gaps, competitors, prospectPersona, coachingTrend(newestFirst), latestHeat);
    }

    private static CoachingTrend coachingTrend(List<ValidatedCallAnalysis> newestFirst) {
        List<String> recentGrades = newestFirst.stream()
            .flatMap(call -> call.coachingValue().stream())
            .map(CoachingAnalysis::overallGrade)
            .filter(Objects::nonNull)
            .toList();
        String primaryFocusArea = firstPresent(newestFirst,
            call -> call.coachingValue().map(CoachingAnalysis::primaryFocusArea));
        if (recentGrades.isEmpty() && primaryFocusArea == null) {
            return null;
        }
        // avg_grade is the most recent grade by contract, not a mean
        String avgGrade = recentGrades.isEmpty() ? null : recentGrades.get(0);
        return new CoachingTrend(avgGrade, primaryFocusArea, recentGrades);
    }

    private static Stream<CompetitorMention> competitorsOf(ValidatedCallAnalysis call) {
        Stream<CompetitorMention> dedicated = call.competitiveIntelValue().stream()
            .flatMap(intel -> intel.competitors().stream());
        Stream<CompetitorMention> embedded = call.strategyValue().stream()
            .flatMap(strategy -> strategy.competitors().stream());
        return Stream.concat(dedicated, embedded)
            .filter(mention -> mention.name() != null && !mention.name().isBlank());
    }

    private static <T, K> List<T> firstDistinct(Stream<T> ordered, Function<T, K> key, int limit) {
        Map<K, T> seen = new LinkedHashMap<>();
        ordered.takeWhile(item -> seen.size() < limit)
            .forEach(item -> seen.putIfAbsent(key.apply(item), item));
        return List.copyOf(new ArrayList<>(seen.values()));
    }

    private static <T> T firstPresent(List<ValidatedCallAnalysis> newestFirst,
                                      Function<ValidatedCallAnalysis, Optional<T>> extractor) {
        return newestFirst.stream()
            .map(extractor)
            .flatMap(Optional::stream)
            .findFirst()
            .orElse(null);
    }

    private static void requireNewestFirst(List<ValidatedCallAnalysis> calls) {
        for (int i = 1; i < calls.size(); i++) {
            LocalDate previous = calls.get(i - 1).callDate();
            LocalDate current = calls.get(i).callDate();
            boolean undatedBeforeDated = previous == null && current != null;
            boolean ascending = previous != null && current != null && current.isAfter(previous);
            if (undatedBeforeDated || ascending) {
                throw new IllegalArgumentException(
                    "Call analyses must be ordered newest first; call %s (%s) follows call %s (%s)"
                        .formatted(calls.get(i).callId(), current, calls.get(i - 1).callId(), previous));
            }
        }
    }
}
