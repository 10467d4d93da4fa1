package net.salescoach.domain.insight;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.annotation.Nullable;
import java.util.List;

/**
 * Coaching grades across an account's calls, newest first.
 *
 * <p>{@code avgGrade} holds the most recent grade, not a statistical average. Downstream
 * readers already depend on that meaning, so it is kept as stored.</p>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record CoachingTrend(
    @JsonProperty("avg_grade") @Nullable String avgGrade,
    @JsonProperty("primary_focus_area") @Nullable String primaryFocusArea,
    @JsonProperty("recent_grades") List<String> recentGrades
) {
    public CoachingTrend {
        recentGrades = recentGrades == null ? List.of() : List.copyOf(recentGrades);
    }
}
