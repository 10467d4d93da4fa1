package net.salescoach.controller;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import net.salescoach.domain.insight.AccountInsightSnapshot;

/**
 * Body of the regenerate endpoint.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
record RegenerationResponse(
    boolean success,
    AccountInsightSnapshot insights,
    String error,
    @JsonProperty("isRateLimited") Boolean isRateLimited,
    String message
) {

    static RegenerationResponse regenerated(AccountInsightSnapshot insights) {
        return new RegenerationResponse(true, insights, null, null, null);
    }

    static RegenerationResponse nothingToAnalyze(AccountInsightSnapshot existing) {
        return new RegenerationResponse(true, existing, null, null, "No data to analyze");
    }

    static RegenerationResponse failure(String error) {
        return new RegenerationResponse(false, null, error, null, null);
    }

    static RegenerationResponse rateLimited(String error) {
        return new RegenerationResponse(false, null, error, true, null);
    }
}
