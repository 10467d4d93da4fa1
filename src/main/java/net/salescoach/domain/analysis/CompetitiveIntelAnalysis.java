package net.salescoach.domain.analysis;

import java.util.List;

public record CompetitiveIntelAnalysis(List<CompetitorMention> competitors) {
    public CompetitiveIntelAnalysis {
        competitors = competitors == null ? List.of() : List.copyOf(competitors);
    }
}
