package net.salescoach.application.insight;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import net.salescoach.domain.account.Account;
import net.salescoach.domain.account.CallRecord;
import net.salescoach.domain.account.EmailLogEntry;
import net.salescoach.domain.account.Stakeholder;
import net.salescoach.domain.analysis.RawAnalysisRecord;

/**
 * Everything fetched for one regeneration run.
 *
 * @param degradedSections names of sections whose fetch failed and were replaced by empty data
 */
public record AccountContext(
    Account account,
    List<CallRecord> calls,
    Map<UUID, RawAnalysisRecord> analyses,
    List<Stakeholder> stakeholders,
    List<EmailLogEntry> emails,
    Set<String> degradedSections
) {
    public AccountContext {
        calls = List.copyOf(calls);
        analyses = Map.copyOf(analyses);
        stakeholders = List.copyOf(stakeholders);
        emails = List.copyOf(emails);
        degradedSections = Set.copyOf(degradedSections);
    }

    public boolean hasNothingToAnalyze() {
        return calls.isEmpty() && emails.isEmpty();
    }
}
