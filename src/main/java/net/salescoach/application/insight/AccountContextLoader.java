package net.salescoach.application.insight;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Supplier;
import net.salescoach.adapters.persistence.AccountRepository;
import net.salescoach.adapters.persistence.CallRecordRepository;
import net.salescoach.adapters.persistence.EmailLogRepository;
import net.salescoach.adapters.persistence.StakeholderRepository;
import net.salescoach.application.ai.InsightGenerationException;
import net.salescoach.application.ai.InsightGenerationException.ErrorCode;
import net.salescoach.domain.account.Account;
import net.salescoach.domain.account.CallRecord;
import net.salescoach.domain.account.EmailLogEntry;
import net.salescoach.domain.account.Stakeholder;
import net.salescoach.domain.analysis.RawAnalysisRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Fetches an account's regeneration context with a partial-failure join.
 *
 * <p>Account, calls, stakeholders and emails load concurrently; raw analyses load once the
 * call IDs are known, in one batch. Every fetch settles before the join, and a failed
 * section degrades to empty. Only the account itself is mandatory.</p>
 */
@Component
public class AccountContextLoader {

    private static final Logger log = LoggerFactory.getLogger(AccountContextLoader.class);

    static final String SECTION_CALLS = "calls";
    static final String SECTION_ANALYSES = "analyses";
    static final String SECTION_STAKEHOLDERS = "stakeholders";
    static final String SECTION_EMAILS = "emails";

    private final AccountRepository accountRepository;
    private final CallRecordRepository callRecordRepository;
    private final StakeholderRepository stakeholderRepository;
    private final EmailLogRepository emailLogRepository;
    private final Executor fetchExecutor;

    public AccountContextLoader(AccountRepository accountRepository,
                                CallRecordRepository callRecordRepository,
                                StakeholderRepository stakeholderRepository,
                                EmailLogRepository emailLogRepository,
                                @Qualifier("insightFetchExecutor") Executor fetchExecutor) {
        this.accountRepository = accountRepository;
        this.callRecordRepository = callRecordRepository;
        this.stakeholderRepository = stakeholderRepository;
        this.emailLogRepository = emailLogRepository;
        this.fetchExecutor = fetchExecutor;
    }

    /**
     * Loads the context for {@code accountId}.
     *
     * @throws InsightGenerationException with {@code ACCOUNT_NOT_FOUND} when the account fetch
     *         fails or finds nothing
     */
    public AccountContext load(UUID accountId) {
        CompletableFuture<Optional<Account>> accountFetch =
            CompletableFuture.supplyAsync(() -> accountRepository.findById(accountId), fetchExecutor);
        CompletableFuture<List<CallRecord>> callsFetch =
            CompletableFuture.supplyAsync(() -> callRecordRepository.findByAccountNewestFirst(accountId), fetchExecutor);
        CompletableFuture<Map<UUID, RawAnalysisRecord>> analysesFetch = callsFetch.thenApplyAsync(
            calls -> callRecordRepository.findAnalysesByCallIds(calls.stream().map(CallRecord::id).toList()),
            fetchExecutor);
        CompletableFuture<List<Stakeholder>> stakeholdersFetch =
            CompletableFuture.supplyAsync(() -> stakeholderRepository.findByAccount(accountId), fetchExecutor);
        CompletableFuture<List<EmailLogEntry>> emailsFetch =
            CompletableFuture.supplyAsync(() -> emailLogRepository.findByAccountNewestFirst(accountId), fetchExecutor);

        CompletableFuture<FetchOutcome<Optional<Account>>> account = settle(accountFetch);
        CompletableFuture<FetchOutcome<List<CallRecord>>> calls = settle(callsFetch);
        CompletableFuture<FetchOutcome<Map<UUID, RawAnalysisRecord>>> analyses = settle(analysesFetch);
        CompletableFuture<FetchOutcome<List<Stakeholder>>> stakeholders = settle(stakeholdersFetch);
        CompletableFuture<FetchOutcome<List<EmailLogEntry>>> emails = settle(emailsFetch);
        CompletableFuture.allOf(account, calls, analyses, stakeholders, emails).join();

        FetchOutcome<Optional<Account>> accountOutcome = account.join();
        if (accountOutcome.failure() != null) {
            log.error("Account fetch failed for accountId={}", accountId, accountOutcome.failure());
            throw new InsightGenerationException(ErrorCode.ACCOUNT_NOT_FOUND,
                "Account could not be loaded: " + accountId, accountOutcome.failure());
        }
        Account loadedAccount = accountOutcome.value().orElseThrow(() ->
            new InsightGenerationException(ErrorCode.ACCOUNT_NOT_FOUND, "Account not found: " + accountId));

        Set<String> degraded = new LinkedHashSet<>();
        List<CallRecord> callRecords = orEmpty(calls.join(), SECTION_CALLS, accountId, degraded, List::of);
        Map<UUID, RawAnalysisRecord> rawAnalyses = orEmpty(analyses.join(), SECTION_ANALYSES, accountId, degraded, Map::of);
        List<Stakeholder> stakeholderList = orEmpty(stakeholders.join(), SECTION_STAKEHOLDERS, accountId, degraded, List::of);
        List<EmailLogEntry> emailList = orEmpty(emails.join(), SECTION_EMAILS, accountId, degraded, List::of);

        return new AccountContext(loadedAccount, callRecords, rawAnalyses, stakeholderList, emailList, degraded);
    }

    private static <T> CompletableFuture<FetchOutcome<T>> settle(CompletableFuture<T> fetch) {
        return fetch.handle((value, failure) -> failure == null
            ? new FetchOutcome<>(value, null)
            : new FetchOutcome<>(null, unwrap(failure)));
    }

    private static <T> T orEmpty(FetchOutcome<T> outcome, String section, UUID accountId,
                                 Set<String> degraded, Supplier<T> empty) {
        if (outcome.failure() == null && outcome.value() != null) {
            return outcome.value();
        }
        log.warn("Context section '{}' unavailable for accountId={}; continuing without it",
            section, accountId, outcome.failure());
        degraded.add(section);
        return empty.get();
    }

    private static Throwable unwrap(Throwable failure) {
        return failure instanceof CompletionException && failure.getCause() != null ? failure.getCause() : failure;
    }

    private record FetchOutcome<T>(T value, Throwable failure) {
    }
}
