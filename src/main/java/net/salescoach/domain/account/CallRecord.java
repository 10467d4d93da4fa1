package net.salescoach.domain.account;

import jakarta.annotation.Nullable;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.UUID;

/**
 * A recorded sales call with its raw transcript.
 */
public record CallRecord(
    UUID id,
    @Nullable LocalDate callDate,
    @Nullable String callType,
    @Nullable String rawText,
    @Nullable Instant createdAt
) {

    /**
     * Newest call first; calls without a date sort last, ties broken by creation time.
     */
    public static final Comparator<CallRecord> NEWEST_FIRST = Comparator
        .comparing(CallRecord::callDate, Comparator.nullsFirst(Comparator.<LocalDate>naturalOrder()))
        .thenComparing(CallRecord::createdAt, Comparator.nullsFirst(Comparator.<Instant>naturalOrder()))
        .reversed();
}
