package net.salescoach.domain.account;

import jakarta.annotation.Nullable;
import java.time.LocalDate;
import java.util.UUID;

/**
 * One logged email exchanged with the account.
 */
public record EmailLogEntry(
    @Nullable String direction,
    @Nullable String subject,
    @Nullable String body,
    @Nullable LocalDate emailDate,
    @Nullable String contactName,
    @Nullable UUID stakeholderId,
    @Nullable String notes
) {

    public boolean outgoing() {
        return "outgoing".equalsIgnoreCase(direction);
    }
}
