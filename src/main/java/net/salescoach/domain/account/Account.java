package net.salescoach.domain.account;

import jakarta.annotation.Nullable;
import java.math.BigDecimal;
import java.util.UUID;

/**
 * Read model of a prospect account row.
 */
public record Account(
    UUID id,
    String accountName,
    @Nullable String status,
    @Nullable Integer heatScore,
    @Nullable BigDecimal potentialRevenue,
    @Nullable String industry
) {
}
