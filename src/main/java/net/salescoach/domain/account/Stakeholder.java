package net.salescoach.domain.account;

import jakarta.annotation.Nullable;
import java.util.UUID;

public record Stakeholder(
    UUID id,
    String name,
    @Nullable String jobTitle,
    @Nullable String influenceLevel,
    @Nullable Integer championScore,
    boolean primaryContact,
    @Nullable String email
) {
}
