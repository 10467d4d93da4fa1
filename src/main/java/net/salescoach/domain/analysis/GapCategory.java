package net.salescoach.domain.analysis;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Optional;

/**
 * Qualification dimension a critical gap belongs to.
 */
public enum GapCategory {
    BUDGET("Budget"),
    AUTHORITY("Authority"),
    NEED("Need"),
    TIMELINE("Timeline"),
    COMPETITION("Competition"),
    TECHNICAL("Technical");

    private final String label;

    GapCategory(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public static Optional<GapCategory> fromLabel(String label) {
        if (label == null) {
            return Optional.empty();
        }
        String trimmed = label.trim();
        for (GapCategory category : values()) {
            if (category.label.equalsIgnoreCase(trimmed)) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    static GapCategory fromJson(String label) {
        return fromLabel(label).orElse(null);
    }
}
