package net.salescoach.domain.analysis;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Optional;

/**
 * How strongly a critical gap threatens the deal.
 */
public enum GapImpact {
    HIGH("High"),
    MEDIUM("Medium"),
    LOW("Low");

    private final String label;

    GapImpact(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public static Optional<GapImpact> fromLabel(String label) {
        if (label == null) {
            return Optional.empty();
        }
        String trimmed = label.trim();
        for (GapImpact impact : values()) {
            if (impact.label.equalsIgnoreCase(trimmed)) {
                return Optional.of(impact);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    static GapImpact fromJson(String label) {
        return fromLabel(label).orElse(null);
    }
}
