package net.salescoach.domain.analysis;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.annotation.Nullable;
import java.util.Locale;

/**
 * A competitor named on a call, with its usage status and our position against it.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CompetitorMention(String name, @Nullable String status, @Nullable String positioning) {

    @JsonIgnore
    public String dedupKey() {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
    }
}
