package net.salescoach.domain.analysis;

import jakarta.annotation.Nullable;
import java.util.List;

/**
 * Communication profile of the primary prospect speaker.
 */
public record PsychologyAnalysis(
    @Nullable String primarySpeakerName,
    @Nullable String prospectPersona,
    @Nullable String discProfile,
    @Nullable String communicationTone,
    @Nullable String communicationPreference,
    List<String> dos,
    List<String> donts
) {
    public PsychologyAnalysis {
        dos = dos == null ? List.of() : List.copyOf(dos);
        donts = donts == null ? List.of() : List.copyOf(donts);
    }
}
