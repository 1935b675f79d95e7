package org.carball.mcda.config;

import lombok.Getter;

import java.util.List;

@Getter
public enum AnalysisProfile {

    STANDARD("standard", "Saaty's 0.10 consistency threshold and 1e-3 weight tolerance",
            0.10, 1e-3, 2),

    STRICT("strict", "Tight consistency and weight checks for funding decisions",
            0.05, 1e-4, 3),

    EXPLORATORY("exploratory", "Relaxed checks for early screening workshops",
            0.20, 1e-2, 2) {
        @Override
        public AnalysisThresholds buildThresholds() {
            return super.buildThresholds().toBuilder()
                    .sensitivityVariations(List.of(0.5, 0.75, 1.25, 1.5)) // Wider sweep for rough judgements
                    .build();
        }
    };

    private final String name;
    private final String description;
    private final double consistencyThreshold;
    private final double weightSumTolerance;
    private final int minimumAlternatives;

    AnalysisProfile(String name, String description,
                    double consistencyThreshold, double weightSumTolerance, int minimumAlternatives) {
        this.name = name;
        this.description = description;
        this.consistencyThreshold = consistencyThreshold;
        this.weightSumTolerance = weightSumTolerance;
        this.minimumAlternatives = minimumAlternatives;
    }

    /**
     * Creates AnalysisThresholds based on this profile's settings.
     */
    public AnalysisThresholds buildThresholds() {
        return AnalysisThresholds.builder()
                .profileName(name)
                .profileDescription(description)
                .consistencyThreshold(consistencyThreshold)
                .weightSumTolerance(weightSumTolerance)
                .minimumAlternatives(minimumAlternatives)
                .build();
    }

    /**
     * Finds profile by name (case-insensitive).
     */
    public static AnalysisProfile fromName(String name) {
        for (AnalysisProfile profile : values()) {
            if (profile.getName().equalsIgnoreCase(name)) {
                return profile;
            }
        }
        throw new IllegalArgumentException("Unknown analysis profile: " + name +
                ". Available profiles: " + getAvailableProfiles());
    }

    public static String getAvailableProfiles() {
        StringBuilder sb = new StringBuilder();
        for (AnalysisProfile profile : values()) {
            if (!sb.isEmpty()) sb.append(", ");
            sb.append(profile.getName());
        }
        return sb.toString();
    }
}
