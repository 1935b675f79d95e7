package org.carball.mcda.config;

import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.carball.mcda.analyzer.RandomIndex;

import java.util.List;

@Data
@Builder(toBuilder = true)
@Slf4j
public class AnalysisThresholds {

    // AHP consistency
    @Builder.Default
    private double consistencyThreshold = 0.10;

    @Builder.Default
    private int maximumAhpCriteria = 15;

    // Request validation
    @Builder.Default
    private double weightSumTolerance = 1e-3;

    @Builder.Default
    private int minimumAlternatives = 2;

    // Sensitivity analysis
    @Builder.Default
    private List<Double> sensitivityVariations = List.of(0.8, 0.9, 1.1, 1.2);

    // Monte Carlo ranking stability
    @Builder.Default
    private int monteCarloSimulations = 1000;

    @Builder.Default
    private double weightUncertainty = 0.1;

    @Builder.Default
    private double dataUncertainty = 0.05;

    @Builder.Default
    private long monteCarloSeed = 42L;

    // Profile information
    @Builder.Default
    private String profileName = "default";

    @Builder.Default
    private String profileDescription = "Saaty's 0.10 consistency threshold and 1e-3 weight tolerance";

    /**
     * Creates the thresholds the engine uses when nothing else is configured.
     */
    public static AnalysisThresholds defaults() {
        return AnalysisThresholds.builder().build();
    }

    /**
     * Validates the threshold configuration and logs warnings for potentially problematic values.
     */
    public void validate() {
        if (consistencyThreshold <= 0) {
            log.warn("Consistency threshold ({}) should be positive", consistencyThreshold);
        } else if (consistencyThreshold > 0.2) {
            log.warn("Consistency threshold ({}) is more than twice Saaty's recommended 0.10", consistencyThreshold);
        }

        if (weightSumTolerance <= 0 || weightSumTolerance >= 0.1) {
            log.warn("Weight sum tolerance ({}) should be between 0 and 0.1", weightSumTolerance);
        }

        if (minimumAlternatives < 2) {
            log.warn("Minimum alternatives ({}) below 2 lets single-site requests reach TOPSIS", minimumAlternatives);
        }

        if (maximumAhpCriteria > RandomIndex.MAX_TABULATED_SIZE) {
            log.warn("Maximum AHP criteria ({}) exceeds the random index table ({}); larger matrices reuse RI({})",
                    maximumAhpCriteria, RandomIndex.MAX_TABULATED_SIZE, RandomIndex.MAX_TABULATED_SIZE);
        }

        if (sensitivityVariations.stream().anyMatch(v -> v <= 0)) {
            log.warn("Sensitivity variations {} should all be positive", sensitivityVariations);
        }

        if (monteCarloSimulations < 100) {
            log.warn("Monte Carlo simulations ({}) below 100 give unreliable rank probabilities", monteCarloSimulations);
        }

        if (weightUncertainty < 0 || dataUncertainty < 0) {
            log.warn("Weight uncertainty ({}) and data uncertainty ({}) should not be negative",
                    weightUncertainty, dataUncertainty);
        }

        log.debug("Using thresholds - CR: {}, Tolerance: {}, Min alternatives: {}, Profile: {}",
                consistencyThreshold, weightSumTolerance, minimumAlternatives, profileName);
    }

    /**
     * Returns a description of the current configuration for user feedback.
     */
    public String getConfigurationSummary() {
        return String.format("Profile: %s | CR threshold: %.2f | Weight tolerance: %.0e | Min alternatives: %d | Max AHP criteria: %d",
                profileName, consistencyThreshold, weightSumTolerance, minimumAlternatives, maximumAhpCriteria);
    }
}
