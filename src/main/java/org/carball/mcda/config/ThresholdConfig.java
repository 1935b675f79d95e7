package org.carball.mcda.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.List;

/**
 * Shape of a YAML threshold file. Absent keys leave the underlying thresholds untouched.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ThresholdConfig {

    @JsonProperty("profile")
    private String profile;

    @JsonProperty("consistency_threshold")
    private Double consistencyThreshold;

    @JsonProperty("weight_sum_tolerance")
    private Double weightSumTolerance;

    @JsonProperty("minimum_alternatives")
    private Integer minimumAlternatives;

    @JsonProperty("maximum_ahp_criteria")
    private Integer maximumAhpCriteria;

    @JsonProperty("sensitivity_variations")
    private List<Double> sensitivityVariations;

    @JsonProperty("monte_carlo_simulations")
    private Integer monteCarloSimulations;

    @JsonProperty("weight_uncertainty")
    private Double weightUncertainty;

    @JsonProperty("data_uncertainty")
    private Double dataUncertainty;

    @JsonProperty("monte_carlo_seed")
    private Long monteCarloSeed;

    public void applyTo(AnalysisThresholds.AnalysisThresholdsBuilder builder) {
        if (consistencyThreshold != null) {
            builder.consistencyThreshold(consistencyThreshold);
        }
        if (weightSumTolerance != null) {
            builder.weightSumTolerance(weightSumTolerance);
        }
        if (minimumAlternatives != null) {
            builder.minimumAlternatives(minimumAlternatives);
        }
        if (maximumAhpCriteria != null) {
            builder.maximumAhpCriteria(maximumAhpCriteria);
        }
        if (sensitivityVariations != null && !sensitivityVariations.isEmpty()) {
            builder.sensitivityVariations(List.copyOf(sensitivityVariations));
        }
        if (monteCarloSimulations != null) {
            builder.monteCarloSimulations(monteCarloSimulations);
        }
        if (weightUncertainty != null) {
            builder.weightUncertainty(weightUncertainty);
        }
        if (dataUncertainty != null) {
            builder.dataUncertainty(dataUncertainty);
        }
        if (monteCarloSeed != null) {
            builder.monteCarloSeed(monteCarloSeed);
        }
    }
}
