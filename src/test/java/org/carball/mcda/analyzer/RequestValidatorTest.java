package org.carball.mcda.analyzer;

import org.carball.mcda.catalog.CriterionCatalog;
import org.carball.mcda.config.AnalysisThresholds;
import org.carball.mcda.model.ahp.PairwiseComparison;
import org.carball.mcda.model.alternative.Alternative;
import org.carball.mcda.model.analysis.AnalysisMethod;
import org.carball.mcda.model.analysis.AnalysisRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

public class RequestValidatorTest {

    private RequestValidator validator;

    @BeforeEach
    void setUp() {
        validator = new RequestValidator(CriterionCatalog.defaults(), AnalysisThresholds.defaults());
    }

    @Test
    void shouldAcceptValidDirectRequest() {
        AnalysisRequest request = directRequest(Map.of("cost_usd", 0.4, "capacity_kw", 0.6));

        assertThat(validator.validate(request)).isEmpty();
    }

    @Test
    void shouldKeepThresholdsFixedAtConstruction() {
        // Given
        AnalysisThresholds thresholds = AnalysisThresholds.defaults();
        RequestValidator fixedValidator = new RequestValidator(CriterionCatalog.defaults(), thresholds);

        // When
        thresholds.setMinimumAlternatives(5);
        thresholds.setWeightSumTolerance(0.5);

        // Then
        assertThat(fixedValidator.validate(directRequest(Map.of("cost_usd", 0.4, "capacity_kw", 0.6)))).isEmpty();
        assertThat(fixedValidator.validate(directRequest(Map.of("cost_usd", 0.5, "capacity_kw", 0.6))))
                .containsExactly("Weights must sum to 1, but sum to 1.100");
    }

    @Test
    void shouldAcceptWeightSumWithinTolerance() {
        AnalysisRequest request = directRequest(Map.of("cost_usd", 0.3333, "capacity_kw", 0.6666));

        assertThat(validator.validate(request)).isEmpty();
    }

    @Test
    void shouldReportWeightSumOutsideTolerance() {
        // When
        List<String> errors = validator.validate(directRequest(Map.of("cost_usd", 0.5, "capacity_kw", 0.6)));

        // Then
        assertThat(errors).containsExactly("Weights must sum to 1, but sum to 1.100");
    }

    @Test
    void shouldCollectAllViolationsInOnePass() {
        // Given - one site, an unknown criterion and no weights
        AnalysisRequest request = AnalysisRequest.builder()
                .alternatives(List.of(site("A", 100, 5)))
                .criteria(List.of("cost_usd", "solar_irradiance"))
                .method(AnalysisMethod.DIRECT)
                .build();

        // When
        List<String> errors = validator.validate(request);

        // Then
        assertThat(errors).containsExactly(
                "At least 2 sites are required for comparison",
                "Unknown criterion: solar_irradiance",
                "Weights are required for DIRECT method");
    }

    @Test
    void shouldReportEmptyCriteriaAndMissingMethod() {
        AnalysisRequest request = AnalysisRequest.builder()
                .alternatives(List.of(site("A", 100, 5), site("B", 200, 10)))
                .build();

        assertThat(validator.validate(request)).containsExactly(
                "At least 1 criterion must be selected",
                "Analysis method is required");
    }

    @Test
    void shouldReportDuplicateCriterion() {
        AnalysisRequest request = directRequest(Map.of("cost_usd", 1.0)).toBuilder()
                .criteria(List.of("cost_usd", "cost_usd"))
                .build();

        assertThat(validator.validate(request)).containsExactly("Duplicate criterion: cost_usd");
    }

    @Test
    void shouldReportMissingAndOutOfRangeWeights() {
        // When
        List<String> errors = validator.validate(directRequest(Map.of("cost_usd", 1.2)));

        // Then
        assertThat(errors).contains(
                "Weight missing for criterion: capacity_kw",
                "Weight for criterion 'cost_usd' must be between 0 and 1");
    }

    @Test
    void shouldIgnoreWeightsOfUnselectedCriteria() {
        AnalysisRequest request = directRequest(Map.of("cost_usd", 0.5, "capacity_kw", 0.5, "latitude", 0.3));

        assertThat(validator.validate(request)).isEmpty();
    }

    @Test
    void shouldReportMissingAndNonFiniteAlternativeValues() {
        // Given
        Map<String, Double> values = new HashMap<>();
        values.put("cost_usd", Double.NaN);
        AnalysisRequest request = directRequest(Map.of("cost_usd", 0.5, "capacity_kw", 0.5)).toBuilder()
                .alternatives(List.of(site("A", 100, 5), new Alternative("B", "Site B", values)))
                .build();

        // When
        List<String> errors = validator.validate(request);

        // Then
        assertThat(errors).containsExactly(
                "Alternative 'Site B' has a non-finite value for criterion 'cost_usd'",
                "Alternative 'Site B' is missing value for criterion 'capacity_kw'");
    }

    @Test
    void shouldReportOnlyInsufficientComparisonsForShortAhpRequest() {
        // Given - 1 of the 3 comparisons needed for 3 criteria
        AnalysisRequest request = AnalysisRequest.builder()
                .alternatives(List.of(
                        site("A", 100, 5, 4),
                        site("B", 200, 10, 2),
                        site("C", 150, 8, 3)))
                .criteria(List.of("cost_usd", "capacity_kw", "electricity_reliability_score"))
                .method(AnalysisMethod.AHP)
                .pairwiseComparisons(List.of(PairwiseComparison.of("cost_usd", "capacity_kw", 3)))
                .build();

        // When
        List<String> errors = validator.validate(request);

        // Then
        assertThat(errors).containsExactly("Insufficient pairwise comparisons. Expected 3, got 1");
    }

    @Test
    void shouldRequireComparisonsForAhp() {
        AnalysisRequest request = directRequest(null).toBuilder()
                .method(AnalysisMethod.AHP)
                .build();

        assertThat(validator.validate(request)).containsExactly("Pairwise comparisons are required for AHP method");
    }

    @Test
    void shouldLimitAhpCriteriaCount() {
        // Given
        RequestValidator smallValidator = new RequestValidator(CriterionCatalog.defaults(),
                AnalysisThresholds.builder().maximumAhpCriteria(1).build());
        AnalysisRequest request = directRequest(null).toBuilder()
                .method(AnalysisMethod.AHP)
                .pairwiseComparisons(List.of(PairwiseComparison.of("cost_usd", "capacity_kw", 2)))
                .build();

        // When/Then
        assertThat(smallValidator.validate(request)).containsExactly("AHP supports at most 1 criteria, got 2");
    }

    @Test
    void shouldHonourConfiguredMinimumAlternatives() {
        RequestValidator strictValidator = new RequestValidator(CriterionCatalog.defaults(),
                AnalysisThresholds.builder().minimumAlternatives(3).build());

        assertThat(strictValidator.validate(directRequest(Map.of("cost_usd", 0.5, "capacity_kw", 0.5))))
                .containsExactly("At least 3 sites are required for comparison");
    }

    private static AnalysisRequest directRequest(Map<String, Double> weights) {
        return AnalysisRequest.builder()
                .alternatives(List.of(site("A", 100, 5), site("B", 200, 10)))
                .criteria(List.of("cost_usd", "capacity_kw"))
                .method(AnalysisMethod.DIRECT)
                .weights(weights)
                .build();
    }

    private static Alternative site(String id, double cost, double capacity) {
        return new Alternative(id, "Site " + id, Map.of("cost_usd", cost, "capacity_kw", capacity));
    }

    private static Alternative site(String id, double cost, double capacity, double reliability) {
        return new Alternative(id, "Site " + id,
                Map.of("cost_usd", cost, "capacity_kw", capacity, "electricity_reliability_score", reliability));
    }
}
