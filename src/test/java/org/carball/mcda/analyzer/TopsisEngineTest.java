package org.carball.mcda.analyzer;

import org.carball.mcda.model.alternative.Alternative;
import org.carball.mcda.model.analysis.TopsisResult;
import org.carball.mcda.model.criterion.Criterion;
import org.carball.mcda.model.criterion.CriterionDirection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

public class TopsisEngineTest {

    private static final List<Criterion> COST_AND_CAPACITY = List.of(
            new Criterion("cost_usd", "System Cost", CriterionDirection.COST, 0.5),
            new Criterion("capacity_kw", "System Capacity", CriterionDirection.BENEFIT, 0.5));

    private TopsisEngine engine;

    @BeforeEach
    void setUp() {
        engine = new TopsisEngine();
    }

    @Test
    void shouldRankCostAndCapacityExample() {
        // Given
        List<Alternative> alternatives = List.of(
                site("A", 100, 5),
                site("B", 200, 10),
                site("C", 150, 8));

        // When
        List<TopsisResult> ranking = engine.rank(alternatives, COST_AND_CAPACITY);

        // Then - C balances cost and capacity best; A and B mirror each other
        assertThat(ranking).extracting(TopsisResult::alternativeId).containsExactly("C", "A", "B");
        assertThat(ranking).extracting(TopsisResult::rank).containsExactly(1, 2, 3);

        TopsisResult c = ranking.get(0);
        assertThat(c.score()).isCloseTo(0.548464, within(1e-6));
        assertThat(c.distanceToIdeal()).isCloseTo(0.117948, within(1e-6));
        assertThat(c.distanceToNegativeIdeal()).isCloseTo(0.143267, within(1e-6));

        TopsisResult a = ranking.get(1);
        assertThat(a.score()).isCloseTo(0.505234, within(1e-6));
        assertThat(a.distanceToIdeal()).isCloseTo(0.181848, within(1e-6));
        assertThat(a.distanceToNegativeIdeal()).isCloseTo(0.185695, within(1e-6));

        assertThat(ranking.get(2).score()).isCloseTo(0.494766, within(1e-6));
    }

    @Test
    void shouldKeepScoresBetweenZeroAndOne() {
        List<Alternative> alternatives = List.of(
                site("A", 100, 10),
                site("B", 200, 5),
                site("C", 150, 8),
                site("D", 120, 6));

        List<TopsisResult> ranking = engine.rank(alternatives, COST_AND_CAPACITY);

        assertThat(ranking).allSatisfy(result -> assertThat(result.score()).isBetween(0.0, 1.0));
        assertThat(ranking).extracting(TopsisResult::rank).containsExactly(1, 2, 3, 4);
    }

    @Test
    void shouldScoreDominatingAlternativeHighest() {
        // Given - A is cheaper and larger than B
        List<Alternative> alternatives = List.of(
                site("B", 200, 5),
                site("C", 150, 8),
                site("A", 100, 10));

        // When
        List<TopsisResult> ranking = engine.rank(alternatives, COST_AND_CAPACITY);

        // Then
        assertThat(ranking.get(0).alternativeId()).isEqualTo("A");
        assertThat(ranking.get(0).score()).isCloseTo(1.0, within(1e-12));
        assertThat(ranking.get(2).alternativeId()).isEqualTo("B");
        assertThat(ranking.get(2).score()).isCloseTo(0.0, within(1e-12));
    }

    @Test
    void shouldBreakTiesByInputOrder() {
        // Given - A and B carry identical values
        List<Alternative> alternatives = List.of(
                site("C", 150, 8),
                site("B", 100, 5),
                site("A", 100, 5));

        // When
        List<TopsisResult> first = engine.rank(alternatives, COST_AND_CAPACITY);
        List<TopsisResult> second = engine.rank(alternatives, COST_AND_CAPACITY);

        // Then
        List<String> order = first.stream().map(TopsisResult::alternativeId).toList();
        assertThat(order.indexOf("A")).isEqualTo(order.indexOf("B") + 1);
        assertThat(first).isEqualTo(second);
    }

    @Test
    void shouldReturnScoresInInputOrder() {
        List<Alternative> alternatives = List.of(
                site("A", 100, 5),
                site("B", 200, 10),
                site("C", 150, 8));

        double[] scores = engine.scores(alternatives, COST_AND_CAPACITY);

        assertThat(scores).containsExactly(new double[]{0.505234, 0.494766, 0.548464}, within(1e-6));
    }

    @Test
    void shouldRankScoresDescendingWithStableTies() {
        int[] ranks = TopsisEngine.ranksOf(new double[]{0.3, 0.9, 0.3, 0.5});

        assertThat(ranks).containsExactly(3, 1, 4, 2);
    }

    @Test
    void shouldRejectCriterionWithIdenticalValues() {
        // Given - every site has the same capacity
        List<Alternative> alternatives = List.of(
                site("A", 100, 8),
                site("B", 200, 8));

        // When/Then
        assertThatThrownBy(() -> engine.rank(alternatives, COST_AND_CAPACITY))
                .isInstanceOf(DegenerateCriterionException.class)
                .hasMessageContaining("capacity_kw")
                .extracting("criterionId").isEqualTo("capacity_kw");
    }

    @Test
    void shouldTreatSingleAlternativeAsDegenerate() {
        assertThatThrownBy(() -> engine.rank(List.of(site("A", 100, 5)), COST_AND_CAPACITY))
                .isInstanceOf(DegenerateCriterionException.class);
    }

    @Test
    void shouldRejectEmptyInputs() {
        assertThatThrownBy(() -> engine.rank(List.of(), COST_AND_CAPACITY))
                .isInstanceOf(EmptyInputException.class)
                .hasMessage("At least one alternative is required");

        assertThatThrownBy(() -> engine.rank(List.of(site("A", 100, 5)), List.of()))
                .isInstanceOf(EmptyInputException.class)
                .hasMessage("At least one criterion is required");
    }

    @Test
    void shouldRejectMissingValue() {
        Map<String, Double> values = new HashMap<>();
        values.put("cost_usd", 120.0);
        values.put("capacity_kw", null);
        List<Alternative> alternatives = List.of(
                site("A", 100, 5),
                new Alternative("B", "Site B", values));

        assertThatThrownBy(() -> engine.rank(alternatives, COST_AND_CAPACITY))
                .isInstanceOf(McdaComputationException.class)
                .hasMessage("Alternative 'Site B' has no usable value for criterion 'capacity_kw'");
    }

    private static Alternative site(String id, double cost, double capacity) {
        return new Alternative(id, "Site " + id, Map.of("cost_usd", cost, "capacity_kw", capacity));
    }
}
