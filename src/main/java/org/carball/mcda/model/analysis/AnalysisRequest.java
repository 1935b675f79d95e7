package org.carball.mcda.model.analysis;

import lombok.Builder;
import lombok.Value;
import org.carball.mcda.model.ahp.PairwiseComparison;
import org.carball.mcda.model.alternative.Alternative;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Input of one analysis. {@code weights} is read only for {@link AnalysisMethod#DIRECT},
 * {@code pairwiseComparisons} only for {@link AnalysisMethod#AHP}.
 * <p>
 * Collections are copied on construction; null entries are kept so that validation can report them.
 */
@Value
public class AnalysisRequest {
    List<Alternative> alternatives;
    List<String> criteria;
    AnalysisMethod method;
    Map<String, Double> weights;
    List<PairwiseComparison> pairwiseComparisons;
    boolean includeSensitivity;
    boolean includeMonteCarlo;

    @Builder(toBuilder = true)
    public AnalysisRequest(List<Alternative> alternatives,
                           List<String> criteria,
                           AnalysisMethod method,
                           Map<String, Double> weights,
                           List<PairwiseComparison> pairwiseComparisons,
                           boolean includeSensitivity,
                           boolean includeMonteCarlo) {
        this.alternatives = alternatives == null ? List.of() : copyOf(alternatives);
        this.criteria = criteria == null ? List.of() : copyOf(criteria);
        this.method = method;
        this.weights = weights == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(weights));
        this.pairwiseComparisons = pairwiseComparisons == null ? null : copyOf(pairwiseComparisons);
        this.includeSensitivity = includeSensitivity;
        this.includeMonteCarlo = includeMonteCarlo;
    }

    private static <T> List<T> copyOf(List<T> list) {
        return Collections.unmodifiableList(new ArrayList<>(list));
    }
}
