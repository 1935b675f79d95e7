package org.carball.mcda.model.ahp;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Weights derived from pairwise judgements, keyed in the order the criteria were requested.
 */
public record AhpResult(
    Map<String, Double> weights,
    double consistencyRatio,
    boolean consistent,
    double consistencyIndex,
    double lambdaMax
) {
    public AhpResult {
        weights = Collections.unmodifiableMap(new LinkedHashMap<>(weights));
    }
}
