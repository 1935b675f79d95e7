package org.carball.mcda.model.analysis;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import org.carball.mcda.model.ahp.AhpResult;
import org.carball.mcda.model.alternative.Alternative;
import org.carball.mcda.model.criterion.Criterion;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Value
public class AnalysisResponse {
    AnalysisMethod method;
    List<Criterion> criteria;
    List<Alternative> alternatives;
    List<TopsisResult> ranking;
    Map<String, Double> resolvedWeights;
    AhpResult ahpDiagnostics;
    SensitivityReport sensitivity;
    RankingStabilityReport rankingStability;
    List<String> validationErrors;

    @Builder
    public AnalysisResponse(AnalysisMethod method,
                            List<Criterion> criteria,
                            List<Alternative> alternatives,
                            List<TopsisResult> ranking,
                            Map<String, Double> resolvedWeights,
                            AhpResult ahpDiagnostics,
                            SensitivityReport sensitivity,
                            RankingStabilityReport rankingStability,
                            List<String> validationErrors) {
        this.method = method;
        this.criteria = criteria == null ? List.of() : List.copyOf(criteria);
        this.alternatives = alternatives == null ? List.of() : List.copyOf(alternatives);
        this.ranking = ranking == null ? List.of() : List.copyOf(ranking);
        this.resolvedWeights = resolvedWeights == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(resolvedWeights));
        this.ahpDiagnostics = ahpDiagnostics;
        this.sensitivity = sensitivity;
        this.rankingStability = rankingStability;
        this.validationErrors = validationErrors == null ? List.of() : List.copyOf(validationErrors);
    }

    public static AnalysisResponse failed(AnalysisMethod method, List<String> errors) {
        return AnalysisResponse.builder()
                .method(method)
                .validationErrors(errors)
                .build();
    }

    @JsonIgnore
    public boolean isSuccessful() {
        return validationErrors.isEmpty();
    }
}
