package org.carball.mcda.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.mcda.builder.AlternativeBuilder;
import org.carball.mcda.builder.CriterionValueExtractor;
import org.carball.mcda.builder.SiteRecord;
import org.carball.mcda.catalog.CriterionCatalog;
import org.carball.mcda.config.AnalysisThresholds;
import org.carball.mcda.model.ahp.AhpResult;
import org.carball.mcda.model.alternative.Alternative;
import org.carball.mcda.model.analysis.AnalysisMethod;
import org.carball.mcda.model.analysis.AnalysisRequest;
import org.carball.mcda.model.analysis.AnalysisResponse;
import org.carball.mcda.model.analysis.RankingStabilityReport;
import org.carball.mcda.model.analysis.SensitivityReport;
import org.carball.mcda.model.analysis.TopsisResult;
import org.carball.mcda.model.criterion.Criterion;
import org.carball.mcda.model.criterion.CriterionDefinition;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Entry point of the engine: validates a request, resolves weights directly or through AHP,
 * and ranks the alternatives with TOPSIS. Failures of any stage come back as validation
 * errors in the response; nothing is thrown past this class.
 * <p>
 * Instances hold no per-request state and may be shared between threads.
 */
@Slf4j
public class McdaAnalyzer {

    private final CriterionCatalog catalog;
    private final double consistencyThreshold;
    private final RequestValidator validator;
    private final AlternativeBuilder alternativeBuilder;
    private final AhpEngine ahpEngine;
    private final TopsisEngine topsisEngine;
    private final WeightSensitivityAnalyzer sensitivityAnalyzer;
    private final MonteCarloRankingAnalyzer monteCarloAnalyzer;

    public McdaAnalyzer() {
        this(CriterionCatalog.defaults(), AnalysisThresholds.defaults());
    }

    public McdaAnalyzer(CriterionCatalog catalog, AnalysisThresholds thresholds) {
        this.catalog = catalog;
        this.consistencyThreshold = thresholds.getConsistencyThreshold();
        this.validator = new RequestValidator(catalog, thresholds);
        this.alternativeBuilder = new AlternativeBuilder();
        this.ahpEngine = new AhpEngine(thresholds);
        this.topsisEngine = new TopsisEngine();
        this.sensitivityAnalyzer = new WeightSensitivityAnalyzer(topsisEngine, thresholds);
        this.monteCarloAnalyzer = new MonteCarloRankingAnalyzer(topsisEngine, thresholds);

        log.info("Initialized McdaAnalyzer with {} catalog criteria", catalog.size());
        log.info("Using thresholds: {}", thresholds.getConfigurationSummary());
    }

    public AnalysisResponse analyze(AnalysisRequest request) {
        AnalysisMethod method = request.getMethod();
        log.info("Starting {} analysis of {} sites over {} criteria", method,
                sizeOf(request.getAlternatives()), sizeOf(request.getCriteria()));

        // Step 1: Validate the whole request
        List<String> errors = validator.validate(request);
        if (!errors.isEmpty()) {
            log.info("Request rejected with {} validation errors", errors.size());
            return AnalysisResponse.failed(method, errors);
        }

        // Step 2: Resolve weights
        Map<String, Double> weights;
        AhpResult ahpResult = null;
        if (method == AnalysisMethod.DIRECT) {
            weights = selectWeights(request.getCriteria(), request.getWeights());
        } else {
            try {
                ahpResult = ahpEngine.deriveWeights(request.getCriteria(), request.getPairwiseComparisons());
            } catch (RuntimeException e) {
                return failure(method, "AHP analysis failed: ", e);
            }
            weights = ahpResult.weights();

            if (!ahpResult.consistent()) {
                log.warn("Pairwise comparisons are inconsistent (CR={} > {}); weights are used regardless",
                        String.format("%.3f", ahpResult.consistencyRatio()), consistencyThreshold);
            }
        }

        // Step 3: Rank
        List<Alternative> alternatives = request.getAlternatives();
        List<Criterion> criteria;
        List<TopsisResult> ranking;
        SensitivityReport sensitivity = null;
        RankingStabilityReport rankingStability = null;
        try {
            criteria = buildCriteria(request.getCriteria(), weights);
            ranking = topsisEngine.rank(alternatives, criteria);
            if (request.isIncludeSensitivity()) {
                sensitivity = sensitivityAnalyzer.analyze(alternatives, criteria);
            }
            if (request.isIncludeMonteCarlo()) {
                rankingStability = monteCarloAnalyzer.analyze(alternatives, criteria);
            }
        } catch (RuntimeException e) {
            return failure(method, "TOPSIS analysis failed: ", e);
        }

        log.info("Analysis complete. Top ranked site: {} (score {})",
                ranking.get(0).alternativeId(), String.format("%.4f", ranking.get(0).score()));

        return AnalysisResponse.builder()
                .method(method)
                .criteria(criteria)
                .alternatives(alternatives)
                .ranking(ranking)
                .resolvedWeights(weights)
                .ahpDiagnostics(ahpResult)
                .sensitivity(sensitivity)
                .rankingStability(rankingStability)
                .build();
    }

    /**
     * Builds alternatives from host site records through {@link AlternativeBuilder} and analyzes them.
     * Any alternatives already on the request are replaced.
     */
    public <S extends SiteRecord> AnalysisResponse analyzeSites(AnalysisRequest request,
                                                                List<S> sites,
                                                                CriterionValueExtractor<S> extractor) {
        List<String> criteria = request.getCriteria() == null ? List.of() : request.getCriteria();
        List<Alternative> alternatives = alternativeBuilder.build(sites, criteria, extractor);
        return analyze(request.toBuilder().alternatives(alternatives).build());
    }

    private Map<String, Double> selectWeights(List<String> criteria, Map<String, Double> supplied) {
        Map<String, Double> weights = new LinkedHashMap<>();
        for (String criterion : criteria) {
            weights.put(criterion, supplied.get(criterion));
        }
        return weights;
    }

    private List<Criterion> buildCriteria(List<String> criterionIds, Map<String, Double> weights) {
        List<Criterion> criteria = new ArrayList<>(criterionIds.size());
        for (String id : criterionIds) {
            CriterionDefinition definition = catalog.lookup(id)
                    .orElseThrow(() -> new IllegalStateException("Criterion passed validation but is not in catalog: " + id));
            criteria.add(Criterion.of(definition, weights.get(id)));
        }
        return criteria;
    }

    private AnalysisResponse failure(AnalysisMethod method, String prefix, RuntimeException e) {
        if (e instanceof McdaComputationException) {
            log.warn("{}{}", prefix, e.getMessage());
        } else {
            log.error("{}{}", prefix, e.getMessage(), e);
        }
        String detail = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        return AnalysisResponse.failed(method, List.of(prefix + detail));
    }

    private static int sizeOf(List<?> list) {
        return list == null ? 0 : list.size();
    }
}
