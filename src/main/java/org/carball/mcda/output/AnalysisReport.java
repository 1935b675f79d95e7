package org.carball.mcda.output;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.carball.mcda.catalog.CriterionCatalog;
import org.carball.mcda.model.ahp.AhpResult;
import org.carball.mcda.model.analysis.AlternativeRobustness;
import org.carball.mcda.model.analysis.AnalysisResponse;
import org.carball.mcda.model.analysis.CriterionSensitivity;
import org.carball.mcda.model.analysis.RankingStabilityReport;
import org.carball.mcda.model.analysis.SensitivityReport;
import org.carball.mcda.model.analysis.TopsisResult;
import org.carball.mcda.model.criterion.Criterion;
import org.carball.mcda.model.criterion.CriterionDefinition;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

/**
 * Renders an {@link AnalysisResponse} as JSON or Markdown for the host application.
 */
@Slf4j
public class AnalysisReport {

    private final AnalysisResponse response;
    private final CriterionCatalog catalog;
    private final LocalDateTime timestamp;
    private final ObjectMapper objectMapper;

    public AnalysisReport(AnalysisResponse response) {
        this(response, CriterionCatalog.defaults(), LocalDateTime.now());
    }

    public AnalysisReport(AnalysisResponse response, CriterionCatalog catalog, LocalDateTime timestamp) {
        this.response = response;
        this.catalog = catalog;
        this.timestamp = timestamp;

        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    public String toJson() {
        try {
            return objectMapper.writeValueAsString(new ReportData(timestamp, response));
        } catch (JsonProcessingException e) {
            log.error("Error generating JSON report", e);
            throw new IllegalStateException("Failed to generate JSON report", e);
        }
    }

    public String toMarkdown() {
        StringBuilder md = new StringBuilder();

        md.append("# Site Ranking Report\n\n");
        md.append("**Generated:** ").append(timestamp.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME)).append("  \n");
        if (response.getMethod() != null) {
            md.append("**Method:** ").append(response.getMethod().getDisplayName()).append("  \n");
        }
        md.append("\n");

        if (!response.isSuccessful()) {
            md.append("## Validation Errors\n\n");
            for (String error : response.getValidationErrors()) {
                md.append("- ").append(error).append("\n");
            }
            md.append("\nNo ranking was produced.\n");
            return md.toString();
        }

        appendCriteria(md, response.getCriteria());

        if (response.getAhpDiagnostics() != null) {
            appendAhpDiagnostics(md, response.getAhpDiagnostics());
        }

        appendRanking(md, response.getRanking());

        if (response.getSensitivity() != null) {
            appendSensitivity(md, response.getSensitivity());
        }

        if (response.getRankingStability() != null) {
            appendRankingStability(md, response.getRankingStability());
        }

        return md.toString();
    }

    private void appendCriteria(StringBuilder md, List<Criterion> criteria) {
        md.append("## Criteria\n\n");
        md.append("| Criterion | Direction | Unit | Weight |\n");
        md.append("|-----------|-----------|------|--------|\n");
        for (Criterion criterion : criteria) {
            String unit = catalog.lookup(criterion.id()).map(CriterionDefinition::getUnit).orElse("");
            md.append("| ").append(criterion.name())
                    .append(" | ").append(criterion.direction().getDisplayName())
                    .append(" | ").append(unit == null ? "" : unit)
                    .append(" | ").append(format(criterion.weight()))
                    .append(" |\n");
        }
        md.append("\n");
    }

    private void appendAhpDiagnostics(StringBuilder md, AhpResult ahp) {
        md.append("## AHP Consistency\n\n");
        md.append("- **Consistency Ratio:** ").append(format(ahp.consistencyRatio())).append("\n");
        md.append("- **Consistent:** ").append(ahp.consistent() ? "Yes" : "No").append("\n");
        md.append("- **λmax:** ").append(format(ahp.lambdaMax())).append("\n");
        if (!ahp.consistent()) {
            md.append("\n> The pairwise judgements contradict each other. Review them before relying on this ranking.\n");
        }
        md.append("\n");
    }

    private void appendRanking(StringBuilder md, List<TopsisResult> ranking) {
        md.append("## Ranking\n\n");
        md.append("| Rank | Site | Score | Distance to ideal | Distance to anti-ideal |\n");
        md.append("|------|------|-------|-------------------|------------------------|\n");
        for (TopsisResult result : ranking) {
            md.append("| ").append(result.rank())
                    .append(" | ").append(result.name())
                    .append(" | ").append(format(result.score()))
                    .append(" | ").append(format(result.distanceToIdeal()))
                    .append(" | ").append(format(result.distanceToNegativeIdeal()))
                    .append(" |\n");
        }
        md.append("\n");
    }

    private void appendSensitivity(StringBuilder md, SensitivityReport sensitivity) {
        md.append("## Weight Sensitivity\n\n");
        md.append("| Criterion | Max mean score change | Min rank correlation |\n");
        md.append("|-----------|-----------------------|----------------------|\n");
        for (CriterionSensitivity criterion : sensitivity.criteria().values()) {
            md.append("| ").append(criterion.criterionId())
                    .append(" | ").append(format(criterion.maxMeanScoreChange()))
                    .append(" | ").append(format(criterion.minRankCorrelation()))
                    .append(" |\n");
        }
        md.append("\n");
        md.append(sensitivity.isRankingStable()
                ? "The ranking is stable under all tested weight variations.\n"
                : "The ranking changes under some weight variations; most sensitive criterion: "
                        + sensitivity.mostSensitiveCriterion() + ".\n");
    }

    private void appendRankingStability(StringBuilder md, RankingStabilityReport stability) {
        md.append("\n## Ranking Stability\n\n");
        md.append(String.format(Locale.ROOT, "%d simulations, weight uncertainty %.2f, data uncertainty %.2f, seed %d\n\n",
                stability.simulations(), stability.weightUncertainty(), stability.dataUncertainty(), stability.seed()));
        md.append("| Site | Mean score | Std dev | 95% interval | P(rank 1) | P(top 3) |\n");
        md.append("|------|------------|---------|--------------|-----------|----------|\n");
        for (AlternativeRobustness robustness : stability.alternatives().values()) {
            md.append("| ").append(robustness.alternativeId())
                    .append(" | ").append(format(robustness.meanScore()))
                    .append(" | ").append(format(robustness.scoreStandardDeviation()))
                    .append(" | ").append(format(robustness.lowerBound()))
                    .append(" - ").append(format(robustness.upperBound()))
                    .append(" | ").append(format(robustness.rankProbabilities().get(0)))
                    .append(" | ").append(format(robustness.topThreeProbability()))
                    .append(" |\n");
        }
        md.append("\n**Robust ranking:** ").append(String.join(", ", stability.robustRanking())).append("  \n");
        md.append("**Most stable site:** ").append(stability.mostStableAlternative()).append("  \n");
        md.append("**Most variable criterion:** ").append(stability.mostUncertainCriterion()).append("\n");
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.4f", value);
    }

    public record ReportData(LocalDateTime generatedAt, AnalysisResponse analysis) {
    }
}
