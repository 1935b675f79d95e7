package org.carball.mcda.builder;

import lombok.extern.slf4j.Slf4j;
import org.carball.mcda.model.alternative.Alternative;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns host-supplied site records into alternatives. This is the only place where a
 * missing or broken value is replaced by a default; the engines never do so.
 */
@Slf4j
public class AlternativeBuilder {

    static final double FALLBACK_VALUE = 0.0;

    public <S extends SiteRecord> List<Alternative> build(List<S> sites,
                                                          List<String> criterionIds,
                                                          CriterionValueExtractor<S> extractor) {
        List<Alternative> alternatives = new ArrayList<>(sites.size());
        int substituted = 0;

        for (S site : sites) {
            Map<String, Double> values = new LinkedHashMap<>();
            for (String criterionId : criterionIds) {
                Double value = extractValue(site, criterionId, extractor);
                if (value == null) {
                    substituted++;
                    value = FALLBACK_VALUE;
                }
                values.put(criterionId, value);
            }
            alternatives.add(new Alternative(site.getId(), site.getName(), values));
        }

        log.debug("Built {} alternatives over {} criteria ({} values substituted)",
                alternatives.size(), criterionIds.size(), substituted);
        return alternatives;
    }

    private <S extends SiteRecord> Double extractValue(S site, String criterionId, CriterionValueExtractor<S> extractor) {
        Object raw;
        try {
            raw = extractor.extract(site, criterionId);
        } catch (Exception e) {
            log.warn("Failed to extract '{}' for site {}: {}. Using {}",
                    criterionId, site.getId(), e.getMessage(), FALLBACK_VALUE);
            log.debug("Extraction failure details", e);
            return null;
        }

        if (raw instanceof Number number && Double.isFinite(number.doubleValue())) {
            return number.doubleValue();
        }

        log.warn("Non-numeric value {} for '{}' on site {}. Using {}", raw, criterionId, site.getId(), FALLBACK_VALUE);
        return null;
    }
}
