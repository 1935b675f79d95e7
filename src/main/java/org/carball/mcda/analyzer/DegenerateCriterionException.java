package org.carball.mcda.analyzer;

import lombok.Getter;

@Getter
public class DegenerateCriterionException extends McdaComputationException {

    private final String criterionId;

    public DegenerateCriterionException(String criterionId) {
        super("Criterion '" + criterionId + "' has identical values for all alternatives and cannot discriminate between them");
        this.criterionId = criterionId;
    }
}
