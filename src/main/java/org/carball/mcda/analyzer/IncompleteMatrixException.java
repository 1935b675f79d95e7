package org.carball.mcda.analyzer;

public class IncompleteMatrixException extends McdaComputationException {

    public IncompleteMatrixException(String criterionA, String criterionB) {
        super("Missing pairwise comparison between '" + criterionA + "' and '" + criterionB + "'");
    }
}
