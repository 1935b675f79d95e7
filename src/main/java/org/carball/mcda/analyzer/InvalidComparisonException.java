package org.carball.mcda.analyzer;

public class InvalidComparisonException extends McdaComputationException {

    public InvalidComparisonException(String message) {
        super(message);
    }
}
