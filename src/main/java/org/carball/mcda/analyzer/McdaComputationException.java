package org.carball.mcda.analyzer;

/**
 * Raised by the numeric engines when their input cannot be computed on.
 * {@link McdaAnalyzer} converts it into a validation message.
 */
public class McdaComputationException extends RuntimeException {

    public McdaComputationException(String message) {
        super(message);
    }
}
