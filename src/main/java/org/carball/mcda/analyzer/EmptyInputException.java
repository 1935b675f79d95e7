package org.carball.mcda.analyzer;

public class EmptyInputException extends McdaComputationException {

    public EmptyInputException(String message) {
        super(message);
    }
}
