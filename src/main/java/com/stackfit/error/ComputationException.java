package com.stackfit.error;

/**
 * Pesos o escalas degenerados, peso total nulo o estadisticas no finitas.
 */
public class ComputationException extends PipelineException {

    public ComputationException(String stage, String message) {
        super(stage, message);
    }

    public ComputationException(String stage, String message, Throwable cause) {
        super(stage, message, cause);
    }
}
