package com.stackfit.error;

/**
 * Base de los errores fatales del pipeline. Siempre lleva la etapa que fallo
 * para que el operador pueda reanudar desde ahi.
 */
public class PipelineException extends RuntimeException {

    private final String stage;

    public PipelineException(String stage, String message) {
        super("[" + stage + "] " + message);
        this.stage = stage;
    }

    public PipelineException(String stage, String message, Throwable cause) {
        super("[" + stage + "] " + message, cause);
        this.stage = stage;
    }

    public String getStage() {
        return stage;
    }
}
