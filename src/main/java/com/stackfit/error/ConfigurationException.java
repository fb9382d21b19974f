package com.stackfit.error;

/**
 * Falta un directorio, script o binario de motor, o un valor de configuracion es invalido.
 */
public class ConfigurationException extends PipelineException {

    public ConfigurationException(String stage, String message) {
        super(stage, message);
    }

    public ConfigurationException(String stage, String message, Throwable cause) {
        super(stage, message, cause);
    }
}
