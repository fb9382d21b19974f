package com.stackfit.error;

import java.nio.file.Path;

/**
 * Un motor externo termino (o agoto el tiempo) sin dejar el fichero esperado.
 */
public class EngineException extends PipelineException {

    private final Path expected;
    private final String stderr;

    public EngineException(String stage, Path expected, String stderr) {
        super(stage, "El motor no produjo " + expected
                + (stderr == null || stderr.isBlank() ? "" : " (stderr: " + stderr.trim() + ")"));
        this.expected = expected;
        this.stderr = stderr;
    }

    public Path getExpected() {
        return expected;
    }

    public String getStderr() {
        return stderr;
    }
}
