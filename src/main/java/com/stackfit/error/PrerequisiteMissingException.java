package com.stackfit.error;

import java.nio.file.Path;

/**
 * Falta un fichero de frame necesario para lanzar un motor. Solo se informa del
 * primero que falta.
 */
public class PrerequisiteMissingException extends PipelineException {

    private final Path missing;

    public PrerequisiteMissingException(String stage, Path missing) {
        super(stage, "Falta el fichero requerido: " + missing);
        this.missing = missing;
    }

    public Path getMissing() {
        return missing;
    }
}
