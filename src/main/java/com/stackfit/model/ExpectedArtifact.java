package com.stackfit.model;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Fichero que una etapa espera encontrar. La existencia con contenido es la unica
 * senal de exito de los motores externos.
 */
public class ExpectedArtifact {

    public enum Status { FOUND, MISSING, EMPTY }

    public final Path path;
    public final String description;

    public ExpectedArtifact(Path path, String description) {
        this.path = path;
        this.description = description;
    }

    public Status check() {
        if (!Files.isRegularFile(path)) return Status.MISSING;
        try {
            return Files.size(path) > 0 ? Status.FOUND : Status.EMPTY;
        } catch (IOException e) {
            return Status.MISSING;
        }
    }

    public boolean isPresent() {
        return check() == Status.FOUND;
    }

    @Override
    public String toString() {
        return description + " (" + path + ")";
    }
}
