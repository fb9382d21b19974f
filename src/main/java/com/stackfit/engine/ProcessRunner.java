package com.stackfit.engine;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Ejecucion de un proceso externo: argv y texto de entrada, devuelve salidas y codigo.
 * Los tests la sustituyen por una falsa que escribe los ficheros del motor.
 */
public interface ProcessRunner {

    ProcessResult run(List<String> argv, String stdin, Path workDir, Duration timeout) throws IOException;
}
