package com.stackfit.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Motor externo conducido por un script corto: el script fija el entorno y lanza el
 * binario, y las respuestas le llegan por stdin. El script se borra siempre, haya ido
 * bien o mal. El codigo de salida solo se registra; lo que cuenta son los ficheros que deja.
 */
public class ExternalEngine {

    private static final Logger log = LoggerFactory.getLogger(ExternalEngine.class);

    private final String name;
    private final Path executable;
    private final String shell;
    private final Map<String, String> environment;
    private final ProcessRunner runner;
    private final Duration timeout;

    public ExternalEngine(String name, Path executable, String shell, Map<String, String> environment,
                          ProcessRunner runner, Duration timeout) {
        this.name = name;
        this.executable = executable;
        this.shell = shell;
        this.environment = environment;
        this.runner = runner;
        this.timeout = timeout;
    }

    public String name() {
        return name;
    }

    public ProcessResult run(Path workDir, AnswerSequence answers) {
        Path script = workDir.resolve(name + ".sh");
        try {
            Files.writeString(script, script(workDir), StandardCharsets.UTF_8);
            log.debug("{}: respuestas\n{}", name, answers.text());
            ProcessResult r = runner.run(List.of(shell, script.toString()), answers.text(), workDir, timeout);
            if (r.timedOut) {
                log.warn("{} agoto el tiempo ({} s)", name, timeout.getSeconds());
            } else {
                log.info("{} termino con codigo {}", name, r.exitCode);
            }
            return r;
        } catch (IOException e) {
            log.error("No se pudo lanzar {}: {}", name, e.getMessage());
            return new ProcessResult(-1, "", e.getMessage(), false);
        } finally {
            try {
                Files.deleteIfExists(script);
            } catch (IOException e) {
                log.warn("No se pudo borrar {}: {}", script, e.getMessage());
            }
        }
    }

    String script(Path workDir) {
        StringBuilder sb = new StringBuilder("#!/bin/sh\n");
        sb.append("cd ").append(quote(workDir.toString())).append(" || exit 1\n");
        for (Map.Entry<String, String> e : environment.entrySet()) {
            sb.append("export ").append(e.getKey()).append('=').append(quote(e.getValue())).append('\n');
        }
        sb.append("exec ").append(quote(executable.toString())).append('\n');
        return sb.toString();
    }

    static String quote(String s) {
        return "'" + s.replace("'", "'\\''") + "'";
    }
}
