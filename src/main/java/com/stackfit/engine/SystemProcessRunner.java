package com.stackfit.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

public class SystemProcessRunner implements ProcessRunner {

    private static final Logger log = LoggerFactory.getLogger(SystemProcessRunner.class);
    private static final long DRAIN_SECONDS = 5;

    @Override
    public ProcessResult run(List<String> argv, String stdin, Path workDir, Duration timeout) throws IOException {
        ProcessBuilder pb = new ProcessBuilder(argv);
        if (workDir != null) pb.directory(workDir.toFile());
        Process p = pb.start();

        // stdout y stderr se leen aparte para que el proceso no se bloquee con la tuberia llena
        CompletableFuture<String> out = CompletableFuture.supplyAsync(() -> drain(p.getInputStream()));
        CompletableFuture<String> err = CompletableFuture.supplyAsync(() -> drain(p.getErrorStream()));

        try (OutputStream in = p.getOutputStream()) {
            if (stdin != null) in.write(stdin.getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            // el motor puede cerrar su entrada antes de leerlo todo
            log.debug("stdin cerrado por {}: {}", argv.get(0), e.getMessage());
        }

        try {
            boolean finished = p.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                p.destroyForcibly();
                log.warn("{} supero el tiempo limite de {} s", argv, timeout.getSeconds());
                return ProcessResult.timeout(collect(out), collect(err));
            }
            return new ProcessResult(p.exitValue(), collect(out), collect(err), false);
        } catch (InterruptedException e) {
            p.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new IOException("Interrumpido esperando a " + argv, e);
        }
    }

    private static String drain(InputStream in) {
        try (InputStream s = in) {
            ByteArrayOutputStream buf = new ByteArrayOutputStream();
            s.transferTo(buf);
            return buf.toString(StandardCharsets.UTF_8);
        } catch (IOException e) {
            return "";
        }
    }

    private static String collect(CompletableFuture<String> f) {
        try {
            return f.get(DRAIN_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return "";
        } catch (ExecutionException | TimeoutException e) {
            return "";
        }
    }
}
