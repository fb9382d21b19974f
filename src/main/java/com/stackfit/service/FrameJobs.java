package com.stackfit.service;

import com.stackfit.error.PipelineException;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Reparte trabajo independiente por frame y devuelve los resultados en el orden de la lista.
 */
final class FrameJobs {

    private FrameJobs() {
    }

    static <T> List<T> run(String stage, List<Callable<T>> jobs, int workers) {
        if (workers <= 1 || jobs.size() <= 1) {
            List<T> out = new ArrayList<>();
            for (Callable<T> job : jobs) {
                try {
                    out.add(job.call());
                } catch (PipelineException e) {
                    throw e;
                } catch (Exception e) {
                    throw new PipelineException(stage, e.getMessage(), e);
                }
            }
            return out;
        }

        ExecutorService exec = Executors.newFixedThreadPool(Math.min(workers, jobs.size()));
        try {
            // invokeAll conserva el orden de entrada
            List<Future<T>> futures = exec.invokeAll(jobs);
            List<T> out = new ArrayList<>();
            for (Future<T> f : futures) out.add(f.get());
            return out;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PipelineException(stage, "Interrumpido", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof PipelineException) throw (PipelineException) cause;
            throw new PipelineException(stage, String.valueOf(cause.getMessage()), cause);
        } finally {
            exec.shutdownNow();
        }
    }
}
