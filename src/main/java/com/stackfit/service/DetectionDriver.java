package com.stackfit.service;

import com.stackfit.engine.AnswerSequence;
import com.stackfit.engine.ExternalEngine;
import com.stackfit.engine.ProcessResult;
import com.stackfit.error.ConfigurationException;
import com.stackfit.error.EngineException;
import com.stackfit.error.PipelineException;
import com.stackfit.model.ExpectedArtifact;
import com.stackfit.model.Frame;
import com.stackfit.model.FrameArtifact;
import com.stackfit.model.PipelineConfig;
import com.stackfit.model.StackImage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.List;

/**
 * Deteccion y modelo PSF sobre el stack con un unico reintento: si el motor no deja modelo
 * con el orden de variacion configurado, se repite una vez con orden lineal.
 */
public class DetectionDriver {

    private static final Logger log = LoggerFactory.getLogger(DetectionDriver.class);
    private static final String STAGE = "detect";

    public enum State { INIT, DETECT, RETRY, ACCEPT, FAIL }

    /** Orden minimo de variacion espacial de la PSF (lineal). */
    public static final int MIN_PSF_ORDER = 1;
    /** Umbral bajo de dato bueno, en sigmas por debajo del cielo. */
    static final double LOW_GOOD_SIGMA = 7.0;

    public static class Result {
        public final State state;
        public final int psfOrder;
        public final int attempts;
        public final Path psfModel;
        public final Path starList;

        Result(State state, int psfOrder, int attempts, Path psfModel, Path starList) {
            this.state = state;
            this.psfOrder = psfOrder;
            this.attempts = attempts;
            this.psfModel = psfModel;
            this.starList = starList;
        }
    }

    private final PipelineConfig config;
    private final ExternalEngine engine;

    public DetectionDriver(PipelineConfig config, ExternalEngine engine) {
        this.config = config;
        this.engine = engine;
    }

    public Result detect(StackImage stack, List<Frame> frames) {
        Path dir = config.getWorkDir();
        String name = config.getStackName();
        ExpectedArtifact psf = FrameArtifact.PSF_MODEL.expect(dir, name);
        ExpectedArtifact starList = FrameArtifact.SOURCE_LIST.expect(dir, name);
        double fitRadius = fitRadius(frames);
        int iterations = config.getFindIterations();

        copyDetectionOptions(frames.get(0).id, name, fitRadius);

        State state = State.INIT;
        int order = config.getPsfOrder();
        int attempts = 0;
        ProcessResult last = null;
        while (state != State.ACCEPT && state != State.FAIL) {
            switch (state) {
                case INIT:
                    state = State.DETECT;
                    break;
                case DETECT:
                case RETRY:
                    attempts++;
                    last = attempt(stack, name, order, fitRadius, iterations, psf);
                    if (psf.isPresent() && !last.timedOut) {
                        state = State.ACCEPT;
                    } else if (state == State.DETECT) {
                        log.warn("Sin modelo PSF con VA={}; se reintenta con VA={}", order, MIN_PSF_ORDER);
                        order = MIN_PSF_ORDER;
                        state = State.RETRY;
                    } else {
                        state = State.FAIL;
                    }
                    break;
                default:
                    throw new IllegalStateException(state.name());
            }
        }

        if (state == State.FAIL) {
            log.error("La deteccion fallo dos veces sobre {}", name);
            throw new EngineException(STAGE, psf.path, last == null ? null : last.stderr);
        }
        if (!starList.isPresent()) {
            throw new EngineException(STAGE, starList.path, last == null ? null : last.stderr);
        }
        log.info("Deteccion aceptada con VA={} tras {} intento(s)", order, attempts);
        return new Result(State.ACCEPT, order, attempts, psf.path, starList.path);
    }

    private ProcessResult attempt(StackImage stack, String name, int order, double fitRadius, int iterations,
                                  ExpectedArtifact psf) {
        Path dir = config.getWorkDir();
        Path options = FrameArtifact.FITTING_OPTIONS.in(dir, name);
        try {
            // salidas viejas darian el intento por bueno
            Files.deleteIfExists(psf.path);
            Files.deleteIfExists(FrameArtifact.SOURCE_LIST.in(dir, name));
            Files.deleteIfExists(FrameArtifact.APERTURE_PHOTOMETRY.in(dir, name));
            stackOptions(stack, order, fitRadius).write(options);
        } catch (IOException e) {
            throw new PipelineException(STAGE, "No se pudo preparar " + options + ": " + e.getMessage(), e);
        }
        ProcessResult r = engine.run(dir, answers(name, iterations, config.getDetectThreshold()));
        appendLog(FrameArtifact.LOG.in(dir, name), order, r);
        return r;
    }

    OptionFile stackOptions(StackImage stack, int order, double fitRadius) {
        return new OptionFile()
                .set("FW", fitRadius)
                .set("VA", order)
                .set("AN", config.getAnalyticModel())
                .set("GA", stack.gain)
                .set("RE", stack.readNoise)
                .set("HI", stack.highGoodDatum)
                .set("LO", LOW_GOOD_SIGMA)
                .set("TH", config.getDetectThreshold());
    }

    /** imagen, opciones de ajuste, opciones de deteccion, iteraciones de busqueda, umbral, raiz de salida. */
    public static AnswerSequence answers(String stackName, int iterations, double threshold) {
        return new AnswerSequence()
                .line(stackName + FrameArtifact.IMAGE.suffix())
                .line(stackName + FrameArtifact.FITTING_OPTIONS.suffix())
                .line(stackName + FrameArtifact.DETECTION_OPTIONS.suffix())
                .line("%d", iterations)
                .line("%.1f", threshold)
                .line(stackName);
    }

    /** FW del stack: configurado, o el mayor de los frames (opciones o lista de transformaciones). */
    double fitRadius(List<Frame> frames) {
        if (config.getFitRadius() > 0) return config.getFitRadius();
        double fw = 0;
        for (Frame f : frames) {
            Path opt = FrameArtifact.FITTING_OPTIONS.in(config.getWorkDir(), f.id);
            if (Files.isRegularFile(opt)) {
                try {
                    fw = Math.max(fw, OptionFile.read(opt).getDouble("FW", 0));
                } catch (IOException e) {
                    throw new ConfigurationException(STAGE, "No se pudo leer " + opt, e);
                }
            }
            fw = Math.max(fw, f.transform.fitRadius);
        }
        if (fw <= 0) {
            throw new ConfigurationException(STAGE, "No hay radio de ajuste: ni " + PipelineConfig.KEY_FIT_RADIUS
                    + " ni FW en las opciones de los frames");
        }
        return fw;
    }

    private void copyDetectionOptions(String referenceId, String stackName, double fitRadius) {
        Path dir = config.getWorkDir();
        Path src = FrameArtifact.DETECTION_OPTIONS.in(dir, referenceId);
        Path dst = FrameArtifact.DETECTION_OPTIONS.in(dir, stackName);
        try {
            if (Files.isRegularFile(src)) {
                Files.copy(src, dst, StandardCopyOption.REPLACE_EXISTING);
            } else {
                log.warn("La referencia no tiene {}; se escribe FI={} para el stack", src.getFileName(), fitRadius);
                new OptionFile().set("FI", fitRadius).write(dst);
            }
        } catch (IOException e) {
            throw new PipelineException(STAGE, "No se pudo copiar " + src + " a " + dst, e);
        }
    }

    private static void appendLog(Path logFile, int order, ProcessResult r) {
        String text = "=== VA=" + order + " exit=" + r.exitCode + (r.timedOut ? " TIMEOUT" : "") + "\n"
                + (r.stdout == null ? "" : r.stdout) + (r.stderr == null ? "" : r.stderr) + "\n";
        try {
            Files.writeString(logFile, text, StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new PipelineException(STAGE, "No se pudo escribir " + logFile, e);
        }
    }
}
