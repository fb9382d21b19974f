package com.stackfit.service;

import com.stackfit.engine.AnswerSequence;
import com.stackfit.engine.ExternalEngine;
import com.stackfit.engine.ProcessResult;
import com.stackfit.error.EngineException;
import com.stackfit.error.PipelineException;
import com.stackfit.error.PrerequisiteMissingException;
import com.stackfit.model.ExpectedArtifact;
import com.stackfit.model.FrameArtifact;
import com.stackfit.model.PipelineConfig;
import com.stackfit.model.TransformList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Ajuste PSF simultaneo de todos los frames mas el stack con posiciones fijas. Antes de
 * lanzar el motor comprueba uno a uno los ficheros de cada frame para poder reanudar a mano.
 */
public class SimultaneousFitDriver {

    private static final Logger log = LoggerFactory.getLogger(SimultaneousFitDriver.class);
    private static final String STAGE = "fit";

    private final PipelineConfig config;
    private final ExternalEngine engine;
    private final TransformStore transforms;

    public SimultaneousFitDriver(PipelineConfig config, ExternalEngine engine, TransformStore transforms) {
        this.config = config;
        this.engine = engine;
        this.transforms = transforms;
    }

    /**
     * @return la fotometria ajustada de cada frame, en el orden de la lista de transformaciones
     */
    public List<Path> fit(int trimX, int trimY) {
        Path dir = config.getWorkDir();
        String stack = config.getStackName();
        List<String> ids = new ArrayList<>();
        ids.add(stack);
        ids.addAll(transforms.list().frameIds());

        Optional<ExpectedArtifact> missing = firstMissing(dir, ids);
        if (missing.isPresent()) {
            log.error("Falta {}", missing.get());
            throw new PrerequisiteMissingException(STAGE, missing.get().path);
        }

        Path mch = dir.resolve(stack + ".mch");
        TransformList fitList = transforms.relativeToStack(stack + FrameArtifact.SOURCE_LIST.suffix(), trimX, trimY);
        try {
            TransformStore.write(fitList, mch);
            for (String id : ids) Files.deleteIfExists(FrameArtifact.FITTED_PHOTOMETRY.in(dir, id));
        } catch (IOException e) {
            throw new PipelineException(STAGE, "No se pudo preparar " + mch + ": " + e.getMessage(), e);
        }

        log.info("Ajuste simultaneo de {} frames + stack", ids.size() - 1);
        ProcessResult r = engine.run(dir, answers(stack, mch.getFileName().toString()));
        if (r.timedOut) {
            // lo que haya dejado a medias no vale
            throw new EngineException(STAGE, FrameArtifact.FITTED_PHOTOMETRY.in(dir, ids.get(1)), r.stderr);
        }

        List<Path> fitted = new ArrayList<>();
        for (String id : transforms.list().frameIds()) {
            ExpectedArtifact alf = FrameArtifact.FITTED_PHOTOMETRY.expect(dir, id);
            if (!alf.isPresent()) {
                throw new EngineException(STAGE, alf.path, r.stderr);
            }
            fitted.add(alf.path);
        }
        return fitted;
    }

    /** Primer fichero requerido que falta (o esta vacio), recorriendo frame a frame. */
    public static Optional<ExpectedArtifact> firstMissing(Path dir, List<String> ids) {
        for (String id : ids) {
            for (FrameArtifact a : FrameArtifact.FIT_PREREQUISITES) {
                ExpectedArtifact e = a.expect(dir, id);
                if (e.check() != ExpectedArtifact.Status.FOUND) return Optional.of(e);
            }
        }
        return Optional.empty();
    }

    /** opciones de ajuste del stack, fichero de transformaciones, lista maestra. */
    public static AnswerSequence answers(String stackName, String transformFile) {
        return new AnswerSequence()
                .line(stackName + FrameArtifact.FITTING_OPTIONS.suffix())
                .line(transformFile)
                .line(stackName + FrameArtifact.SOURCE_LIST.suffix());
    }
}
