package com.stackfit.service;

import com.stackfit.engine.ExternalEngine;
import com.stackfit.engine.ProcessRunner;
import com.stackfit.error.PipelineException;
import com.stackfit.model.AlignedSet;
import com.stackfit.model.Frame;
import com.stackfit.model.FrameArtifact;
import com.stackfit.model.PipelineConfig;
import com.stackfit.model.StackImage;
import com.stackfit.model.StarCatalog;
import com.stackfit.model.WeightSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ejecuta las etapas en orden: transformaciones, captura de frames, pesos, alineado,
 * stack, deteccion, ajuste simultaneo y catalogo. Cada etapa deja sus ficheros cerrados
 * antes de empezar la siguiente.
 */
public class StackAndFitPipeline {

    private static final Logger log = LoggerFactory.getLogger(StackAndFitPipeline.class);

    private final PipelineConfig config;
    private final ProcessRunner runner;
    private final FitsIoService fitsIo = new FitsIoService();

    public StackAndFitPipeline(PipelineConfig config, ProcessRunner runner) {
        this.config = config;
        this.runner = runner;
    }

    public StarCatalog run() {
        config.validate();
        Path dir = config.getWorkDir();
        String stackName = config.getStackName();

        log.info("1/7 Transformaciones: {}", config.getTransformFile());
        TransformStore transforms = TransformStore.load(config.getTransformFile());

        log.info("2/7 Captura de {} frames", transforms.size());
        List<Frame> frames = new FrameLoader(config, fitsIo, new SkyEstimator()).load(transforms.list());

        log.info("3/7 Pesos (escalado {})", config.isScaleFrames() ? "si" : "no");
        WeightCalculator weightCalculator = new WeightCalculator(config);
        WeightSet weights = weightCalculator.compute(frames);
        try {
            weightCalculator.writeLists(weights, dir, stackName);
        } catch (IOException e) {
            throw new PipelineException("weights", "No se pudieron escribir las listas de pesos en " + dir, e);
        }

        log.info("4/7 Alineado (recorte {})", config.isTrim() ? "si" : "no");
        AlignedSet aligned = new Aligner(config.isTrim(), config.getWorkers()).alignAll(frames);

        log.info("5/7 Stack");
        StackImage stack = new Stacker(config, new MaskCombiner()).stack(aligned, weights);
        writeStack(stack, dir, stackName);

        log.info("6/7 Deteccion sobre {}", stackName);
        DetectionDriver detection = new DetectionDriver(config, engine("detect", config.getDetectEngine()));
        DetectionDriver.Result detected = detection.detect(stack, frames);

        log.info("7/7 Ajuste simultaneo y catalogo");
        SimultaneousFitDriver fitDriver = new SimultaneousFitDriver(config, engine("fit", config.getFitEngine()),
                transforms);
        List<Path> fitted = fitDriver.fit(stack.trimX, stack.trimY);

        MagnitudeMerger merger = new MagnitudeMerger();
        StarCatalog catalog = merger.merge(detected.starList, transforms.list().frameIds(), fitted,
                config.getClassificationFile());
        Path out = dir.resolve(config.getCatalogName());
        try {
            merger.write(catalog, out);
        } catch (IOException e) {
            throw new PipelineException("merge", "No se pudo escribir el catalogo " + out, e);
        }
        log.info("Catalogo escrito en {} ({} estrellas)", out, catalog.size());
        return catalog;
    }

    private ExternalEngine engine(String name, Path executable) {
        return new ExternalEngine(name, executable, config.getShell(), config.getEngineEnvironment(), runner,
                config.getEngineTimeout());
    }

    void writeStack(StackImage stack, Path dir, String stackName) {
        Map<String, Object> cards = new LinkedHashMap<>();
        cards.put("GAIN", stack.gain);
        cards.put("RDNOISE", stack.readNoise);
        cards.put("SKY", stack.sky);
        cards.put("SATURATE", stack.highGoodDatum);
        cards.put("MASKLEV", stack.maskDataLevel);
        cards.put("RESCALE", stack.rescale);
        cards.put("NCOMBINE", stack.frameCount);
        cards.put("TRIMX", stack.trimX);
        cards.put("TRIMY", stack.trimY);
        Path image = FrameArtifact.IMAGE.in(dir, stackName);
        try {
            fitsIo.writeImage(image, stack.pixels, cards);
            fitsIo.writeMask(FrameArtifact.MASK.in(dir, stackName), stack.mask.bad);
            fitsIo.writeImage(FrameArtifact.WEIGHT_MAP.in(dir, stackName), stack.mask.weightMap, Map.of());
        } catch (IOException e) {
            throw new PipelineException("stack", "No se pudo escribir " + image + ": " + e.getMessage(), e);
        }
        log.info("Stack escrito en {}", image);
    }
}
