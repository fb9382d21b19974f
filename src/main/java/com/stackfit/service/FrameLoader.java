package com.stackfit.service;

import com.stackfit.error.ComputationException;
import com.stackfit.error.PrerequisiteMissingException;
import com.stackfit.model.Frame;
import com.stackfit.model.FrameArtifact;
import com.stackfit.model.PipelineConfig;
import com.stackfit.model.TransformList;
import ij.process.ByteProcessor;
import ij.process.FloatProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Captura cada frame de la lista una sola vez al inicio: cabecera, cielo y el cargador
 * perezoso de pixeles y mascara.
 */
public class FrameLoader {

    private static final Logger log = LoggerFactory.getLogger(FrameLoader.class);
    private static final String STAGE = "load";

    private final PipelineConfig config;
    private final FitsIoService fitsIo;
    private final SkyEstimator skyEstimator;

    public FrameLoader(PipelineConfig config, FitsIoService fitsIo, SkyEstimator skyEstimator) {
        this.config = config;
        this.fitsIo = fitsIo;
        this.skyEstimator = skyEstimator;
    }

    public List<Frame> load(TransformList list) {
        List<Callable<Frame>> jobs = new ArrayList<>();
        for (TransformList.Entry e : list.entries()) jobs.add(() -> capture(e));
        List<Frame> frames = FrameJobs.run(STAGE, jobs, config.getWorkers());
        log.info("Capturados {} frames (referencia {})", frames.size(), list.reference().frameId);
        return frames;
    }

    Frame capture(TransformList.Entry entry) throws IOException {
        Path dir = config.getWorkDir();
        Path image = FrameArtifact.IMAGE.in(dir, entry.frameId);
        if (!Files.isRegularFile(image)) {
            throw new PrerequisiteMissingException(STAGE, image);
        }
        FitsIoService.FrameHeader h = fitsIo.readHeader(image);
        double gain = Double.isFinite(h.gain) ? h.gain : config.getDefaultGain();
        double rdnoise = Double.isFinite(h.readNoise) ? h.readNoise : config.getDefaultReadNoise();
        double saturation = Double.isFinite(h.saturation) ? h.saturation : config.getSaturationLevel();

        // El raster se lee una vez y el frame lo reutiliza
        FloatProcessor[] cache = new FloatProcessor[1];
        Frame.Loader<FloatProcessor> raster = () -> {
            if (cache[0] == null) cache[0] = fitsIo.readImage(image);
            return cache[0];
        };

        double sky = h.sky, skySigma = h.skySigma;
        if (!Double.isFinite(sky) || !Double.isFinite(skySigma)) {
            SkyEstimator.SkyStats st = skyEstimator.estimate(raster.load(), saturation);
            if (!Double.isFinite(sky)) sky = st.level;
            if (!Double.isFinite(skySigma)) skySigma = st.sigma;
        }
        if (!Double.isFinite(sky) || !Double.isFinite(skySigma)) {
            throw new ComputationException(STAGE, "No se pudo estimar el cielo de " + image);
        }

        Path maskFile = FrameArtifact.MASK.in(dir, entry.frameId);
        Frame.Loader<ByteProcessor> mask = () -> buildMask(raster.load(), maskFile, saturation);

        log.debug("Frame {}: gain={} rdnoise={} sky={} sigma={} sat={}", entry.frameId, gain, rdnoise, sky, skySigma,
                saturation);
        return new Frame(entry.frameId, image, gain, rdnoise, sky, skySigma, saturation, entry.transform, raster, mask);
    }

    /** Union de la mascara en disco (si existe) y de los pixeles saturados. */
    ByteProcessor buildMask(FloatProcessor px, Path maskFile, double saturation) throws IOException {
        int w = px.getWidth(), h = px.getHeight();
        ByteProcessor mask;
        if (Files.isRegularFile(maskFile)) {
            mask = fitsIo.readMask(maskFile);
            if (mask.getWidth() != w || mask.getHeight() != h) {
                throw new ComputationException(STAGE, "La mascara " + maskFile + " no tiene la forma de su imagen");
            }
        } else {
            mask = new ByteProcessor(w, h);
        }
        float[] v = (float[]) px.getPixels();
        byte[] m = (byte[]) mask.getPixels();
        for (int i = 0; i < v.length; i++) {
            if (v[i] >= saturation || Float.isNaN(v[i])) m[i] = 1;
        }
        return mask;
    }
}
