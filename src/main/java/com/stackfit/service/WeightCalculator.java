package com.stackfit.service;

import com.stackfit.error.ComputationException;
import com.stackfit.error.ConfigurationException;
import com.stackfit.model.Frame;
import com.stackfit.model.FrameArtifact;
import com.stackfit.model.FrameWeight;
import com.stackfit.model.PipelineConfig;
import com.stackfit.model.WeightSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Peso, escala y offset de cada frame a partir del ruido de cielo y, si se escala,
 * de la fotometria de apertura de las estrellas comunes.
 */
public class WeightCalculator {

    private static final Logger log = LoggerFactory.getLogger(WeightCalculator.class);
    private static final String STAGE = "weights";

    // Limites del frame degenerado
    static final double MIN_SCALE = 1e-5;
    static final double MAX_INVERSE_SCALE = 900.0;

    private final PipelineConfig config;

    public WeightCalculator(PipelineConfig config) {
        this.config = config;
    }

    public WeightSet compute(List<Frame> frames) {
        boolean scaled = config.isScaleFrames();
        double[] scales = new double[frames.size()];
        if (scaled) {
            scales = photometricScales(frames);
        } else {
            Arrays.fill(scales, 1.0);
        }
        return fromScales(frames, scales, scaled);
    }

    /**
     * Aplica la regla del frame degenerado, calcula pesos 1/(s*sigma)^2 normalizados a
     * suma 1 y los offsets de cielo.
     */
    public WeightSet fromScales(List<Frame> frames, double[] scales, boolean scaled) {
        int n = frames.size();
        double[] raw = new double[n];
        double[] s = new double[n];
        double total = 0;
        for (int i = 0; i < n; i++) {
            Frame f = frames.get(i);
            if (!Double.isFinite(f.sky)) {
                throw new ComputationException(STAGE, "Cielo no finito en " + f.describe());
            }
            if (!Double.isFinite(f.skySigma) || f.skySigma <= 0) {
                throw new ComputationException(STAGE, "Sigma de cielo invalida (" + f.skySigma + ") en " + f.describe());
            }
            if (isDegenerate(scales[i])) {
                log.warn("Frame {} neutralizado: escala {} fuera de limites", f.id, scales[i]);
                s[i] = 1.0;
                raw[i] = 0.0;
                continue;
            }
            s[i] = scales[i];
            double noise = s[i] * f.skySigma;
            raw[i] = 1.0 / (noise * noise);
            total += raw[i];
        }
        if (!(total > 0) || !Double.isFinite(total)) {
            throw new ComputationException(STAGE, "Peso total nulo: ningun frame utilizable");
        }

        List<FrameWeight> out = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            Frame f = frames.get(i);
            double zero = config.isSubtractSky() ? -f.sky : 0.0;
            FrameWeight fw = new FrameWeight(f.id, raw[i] / total, s[i], zero);
            log.debug("{}: w={} s={} z={}", f.id, fw.weight, fw.scale, fw.zero);
            out.add(fw);
        }
        return new WeightSet(out, scaled);
    }

    public static boolean isDegenerate(double scale) {
        return !Double.isFinite(scale) || scale < MIN_SCALE || 1.0 / scale > MAX_INVERSE_SCALE;
    }

    /**
     * s_i = 10^(0.4 * mediana(m_i - m_ref)) sobre las estrellas comunes con magnitud valida
     * en ambos frames. La referencia tiene escala 1.
     */
    double[] photometricScales(List<Frame> frames) {
        Path common = config.getCommonSourceList();
        if (common == null || !Files.isRegularFile(common)) {
            throw new ConfigurationException(STAGE, "Se pidio escalado y no existe la lista comun " + common);
        }
        Path dir = config.getWorkDir();
        try {
            Set<Integer> ids = PhotometryFiles.readIds(common);
            Map<Integer, Double> ref = PhotometryFiles.readApertureMags(
                    FrameArtifact.APERTURE_PHOTOMETRY.in(dir, frames.get(0).id));
            double[] scales = new double[frames.size()];
            scales[0] = 1.0;
            for (int i = 1; i < frames.size(); i++) {
                Path ap = FrameArtifact.APERTURE_PHOTOMETRY.in(dir, frames.get(i).id);
                Map<Integer, Double> mags = PhotometryFiles.readApertureMags(ap);
                List<Double> diffs = new ArrayList<>();
                for (Integer id : ids) {
                    Double mr = ref.get(id), mi = mags.get(id);
                    if (mr == null || mi == null) continue;
                    if (mr >= PhotometryFiles.INVALID_MAG || mi >= PhotometryFiles.INVALID_MAG) continue;
                    diffs.add(mi - mr);
                }
                if (diffs.isEmpty()) {
                    throw new ComputationException(STAGE, "Ninguna estrella comun valida en " + ap);
                }
                scales[i] = Math.pow(10.0, 0.4 * median(diffs));
            }
            return scales;
        } catch (IOException e) {
            throw new ComputationException(STAGE, "No se pudo leer la fotometria de apertura: " + e.getMessage(), e);
        }
    }

    /** Escribe &lt;stack&gt;.weight, .scale y .zero, una linea por frame. */
    public void writeLists(WeightSet weights, Path dir, String stackName) throws IOException {
        writeColumn(dir.resolve(stackName + ".weight"), weights, "%10.6f", 0);
        writeColumn(dir.resolve(stackName + ".scale"), weights, "%10.5f", 1);
        writeColumn(dir.resolve(stackName + ".zero"), weights, "%10.2f", 2);
    }

    private static void writeColumn(Path file, WeightSet weights, String fmt, int column) throws IOException {
        try (BufferedWriter w = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            for (FrameWeight fw : weights.all()) {
                double v = column == 0 ? fw.weight : column == 1 ? fw.scale : fw.zero;
                w.write(String.format(Locale.US, fmt, v));
                w.newLine();
            }
        }
    }

    static double median(List<Double> values) {
        List<Double> sorted = new ArrayList<>(values);
        sorted.sort(null);
        int mid = sorted.size() / 2;
        if (sorted.size() % 2 == 0) return (sorted.get(mid - 1) + sorted.get(mid)) / 2.0;
        return sorted.get(mid);
    }
}
