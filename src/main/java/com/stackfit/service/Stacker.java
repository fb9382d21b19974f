package com.stackfit.service;

import com.stackfit.error.ComputationException;
import com.stackfit.model.AlignedSet;
import com.stackfit.model.CombinedMask;
import com.stackfit.model.Frame;
import com.stackfit.model.FrameWeight;
import com.stackfit.model.PipelineConfig;
import com.stackfit.model.RejectionMap;
import com.stackfit.model.StackImage;
import com.stackfit.model.WeightSet;
import ij.process.FloatProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Co-adicion ponderada con recorte sigma. Recalcula ganancia, ruido de lectura y cielo del
 * stack para que el fondo siga un modelo de Poisson coherente, y satura los pixeles malos.
 */
public class Stacker {

    private static final Logger log = LoggerFactory.getLogger(Stacker.class);
    private static final String STAGE = "stack";

    static final double MIN_READ_NOISE = 0.01;   // e-; 0 rompe las opciones de ancho fijo del motor
    static final double MAX_DATA_LEVEL = 50000.0; // ADU
    static final double MASK_MARGIN = 10000.0;   // ADU por encima del maximo
    static final int MIN_CLIP_VALUES = 3;

    public static class RangeLimit {
        public final double factor; // 1 si no hizo falta
        public final double gain;

        RangeLimit(double factor, double gain) {
            this.factor = factor;
            this.gain = gain;
        }
    }

    private final MaskCombiner maskCombiner;
    private final double lowSigma;
    private final double highSigma;
    private final int clipIterations;

    public Stacker(PipelineConfig config, MaskCombiner maskCombiner) {
        this(maskCombiner, config.getClipLowSigma(), config.getClipHighSigma(), config.getClipIterations());
    }

    public Stacker(MaskCombiner maskCombiner, double lowSigma, double highSigma, int clipIterations) {
        this.maskCombiner = maskCombiner;
        this.lowSigma = lowSigma;
        this.highSigma = highSigma;
        this.clipIterations = clipIterations;
    }

    public StackImage stack(AlignedSet aligned, WeightSet weights) {
        int n = aligned.size();
        if (weights.size() != n) {
            throw new ComputationException(STAGE, "Hay " + n + " frames alineados y " + weights.size() + " pesos");
        }
        double totalWeight = weights.totalWeight();
        if (!(totalWeight > 0)) {
            throw new ComputationException(STAGE, "Peso total nulo");
        }
        double[] w = new double[n], s = new double[n], z = new double[n];
        double[] g = new double[n], rn = new double[n], sky = new double[n];
        for (int i = 0; i < n; i++) {
            FrameWeight fw = weights.get(i);
            Frame f = aligned.get(i).source;
            requireFinite(f, "ganancia", f.gain, true);
            requireFinite(f, "ruido de lectura", f.readNoise, false);
            requireFinite(f, "cielo", f.sky, false);
            if (!(fw.scale > 0) || !Double.isFinite(fw.scale) || !Double.isFinite(fw.zero)) {
                throw new ComputationException(STAGE, "Escala u offset invalidos para " + f.describe());
            }
            w[i] = fw.weight;
            s[i] = fw.scale;
            z[i] = fw.zero;
            g[i] = f.gain;
            rn[i] = f.readNoise;
            sky[i] = f.sky;
        }

        // 1. Suma ponderada con recorte sigma
        int width = aligned.width(), height = aligned.height();
        RejectionMap rejections = new RejectionMap(n, width, height);
        float[] out = combinePixels(aligned, w, s, z, totalWeight, rejections);
        CombinedMask mask = maskCombiner.combine(aligned, weights, rejections, MaskCombiner.policyFor(weights));

        // 2-3. Ruido, ganancia y cielo del stack
        double readNoise = combinedReadNoise(w, rn, s);
        double gain = combinedGain(w, g, s);
        double combSky = combinedSky(gain, w, sky, g, s);
        for (int p = 0; p < out.length; p++) out[p] += (float) combSky;
        log.info("Stack: rdnoise={} e- gain={} e-/ADU sky={} ADU", readNoise, gain, combSky);

        // 4. Limite de rango dinamico
        FloatProcessor ip = new FloatProcessor(width, height, out);
        RangeLimit limit = limitDynamicRange(ip, gain);
        if (limit.factor != 1.0) {
            log.info("Maximo por encima de {}: reescalado x{} (gain {} -> {})", MAX_DATA_LEVEL, limit.factor, gain,
                    limit.gain);
        }

        // 5. Pixeles malos por encima del maximo
        double max = maxOf(out);
        double maskDataLevel = max + MASK_MARGIN;
        double highGood = max + MASK_MARGIN / 2;
        byte[] bad = (byte[]) mask.bad.getPixels();
        for (int p = 0; p < out.length; p++) {
            if (bad[p] != 0) out[p] = (float) maskDataLevel;
        }

        int used = 0;
        for (double wi : w) if (wi > 0) used++;
        return new StackImage(ip, mask, limit.gain, readNoise, combSky * limit.factor, limit.factor, maskDataLevel,
                highGood, used, aligned.trimX, aligned.trimY);
    }

    private float[] combinePixels(AlignedSet aligned, double[] w, double[] s, double[] z, double totalWeight,
                                  RejectionMap rejections) {
        int n = aligned.size();
        int size = aligned.width() * aligned.height();
        float[][] px = new float[n][];
        byte[][] masks = new byte[n][];
        for (int i = 0; i < n; i++) {
            px[i] = (float[]) aligned.get(i).pixels.getPixels();
            masks[i] = (byte[]) aligned.get(i).mask.getPixels();
        }

        float[] out = new float[size];
        double[] v = new double[n];
        boolean[] ok = new boolean[n];
        for (int p = 0; p < size; p++) {
            for (int i = 0; i < n; i++) {
                ok[i] = w[i] > 0 && masks[i][p] == 0;
                v[i] = s[i] * (px[i][p] + z[i]);
            }
            sigmaClip(v, ok);

            double sum = 0, acc = 0;
            for (int i = 0; i < n; i++) {
                if (ok[i]) {
                    sum += w[i] * v[i];
                    acc += w[i];
                } else if (w[i] > 0) {
                    rejections.reject(i, p);
                }
            }
            out[p] = acc > 0 ? (float) (sum * totalWeight / acc) : 0f;
        }
        return out;
    }

    void sigmaClip(double[] v, boolean[] ok) {
        for (int iter = 0; iter < clipIterations; iter++) {
            int count = 0;
            double mean = 0;
            for (int i = 0; i < v.length; i++) {
                if (ok[i]) {
                    mean += v[i];
                    count++;
                }
            }
            if (count < MIN_CLIP_VALUES) return;
            mean /= count;
            double var = 0;
            for (int i = 0; i < v.length; i++) if (ok[i]) var += (v[i] - mean) * (v[i] - mean);
            double sigma = Math.sqrt(var / count);
            if (sigma <= 0) return;

            boolean changed = false;
            for (int i = 0; i < v.length; i++) {
                if (ok[i] && (v[i] < mean - lowSigma * sigma || v[i] > mean + highSigma * sigma)) {
                    ok[i] = false;
                    changed = true;
                }
            }
            if (!changed) return;
        }
    }

    // sqrt(sum((w_i*rn_i/s_i)^2))
    public static double combinedReadNoise(double[] w, double[] rn, double[] s) {
        double sum = 0;
        for (int i = 0; i < w.length; i++) {
            double t = w[i] * rn[i] / s[i];
            sum += t * t;
        }
        return Math.max(MIN_READ_NOISE, Math.sqrt(sum));
    }

    public static double combinedGain(double[] w, double[] g, double[] s) {
        double sum = 0;
        for (int i = 0; i < w.length; i++) {
            double t = w[i] / s[i];
            sum += t * t / g[i];
        }
        return 1.0 / sum;
    }

    public static double combinedSky(double gain, double[] w, double[] sky, double[] g, double[] s) {
        double sum = 0;
        for (int i = 0; i < w.length; i++) {
            double t = w[i] * Math.sqrt(Math.max(sky[i], 0) / g[i]) / s[i];
            sum += t * t;
        }
        return gain * sum;
    }

    /**
     * Si el maximo pasa de 50000 ADU reescala los pixeles para que quede en 50000 y divide la
     * ganancia por el mismo factor. El ruido de lectura no cambia (esta en electrones).
     */
    public static RangeLimit limitDynamicRange(FloatProcessor ip, double gain) {
        float[] px = (float[]) ip.getPixels();
        double max = maxOf(px);
        if (max <= MAX_DATA_LEVEL) {
            return new RangeLimit(1.0, gain);
        }
        double factor = MAX_DATA_LEVEL / max;
        for (int p = 0; p < px.length; p++) px[p] = (float) (px[p] * factor);
        return new RangeLimit(factor, gain / factor);
    }

    private static double maxOf(float[] px) {
        double max = Double.NEGATIVE_INFINITY;
        for (float v : px) if (v > max) max = v;
        return max;
    }

    private static void requireFinite(Frame f, String what, double value, boolean positive) {
        if (!Double.isFinite(value) || (positive && value <= 0)) {
            throw new ComputationException(STAGE, "Falta " + what + " valida en " + f.describe() + " (" + value + ")");
        }
    }
}
