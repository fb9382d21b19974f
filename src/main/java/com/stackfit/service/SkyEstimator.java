package com.stackfit.service;

import ij.measure.Measurements;
import ij.process.FloatProcessor;
import ij.process.ImageProcessor;
import ij.process.ImageStatistics;

/**
 * Nivel de cielo y sigma por recorte iterativo alrededor de la mediana.
 */
public class SkyEstimator {

    public static class SkyStats {
        public final double level;
        public final double sigma;
        public final long pixels;

        public SkyStats(double level, double sigma, long pixels) {
            this.level = level;
            this.sigma = sigma;
            this.pixels = pixels;
        }
    }

    private static final int MEASUREMENTS = Measurements.MEDIAN | Measurements.STD_DEV | Measurements.AREA;
    private static final int MIN_PIXELS = 16;

    private final double clipSigma;
    private final int maxIterations;

    public SkyEstimator() {
        this(3.0, 10);
    }

    public SkyEstimator(double clipSigma, int maxIterations) {
        this.clipSigma = clipSigma;
        this.maxIterations = maxIterations;
    }

    /**
     * @param saturation pixeles por encima no entran en la estadistica
     */
    public SkyStats estimate(FloatProcessor ip, double saturation) {
        FloatProcessor work = (FloatProcessor) ip.duplicate();
        double hi = Double.isFinite(saturation) ? saturation : Float.MAX_VALUE;
        work.setThreshold(-Float.MAX_VALUE, hi, ImageProcessor.NO_LUT_UPDATE);
        ImageStatistics st = ImageStatistics.getStatistics(work, MEASUREMENTS | Measurements.LIMIT, null);
        double level = st.median;
        double sigma = st.stdDev;
        long n = st.pixelCount;

        for (int i = 0; i < maxIterations && sigma > 0; i++) {
            double lo = level - clipSigma * sigma;
            double up = Math.min(hi, level + clipSigma * sigma);
            work.setThreshold(lo, up, ImageProcessor.NO_LUT_UPDATE);
            st = ImageStatistics.getStatistics(work, MEASUREMENTS | Measurements.LIMIT, null);
            if (st.pixelCount < MIN_PIXELS) break;
            boolean converged = st.pixelCount == n;
            level = st.median;
            sigma = st.stdDev;
            n = st.pixelCount;
            if (converged) break;
        }
        return new SkyStats(level, sigma, n);
    }
}
