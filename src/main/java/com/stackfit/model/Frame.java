package com.stackfit.model;

import com.stackfit.error.PipelineException;
import ij.process.ByteProcessor;
import ij.process.FloatProcessor;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Una exposicion. Los valores de cabecera y el cielo se capturan al inicio de la
 * ejecucion; los pixeles y la mascara se leen la primera vez que se piden.
 */
public class Frame {

    public interface Loader<T> {
        T load() throws IOException;
    }

    public final String id;
    public final Path imagePath;
    public final double gain;       // e-/ADU
    public final double readNoise;  // e-
    public final double sky;        // ADU
    public final double skySigma;   // ADU
    public final double saturation; // ADU
    public final Transform transform;

    private final Loader<FloatProcessor> rasterLoader;
    private final Loader<ByteProcessor> maskLoader;
    private FloatProcessor raster;
    private ByteProcessor mask;

    public Frame(String id, Path imagePath, double gain, double readNoise, double sky, double skySigma,
                 double saturation, Transform transform,
                 Loader<FloatProcessor> rasterLoader, Loader<ByteProcessor> maskLoader) {
        this.id = id;
        this.imagePath = imagePath;
        this.gain = gain;
        this.readNoise = readNoise;
        this.sky = sky;
        this.skySigma = skySigma;
        this.saturation = saturation;
        this.transform = transform;
        this.rasterLoader = rasterLoader;
        this.maskLoader = maskLoader;
    }

    /** Frame en memoria, sin fichero detras. */
    public static Frame inMemory(String id, FloatProcessor raster, ByteProcessor mask, double gain, double readNoise,
                                 double sky, double skySigma, double saturation, Transform transform) {
        return new Frame(id, null, gain, readNoise, sky, skySigma, saturation, transform, () -> raster, () -> mask);
    }

    public synchronized FloatProcessor raster() {
        if (raster == null) {
            try {
                raster = rasterLoader.load();
            } catch (IOException e) {
                throw new PipelineException("load", "No se pudieron leer los pixeles de " + describe(), e);
            }
        }
        return raster;
    }

    /** Mascara 1=malo/0=bueno con la geometria del raster original. */
    public synchronized ByteProcessor mask() {
        if (mask == null) {
            try {
                mask = maskLoader.load();
            } catch (IOException e) {
                throw new PipelineException("load", "No se pudo leer la mascara de " + describe(), e);
            }
            if (mask == null) {
                FloatProcessor px = raster();
                mask = new ByteProcessor(px.getWidth(), px.getHeight());
            }
        }
        return mask;
    }

    public String describe() {
        return imagePath != null ? imagePath.toString() : id;
    }

    @Override
    public String toString() {
        return id;
    }
}
