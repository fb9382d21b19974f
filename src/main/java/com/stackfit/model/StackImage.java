package com.stackfit.model;

import ij.process.FloatProcessor;

public class StackImage {
    public final FloatProcessor pixels;
    public final CombinedMask mask;
    public final double gain;          // e-/ADU
    public final double readNoise;     // e-
    public final double sky;           // ADU
    public final double rescale;       // 1 si no se aplico el limite de rango dinamico
    public final double maskDataLevel; // valor asignado a los pixeles malos
    public final double highGoodDatum;
    public final int frameCount;
    public final int trimX;
    public final int trimY;

    public StackImage(FloatProcessor pixels, CombinedMask mask, double gain, double readNoise, double sky,
                      double rescale, double maskDataLevel, double highGoodDatum, int frameCount, int trimX, int trimY) {
        this.pixels = pixels;
        this.mask = mask;
        this.gain = gain;
        this.readNoise = readNoise;
        this.sky = sky;
        this.rescale = rescale;
        this.maskDataLevel = maskDataLevel;
        this.highGoodDatum = highGoodDatum;
        this.frameCount = frameCount;
        this.trimX = trimX;
        this.trimY = trimY;
    }
}
