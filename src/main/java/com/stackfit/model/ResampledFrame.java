package com.stackfit.model;

import ij.process.ByteProcessor;
import ij.process.FloatProcessor;

public class ResampledFrame {
    public final Frame source;
    public final FloatProcessor pixels;
    public final ByteProcessor mask; // 1=malo

    public ResampledFrame(Frame source, FloatProcessor pixels, ByteProcessor mask) {
        this.source = source;
        this.pixels = pixels;
        this.mask = mask;
    }

    public int width() { return pixels.getWidth(); }
    public int height() { return pixels.getHeight(); }
}
