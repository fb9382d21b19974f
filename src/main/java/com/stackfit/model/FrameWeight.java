package com.stackfit.model;

public class FrameWeight {
    public final String frameId;
    public final double weight;
    public final double scale;
    public final double zero;

    public FrameWeight(String frameId, double weight, double scale, double zero) {
        this.frameId = frameId;
        this.weight = weight;
        this.scale = scale;
        this.zero = zero;
    }

    public boolean contributes() {
        return weight > 0;
    }
}
