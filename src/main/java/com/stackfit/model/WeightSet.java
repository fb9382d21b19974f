package com.stackfit.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Peso, escala y offset por frame, en el mismo orden que la TransformList.
 * Un frame neutralizado conserva su posicion con peso 0.
 */
public class WeightSet {

    private final List<FrameWeight> weights;
    private final boolean scaled;

    public WeightSet(List<FrameWeight> weights, boolean scaled) {
        this.weights = Collections.unmodifiableList(new ArrayList<>(weights));
        this.scaled = scaled;
    }

    public List<FrameWeight> all() { return weights; }
    public FrameWeight get(int i) { return weights.get(i); }
    public int size() { return weights.size(); }

    /** true si se aplico escalado fotometrico antes de combinar. */
    public boolean isScaled() { return scaled; }

    public double totalWeight() {
        double w = 0;
        for (FrameWeight fw : weights) w += fw.weight;
        return w;
    }
}
