package com.stackfit.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class AlignedSet {
    private final List<ResampledFrame> frames;
    public final int trimX; // origen del recorte en la referencia
    public final int trimY;

    public AlignedSet(List<ResampledFrame> frames, int trimX, int trimY) {
        this.frames = Collections.unmodifiableList(new ArrayList<>(frames));
        this.trimX = trimX;
        this.trimY = trimY;
    }

    public List<ResampledFrame> frames() { return frames; }
    public ResampledFrame get(int i) { return frames.get(i); }
    public int size() { return frames.size(); }
    public int width() { return frames.get(0).width(); }
    public int height() { return frames.get(0).height(); }
}
