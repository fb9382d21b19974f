package com.stackfit.model;

public class RejectionMap {
    private final byte[][] rejected; // [frame][pixel], 1 si no entro en la suma
    public final int width;
    public final int height;

    public RejectionMap(int frames, int width, int height) {
        this.rejected = new byte[frames][width * height];
        this.width = width;
        this.height = height;
    }

    public void reject(int frame, int pixel) {
        rejected[frame][pixel] = 1;
    }

    public boolean isRejected(int frame, int pixel) {
        return rejected[frame][pixel] != 0;
    }

    public int frames() {
        return rejected.length;
    }
}
