package com.stackfit.model;

import ij.process.ByteProcessor;
import ij.process.FloatProcessor;

/**
 * Mascara combinada (1=malo) y mapa de pesos (fraccion del peso total que contribuyo).
 */
public class CombinedMask {

    public enum Policy {
        /** Sin escalado: malo si lo es en al menos un frame que contribuye. */
        ANY_BAD,
        /** Con escalado: malo solo si el combinador lo rechazo en todos los frames. */
        ALL_BAD
    }

    public final Policy policy;
    public final ByteProcessor bad;
    public final FloatProcessor weightMap;

    public CombinedMask(Policy policy, ByteProcessor bad, FloatProcessor weightMap) {
        this.policy = policy;
        this.bad = bad;
        this.weightMap = weightMap;
    }

    public boolean isBad(int x, int y) {
        return bad.get(x, y) != 0;
    }

    public int badCount() {
        byte[] px = (byte[]) bad.getPixels();
        int n = 0;
        for (byte b : px) if (b != 0) n++;
        return n;
    }
}
