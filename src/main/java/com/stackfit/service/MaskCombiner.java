package com.stackfit.service;

import com.stackfit.model.AlignedSet;
import com.stackfit.model.CombinedMask;
import com.stackfit.model.RejectionMap;
import com.stackfit.model.WeightSet;
import ij.process.ByteProcessor;
import ij.process.FloatProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Une las mascaras de los frames en una sola. Sin escalado manda la mascara de cada frame
 * (malo si lo es en uno); con escalado manda el combinador (malo solo si lo rechazo en
 * todos), porque ahi el peso por frame ya se aplico. Las dos reglas se mantienen distintas.
 */
public class MaskCombiner {

    private static final Logger log = LoggerFactory.getLogger(MaskCombiner.class);

    public static CombinedMask.Policy policyFor(WeightSet weights) {
        return weights.isScaled() ? CombinedMask.Policy.ALL_BAD : CombinedMask.Policy.ANY_BAD;
    }

    public CombinedMask combine(AlignedSet aligned, WeightSet weights, RejectionMap rejections,
                                CombinedMask.Policy policy) {
        int w = aligned.width(), h = aligned.height(), n = aligned.size();
        double total = weights.totalWeight();
        byte[] bad = new byte[w * h];
        float[] wmap = new float[w * h];

        byte[][] masks = new byte[n][];
        for (int i = 0; i < n; i++) masks[i] = (byte[]) aligned.get(i).mask.getPixels();

        for (int p = 0; p < w * h; p++) {
            boolean anyBad = false;
            boolean allRejected = true;
            double accepted = 0;
            for (int i = 0; i < n; i++) {
                double wi = weights.get(i).weight;
                if (wi <= 0) continue;
                if (masks[i][p] != 0) anyBad = true;
                if (rejections.isRejected(i, p)) continue;
                allRejected = false;
                accepted += wi;
            }
            boolean isBad = policy == CombinedMask.Policy.ANY_BAD ? anyBad : allRejected;
            bad[p] = (byte) (isBad ? 1 : 0);
            wmap[p] = (float) (total > 0 ? accepted / total : 0);
        }

        ByteProcessor badIp = new ByteProcessor(w, h);
        badIp.setPixels(bad);
        CombinedMask mask = new CombinedMask(policy, badIp, new FloatProcessor(w, h, wmap));
        log.info("Mascara combinada ({}): {} pixeles malos de {}", policy, mask.badCount(), w * h);
        return mask;
    }
}
