package com.stackfit.service;

import ij.process.FloatProcessor;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class SkyEstimatorTest {

    static FloatProcessor noisySky(int size, double level, double sigma, long seed) {
        Random rnd = new Random(seed);
        FloatProcessor ip = new FloatProcessor(size, size);
        for (int y = 0; y < size; y++)
            for (int x = 0; x < size; x++) ip.setf(x, y, (float) (level + sigma * rnd.nextGaussian()));
        return ip;
    }

    @Test
    void recoversLevelAndNoiseDespiteStars() {
        FloatProcessor ip = noisySky(64, 100.0, 5.0, 42L);
        for (int i = 0; i < 20; i++) ip.setf(3 * i, 2 * i, 5000f);

        SkyEstimator.SkyStats st = new SkyEstimator().estimate(ip, 65000.0);

        assertEquals(100.0, st.level, 1.0);
        assertEquals(5.0, st.sigma, 1.0);
        assertTrue(st.pixels < 64 * 64);
    }

    @Test
    void saturatedPixelsNeverEnterTheStatistics() {
        FloatProcessor ip = noisySky(32, 200.0, 4.0, 7L);
        for (int x = 0; x < 32; x++) ip.setf(x, 0, 70000f);

        SkyEstimator.SkyStats st = new SkyEstimator().estimate(ip, 65000.0);

        assertEquals(200.0, st.level, 1.0);
        assertTrue(st.sigma < 6.0);
    }

    @Test
    void doesNotModifyTheInput() {
        FloatProcessor ip = noisySky(16, 50.0, 2.0, 1L);
        float before = ip.getf(3, 3);
        new SkyEstimator().estimate(ip, 65000.0);
        assertEquals(before, ip.getf(3, 3), 0f);
    }
}
