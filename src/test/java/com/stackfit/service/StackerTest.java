package com.stackfit.service;

import com.stackfit.error.ComputationException;
import com.stackfit.model.AlignedSet;
import com.stackfit.model.Frame;
import com.stackfit.model.StackImage;
import com.stackfit.model.Transform;
import com.stackfit.model.WeightSet;
import ij.process.ByteProcessor;
import ij.process.FloatProcessor;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StackerTest {

    private final Stacker stacker = new Stacker(new MaskCombiner(), 3.0, 3.0, 5);

    @Test
    void readNoiseGrowsWithAnyInputAndHasAFloor() {
        double[] w = {0.5, 0.3, 0.2};
        double[] s = {1, 1, 1};
        double base = Stacker.combinedReadNoise(w, new double[]{3, 4, 5}, s);
        double more = Stacker.combinedReadNoise(w, new double[]{3, 6, 5}, s);

        assertTrue(more > base);
        assertEquals(Math.sqrt(1.5 * 1.5 + 1.2 * 1.2 + 1.0), base, 1e-12);
        assertEquals(0.01, Stacker.combinedReadNoise(w, new double[]{0, 0, 0}, s), 0.0);
    }

    @Test
    void gainOfEqualFramesAveragedIsMultiplied() {
        double third = 1.0 / 3;
        double gain = Stacker.combinedGain(new double[]{third, third, third}, new double[]{2, 2, 2},
                new double[]{1, 1, 1});
        assertEquals(6.0, gain, 1e-9);
    }

    @Test
    void dynamicRangeIsCappedAndGainFollows() {
        FloatProcessor ip = new FloatProcessor(3, 1, new float[]{100f, 80000f, 40000f});

        Stacker.RangeLimit limit = Stacker.limitDynamicRange(ip, 2.0);

        assertEquals(0.625, limit.factor, 1e-12);
        assertEquals(3.2, limit.gain, 1e-12);
        assertEquals(50000f, ip.getf(1, 0), 0.01f);
        assertEquals(62.5f, ip.getf(0, 0), 1e-3f);
    }

    @Test
    void dynamicRangeUntouchedBelowLimit() {
        FloatProcessor ip = new FloatProcessor(2, 1, new float[]{100f, 40000f});
        Stacker.RangeLimit limit = Stacker.limitDynamicRange(ip, 2.0);
        assertEquals(1.0, limit.factor, 0.0);
        assertEquals(2.0, limit.gain, 0.0);
        assertEquals(40000f, ip.getf(1, 0), 0f);
    }

    @Test
    void weightedStackOfShiftedFramesRecoversTheField() {
        int[][] shifts = {{0, 0}, {2, 1}, {-1, 2}};
        double[] base = {0, 5, -3};
        double[] gains = {1.5, 2.0, 2.5};
        double[] skies = {100, 120, 90};
        Frame[] frames = new Frame[3];
        for (int i = 0; i < 3; i++) {
            int dx = shifts[i][0], dy = shifts[i][1];
            double b = base[i];
            FloatProcessor px = TestFrames.raster(10, 10, (x, y) -> b + field(x + dx, y + dy));
            frames[i] = TestFrames.frame("f" + i, px, new ByteProcessor(10, 10), Transform.shift(dx, dy), gains[i],
                    5.0, skies[i], 10.0);
        }
        AlignedSet aligned = new Aligner(true, 1).alignAll(List.of(frames));
        WeightSet weights = TestFrames.weights(false, 0.5, 0.3, 0.2);

        StackImage stack = stacker.stack(aligned, weights);

        double[] w = {0.5, 0.3, 0.2};
        double gain = 1.0 / (0.25 / 1.5 + 0.09 / 2.0 + 0.04 / 2.5);
        double sum = 0;
        for (int i = 0; i < 3; i++) {
            double t = w[i] * Math.sqrt(skies[i] / gains[i]);
            sum += t * t;
        }
        double combSky = gain * sum;
        double offset = 0.5 * 0 + 0.3 * 5 + 0.2 * -3;

        assertEquals(2, stack.trimX);
        assertEquals(2, stack.trimY);
        assertEquals(7, stack.pixels.getWidth());
        assertEquals(8, stack.pixels.getHeight());
        assertEquals(gain, stack.gain, 1e-9);
        assertEquals(combSky, stack.sky, 1e-9);
        assertEquals(5.0 * Math.sqrt(0.38), stack.readNoise, 1e-9);
        assertEquals(1.0, stack.rescale, 0.0);
        assertEquals(3, stack.frameCount);
        assertEquals(0, stack.mask.badCount());
        for (int v = 0; v < 8; v++) {
            for (int u = 0; u < 7; u++) {
                double expected = offset + field(u + 2, v + 2) + combSky;
                assertEquals(expected, stack.pixels.getf(u, v), 1e-3, "pixel " + u + "," + v);
            }
        }
    }

    @Test
    void scalesAndZeroOffsetsBringFramesToACommonLevel() {
        double[] w = {0.5, 0.3, 0.2};
        double[] scales = {1.0, 2.0, 0.5};
        double[] skies = {100, 120, 90};
        double[] gains = {1.5, 2.0, 2.5};
        double[] rdnoise = {4.0, 6.0, 5.0};
        Frame[] frames = new Frame[3];
        for (int i = 0; i < 3; i++) {
            double sky = skies[i], sc = scales[i];
            // el mismo campo visto con otra transparencia y otro fondo
            FloatProcessor px = TestFrames.raster(4, 3, (x, y) -> sky + (10 * x + y) / sc);
            frames[i] = TestFrames.frame("f" + i, px, new ByteProcessor(4, 3), Transform.identity(), gains[i],
                    rdnoise[i], skies[i], 10.0);
        }
        WeightSet weights = TestFrames.weights(true, w, scales, new double[]{-100, -120, -90});

        StackImage stack = stacker.stack(TestFrames.aligned(frames), weights);

        double gain = 1.0 / (0.25 / 1.5 + 0.0225 / 2.0 + 0.16 / 2.5);
        double combSky = gain * (0.25 * 100 / 1.5 + 0.09 * 120 / (2.0 * 4.0) + 0.04 * 90 / (2.5 * 0.25));
        assertEquals(gain, stack.gain, 1e-9);
        assertEquals(combSky, stack.sky, 1e-9);
        assertEquals(Math.sqrt(2.0 * 2.0 + 0.9 * 0.9 + 2.0 * 2.0), stack.readNoise, 1e-9);
        assertEquals(0, stack.mask.badCount());
        for (int y = 0; y < 3; y++) {
            for (int x = 0; x < 4; x++) {
                assertEquals(10 * x + y + combSky, stack.pixels.getf(x, y), 1e-3, "pixel " + x + "," + y);
            }
        }
    }

    @Test
    void badPixelsAreRaisedAboveEveryGoodValue() {
        Frame[] frames = new Frame[3];
        for (int i = 0; i < 3; i++) {
            ByteProcessor mask = new ByteProcessor(4, 4);
            if (i == 1) mask.set(1, 1, 1);
            frames[i] = TestFrames.frame("f" + i, TestFrames.raster(4, 4, (x, y) -> 100 + x + 4 * y), mask,
                    Transform.identity(), 2.0, 5.0, 0.0, 10.0);
        }
        StackImage stack = stacker.stack(TestFrames.aligned(frames), TestFrames.weights(false, 0.4, 0.3, 0.3));

        assertTrue(stack.mask.isBad(1, 1));
        assertEquals((float) stack.maskDataLevel, stack.pixels.getf(1, 1), 0f);
        assertEquals(stack.maskDataLevel - 5000.0, stack.highGoodDatum, 1e-9);
        for (int y = 0; y < 4; y++) {
            for (int x = 0; x < 4; x++) {
                if (x == 1 && y == 1) continue;
                assertTrue(stack.pixels.getf(x, y) <= stack.maskDataLevel - 10000.0 + 1e-3);
            }
        }
    }

    @Test
    void outlierIsClippedAndTheRestRenormalized() {
        Stacker tight = new Stacker(new MaskCombiner(), 1.5, 1.5, 5);
        Frame[] frames = new Frame[5];
        for (int i = 0; i < 5; i++) {
            FloatProcessor px = TestFrames.raster(2, 2, (x, y) -> 10.0);
            if (i == 4) px.setf(0, 0, 1000f);
            frames[i] = TestFrames.frame("f" + i, px, new ByteProcessor(2, 2), Transform.identity(), 1.0, 5.0, 0.0,
                    10.0);
        }

        StackImage stack = tight.stack(TestFrames.aligned(frames), TestFrames.weights(true, 0.2, 0.2, 0.2, 0.2, 0.2));

        assertEquals(10f, stack.pixels.getf(0, 0), 1e-4f);
        assertEquals(10f, stack.pixels.getf(1, 1), 1e-4f);
        assertFalse(stack.mask.isBad(0, 0));
        assertEquals(0.8f, stack.mask.weightMap.getf(0, 0), 1e-6f);
        assertEquals(1.0f, stack.mask.weightMap.getf(1, 0), 1e-6f);
    }

    @Test
    void sigmaClipLeavesFewerThanThreeValuesAlone() {
        double[] v = {1, 1000};
        boolean[] ok = {true, true};
        stacker.sigmaClip(v, ok);
        assertTrue(ok[0] && ok[1]);
    }

    @Test
    void brightStackIsRescaledToTheDataCeiling() {
        Frame[] frames = new Frame[2];
        for (int i = 0; i < 2; i++) {
            frames[i] = TestFrames.frame("f" + i, TestFrames.raster(2, 2, (x, y) -> 90000.0), new ByteProcessor(2, 2),
                    Transform.identity(), 2.0, 5.0, 0.0, 10.0);
        }

        StackImage stack = stacker.stack(TestFrames.aligned(frames), TestFrames.weights(false, 0.5, 0.5));

        double factor = 50000.0 / 90000.0;
        assertEquals(factor, stack.rescale, 1e-6);
        assertEquals(50000f, stack.pixels.getf(0, 0), 0.05f);
        assertEquals(4.0 / factor, stack.gain, 1e-3);
    }

    @Test
    void missingGainIsAnErrorNamingTheFrame() {
        Frame good = TestFrames.frame("good", new FloatProcessor(2, 2), Transform.identity());
        Frame bad = TestFrames.frame("nogain", new FloatProcessor(2, 2), new ByteProcessor(2, 2), Transform.identity(),
                Double.NaN, 5.0, 100.0, 10.0);
        ComputationException e = assertThrows(ComputationException.class,
                () -> stacker.stack(TestFrames.aligned(good, bad), TestFrames.weights(false, 0.5, 0.5)));
        assertTrue(e.getMessage().contains("nogain"));
    }

    @Test
    void zeroTotalWeightIsAnError() {
        Frame a = TestFrames.frame("a", new FloatProcessor(2, 2), Transform.identity());
        Frame b = TestFrames.frame("b", new FloatProcessor(2, 2), Transform.identity());
        assertThrows(ComputationException.class,
                () -> stacker.stack(TestFrames.aligned(a, b), TestFrames.weights(false, 0.0, 0.0)));
    }

    @Test
    void weightCountMustMatchFrames() {
        Frame a = TestFrames.frame("a", new FloatProcessor(2, 2), Transform.identity());
        assertThrows(ComputationException.class,
                () -> stacker.stack(TestFrames.aligned(a), TestFrames.weights(false, 0.5, 0.5)));
    }

    private static double field(int x, int y) {
        return 10.0 * x + y;
    }
}
