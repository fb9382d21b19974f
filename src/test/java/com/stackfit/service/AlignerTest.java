package com.stackfit.service;

import com.stackfit.error.ComputationException;
import com.stackfit.model.AlignedSet;
import com.stackfit.model.Frame;
import com.stackfit.model.ResampledFrame;
import com.stackfit.model.Transform;
import ij.process.ByteProcessor;
import ij.process.FloatProcessor;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AlignerTest {

    private final Aligner aligner = new Aligner(false, 1);

    private static FloatProcessor ramp(int w, int h) {
        return TestFrames.raster(w, h, (x, y) -> 3.0 * x + 17.0 * y + 0.25);
    }

    @Test
    void identityTransformCopiesPixelsExactly() {
        FloatProcessor src = TestFrames.raster(6, 5, (x, y) -> Math.sin(x * 1.3 + y * 0.7) * 1000);
        ByteProcessor mask = new ByteProcessor(6, 5);
        mask.set(4, 3, 1);
        Frame f = TestFrames.frame("a", src, mask, Transform.identity(), 2, 5, 100, 10);

        ResampledFrame r = aligner.align(f, Transform.identity());

        assertArrayEquals((float[]) src.getPixels(), (float[]) r.pixels.getPixels());
        assertArrayEquals((byte[]) mask.getPixels(), (byte[]) r.mask.getPixels());
    }

    @Test
    void integerShiftMovesPixelsAndMarksUncoveredArea() {
        FloatProcessor src = ramp(6, 5);
        Frame f = TestFrames.frame("a", src, Transform.shift(2, 1));

        ResampledFrame r = aligner.align(f, f.transform);

        assertEquals(src.getf(1, 1), r.pixels.getf(3, 2), 0f);
        assertEquals(src.getf(3, 3), r.pixels.getf(5, 4), 0f);
        assertEquals(0f, r.pixels.getf(0, 0), 0f);
        assertEquals(1, r.mask.get(0, 0));
        assertEquals(1, r.mask.get(1, 4));
        assertEquals(0, r.mask.get(2, 1));
    }

    @Test
    void halfPixelShiftInterpolatesAndSpreadsBadPixels() {
        FloatProcessor src = ramp(6, 5);
        ByteProcessor mask = new ByteProcessor(6, 5);
        mask.set(2, 2, 1);
        Frame f = TestFrames.frame("a", src, mask, Transform.shift(0.5, 0), 2, 5, 100, 10);

        ResampledFrame r = aligner.align(f, f.transform);

        // x_src = x - 0.5: media de las columnas x-1 y x
        assertEquals((src.getf(2, 1) + src.getf(3, 1)) / 2f, r.pixels.getf(3, 1), 1e-4f);
        assertEquals(1, r.mask.get(2, 2));
        assertEquals(1, r.mask.get(3, 2));
        assertEquals(0, r.mask.get(4, 2));
        assertEquals(0, r.mask.get(2, 1));
    }

    @Test
    void alignmentNeverClearsABadPixel() {
        FloatProcessor src = ramp(8, 8);
        ByteProcessor mask = new ByteProcessor(8, 8);
        mask.set(3, 4, 1);
        mask.set(6, 1, 1);
        Frame f = TestFrames.frame("a", src, mask, Transform.shift(0.3, -0.6), 2, 5, 100, 10);

        ResampledFrame r = aligner.align(f, f.transform);

        int badIn = 0, badOut = 0;
        for (int i = 0; i < 64; i++) {
            if (((byte[]) mask.getPixels())[i] != 0) badIn++;
            if (((byte[]) r.mask.getPixels())[i] != 0) badOut++;
        }
        assertTrue(badOut >= badIn);
        double[] p = f.transform.toReference(3, 4);
        assertEquals(1, r.mask.get((int) Math.floor(p[0]), (int) Math.floor(p[1])));
    }

    @Test
    void alignAllWithoutTrimKeepsReferenceShape() {
        List<Frame> frames = List.of(
                TestFrames.frame("f1", ramp(10, 8), Transform.identity()),
                TestFrames.frame("f2", ramp(10, 8), Transform.shift(2, 1)));

        AlignedSet set = aligner.alignAll(frames);

        assertEquals(10, set.width());
        assertEquals(8, set.height());
        assertEquals(0, set.trimX);
        assertEquals(0, set.trimY);
    }

    @Test
    void trimCutsToTheCommonFootprint() {
        List<Frame> frames = List.of(
                TestFrames.frame("f1", ramp(10, 8), Transform.identity()),
                TestFrames.frame("f2", ramp(10, 8), Transform.shift(2, 1)),
                TestFrames.frame("f3", ramp(10, 8), Transform.shift(-1, 0)));

        AlignedSet set = new Aligner(true, 2).alignAll(frames);

        assertEquals(2, set.trimX);
        assertEquals(1, set.trimY);
        assertEquals(7, set.width());
        assertEquals(7, set.height());
        // (0,0) del recorte es (2,1) de la referencia
        assertEquals(frames.get(0).raster().getf(2, 1), set.get(0).pixels.getf(0, 0), 0f);
        for (int i = 0; i < set.size(); i++) {
            assertEquals(0, set.get(i).mask.get(0, 0));
        }
    }

    @Test
    void fractionalShiftsDropEdgesSampledOutsideAFrame() {
        List<Frame> frames = List.of(
                TestFrames.frame("f1", ramp(10, 8), Transform.identity()),
                TestFrames.frame("f2", ramp(10, 8), Transform.shift(0.4, 0)),
                TestFrames.frame("f3", ramp(10, 8), Transform.shift(-0.4, 0.6)));

        AlignedSet set = new Aligner(true, 1).alignAll(frames);

        assertEquals(1, set.trimX);
        assertEquals(1, set.trimY);
        assertEquals(8, set.width());
        assertEquals(7, set.height());
        for (int i = 0; i < set.size(); i++) {
            for (int y = 0; y < set.height(); y++)
                for (int x = 0; x < set.width(); x++)
                    assertEquals(0, set.get(i).mask.get(x, y), "frame " + i + " en " + x + "," + y);
        }
    }

    @Test
    void framesWithoutOverlapFail() {
        List<Frame> frames = List.of(
                TestFrames.frame("f1", ramp(4, 4), Transform.identity()),
                TestFrames.frame("f2", ramp(4, 4), Transform.shift(10, 0)));
        assertThrows(ComputationException.class, () -> new Aligner(true, 1).alignAll(frames));
    }
}
