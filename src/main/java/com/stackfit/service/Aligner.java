package com.stackfit.service;

import com.stackfit.error.ComputationException;
import com.stackfit.model.AlignedSet;
import com.stackfit.model.Frame;
import com.stackfit.model.ResampledFrame;
import com.stackfit.model.Transform;
import ij.process.ByteProcessor;
import ij.process.FloatProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Remuestrea frames y mascaras sobre la malla de la referencia (bilineal, 0 fuera) y,
 * opcionalmente, recorta a la huella comun.
 */
public class Aligner {

    private static final Logger log = LoggerFactory.getLogger(Aligner.class);
    private static final String STAGE = "align";

    private final boolean trim;
    private final int workers;

    public Aligner(boolean trim, int workers) {
        this.trim = trim;
        this.workers = workers;
    }

    public AlignedSet alignAll(List<Frame> frames) {
        FloatProcessor ref = frames.get(0).raster();
        int w = ref.getWidth(), h = ref.getHeight();

        List<Callable<ResampledFrame>> jobs = new ArrayList<>();
        for (Frame f : frames) jobs.add(() -> align(f, f.transform, w, h));
        List<ResampledFrame> aligned = FrameJobs.run(STAGE, jobs, workers);

        if (!trim) {
            return new AlignedSet(aligned, 0, 0);
        }
        int[] box = commonFootprint(frames, w, h);
        int x0 = box[0], y0 = box[1], x1 = box[2], y1 = box[3];
        log.info("Recorte comun: x {}..{} y {}..{} (de {}x{})", x0, x1 - 1, y0, y1 - 1, w, h);
        if (x0 == 0 && y0 == 0 && x1 == w && y1 == h) {
            return new AlignedSet(aligned, 0, 0);
        }
        List<ResampledFrame> trimmed = new ArrayList<>();
        for (ResampledFrame r : aligned) {
            r.pixels.setRoi(x0, y0, x1 - x0, y1 - y0);
            r.mask.setRoi(x0, y0, x1 - x0, y1 - y0);
            trimmed.add(new ResampledFrame(r.source, (FloatProcessor) r.pixels.crop(), (ByteProcessor) r.mask.crop()));
        }
        return new AlignedSet(trimmed, x0, y0);
    }

    public ResampledFrame align(Frame frame, Transform t) {
        FloatProcessor src = frame.raster();
        return align(frame, t, src.getWidth(), src.getHeight());
    }

    /**
     * Cada pixel de salida se lleva al frame con la inversa de la transformacion. Los vecinos
     * con peso bilineal 0 no se leen, asi la identidad copia los pixeles tal cual. La mascara
     * de salida es mala si lo es algun vecino con peso o si la muestra cae fuera del frame.
     */
    public ResampledFrame align(Frame frame, Transform t, int width, int height) {
        FloatProcessor src = frame.raster();
        ByteProcessor srcMask = frame.mask();
        int sw = src.getWidth(), sh = src.getHeight();
        float[] in = (float[]) src.getPixels();
        byte[] inMask = (byte[]) srcMask.getPixels();

        float[] out = new float[width * height];
        byte[] outMask = new byte[width * height];

        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                double[] p = t.fromReference(x, y);
                int x0 = (int) Math.floor(p[0]);
                int y0 = (int) Math.floor(p[1]);
                double ax = p[0] - x0;
                double ay = p[1] - y0;

                double value = 0;
                boolean bad = false;
                for (int j = 0; j <= 1; j++) {
                    double wy = j == 0 ? 1 - ay : ay;
                    if (wy == 0) continue;
                    for (int i = 0; i <= 1; i++) {
                        double wx = i == 0 ? 1 - ax : ax;
                        if (wx == 0) continue;
                        int xs = x0 + i, ys = y0 + j;
                        if (xs < 0 || ys < 0 || xs >= sw || ys >= sh) {
                            bad = true; // relleno constante 0
                            continue;
                        }
                        int k = ys * sw + xs;
                        value += wx * wy * in[k];
                        if (inMask[k] != 0) bad = true;
                    }
                }
                out[y * width + x] = (float) value;
                outMask[y * width + x] = (byte) (bad ? 1 : 0);
            }
        }
        ByteProcessor mask = new ByteProcessor(width, height);
        mask.setPixels(outMask);
        return new ResampledFrame(frame, new FloatProcessor(width, height, out), mask);
    }

    /**
     * Interseccion de las huellas de todos los frames como {x0, y0, x1, y1} con x1/y1
     * exclusivos. Con desplazamientos fraccionarios solo entran columnas y filas cuyos
     * vecinos bilineales caen dentro de cada frame.
     */
    static int[] commonFootprint(List<Frame> frames, int width, int height) {
        int x0 = 0, y0 = 0, x1 = width, y1 = height;
        for (Frame f : frames) {
            FloatProcessor px = f.raster();
            x0 = Math.max(x0, (int) Math.ceil(f.transform.dx));
            y0 = Math.max(y0, (int) Math.ceil(f.transform.dy));
            x1 = Math.min(x1, (int) Math.floor(f.transform.dx) + px.getWidth());
            y1 = Math.min(y1, (int) Math.floor(f.transform.dy) + px.getHeight());
        }
        if (x1 <= x0 || y1 <= y0) {
            throw new ComputationException(STAGE, "Los frames no tienen huella comun");
        }
        return new int[]{x0, y0, x1, y1};
    }
}
