package com.stackfit.service;

import ij.process.ByteProcessor;
import ij.process.FloatProcessor;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.Header;
import nom.tam.util.BufferedFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Lectura y escritura de FITS. Es el unico sitio donde se traduce la convencion
 * externa de mascaras (-1 malo / +1 bueno) a la interna (1 malo / 0 bueno).
 */
public class FitsIoService {

    private static final Logger log = LoggerFactory.getLogger(FitsIoService.class);

    public static class FrameHeader {
        public double gain = Double.NaN;
        public double readNoise = Double.NaN;
        public double saturation = Double.NaN;
        public double sky = Double.NaN;
        public double skySigma = Double.NaN;
    }

    public FrameHeader readHeader(Path file) throws IOException {
        FrameHeader meta = new FrameHeader();
        try (Fits fits = new Fits(file.toFile())) {
            Header header = fits.getHDU(0).getHeader();

            // Claves estandar y variantes habituales
            meta.gain = firstOf(header, "GAIN", "EGAIN");
            meta.readNoise = firstOf(header, "RDNOISE", "READNOIS", "RON");
            meta.saturation = firstOf(header, "SATURATE", "SATLEVEL");
            meta.sky = firstOf(header, "SKY", "SKYLEVEL");
            meta.skySigma = firstOf(header, "SKYSIG", "SKYSIGMA");
        } catch (FitsException e) {
            throw new IOException("Cabecera FITS ilegible: " + file, e);
        }
        return meta;
    }

    public FloatProcessor readImage(Path file) throws IOException {
        try (Fits fits = new Fits(file.toFile())) {
            BasicHDU<?> hdu = fits.getHDU(0);
            Header header = hdu.getHeader();
            double bzero = header.getDoubleValue("BZERO", 0.0);
            double bscale = header.getDoubleValue("BSCALE", 1.0);
            float[][] rows = toFloat(hdu.getKernel(), bzero, bscale);
            if (rows.length == 0) {
                throw new IOException("El HDU primario no contiene una imagen 2D: " + file);
            }
            int h = rows.length, w = rows[0].length;
            float[] px = new float[w * h];
            for (int y = 0; y < h; y++) System.arraycopy(rows[y], 0, px, y * w, w);
            log.debug("Leido {} ({}x{})", file.getFileName(), w, h);
            return new FloatProcessor(w, h, px);
        } catch (FitsException e) {
            throw new IOException("FITS ilegible: " + file, e);
        }
    }

    /** Lee una mascara externa (+1 bueno, -1 o 0 malo) y la devuelve con 1=malo. */
    public ByteProcessor readMask(Path file) throws IOException {
        FloatProcessor ext = readImage(file);
        int w = ext.getWidth(), h = ext.getHeight();
        ByteProcessor mask = new ByteProcessor(w, h);
        float[] src = (float[]) ext.getPixels();
        byte[] dst = (byte[]) mask.getPixels();
        for (int i = 0; i < src.length; i++) {
            dst[i] = (byte) (src[i] > 0 ? 0 : 1);
        }
        return mask;
    }

    public void writeImage(Path file, FloatProcessor ip, Map<String, Object> cards) throws IOException {
        int w = ip.getWidth(), h = ip.getHeight();
        float[] px = (float[]) ip.getPixels();
        float[][] rows = new float[h][w];
        for (int y = 0; y < h; y++) System.arraycopy(px, y * w, rows[y], 0, w);
        write(file, rows, cards);
    }

    /** Escribe una mascara interna (1=malo) en la convencion externa (-1 malo / +1 bueno). */
    public void writeMask(Path file, ByteProcessor mask) throws IOException {
        int w = mask.getWidth(), h = mask.getHeight();
        byte[] px = (byte[]) mask.getPixels();
        short[][] rows = new short[h][w];
        for (int y = 0; y < h; y++)
            for (int x = 0; x < w; x++)
                rows[y][x] = (short) (px[y * w + x] != 0 ? -1 : 1);
        write(file, rows, Map.of());
    }

    private void write(Path file, Object data, Map<String, Object> cards) throws IOException {
        // BufferedFile no trunca: un fichero previo mas largo dejaria basura al final
        Files.deleteIfExists(file);
        try (Fits fits = new Fits(); BufferedFile out = new BufferedFile(file.toFile(), "rw")) {
            BasicHDU<?> hdu = Fits.makeHDU(data);
            Header header = hdu.getHeader();
            for (Map.Entry<String, Object> c : cards.entrySet()) {
                Object v = c.getValue();
                if (v instanceof Integer) header.addValue(c.getKey(), ((Integer) v).intValue(), "");
                else if (v instanceof Number) header.addValue(c.getKey(), ((Number) v).doubleValue(), "");
                else header.addValue(c.getKey(), String.valueOf(v), "");
            }
            fits.addHDU(hdu);
            fits.write(out);
        } catch (FitsException e) {
            throw new IOException("No se pudo escribir " + file, e);
        }
    }

    private static double firstOf(Header header, String... keys) {
        for (String k : keys) {
            if (header.containsKey(k)) return header.getDoubleValue(k, Double.NaN);
        }
        return Double.NaN;
    }

    private static float[][] toFloat(Object k, double bzero, double bscale) {
        if (k instanceof short[][]) {
            short[][] s = (short[][]) k;
            float[][] d = new float[s.length][s.length == 0 ? 0 : s[0].length];
            for (int i = 0; i < s.length; i++)
                for (int j = 0; j < s[i].length; j++) d[i][j] = (float) (bzero + bscale * s[i][j]);
            return d;
        }
        if (k instanceof int[][]) {
            int[][] s = (int[][]) k;
            float[][] d = new float[s.length][s.length == 0 ? 0 : s[0].length];
            for (int i = 0; i < s.length; i++)
                for (int j = 0; j < s[i].length; j++) d[i][j] = (float) (bzero + bscale * s[i][j]);
            return d;
        }
        if (k instanceof byte[][]) {
            byte[][] s = (byte[][]) k;
            float[][] d = new float[s.length][s.length == 0 ? 0 : s[0].length];
            for (int i = 0; i < s.length; i++)
                for (int j = 0; j < s[i].length; j++) d[i][j] = (float) (bzero + bscale * (s[i][j] & 0xFF));
            return d;
        }
        if (k instanceof float[][]) {
            float[][] f = (float[][]) k;
            if (bzero == 0.0 && bscale == 1.0) return f;
            float[][] d = new float[f.length][f.length == 0 ? 0 : f[0].length];
            for (int i = 0; i < f.length; i++)
                for (int j = 0; j < f[i].length; j++) d[i][j] = (float) (bzero + bscale * f[i][j]);
            return d;
        }
        if (k instanceof double[][]) {
            double[][] f = (double[][]) k;
            float[][] d = new float[f.length][f.length == 0 ? 0 : f[0].length];
            for (int i = 0; i < f.length; i++)
                for (int j = 0; j < f[i].length; j++) d[i][j] = (float) (bzero + bscale * f[i][j]);
            return d;
        }
        return new float[0][0];
    }
}
