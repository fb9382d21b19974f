package com.stackfit.service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Lectores de los ficheros de texto que dejan los motores: listas de estrellas con
 * cabecera de 3 lineas, fotometria de apertura y clasificaciones.
 */
public final class PhotometryFiles {

    public static final int HEADER_LINES = 3;
    /** Magnitudes por encima de esto son "sin medida". */
    public static final double INVALID_MAG = 90.0;

    private PhotometryFiles() {
    }

    public static class Star {
        public final int id;
        public final double x, y;
        public final double mag, err;
        public final double chi, sharp;

        public Star(int id, double x, double y, double mag, double err, double chi, double sharp) {
            this.id = id;
            this.x = x;
            this.y = y;
            this.mag = mag;
            this.err = err;
            this.chi = chi;
            this.sharp = sharp;
        }
    }

    public static class Classification {
        public final int flag;
        public final double probability;

        public Classification(int flag, double probability) {
            this.flag = flag;
            this.probability = probability;
        }
    }

    public static List<String> readHeader(Path file) throws IOException {
        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        List<String> header = new ArrayList<>();
        for (int i = 0; i < HEADER_LINES; i++) header.add(i < lines.size() ? lines.get(i) : "");
        return header;
    }

    /**
     * Lista de estrellas: {@code id x y [mag err [sky niter chi sharp]]}. Las columnas que
     * falten quedan a NaN.
     */
    public static List<Star> readStars(Path file) throws IOException {
        List<Star> stars = new ArrayList<>();
        for (String[] tok : dataRows(file)) {
            Integer id = parseId(tok[0]);
            if (id == null || tok.length < 3) continue;
            double mag = tok.length > 3 ? Double.parseDouble(tok[3]) : Double.NaN;
            double err = tok.length > 4 ? Double.parseDouble(tok[4]) : Double.NaN;
            double chi = tok.length > 7 ? Double.parseDouble(tok[7]) : Double.NaN;
            double sharp = tok.length > 8 ? Double.parseDouble(tok[8]) : Double.NaN;
            stars.add(new Star(id, Double.parseDouble(tok[1]), Double.parseDouble(tok[2]), mag, err, chi, sharp));
        }
        return stars;
    }

    public static Map<Integer, Star> readStarsById(Path file) throws IOException {
        Map<Integer, Star> byId = new LinkedHashMap<>();
        for (Star s : readStars(file)) byId.putIfAbsent(s.id, s);
        return byId;
    }

    public static Set<Integer> readIds(Path file) throws IOException {
        Set<Integer> ids = new LinkedHashSet<>();
        for (String[] tok : dataRows(file)) {
            Integer id = parseId(tok[0]);
            if (id != null) ids.add(id);
        }
        return ids;
    }

    /**
     * Fotometria de apertura: registros separados por linea en blanco, la primera linea
     * {@code id x y mag1 ...}, la segunda {@code sky sigma skew err1 ...}. Devuelve la
     * primera apertura de cada estrella.
     */
    public static Map<Integer, Double> readApertureMags(Path file) throws IOException {
        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        Map<Integer, Double> mags = new LinkedHashMap<>();
        boolean expectStart = true;
        for (int i = HEADER_LINES; i < lines.size(); i++) {
            String l = lines.get(i).trim();
            if (l.isEmpty()) {
                expectStart = true;
                continue;
            }
            if (!expectStart) continue;
            String[] tok = l.split("\\s+");
            Integer id = parseId(tok[0]);
            if (id != null && tok.length > 3) {
                mags.putIfAbsent(id, Double.parseDouble(tok[3]));
            }
            expectStart = false;
        }
        return mags;
    }

    /** Clasificaciones {@code id flag probabilidad}; '#' empieza comentario. */
    public static Map<Integer, Classification> readClassifications(Path file) throws IOException {
        Map<Integer, Classification> out = new LinkedHashMap<>();
        for (String raw : Files.readAllLines(file, StandardCharsets.UTF_8)) {
            String l = raw.trim();
            if (l.isEmpty() || l.startsWith("#")) continue;
            String[] tok = l.split("\\s+");
            Integer id = parseId(tok[0]);
            if (id == null || tok.length < 3) continue;
            out.put(id, new Classification(Integer.parseInt(tok[1]), Double.parseDouble(tok[2])));
        }
        return out;
    }

    private static List<String[]> dataRows(Path file) throws IOException {
        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        List<String[]> rows = new ArrayList<>();
        for (int i = HEADER_LINES; i < lines.size(); i++) {
            String l = lines.get(i).trim();
            if (!l.isEmpty()) rows.add(l.split("\\s+"));
        }
        return rows;
    }

    private static Integer parseId(String tok) {
        try {
            return Integer.parseInt(tok);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
