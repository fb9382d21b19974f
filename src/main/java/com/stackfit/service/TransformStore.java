package com.stackfit.service;

import com.stackfit.error.ConfigurationException;
import com.stackfit.model.Transform;
import com.stackfit.model.TransformList;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Transformaciones de cada frame respecto a la referencia, tal como las deja el
 * emparejado de estrellas. Una fila por frame:
 * {@code 'nombre' dx dy a11 a21 a12 a22 [radioAjuste] [resto]}.
 */
public class TransformStore {

    private static final String STAGE = "transforms";
    private static final Pattern ROW = Pattern.compile("^\\s*(['\"])(.+?)\\1\\s+(.*)$");

    private final TransformList list;

    public TransformStore(TransformList list) {
        if (list.size() == 0) {
            throw new ConfigurationException(STAGE, "La lista de transformaciones esta vacia");
        }
        Transform ref = list.reference().transform;
        if (!ref.isIdentity()) {
            throw new ConfigurationException(STAGE, "La fila 0 (" + list.reference().fileName
                    + ") debe ser la identidad y es " + ref);
        }
        for (TransformList.Entry e : list.entries()) {
            if (Math.abs(e.transform.determinant()) < 1e-12) {
                throw new ConfigurationException(STAGE, "Transformacion singular para " + e.fileName);
            }
        }
        this.list = list;
    }

    public static TransformStore load(Path file) {
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConfigurationException(STAGE, "No se pudo leer " + file, e);
        }
        List<TransformList.Entry> entries = new ArrayList<>();
        int lineNo = 0;
        for (String l : lines) {
            lineNo++;
            if (l.isBlank()) continue;
            entries.add(parseRow(l, file, lineNo));
        }
        return new TransformStore(new TransformList(entries));
    }

    static TransformList.Entry parseRow(String line, Path file, int lineNo) {
        Matcher m = ROW.matcher(line);
        if (!m.matches()) {
            throw new ConfigurationException(STAGE, file + ":" + lineNo + " sin nombre de fichero entre comillas");
        }
        String name = m.group(2).trim();
        String[] tok = m.group(3).trim().split("\\s+");
        if (tok.length < 6) {
            throw new ConfigurationException(STAGE, file + ":" + lineNo + " necesita dx dy y 4 coeficientes");
        }
        double[] c = new double[6];
        try {
            for (int i = 0; i < 6; i++) c[i] = Double.parseDouble(tok[i]);
        } catch (NumberFormatException e) {
            throw new ConfigurationException(STAGE, file + ":" + lineNo + " coeficiente no numerico", e);
        }
        double fitRadius = 0;
        int next = 6;
        if (tok.length > 6) {
            try {
                fitRadius = Double.parseDouble(tok[6]);
                next = 7;
            } catch (NumberFormatException ignored) {
                // la septima columna es parte del resto
            }
        }
        String trailing = tok.length > next ? String.join(" ", java.util.Arrays.copyOfRange(tok, next, tok.length)) : "";
        return new TransformList.Entry(name, new Transform(c[0], c[1], c[2], c[3], c[4], c[5], fitRadius), trailing);
    }

    public TransformList list() {
        return list;
    }

    public int size() {
        return list.size();
    }

    public Transform transform(int i) {
        return list.get(i).transform;
    }

    public double[] toReference(int frame, double x, double y) {
        return transform(frame).toReference(x, y);
    }

    public double[] fromReference(int frame, double xr, double yr) {
        return transform(frame).fromReference(xr, yr);
    }

    /**
     * Transformaciones para el ajuste simultaneo: el stack va primero (identidad) y los
     * frames pasan a coordenadas del stack, que empiezan en (trimX, trimY) de la referencia.
     */
    public TransformList relativeToStack(String stackFileName, int trimX, int trimY) {
        List<TransformList.Entry> out = new ArrayList<>();
        out.add(new TransformList.Entry(stackFileName, Transform.identity(), ""));
        for (TransformList.Entry e : list.entries()) {
            out.add(new TransformList.Entry(e.fileName, e.transform.withOrigin(trimX, trimY), e.trailing));
        }
        return new TransformList(out);
    }

    public static void write(TransformList l, Path file) throws IOException {
        try (BufferedWriter w = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            for (TransformList.Entry e : l.entries()) {
                Transform t = e.transform;
                StringBuilder sb = new StringBuilder(String.format(Locale.US,
                        " '%s' %9.3f %9.3f %9.5f %9.5f %9.5f %9.5f",
                        e.fileName, t.dx, t.dy, t.a11, t.a21, t.a12, t.a22));
                if (t.fitRadius > 0) sb.append(String.format(Locale.US, " %6.2f", t.fitRadius));
                if (!e.trailing.isEmpty()) sb.append(' ').append(e.trailing);
                w.write(sb.toString());
                w.newLine();
            }
        }
    }
}
