package com.stackfit.service;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Fichero de opciones de los motores: una linea {@code CLAVE=valor} por opcion
 * (FW radio de ajuste, VA orden de variacion de la PSF, AN modelo analitico...).
 * Las claves se guardan en mayusculas y en orden de aparicion.
 */
public class OptionFile {

    private final Map<String, String> values = new LinkedHashMap<>();

    public static OptionFile read(Path file) throws IOException {
        OptionFile opt = new OptionFile();
        for (String raw : Files.readAllLines(file, StandardCharsets.UTF_8)) {
            int eq = raw.indexOf('=');
            if (eq <= 0) continue;
            opt.values.put(raw.substring(0, eq).trim().toUpperCase(Locale.ROOT), raw.substring(eq + 1).trim());
        }
        return opt;
    }

    public OptionFile set(String key, String value) {
        values.put(key.toUpperCase(Locale.ROOT), value);
        return this;
    }

    public OptionFile set(String key, double value) {
        return set(key, String.format(Locale.US, "%.2f", value));
    }

    public OptionFile set(String key, int value) {
        return set(key, Integer.toString(value));
    }

    public String get(String key) {
        return values.get(key.toUpperCase(Locale.ROOT));
    }

    public double getDouble(String key, double def) {
        String v = get(key);
        if (v == null || v.isEmpty()) return def;
        try {
            return Double.parseDouble(v);
        } catch (NumberFormatException e) {
            return def;
        }
    }

    public Map<String, String> values() {
        return values;
    }

    public void write(Path file) throws IOException {
        try (BufferedWriter w = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            for (Map.Entry<String, String> e : values.entrySet()) {
                w.write(e.getKey() + "=" + e.getValue());
                w.newLine();
            }
        }
    }
}
