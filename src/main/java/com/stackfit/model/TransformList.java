package com.stackfit.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Lista ordenada (frame, transformacion). La entrada 0 es la referencia.
 */
public class TransformList {

    public static class Entry {
        public final String fileName; // tal como aparece entre comillas
        public final String frameId;
        public final Transform transform;
        public final String trailing;

        public Entry(String fileName, Transform transform, String trailing) {
            this.fileName = fileName;
            this.frameId = baseName(fileName);
            this.transform = transform;
            this.trailing = trailing == null ? "" : trailing;
        }
    }

    private final List<Entry> entries;

    public TransformList(List<Entry> entries) {
        this.entries = Collections.unmodifiableList(new ArrayList<>(entries));
    }

    public List<Entry> entries() { return entries; }
    public Entry get(int i) { return entries.get(i); }
    public Entry reference() { return entries.get(0); }
    public int size() { return entries.size(); }

    public List<String> frameIds() {
        List<String> ids = new ArrayList<>();
        for (Entry e : entries) ids.add(e.frameId);
        return ids;
    }

    static String baseName(String fileName) {
        String name = fileName.replace('\\', '/');
        int slash = name.lastIndexOf('/');
        if (slash >= 0) name = name.substring(slash + 1);
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
