package com.stackfit.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class StarCatalog {
    private final List<String> header;
    private final List<String> frameIds;
    private final List<CatalogRow> rows;
    private final boolean classified;
    /** Estrellas del maestro sin fila en el fichero de clasificacion (aviso, no error). */
    public final int unmatchedClassifications;

    public StarCatalog(List<String> header, List<String> frameIds, List<CatalogRow> rows,
                       boolean classified, int unmatchedClassifications) {
        this.header = Collections.unmodifiableList(new ArrayList<>(header));
        this.frameIds = Collections.unmodifiableList(new ArrayList<>(frameIds));
        this.rows = Collections.unmodifiableList(new ArrayList<>(rows));
        this.classified = classified;
        this.unmatchedClassifications = unmatchedClassifications;
    }

    public List<String> header() { return header; }
    public List<String> frameIds() { return frameIds; }
    public List<CatalogRow> rows() { return rows; }
    public boolean isClassified() { return classified; }
    public int size() { return rows.size(); }
}
