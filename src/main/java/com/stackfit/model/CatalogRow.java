package com.stackfit.model;

public class CatalogRow {
    public static final double NO_MAG = 99.9999;
    public static final double NO_ERR = 9.9999;

    public final int id;
    public final double x;
    public final double y;
    public final double[] mags;
    public final double[] errors;
    public final double chi;
    public final double sharp;
    public final Integer classFlag;      // null sin clasificacion
    public final Double classProbability;

    public CatalogRow(int id, double x, double y, double[] mags, double[] errors, double chi, double sharp,
                      Integer classFlag, Double classProbability) {
        this.id = id;
        this.x = x;
        this.y = y;
        this.mags = mags;
        this.errors = errors;
        this.chi = chi;
        this.sharp = sharp;
        this.classFlag = classFlag;
        this.classProbability = classProbability;
    }

    public boolean isClassified() {
        return classFlag != null;
    }

    public CatalogRow withClassification(Integer flag, Double probability) {
        return new CatalogRow(id, x, y, mags, errors, chi, sharp, flag, probability);
    }
}
