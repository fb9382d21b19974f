package com.stackfit.model;

/**
 * Desplazamiento mas parte lineal 2x2 que lleva coordenadas del frame al de referencia:
 * x_ref = dx + a11*x + a12*y, y_ref = dy + a21*x + a22*y.
 */
public class Transform {

    private static final double IDENTITY_TOLERANCE = 1e-9;

    public final double dx;
    public final double dy;
    public final double a11;
    public final double a21;
    public final double a12;
    public final double a22;
    public final double fitRadius; // 0 si la fila no lo trae

    public Transform(double dx, double dy, double a11, double a21, double a12, double a22, double fitRadius) {
        this.dx = dx;
        this.dy = dy;
        this.a11 = a11;
        this.a21 = a21;
        this.a12 = a12;
        this.a22 = a22;
        this.fitRadius = fitRadius;
    }

    public static Transform identity() {
        return new Transform(0, 0, 1, 0, 0, 1, 0);
    }

    public static Transform shift(double dx, double dy) {
        return new Transform(dx, dy, 1, 0, 0, 1, 0);
    }

    public boolean isIdentity() {
        return Math.abs(dx) < IDENTITY_TOLERANCE && Math.abs(dy) < IDENTITY_TOLERANCE && hasIdentityLinearPart();
    }

    public boolean hasIdentityLinearPart() {
        return Math.abs(a11 - 1) < IDENTITY_TOLERANCE && Math.abs(a22 - 1) < IDENTITY_TOLERANCE
                && Math.abs(a12) < IDENTITY_TOLERANCE && Math.abs(a21) < IDENTITY_TOLERANCE;
    }

    public double determinant() {
        return a11 * a22 - a12 * a21;
    }

    public double[] toReference(double x, double y) {
        return new double[]{dx + a11 * x + a12 * y, dy + a21 * x + a22 * y};
    }

    public double[] fromReference(double xr, double yr) {
        double det = determinant();
        double u = xr - dx, v = yr - dy;
        return new double[]{(a22 * u - a12 * v) / det, (-a21 * u + a11 * v) / det};
    }

    /** Misma transformacion con el origen de destino movido a (ox, oy). */
    public Transform withOrigin(double ox, double oy) {
        return new Transform(dx - ox, dy - oy, a11, a21, a12, a22, fitRadius);
    }

    @Override
    public String toString() {
        return String.format(java.util.Locale.US, "[%.3f %.3f | %.5f %.5f %.5f %.5f]", dx, dy, a11, a21, a12, a22);
    }
}
