package com.stdatmosphere.util;

/**
 * Closed-form expression of one layer quantity as a function of the altitude above the
 * layer base, {@code dz} (ft).
 *
 *   CONSTANT       f = c0
 *   AFFINE         f = c0 + c1 * dz
 *   AFFINE_IN_LOG  f = c0 + c1 * ln(1 + c2 * dz)
 *
 * Immutable.
 */
public final class LayerFormula {

    public enum Kind {
        CONSTANT,
        AFFINE,
        AFFINE_IN_LOG
    }

    private final Kind kind;
    private final double c0;
    private final double c1;
    private final double c2;

    private LayerFormula(Kind kind, double c0, double c1, double c2) {
        this.kind = kind;
        this.c0 = c0;
        this.c1 = c1;
        this.c2 = c2;
    }

    public static LayerFormula constant(double value) {
        return new LayerFormula(Kind.CONSTANT, value, 0.0, 0.0);
    }

    public static LayerFormula affine(double base, double slope) {
        return new LayerFormula(Kind.AFFINE, base, slope, 0.0);
    }

    public static LayerFormula affineInLog(double base, double scale, double rate) {
        return new LayerFormula(Kind.AFFINE_IN_LOG, base, scale, rate);
    }

    public double evaluate(double dz) {
        switch (kind) {
            case CONSTANT:
                return c0;
            case AFFINE:
                return c0 + c1 * dz;
            case AFFINE_IN_LOG:
                return c0 + c1 * Math.log(1.0 + c2 * dz);
            default:
                throw new IllegalStateException("Unhandled formula kind " + kind);
        }
    }

    public Kind kind() { return kind; }

    @Override
    public String toString() {
        switch (kind) {
            case CONSTANT:
                return "LayerFormula{" + c0 + "}";
            case AFFINE:
                return "LayerFormula{" + c0 + " + " + c1 + "*dz}";
            default:
                return "LayerFormula{" + c0 + " + " + c1 + "*ln(1 + " + c2 + "*dz)}";
        }
    }
}
