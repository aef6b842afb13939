package com.stdatmosphere.util;

/**
 * Curve-fit layers of the 1976 U.S. Standard Atmosphere, English units.
 * <p>
 * Source: Bell Handbook of Aerodynamic Heating (BAC-7006-3352-001), Table C.1.
 * The fits are valid to ~300 kft; the last layer is open-ended and is used to
 * extrapolate above it. Temperature is in Rankine, the pressure formula yields
 * ln(p) with p in psf, and both are functions of the altitude above the layer base.
 * <p>
 * Declaration order is ascending altitude; {@link AtmosphereProfile#layerAt(double)}
 * relies on it.
 */
public enum AtmosphereLayer {

    TROPOSPHERE(0.0, 36151.725,
            LayerFormula.affine(518.0, -0.003559996),
            LayerFormula.affineInLog(7.657389, 5.2561258, -6.8634634E-6)),

    TROPOPAUSE(36151.725, 82344.678,
            LayerFormula.constant(389.988),
            LayerFormula.affine(6.158411, -4.77916918E-5)),

    STRATOSPHERE(82344.678, 155347.756,
            LayerFormula.affine(389.988, 0.0016273286),
            LayerFormula.affineInLog(3.950775, -11.3882724, 4.17276598E-6)),

    STRATOPAUSE(155347.756, 175346.171,
            LayerFormula.constant(508.788),
            LayerFormula.affine(0.922461, -3.62635373E-5)),

    MESOSPHERE(175346.171, 249000.304,
            LayerFormula.affine(508.788, -0.0020968273),
            LayerFormula.affineInLog(0.197235, 8.7602095, -4.12122002E-6)),

    UPPER_MESOSPHERE(249000.304, 299515.564,
            LayerFormula.constant(354.348),
            LayerFormula.affine(-2.971785, -5.1533546650E-5));

    private final double baseFt;
    private final double topFt;
    private final LayerFormula temperature;
    private final LayerFormula logPressure;

    AtmosphereLayer(double baseFt, double topFt, LayerFormula temperature, LayerFormula logPressure) {
        this.baseFt = baseFt;
        this.topFt = topFt;
        this.temperature = temperature;
        this.logPressure = logPressure;
    }

    /** Lower bound (inclusive), ft. */
    public double baseFt() { return baseFt; }

    /** Upper bound of the fitted range (exclusive), ft. */
    public double topFt() { return topFt; }

    public LayerFormula temperatureFormula() { return temperature; }

    public LayerFormula logPressureFormula() { return logPressure; }

    /** Temperature (R) at {@code altitudeFt}, no bounds check. */
    public double temperature(double altitudeFt) {
        return temperature.evaluate(altitudeFt - baseFt);
    }

    /** ln(pressure in psf) at {@code altitudeFt}, no bounds check. */
    public double logPressure(double altitudeFt) {
        return logPressure.evaluate(altitudeFt - baseFt);
    }

    /** Highest altitude covered by the fits, ft. */
    public static double topOfModelFt() {
        return UPPER_MESOSPHERE.topFt;
    }
}
