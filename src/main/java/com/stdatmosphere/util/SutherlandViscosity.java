package com.stdatmosphere.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sutherland's law for the dynamic viscosity of air, English units.
 * <p>
 * Bertin, Aerodynamics for Engineers (4th ed.), eq. 1.5b.
 */
public final class SutherlandViscosity {

    private static final Logger LOG = LoggerFactory.getLogger(SutherlandViscosity.class);

    /** Below this temperature (R) the linear approximation is used. */
    public static final double LOW_TEMPERATURE_LIMIT = 225.0;

    /** Above this temperature (R) the law is not validated. */
    public static final double HIGH_TEMPERATURE_LIMIT = 5400.0;

    private static final double LINEAR_COEFF     = 8.0382436E-10; // (lbf*s)/(ft^2*R)
    private static final double SUTHERLAND_COEFF = 2.27E-8;       // (lbf*s)/(ft^2*R^0.5)
    private static final double SUTHERLAND_TEMP  = 198.6;         // R

    private SutherlandViscosity() {} // utility class

    /**
     * Dynamic viscosity mu in (lbf*s)/ft^2.
     *
     * @param temperatureR static temperature in Rankine
     */
    public static double viscosity(double temperatureR) {
        if (temperatureR < LOW_TEMPERATURE_LIMIT) {
            return LINEAR_COEFF * temperatureR;
        }
        if (temperatureR > HIGH_TEMPERATURE_LIMIT) {
            LOG.warn("viscosity - Temperature is too large (T>{} R) T={}", HIGH_TEMPERATURE_LIMIT, temperatureR);
        }
        return SUTHERLAND_COEFF * Math.pow(temperatureR, 1.5) / (temperatureR + SUTHERLAND_TEMP);
    }

    /** True when {@link #viscosity(double)} uses the linear low-temperature branch. */
    public static boolean isLinearRegime(double temperatureR) {
        return temperatureR < LOW_TEMPERATURE_LIMIT;
    }
}
