package com.stdatmosphere.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Temperature and pressure profile of the standard atmosphere, English units.
 * <ul>
 *   <li>Below 0 ft the troposphere fit is evaluated as-is.</li>
 *   <li>Above {@link AtmosphereLayer#topOfModelFt()} the last layer's fit is extrapolated.</li>
 * </ul>
 * Neither case is an error.
 */
public final class AtmosphereProfile {

    private static final Logger LOG = LoggerFactory.getLogger(AtmosphereProfile.class);

    private static final AtmosphereLayer[] LAYERS = AtmosphereLayer.values();

    private AtmosphereProfile() {} // utility class

    /** Layer whose fit applies at {@code altitudeFt}. */
    public static AtmosphereLayer layerAt(double altitudeFt) {
        for (int i = 0; i < LAYERS.length - 1; i++) {
            if (altitudeFt < LAYERS[i].topFt()) return LAYERS[i];
        }
        final AtmosphereLayer last = LAYERS[LAYERS.length - 1];
        if (altitudeFt >= last.topFt()) {
            LOG.trace("alt={} ft is above {} ft; extrapolating {}", altitudeFt, last.topFt(), last);
        }
        return last;
    }

    /** Static temperature (R). */
    public static double temperature(double altitudeFt) {
        return layerAt(altitudeFt).temperature(altitudeFt);
    }

    /** Static pressure (psf). */
    public static double pressure(double altitudeFt) {
        return Math.exp(layerAt(altitudeFt).logPressure(altitudeFt));
    }
}
