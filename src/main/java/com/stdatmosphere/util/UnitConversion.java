package com.stdatmosphere.util;

import java.util.List;

/**
 * Scalar unit conversion for the dimensions the atmosphere API accepts.
 * <p>
 * Canonical (internal) units are English: ft, ft/s, psf, slug/ft^3, Rankine,
 * (lbf*s)/ft^2, ft^2/s and 1/ft. Every conversion is a single multiplicative factor
 * built as input unit → canonical → output unit; there are no offsets, temperature
 * included (absolute scales only).
 */
public final class UnitConversion {

    // Conversion constants
    public static final double FT_TO_M           = 0.3048;       // m per ft
    public static final double KFT_TO_FT         = 1000.0;       // ft per kft
    public static final double KNOT_TO_FPS       = 1.68781;      // ft/s per knot
    public static final double FPS_TO_IPS        = 12.0;         // in/s per ft/s
    public static final double PSI_TO_PSF        = 144.0;        // psf per psi
    public static final double PSF_TO_PA         = 47.880172;    // Pa per psf
    public static final double SLINCH_TO_SLUG    = 20736.0;      // 12^4, slug/ft^3 per slinch/in^3
    public static final double SLUG_TO_KG_M3     = 515.378818;   // kg/m^3 per slug/ft^3
    public static final double RANKINE_TO_KELVIN = 5.0 / 9.0;    // K per R
    public static final double LBF_S_FT2_TO_PA_S = 47.88026;     // Pa*s per (lbf*s)/ft^2

    private static final List<String> ALTITUDE_UNITS            = List.of("ft", "m", "kft");
    private static final List<String> VELOCITY_UNITS            = List.of("ft/s", "m/s", "in/s", "knots");
    private static final List<String> PRESSURE_UNITS            = List.of("psf", "psi", "Pa");
    private static final List<String> DENSITY_UNITS             = List.of("slug/ft^3", "slinch/in^3", "kg/m^3");
    private static final List<String> TEMPERATURE_UNITS         = List.of("R", "K");
    private static final List<String> DYNAMIC_VISCOSITY_UNITS   = List.of("(lbf*s)/ft^2", "(N*s)/m^2", "Pa*s");
    private static final List<String> KINEMATIC_VISCOSITY_UNITS = List.of("ft^2/s", "m^2/s");
    private static final List<String> RECIPROCAL_LENGTH_UNITS   = List.of("1/ft", "1/m");

    private UnitConversion() {} // utility class

    // -----------------------------------------------------------------------------
    // Public API
    // -----------------------------------------------------------------------------

    /** Altitude/length; canonical unit ft. Accepts ft, m, kft. */
    public static double convertAltitude(double alt, String unitsIn, String unitsOut) {
        return scale(alt, unitsIn, unitsOut, altitudeToFeet(unitsIn), altitudeToFeet(unitsOut));
    }

    /** Velocity; canonical unit ft/s. Accepts ft/s, m/s, in/s, knots. */
    public static double convertVelocity(double velocity, String unitsIn, String unitsOut) {
        return scale(velocity, unitsIn, unitsOut, velocityToFps(unitsIn), velocityToFps(unitsOut));
    }

    /** Pressure; canonical unit psf. Accepts psf, psi, Pa. */
    public static double convertPressure(double pressure, String unitsIn, String unitsOut) {
        return scale(pressure, unitsIn, unitsOut, pressureToPsf(unitsIn), pressureToPsf(unitsOut));
    }

    /** Density; canonical unit slug/ft^3. Accepts slug/ft^3, slinch/in^3, kg/m^3. */
    public static double convertDensity(double density, String unitsIn, String unitsOut) {
        return scale(density, unitsIn, unitsOut, densityToSlugFt3(unitsIn), densityToSlugFt3(unitsOut));
    }

    /** Absolute temperature; canonical unit R. Accepts R, K. */
    public static double convertTemperature(double temperature, String unitsIn, String unitsOut) {
        return scale(temperature, unitsIn, unitsOut, temperatureToRankine(unitsIn), temperatureToRankine(unitsOut));
    }

    /** Dynamic viscosity; canonical unit (lbf*s)/ft^2. Accepts (lbf*s)/ft^2, (N*s)/m^2, Pa*s. */
    public static double convertDynamicViscosity(double mu, String unitsIn, String unitsOut) {
        return scale(mu, unitsIn, unitsOut, dynamicViscosityToEnglish(unitsIn), dynamicViscosityToEnglish(unitsOut));
    }

    /** Kinematic viscosity; canonical unit ft^2/s. Accepts ft^2/s, m^2/s. */
    public static double convertKinematicViscosity(double nu, String unitsIn, String unitsOut) {
        return scale(nu, unitsIn, unitsOut, kinematicViscosityToFt2s(unitsIn), kinematicViscosityToFt2s(unitsOut));
    }

    /** Per-length quantities such as the unit Reynolds number; canonical unit 1/ft. Accepts 1/ft, 1/m. */
    public static double convertReciprocalLength(double perLength, String unitsIn, String unitsOut) {
        return scale(perLength, unitsIn, unitsOut, reciprocalLengthToPerFoot(unitsIn), reciprocalLengthToPerFoot(unitsOut));
    }

    // -----------------------------------------------------------------------------
    // Factor tables: value in the given unit × factor = value in the canonical unit
    // -----------------------------------------------------------------------------

    static double altitudeToFeet(String units) {
        if (units != null) {
            switch (units) {
                case "ft":  return 1.0;
                case "m":   return 1.0 / FT_TO_M;
                case "kft": return KFT_TO_FT;
                default: break;
            }
        }
        throw new InvalidUnitException("altitude", units, ALTITUDE_UNITS);
    }

    static double velocityToFps(String units) {
        if (units != null) {
            switch (units) {
                case "ft/s":  return 1.0;
                case "m/s":   return 1.0 / FT_TO_M;
                case "in/s":  return 1.0 / FPS_TO_IPS;
                case "knots": return KNOT_TO_FPS;
                default: break;
            }
        }
        throw new InvalidUnitException("velocity", units, VELOCITY_UNITS);
    }

    static double pressureToPsf(String units) {
        if (units != null) {
            switch (units) {
                case "psf": return 1.0;
                case "psi": return PSI_TO_PSF;
                case "Pa":  return 1.0 / PSF_TO_PA;
                default: break;
            }
        }
        throw new InvalidUnitException("pressure", units, PRESSURE_UNITS);
    }

    static double densityToSlugFt3(String units) {
        if (units != null) {
            switch (units) {
                case "slug/ft^3":   return 1.0;
                case "slinch/in^3": return SLINCH_TO_SLUG;
                case "kg/m^3":      return 1.0 / SLUG_TO_KG_M3;
                default: break;
            }
        }
        throw new InvalidUnitException("density", units, DENSITY_UNITS);
    }

    static double temperatureToRankine(String units) {
        if (units != null) {
            switch (units) {
                case "R": return 1.0;
                case "K": return 1.0 / RANKINE_TO_KELVIN;
                default: break;
            }
        }
        throw new InvalidUnitException("temperature", units, TEMPERATURE_UNITS);
    }

    static double dynamicViscosityToEnglish(String units) {
        if (units != null) {
            switch (units) {
                case "(lbf*s)/ft^2": return 1.0;
                case "(N*s)/m^2":
                case "Pa*s":         return 1.0 / LBF_S_FT2_TO_PA_S;
                default: break;
            }
        }
        throw new InvalidUnitException("dynamic viscosity", units, DYNAMIC_VISCOSITY_UNITS);
    }

    static double kinematicViscosityToFt2s(String units) {
        if (units != null) {
            switch (units) {
                case "ft^2/s": return 1.0;
                case "m^2/s":  return 1.0 / (FT_TO_M * FT_TO_M);
                default: break;
            }
        }
        throw new InvalidUnitException("kinematic viscosity", units, KINEMATIC_VISCOSITY_UNITS);
    }

    static double reciprocalLengthToPerFoot(String units) {
        if (units != null) {
            switch (units) {
                case "1/ft": return 1.0;
                case "1/m":  return FT_TO_M;
                default: break;
            }
        }
        throw new InvalidUnitException("reciprocal length", units, RECIPROCAL_LENGTH_UNITS);
    }

    // -----------------------------------------------------------------------------
    // Helpers
    // -----------------------------------------------------------------------------

    /**
     * Both tokens are validated (by the factor lookups) before this is called.
     * Identical tokens return the value untouched so no rounding is introduced.
     */
    private static double scale(double value, String unitsIn, String unitsOut, double inToCanonical, double outToCanonical) {
        if (unitsIn.equals(unitsOut)) return value;
        final double factor = inToCanonical / outToCanonical;
        return value * factor;
    }
}
