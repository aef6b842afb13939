package com.stdatmosphere;

import com.stdatmosphere.util.AtmosphereProfile;
import com.stdatmosphere.util.SutherlandViscosity;
import com.stdatmosphere.util.UnitConversion;
import com.stdatmosphere.util.UnitSystem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * StandardAtmosphere
 *
 * Freestream properties of the 1976 U.S. Standard Atmosphere as a function of geometric
 * altitude, plus the aerodynamic quantities derived from them.
 * - Physics is evaluated in English units (ft, R, psf, slug/ft^3, ft/s).
 * - Each quantity has a canonical overload (altitude in ft, result in English units) and a
 *   unit-qualified overload taking the caller's tokens; see {@link UnitConversion}.
 * - Only bad unit tokens fail ({@link com.stdatmosphere.util.InvalidUnitException}).
 *   Altitudes outside the fitted range are extrapolated.
 */
public final class StandardAtmosphere {

    private static final Logger LOG = LoggerFactory.getLogger(StandardAtmosphere.class);

    // Gas constants, English units
    public static final double GAS_CONSTANT = 1716.0;  // ft·lbf/(slug·R), dry air
    public static final double GAMMA        = 1.4;     // ratio of specific heats

    /** q = ½ γ p M² with γ = 1.4. */
    private static final double DYNAMIC_PRESSURE_FACTOR = 0.5 * GAMMA;

    private static final double SEA_LEVEL_FT = 0.0;

    private StandardAtmosphere() {} // utility class

    // -----------------------------------------------------------------------------
    // Temperature & pressure
    // -----------------------------------------------------------------------------

    /** Static temperature (R) at {@code altitudeFt}. */
    public static double temperature(double altitudeFt) {
        return AtmosphereProfile.temperature(altitudeFt);
    }

    /** Static temperature in {@code temperatureUnits} (R, K). */
    public static double temperature(double alt, String altUnits, String temperatureUnits) {
        final double z = toFeet(alt, altUnits);
        return UnitConversion.convertTemperature(temperature(z), "R", temperatureUnits);
    }

    /** Static pressure (psf) at {@code altitudeFt}. */
    public static double pressure(double altitudeFt) {
        return AtmosphereProfile.pressure(altitudeFt);
    }

    /** Static pressure in {@code pressureUnits} (psf, psi, Pa). */
    public static double pressure(double alt, String altUnits, String pressureUnits) {
        final double z = toFeet(alt, altUnits);
        return UnitConversion.convertPressure(pressure(z), "psf", pressureUnits);
    }

    // -----------------------------------------------------------------------------
    // Density, speed of sound, velocity, Mach
    // -----------------------------------------------------------------------------

    /** Density (slug/ft^3) via the ideal gas law, rho = p / (R T). */
    public static double density(double altitudeFt) {
        return density(altitudeFt, GAS_CONSTANT, "ft", "slug/ft^3");
    }

    /**
     * Density via the ideal gas law with a caller-supplied gas constant.
     *
     * @param gasConstant  R in ft·lbf/(slug·R); {@link #GAS_CONSTANT} for air
     * @param densityUnits slug/ft^3, slinch/in^3, kg/m^3
     */
    public static double density(double alt, double gasConstant, String altUnits, String densityUnits) {
        final double z = toFeet(alt, altUnits);
        final double p = pressure(z);
        final double T = temperature(z);
        return UnitConversion.convertDensity(p / (gasConstant * T), "slug/ft^3", densityUnits);
    }

    /** Speed of sound (ft/s), a = sqrt(γ R T). */
    public static double speedOfSound(double altitudeFt) {
        return Math.sqrt(GAMMA * GAS_CONSTANT * temperature(altitudeFt));
    }

    /** Speed of sound in {@code velocityUnits} (ft/s, m/s, in/s, knots). */
    public static double speedOfSound(double alt, String altUnits, String velocityUnits) {
        return speedOfSound(alt, altUnits, velocityUnits, GAMMA);
    }

    /** Speed of sound with a caller-supplied ratio of specific heats. */
    public static double speedOfSound(double alt, String altUnits, String velocityUnits, double gamma) {
        final double z = toFeet(alt, altUnits);
        final double a = Math.sqrt(gamma * GAS_CONSTANT * temperature(z));
        return UnitConversion.convertVelocity(a, "ft/s", velocityUnits);
    }

    /** True airspeed (ft/s) for {@code mach}, V = M a. */
    public static double velocity(double altitudeFt, double mach) {
        return mach * speedOfSound(altitudeFt);
    }

    /** True airspeed in {@code velocityUnits} for {@code mach}. */
    public static double velocity(double alt, double mach, String altUnits, String velocityUnits) {
        return mach * speedOfSound(alt, altUnits, velocityUnits);
    }

    /** Mach number for a true airspeed in ft/s, M = V / a. */
    public static double mach(double altitudeFt, double velocityFps) {
        return velocityFps / speedOfSound(altitudeFt);
    }

    /** Mach number for a true airspeed given in {@code velocityUnits}. */
    public static double mach(double alt, double velocity, String altUnits, String velocityUnits) {
        return velocity / speedOfSound(alt, altUnits, velocityUnits);
    }

    // -----------------------------------------------------------------------------
    // Dynamic pressure & equivalent airspeed
    // -----------------------------------------------------------------------------

    /**
     * Dynamic pressure (psf). With q = ½ rho V², p = rho R T and a² = γ R T this
     * reduces to q = ½ γ p M².
     */
    public static double dynamicPressure(double altitudeFt, double mach) {
        return DYNAMIC_PRESSURE_FACTOR * pressure(altitudeFt) * mach * mach;
    }

    /** Dynamic pressure in {@code pressureUnits}. */
    public static double dynamicPressure(double alt, double mach, String altUnits, String pressureUnits) {
        final double z = toFeet(alt, altUnits);
        return UnitConversion.convertPressure(dynamicPressure(z, mach), "psf", pressureUnits);
    }

    /**
     * Equivalent airspeed (ft/s).
     *
     *   EAS = TAS sqrt(rho / rho0) = a M sqrt(p T0 / (T p0))
     *
     * where T0, p0 are the sea-level values of this model.
     */
    public static double equivalentAirspeed(double altitudeFt, double mach) {
        final double T0 = temperature(SEA_LEVEL_FT);
        final double p0 = pressure(SEA_LEVEL_FT);
        final double T = temperature(altitudeFt);
        final double p = pressure(altitudeFt);
        final double a = Math.sqrt(GAMMA * GAS_CONSTANT * T);
        return a * mach * Math.sqrt((p * T0) / (T * p0));
    }

    /** Equivalent airspeed in {@code easUnits} (ft/s, m/s, in/s, knots). */
    public static double equivalentAirspeed(double alt, double mach, String altUnits, String easUnits) {
        final double z = toFeet(alt, altUnits);
        return UnitConversion.convertVelocity(equivalentAirspeed(z, mach), "ft/s", easUnits);
    }

    // -----------------------------------------------------------------------------
    // Viscosity & Reynolds number
    // -----------------------------------------------------------------------------

    /** Dynamic viscosity mu ((lbf*s)/ft^2) from Sutherland's law. */
    public static double dynamicViscosity(double altitudeFt) {
        return SutherlandViscosity.viscosity(temperature(altitudeFt));
    }

    /** Dynamic viscosity in {@code viscosityUnits} ((lbf*s)/ft^2, (N*s)/m^2, Pa*s). */
    public static double dynamicViscosity(double alt, String altUnits, String viscosityUnits) {
        final double z = toFeet(alt, altUnits);
        return UnitConversion.convertDynamicViscosity(dynamicViscosity(z), "(lbf*s)/ft^2", viscosityUnits);
    }

    /** Kinematic viscosity nu = mu / rho (ft^2/s). */
    public static double kinematicViscosity(double altitudeFt) {
        return dynamicViscosity(altitudeFt) / density(altitudeFt);
    }

    /** Kinematic viscosity in {@code viscosityUnits} (ft^2/s, m^2/s). */
    public static double kinematicViscosity(double alt, String altUnits, String viscosityUnits) {
        final double z = toFeet(alt, altUnits);
        return UnitConversion.convertKinematicViscosity(kinematicViscosity(z), "ft^2/s", viscosityUnits);
    }

    /**
     * Reynolds number per unit length (1/ft), closed form
     *
     *   Re/L = rho V / mu = p M a / (mu R T)
     *
     * Pressure and temperature are evaluated once.
     */
    public static double unitReynoldsNumber(double altitudeFt, double mach) {
        final double p = pressure(altitudeFt);
        final double T = temperature(altitudeFt);
        final double a = Math.sqrt(GAMMA * GAS_CONSTANT * T);
        final double mu = SutherlandViscosity.viscosity(T);
        final double reL = p * a * mach / (mu * GAS_CONSTANT * T);

        if (LOG.isDebugEnabled()) {
            final double rho = p / (GAS_CONSTANT * T);
            LOG.debug("unitReynoldsNumber: z={} ft, a={} ft/s, rho={} slug/ft^3, M={}, V={} ft/s, T={} R, mu={} (lbf*s)/ft^2 → Re/L={} 1/ft",
                    altitudeFt, a, rho, mach, a * mach, T, mu, reL);
        }
        return reL;
    }

    /** Closed-form unit Reynolds number in {@code reynoldsUnits} (1/ft, 1/m). */
    public static double unitReynoldsNumber(double alt, double mach, String altUnits, String reynoldsUnits) {
        final double z = toFeet(alt, altUnits);
        return UnitConversion.convertReciprocalLength(unitReynoldsNumber(z, mach), "1/ft", reynoldsUnits);
    }

    /**
     * Unit Reynolds number composed from the other primitives, Re/L = rho V / mu.
     * Agrees with {@link #unitReynoldsNumber(double, double)} to rounding.
     *
     * @param alt   altitude in ft ({@code ENGLISH}) or m ({@code SI})
     * @param units {@code ENGLISH} returns 1/ft, {@code SI} returns 1/m
     */
    public static double unitReynoldsNumberFromPrimitives(double alt, double mach, UnitSystem units) {
        final double z = toFeet(alt, units.altitude());
        final double rho = density(z);
        final double V = velocity(z, mach);
        final double mu = dynamicViscosity(z);
        final double reL = (rho * V) / mu;
        return UnitConversion.convertReciprocalLength(reL, "1/ft", units.reciprocalLength());
    }

    // -----------------------------------------------------------------------------
    // Helpers
    // -----------------------------------------------------------------------------

    private static double toFeet(double alt, String altUnits) {
        return UnitConversion.convertAltitude(alt, altUnits, "ft");
    }
}
