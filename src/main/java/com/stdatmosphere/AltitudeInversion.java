package com.stdatmosphere;

import com.stdatmosphere.util.SecantAltitudeSolver;
import com.stdatmosphere.util.SolverResult;
import com.stdatmosphere.util.SolverSettings;
import com.stdatmosphere.util.UnitConversion;
import com.stdatmosphere.util.UnitSystem;

import java.util.Objects;

/**
 * AltitudeInversion
 *
 * Recovers the altitude at which a derived atmosphere quantity takes a given value:
 * density, static pressure, dynamic pressure at fixed Mach, equivalent airspeed at fixed Mach.
 * - All inversions share one {@link SecantAltitudeSolver}; see it for the iteration contract.
 * - Results are best effort: a solve that reaches the iteration cap still returns its last
 *   estimate. The {@code solve*} methods expose the convergence flag.
 * - Instances are immutable and may be shared between threads.
 */
public final class AltitudeInversion {

    private final SecantAltitudeSolver solver;

    /** Default solver: first guess 5000 ft, 500 ft probe, 5 ft tolerance, 20 iterations. */
    public AltitudeInversion() {
        this(new SolverSettings());
    }

    public AltitudeInversion(SolverSettings settings) {
        Objects.requireNonNull(settings, "Solver settings must not be null");
        this.solver = new SecantAltitudeSolver(settings);
    }

    // -----------------------------------------------------------------------------
    // Density
    // -----------------------------------------------------------------------------

    /**
     * Altitude (ft) at which the density equals {@code densitySlugFt3}.
     */
    public double altitudeForDensity(double densitySlugFt3) {
        return solveDensity(densitySlugFt3).getAltitudeFt();
    }

    /**
     * @param density       target density in {@code densityUnits}
     * @param densityUnits  slug/ft^3, slinch/in^3, kg/m^3
     * @param altUnits      units of the returned altitude; ft, m, kft
     */
    public double altitudeForDensity(double density, String densityUnits, String altUnits) {
        final double rho = UnitConversion.convertDensity(density, densityUnits, "slug/ft^3");
        return UnitConversion.convertAltitude(altitudeForDensity(rho), "ft", altUnits);
    }

    public SolverResult solveDensity(double densitySlugFt3) {
        return solver.solve(StandardAtmosphere::density, densitySlugFt3);
    }

    // -----------------------------------------------------------------------------
    // Static pressure
    // -----------------------------------------------------------------------------

    /** Altitude (ft) at which the static pressure equals {@code pressurePsf}. */
    public double altitudeForPressure(double pressurePsf) {
        return solvePressure(pressurePsf).getAltitudeFt();
    }

    /**
     * @param pressure       target static pressure in {@code pressureUnits}
     * @param pressureUnits  psf, psi, Pa
     * @param altUnits       units of the returned altitude; ft, m, kft
     */
    public double altitudeForPressure(double pressure, String pressureUnits, String altUnits) {
        final double p = UnitConversion.convertPressure(pressure, pressureUnits, "psf");
        return UnitConversion.convertAltitude(altitudeForPressure(p), "ft", altUnits);
    }

    public SolverResult solvePressure(double pressurePsf) {
        return solver.solve(StandardAtmosphere::pressure, pressurePsf);
    }

    // -----------------------------------------------------------------------------
    // Dynamic pressure at fixed Mach
    // -----------------------------------------------------------------------------

    /**
     * Altitude at which the dynamic pressure at {@code mach} equals {@code q}.
     * <p>
     * q = ½ γ p M² is solved for p and the monotonic pressure profile is inverted instead.
     *
     * @param q      dynamic pressure, psf ({@code ENGLISH}) or Pa ({@code SI})
     * @param units  {@code ENGLISH} returns ft, {@code SI} returns m
     */
    public double altitudeForDynamicPressureAndMach(double q, double mach, UnitSystem units) {
        Objects.requireNonNull(units, "Unit system must not be null");
        return altitudeForDynamicPressureAndMach(q, mach, units.pressure(), units.altitude());
    }

    /** English units: q in psf, altitude in ft. */
    public double altitudeForDynamicPressureAndMach(double q, double mach) {
        return altitudeForDynamicPressureAndMach(q, mach, UnitSystem.ENGLISH);
    }

    /**
     * @param pressureUnits  units of {@code q}; psf, psi, Pa
     * @param altUnits       units of the returned altitude; ft, m, kft
     */
    public double altitudeForDynamicPressureAndMach(double q, double mach, String pressureUnits, String altUnits) {
        return altitudeForPressure(staticPressureFor(q, mach), pressureUnits, altUnits);
    }

    /** q in psf; altitude in ft. */
    public SolverResult solveDynamicPressure(double qPsf, double mach) {
        return solvePressure(staticPressureFor(qPsf, mach));
    }

    // -----------------------------------------------------------------------------
    // Equivalent airspeed at fixed Mach
    // -----------------------------------------------------------------------------

    /** Altitude (ft) at which the equivalent airspeed at {@code mach} equals {@code easFps}. */
    public double altitudeForEquivalentAirspeedAndMach(double easFps, double mach) {
        return solveEquivalentAirspeed(easFps, mach).getAltitudeFt();
    }

    /**
     * @param eas            equivalent airspeed in {@code velocityUnits}
     * @param velocityUnits  ft/s, m/s, in/s, knots
     * @param altUnits       units of the returned altitude; ft, m, kft
     */
    public double altitudeForEquivalentAirspeedAndMach(double eas, double mach, String velocityUnits, String altUnits) {
        final double easFps = UnitConversion.convertVelocity(eas, velocityUnits, "ft/s");
        return UnitConversion.convertAltitude(altitudeForEquivalentAirspeedAndMach(easFps, mach), "ft", altUnits);
    }

    /**
     * EAS depends on both temperature and pressure, so this inverts the EAS relation
     * directly rather than reducing it to a pressure inversion.
     */
    public SolverResult solveEquivalentAirspeed(double easFps, double mach) {
        return solver.solve(z -> StandardAtmosphere.equivalentAirspeed(z, mach), easFps);
    }

    // -----------------------------------------------------------------------------
    // Helpers
    // -----------------------------------------------------------------------------

    /** p = 2 q / (γ M²); unit-agnostic since it is a pure scale. */
    static double staticPressureFor(double q, double mach) {
        return 2.0 * q / (StandardAtmosphere.GAMMA * mach * mach);
    }
}
