package com.stdatmosphere;

import com.stdatmosphere.util.InvalidUnitException;
import com.stdatmosphere.util.SolverResult;
import com.stdatmosphere.util.SolverSettings;
import com.stdatmosphere.util.UnitSystem;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AltitudeInversion recovers the forward model's altitude")
class AltitudeInversionTest {

    private static final double TOL_FT = 5.0;
    private static final double[] ALTITUDES_FT = {0.0, 10000.0, 36000.0, 50000.0, 80000.0, 150000.0};
    private static final double[] MACHS = {0.3, 0.8, 1.2};

    private final AltitudeInversion inversion = new AltitudeInversion();

    @Test
    @DisplayName("Density → altitude")
    void density_roundTrip() {
        for (double alt : ALTITUDES_FT) {
            final double rho = StandardAtmosphere.density(alt);
            assertEquals(alt, inversion.altitudeForDensity(rho), TOL_FT, "alt=" + alt);
        }
    }

    @Test
    @DisplayName("Pressure → altitude")
    void pressure_roundTrip() {
        for (double alt : ALTITUDES_FT) {
            final double p = StandardAtmosphere.pressure(alt);
            assertEquals(alt, inversion.altitudeForPressure(p), TOL_FT, "alt=" + alt);
            assertEquals(alt, inversion.altitudeForPressure(p, "psf", "ft"), TOL_FT, "alt=" + alt);
        }
    }

    @Test
    @DisplayName("Dynamic pressure at fixed Mach → altitude")
    void dynamicPressure_roundTrip() {
        for (double alt : ALTITUDES_FT) {
            for (double mach : MACHS) {
                final double q = StandardAtmosphere.dynamicPressure(alt, mach);
                assertEquals(alt, inversion.altitudeForDynamicPressureAndMach(q, mach), TOL_FT,
                        "alt=" + alt + " M=" + mach);
            }
        }
    }

    @Test
    @DisplayName("Equivalent airspeed at fixed Mach → altitude")
    void equivalentAirspeed_roundTrip() {
        for (double alt : ALTITUDES_FT) {
            for (double mach : MACHS) {
                final double eas = StandardAtmosphere.equivalentAirspeed(alt, mach);
                assertEquals(alt, inversion.altitudeForEquivalentAirspeedAndMach(eas, mach), TOL_FT,
                        "alt=" + alt + " M=" + mach);
            }
        }
    }

    @Test
    @DisplayName("Result variants report convergence within the iteration cap")
    void solveVariants_converge() {
        for (double alt : ALTITUDES_FT) {
            final SolverResult rho = inversion.solveDensity(StandardAtmosphere.density(alt));
            final SolverResult p = inversion.solvePressure(StandardAtmosphere.pressure(alt));
            final SolverResult q = inversion.solveDynamicPressure(StandardAtmosphere.dynamicPressure(alt, 0.8), 0.8);
            final SolverResult eas = inversion.solveEquivalentAirspeed(StandardAtmosphere.equivalentAirspeed(alt, 0.8), 0.8);
            for (SolverResult r : new SolverResult[]{rho, p, q, eas}) {
                assertTrue(r.isConverged(), "alt=" + alt + " " + r);
                assertTrue(r.getIterations() <= SolverSettings.DEFAULT_MAX_ITERATIONS, "alt=" + alt + " " + r);
                assertEquals(alt, r.getAltitudeFt(), TOL_FT, "alt=" + alt + " " + r);
            }
        }
    }

    @Test
    @DisplayName("Unit-qualified inversions convert in and out")
    void unitQualified() {
        final double altM = 3048.0;
        final double tolM = TOL_FT * 0.3048;
        assertAll(
            () -> assertEquals(altM, inversion.altitudeForPressure(
                    StandardAtmosphere.pressure(altM, "m", "Pa"), "Pa", "m"), tolM),
            () -> assertEquals(10.0, inversion.altitudeForPressure(
                    StandardAtmosphere.pressure(10.0, "kft", "psi"), "psi", "kft"), TOL_FT / 1000.0),
            () -> assertEquals(altM, inversion.altitudeForDensity(
                    StandardAtmosphere.density(altM, StandardAtmosphere.GAS_CONSTANT, "m", "kg/m^3"), "kg/m^3", "m"), tolM),
            () -> assertEquals(altM, inversion.altitudeForEquivalentAirspeedAndMach(
                    StandardAtmosphere.equivalentAirspeed(altM, 0.8, "m", "knots"), 0.8, "knots", "m"), tolM),
            () -> assertEquals(altM, inversion.altitudeForDynamicPressureAndMach(
                    StandardAtmosphere.dynamicPressure(altM, 0.8, "m", "Pa"), 0.8, "Pa", "m"), tolM)
        );
    }

    @Test
    @DisplayName("SI flag: q in Pa, altitude in m")
    void dynamicPressure_unitSystem() {
        final double qPa = StandardAtmosphere.dynamicPressure(3048.0, 0.8, "m", "Pa");
        final double qPsf = StandardAtmosphere.dynamicPressure(10000.0, 0.8);
        assertEquals(3048.0, inversion.altitudeForDynamicPressureAndMach(qPa, 0.8, UnitSystem.SI), TOL_FT * 0.3048);
        assertEquals(10000.0, inversion.altitudeForDynamicPressureAndMach(qPsf, 0.8, UnitSystem.ENGLISH), TOL_FT);
    }

    @Test
    @DisplayName("q is reduced to static pressure with γ = 1.4")
    void staticPressureFor() {
        final double p = StandardAtmosphere.pressure(25000.0);
        final double q = StandardAtmosphere.dynamicPressure(25000.0, 0.7);
        assertEquals(p, AltitudeInversion.staticPressureFor(q, 0.7), p * 1e-12);
    }

    @Test
    @DisplayName("Custom solver settings tighten the result")
    void customSettings() {
        SolverSettings s = new SolverSettings();
        s.setToleranceFt(0.01);
        AltitudeInversion precise = new AltitudeInversion(s);
        final double alt = 42000.0;
        SolverResult r = precise.solvePressure(StandardAtmosphere.pressure(alt));
        assertTrue(r.isConverged(), r.toString());
        assertEquals(alt, r.getAltitudeFt(), 0.01);
    }

    @Test
    @DisplayName("Bad unit tokens are rejected, not solved")
    void invalidUnits() {
        assertAll(
            () -> assertThrows(InvalidUnitException.class, () -> inversion.altitudeForPressure(1.0, "bar", "ft")),
            () -> assertThrows(InvalidUnitException.class, () -> inversion.altitudeForPressure(2116.0, "psf", "yd")),
            () -> assertThrows(InvalidUnitException.class, () -> inversion.altitudeForDensity(1.2, "g/l", "m")),
            () -> assertThrows(InvalidUnitException.class,
                    () -> inversion.altitudeForEquivalentAirspeedAndMach(300.0, 0.5, "mph", "ft")),
            () -> assertThrows(NullPointerException.class, () -> new AltitudeInversion(null)),
            () -> assertThrows(NullPointerException.class,
                    () -> inversion.altitudeForDynamicPressureAndMach(100.0, 0.5, (UnitSystem) null))
        );
    }
}
