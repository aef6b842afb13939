package com.stdatmosphere.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.function.DoubleUnaryOperator;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("SecantAltitudeSolver iteration contract")
class SecantAltitudeSolverTest {

    @Mock
    private DoubleUnaryOperator forward;

    @Test
    @DisplayName("Linear profile: probes at z and z + 500 ft, converges in two steps")
    void linearProfile_probesAndConverges() {
        when(forward.applyAsDouble(anyDouble())).thenAnswer(inv -> -inv.<Double>getArgument(0));

        SolverResult r = new SecantAltitudeSolver().solve(forward, -12000.0);

        assertAll(
            () -> assertEquals(12000.0, r.getAltitudeFt(), 1e-9),
            () -> assertEquals(2, r.getIterations()),
            () -> assertTrue(r.isConverged())
        );
        InOrder order = inOrder(forward);
        order.verify(forward).applyAsDouble(5000.0);
        order.verify(forward).applyAsDouble(5500.0);
        order.verify(forward).applyAsDouble(12000.0);
        order.verify(forward).applyAsDouble(12500.0);
        verifyNoMoreInteractions(forward);
    }

    @Test
    @DisplayName("Divergent profile stops at the iteration cap and returns its last estimate")
    void divergentProfile_hitsCap() {
        // Secant steps on a cube root overshoot by ~2x each time
        when(forward.applyAsDouble(anyDouble())).thenAnswer(inv -> -Math.cbrt(inv.<Double>getArgument(0) - 20000.0));

        SolverResult r = new SecantAltitudeSolver().solve(forward, 0.0);

        assertAll(
            () -> assertEquals(20, r.getIterations()),
            () -> assertFalse(r.isConverged()),
            () -> assertTrue(Double.isFinite(r.getAltitudeFt()))
        );
        verify(forward, times(40)).applyAsDouble(anyDouble());
    }

    @Test
    @DisplayName("Flat probe pair ends the iteration at the last finite estimate")
    void flatProfile_degenerateSlope() {
        when(forward.applyAsDouble(anyDouble())).thenReturn(1.0);

        SolverResult r = new SecantAltitudeSolver().solve(forward, 0.5);

        assertAll(
            () -> assertEquals(5000.0, r.getAltitudeFt(), 0.0),
            () -> assertEquals(1, r.getIterations()),
            () -> assertFalse(r.isConverged())
        );
    }

    @Test
    @DisplayName("Seed already within tolerance: no evaluations")
    void seedWithinTolerance_noIterations() {
        SolverSettings s = new SolverSettings();
        s.setInitialEstimateFt(1000.0);
        s.setFirstGuessFt(1003.0);

        SolverResult r = new SecantAltitudeSolver(s).solve(forward, 42.0);

        assertEquals(1003.0, r.getAltitudeFt(), 0.0);
        assertEquals(0, r.getIterations());
        assertTrue(r.isConverged());
        verifyNoInteractions(forward);
    }

    @Test
    @DisplayName("Custom settings change the probe step and cap")
    void customSettings() {
        when(forward.applyAsDouble(anyDouble())).thenAnswer(inv -> -Math.cbrt(inv.<Double>getArgument(0) - 20000.0));
        SolverSettings s = new SolverSettings();
        s.setProbeStepFt(100.0);
        s.setMaxIterations(3);

        SecantAltitudeSolver solver = new SecantAltitudeSolver(s);
        s.setMaxIterations(50); // copied at construction

        SolverResult r = solver.solve(forward, 0.0);

        assertEquals(3, r.getIterations());
        assertEquals(100.0, solver.getProbeStepFt(), 0.0);
        verify(forward).applyAsDouble(5000.0);
        verify(forward).applyAsDouble(5100.0);
        verify(forward, times(6)).applyAsDouble(anyDouble());
    }

    @Test
    @DisplayName("Settings reject values the iteration cannot use")
    void settings_validation() {
        SolverSettings s = new SolverSettings();
        assertAll(
            () -> assertThrows(IllegalArgumentException.class, () -> s.setProbeStepFt(0.0)),
            () -> assertThrows(IllegalArgumentException.class, () -> s.setToleranceFt(-5.0)),
            () -> assertThrows(IllegalArgumentException.class, () -> s.setMaxIterations(0)),
            () -> assertThrows(IllegalArgumentException.class, () -> s.setFirstGuessFt(Double.NaN)),
            () -> assertThrows(NullPointerException.class, () -> new SecantAltitudeSolver(null)),
            () -> assertThrows(NullPointerException.class, () -> new SecantAltitudeSolver().solve(null, 1.0))
        );
    }

    @Test
    @DisplayName("Defaults match the classic inversion")
    void settings_defaults() {
        SolverSettings s = new SolverSettings();
        assertAll(
            () -> assertEquals(0.0, s.getInitialEstimateFt()),
            () -> assertEquals(5000.0, s.getFirstGuessFt()),
            () -> assertEquals(500.0, s.getProbeStepFt()),
            () -> assertEquals(5.0, s.getToleranceFt()),
            () -> assertEquals(20, s.getMaxIterations()),
            () -> assertTrue(s.toString().contains("probeStepFt=500.0"))
        );
    }
}
