package com.stdatmosphere.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.DoubleUnaryOperator;

/**
 * Bracket-free secant inversion of an altitude profile.
 * <p>
 * Finds z such that f(z) = target, where f is a forward atmosphere quantity (altitude in ft).
 * Each iteration probes f at the current estimate z and at z + dz and takes one linear step:
 *
 *   m  = dz / (f(z + dz) - f(z))
 *   z' = m * (target - f(z)) + z
 *
 * Iteration stops once |z' - z| is within tolerance or the iteration cap is reached. Hitting
 * the cap is not an error: the last estimate is returned with {@code converged == false}.
 * <p>
 * Assumes f is monotonic over the region explored (true for pressure, density, q and EAS
 * between 0 and 300 kft). A flat probe pair (non-finite slope) ends the iteration at the
 * last finite estimate.
 */
public final class SecantAltitudeSolver {

    private static final Logger LOG = LoggerFactory.getLogger(SecantAltitudeSolver.class);

    private final double initialEstimateFt;
    private final double firstGuessFt;
    private final double probeStepFt;
    private final double toleranceFt;
    private final int maxIterations;
    private final int warnIterations;

    public SecantAltitudeSolver() {
        this(new SolverSettings());
    }

    /** Settings are copied; later changes to {@code settings} have no effect. */
    public SecantAltitudeSolver(SolverSettings settings) {
        Objects.requireNonNull(settings, "settings must not be null");
        this.initialEstimateFt = settings.getInitialEstimateFt();
        this.firstGuessFt = settings.getFirstGuessFt();
        this.probeStepFt = settings.getProbeStepFt();
        this.toleranceFt = settings.getToleranceFt();
        this.maxIterations = settings.getMaxIterations();
        this.warnIterations = settings.getWarnIterations();
    }

    /**
     * Solve f(z) = target for z.
     *
     * @param forward  forward quantity as a function of altitude in ft
     * @param target   value of the quantity to reach, same units as {@code forward}
     * @return best-effort altitude (ft) with iteration count and convergence flag
     */
    public SolverResult solve(DoubleUnaryOperator forward, double target) {
        Objects.requireNonNull(forward, "forward function must not be null");

        double previous = initialEstimateFt;
        double estimate = firstGuessFt;
        int n = 0;

        while (Math.abs(estimate - previous) > toleranceFt && n < maxIterations) {
            previous = estimate;
            final double f1 = forward.applyAsDouble(previous);
            final double f2 = forward.applyAsDouble(previous + probeStepFt);
            final double slope = probeStepFt / (f2 - f1);
            final double next = slope * (target - f1) + previous;
            n++;

            if (!Double.isFinite(next)) {
                LOG.warn("Secant step degenerate at z={} ft (f={}, f(z+dz)={}, target={}); stopping after {} iterations",
                        previous, f1, f2, target, n);
                return new SolverResult(previous, n, false);
            }
            estimate = next;
        }

        final boolean converged = Math.abs(estimate - previous) <= toleranceFt;
        if (n > warnIterations) {
            LOG.warn("Altitude inversion took n = {} iterations (cap {}, converged={}); z={} ft",
                    n, maxIterations, converged, estimate);
        } else {
            LOG.debug("Altitude inversion: target={} → z={} ft after {} iterations", target, estimate, n);
        }
        return new SolverResult(estimate, n, converged);
    }

    public double getProbeStepFt() { return probeStepFt; }

    public double getToleranceFt() { return toleranceFt; }

    public int getMaxIterations() { return maxIterations; }
}
