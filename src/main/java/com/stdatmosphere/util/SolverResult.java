package com.stdatmosphere.util;

/**
 * Outcome of one altitude inversion. The altitude is always usable; {@code converged}
 * only tells whether successive estimates got within tolerance before the iteration cap.
 */
public final class SolverResult {

    private final double altitudeFt;
    private final int iterations;
    private final boolean converged;

    public SolverResult(double altitudeFt, int iterations, boolean converged) {
        this.altitudeFt = altitudeFt;
        this.iterations = iterations;
        this.converged = converged;
    }

    /** Final altitude estimate, ft. */
    public double getAltitudeFt() { return altitudeFt; }

    public int getIterations() { return iterations; }

    public boolean isConverged() { return converged; }

    @Override
    public String toString() {
        return "SolverResult{altitudeFt=" + altitudeFt +
                ", iterations=" + iterations +
                ", converged=" + converged + "}";
    }
}
