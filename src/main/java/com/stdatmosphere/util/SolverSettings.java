package com.stdatmosphere.util;

/**
 * Tuning for {@link SecantAltitudeSolver}.
 * <p>
 *   Defaults reproduce the classic inversion: first estimate 0 ft, first guess 5000 ft,
 *   500 ft probe step, 5 ft tolerance, at most 20 iterations.
 * </p>
 */
public class SolverSettings {

    public static final double DEFAULT_INITIAL_ESTIMATE_FT = 0.0;
    public static final double DEFAULT_FIRST_GUESS_FT      = 5000.0;
    public static final double DEFAULT_PROBE_STEP_FT       = 500.0;
    public static final double DEFAULT_TOLERANCE_FT        = 5.0;
    public static final int    DEFAULT_MAX_ITERATIONS      = 20;
    public static final int    DEFAULT_WARN_ITERATIONS     = 18;

    // ── Iteration seed ──────────────────────────────────────────────────────
    private double initialEstimateFt;
    private double firstGuessFt;

    // ── Secant probe & stopping rule ────────────────────────────────────────
    private double probeStepFt;
    private double toleranceFt;
    private int    maxIterations;

    /** Iteration counts above this are logged at WARN. */
    private int    warnIterations;

    /**
     * Constructor with default values.
     */
    public SolverSettings() {
        this.initialEstimateFt = DEFAULT_INITIAL_ESTIMATE_FT;
        this.firstGuessFt = DEFAULT_FIRST_GUESS_FT;
        this.probeStepFt = DEFAULT_PROBE_STEP_FT;
        this.toleranceFt = DEFAULT_TOLERANCE_FT;
        this.maxIterations = DEFAULT_MAX_ITERATIONS;
        this.warnIterations = DEFAULT_WARN_ITERATIONS;
    }

    // =====================================================================
    // Getters & setters
    // =====================================================================
    public double getInitialEstimateFt()              { return initialEstimateFt; }
    public void   setInitialEstimateFt(double ft)     { this.initialEstimateFt = requireFinite(ft, "initialEstimateFt"); }

    public double getFirstGuessFt()                   { return firstGuessFt; }
    public void   setFirstGuessFt(double ft)          { this.firstGuessFt = requireFinite(ft, "firstGuessFt"); }

    public double getProbeStepFt()                    { return probeStepFt; }
    public void   setProbeStepFt(double ft)           { this.probeStepFt = requirePositive(ft, "probeStepFt"); }

    public double getToleranceFt()                    { return toleranceFt; }
    public void   setToleranceFt(double ft)           { this.toleranceFt = requirePositive(ft, "toleranceFt"); }

    public int    getMaxIterations()                  { return maxIterations; }
    public void   setMaxIterations(int n) {
        if (n < 1) throw new IllegalArgumentException("maxIterations must be >= 1, got " + n);
        this.maxIterations = n;
    }

    public int    getWarnIterations()                 { return warnIterations; }
    public void   setWarnIterations(int n)            { this.warnIterations = Math.max(0, n); }

    // =====================================================================
    private static double requireFinite(double v, String name) {
        if (!Double.isFinite(v)) throw new IllegalArgumentException(name + " must be finite, got " + v);
        return v;
    }

    private static double requirePositive(double v, String name) {
        if (!Double.isFinite(v) || v <= 0.0) throw new IllegalArgumentException(name + " must be > 0, got " + v);
        return v;
    }

    @Override
    public String toString() {
        return "SolverSettings{" +
                "initialEstimateFt=" + initialEstimateFt +
                ", firstGuessFt=" + firstGuessFt +
                ", probeStepFt=" + probeStepFt +
                ", toleranceFt=" + toleranceFt +
                ", maxIterations=" + maxIterations +
                ", warnIterations=" + warnIterations +
                "}";
    }
}
