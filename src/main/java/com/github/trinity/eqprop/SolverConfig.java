package com.github.trinity.eqprop;

/**
 * Tunable parameters of the Newton equilibrium solve.
 *
 * <ul>
 *   <li><b>maxIterations</b>: Newton iteration budget per solve.</li>
 *   <li><b>absoluteTolerance</b>: KCL residual (A) accepted at every free node regardless of scale.</li>
 *   <li><b>relativeTolerance</b>: additional residual allowance as a fraction of the largest
 *       branch current meeting at the node, covering cancellation error when large currents balance.</li>
 *   <li><b>maxVoltageStep</b>: largest change (V) any node may take in one Newton step; longer
 *       steps are scaled down as a whole so the direction is kept.</li>
 * </ul>
 *
 * @author Sean Phillips
 */
public class SolverConfig {
    /**
     * Maximum number of Newton iterations
     */
    public int maxIterations = 200;

    /**
     * Absolute residual tolerance in amperes
     */
    public double absoluteTolerance = 1e-15;

    /**
     * Residual tolerance relative to the node's largest branch current
     */
    public double relativeTolerance = 1e-10;

    /**
     * Newton step cap in volts
     */
    public double maxVoltageStep = 0.5;

    // Constructor with defaults
    public SolverConfig() {
    }

    // Constructor for convenience
    public SolverConfig(int maxIterations, double absoluteTolerance, double relativeTolerance) {
        this.maxIterations = maxIterations;
        this.absoluteTolerance = absoluteTolerance;
        this.relativeTolerance = relativeTolerance;
    }

    public SolverConfig copy() {
        SolverConfig c = new SolverConfig(maxIterations, absoluteTolerance, relativeTolerance);
        c.maxVoltageStep = maxVoltageStep;
        return c;
    }
}
