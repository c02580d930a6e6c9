package com.github.trinity.eqprop;

/**
 * Settings of the EqProp gradient engine.
 *
 * @author Sean Phillips
 */
public class GradientConfig {
    /**
     * Default nudge strength, used when the caller passes none
     */
    public double beta = 1e-5;

    /**
     * Nudge scheme
     */
    public NudgeMode nudgeMode = NudgeMode.SYMMETRIC;

    /**
     * Largest free-node shift (V) between free and nudged equilibria before the
     * nudged solve is reported as having landed on another branch
     */
    public double branchTolerance = 0.5;

    /**
     * Settings shared by the free and nudge solves
     */
    public SolverConfig solver = new SolverConfig();

    public GradientConfig() {
    }

    public GradientConfig(NudgeMode nudgeMode) {
        this.nudgeMode = nudgeMode;
    }

    public GradientConfig copy() {
        GradientConfig c = new GradientConfig(nudgeMode);
        c.beta = beta;
        c.branchTolerance = branchTolerance;
        c.solver = solver.copy();
        return c;
    }
}
