package com.github.trinity.eqprop;

import org.apache.commons.math3.optim.ConvergenceChecker;

/**
 * Declares a Newton iterate converged once every free node satisfies
 * {@code |residual| <= absoluteTolerance + relativeTolerance * currentScale}.
 * <p>
 * Only the residual counts. A small step with a large residual is a stall, not
 * convergence, and must surface as a {@link ConvergenceException}.
 * </p>
 *
 * @author Sean Phillips
 */
public class KclConvergenceChecker implements ConvergenceChecker<KclState> {

    private final double absoluteTolerance;
    private final double relativeTolerance;

    /**
     * @param absoluteTolerance residual floor in amperes
     * @param relativeTolerance residual allowance relative to the node's largest branch current
     */
    public KclConvergenceChecker(double absoluteTolerance, double relativeTolerance) {
        this.absoluteTolerance = absoluteTolerance;
        this.relativeTolerance = relativeTolerance;
    }

    public KclConvergenceChecker(SolverConfig config) {
        this(config.absoluteTolerance, config.relativeTolerance);
    }

    @Override
    public boolean converged(int iteration, KclState previous, KclState current) {
        double[] residual = current.getResidual();
        double[] scale = current.getCurrentScale();
        for (int n = 0; n < residual.length; n++) {
            double tol = absoluteTolerance + relativeTolerance * scale[n];
            // NaN fails this comparison too
            if (!(Math.abs(residual[n]) <= tol)) {
                return false;
            }
        }
        return true;
    }
}
