package com.github.trinity.eqprop;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Equilibrium propagation gradient for a single pattern.
 * <p>
 * The free phase solves the network as is. The nudge phase injects
 * {@code sign * beta * (target - prediction)} into each output node and solves
 * again from the free equilibrium. For connection {@code i} between nodes
 * {@code (a, b)} the conductance-space gradient is
 * <pre>
 * dLoss/dG_i = ((V_nudge[a] - V_nudge[b])^2 - (V_free[a] - V_free[b])^2) / (2 * beta)
 * </pre>
 * which is exact only as {@code beta -> 0}. {@link NudgeMode#SYMMETRIC} replaces
 * the free state by a {@code -beta} nudge and divides by {@code 4 * beta},
 * cancelling the first-order bias of a one-sided nudge; {@link NudgeMode#ALTERNATING}
 * gets the same cancellation across consecutive steps by flipping the sign of
 * beta on odd step parities.
 * </p>
 * <p>
 * A failing solve is never turned into a zero gradient: the
 * {@link ConvergenceException} propagates, tagged with the phase that failed.
 * When a nudged solve moves any free node further than the configured branch
 * tolerance the result is flagged as a branch mismatch and a warning is logged.
 * </p>
 *
 * @author Sean Phillips
 */
public class EqPropGradientEngine {
    private static final Logger LOG = LoggerFactory.getLogger(EqPropGradientEngine.class);

    private final GradientConfig config;
    private final EquilibriumSolver solver;

    public EqPropGradientEngine() {
        this(new GradientConfig());
    }

    public EqPropGradientEngine(GradientConfig config) {
        this.config = config.copy();
        this.solver = new EquilibriumSolver(this.config.solver);
    }

    public EquilibriumSolver getSolver() {
        return solver;
    }

    public NudgeMode getNudgeMode() {
        return config.nudgeMode;
    }

    /**
     * Gradient at the configured default beta.
     */
    public GradientResult computeGradient(Network network, double[] inputs, double[] weights,
                                          double target, int stepParity) {
        return computeGradient(network, inputs, weights, target, config.beta, stepParity);
    }

    /**
     * @param network    topology
     * @param inputs     clamped voltages
     * @param weights    resistances in connection order
     * @param target     desired differential output
     * @param beta       nudge strength (non-zero)
     * @param stepParity caller's step counter; only its parity matters, and only for ALTERNATING
     * @return prediction, loss and gradient
     * @throws ConvergenceException tagged FREE, NUDGE, NUDGE_POSITIVE or NUDGE_NEGATIVE
     */
    public GradientResult computeGradient(Network network, double[] inputs, double[] weights,
                                          double target, double beta, int stepParity) {
        return computeGradient(network, inputs, weights, target, beta, stepParity, null, null);
    }

    /**
     * As {@link #computeGradient(Network, double[], double[], double, double, int)}, optionally
     * reusing an already solved free phase or starting the free solve from a given guess.
     *
     * @param freePhase  free-phase equilibrium for these exact inputs and weights, or null
     * @param freeGuess  initial guess for the free solve when {@code freePhase} is null, or null
     */
    public GradientResult computeGradient(Network network, double[] inputs, double[] weights,
                                          double target, double beta, int stepParity,
                                          Equilibrium freePhase, double[] freeGuess) {
        if (beta == 0.0 || !Double.isFinite(beta)) {
            throw new IllegalArgumentException("Nudge strength beta must be finite and non-zero: " + beta);
        }

        Equilibrium free = freePhase;
        if (free == null) {
            try {
                free = solver.solve(network, inputs, weights, null, freeGuess);
            } catch (ConvergenceException ex) {
                throw ex.inPhase(ConvergenceException.Phase.FREE);
            }
        }
        double[] freeAll = free.allVoltages(network, inputs);
        double prediction = network.prediction(freeAll);
        double error = target - prediction;
        double loss = 0.5 * error * error;

        double effectiveBeta = beta;
        if (config.nudgeMode == NudgeMode.ALTERNATING && (stepParity & 1) == 1) {
            effectiveBeta = -beta;
        }

        int fixed = network.numFixed();
        double[] gradient;
        double[] nudgeAll;
        double[] oppositeAll = null;
        double deviation;
        int nudgeIterations;

        if (config.nudgeMode == NudgeMode.SYMMETRIC) {
            Equilibrium plus = nudgeSolve(network, inputs, weights, free, beta, error,
                ConvergenceException.Phase.NUDGE_POSITIVE);
            Equilibrium minus = nudgeSolve(network, inputs, weights, free, -beta, error,
                ConvergenceException.Phase.NUDGE_NEGATIVE);
            nudgeAll = plus.allVoltages(network, inputs);
            oppositeAll = minus.allVoltages(network, inputs);
            double[] dPlus = CircuitHelper.squaredDrops(network.connections(), nudgeAll);
            double[] dMinus = CircuitHelper.squaredDrops(network.connections(), oppositeAll);
            gradient = new double[dPlus.length];
            for (int w = 0; w < gradient.length; w++) {
                gradient[w] = (dPlus[w] - dMinus[w]) / (4.0 * beta);
            }
            deviation = Math.max(
                CircuitHelper.maxAbsDifference(nudgeAll, freeAll, fixed),
                CircuitHelper.maxAbsDifference(oppositeAll, freeAll, fixed));
            nudgeIterations = plus.iterations() + minus.iterations();
        } else {
            Equilibrium nudged = nudgeSolve(network, inputs, weights, free, effectiveBeta, error,
                ConvergenceException.Phase.NUDGE);
            nudgeAll = nudged.allVoltages(network, inputs);
            double[] dNudge = CircuitHelper.squaredDrops(network.connections(), nudgeAll);
            double[] dFree = CircuitHelper.squaredDrops(network.connections(), freeAll);
            gradient = new double[dNudge.length];
            for (int w = 0; w < gradient.length; w++) {
                gradient[w] = (dNudge[w] - dFree[w]) / (2.0 * effectiveBeta);
            }
            deviation = CircuitHelper.maxAbsDifference(nudgeAll, freeAll, fixed);
            nudgeIterations = nudged.iterations();
        }

        boolean mismatch = deviation > config.branchTolerance;
        if (mismatch) {
            LOG.warn("Nudged equilibrium moved {} V from the free equilibrium (tolerance {} V); "
                    + "the nudge solve likely landed on another branch",
                String.format("%.4f", deviation), config.branchTolerance);
        }
        return new GradientResult(prediction, loss, gradient, effectiveBeta, free, freeAll, nudgeAll,
            oppositeAll, deviation, mismatch, nudgeIterations);
    }

    private Equilibrium nudgeSolve(Network network, double[] inputs, double[] weights, Equilibrium free,
                                   double beta, double error, ConvergenceException.Phase phase) {
        double[] nudge = network.nudgeCurrents(beta, error);
        try {
            return solver.solve(network, inputs, weights, nudge, free.freeVoltages());
        } catch (ConvergenceException ex) {
            throw ex.inPhase(phase);
        }
    }
}
