package com.github.trinity.eqprop;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularMatrixException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Steady-state KCL solver for networks of clamped and free nodes joined by
 * weight resistors, with optional antiparallel diode pairs from free nodes to
 * fixed anchor rails.
 * <p>
 * For every free node {@code n} the residual {@code F_n} is the net current into
 * the node: resistor currents {@code (V_other - V_n) / R}, minus the current the
 * diode pair sinks toward its anchor, plus any injected nudge current. Newton's
 * method drives {@code F} to zero using the analytic Jacobian: conductances off
 * the diagonal, conductances plus diode differential conductance on it.
 * </p>
 * <p>
 * Without an explicit initial guess the solve starts from the exact solution
 * of the diode-free linear system. Starting at the anchor voltage instead puts
 * Newton where diode conductance is near zero, which can stall it or send it to
 * a spurious branch.
 * </p>
 * <p>
 * The solver holds only its configuration; it is safe to share across threads as
 * long as each call gets its own weight and guess arrays.
 * </p>
 *
 * @author Sean Phillips
 */
public class EquilibriumSolver {
    private static final Logger LOG = LoggerFactory.getLogger(EquilibriumSolver.class);

    /** LU pivot threshold; conductances of real networks sit many decades above it. */
    private static final double SINGULARITY_THRESHOLD = 1e-30;

    private final SolverConfig config;
    private final KclConvergenceChecker checker;

    public EquilibriumSolver() {
        this(new SolverConfig());
    }

    public EquilibriumSolver(SolverConfig config) {
        this.config = config.copy();
        this.checker = new KclConvergenceChecker(this.config);
    }

    public SolverConfig getConfig() {
        return config.copy();
    }

    /**
     * Free-phase solve: no injected current, resistive pre-solve as the starting point.
     *
     * @param network       topology
     * @param fixedVoltages voltages of the fixed nodes
     * @param weights       resistance of each connection, in connection order
     * @return the equilibrium
     * @throws ConvergenceException if Newton does not reach tolerance within its budget
     */
    public Equilibrium solve(Network network, double[] fixedVoltages, double[] weights) {
        return solve(network, fixedVoltages, weights, null, null);
    }

    /**
     * Solves KCL with optional current injection and optional starting point.
     *
     * @param network       topology
     * @param fixedVoltages voltages of the fixed nodes
     * @param weights       resistance of each connection (any positive value)
     * @param nudge         current injected into each free node (positive = into the node), or null
     * @param initialGuess  starting free voltages, or null for the resistive pre-solve
     * @return the equilibrium; the solver keeps no state between calls
     * @throws ConvergenceException if Newton does not reach tolerance within its budget
     */
    public Equilibrium solve(Network network, double[] fixedVoltages, double[] weights,
                             double[] nudge, double[] initialGuess) {
        checkInputs(network, fixedVoltages, weights);
        int n = network.numFree();
        if (nudge != null && nudge.length != n) {
            throw new IllegalArgumentException("Nudge vector length " + nudge.length + " != " + n + " free nodes");
        }
        if (initialGuess != null && initialGuess.length != n) {
            throw new IllegalArgumentException("Initial guess length " + initialGuess.length + " != " + n + " free nodes");
        }

        double[] v = initialGuess != null
            ? initialGuess.clone()
            : resistiveSolve(network, fixedVoltages, weights);

        KclState state = evaluate(network, fixedVoltages, weights, nudge, v);
        KclState previous = null;
        int iteration = 0;
        while (!checker.converged(iteration, previous, state)) {
            if (iteration >= config.maxIterations) {
                throw new ConvergenceException(String.format(
                    "KCL residual %.3e A still above tolerance after %d Newton iterations",
                    state.residualNorm(), iteration), iteration, state.residualNorm());
            }
            iteration++;

            RealVector rhs = new ArrayRealVector(state.getResidual()).mapMultiply(-1.0);
            RealVector step;
            try {
                step = new LUDecomposition(state.getJacobian(), SINGULARITY_THRESHOLD).getSolver().solve(rhs);
            } catch (SingularMatrixException ex) {
                throw new ConvergenceException("Singular KCL Jacobian at Newton iteration " + iteration,
                    iteration, state.residualNorm(), ex);
            }

            double largest = step.getLInfNorm();
            double scale = largest > config.maxVoltageStep ? config.maxVoltageStep / largest : 1.0;
            for (int i = 0; i < n; i++) {
                v[i] += scale * step.getEntry(i);
            }
            if (!allFinite(v)) {
                throw new ConvergenceException("Newton iterate became non-finite at iteration " + iteration,
                    iteration, Double.NaN);
            }

            previous = state;
            state = evaluate(network, fixedVoltages, weights, nudge, v);
        }

        LOG.debug("Equilibrium after {} Newton iterations, residual {}", iteration,
            String.format("%.3e", state.residualNorm()));
        return new Equilibrium(v, iteration, state.residualNorm());
    }

    /**
     * Evaluates residual, per-node current scale and Jacobian at a trial point.
     *
     * @param network       topology
     * @param fixedVoltages voltages of the fixed nodes
     * @param weights       resistance of each connection
     * @param nudge         injected currents, or null
     * @param freeVoltages  trial free-node voltages
     * @return the KCL state at {@code freeVoltages}
     */
    public static KclState evaluate(Network network, double[] fixedVoltages, double[] weights,
                                    double[] nudge, double[] freeVoltages) {
        int n = network.numFree();
        double[] all = network.allVoltages(fixedVoltages, freeVoltages);
        double[] residual = new double[n];
        double[] scale = new double[n];
        double[][] jacobian = new double[n][n];

        for (Element element : network.elements()) {
            switch (element.kind()) {
                case RESISTOR: {
                    int a = element.nodeA();
                    int b = element.nodeB();
                    double g = 1.0 / weights[element.weightIndex()];
                    double current = (all[a] - all[b]) * g;  // a -> b
                    boolean aFree = !network.isFixed(a);
                    boolean bFree = !network.isFixed(b);
                    if (aFree) {
                        int ia = network.freeIndex(a);
                        residual[ia] -= current;
                        scale[ia] = Math.max(scale[ia], Math.abs(current));
                        jacobian[ia][ia] -= g;
                        if (bFree) {
                            jacobian[ia][network.freeIndex(b)] += g;
                        }
                    }
                    if (bFree) {
                        int ib = network.freeIndex(b);
                        residual[ib] += current;
                        scale[ib] = Math.max(scale[ib], Math.abs(current));
                        jacobian[ib][ib] -= g;
                        if (aFree) {
                            jacobian[ib][network.freeIndex(a)] += g;
                        }
                    }
                    break;
                }
                case DIODE_PAIR: {
                    int i = network.freeIndex(element.nodeA());
                    DiodeModel.Response r = element.diode().response(all[element.nodeA()]);
                    residual[i] -= r.current();
                    scale[i] = Math.max(scale[i], Math.abs(r.current()));
                    jacobian[i][i] -= r.conductance();
                    break;
                }
                default:
                    throw new IllegalStateException("Unknown element kind " + element.kind());
            }
        }

        if (nudge != null) {
            for (int i = 0; i < n; i++) {
                residual[i] += nudge[i];
                scale[i] = Math.max(scale[i], Math.abs(nudge[i]));
            }
        }
        return new KclState(freeVoltages.clone(), residual, scale, new Array2DRowRealMatrix(jacobian, false));
    }

    /**
     * Exact solution of the diode-free linear KCL system {@code G v = I}, one LU
     * solve. A free node that only reaches a fixed node through its diode pair
     * would leave {@code G} singular; in that case the pairs are linearised at
     * zero bias and the system is solved again.
     *
     * @param network       topology
     * @param fixedVoltages voltages of the fixed nodes
     * @param weights       resistance of each connection
     * @return free-node voltages of the resistive network
     */
    public static double[] resistiveSolve(Network network, double[] fixedVoltages, double[] weights) {
        checkInputs(network, fixedVoltages, weights);
        try {
            return linearSolve(network, fixedVoltages, weights, false);
        } catch (SingularMatrixException ex) {
            LOG.debug("Resistive system singular, linearising diode pairs at zero bias");
            return linearSolve(network, fixedVoltages, weights, true);
        }
    }

    private static double[] linearSolve(Network network, double[] fixedVoltages, double[] weights,
                                        boolean linearDiodes) {
        int n = network.numFree();
        RealMatrix g = new Array2DRowRealMatrix(n, n);
        double[] injected = new double[n];

        for (int w = 0; w < network.numWeights(); w++) {
            Connection c = network.connections().get(w);
            double cond = 1.0 / weights[w];
            int a = c.nodeA();
            int b = c.nodeB();
            boolean aFree = !network.isFixed(a);
            boolean bFree = !network.isFixed(b);
            if (aFree && bFree) {
                int ia = network.freeIndex(a);
                int ib = network.freeIndex(b);
                g.addToEntry(ia, ia, cond);
                g.addToEntry(ib, ib, cond);
                g.addToEntry(ia, ib, -cond);
                g.addToEntry(ib, ia, -cond);
            } else if (aFree) {
                int ia = network.freeIndex(a);
                g.addToEntry(ia, ia, cond);
                injected[ia] += cond * fixedVoltages[b];
            } else if (bFree) {
                int ib = network.freeIndex(b);
                g.addToEntry(ib, ib, cond);
                injected[ib] += cond * fixedVoltages[a];
            }
        }
        if (linearDiodes) {
            for (Map.Entry<Integer, DiodePair> entry : network.diodePairs().entrySet()) {
                int i = network.freeIndex(entry.getKey());
                DiodePair pair = entry.getValue();
                double cond = DiodeModel.pairCurrent(0.0, pair.params()).conductance();
                g.addToEntry(i, i, cond);
                injected[i] += cond * pair.anchorVoltage();
            }
        }
        return new LUDecomposition(g, SINGULARITY_THRESHOLD).getSolver()
            .solve(new ArrayRealVector(injected, false)).toArray();
    }

    private static void checkInputs(Network network, double[] fixedVoltages, double[] weights) {
        if (fixedVoltages.length != network.numFixed()) {
            throw new IllegalArgumentException(
                "Expected " + network.numFixed() + " fixed voltages, got " + fixedVoltages.length);
        }
        if (weights.length != network.numWeights()) {
            throw new IllegalArgumentException(
                "Expected " + network.numWeights() + " weights, got " + weights.length);
        }
        for (int w = 0; w < weights.length; w++) {
            if (!(weights[w] > 0.0) || Double.isInfinite(weights[w])) {
                throw new IllegalArgumentException("W" + (w + 1) + " must be a positive finite resistance: " + weights[w]);
            }
        }
    }

    private static boolean allFinite(double[] v) {
        for (double x : v) {
            if (!Double.isFinite(x)) {
                return false;
            }
        }
        return true;
    }
}
