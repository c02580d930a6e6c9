package com.github.trinity.eqprop;

import com.github.trinity.eqprop.xor.XorTopology;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

public class EquilibriumSolverTest {

    private final EquilibriumSolver solver = new EquilibriumSolver();

    /** 3 fixed (x1, x2, bias), h1, h2 with diode pairs at 2.5 V, outputs yp, yn. */
    static Network threeInputNetwork() {
        return Network.builder(3, 4)
            .connect(0, 3).connect(0, 4)
            .connect(1, 3).connect(1, 4)
            .connect(2, 3).connect(2, 4)
            .connect(3, 5).connect(3, 6)
            .connect(4, 5).connect(4, 6)
            .diodePair(3, 2.5).diodePair(4, 2.5)
            .outputs(5, 6).nudgeSign(5, 1.0).nudgeSign(6, -1.0)
            .build();
    }

    static double[] uniform(int n, double r) {
        double[] w = new double[n];
        Arrays.fill(w, r);
        return w;
    }

    @Test
    public void testEqualResistorDivider() {
        Network net = Network.builder(2, 1).connect(0, 2).connect(1, 2).build();
        Equilibrium eq = solver.solve(net, new double[]{1.0, 3.0}, new double[]{10000.0, 10000.0});
        assertEquals(2.0, eq.freeVoltages()[0], 1e-9);
    }

    @Test
    public void testStoredSolutionCannotBeMutatedByCallers() {
        Network net = Network.builder(2, 1).connect(0, 2).connect(1, 2).build();
        double[] guess = {2.5};
        Equilibrium eq = solver.solve(net, new double[]{1.0, 3.0}, new double[]{10000.0, 10000.0}, null, guess);
        eq.freeVoltages()[0] = 99.0;
        guess[0] = 99.0;
        assertEquals(2.0, eq.freeVoltages()[0], 1e-9);
        assertEquals(2.0, eq.allVoltages(net, new double[]{1.0, 3.0})[2], 1e-9);
    }

    @Test
    public void testUnequalResistorDivider() {
        Network net = Network.builder(2, 1).connect(0, 2).connect(1, 2).build();
        Equilibrium eq = solver.solve(net, new double[]{0.0, 5.0}, new double[]{10000.0, 40000.0});
        double expected = (5.0 / 40000) / (1 / 10000.0 + 1 / 40000.0);
        assertEquals(expected, eq.freeVoltages()[0], 1e-9);
    }

    @Test
    public void testThreeSources() {
        Network net = Network.builder(3, 1).connect(0, 3).connect(1, 3).connect(2, 3).build();
        double[] r = {5000.0, 10000.0, 20000.0};
        double[] v = {1.0, 3.0, 5.0};
        double num = 0;
        double den = 0;
        for (int i = 0; i < 3; i++) {
            num += v[i] / r[i];
            den += 1 / r[i];
        }
        assertEquals(num / den, solver.solve(net, v, r).freeVoltages()[0], 1e-9);
    }

    @Test
    public void testMatchesLinearSolutionWhenDiodesDisabled() {
        // two fixed, two free in a chain: x0 - a - b - x1
        Network net = Network.builder(2, 2)
            .connect(0, 2).connect(1, 3).connect(2, 3)
            .diodePair(2, new DiodePair(2.5, DiodeParams.disabled()))
            .build();
        double v0 = 1.0;
        double v1 = 4.0;
        double[] r = {12000.0, 33000.0, 47000.0};
        double g1 = 1 / r[0];
        double g2 = 1 / r[1];
        double g3 = 1 / r[2];
        double det = (g1 + g3) * (g2 + g3) - g3 * g3;
        double a = (g1 * v0 * (g2 + g3) + g3 * g2 * v1) / det;
        double b = ((g1 + g3) * g2 * v1 + g3 * g1 * v0) / det;

        double[] free = solver.solve(net, new double[]{v0, v1}, r).freeVoltages();
        assertEquals(a, free[0], Math.abs(a) * 1e-9);
        assertEquals(b, free[1], Math.abs(b) * 1e-9);
        assertArrayEquals(free, EquilibriumSolver.resistiveSolve(net, new double[]{v0, v1}, r), 1e-9);
    }

    @Test
    public void testUniformWeightsKeepXorSymmetric() {
        Network net = XorTopology.createNetwork();
        double[] w = uniform(16, 21200.0);
        for (Pattern p : XorTopology.DATASET) {
            double[] v = solver.solve(net, p.inputs(), w).freeVoltages();
            assertEquals(v[0], v[1], 1e-6, "h1 vs h2");
            assertEquals(v[2], v[3], 1e-6, "yp vs yn");
        }
    }

    @Test
    public void testDiodesClampHiddenNodes() {
        Network net = XorTopology.createNetwork();
        double[] w = uniform(16, 5000.0);
        double[][] inputs = {
            XorTopology.inputs(1.0, 1.0), XorTopology.inputs(4.0, 4.0), XorTopology.inputs(1.0, 4.0)};
        for (double[] in : inputs) {
            double[] v = solver.solve(net, in, w).freeVoltages();
            assertTrue(v[0] > 1.8 && v[0] < 3.2, "h1=" + v[0]);
            assertTrue(v[1] > 1.8 && v[1] < 3.2, "h2=" + v[1]);
        }
    }

    @Test
    public void testThreeInputReferenceVoltages() {
        Network net = threeInputNetwork();
        double[] w = uniform(10, 21200.0);
        double[][] inputs = {{4.0, 4.0, 2.5}, {1.0, 1.0, 2.5}, {4.0, 1.0, 2.5}};
        double[] expectedH1 = {2.70137, 2.29863, 2.5};
        for (int i = 0; i < inputs.length; i++) {
            double h1 = solver.solve(net, inputs[i], w).freeVoltages()[0];
            double errPct = Math.abs(h1 - expectedH1[i]) / expectedH1[i] * 100;
            assertTrue(errPct < 1.0, "h1=" + h1 + " vs " + expectedH1[i]);
        }
    }

    @Test
    public void testNudgePropagatesToHiddenLayer() {
        Network net = threeInputNetwork();
        double[] w = uniform(10, 21200.0);
        double[] inputs = {1.0, 4.0, 2.5};
        double[] free = solver.solve(net, inputs, w).freeVoltages();
        double[] nudge = new double[4];
        nudge[2] = 10e-6;
        double[] nudged = solver.solve(net, inputs, w, nudge, free).freeVoltages();

        assertTrue(nudged[2] > free[2], "current into yp must raise it");
        double ratio = (nudged[2] - free[2]) / (nudged[0] - free[0]);
        assertEquals(4.0, ratio, 0.5);
    }

    @Test
    public void testResidualWithinToleranceAtSolution() {
        Network net = XorTopology.createNetwork();
        double[] w = new double[16];
        for (int i = 0; i < w.length; i++) {
            w[i] = 20000.0 + 2500.0 * i;
        }
        double[] in = XorTopology.inputs(4.0, 1.0);
        Equilibrium eq = solver.solve(net, in, w);
        KclState state = EquilibriumSolver.evaluate(net, in, w, null, eq.freeVoltages());
        assertTrue(new KclConvergenceChecker(new SolverConfig()).converged(eq.iterations(), null, state));
        assertEquals(state.residualNorm(), eq.residualNorm(), 1e-20);
        assertTrue(eq.iterations() > 0);
    }

    @Test
    public void testWarmStartNeedsFewerIterations() {
        Network net = XorTopology.createNetwork();
        double[] w = uniform(16, 100000.0);
        w[10] = 1590.0;
        w[11] = 1590.0;
        double[] in = XorTopology.inputs(1.0, 4.0);
        Equilibrium free = solver.solve(net, in, w);
        double[] nudge = net.nudgeCurrents(1e-5, 0.3);

        int warm = solver.solve(net, in, w, nudge, free.freeVoltages()).iterations();
        int cold = solver.solve(net, in, w, nudge, uniform(4, 2.5)).iterations();
        assertTrue(warm < cold, "warm=" + warm + " cold=" + cold);
    }

    @Test
    public void testIterationBudgetExceededThrows() {
        Network net = XorTopology.createNetwork();
        SolverConfig config = new SolverConfig();
        config.maxIterations = 1;
        EquilibriumSolver limited = new EquilibriumSolver(config);
        ConvergenceException ex = assertThrows(ConvergenceException.class,
            () -> limited.solve(net, XorTopology.inputs(1.0, 4.0), uniform(16, 5000.0), null,
                uniform(4, 0.0)));
        assertEquals(1, ex.getIterations());
        assertEquals(ConvergenceException.Phase.STANDALONE, ex.getPhase());
        assertTrue(ex.getResidualNorm() > 0.0);
    }

    @Test
    public void testBadArgumentsRejected() {
        Network net = XorTopology.createNetwork();
        double[] in = XorTopology.inputs(1.0, 1.0);
        assertThrows(IllegalArgumentException.class, () -> solver.solve(net, new double[3], uniform(16, 1e4)));
        assertThrows(IllegalArgumentException.class, () -> solver.solve(net, in, uniform(15, 1e4)));
        double[] negative = uniform(16, 1e4);
        negative[4] = -1.0;
        assertThrows(IllegalArgumentException.class, () -> solver.solve(net, in, negative));
        assertThrows(IllegalArgumentException.class,
            () -> solver.solve(net, in, uniform(16, 1e4), new double[2], null));
    }

    @Test
    public void testSolverAcceptsResistanceOutsidePotRange() {
        Network net = Network.builder(2, 1).connect(0, 2).connect(1, 2).build();
        Equilibrium eq = solver.solve(net, new double[]{0.0, 1.0}, new double[]{10.0, 1e7});
        assertEquals(1e-6, eq.freeVoltages()[0], 1e-8);
    }
}
