package com.github.trinity.eqprop;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class DiodeModelTest {

    private static final DiodeParams BAT42 = DiodeParams.BAT42;

    @Test
    public void testPairIsZeroAtZeroBias() {
        DiodeModel.Response r = DiodeModel.pairCurrent(0.0, BAT42);
        assertEquals(0.0, r.current(), 0.0);
        assertEquals(2 * 1e-7 / (1.1 * 0.02585), r.conductance(), 1e-15);
    }

    @Test
    public void testPairMatchesHyperbolicSine() {
        double nVt = BAT42.emissionVoltage();
        for (double v : new double[]{-0.4, -0.1, 0.05, 0.2, 0.45}) {
            double expected = 2 * 1e-7 * Math.sinh(v / nVt);
            assertEquals(expected, DiodeModel.pairCurrent(v, BAT42).current(), Math.abs(expected) * 1e-10,
                "I(" + v + ")");
        }
    }

    @Test
    public void testPairIsOddAndConductanceEven() {
        for (double v : new double[]{0.01, 0.15, 0.3, 0.6}) {
            DiodeModel.Response pos = DiodeModel.pairCurrent(v, BAT42);
            DiodeModel.Response neg = DiodeModel.pairCurrent(-v, BAT42);
            assertEquals(-pos.current(), neg.current(), Math.abs(pos.current()) * 1e-12);
            assertEquals(pos.conductance(), neg.conductance(), pos.conductance() * 1e-12);
        }
    }

    @Test
    public void testConductanceIsDerivativeOfCurrent() {
        double h = 1e-7;
        for (double v : new double[]{-0.3, 0.0, 0.12, 0.35}) {
            double numeric = (DiodeModel.pairCurrent(v + h, BAT42).current()
                - DiodeModel.pairCurrent(v - h, BAT42).current()) / (2 * h);
            double analytic = DiodeModel.pairCurrent(v, BAT42).conductance();
            assertEquals(analytic, numeric, analytic * 1e-5, "dI/dV at " + v);
        }
    }

    @Test
    public void testLargeBiasStaysFiniteAndMonotone() {
        double previous = Double.NEGATIVE_INFINITY;
        for (double v = 1.0; v <= 10.0; v += 0.5) {
            DiodeModel.Response r = DiodeModel.pairCurrent(v, BAT42);
            assertTrue(Double.isFinite(r.current()), "current at " + v);
            assertTrue(Double.isFinite(r.conductance()), "conductance at " + v);
            assertTrue(r.current() > previous, "current must keep rising at " + v);
            previous = r.current();
        }
    }

    @Test
    public void testExponentContinuousAtCap() {
        double below = DiodeModel.limitedExp(DiodeModel.MAX_EXPONENT - 1e-9);
        double above = DiodeModel.limitedExp(DiodeModel.MAX_EXPONENT + 1e-9);
        assertEquals(below, above, below * 1e-8);
    }

    @Test
    public void testDisabledDiodeConductsNothing() {
        DiodeModel.Response r = DiodeModel.pairCurrent(0.7, DiodeParams.disabled());
        assertEquals(0.0, r.current(), 0.0);
        assertEquals(0.0, r.conductance(), 0.0);
    }

    @Test
    public void testInvalidParamsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new DiodeParams(-1e-9, 1.0, 0.025));
        assertThrows(IllegalArgumentException.class, () -> new DiodeParams(1e-9, 0.0, 0.025));
    }

    @Test
    public void testDiodePairMeasuresFromAnchor() {
        DiodePair pair = new DiodePair(2.5);
        assertEquals(0.0, pair.response(2.5).current(), 0.0);
        double expected = DiodeModel.pairCurrent(0.2, BAT42).current();
        assertEquals(expected, pair.response(2.7).current(), Math.abs(expected) * 1e-12);
    }
}
