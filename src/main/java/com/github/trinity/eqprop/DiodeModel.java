package com.github.trinity.eqprop;

import org.apache.commons.math3.util.FastMath;

/**
 * Current and differential conductance of a single diode and of an
 * antiparallel diode pair.
 * <p>
 * The exponent is capped at {@link #MAX_EXPONENT}. Past the cap the
 * exponential is continued along its tangent, so current and conductance stay
 * finite and continuous for any trial voltage Newton's method proposes.
 * </p>
 *
 * @author Sean Phillips
 */
public final class DiodeModel {

    /** Largest exponent evaluated exactly; exp(80) * 1e-7 A is already ~5e27 A. */
    public static final double MAX_EXPONENT = 80.0;

    private static final double EXP_AT_CAP = FastMath.exp(MAX_EXPONENT);

    /** Current through a diode element and its derivative dI/dV. */
    public record Response(double current, double conductance) {
    }

    private DiodeModel() {
    }

    /**
     * Forward diode: {@code I = Is * (exp(v / (N*VT)) - 1)}.
     *
     * @param v      voltage across the diode, anode minus cathode
     * @param params diode parameters
     * @return current from anode to cathode and dI/dv
     */
    public static Response diodeCurrent(double v, DiodeParams params) {
        double nVt = params.emissionVoltage();
        double x = v / nVt;
        double e = limitedExp(x);
        double de = x > MAX_EXPONENT ? EXP_AT_CAP : e;
        double is = params.saturationCurrent();
        return new Response(is * (e - 1.0), is * de / nVt);
    }

    /**
     * Antiparallel pair: {@code I(v) = I_d(v) - I_d(-v) = 2 Is sinh(v / (N*VT))}.
     * Odd in {@code v}; the conductance is even and strictly positive whenever
     * {@code Is > 0}.
     *
     * @param v      voltage across the pair, node minus anchor
     * @param params diode parameters
     * @return current flowing from the node into the anchor rail and dI/dv
     */
    public static Response pairCurrent(double v, DiodeParams params) {
        Response forward = diodeCurrent(v, params);
        Response reverse = diodeCurrent(-v, params);
        return new Response(
            forward.current() - reverse.current(),
            forward.conductance() + reverse.conductance());
    }

    /**
     * Exponential with linear continuation above {@link #MAX_EXPONENT}. Below
     * {@code -MAX_EXPONENT} the plain exponential already underflows gracefully.
     */
    static double limitedExp(double x) {
        if (x > MAX_EXPONENT) {
            return EXP_AT_CAP * (1.0 + (x - MAX_EXPONENT));
        }
        return FastMath.exp(x);
    }
}
