package com.github.trinity.eqprop;

import java.util.List;

/**
 * Small vector helpers shared by the gradient engine, the trainer and the
 * cross-validation code.
 *
 * @author Sean Phillips
 */
public class CircuitHelper {

    /**
     * Squared voltage drop across every connection.
     *
     * @param connections connections in weight order
     * @param voltages    all node voltages, fixed first
     * @return (V_a - V_b)^2 per connection
     */
    public static double[] squaredDrops(List<Connection> connections, double[] voltages) {
        double[] drops = new double[connections.size()];
        for (int w = 0; w < drops.length; w++) {
            double dv = connections.get(w).voltageDrop(voltages);
            drops[w] = dv * dv;
        }
        return drops;
    }

    /**
     * Largest absolute component difference over {@code [from, a.length)}.
     */
    public static double maxAbsDifference(double[] a, double[] b, int from) {
        double max = 0.0;
        for (int i = from; i < a.length; i++) {
            max = Math.max(max, Math.abs(a[i] - b[i]));
        }
        return max;
    }

    public static double percentError(double reference, double measured) {
        double diff = Math.abs(reference - measured);
        // near-zero references are compared absolutely, scaled the same way
        if (Math.abs(reference) > 1e-6) {
            return diff / Math.abs(reference) * 100.0;
        }
        return diff * 100.0;
    }
}
