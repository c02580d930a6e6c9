package com.github.trinity.eqprop;

import java.util.Arrays;

/**
 * Running sum of per-pattern gradients for a full-batch update.
 *
 * @author Sean Phillips
 */
public class GradientBuffer {
    private final double[] gradient;

    public GradientBuffer(int numWeights) {
        gradient = new double[numWeights];
    }

    public void clear() {
        Arrays.fill(gradient, 0.0);
    }

    public void accumulate(double[] g) {
        if (g.length != gradient.length) {
            throw new IllegalArgumentException("Gradient length " + g.length + " != " + gradient.length);
        }
        for (int i = 0; i < gradient.length; i++) {
            gradient[i] += g[i];
        }
    }

    public double[] values() {
        return gradient;
    }
}
