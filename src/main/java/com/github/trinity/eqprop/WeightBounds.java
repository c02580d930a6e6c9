package com.github.trinity.eqprop;

import java.util.Random;

/**
 * Physical range of a weight resistor: a series protection resistor in line
 * with an MCP4251-style digital potentiometer.
 * <p>
 * Weights travel as resistances; updates happen in conductance space, where the
 * usable range is {@code [1/maxResistance, 1/minResistance]}.
 * </p>
 *
 * @param seriesResistance   protection resistor in series with the pot (ohm)
 * @param minResistance      resistance at the top tap, wiper plus series (ohm)
 * @param maxResistance      resistance at tap 1, full pot plus series (ohm)
 * @param tapCount           number of pot tap positions
 * @param potFullScale       full-scale pot resistance (ohm)
 * @author Sean Phillips
 */
public record WeightBounds(double seriesResistance, double minResistance, double maxResistance,
                           int tapCount, double potFullScale) {

    /** MCP4251-104 with a 1.2k series resistor. */
    public static final WeightBounds MCP4251 = new WeightBounds(1200.0, 1590.0, 101200.0, 256, 100000.0);

    /** Paired resistances and tap positions produced by {@link #quantize(double[])}. */
    public record Quantized(double[] resistances, int[] taps) {
    }

    public WeightBounds {
        if (!(minResistance > 0.0) || !(maxResistance > minResistance)) {
            throw new IllegalArgumentException(
                "Resistance bounds must satisfy 0 < min < max, got [" + minResistance + ", " + maxResistance + "]");
        }
        if (tapCount < 1 || potFullScale <= 0.0) {
            throw new IllegalArgumentException("Tap count and pot full scale must be positive");
        }
    }

    public double gMin() {
        return 1.0 / maxResistance;
    }

    public double gMax() {
        return 1.0 / minResistance;
    }

    public double clampConductance(double g) {
        return Math.max(gMin(), Math.min(gMax(), g));
    }

    public boolean contains(double resistance) {
        return resistance >= minResistance && resistance <= maxResistance;
    }

    /**
     * Gradient-descent step in conductance space, applied in place:
     * {@code G_new = clamp(G_old - learningRate * gradient[i])}, converted back to
     * resistance. A clamped conductance maps to exactly {@code minResistance} or
     * {@code maxResistance}, never to a rounded reciprocal. The gradient is checked
     * in full before any weight changes.
     *
     * @param weights      resistances, updated in place
     * @param gradient     dLoss/dG per weight
     * @param learningRate step size
     * @return number of weights pushed past a bound
     */
    public int applyUpdate(double[] weights, double[] gradient, double learningRate) {
        if (weights.length != gradient.length) {
            throw new IllegalArgumentException(
                "Gradient length " + gradient.length + " does not match " + weights.length + " weights");
        }
        for (int i = 0; i < gradient.length; i++) {
            if (!Double.isFinite(gradient[i])) {
                throw new IllegalArgumentException("Gradient for W" + (i + 1) + " is not finite: " + gradient[i]);
            }
        }
        int clamped = 0;
        for (int i = 0; i < weights.length; i++) {
            double g = 1.0 / weights[i] - learningRate * gradient[i];
            if (g > gMax()) {
                weights[i] = minResistance;
                clamped++;
            } else if (g < gMin()) {
                weights[i] = maxResistance;
                clamped++;
            } else if (g == gMax()) {
                weights[i] = minResistance;
            } else if (g == gMin()) {
                weights[i] = maxResistance;
            } else {
                weights[i] = Math.max(minResistance, Math.min(maxResistance, 1.0 / g));
            }
        }
        return clamped;
    }

    /**
     * Conductances drawn uniformly from {@code [gMin, gMax]}, returned as resistances.
     *
     * @param count  number of weights
     * @param random source of randomness
     * @return resistances within bounds
     */
    public double[] randomWeights(int count, Random random) {
        double[] weights = new double[count];
        for (int i = 0; i < count; i++) {
            double g = gMin() + random.nextDouble() * (gMax() - gMin());
            weights[i] = Math.max(minResistance, Math.min(maxResistance, 1.0 / g));
        }
        return weights;
    }

    /**
     * Map a continuous resistance to the nearest tap, 1..tapCount.
     */
    public int resistanceToTap(double resistance) {
        double rPot = resistance - seriesResistance;
        long tap = Math.round((potFullScale - rPot) * tapCount / potFullScale);
        return (int) Math.max(1, Math.min(tapCount, tap));
    }

    /**
     * Exact resistance at a tap position.
     */
    public double tapToResistance(int tap) {
        double rPot = potFullScale * (1.0 - (double) tap / tapCount);
        return rPot + seriesResistance;
    }

    /**
     * Round-trips weights through the hardware tap positions.
     */
    public Quantized quantize(double[] weights) {
        int[] taps = new int[weights.length];
        double[] resistances = new double[weights.length];
        for (int i = 0; i < weights.length; i++) {
            taps[i] = resistanceToTap(weights[i]);
            resistances[i] = tapToResistance(taps[i]);
        }
        return new Quantized(resistances, taps);
    }

    /**
     * @throws WeightBoundsException when {@code resistance} lies outside the pot range
     */
    public void checkResistance(int index, double resistance) {
        if (!contains(resistance)) {
            throw new WeightBoundsException(String.format(
                "W%d = %.1f ohm outside [%.1f, %.1f]", index + 1, resistance, minResistance, maxResistance),
                index, resistance);
        }
    }

    /**
     * @throws WeightBoundsException when {@code conductance} lies outside {@code [gMin, gMax]}
     */
    public void checkConductance(int index, double conductance) {
        if (!(conductance >= gMin() && conductance <= gMax())) {
            throw new WeightBoundsException(String.format(
                "W%d = %.3e S outside [%.3e, %.3e]", index + 1, conductance, gMin(), gMax()),
                index, conductance);
        }
    }

    /**
     * Rejects a whole weight vector if any entry is out of range.
     */
    public void validate(double[] weights) {
        for (int i = 0; i < weights.length; i++) {
            checkResistance(i, weights[i]);
        }
    }
}
