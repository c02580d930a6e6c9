package com.github.trinity.eqprop;

/**
 * Raised when a resistance or conductance is set explicitly outside the
 * physical range of the weight potentiometer. The training loop never raises
 * this; it clamps instead.
 *
 * @author Sean Phillips
 */
public class WeightBoundsException extends CircuitException {

    private final int weightIndex;
    private final double value;

    public WeightBoundsException(String message, int weightIndex, double value) {
        super(message);
        this.weightIndex = weightIndex;
        this.value = value;
    }

    /**
     * @return index of the offending weight, or -1 for a standalone value
     */
    public int getWeightIndex() {
        return weightIndex;
    }

    public double getValue() {
        return value;
    }
}
