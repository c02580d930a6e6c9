package com.github.trinity.eqprop;

/**
 * One training example: clamped input voltages and the desired differential output.
 *
 * @author Sean Phillips
 */
public record Pattern(double[] inputs, double target) {
}
