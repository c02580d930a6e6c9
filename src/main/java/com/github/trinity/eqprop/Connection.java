package com.github.trinity.eqprop;

/**
 * One weight resistor between two global node indices. Current is counted
 * positive when it flows from {@code nodeA} to {@code nodeB}.
 *
 * @author Sean Phillips
 */
public record Connection(int nodeA, int nodeB) {

    /**
     * @param voltages voltages of all nodes, fixed first
     * @return V(nodeA) - V(nodeB)
     */
    public double voltageDrop(double[] voltages) {
        return voltages[nodeA] - voltages[nodeB];
    }
}
