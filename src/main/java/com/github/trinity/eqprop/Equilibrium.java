package com.github.trinity.eqprop;

/**
 * Result of one equilibrium solve. The voltage array is copied in and out, so a
 * stored result stays usable as a warm start.
 *
 * @param freeVoltages voltages of the free nodes, in free-node order
 * @param iterations   Newton iterations taken (0 when the initial guess already satisfied KCL)
 * @param residualNorm largest absolute KCL residual at the returned point (A)
 * @author Sean Phillips
 */
public record Equilibrium(double[] freeVoltages, int iterations, double residualNorm) {

    public Equilibrium {
        freeVoltages = freeVoltages.clone();
    }

    @Override
    public double[] freeVoltages() {
        return freeVoltages.clone();
    }

    /**
     * @param network       topology the solve belonged to
     * @param fixedVoltages clamped voltages used for the solve
     * @return every node voltage, fixed first
     */
    public double[] allVoltages(Network network, double[] fixedVoltages) {
        return network.allVoltages(fixedVoltages, freeVoltages);
    }
}
