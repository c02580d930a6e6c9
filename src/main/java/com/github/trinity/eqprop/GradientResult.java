package com.github.trinity.eqprop;

/**
 * Output of one EqProp gradient evaluation for a single pattern. Arrays are
 * copied on the way in and out.
 *
 * @param prediction          V(output+) - V(output-) at the free equilibrium
 * @param loss                0.5 * (target - prediction)^2
 * @param gradient            dLoss/dG per connection, in connection order
 * @param effectiveBeta       signed beta actually applied (negative on odd ALTERNATING steps)
 * @param freeEquilibrium     the free-phase solve, reusable as a warm start
 * @param freeVoltages        all node voltages at the free equilibrium
 * @param nudgeVoltages       all node voltages at the (+beta) nudged equilibrium
 * @param oppositeVoltages    all node voltages at the -beta equilibrium (SYMMETRIC only, else null)
 * @param maxNudgeDeviation   largest |V_nudge - V_free| over free nodes and nudge solves
 * @param branchMismatch      true when {@code maxNudgeDeviation} exceeded the branch tolerance
 * @param nudgeIterations     Newton iterations spent on the nudge solve(s)
 * @author Sean Phillips
 */
public record GradientResult(double prediction, double loss, double[] gradient, double effectiveBeta,
                             Equilibrium freeEquilibrium, double[] freeVoltages, double[] nudgeVoltages,
                             double[] oppositeVoltages, double maxNudgeDeviation, boolean branchMismatch,
                             int nudgeIterations) {

    public GradientResult {
        gradient = gradient.clone();
        freeVoltages = copy(freeVoltages);
        nudgeVoltages = copy(nudgeVoltages);
        oppositeVoltages = copy(oppositeVoltages);
    }

    @Override
    public double[] gradient() {
        return gradient.clone();
    }

    @Override
    public double[] freeVoltages() {
        return copy(freeVoltages);
    }

    @Override
    public double[] nudgeVoltages() {
        return copy(nudgeVoltages);
    }

    @Override
    public double[] oppositeVoltages() {
        return copy(oppositeVoltages);
    }

    private static double[] copy(double[] values) {
        return values == null ? null : values.clone();
    }
}
