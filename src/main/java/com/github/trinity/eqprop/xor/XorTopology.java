package com.github.trinity.eqprop.xor;

import com.github.trinity.eqprop.EquilibriumSolver;
import com.github.trinity.eqprop.Network;
import com.github.trinity.eqprop.Pattern;
import com.github.trinity.eqprop.WeightBounds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * The 16-weight complementary-input XOR network.
 * <p>
 * Global nodes: 0=x1, 1=x1c, 2=x2, 3=x2c, 4=vlow, 5=vhigh (fixed), 6=h1, 7=h2,
 * 8=yp, 9=yn (free). Each input is also applied in complement ({@code 5 - x}) so a
 * hidden node sees an effective signed weight {@code g(x -> h) - g(xc -> h)}.
 * The hidden nodes carry BAT42 pairs to the 2.5 V rail; the output is
 * {@code V(yp) - V(yn)}.
 * </p>
 *
 * @author Sean Phillips
 */
public final class XorTopology {
    private static final Logger LOG = LoggerFactory.getLogger(XorTopology.class);

    public static final double V_MID = 2.5;
    public static final double V_LOW = 1.0;
    public static final double V_HIGH = 4.0;
    public static final double SUPPLY = 5.0;

    public static final int H1 = 6;
    public static final int H2 = 7;
    public static final int YP = 8;
    public static final int YN = 9;

    public static final List<String> NODE_NAMES = List.of(
        "x1", "x1c", "x2", "x2c", "vlow", "vhigh", "h1", "h2", "yp", "yn");

    public static final List<String> LABELS = List.of("(0,0)", "(0,1)", "(1,0)", "(1,1)");

    /**
     * Truth table: logic 0 encoded as 1 V, logic 1 as 4 V. Target 0.3 V is
     * within reach of the diode-limited hidden swing of roughly 2.2 to 2.8 V.
     */
    public static final List<Pattern> DATASET = List.of(
        new Pattern(inputs(V_LOW, V_LOW), 0.0),
        new Pattern(inputs(V_LOW, V_HIGH), 0.3),
        new Pattern(inputs(V_HIGH, V_LOW), 0.3),
        new Pattern(inputs(V_HIGH, V_HIGH), 0.0));

    /** Outcome of classifying one pattern. */
    public record PatternCheck(String label, double prediction, double target, boolean correct) {
    }

    /** Outcome of {@link #verify}. */
    public record Verification(List<PatternCheck> patterns, boolean passed) {
    }

    private XorTopology() {
    }

    public static Network createNetwork() {
        Network.Builder b = Network.builder(6, 4);
        // W1..W8: inputs and complements into h1, h2
        for (int input = 0; input < 4; input++) {
            b.connect(input, H1).connect(input, H2);
        }
        // W9..W12: bias rails
        b.connect(4, H1).connect(4, H2).connect(5, H1).connect(5, H2);
        // W13..W16: hidden to output
        b.connect(H1, YP).connect(H1, YN).connect(H2, YP).connect(H2, YN);
        return b.diodePair(H1, V_MID)
            .diodePair(H2, V_MID)
            .outputs(YP, YN)
            .nudgeSign(YP, 1.0)
            .nudgeSign(YN, -1.0)
            .nodeNames(NODE_NAMES)
            .build();
    }

    /**
     * Fixed-node voltages for input voltages {@code vx1, vx2}.
     */
    public static double[] inputs(double vx1, double vx2) {
        return new double[]{vx1, SUPPLY - vx1, vx2, SUPPLY - vx2, V_LOW, V_HIGH};
    }

    public static Verification verify(Network network, double[] weights) {
        return verify(network, weights, new EquilibriumSolver(), 0.1);
    }

    /**
     * Classifies every pattern of {@link #DATASET}. A pattern with target above 0.1
     * is correct when the prediction exceeds {@code threshold}, otherwise when
     * {@code |prediction| < threshold}.
     */
    public static Verification verify(Network network, double[] weights, EquilibriumSolver solver,
                                      double threshold) {
        List<PatternCheck> checks = new ArrayList<>();
        boolean passed = true;
        for (int p = 0; p < DATASET.size(); p++) {
            Pattern pattern = DATASET.get(p);
            double[] all = solver.solve(network, pattern.inputs(), weights)
                .allVoltages(network, pattern.inputs());
            double prediction = network.prediction(all);
            boolean correct = pattern.target() > 0.1
                ? prediction > threshold
                : Math.abs(prediction) < threshold;
            LOG.info("{}: pred={} target={} [{}]", LABELS.get(p), String.format("%+.4f", prediction),
                String.format("%.1f", pattern.target()), correct ? "PASS" : "FAIL");
            checks.add(new PatternCheck(LABELS.get(p), prediction, pattern.target(), correct));
            passed &= correct;
        }
        return new Verification(List.copyOf(checks), passed);
    }

    /**
     * Logs each weight with its nearest potentiometer tap.
     */
    public static void logWeights(double[] weights, WeightBounds bounds) {
        for (int i = 0; i < weights.length; i++) {
            LOG.info("W{}: R={} ohm (tap={})", String.format("%2d", i + 1),
                String.format("%8.0f", weights[i]), String.format("%3d", bounds.resistanceToTap(weights[i])));
        }
    }
}
