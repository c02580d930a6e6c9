package com.github.trinity.eqprop.xor;

import com.github.trinity.eqprop.EqPropTrainer;
import com.github.trinity.eqprop.EquilibriumSolver;
import com.github.trinity.eqprop.Network;
import com.github.trinity.eqprop.TrainingConfig;
import com.github.trinity.eqprop.TrainingResult;
import com.github.trinity.eqprop.TrainingState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Trains the XOR network and checks the result.
 * <p>
 * Arguments are {@code key=value} overrides of {@link TrainingConfig} fields,
 * e.g. {@code learningRate=5e-10 beta=5e-5 updateMode=PER_PATTERN}. Exits 0 when
 * all four patterns are classified correctly, 1 otherwise, 2 on bad arguments.
 * </p>
 *
 * @author Sean Phillips
 */
public class EqPropXorApp {
    private static final Logger LOG = LoggerFactory.getLogger(EqPropXorApp.class);

    public static void main(String[] args) {
        TrainingConfig config;
        try {
            config = parseArgs(args);
        } catch (IllegalArgumentException ex) {
            LOG.error("{}", ex.getMessage());
            LOG.error("Usage: EqPropXorApp [key=value ...]");
            System.exit(2);
            return;
        }
        System.exit(run(config) ? 0 : 1);
    }

    static TrainingConfig parseArgs(String[] args) {
        TrainingConfig config = new TrainingConfig();
        for (String arg : args) {
            int eq = arg.indexOf('=');
            if (eq <= 0) {
                throw new IllegalArgumentException("Expected key=value, got: " + arg);
            }
            config.set(arg.substring(0, eq).trim(), arg.substring(eq + 1).trim());
        }
        return config;
    }

    /**
     * @return true when the trained weights classify every XOR pattern correctly
     */
    public static boolean run(TrainingConfig config) {
        Network network = XorTopology.createNetwork();
        LOG.info("Training XOR network ({} weights) with {}", network.numWeights(), config);

        TrainingResult result = new EqPropTrainer(config).train(XorTopology.DATASET, network, null);
        if (result.state() == TrainingState.CONVERGED) {
            LOG.info("Converged at epoch {}", result.epochsRun());
        } else {
            LOG.warn("Stopped {} after {} epochs (best loss {} at epoch {})", result.state(),
                result.epochsRun(), String.format("%.6f", result.bestLoss()), result.bestEpoch());
        }

        XorTopology.Verification verification = XorTopology.verify(network, result.weights(),
            new EquilibriumSolver(config.solver), 0.1);
        XorTopology.logWeights(result.weights(), config.weightBounds);

        if (verification.passed()) {
            LOG.info("XOR learned via equilibrium propagation");
        } else {
            if (result.state() != TrainingState.CONVERGED) {
                LOG.info("Did not converge. Try learningRate=5e-10 or beta=5e-5");
            }
            LOG.error("XOR not learned");
        }
        return verification.passed();
    }
}
