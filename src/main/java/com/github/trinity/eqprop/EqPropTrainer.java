package com.github.trinity.eqprop;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;
import java.util.Random;

/**
 * Equilibrium propagation training loop.
 * <p>
 * Each epoch visits every pattern once, asks {@link EqPropGradientEngine} for the
 * gradient and moves the weight conductances against it, clamped to the
 * {@link WeightBounds}. In {@link TrainingConfig.UpdateMode#FULL_BATCH} the
 * per-pattern gradients are summed and applied after the epoch; in
 * {@link TrainingConfig.UpdateMode#PER_PATTERN} each one is applied immediately.
 * </p>
 * <p>
 * A pattern whose solve fails is retried up to {@code retryBudget} times from the
 * resistive pre-solve plus Gaussian noise. If it still fails it is skipped for
 * the epoch with a warning, as is one whose gradient comes back non-finite. Only
 * epochs in which every pattern was solved can set the best loss. An epoch in
 * which no pattern could be solved ends the run as {@link TrainingState#FAILED}.
 * </p>
 * <p>
 * Not thread-safe: use one trainer per thread. The caller's weight array is never
 * modified.
 * </p>
 *
 * @author Sean Phillips
 */
public class EqPropTrainer {
    private static final Logger LOG = LoggerFactory.getLogger(EqPropTrainer.class);

    private final TrainingConfig config;
    private final EqPropGradientEngine engine;
    private TrainingListener listener;

    public EqPropTrainer() {
        this(new TrainingConfig());
    }

    public EqPropTrainer(TrainingConfig config) {
        this(config, null);
    }

    EqPropTrainer(TrainingConfig config, EqPropGradientEngine engine) {
        this.config = config.copy();
        this.engine = engine != null ? engine : new EqPropGradientEngine(this.config.gradientConfig());
        this.listener = (epoch, loss, predictions) -> LOG.info("Epoch {}: loss {} predictions {}",
            epoch, String.format("%.6f", loss), formatPredictions(predictions));
    }

    public TrainingConfig getConfig() {
        return config.copy();
    }

    public void setListener(TrainingListener listener) {
        this.listener = listener;
    }

    /**
     * Trains with the given hyperparameters, overriding the configured ones.
     */
    public TrainingResult train(List<Pattern> dataset, Network network, double[] initialWeights,
                                double learningRate, double beta, int patience) {
        TrainingConfig c = config.copy();
        c.learningRate = learningRate;
        c.beta = beta;
        c.patience = patience;
        EqPropTrainer trainer = new EqPropTrainer(c, engine);
        trainer.setListener(listener);
        return trainer.train(dataset, network, initialWeights);
    }

    /**
     * @param dataset        patterns, visited in order every epoch
     * @param network        topology
     * @param initialWeights starting resistances, or null for seeded uniform-conductance weights
     * @return final and best weights, terminal state and history
     */
    public TrainingResult train(List<Pattern> dataset, Network network, double[] initialWeights) {
        if (dataset.isEmpty()) {
            throw new IllegalArgumentException("Dataset is empty");
        }
        WeightBounds bounds = config.weightBounds;
        Random random = new Random(config.seed);
        double[] weights = initialWeights != null
            ? initialWeights.clone()
            : bounds.randomWeights(network.numWeights(), random);
        if (weights.length != network.numWeights()) {
            throw new IllegalArgumentException(
                "Expected " + network.numWeights() + " weights, got " + weights.length);
        }
        for (int i = 0; i < weights.length; i++) {
            weights[i] = Math.max(bounds.minResistance(), Math.min(bounds.maxResistance(), weights[i]));
        }

        LOG.info("Training {} patterns on {}: lr={}, beta={}, maxEpochs={}, patience={}, {} / {}",
            dataset.size(), network, config.learningRate, config.beta, config.maxEpochs,
            config.patience, config.updateMode, config.nudgeMode);

        TrainingHistory history = new TrainingHistory();
        GradientBuffer buffer = new GradientBuffer(network.numWeights());
        double[] bestWeights = weights.clone();
        double bestLoss = Double.POSITIVE_INFINITY;
        int bestEpoch = 0;
        double epochLoss = Double.NaN;
        double[] predictions = new double[dataset.size()];
        Arrays.fill(predictions, Double.NaN);
        int stepParity = 0;
        int epoch = 0;
        TrainingState state = TrainingState.RUNNING;

        while (!state.isTerminal()) {
            if (epoch >= config.maxEpochs) {
                state = TrainingState.EXHAUSTED;
                break;
            }
            epoch++;
            double[] epochStart = weights.clone();
            double[] patternLoss = new double[dataset.size()];
            Arrays.fill(predictions, Double.NaN);
            buffer.clear();
            epochLoss = 0.0;
            int solved = 0;

            for (int p = 0; p < dataset.size(); p++) {
                Pattern pattern = dataset.get(p);
                GradientResult result = gradientWithRetry(network, pattern, weights, stepParity, random,
                    history, epoch, p);
                stepParity++;
                if (result == null) {
                    patternLoss[p] = Double.NaN;
                    continue;
                }
                solved++;
                patternLoss[p] = result.loss();
                predictions[p] = result.prediction();
                epochLoss += result.loss();
                if (result.branchMismatch()) {
                    history.recordBranchMismatch();
                }
                if (config.updateMode == TrainingConfig.UpdateMode.PER_PATTERN) {
                    history.recordClamps(bounds.applyUpdate(weights, result.gradient(), config.learningRate));
                } else {
                    buffer.accumulate(result.gradient());
                }
            }

            if (solved == 0) {
                epochLoss = Double.NaN;
                state = TrainingState.FAILED;
                LOG.error("Epoch {}: no pattern could be solved after {} retries each, stopping",
                    epoch, config.retryBudget);
                break;
            }
            if (config.updateMode == TrainingConfig.UpdateMode.FULL_BATCH) {
                history.recordClamps(bounds.applyUpdate(weights, buffer.values(), config.learningRate));
            }
            history.recordEpoch(epochLoss, patternLoss);

            // epochLoss was measured at the weights the epoch started from; a partial
            // epoch sums fewer patterns and is not comparable
            if (solved == dataset.size() && epochLoss < bestLoss - config.minDelta) {
                bestLoss = epochLoss;
                bestEpoch = epoch;
                bestWeights = epochStart;
            }

            if (solved == dataset.size() && epochLoss < config.convergenceThreshold) {
                state = TrainingState.CONVERGED;
            } else if (epoch - bestEpoch >= config.patience) {
                state = TrainingState.PLATEAUED;
            } else if (config.logInterval > 0 && epoch % config.logInterval == 0) {
                listener.onProgress(epoch, epochLoss, predictions.clone());
            }
        }

        if (epoch > 0) {
            listener.onProgress(epoch, epochLoss, predictions.clone());
        }
        LOG.info("Training stopped: {} after {} epochs, best loss {} at epoch {}", state, epoch,
            String.format("%.6f", bestLoss), bestEpoch);
        return new TrainingResult(weights, bestWeights, state, epochLoss, bestLoss, bestEpoch, epoch,
            predictions.clone(), history);
    }

    /**
     * @return the gradient, or null once the retry budget is spent
     */
    private GradientResult gradientWithRetry(Network network, Pattern pattern, double[] weights,
                                             int stepParity, Random random, TrainingHistory history,
                                             int epoch, int patternIndex) {
        double[] guess = null;
        for (int attempt = 0; ; attempt++) {
            try {
                GradientResult result = engine.computeGradient(network, pattern.inputs(), weights,
                    pattern.target(), config.beta, stepParity, null, guess);
                checkFinite(result);
                return result;
            } catch (ConvergenceException ex) {
                if (attempt >= config.retryBudget) {
                    history.recordSkip();
                    LOG.warn("Epoch {}: skipping pattern {} after {} attempts: {}", epoch, patternIndex,
                        attempt + 1, ex.getMessage());
                    return null;
                }
                history.recordRetry();
                LOG.warn("Epoch {}: retrying pattern {} ({}/{}): {}", epoch, patternIndex, attempt + 1,
                    config.retryBudget, ex.getMessage());
                guess = EquilibriumSolver.resistiveSolve(network, pattern.inputs(), weights);
                for (int i = 0; i < guess.length; i++) {
                    guess[i] += random.nextGaussian() * config.retryPerturbation;
                }
            }
        }
    }

    private static void checkFinite(GradientResult result) {
        double[] gradient = result.gradient();
        for (int i = 0; i < gradient.length; i++) {
            if (!Double.isFinite(gradient[i])) {
                throw new ConvergenceException("Gradient for W" + (i + 1) + " is not finite: " + gradient[i],
                    result.freeEquilibrium().iterations(), result.freeEquilibrium().residualNorm());
            }
        }
    }

    static String formatPredictions(double[] predictions) {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < predictions.length; i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(String.format("%.4f", predictions[i]));
        }
        return sb.append(']').toString();
    }
}
