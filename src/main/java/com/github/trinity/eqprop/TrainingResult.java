package com.github.trinity.eqprop;

/**
 * Outcome of {@link EqPropTrainer#train}.
 *
 * @param weights     weights at the end of the run
 * @param bestWeights weights that produced {@code bestLoss}
 * @param state       terminal state
 * @param finalLoss   summed loss of the last epoch
 * @param bestLoss    lowest summed epoch loss seen
 * @param bestEpoch   1-based epoch of {@code bestLoss}, 0 if none completed
 * @param epochsRun   epochs completed
 * @param predictions prediction per pattern in the last epoch
 * @param history     loss curve and counters
 * @author Sean Phillips
 */
public record TrainingResult(double[] weights, double[] bestWeights, TrainingState state,
                             double finalLoss, double bestLoss, int bestEpoch, int epochsRun,
                             double[] predictions, TrainingHistory history) {
}
