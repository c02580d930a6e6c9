package com.github.trinity.eqprop;

/**
 * Progress callback of {@link EqPropTrainer}, called every {@code logInterval}
 * epochs and once more when training stops.
 *
 * @author Sean Phillips
 */
@FunctionalInterface
public interface TrainingListener {

    /**
     * @param epoch       1-based epoch just completed
     * @param loss        summed loss of that epoch
     * @param predictions prediction per pattern, NaN for skipped patterns
     */
    void onProgress(int epoch, double loss, double[] predictions);
}
