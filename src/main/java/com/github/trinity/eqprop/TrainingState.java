package com.github.trinity.eqprop;

/**
 * Lifecycle of a training run. Every state other than RUNNING is terminal.
 *
 * @author Sean Phillips
 */
public enum TrainingState {
    RUNNING,
    /** Summed epoch loss fell below the convergence threshold. */
    CONVERGED,
    /** No improvement for {@code patience} epochs. */
    PLATEAUED,
    /** Every pattern of an epoch failed to solve after all retries. */
    FAILED,
    /** Epoch budget used up. */
    EXHAUSTED;

    public boolean isTerminal() {
        return this != RUNNING;
    }
}
