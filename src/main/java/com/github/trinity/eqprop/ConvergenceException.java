package com.github.trinity.eqprop;

/**
 * Raised when the Newton iteration does not bring the KCL residual under
 * tolerance within its iteration budget. The exception records which solve
 * failed so callers (the trainer's retry policy) can tell a free-phase
 * failure from a nudge-phase one.
 *
 * @author Sean Phillips
 */
public class ConvergenceException extends CircuitException {

    /** Which equilibrium solve raised the failure. */
    public enum Phase {
        STANDALONE,
        FREE,
        NUDGE,
        NUDGE_POSITIVE,
        NUDGE_NEGATIVE
    }

    private final Phase phase;
    private final int iterations;
    private final double residualNorm;

    public ConvergenceException(String message, int iterations, double residualNorm) {
        this(message, Phase.STANDALONE, iterations, residualNorm, null);
    }

    public ConvergenceException(String message, int iterations, double residualNorm, Throwable cause) {
        this(message, Phase.STANDALONE, iterations, residualNorm, cause);
    }

    private ConvergenceException(String message, Phase phase, int iterations,
                                 double residualNorm, Throwable cause) {
        super(message, cause);
        this.phase = phase;
        this.iterations = iterations;
        this.residualNorm = residualNorm;
    }

    /**
     * Re-labels a solver failure with the phase it happened in, keeping the
     * original as the cause.
     *
     * @param phase phase the failed solve belonged to
     * @return a new exception tagged with {@code phase}
     */
    public ConvergenceException inPhase(Phase phase) {
        return new ConvergenceException(
            phase + " phase: " + getMessage(), phase, iterations, residualNorm, this);
    }

    public Phase getPhase() {
        return phase;
    }

    public int getIterations() {
        return iterations;
    }

    public double getResidualNorm() {
        return residualNorm;
    }
}
