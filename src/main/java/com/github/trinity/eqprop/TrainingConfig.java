package com.github.trinity.eqprop;

/**
 * Hyperparameters of {@link EqPropTrainer}.
 *
 * <ul>
 *   <li><b>learningRate</b>: step size in conductance space. Gradients are in V^2 so
 *       steps of order 1e-9 S need a rate of this order.</li>
 *   <li><b>beta</b>: nudge strength (A per V of output error).</li>
 *   <li><b>maxEpochs</b>: passes over the dataset before giving up.</li>
 *   <li><b>patience</b>: epochs without an improvement larger than <b>minDelta</b> before stopping.</li>
 *   <li><b>convergenceThreshold</b>: summed epoch loss below which training has converged.</li>
 *   <li><b>updateMode</b>: one update per pattern or one accumulated update per epoch.</li>
 *   <li><b>retryBudget</b>: extra solve attempts per pattern, each from a perturbed guess.</li>
 * </ul>
 *
 * @author Sean Phillips
 */
public class TrainingConfig {

    public enum UpdateMode {
        /** Weights change after every pattern. */
        PER_PATTERN,
        /** Gradients of all patterns are summed and applied once per epoch. */
        FULL_BATCH
    }

    public double learningRate = 5e-9;
    public double beta = 1e-5;
    public int maxEpochs = 50000;
    public int patience = 500;
    public double minDelta = 1e-6;
    public double convergenceThreshold = 0.005;
    public UpdateMode updateMode = UpdateMode.FULL_BATCH;
    public NudgeMode nudgeMode = NudgeMode.SYMMETRIC;
    public int retryBudget = 3;

    /**
     * Standard deviation (V) of the Gaussian noise added to the resistive guess on a retry
     */
    public double retryPerturbation = 0.05;

    /**
     * Seed for weight initialisation and retry noise
     */
    public long seed = 42L;

    /**
     * Epochs between progress reports
     */
    public int logInterval = 5000;

    public WeightBounds weightBounds = WeightBounds.MCP4251;
    public double branchTolerance = 0.5;
    public SolverConfig solver = new SolverConfig();

    public TrainingConfig() {
    }

    public TrainingConfig(double learningRate, double beta, int maxEpochs, int patience) {
        this.learningRate = learningRate;
        this.beta = beta;
        this.maxEpochs = maxEpochs;
        this.patience = patience;
    }

    /**
     * Settings for the gradient engine this configuration drives.
     */
    public GradientConfig gradientConfig() {
        GradientConfig g = new GradientConfig(nudgeMode);
        g.beta = beta;
        g.branchTolerance = branchTolerance;
        g.solver = solver.copy();
        return g;
    }

    public TrainingConfig copy() {
        TrainingConfig c = new TrainingConfig(learningRate, beta, maxEpochs, patience);
        c.minDelta = minDelta;
        c.convergenceThreshold = convergenceThreshold;
        c.updateMode = updateMode;
        c.nudgeMode = nudgeMode;
        c.retryBudget = retryBudget;
        c.retryPerturbation = retryPerturbation;
        c.seed = seed;
        c.logInterval = logInterval;
        c.weightBounds = weightBounds;
        c.branchTolerance = branchTolerance;
        c.solver = solver.copy();
        return c;
    }

    /**
     * Applies one {@code key=value} override, as given on the command line.
     *
     * @throws IllegalArgumentException on an unknown key or unparsable value
     */
    public void set(String key, String value) {
        try {
            switch (key) {
                case "learningRate" -> learningRate = Double.parseDouble(value);
                case "beta" -> beta = Double.parseDouble(value);
                case "maxEpochs" -> maxEpochs = Integer.parseInt(value);
                case "patience" -> patience = Integer.parseInt(value);
                case "minDelta" -> minDelta = Double.parseDouble(value);
                case "convergenceThreshold" -> convergenceThreshold = Double.parseDouble(value);
                case "updateMode" -> updateMode = UpdateMode.valueOf(value.toUpperCase());
                case "nudgeMode" -> nudgeMode = NudgeMode.valueOf(value.toUpperCase());
                case "retryBudget" -> retryBudget = Integer.parseInt(value);
                case "retryPerturbation" -> retryPerturbation = Double.parseDouble(value);
                case "seed" -> seed = Long.parseLong(value);
                case "logInterval" -> logInterval = Integer.parseInt(value);
                case "branchTolerance" -> branchTolerance = Double.parseDouble(value);
                case "maxIterations" -> solver.maxIterations = Integer.parseInt(value);
                case "maxVoltageStep" -> solver.maxVoltageStep = Double.parseDouble(value);
                default -> throw new IllegalArgumentException("Unknown training option: " + key);
            }
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Bad value for " + key + ": " + value, ex);
        }
    }

    @Override
    public String toString() {
        return "TrainingConfig[lr=" + learningRate + ", beta=" + beta + ", maxEpochs=" + maxEpochs
            + ", patience=" + patience + ", updateMode=" + updateMode + ", nudgeMode=" + nudgeMode + "]";
    }
}
