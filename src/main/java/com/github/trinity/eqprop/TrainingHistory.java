package com.github.trinity.eqprop;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Loss curve and solver incidents of one training run.
 *
 * @author Sean Phillips
 */
public class TrainingHistory {
    private final List<Double> epochLosses = new ArrayList<>();
    private final List<double[]> patternLosses = new ArrayList<>();
    private int retries;
    private int skippedPatterns;
    private int branchMismatches;
    private int clampedUpdates;

    void recordEpoch(double loss, double[] perPattern) {
        epochLosses.add(loss);
        patternLosses.add(perPattern.clone());
    }

    void recordRetry() {
        retries++;
    }

    void recordSkip() {
        skippedPatterns++;
    }

    void recordBranchMismatch() {
        branchMismatches++;
    }

    void recordClamps(int count) {
        clampedUpdates += count;
    }

    /** Summed loss of each completed epoch. */
    public List<Double> getEpochLosses() {
        return Collections.unmodifiableList(epochLosses);
    }

    /** Loss of each pattern per epoch; NaN where the pattern was skipped. */
    public List<double[]> getPatternLosses() {
        return Collections.unmodifiableList(patternLosses);
    }

    public int getEpochCount() {
        return epochLosses.size();
    }

    public int getRetries() {
        return retries;
    }

    public int getSkippedPatterns() {
        return skippedPatterns;
    }

    public int getBranchMismatches() {
        return branchMismatches;
    }

    public int getClampedUpdates() {
        return clampedUpdates;
    }
}
