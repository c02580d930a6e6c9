package com.github.trinity.eqprop.spice;

import com.github.trinity.eqprop.CircuitHelper;
import com.github.trinity.eqprop.EquilibriumSolver;
import com.github.trinity.eqprop.Network;
import com.github.trinity.eqprop.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Checks {@link EquilibriumSolver} against ngspice, pattern by pattern.
 * <p>
 * For every free node the error is {@code |solver - spice| / |solver| * 100}, or
 * {@code |solver - spice| * 100} when the solver voltage is within 1 uV of zero.
 * A run passes when every node of every pattern was simulated and is below the
 * tolerance.
 * </p>
 *
 * @author Sean Phillips
 */
public class SpiceCrossValidator {
    private static final Logger LOG = LoggerFactory.getLogger(SpiceCrossValidator.class);

    public static final double IDEAL_TOLERANCE_PCT = 1.0;
    public static final double FULL_TOLERANCE_PCT = 2.0;

    /** Solver and SPICE voltage of one free node; {@code spice} is NaN when missing. */
    public record NodeComparison(String node, double solver, double spice, double errorPct) {
        public boolean within(double tolerancePct) {
            return errorPct < tolerancePct;
        }
    }

    public record PatternReport(int pattern, boolean simulated, List<NodeComparison> nodes, boolean passed) {
    }

    public record Report(List<PatternReport> patterns, double tolerancePct, boolean passed) {
    }

    /** One node in the three-way comparison; missing SPICE values are NaN. */
    public record NodeValues(double solver, double ideal, double full) {
        public double idealMinusFull() {
            return ideal - full;
        }
    }

    public record ComparisonRow(int pattern, double target, Map<String, NodeValues> nodes,
                                NodeValues prediction) {
    }

    private final NgspiceRunner runner;
    private final NetlistWriter writer;
    private final EquilibriumSolver solver;

    public SpiceCrossValidator() {
        this(new NgspiceRunner(), new NetlistWriter(), new EquilibriumSolver());
    }

    public SpiceCrossValidator(NgspiceRunner runner, NetlistWriter writer, EquilibriumSolver solver) {
        this.runner = runner;
        this.writer = writer;
        this.solver = solver;
    }

    public Report crossValidate(Network network, double[] weights, List<Pattern> dataset) {
        return crossValidate(network, weights, dataset, IDEAL_TOLERANCE_PCT);
    }

    /**
     * Solver against the ideal netlist.
     */
    public Report crossValidate(Network network, double[] weights, List<Pattern> dataset, double tolerancePct) {
        return validate(network, weights, dataset, tolerancePct, false);
    }

    public Report crossValidateFull(Network network, double[] weights, List<Pattern> dataset) {
        return crossValidateFull(network, weights, dataset, FULL_TOLERANCE_PCT);
    }

    /**
     * Solver against the board-level netlist. The solver leaves out mux
     * resistance and op-amp offsets, so small differences are expected.
     */
    public Report crossValidateFull(Network network, double[] weights, List<Pattern> dataset,
                                    double tolerancePct) {
        return validate(network, weights, dataset, tolerancePct, true);
    }

    private Report validate(Network network, double[] weights, List<Pattern> dataset, double tolerancePct,
                            boolean full) {
        List<PatternReport> reports = new ArrayList<>();
        boolean allPassed = true;
        for (int p = 0; p < dataset.size(); p++) {
            double[] inputs = dataset.get(p).inputs();
            double[] free = solver.solve(network, inputs, weights).freeVoltages();
            Optional<Map<String, Double>> spice = runner.run(full
                ? writer.fullCircuit(network, weights, inputs, null)
                : writer.ideal(network, weights, inputs, null));
            if (spice.isEmpty()) {
                LOG.warn("Pattern {}: no SPICE result", p);
                reports.add(new PatternReport(p, false, List.of(), false));
                allPassed = false;
                continue;
            }
            List<NodeComparison> nodes = new ArrayList<>();
            boolean passed = true;
            for (int f = 0; f < network.numFree(); f++) {
                String node = network.nodeName(network.numFixed() + f);
                double spiceValue = lookup(spice.get(), node);
                double err = CircuitHelper.percentError(free[f], spiceValue);
                NodeComparison cmp = new NodeComparison(node, free[f], spiceValue, err);
                // NaN error (missing node) fails too
                passed &= cmp.within(tolerancePct);
                nodes.add(cmp);
                LOG.debug("Pattern {} {}: solver={} spice={} err={}%", p, node,
                    String.format("%.6f", free[f]), String.format("%.6f", spiceValue), String.format("%.4f", err));
            }
            if (!passed) {
                LOG.warn("Pattern {}: solver and SPICE differ by more than {}%", p, tolerancePct);
            }
            reports.add(new PatternReport(p, true, List.copyOf(nodes), passed));
            allPassed &= passed;
        }
        LOG.info("SPICE cross-validation ({}, tolerance {}%): {}", full ? "full circuit" : "ideal",
            tolerancePct, allPassed ? "PASS" : "FAIL");
        return new Report(List.copyOf(reports), tolerancePct, allPassed);
    }

    /**
     * Solver versus ideal SPICE versus full-circuit SPICE, per free node and for
     * the differential prediction. Quantifies the effect of the board's
     * non-idealities.
     */
    public List<ComparisonRow> compare(Network network, double[] weights, List<Pattern> dataset) {
        List<ComparisonRow> rows = new ArrayList<>();
        LOG.info(String.format("%-8s %-6s %9s %9s %9s %11s", "Pattern", "Node", "Solver", "Ideal", "Full",
            "Ideal-Full"));
        for (int p = 0; p < dataset.size(); p++) {
            Pattern pattern = dataset.get(p);
            double[] inputs = pattern.inputs();
            double[] all = solver.solve(network, inputs, weights).allVoltages(network, inputs);
            Map<String, Double> ideal = runner.run(writer.ideal(network, weights, inputs, null)).orElse(Map.of());
            Map<String, Double> full = runner.run(writer.fullCircuit(network, weights, inputs, null))
                .orElse(Map.of());

            Map<String, NodeValues> nodes = new LinkedHashMap<>();
            for (int f = 0; f < network.numFree(); f++) {
                int global = network.numFixed() + f;
                String node = network.nodeName(global);
                NodeValues values = new NodeValues(all[global], lookup(ideal, node), lookup(full, node));
                nodes.put(node, values);
                logRow(p, node, values);
            }
            String pos = network.nodeName(network.outputPositive());
            String neg = network.nodeName(network.outputNegative());
            NodeValues prediction = new NodeValues(network.prediction(all),
                lookupAny(ideal, network, network.outputPositive(), all) - lookupAny(ideal, network, network.outputNegative(), all),
                lookupAny(full, network, network.outputPositive(), all) - lookupAny(full, network, network.outputNegative(), all));
            logRow(p, pos + "-" + neg, prediction);
            rows.add(new ComparisonRow(p, pattern.target(), nodes, prediction));
        }
        return rows;
    }

    // fixed outputs are not saved by SPICE but are known exactly
    private static double lookupAny(Map<String, Double> spice, Network network, int node, double[] all) {
        if (spice.isEmpty()) {
            return Double.NaN;
        }
        return network.isFixed(node) ? all[node] : lookup(spice, network.nodeName(node));
    }

    private static void logRow(int pattern, String node, NodeValues v) {
        LOG.info(String.format("%-8d %-6s %9.4f %9.4f %9.4f %+10.4fV", pattern, node, v.solver(), v.ideal(),
            v.full(), v.idealMinusFull()));
    }

    static double lookup(Map<String, Double> spice, String node) {
        Double value = spice.get("v(" + node + ")");
        if (value == null) {
            value = spice.get(node);
        }
        return value == null ? Double.NaN : value;
    }
}
