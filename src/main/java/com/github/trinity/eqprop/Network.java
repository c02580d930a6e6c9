package com.github.trinity.eqprop;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Immutable topology of a resistive/diode analog network.
 * <p>
 * Nodes are numbered globally: fixed (clamped) nodes first, {@code [0, numFixed)},
 * then free (solved) nodes, {@code [numFixed, numFixed + numFree)}. The order of
 * {@link #connections()} is the canonical weight numbering W1..Wn used by the
 * solver, the trainer and the SPICE export. Diode pairs, output nodes and nudge
 * signs are all keyed by global node index.
 * </p>
 * <p>
 * Instances are only obtained through {@link Builder#build()}, which rejects any
 * topology whose KCL system would be singular. A built network is safe to share
 * across threads.
 * </p>
 *
 * @author Sean Phillips
 */
public final class Network {

    private final int numFixed;
    private final int numFree;
    private final List<Connection> connections;
    private final Map<Integer, DiodePair> diodePairs;
    private final int outputPositive;
    private final int outputNegative;
    private final Map<Integer, Double> nudgeSigns;
    private final List<String> nodeNames;
    private final List<Element> elements;

    private Network(Builder builder) {
        this.numFixed = builder.numFixed;
        this.numFree = builder.numFree;
        this.connections = Collections.unmodifiableList(new ArrayList<>(builder.connections));
        this.diodePairs = Collections.unmodifiableMap(new TreeMap<>(builder.diodePairs));
        this.outputPositive = builder.outputPositive;
        this.outputNegative = builder.outputNegative;
        this.nudgeSigns = Collections.unmodifiableMap(new TreeMap<>(builder.nudgeSigns));
        this.nodeNames = Collections.unmodifiableList(new ArrayList<>(builder.nodeNames));

        List<Element> flat = new ArrayList<>(connections.size() + diodePairs.size());
        for (int w = 0; w < connections.size(); w++) {
            flat.add(Element.resistor(w, connections.get(w)));
        }
        for (Map.Entry<Integer, DiodePair> entry : diodePairs.entrySet()) {
            flat.add(Element.diodePair(entry.getKey(), entry.getValue()));
        }
        this.elements = Collections.unmodifiableList(flat);
    }

    public static Builder builder(int numFixed, int numFree) {
        return new Builder(numFixed, numFree);
    }

    public int numFixed() {
        return numFixed;
    }

    public int numFree() {
        return numFree;
    }

    public int numNodes() {
        return numFixed + numFree;
    }

    public int numWeights() {
        return connections.size();
    }

    public List<Connection> connections() {
        return connections;
    }

    /**
     * @return diode pairs keyed by the global index of the free node they shunt
     */
    public Map<Integer, DiodePair> diodePairs() {
        return diodePairs;
    }

    public int outputPositive() {
        return outputPositive;
    }

    public int outputNegative() {
        return outputNegative;
    }

    public Map<Integer, Double> nudgeSigns() {
        return nudgeSigns;
    }

    /**
     * @return SPICE node names, one per global node, or an empty list
     */
    public List<String> nodeNames() {
        return nodeNames;
    }

    /**
     * @return resistors in weight order followed by the diode pairs
     */
    public List<Element> elements() {
        return elements;
    }

    public boolean isFixed(int node) {
        return node < numFixed;
    }

    /**
     * @param node global node index of a free node
     * @return its position in the free-voltage vector
     */
    public int freeIndex(int node) {
        return node - numFixed;
    }

    public String nodeName(int node) {
        return nodeNames.isEmpty() ? "n" + node : nodeNames.get(node);
    }

    /**
     * Differential output {@code V(outputPositive) - V(outputNegative)}.
     *
     * @param allVoltages voltages of every node, fixed first
     * @return prediction in volts
     */
    public double prediction(double[] allVoltages) {
        return allVoltages[outputPositive] - allVoltages[outputNegative];
    }

    /**
     * Nudge current for each free node: {@code sign * beta * error}, zero for
     * nodes without a nudge sign. Positive current flows into the node.
     *
     * @param beta  nudge strength
     * @param error target minus prediction
     * @return vector of length {@link #numFree()}
     */
    public double[] nudgeCurrents(double beta, double error) {
        double[] nudge = new double[numFree];
        for (Map.Entry<Integer, Double> entry : nudgeSigns.entrySet()) {
            nudge[freeIndex(entry.getKey())] = entry.getValue() * beta * error;
        }
        return nudge;
    }

    /**
     * Joins clamped and solved voltages into one vector indexed by global node.
     *
     * @param fixedVoltages voltages of the fixed nodes
     * @param freeVoltages  voltages of the free nodes
     * @return all node voltages, fixed first
     */
    public double[] allVoltages(double[] fixedVoltages, double[] freeVoltages) {
        double[] all = new double[numNodes()];
        System.arraycopy(fixedVoltages, 0, all, 0, numFixed);
        System.arraycopy(freeVoltages, 0, all, numFixed, numFree);
        return all;
    }

    /**
     * Copy of this network with every diode pair's saturation current set to
     * zero, leaving only the resistive part.
     *
     * @return resistive-only view of the same topology
     * @throws InvalidTopologyException if some free node depended on its diode
     *                                  pair to reach a fixed node
     */
    public Network withoutDiodes() {
        Builder b = toBuilder();
        b.diodePairs.replaceAll((node, pair) -> new DiodePair(pair.anchorVoltage(), DiodeParams.disabled()));
        return b.build();
    }

    public Builder toBuilder() {
        Builder b = new Builder(numFixed, numFree);
        b.connections.addAll(connections);
        b.diodePairs.putAll(diodePairs);
        b.outputPositive = outputPositive;
        b.outputNegative = outputNegative;
        b.nudgeSigns.putAll(nudgeSigns);
        b.nodeNames.addAll(nodeNames);
        return b;
    }

    @Override
    public String toString() {
        return "Network[fixed=" + numFixed + ", free=" + numFree
            + ", weights=" + connections.size() + ", diodePairs=" + diodePairs.keySet() + "]";
    }

    /**
     * Accumulates a topology and validates it in {@link #build()}.
     */
    public static final class Builder {
        private final int numFixed;
        private final int numFree;
        private final List<Connection> connections = new ArrayList<>();
        private final Map<Integer, DiodePair> diodePairs = new TreeMap<>();
        private final Map<Integer, Double> nudgeSigns = new TreeMap<>();
        private final List<String> nodeNames = new ArrayList<>();
        private int outputPositive = -1;
        private int outputNegative = -1;

        private Builder(int numFixed, int numFree) {
            this.numFixed = numFixed;
            this.numFree = numFree;
        }

        /** Adds the next weight, W(n+1), between two global nodes. */
        public Builder connect(int nodeA, int nodeB) {
            connections.add(new Connection(nodeA, nodeB));
            return this;
        }

        public Builder diodePair(int freeNode, DiodePair pair) {
            diodePairs.put(freeNode, pair);
            return this;
        }

        public Builder diodePair(int freeNode, double anchorVoltage) {
            return diodePair(freeNode, new DiodePair(anchorVoltage));
        }

        /** Output pair; prediction is V(positive) - V(negative). */
        public Builder outputs(int positive, int negative) {
            this.outputPositive = positive;
            this.outputNegative = negative;
            return this;
        }

        public Builder nudgeSign(int freeNode, double sign) {
            nudgeSigns.put(freeNode, sign);
            return this;
        }

        public Builder nodeNames(List<String> names) {
            nodeNames.clear();
            nodeNames.addAll(names);
            return this;
        }

        /**
         * Validates and freezes the topology. When no outputs were given the
         * first two free nodes are used, nudged +1 and -1.
         *
         * @return the immutable network
         * @throws InvalidTopologyException on any structural problem
         */
        public Network build() {
            if (numFixed < 1) {
                throw new InvalidTopologyException("Network needs at least one fixed node, got " + numFixed);
            }
            if (numFree < 1) {
                throw new InvalidTopologyException("Network needs at least one free node, got " + numFree);
            }
            int numNodes = numFixed + numFree;
            for (int w = 0; w < connections.size(); w++) {
                Connection c = connections.get(w);
                checkNode(c.nodeA(), numNodes, "W" + (w + 1));
                checkNode(c.nodeB(), numNodes, "W" + (w + 1));
                if (c.nodeA() == c.nodeB()) {
                    throw new InvalidTopologyException("W" + (w + 1) + " connects node " + c.nodeA() + " to itself");
                }
            }
            for (int node : diodePairs.keySet()) {
                checkFree(node, numNodes, "Diode pair");
            }
            for (int node : nudgeSigns.keySet()) {
                checkFree(node, numNodes, "Nudge sign");
            }
            if (outputPositive < 0 && outputNegative < 0) {
                outputPositive = numFixed;
                outputNegative = numFree > 1 ? numFixed + 1 : 0;
                if (nudgeSigns.isEmpty()) {
                    nudgeSigns.put(outputPositive, 1.0);
                    if (outputNegative >= numFixed) {
                        nudgeSigns.put(outputNegative, -1.0);
                    }
                }
            }
            checkNode(outputPositive, numNodes, "Positive output");
            checkNode(outputNegative, numNodes, "Negative output");
            if (!nodeNames.isEmpty() && nodeNames.size() != numNodes) {
                throw new InvalidTopologyException("Expected " + numNodes + " node names, got " + nodeNames.size());
            }
            checkReachability(numNodes);
            return new Network(this);
        }

        private void checkNode(int node, int numNodes, String what) {
            if (node < 0 || node >= numNodes) {
                throw new InvalidTopologyException(
                    what + " references node " + node + " outside [0, " + numNodes + ")");
            }
        }

        private void checkFree(int node, int numNodes, String what) {
            checkNode(node, numNodes, what);
            if (node < numFixed) {
                throw new InvalidTopologyException(what + " must sit on a free node, got fixed node " + node);
            }
        }

        /**
         * Breadth-first walk from every fixed node and every diode-shunted node
         * (whose anchor is itself a fixed rail) over the connections. A conducting
         * diode pair counts as a path; a disabled one does not.
         */
        private void checkReachability(int numNodes) {
            List<List<Integer>> adjacency = new ArrayList<>(numNodes);
            for (int n = 0; n < numNodes; n++) {
                adjacency.add(new ArrayList<>());
            }
            for (Connection c : connections) {
                adjacency.get(c.nodeA()).add(c.nodeB());
                adjacency.get(c.nodeB()).add(c.nodeA());
            }
            boolean[] grounded = new boolean[numNodes];
            Deque<Integer> queue = new ArrayDeque<>();
            for (int n = 0; n < numFixed; n++) {
                grounded[n] = true;
                queue.add(n);
            }
            for (Map.Entry<Integer, DiodePair> entry : diodePairs.entrySet()) {
                if (entry.getValue().params().saturationCurrent() > 0.0 && !grounded[entry.getKey()]) {
                    grounded[entry.getKey()] = true;
                    queue.add(entry.getKey());
                }
            }
            while (!queue.isEmpty()) {
                int node = queue.poll();
                for (int next : adjacency.get(node)) {
                    if (!grounded[next]) {
                        grounded[next] = true;
                        queue.add(next);
                    }
                }
            }
            for (int n = numFixed; n < numNodes; n++) {
                if (!grounded[n]) {
                    throw new InvalidTopologyException("Free node " + n + " has no path to any fixed node");
                }
            }
        }
    }
}
