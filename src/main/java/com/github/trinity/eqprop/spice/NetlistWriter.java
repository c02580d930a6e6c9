package com.github.trinity.eqprop.spice;

import com.github.trinity.eqprop.DiodePair;
import com.github.trinity.eqprop.DiodeParams;
import com.github.trinity.eqprop.Network;
import com.github.trinity.eqprop.WeightBounds;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Renders a {@link Network} with its weights and inputs as an ngspice
 * operating-point netlist.
 * <p>
 * Every weight becomes the series protection resistor plus the potentiometer
 * resistance through a midpoint node {@code w<i>m}, so netlist weight numbers
 * match W1..Wn. Free-node voltages are saved as {@code v(<node>)}.
 * </p>
 *
 * @author Sean Phillips
 */
public class NetlistWriter {

    public static final String BAT42_MODEL = ".model BAT42 D(Is=1e-7 Rs=12 N=1.1 Cjo=15p Vj=0.25 M=0.5)";

    /** CD4053B typical on-resistance (ohm). */
    public static final double DEFAULT_MUX_RESISTANCE = 100.0;

    /** Howland pump transconductance resistor: I = (V_dac - V_mid) / R_SET. */
    public static final double HOWLAND_R_SET = 1e6;

    private final WeightBounds bounds;

    public NetlistWriter() {
        this(WeightBounds.MCP4251);
    }

    public NetlistWriter(WeightBounds bounds) {
        this.bounds = bounds;
    }

    /**
     * Ideal netlist: fixed nodes as voltage sources, one anchor source per diode
     * pair, nudge currents as ideal current sources.
     *
     * @param network topology
     * @param weights resistances in connection order
     * @param inputs  fixed-node voltages
     * @param nudge   injected current per free node, or null
     * @return netlist text
     */
    public String ideal(Network network, double[] weights, double[] inputs, double[] nudge) {
        checkShapes(network, weights, inputs, nudge);
        List<String> lines = new ArrayList<>();
        lines.add("* Auto-generated EqProp network");
        lines.add(BAT42_MODEL);
        lines.add("");
        lines.add("* Input voltages");
        for (int i = 0; i < network.numFixed(); i++) {
            String node = network.nodeName(i);
            lines.add("V_" + node.toUpperCase(Locale.ROOT) + " " + node + " 0 " + number(inputs[i]));
        }

        lines.add("");
        lines.add("* Reference voltages");
        for (Map.Entry<Integer, DiodePair> entry : network.diodePairs().entrySet()) {
            if (entry.getValue().params().saturationCurrent() == 0.0) {
                continue;
            }
            String node = network.nodeName(entry.getKey());
            lines.add("V_MID_" + node.toUpperCase(Locale.ROOT) + " vmid_" + node + " 0 "
                + number(entry.getValue().anchorVoltage()));
        }

        lines.add("");
        weightLines(network, weights, lines);
        lines.add("");
        diodeLines(network, lines);

        if (nudge != null && anyNonZero(nudge)) {
            lines.add("");
            lines.add("* Nudge current sources");
            for (int f = 0; f < network.numFree(); f++) {
                if (nudge[f] != 0.0) {
                    String node = network.nodeName(network.numFixed() + f);
                    lines.add("I_nudge_" + node + " 0 " + node + " " + number(nudge[f]));
                }
            }
        }

        lines.add("");
        lines.add(".op");
        lines.add("");
        lines.add(".save " + freeNodeSaves(network));
        lines.add("");
        lines.add(".end");
        return String.join("\n", lines) + "\n";
    }

    public String fullCircuit(Network network, double[] weights, double[] inputs, double[] nudge) {
        return fullCircuit(network, weights, inputs, nudge, DEFAULT_MUX_RESISTANCE);
    }

    /**
     * Board-level netlist for the six-input layout (four mux-routed signal inputs,
     * then the low and high bias rails): 5 V supply, divider references buffered by
     * behavioral op-amps, mux on-resistance on the signal inputs, and Howland current
     * pumps on both outputs whose DAC voltage encodes the nudge current. The pumps
     * are always present and idle at mid-rail when there is no nudge.
     *
     * @param muxResistance on-resistance of each mux channel (ohm)
     * @throws IllegalArgumentException if the network does not have that layout
     */
    public String fullCircuit(Network network, double[] weights, double[] inputs, double[] nudge,
                              double muxResistance) {
        checkShapes(network, weights, inputs, nudge);
        if (network.numFixed() != 6) {
            throw new IllegalArgumentException(
                "Full-circuit export needs 4 signal inputs plus vlow and vhigh, got " + network.numFixed() + " fixed nodes");
        }
        if (network.isFixed(network.outputPositive()) || network.isFixed(network.outputNegative())) {
            throw new IllegalArgumentException("Full-circuit export needs both outputs on free nodes");
        }

        List<String> lines = new ArrayList<>();
        lines.add("* Full-circuit EqProp network with hardware non-idealities");
        lines.add(".include " + ResourceUtils.BEHAVIORAL_LIB);
        lines.add(BAT42_MODEL);
        lines.add("");
        lines.add("* Power rail");
        lines.add("V_VCC vcc 0 5.0");
        lines.add("");
        lines.add("* Voltage reference dividers");
        lines.add("R_div_low_hi vcc vlow_div 8000");
        lines.add("R_div_low_lo vlow_div 0 2000");
        lines.add("R_div_high_hi vcc vhigh_div 2000");
        lines.add("R_div_high_lo vhigh_div 0 8000");
        lines.add("R_div_mid_hi vcc vmid_div 10000");
        lines.add("R_div_mid_lo vmid_div 0 10000");
        lines.add("");
        lines.add("* Op-amp buffers (voltage followers)");
        lines.add("X_buf_vlow vlow_div vlow vcc 0 vlow opamp_rr");
        lines.add("X_buf_vhigh vhigh_div vhigh vcc 0 vhigh opamp_rr");
        List<String> diagnostics = new ArrayList<>(List.of("v(vlow)", "v(vhigh)"));
        for (int node : network.diodePairs().keySet()) {
            String vmid = "vmid_" + network.nodeName(node);
            lines.add("X_buf_" + vmid + " vmid_div " + vmid + " vcc 0 " + vmid + " opamp_lm324");
            diagnostics.add("v(" + vmid + ")");
        }
        lines.add("X_buf_vmid_pump vmid_div vmid_pump vcc 0 vmid_pump opamp_lm324");
        diagnostics.add("v(vmid_pump)");
        lines.add("");

        lines.add("* CD4053B mux routing (on-resistance models)");
        StringBuilder inputSaves = new StringBuilder();
        for (int i = 0; i < 4; i++) {
            String node = network.nodeName(i);
            String source = Math.abs(inputs[i] - inputs[4]) < 0.1 ? "vlow" : "vhigh";
            lines.add("R_mux_" + node + " " + source + " " + node + " " + number(muxResistance));
            inputSaves.append(" v(").append(node).append(')');
        }
        lines.add("");

        weightLines(network, weights, lines);
        lines.add("");
        diodeLines(network, lines);
        lines.add("");

        double currentA = 0.0;
        double currentB = 0.0;
        if (nudge != null) {
            currentA = nudge[network.freeIndex(network.outputPositive())];
            currentB = nudge[network.freeIndex(network.outputNegative())];
        }
        lines.add("* Howland current pumps (MCP6002 + precision resistors)");
        howlandPump(lines, "a", 1, network.nodeName(network.outputPositive()), dacVoltage(currentA));
        howlandPump(lines, "b", 5, network.nodeName(network.outputNegative()), dacVoltage(currentB));

        lines.add(".op");
        lines.add("");
        lines.add(".save " + freeNodeSaves(network) + " " + String.join(" ", diagnostics) + inputSaves);
        lines.add("");
        lines.add(".end");
        return String.join("\n", lines) + "\n";
    }

    /**
     * DAC voltage that makes a Howland pump source {@code current} amperes.
     */
    public static double dacVoltage(double current) {
        return current * HOWLAND_R_SET + 2.5;
    }

    private static void howlandPump(List<String> lines, String id, int firstResistor, String output, double vDac) {
        String upper = id.toUpperCase(Locale.ROOT);
        String inp = "pump_" + id + "_inp";
        String inn = "pump_" + id + "_inn";
        String out = "pump_" + id + "_out";
        lines.add("V_DAC_" + upper + " dac_" + id + " 0 " + number(vDac));
        lines.add("R_H" + firstResistor + " dac_" + id + " " + inp + " 10000");
        lines.add("R_SET_" + upper + " " + inp + " " + output + " 1e6");
        lines.add("R_H" + (firstResistor + 1) + " vmid_pump " + inn + " 10000");
        lines.add("R_H" + (firstResistor + 2) + " " + out + " " + inn + " 10000");
        lines.add("R_H" + (firstResistor + 3) + " " + out + " " + output + " 10000");
        lines.add("X_pump_" + id + " " + inp + " " + inn + " vcc 0 " + out + " opamp_rr");
        lines.add("");
    }

    private void weightLines(Network network, double[] weights, List<String> lines) {
        lines.add("* Weight resistors (series protection + variable pot)");
        double series = bounds.seriesResistance();
        for (int w = 0; w < network.numWeights(); w++) {
            String src = network.nodeName(network.connections().get(w).nodeA());
            String dst = network.nodeName(network.connections().get(w).nodeB());
            String mid = "w" + (w + 1) + "m";
            lines.add("R_s" + (w + 1) + " " + src + " " + mid + " " + number(series));
            lines.add("R_W" + (w + 1) + " " + mid + " " + dst + " "
                + String.format(Locale.ROOT, "%.1f", weights[w] - series));
        }
    }

    private static void diodeLines(Network network, List<String> lines) {
        lines.add("* Activation functions (antiparallel BAT42 pairs)");
        int d = 1;
        for (Map.Entry<Integer, DiodePair> entry : network.diodePairs().entrySet()) {
            if (entry.getValue().params().saturationCurrent() == 0.0) {
                continue;
            }
            String node = network.nodeName(entry.getKey());
            String vmid = "vmid_" + node;
            lines.add("D" + d + "a " + node + " " + vmid + " BAT42");
            lines.add("D" + d + "b " + vmid + " " + node + " BAT42");
            d++;
        }
    }

    private static String freeNodeSaves(Network network) {
        List<String> saves = new ArrayList<>();
        for (int f = 0; f < network.numFree(); f++) {
            saves.add("v(" + network.nodeName(network.numFixed() + f) + ")");
        }
        return String.join(" ", saves);
    }

    private static void checkShapes(Network network, double[] weights, double[] inputs, double[] nudge) {
        if (weights.length != network.numWeights() || inputs.length != network.numFixed()
            || (nudge != null && nudge.length != network.numFree())) {
            throw new IllegalArgumentException("Weights, inputs or nudge do not match " + network);
        }
        for (DiodePair pair : network.diodePairs().values()) {
            DiodeParams p = pair.params();
            if (p.saturationCurrent() != 0.0 && !p.equals(DiodeParams.BAT42)) {
                throw new IllegalArgumentException("Only BAT42 diode pairs can be exported, got " + p);
            }
        }
    }

    private static boolean anyNonZero(double[] v) {
        for (double x : v) {
            if (x != 0.0) {
                return true;
            }
        }
        return false;
    }

    static String number(double v) {
        return Double.toString(v).toLowerCase(Locale.ROOT);
    }
}
