package com.github.trinity.eqprop.spice;

import com.github.trinity.eqprop.Network;
import com.github.trinity.eqprop.xor.XorTopology;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class NetlistWriterTest {

    private final NetlistWriter writer = new NetlistWriter();

    private static double[] uniform(double r) {
        double[] w = new double[16];
        Arrays.fill(w, r);
        return w;
    }

    private static long count(String netlist, String prefix) {
        return netlist.lines().filter(l -> l.startsWith(prefix)).count();
    }

    @Test
    public void testIdealNetlist() {
        Network net = XorTopology.createNetwork();
        String netlist = writer.ideal(net, uniform(21200.0), XorTopology.inputs(1.0, 4.0), null);
        List<String> lines = netlist.lines().toList();

        assertTrue(lines.contains(NetlistWriter.BAT42_MODEL));
        assertTrue(lines.contains("V_X1 x1 0 1.0"));
        assertTrue(lines.contains("V_X1C x1c 0 4.0"));
        assertTrue(lines.contains("V_MID_H1 vmid_h1 0 2.5"));
        assertTrue(lines.contains("R_s1 x1 w1m 1200.0"));
        assertTrue(lines.contains("R_W1 w1m h1 20000.0"));
        assertTrue(lines.contains("R_W16 w16m yn 20000.0"));
        assertTrue(lines.contains("D1a h1 vmid_h1 BAT42"));
        assertTrue(lines.contains("D2b vmid_h2 h2 BAT42"));
        assertTrue(lines.contains(".save v(h1) v(h2) v(yp) v(yn)"));
        assertEquals(".end", lines.get(lines.size() - 1));
        assertEquals(16, count(netlist, "R_W"));
        assertEquals(6, count(netlist, "V_") - count(netlist, "V_MID"));
        assertEquals(0, count(netlist, "I_nudge"));
    }

    @Test
    public void testNudgeSources() {
        Network net = XorTopology.createNetwork();
        double[] nudge = net.nudgeCurrents(1e-5, 0.3);
        String netlist = writer.ideal(net, uniform(21200.0), XorTopology.inputs(1.0, 4.0), nudge);
        assertEquals(2, count(netlist, "I_nudge"));
        assertTrue(netlist.contains("I_nudge_yp 0 yp " + NetlistWriter.number(nudge[2])));
        assertTrue(netlist.contains("I_nudge_yn 0 yn " + NetlistWriter.number(nudge[3])));
        assertTrue(nudge[2] > 0 && nudge[3] < 0);
    }

    @Test
    public void testFullCircuitNetlist() {
        Network net = XorTopology.createNetwork();
        double[] nudge = new double[4];
        nudge[2] = 2e-6;
        String netlist = writer.fullCircuit(net, uniform(21200.0), XorTopology.inputs(1.0, 4.0), nudge);
        List<String> lines = netlist.lines().toList();

        assertTrue(lines.contains(".include behavioral.lib"));
        assertTrue(lines.contains("V_VCC vcc 0 5.0"));
        assertTrue(lines.contains("X_buf_vlow vlow_div vlow vcc 0 vlow opamp_rr"));
        assertTrue(lines.contains("X_buf_vmid_h1 vmid_div vmid_h1 vcc 0 vmid_h1 opamp_lm324"));
        assertTrue(lines.contains("R_mux_x1 vlow x1 100.0"));
        assertTrue(lines.contains("R_mux_x1c vhigh x1c 100.0"));
        assertTrue(lines.contains("R_SET_A pump_a_inp yp 1e6"));
        assertTrue(lines.contains("R_H8 pump_b_out yn 10000"));
        assertTrue(lines.contains("V_DAC_B dac_b 0 2.5"));
        assertEquals(4.5, NetlistWriter.dacVoltage(2e-6), 1e-12);
        String dacA = lines.stream().filter(l -> l.startsWith("V_DAC_A dac_a 0 ")).findFirst().orElseThrow();
        assertEquals(4.5, Double.parseDouble(dacA.substring("V_DAC_A dac_a 0 ".length())), 1e-9);
        // fixed inputs are driven through the mux, not by sources
        assertFalse(lines.contains("V_X1 x1 0 1.0"));
        assertEquals(16, count(netlist, "R_W"));
    }

    @Test
    public void testFullCircuitNeedsBoardLayout() {
        Network net = Network.builder(2, 1).connect(0, 2).connect(1, 2).build();
        assertThrows(IllegalArgumentException.class,
            () -> writer.fullCircuit(net, new double[]{1e4, 1e4}, new double[]{1, 2}, null));
    }

    @Test
    public void testShapeMismatchRejected() {
        Network net = XorTopology.createNetwork();
        assertThrows(IllegalArgumentException.class,
            () -> writer.ideal(net, new double[15], XorTopology.inputs(1.0, 1.0), null));
    }
}
