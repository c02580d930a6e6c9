package com.github.trinity.eqprop;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class NetworkTest {

    private static Network divider() {
        return Network.builder(2, 1).connect(0, 2).connect(1, 2).build();
    }

    @Test
    public void testCountsAndIndices() {
        Network net = Network.builder(3, 2)
            .connect(0, 3).connect(1, 3).connect(2, 4).connect(3, 4)
            .build();
        assertEquals(3, net.numFixed());
        assertEquals(2, net.numFree());
        assertEquals(5, net.numNodes());
        assertEquals(4, net.numWeights());
        assertTrue(net.isFixed(2));
        assertFalse(net.isFixed(3));
        assertEquals(1, net.freeIndex(4));
    }

    @Test
    public void testDefaultOutputsAndNudgeSigns() {
        Network net = Network.builder(1, 2).connect(0, 1).connect(1, 2).build();
        assertEquals(1, net.outputPositive());
        assertEquals(2, net.outputNegative());
        assertEquals(1.0, net.nudgeSigns().get(1));
        assertEquals(-1.0, net.nudgeSigns().get(2));
    }

    @Test
    public void testSingleFreeNodeDefaultsToFixedNegativeOutput() {
        Network net = divider();
        assertEquals(2, net.outputPositive());
        assertEquals(0, net.outputNegative());
        assertEquals(1, net.nudgeSigns().size());
    }

    @Test
    public void testOutOfRangeConnectionRejected() {
        assertThrows(InvalidTopologyException.class,
            () -> Network.builder(2, 1).connect(0, 2).connect(1, 3).build());
    }

    @Test
    public void testSelfLoopRejected() {
        assertThrows(InvalidTopologyException.class,
            () -> Network.builder(1, 1).connect(0, 1).connect(1, 1).build());
    }

    @Test
    public void testIsolatedFreeNodeRejected() {
        InvalidTopologyException ex = assertThrows(InvalidTopologyException.class,
            () -> Network.builder(1, 2).connect(0, 1).build());
        assertTrue(ex.getMessage().contains("2"));
    }

    @Test
    public void testDiodePathCountsAsGrounded() {
        Network net = Network.builder(1, 2).connect(0, 1).diodePair(2, 2.5).build();
        assertEquals(1, net.diodePairs().size());
        assertThrows(InvalidTopologyException.class, net::withoutDiodes);
    }

    @Test
    public void testDiodeOnFixedNodeRejected() {
        assertThrows(InvalidTopologyException.class,
            () -> Network.builder(2, 1).connect(0, 2).connect(1, 2).diodePair(1, 2.5).build());
    }

    @Test
    public void testNodeNamesMustCoverEveryNode() {
        assertThrows(InvalidTopologyException.class,
            () -> Network.builder(2, 1).connect(0, 2).connect(1, 2).nodeNames(List.of("a", "b")).build());
        Network net = Network.builder(2, 1).connect(0, 2).connect(1, 2).nodeNames(List.of("a", "b", "c")).build();
        assertEquals("c", net.nodeName(2));
        assertEquals("n2", divider().nodeName(2));
    }

    @Test
    public void testPredictionAndNudgeCurrents() {
        Network net = Network.builder(1, 3).connect(0, 1).connect(1, 2).connect(1, 3)
            .outputs(2, 3).nudgeSign(2, 1.0).nudgeSign(3, -1.0).build();
        double[] all = {1.0, 2.0, 2.7, 2.4};
        assertEquals(0.3, net.prediction(all), 1e-12);
        double[] nudge = net.nudgeCurrents(1e-5, 0.2);
        assertArrayEquals(new double[]{0.0, 2e-6, -2e-6}, nudge, 1e-18);
    }

    @Test
    public void testElementsListResistorsThenDiodes() {
        Network net = Network.builder(1, 2).connect(0, 1).connect(1, 2).diodePair(1, 2.5).build();
        List<Element> elements = net.elements();
        assertEquals(3, elements.size());
        assertEquals(Element.Kind.RESISTOR, elements.get(0).kind());
        assertEquals(1, elements.get(1).weightIndex());
        assertEquals(Element.Kind.DIODE_PAIR, elements.get(2).kind());
        assertEquals(1, elements.get(2).nodeA());
    }

    @Test
    public void testWithoutDiodesKeepsTopology() {
        Network net = Network.builder(2, 1).connect(0, 2).connect(1, 2).diodePair(2, 2.5).build();
        Network plain = net.withoutDiodes();
        assertEquals(net.connections(), plain.connections());
        assertEquals(0.0, plain.diodePairs().get(2).params().saturationCurrent());
        assertEquals(2.5, plain.diodePairs().get(2).anchorVoltage());
    }

    @Test
    public void testAllVoltagesJoinsFixedAndFree() {
        assertArrayEquals(new double[]{1.0, 3.0, 2.0},
            divider().allVoltages(new double[]{1.0, 3.0}, new double[]{2.0}), 0.0);
    }
}
