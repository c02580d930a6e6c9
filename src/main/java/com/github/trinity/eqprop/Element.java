package com.github.trinity.eqprop;

/**
 * Flat, tagged description of one conductive element as the solver sees it.
 * Resistors carry the index of the weight that sets their resistance; diode
 * pairs carry the free node they shunt and their anchor descriptor.
 *
 * @param kind        element tag
 * @param nodeA       first terminal (the free node, for a diode pair)
 * @param nodeB       second terminal, or -1 for a diode pair (its anchor is a rail)
 * @param weightIndex weight index for a resistor, -1 otherwise
 * @param diode       diode pair descriptor, null for a resistor
 * @author Sean Phillips
 */
public record Element(Kind kind, int nodeA, int nodeB, int weightIndex, DiodePair diode) {

    public enum Kind {
        RESISTOR,
        DIODE_PAIR
    }

    static Element resistor(int weightIndex, Connection connection) {
        return new Element(Kind.RESISTOR, connection.nodeA(), connection.nodeB(), weightIndex, null);
    }

    static Element diodePair(int node, DiodePair diode) {
        return new Element(Kind.DIODE_PAIR, node, -1, -1, diode);
    }
}
