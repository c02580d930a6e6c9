package com.github.trinity.eqprop;

/**
 * Raised while building a {@link Network} whose KCL system could never be
 * solved: an out-of-range node index, a self loop, a diode pair on a fixed
 * node, or a free node with no path to any fixed node.
 *
 * @author Sean Phillips
 */
public class InvalidTopologyException extends CircuitException {

    public InvalidTopologyException(String message) {
        super(message);
    }
}
