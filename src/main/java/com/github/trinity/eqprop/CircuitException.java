package com.github.trinity.eqprop;

/**
 * Base type for every failure raised by the circuit solver, the gradient
 * engine and the network descriptor.
 *
 * @author Sean Phillips
 */
public class CircuitException extends RuntimeException {

    public CircuitException(String message) {
        super(message);
    }

    public CircuitException(String message, Throwable cause) {
        super(message, cause);
    }
}
