package com.github.trinity.eqprop;

/**
 * Antiparallel diode pair shunting a free node to a fixed anchor rail.
 *
 * @param anchorVoltage voltage of the rail the pair returns to
 * @param params        diode parameters of both diodes
 * @author Sean Phillips
 */
public record DiodePair(double anchorVoltage, DiodeParams params) {

    public DiodePair(double anchorVoltage) {
        this(anchorVoltage, DiodeParams.BAT42);
    }

    /**
     * @param nodeVoltage voltage of the free node the pair hangs from
     * @return current leaving the node through the pair and its conductance
     */
    public DiodeModel.Response response(double nodeVoltage) {
        return DiodeModel.pairCurrent(nodeVoltage - anchorVoltage, params);
    }
}
