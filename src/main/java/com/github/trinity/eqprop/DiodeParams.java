package com.github.trinity.eqprop;

/**
 * Shockley parameters shared by every diode of an antiparallel activation pair.
 *
 * @param saturationCurrent Is, in amperes
 * @param idealityFactor    N
 * @param thermalVoltage    VT, in volts
 * @author Sean Phillips
 */
public record DiodeParams(double saturationCurrent, double idealityFactor, double thermalVoltage) {

    /** BAT42 Schottky diode at 27C, taken from the datasheet. */
    public static final DiodeParams BAT42 = new DiodeParams(1e-7, 1.1, 0.02585);

    public DiodeParams {
        if (saturationCurrent < 0.0) {
            throw new IllegalArgumentException("Saturation current must be non-negative: " + saturationCurrent);
        }
        if (idealityFactor <= 0.0 || thermalVoltage <= 0.0) {
            throw new IllegalArgumentException("Ideality factor and thermal voltage must be positive");
        }
    }

    /**
     * @return the emission voltage N * VT
     */
    public double emissionVoltage() {
        return idealityFactor * thermalVoltage;
    }

    /**
     * A pair with zero saturation current conducts nothing, which reduces the
     * network to its purely resistive part.
     *
     * @return parameters of a diode that never conducts
     */
    public static DiodeParams disabled() {
        return new DiodeParams(0.0, 1.0, 0.02585);
    }
}
