package com.github.trinity.eqprop;

/**
 * How the nudge phase perturbs the outputs.
 *
 * @author Sean Phillips
 */
public enum NudgeMode {
    /** One nudge solve at +beta; gradient divided by 2*beta. */
    SINGLE_SIDED,
    /** One nudge solve whose sign follows the step parity (even: +beta, odd: -beta). */
    ALTERNATING,
    /** Two nudge solves at +beta and -beta; gradient divided by 4*beta. */
    SYMMETRIC
}
