package com.github.trinity.eqprop;

import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.optim.PointVectorValuePair;

/**
 * One evaluation of the KCL system at a trial free-voltage vector: the
 * residual current at each free node, the magnitude of the largest branch
 * current meeting there, and the Jacobian of the residual.
 *
 * @author Sean Phillips
 */
public class KclState extends PointVectorValuePair {

    private static final long serialVersionUID = 1L;

    private final double[] currentScale;
    private final transient RealMatrix jacobian;

    public KclState(double[] freeVoltages, double[] residual, double[] currentScale, RealMatrix jacobian) {
        super(freeVoltages, residual, false);
        this.currentScale = currentScale;
        this.jacobian = jacobian;
    }

    /**
     * @return net current into each free node, zero at equilibrium
     */
    public double[] getResidual() {
        return getValueRef();
    }

    /**
     * @return per free node, the largest absolute current among the terms summed into its residual
     */
    public double[] getCurrentScale() {
        return currentScale;
    }

    /**
     * @return dF/dV, with F the residual vector
     */
    public RealMatrix getJacobian() {
        return jacobian;
    }

    public double residualNorm() {
        double max = 0.0;
        for (double r : getValueRef()) {
            max = Math.max(max, Math.abs(r));
        }
        return max;
    }
}
