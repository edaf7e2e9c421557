package com.adobe.nthprime.exception;

import java.math.BigDecimal;

/**
 * Raised by the Newton-Raphson solver when the derivative evaluates to
 * exactly zero, which would make the next step undefined.
 */
public class DerivativeZeroException extends NumericDegeneracyException {

    private final int iteration;

    public DerivativeZeroException(BigDecimal point, int iteration) {
        super(String.format("Derivative is zero at x = %s (iteration %d)",
            point.toPlainString(), iteration), point);
        this.iteration = iteration;
    }

    public int getIteration() {
        return iteration;
    }
}
