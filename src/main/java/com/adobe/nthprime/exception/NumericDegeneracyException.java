package com.adobe.nthprime.exception;

import java.math.BigDecimal;

/**
 * Raised when an iterative solver hits a state it cannot continue from,
 * such as an iterate leaving the domain of the function being inverted.
 * 
 * <p>Running out of iterations is <b>not</b> reported through this type;
 * it is surfaced as {@code converged=false} on the result.</p>
 */
public class NumericDegeneracyException extends PredictionException {

    private final BigDecimal point;

    public NumericDegeneracyException(String message, BigDecimal point) {
        super(message);
        this.point = point;
    }

    /**
     * @return the iterate at which the degeneracy was detected
     */
    public BigDecimal getPoint() {
        return point;
    }
}
