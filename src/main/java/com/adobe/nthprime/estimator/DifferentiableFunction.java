package com.adobe.nthprime.estimator;

import com.adobe.nthprime.precision.PrecisionContext;

import java.math.BigDecimal;

/**
 * A real function together with its first derivative, as consumed by
 * {@link NewtonRaphsonSolver}.
 */
public interface DifferentiableFunction {

    BigDecimal value(BigDecimal x, PrecisionContext ctx);

    BigDecimal derivative(BigDecimal x, PrecisionContext ctx);

    /**
     * Whether {@code x} lies in the domain of the function.
     * 
     * @param x a candidate iterate
     * @return {@code true} by default
     */
    default boolean inDomain(BigDecimal x) {
        return true;
    }
}
