package com.adobe.nthprime.estimator;

import java.math.BigDecimal;

/**
 * Outcome of a Newton-Raphson run.
 * 
 * @param root       the last iterate
 * @param iterations number of updates performed
 * @param converged  whether the relative step fell below tolerance
 */
public record NewtonSolution(BigDecimal root, int iterations, boolean converged) {
}
