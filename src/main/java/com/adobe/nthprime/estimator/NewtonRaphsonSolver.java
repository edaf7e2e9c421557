package com.adobe.nthprime.estimator;

import com.adobe.nthprime.exception.DerivativeZeroException;
import com.adobe.nthprime.exception.NumericDegeneracyException;
import com.adobe.nthprime.precision.PrecisionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;

/**
 * Solves {@code f(x) = target} by Newton-Raphson iteration.
 * 
 * <pre>
 *   x_{i+1} = x_i - (f(x_i) - target) / f'(x_i)
 * </pre>
 * 
 * <p>Iteration stops once {@code |x_{i+1} - x_i| < tolerance · |x_{i+1}|}.
 * When the budget runs out first, the last iterate is returned with
 * {@code converged = false}; callers decide whether that is acceptable.</p>
 * 
 * <h2>Failures:</h2>
 * <ul>
 *   <li>{@code f'(x) = 0}: {@link DerivativeZeroException}</li>
 *   <li>an iterate outside the function's domain: {@link NumericDegeneracyException}</li>
 * </ul>
 * 
 * @author Adobe AEM Engineering Assessment
 * @version 1.0.0
 */
@Component
public class NewtonRaphsonSolver {

    private static final Logger logger = LoggerFactory.getLogger(NewtonRaphsonSolver.class);

    /**
     * Runs the iteration.
     * 
     * @param function      the function and its derivative
     * @param target        the value to solve for
     * @param initial       starting point, must lie in the function's domain
     * @param maxIterations iteration budget, at least 1
     * @param tolerance     relative step tolerance, positive
     * @param ctx           working precision
     * @return the solution and its convergence metadata
     */
    public NewtonSolution solve(DifferentiableFunction function, BigDecimal target, BigDecimal initial,
                                int maxIterations, BigDecimal tolerance, PrecisionContext ctx) {
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be at least 1, got: " + maxIterations);
        }
        if (!function.inDomain(initial)) {
            throw new NumericDegeneracyException(
                "Initial point " + initial.toPlainString() + " is outside the function domain", initial);
        }

        MathContext mc = ctx.mathContext();
        BigDecimal x = initial;
        for (int i = 1; i <= maxIterations; i++) {
            BigDecimal residual = function.value(x, ctx).subtract(target, mc);
            BigDecimal slope = function.derivative(x, ctx);
            if (slope.signum() == 0) {
                throw new DerivativeZeroException(x, i);
            }

            BigDecimal next = x.subtract(residual.divide(slope, mc), mc);
            if (!function.inDomain(next)) {
                throw new NumericDegeneracyException(String.format(
                    "Iterate %s left the function domain (iteration %d)", next.toPlainString(), i), next);
            }

            BigDecimal step = next.subtract(x, mc).abs();
            x = next;
            logger.trace("Newton iteration {}: x={}, |dx|={}", i, x.round(MathContext.DECIMAL64),
                step.round(MathContext.DECIMAL64));

            if (step.compareTo(tolerance.multiply(next.abs(), mc)) < 0) {
                return new NewtonSolution(x, i, true);
            }
        }
        return new NewtonSolution(x, maxIterations, false);
    }
}
