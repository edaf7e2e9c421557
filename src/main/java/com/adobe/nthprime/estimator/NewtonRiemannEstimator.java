package com.adobe.nthprime.estimator;

import com.adobe.nthprime.exception.InvalidIndexException;
import com.adobe.nthprime.function.RiemannR;
import com.adobe.nthprime.model.PredictionConfig;
import com.adobe.nthprime.model.PredictionMethod;
import com.adobe.nthprime.precision.PrecisionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Estimates p_n by inverting Riemann's R function: solves {@code R(x) = n}
 * with Newton-Raphson, seeded by the {@link DusartSeed} expansion.
 * 
 * <p>Series depth, iteration budget and tolerance come from the
 * {@link PredictionConfig}. A run that exhausts its budget still yields an
 * estimate, flagged {@code converged = false}.</p>
 * 
 * @author Adobe AEM Engineering Assessment
 * @version 1.0.0
 */
@Component
public class NewtonRiemannEstimator implements PrimeEstimator {

    private static final Logger logger = LoggerFactory.getLogger(NewtonRiemannEstimator.class);

    private final NewtonRaphsonSolver solver;

    public NewtonRiemannEstimator(NewtonRaphsonSolver solver) {
        this.solver = solver;
    }

    @Override
    public EstimateResult estimate(BigInteger n, PredictionConfig config, PrecisionContext ctx) {
        if (n.compareTo(BigInteger.TWO) < 0) {
            throw new InvalidIndexException(n, "Newton estimator requires n >= 2, got: " + n);
        }

        BigDecimal seed = DusartSeed.seed(n, ctx);
        NewtonSolution solution = solver.solve(new RiemannFunction(config.seriesTerms()),
            new BigDecimal(n), seed, config.maxIterations(), config.tolerance(), ctx);

        logger.debug("Newton estimate for n={}: {} iterations, converged={}",
            n, solution.iterations(), solution.converged());
        return new EstimateResult(solution.root(), PredictionMethod.NEWTON,
            solution.iterations(), solution.converged());
    }

    @Override
    public PredictionMethod method() {
        return PredictionMethod.NEWTON;
    }

    /**
     * R(x) truncated to a fixed number of terms, defined for x &gt; 1.
     */
    static final class RiemannFunction implements DifferentiableFunction {

        private final int terms;

        RiemannFunction(int terms) {
            this.terms = terms;
        }

        @Override
        public BigDecimal value(BigDecimal x, PrecisionContext ctx) {
            return RiemannR.value(x, terms, ctx);
        }

        @Override
        public BigDecimal derivative(BigDecimal x, PrecisionContext ctx) {
            return RiemannR.derivative(x, terms, ctx);
        }

        @Override
        public boolean inDomain(BigDecimal x) {
            return x.compareTo(BigDecimal.ONE) > 0;
        }
    }
}
