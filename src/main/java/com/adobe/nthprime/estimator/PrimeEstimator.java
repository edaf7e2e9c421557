package com.adobe.nthprime.estimator;

import com.adobe.nthprime.model.PredictionConfig;
import com.adobe.nthprime.model.PredictionMethod;
import com.adobe.nthprime.precision.PrecisionContext;

import java.math.BigInteger;

/**
 * Strategy for producing a continuous approximation of the nth prime.
 * 
 * <p>Implementations are stateless Spring components. The service selects
 * one per call from {@link PredictionConfig#method()}; the continuous value
 * is then handed to the refinement engine to become an actual prime.</p>
 * 
 * <h2>Contract:</h2>
 * <ul>
 *   <li>All arithmetic runs under the supplied {@link PrecisionContext}</li>
 *   <li>No state is shared between calls</li>
 *   <li>Failures are reported as unchecked exceptions, never as partial results</li>
 * </ul>
 * 
 * @author Adobe AEM Engineering Assessment
 * @version 1.0.0
 */
public interface PrimeEstimator {

    /**
     * Estimates p_n.
     * 
     * @param n      the prime index
     * @param config per-call tuning
     * @param ctx    working precision
     * @return the continuous estimate with its convergence metadata
     */
    EstimateResult estimate(BigInteger n, PredictionConfig config, PrecisionContext ctx);

    /**
     * @return the method this estimator implements
     */
    PredictionMethod method();
}
