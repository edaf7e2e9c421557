package com.adobe.nthprime.estimator;

import com.adobe.nthprime.model.PredictionMethod;

import java.math.BigDecimal;

/**
 * Continuous output of a {@link PrimeEstimator}.
 * 
 * @param value      the estimate x ≈ p_n
 * @param method     estimator that produced it
 * @param iterations solver iterations, 0 for closed-form evaluation
 * @param converged  whether the solver met its tolerance
 */
public record EstimateResult(BigDecimal value, PredictionMethod method, int iterations, boolean converged) {

    public static EstimateResult direct(BigDecimal value, PredictionMethod method) {
        return new EstimateResult(value, method, 0, true);
    }
}
