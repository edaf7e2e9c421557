package com.adobe.nthprime.model;

import com.adobe.nthprime.exception.InvalidInputException;

import java.math.BigDecimal;

/**
 * Per-call tuning of a prediction.
 * 
 * <p>The application exposes one default instance as a bean built from
 * {@code app.predictor.*}; callers derive variants through the
 * {@code with*} methods, which never mutate the receiver.</p>
 * 
 * <h2>Defaults:</h2>
 * <ul>
 *   <li>precision override: none (derived from the index)</li>
 *   <li>Riemann R series depth: {@value #DEFAULT_SERIES_TERMS}</li>
 *   <li>Newton iterations: {@value #DEFAULT_MAX_ITERATIONS}</li>
 *   <li>relative tolerance: 1e-50</li>
 *   <li>calibration: c = -0.00016667, κ* = 0.065</li>
 *   <li>estimator: closed form</li>
 *   <li>forward-scan cap: {@value #DEFAULT_FORWARD_SCAN_LIMIT} steps</li>
 * </ul>
 * 
 * @param precisionOverride decimal digits to run at, or {@code null}
 * @param seriesTerms       K, the number of Riemann R terms, at most {@value #MAX_SERIES_TERMS}
 * @param maxIterations     Newton iteration budget, at most {@value #MAX_ITERATIONS}
 * @param tolerance         relative convergence tolerance for Newton
 * @param calibrationC      closed-form second-order coefficient c
 * @param kappaStar         closed-form cube-root coefficient κ*
 * @param method            estimator to run on a table miss
 * @param forwardScanLimit  step cap of the refinement fallback scan
 * 
 * @author Adobe AEM Engineering Assessment
 * @version 1.0.0
 */
public record PredictionConfig(
    Integer precisionOverride,
    int seriesTerms,
    int maxIterations,
    BigDecimal tolerance,
    BigDecimal calibrationC,
    BigDecimal kappaStar,
    PredictionMethod method,
    long forwardScanLimit
) {

    public static final int DEFAULT_SERIES_TERMS = 10;
    public static final int DEFAULT_MAX_ITERATIONS = 10;
    public static final BigDecimal DEFAULT_TOLERANCE = new BigDecimal("1e-50");
    public static final BigDecimal DEFAULT_CALIBRATION_C = new BigDecimal("-0.00016667");
    public static final BigDecimal DEFAULT_KAPPA_STAR = new BigDecimal("0.065");
    public static final long DEFAULT_FORWARD_SCAN_LIMIT = 1_000_000L;

    /**
     * Upper bound on K. Each Newton step evaluates K logarithmic integrals.
     */
    public static final int MAX_SERIES_TERMS = 100;

    /**
     * Upper bound on the Newton iteration budget.
     */
    public static final int MAX_ITERATIONS = 100;

    public PredictionConfig {
        if (seriesTerms < 1 || seriesTerms > MAX_SERIES_TERMS) {
            throw new InvalidInputException(String.format(
                "Series depth k must be between 1 and %d, got: %d", MAX_SERIES_TERMS, seriesTerms));
        }
        if (maxIterations < 1 || maxIterations > MAX_ITERATIONS) {
            throw new InvalidInputException(String.format(
                "maxIterations must be between 1 and %d, got: %d", MAX_ITERATIONS, maxIterations));
        }
        if (tolerance == null || tolerance.signum() <= 0) {
            throw new InvalidInputException("tolerance must be a positive number, got: " + tolerance);
        }
        if (calibrationC == null || kappaStar == null) {
            throw new InvalidInputException("Calibration constants c and kappaStar are required");
        }
        if (method == null || method == PredictionMethod.LOOKUP) {
            throw new InvalidInputException("method must be closed_form or newton, got: " + method);
        }
        if (forwardScanLimit < 1) {
            throw new InvalidInputException("forwardScanLimit must be at least 1, got: " + forwardScanLimit);
        }
    }

    /**
     * @return the built-in defaults, independent of application configuration
     */
    public static PredictionConfig defaults() {
        return new PredictionConfig(null, DEFAULT_SERIES_TERMS, DEFAULT_MAX_ITERATIONS,
            DEFAULT_TOLERANCE, DEFAULT_CALIBRATION_C, DEFAULT_KAPPA_STAR,
            PredictionMethod.CLOSED_FORM, DEFAULT_FORWARD_SCAN_LIMIT);
    }

    public PredictionConfig withPrecisionOverride(Integer digits) {
        return new PredictionConfig(digits, seriesTerms, maxIterations, tolerance,
            calibrationC, kappaStar, method, forwardScanLimit);
    }

    public PredictionConfig withSeriesTerms(int terms) {
        return new PredictionConfig(precisionOverride, terms, maxIterations, tolerance,
            calibrationC, kappaStar, method, forwardScanLimit);
    }

    public PredictionConfig withMaxIterations(int iterations) {
        return new PredictionConfig(precisionOverride, seriesTerms, iterations, tolerance,
            calibrationC, kappaStar, method, forwardScanLimit);
    }

    public PredictionConfig withTolerance(BigDecimal relativeTolerance) {
        return new PredictionConfig(precisionOverride, seriesTerms, maxIterations, relativeTolerance,
            calibrationC, kappaStar, method, forwardScanLimit);
    }

    public PredictionConfig withCalibration(BigDecimal c, BigDecimal kappa) {
        return new PredictionConfig(precisionOverride, seriesTerms, maxIterations, tolerance,
            c, kappa, method, forwardScanLimit);
    }

    public PredictionConfig withMethod(PredictionMethod estimator) {
        return new PredictionConfig(precisionOverride, seriesTerms, maxIterations, tolerance,
            calibrationC, kappaStar, estimator, forwardScanLimit);
    }

    public PredictionConfig withForwardScanLimit(long steps) {
        return new PredictionConfig(precisionOverride, seriesTerms, maxIterations, tolerance,
            calibrationC, kappaStar, method, steps);
    }
}
