package com.adobe.nthprime.service;

import com.adobe.nthprime.estimator.EstimateResult;
import com.adobe.nthprime.estimator.PrimeEstimator;
import com.adobe.nthprime.exception.InvalidIndexException;
import com.adobe.nthprime.lookup.KnownPrimeTable;
import com.adobe.nthprime.model.PredictionConfig;
import com.adobe.nthprime.model.PredictionMethod;
import com.adobe.nthprime.model.PredictionResult;
import com.adobe.nthprime.precision.PrecisionContext;
import com.adobe.nthprime.precision.PrecisionManager;
import com.adobe.nthprime.refinement.PrimeRefiner;
import com.adobe.nthprime.refinement.RefinementResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Service layer for nth-prime prediction.
 * 
 * <p>Each call runs through the same pipeline:</p>
 * <pre>
 *   index → known-value lookup ─hit──────────────────────────────→ result
 *                              └miss→ precision → estimator → refinement → result
 * </pre>
 * 
 * <h2>Responsibilities:</h2>
 * <ul>
 *   <li>Index validation</li>
 *   <li>Estimator selection from the call's {@link PredictionConfig}</li>
 *   <li>Timing, metrics and logging of every prediction</li>
 * </ul>
 * 
 * <p>Calls are independent and synchronous. The only shared state is
 * read-only tables and thread-safe meters, so the service may be used from
 * parallel streams.</p>
 * 
 * @author Adobe AEM Engineering Assessment
 * @version 1.0.0
 */
@Service
public class NthPrimeService {

    private static final Logger logger = LoggerFactory.getLogger(NthPrimeService.class);

    private final KnownPrimeTable knownPrimes;
    private final PrecisionManager precisionManager;
    private final Map<PredictionMethod, PrimeEstimator> estimators;
    private final PrimeRefiner refiner;
    private final PredictionConfig defaultConfig;

    private final Map<PredictionMethod, Timer> predictionTimers;
    private final Map<PredictionMethod, Counter> predictionCounters;
    private final Counter nonConvergedCounter;

    /**
     * Constructs the service with its collaborators.
     * 
     * @param knownPrimes      exact values for canonical indices
     * @param precisionManager maps magnitudes to working precision
     * @param estimators       all available estimators, one per method
     * @param refiner          converts estimates into primes
     * @param defaultConfig    configuration used when a caller supplies none
     * @param meterRegistry    the Micrometer registry for metrics
     */
    public NthPrimeService(KnownPrimeTable knownPrimes,
                           PrecisionManager precisionManager,
                           List<PrimeEstimator> estimators,
                           PrimeRefiner refiner,
                           PredictionConfig defaultConfig,
                           MeterRegistry meterRegistry) {
        this.knownPrimes = knownPrimes;
        this.precisionManager = precisionManager;
        this.refiner = refiner;
        this.defaultConfig = defaultConfig;

        this.estimators = new EnumMap<>(PredictionMethod.class);
        for (PrimeEstimator estimator : estimators) {
            PrimeEstimator previous = this.estimators.put(estimator.method(), estimator);
            if (previous != null) {
                throw new IllegalStateException("Duplicate estimator for method " + estimator.method());
            }
        }

        this.predictionTimers = new EnumMap<>(PredictionMethod.class);
        this.predictionCounters = new EnumMap<>(PredictionMethod.class);
        for (PredictionMethod method : PredictionMethod.values()) {
            predictionTimers.put(method, Timer.builder("nthprime.prediction.time")
                .description("Time taken to predict the nth prime")
                .tag("method", method.wireName())
                .register(meterRegistry));
            predictionCounters.put(method, Counter.builder("nthprime.predictions.total")
                .description("Total number of predictions")
                .tag("method", method.wireName())
                .register(meterRegistry));
        }
        this.nonConvergedCounter = Counter.builder("nthprime.newton.nonconverged")
            .description("Newton runs that exhausted their iteration budget")
            .register(meterRegistry);

        logger.info("NthPrimeService initialized with estimators {}", this.estimators.keySet());
    }

    /**
     * Predicts p_n with the application's default configuration.
     * 
     * @param n the prime index, at least 1
     * @return the prediction
     */
    public PredictionResult predict(long n) {
        return predict(BigInteger.valueOf(n), defaultConfig);
    }

    /**
     * Predicts p_n with the application's default configuration.
     * 
     * @param n the prime index, at least 1
     * @return the prediction
     */
    public PredictionResult predict(BigInteger n) {
        return predict(n, defaultConfig);
    }

    /**
     * Predicts p_n.
     * 
     * @param n      the prime index, at least 1
     * @param config per-call tuning, or {@code null} for the defaults
     * @return the prediction with provenance metadata
     * @throws InvalidIndexException if {@code n < 1}
     * @throws com.adobe.nthprime.exception.PrecisionException if the index needs more precision than allowed
     * @throws com.adobe.nthprime.exception.NumericDegeneracyException if Newton iteration breaks down
     * @throws com.adobe.nthprime.exception.RefinementExhaustionException if no prime is found
     */
    public PredictionResult predict(BigInteger n, PredictionConfig config) {
        if (n == null || n.signum() <= 0) {
            throw InvalidIndexException.notPositive(n);
        }
        PredictionConfig effective = config != null ? config : defaultConfig;
        long startTime = System.nanoTime();

        var known = knownPrimes.lookup(n);
        if (known.isPresent()) {
            long elapsedNanos = System.nanoTime() - startTime;
            record(PredictionMethod.LOOKUP, elapsedNanos);
            logger.debug("Index {} answered from known-value table: {}", n, known.get());
            return PredictionResult.lookup(n, known.get(), elapsedNanos / 1_000_000);
        }

        PrecisionContext ctx = precisionManager.resolve(n, effective.precisionOverride());
        PrimeEstimator estimator = estimators.get(effective.method());
        if (estimator == null) {
            throw new IllegalStateException("No estimator registered for method " + effective.method());
        }

        logger.debug("Predicting p_{} with {} at {} digits", n, effective.method().wireName(), ctx.digits());
        EstimateResult estimate = estimator.estimate(n, effective, ctx);
        if (!estimate.converged()) {
            nonConvergedCounter.increment();
            logger.warn("Estimator {} did not converge for n={} after {} iterations; refining last iterate",
                estimate.method().wireName(), n, estimate.iterations());
        }

        RefinementResult refinement = refiner.refine(estimate.value(), effective.forwardScanLimit());
        long elapsedNanos = System.nanoTime() - startTime;
        record(estimate.method(), elapsedNanos);

        logger.debug("Predicted p_{} = {} (estimate {}, offset {}, {} candidates)",
            n, refinement.prime(), refinement.rounded(), refinement.offset(), refinement.candidatesTested());

        return new PredictionResult(
            n,
            refinement.prime(),
            estimate.value().setScale(0, RoundingMode.HALF_UP).toBigIntegerExact(),
            estimate.iterations(),
            estimate.converged(),
            elapsedNanos / 1_000_000,
            estimate.method(),
            ctx.digits(),
            refinement.candidatesTested(),
            refinement.offset());
    }

    /**
     * @return the configuration applied when callers supply none
     */
    public PredictionConfig getDefaultConfig() {
        return defaultConfig;
    }

    private void record(PredictionMethod method, long elapsedNanos) {
        predictionTimers.get(method).record(Duration.ofNanos(elapsedNanos));
        predictionCounters.get(method).increment();
    }
}
