package com.adobe.nthprime.service;

import com.adobe.nthprime.model.BatchPredictionResult;
import com.adobe.nthprime.model.PredictionConfig;
import com.adobe.nthprime.model.PredictionResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.stream.LongStream;

/**
 * Parallel processor for range-based predictions.
 * 
 * <p>Each index in the range is predicted independently on the common
 * ForkJoinPool through a parallel stream, and the results are sorted back
 * into ascending index order. Predictions are CPU-bound and share no mutable
 * state, so work stealing spreads them across cores without coordination.</p>
 * 
 * <h2>Complexity:</h2>
 * <ul>
 *   <li>Time: O(n/p) predictions, where n = range size, p = parallelism</li>
 *   <li>Space: O(n) for storing results</li>
 * </ul>
 * 
 * @author Adobe AEM Engineering Assessment
 * @version 1.0.0
 */
@Component
public class ParallelBatchProcessor {

    private static final Logger logger = LoggerFactory.getLogger(ParallelBatchProcessor.class);

    /**
     * Maximum number of indices in one range request.
     */
    public static final int MAX_RANGE_SIZE = 500;

    private final NthPrimeService nthPrimeService;

    private final Timer batchProcessingTimer;
    private final Counter batchRequestsCounter;
    private final DistributionSummary batchSizeDistribution;

    /**
     * Constructs the processor with the prediction service and metrics registry.
     * 
     * @param nthPrimeService the service performing single predictions
     * @param meterRegistry   the Micrometer registry for metrics
     */
    public ParallelBatchProcessor(NthPrimeService nthPrimeService, MeterRegistry meterRegistry) {
        this.nthPrimeService = nthPrimeService;

        this.batchProcessingTimer = Timer.builder("nthprime.batch.processing.time")
            .description("Time taken to process range prediction requests")
            .tag("processor", "parallel-stream")
            .register(meterRegistry);

        this.batchRequestsCounter = Counter.builder("nthprime.batch.requests.total")
            .description("Total number of range prediction requests")
            .register(meterRegistry);

        this.batchSizeDistribution = DistributionSummary.builder("nthprime.batch.size")
            .description("Distribution of range sizes requested")
            .baseUnit("indices")
            .publishPercentiles(0.5, 0.95, 0.99)
            .register(meterRegistry);
    }

    /**
     * Predicts every index in {@code [min, max]}.
     * 
     * @param min    first index (inclusive), at least 1
     * @param max    last index (inclusive), greater than {@code min}
     * @param config per-call tuning applied to every index
     * @return predictions sorted by index
     * @throws IllegalArgumentException if the range is invalid or too large
     */
    public BatchPredictionResult processRange(long min, long max, PredictionConfig config) {
        validateRange(min, max);

        long rangeSize = max - min + 1;
        batchRequestsCounter.increment();
        batchSizeDistribution.record(rangeSize);

        logger.debug("Processing range [{}, {}] with {} indices using parallel streams", min, max, rangeSize);
        long startTime = System.nanoTime();

        List<PredictionResult> results = LongStream.rangeClosed(min, max)
            .parallel()
            .mapToObj(index -> nthPrimeService.predict(BigInteger.valueOf(index), config))
            .sorted(Comparator.comparing(PredictionResult::index))
            .toList();

        long durationNanos = System.nanoTime() - startTime;
        batchProcessingTimer.record(Duration.ofNanos(durationNanos));

        logger.info("Processed {} predictions in {}ms using parallel streams",
            rangeSize, durationNanos / 1_000_000);

        return BatchPredictionResult.of(results);
    }

    private void validateRange(long min, long max) {
        if (min < 1) {
            throw new IllegalArgumentException(
                String.format("min must be a positive index (>= 1), got: %d", min));
        }
        if (max < 1) {
            throw new IllegalArgumentException(
                String.format("max must be a positive index (>= 1), got: %d", max));
        }
        if (min >= max) {
            throw new IllegalArgumentException(
                String.format("min (%d) must be less than max (%d)", min, max));
        }
        long rangeSize = max - min + 1;
        if (rangeSize > MAX_RANGE_SIZE) {
            throw new IllegalArgumentException(
                String.format("Range size (%d) exceeds maximum allowed (%d). " +
                    "Please request a smaller range.", rangeSize, MAX_RANGE_SIZE));
        }
    }
}
