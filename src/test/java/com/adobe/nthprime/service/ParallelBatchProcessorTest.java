package com.adobe.nthprime.service;

import com.adobe.nthprime.estimator.ClosedFormEstimator;
import com.adobe.nthprime.estimator.NewtonRaphsonSolver;
import com.adobe.nthprime.estimator.NewtonRiemannEstimator;
import com.adobe.nthprime.lookup.KnownPrimeTable;
import com.adobe.nthprime.model.BatchPredictionResult;
import com.adobe.nthprime.model.PredictionConfig;
import com.adobe.nthprime.model.PredictionMethod;
import com.adobe.nthprime.model.PredictionResult;
import com.adobe.nthprime.precision.PrecisionManager;
import com.adobe.nthprime.refinement.PrimeRefiner;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigInteger;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ParallelBatchProcessor Tests")
class ParallelBatchProcessorTest {

    private SimpleMeterRegistry meterRegistry;
    private PredictionConfig config;
    private ParallelBatchProcessor processor;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        config = PredictionConfig.defaults();
        NthPrimeService service = new NthPrimeService(
            new KnownPrimeTable(),
            new PrecisionManager(false),
            List.of(new ClosedFormEstimator(), new NewtonRiemannEstimator(new NewtonRaphsonSolver())),
            new PrimeRefiner(),
            config,
            meterRegistry);
        processor = new ParallelBatchProcessor(service, meterRegistry);
    }

    @Nested
    @DisplayName("Range Processing")
    class RangeProcessing {

        @Test
        @DisplayName("Results are complete and in ascending index order")
        void shouldReturnSortedResults() {
            BatchPredictionResult result = processor.processRange(20, 60, config);

            assertEquals(41, result.size());
            for (int i = 0; i < result.size(); i++) {
                assertEquals(BigInteger.valueOf(20L + i), result.predictions().get(i).index());
            }
        }

        @Test
        @DisplayName("Small indices come from the table, larger ones from the estimator")
        void shouldMixLookupAndEstimates() {
            List<PredictionResult> predictions = processor.processRange(24, 27, config).predictions();

            assertEquals(PredictionMethod.LOOKUP, predictions.get(0).method());
            assertEquals(BigInteger.valueOf(97), predictions.get(1).prime());
            assertEquals(PredictionMethod.CLOSED_FORM, predictions.get(2).method());
            assertEquals(BigInteger.valueOf(89), predictions.get(2).prime());
            assertEquals(BigInteger.valueOf(89), predictions.get(3).prime());
        }

        @Test
        @DisplayName("Each request records metrics")
        void shouldRecordMetrics() {
            processor.processRange(1, 10, config);

            assertEquals(1.0, meterRegistry.get("nthprime.batch.requests.total").counter().count());
            assertEquals(10.0, meterRegistry.get("nthprime.batch.size").summary().totalAmount());
            assertEquals(1L, meterRegistry.get("nthprime.batch.processing.time").timer().count());
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @ParameterizedTest(name = "[{0}, {1}] is rejected: {2}")
        @CsvSource({
            "0, 10, min must be a positive index",
            "5, -1, max must be a positive index",
            "10, 5, must be less than",
            "5, 5, must be less than",
            "1, 501, exceeds maximum allowed"
        })
        void shouldRejectInvalidRanges(long min, long max, String message) {
            IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> processor.processRange(min, max, config));
            assertTrue(ex.getMessage().contains(message), ex.getMessage());
        }

        @Test
        @DisplayName("Range of exactly 500 indices is accepted")
        void shouldAcceptMaximumRange() {
            assertEquals(500, processor.processRange(1, 500, config).size());
        }
    }
}
