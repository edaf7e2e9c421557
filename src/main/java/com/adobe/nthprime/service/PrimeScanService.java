package com.adobe.nthprime.service;

import com.adobe.nthprime.model.PredictionConfig;
import com.adobe.nthprime.model.PrimeScanResult;
import com.adobe.nthprime.model.ScannedPrime;
import com.adobe.nthprime.refinement.MersennePrimes;
import com.adobe.nthprime.refinement.PrimeRefiner;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Lists consecutive probable primes from a starting point.
 * 
 * <p>Each prime is the first one at or above the previous prime plus one, found
 * with the refinement engine's forward scan and flagged when it is a Mersenne
 * prime. Scans are sequential by nature, so a request runs on its own thread
 * only.</p>
 * 
 * <h2>Limits:</h2>
 * <ul>
 *   <li>at most {@value #MAX_COUNT} primes per request</li>
 *   <li>start of at most {@value #MAX_START_DIGITS} decimal digits</li>
 *   <li>the per-prime step cap is the configured forward-scan limit</li>
 * </ul>
 * 
 * @author Adobe AEM Engineering Assessment
 * @version 1.0.0
 */
@Service
public class PrimeScanService {

    private static final Logger logger = LoggerFactory.getLogger(PrimeScanService.class);

    /**
     * Maximum number of primes in one scan.
     */
    public static final int MAX_COUNT = 100;

    /**
     * Maximum number of decimal digits of the starting point.
     */
    public static final int MAX_START_DIGITS = 1000;

    private final PrimeRefiner refiner;
    private final long stepLimit;

    private final Timer scanTimer;
    private final Counter scanRequestsCounter;
    private final Counter mersenneCounter;
    private final DistributionSummary scanSizeDistribution;

    /**
     * @param refiner       supplies the forward scan
     * @param defaultConfig source of the per-prime step cap
     * @param meterRegistry the Micrometer registry for metrics
     */
    public PrimeScanService(PrimeRefiner refiner, PredictionConfig defaultConfig, MeterRegistry meterRegistry) {
        this.refiner = refiner;
        this.stepLimit = defaultConfig.forwardScanLimit();

        this.scanTimer = Timer.builder("nthprime.scan.time")
            .description("Time taken to process prime scan requests")
            .register(meterRegistry);

        this.scanRequestsCounter = Counter.builder("nthprime.scan.requests.total")
            .description("Total number of prime scan requests")
            .register(meterRegistry);

        this.mersenneCounter = Counter.builder("nthprime.scan.mersenne.total")
            .description("Mersenne primes reported by scans")
            .register(meterRegistry);

        this.scanSizeDistribution = DistributionSummary.builder("nthprime.scan.size")
            .description("Distribution of requested prime counts")
            .baseUnit("primes")
            .register(meterRegistry);
    }

    /**
     * Returns the first {@code count} probable primes at or above {@code start}.
     * 
     * @param start inclusive lower bound, at least 1
     * @param count number of primes, 1 to {@value #MAX_COUNT}
     * @return the primes in ascending order
     * @throws IllegalArgumentException if the start or count is out of range
     * @throws com.adobe.nthprime.exception.RefinementExhaustionException if a gap exceeds the step cap
     */
    public PrimeScanResult scan(BigInteger start, int count) {
        validate(start, count);

        scanRequestsCounter.increment();
        scanSizeDistribution.record(count);
        long startTime = System.nanoTime();

        List<ScannedPrime> primes = new ArrayList<>(count);
        BigInteger from = start;
        for (int position = 1; position <= count; position++) {
            long primeStart = System.nanoTime();
            BigInteger prime = refiner.nextPrime(from, stepLimit);
            boolean mersenne = MersennePrimes.isMersennePrime(prime);
            if (mersenne) {
                mersenneCounter.increment();
                logger.info("Mersenne prime found at scan position {}: 2^{} - 1",
                    position, prime.bitLength());
            }
            primes.add(new ScannedPrime(position, prime, mersenne, (System.nanoTime() - primeStart) / 1_000_000));
            from = prime.add(BigInteger.ONE);
        }

        long durationNanos = System.nanoTime() - startTime;
        scanTimer.record(Duration.ofNanos(durationNanos));
        logger.debug("Scanned {} primes from {} in {}ms", count, start, durationNanos / 1_000_000);

        return PrimeScanResult.of(start, primes);
    }

    private void validate(BigInteger start, int count) {
        if (start == null || start.signum() <= 0) {
            throw new IllegalArgumentException(
                String.format("start must be a positive integer (>= 1), got: %s", start));
        }
        int digits = start.toString().length();
        if (digits > MAX_START_DIGITS) {
            throw new IllegalArgumentException(
                String.format("start has %d digits, exceeding the maximum of %d", digits, MAX_START_DIGITS));
        }
        if (count < 1 || count > MAX_COUNT) {
            throw new IllegalArgumentException(
                String.format("count must be between 1 and %d, got: %d", MAX_COUNT, count));
        }
    }
}
