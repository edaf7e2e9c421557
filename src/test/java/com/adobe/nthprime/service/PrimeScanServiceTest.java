package com.adobe.nthprime.service;

import com.adobe.nthprime.exception.RefinementExhaustionException;
import com.adobe.nthprime.model.PredictionConfig;
import com.adobe.nthprime.model.PrimeScanResult;
import com.adobe.nthprime.model.ScannedPrime;
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
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

@DisplayName("PrimeScanService Tests")
class PrimeScanServiceTest {

    private SimpleMeterRegistry meterRegistry;
    private PrimeScanService service;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        service = new PrimeScanService(new PrimeRefiner(), PredictionConfig.defaults(), meterRegistry);
    }

    private static List<BigInteger> primesOf(PrimeScanResult result) {
        return result.primes().stream().map(ScannedPrime::prime).toList();
    }

    @Nested
    @DisplayName("Scanning")
    class Scanning {

        @Test
        @DisplayName("Scan from 1 lists the first five primes")
        void shouldListFirstPrimes() {
            PrimeScanResult result = service.scan(BigInteger.ONE, 5);

            assertEquals(BigInteger.ONE, result.start());
            assertEquals(List.of(2L, 3L, 5L, 7L, 11L),
                primesOf(result).stream().map(BigInteger::longValueExact).toList());
            assertEquals(List.of(1, 2, 3, 4, 5), result.primes().stream().map(ScannedPrime::position).toList());
        }

        @Test
        @DisplayName("Start is inclusive and primes are consecutive")
        void shouldScanConsecutivePrimes() {
            PrimeScanResult result = service.scan(BigInteger.TEN.pow(12), 3);

            assertEquals(List.of(new BigInteger("1000000000039"), new BigInteger("1000000000061"),
                new BigInteger("1000000000063")), primesOf(result));
        }

        @Test
        @DisplayName("Large starting points are supported")
        void shouldScanAboveFiftyDigits() {
            PrimeScanResult result = service.scan(BigInteger.TEN.pow(50), 1);

            assertEquals(BigInteger.TEN.pow(50).add(BigInteger.valueOf(151)), result.primes().get(0).prime());
        }

        @Test
        @DisplayName("Mersenne primes are flagged")
        void shouldFlagMersennePrimes() {
            List<ScannedPrime> primes = service.scan(BigInteger.valueOf(2_147_483_640L), 2).primes();

            assertEquals(BigInteger.valueOf(2_147_483_647L), primes.get(0).prime());
            assertTrue(primes.get(0).mersenne());
            assertEquals(BigInteger.valueOf(2_147_483_659L), primes.get(1).prime());
            assertFalse(primes.get(1).mersenne());
        }

        @Test
        @DisplayName("Small Mersenne primes among the first primes")
        void shouldFlagSmallMersennePrimes() {
            List<ScannedPrime> primes = service.scan(BigInteger.ONE, 5).primes();

            assertEquals(List.of(false, true, false, true, false),
                primes.stream().map(ScannedPrime::mersenne).toList());
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @ParameterizedTest(name = "start={0}, count={1} is rejected: {2}")
        @CsvSource({
            "0, 5, start must be a positive integer",
            "-3, 5, start must be a positive integer",
            "10, 0, count must be between 1 and 100",
            "10, 101, count must be between 1 and 100"
        })
        void shouldRejectInvalidRequests(String start, int count, String message) {
            IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> service.scan(new BigInteger(start), count));
            assertTrue(ex.getMessage().contains(message), ex.getMessage());
        }

        @Test
        @DisplayName("Start above the digit cap is rejected")
        void shouldRejectOversizedStart() {
            IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> service.scan(BigInteger.TEN.pow(1000), 1));
            assertTrue(ex.getMessage().contains("1001 digits"), ex.getMessage());
        }

        @Test
        @DisplayName("Gap beyond the step cap surfaces as exhaustion")
        void shouldPropagateExhaustion() {
            PrimeRefiner refiner = mock(PrimeRefiner.class);
            when(refiner.nextPrime(any(), anyLong()))
                .thenThrow(new RefinementExhaustionException(BigInteger.TEN, 1_000_000L));
            PrimeScanService failing = new PrimeScanService(refiner, PredictionConfig.defaults(), meterRegistry);

            assertThrows(RefinementExhaustionException.class, () -> failing.scan(BigInteger.TEN, 1));
            verify(refiner).nextPrime(BigInteger.TEN, PredictionConfig.DEFAULT_FORWARD_SCAN_LIMIT);
        }
    }

    @Nested
    @DisplayName("Metrics")
    class Metrics {

        @Test
        @DisplayName("Each scan records metrics")
        void shouldRecordMetrics() {
            service.scan(BigInteger.ONE, 5);

            assertEquals(1.0, meterRegistry.get("nthprime.scan.requests.total").counter().count());
            assertEquals(5.0, meterRegistry.get("nthprime.scan.size").summary().totalAmount());
            assertEquals(2.0, meterRegistry.get("nthprime.scan.mersenne.total").counter().count());
            assertEquals(1L, meterRegistry.get("nthprime.scan.time").timer().count());
        }
    }
}
