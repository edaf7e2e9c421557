package com.adobe.nthprime.refinement;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigInteger;
import java.util.List;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MersennePrimes Tests")
class MersennePrimesTest {

    private static BigInteger mersenne(int p) {
        return BigInteger.ONE.shiftLeft(p).subtract(BigInteger.ONE);
    }

    @ParameterizedTest(name = "2^{0} - 1 is a Mersenne prime")
    @ValueSource(ints = {2, 3, 5, 7, 13, 17, 19, 31, 61, 89, 107, 127})
    void shouldAcceptMersennePrimes(int p) {
        assertTrue(MersennePrimes.isMersennePrime(mersenne(p)));
    }

    @ParameterizedTest(name = "2^{0} - 1 is composite")
    @ValueSource(ints = {4, 6, 11, 23, 29, 37, 67, 101})
    void shouldRejectCompositeMersenneNumbers(int p) {
        assertFalse(MersennePrimes.isMersennePrime(mersenne(p)));
    }

    @ParameterizedTest(name = "{0} is not of the form 2^p - 1")
    @ValueSource(longs = {-1, 0, 1, 2, 5, 11, 8193, 2147483659L})
    void shouldRejectOtherValues(long n) {
        assertFalse(MersennePrimes.isMersennePrime(BigInteger.valueOf(n)));
    }

    @Test
    @DisplayName("Lucas-Lehmer agrees with the known exponents below 130")
    void shouldMatchKnownExponents() {
        List<Integer> exponents = IntStream.rangeClosed(2, 130)
            .filter(MersennePrimes::lucasLehmer)
            .boxed()
            .toList();

        assertEquals(List.of(2, 3, 5, 7, 13, 17, 19, 31, 61, 89, 107, 127), exponents);
    }
}
