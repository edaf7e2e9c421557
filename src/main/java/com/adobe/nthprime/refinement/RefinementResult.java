package com.adobe.nthprime.refinement;

import java.math.BigInteger;

/**
 * Prime found by {@link PrimeRefiner} and how it was reached.
 * 
 * @param prime            the accepted probable prime
 * @param rounded          the estimate rounded half-up
 * @param candidatesTested distinct candidates submitted to the primality test
 * @param offset           prime minus {@code rounded}
 * @param forwardScan      whether the bounded forward scan produced the prime
 */
public record RefinementResult(BigInteger prime, BigInteger rounded, long candidatesTested,
                               BigInteger offset, boolean forwardScan) {
}
