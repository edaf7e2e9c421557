package com.adobe.nthprime.refinement;

import java.math.BigInteger;

/**
 * A value submitted to the primality test during refinement.
 * 
 * @param value     the candidate
 * @param offset    candidate minus the rounded estimate
 * @param direction +1 above the estimate, -1 below, 0 at the start point
 */
public record RefinementCandidate(BigInteger value, BigInteger offset, int direction) {

    static RefinementCandidate of(BigInteger value, BigInteger origin, int direction) {
        return new RefinementCandidate(value, value.subtract(origin), direction);
    }
}
