package com.adobe.nthprime.exception;

import java.math.BigInteger;

/**
 * Raised when the refinement engine finds no probable prime within its
 * symmetric window and the bounded forward scan that follows it.
 * 
 * <p>This is a hard failure: the caller must raise the scan limit or
 * inspect the index manually.</p>
 */
public class RefinementExhaustionException extends PredictionException {

    private final BigInteger startCandidate;
    private final long stepsScanned;

    public RefinementExhaustionException(BigInteger startCandidate, long stepsScanned) {
        super(String.format("No probable prime found near %s after %d forward-scan steps",
            startCandidate, stepsScanned));
        this.startCandidate = startCandidate;
        this.stepsScanned = stepsScanned;
    }

    public BigInteger getStartCandidate() {
        return startCandidate;
    }

    public long getStepsScanned() {
        return stepsScanned;
    }
}
