package com.adobe.nthprime.exception;

import java.math.BigInteger;

/**
 * Thrown when a prime index is outside the domain of the operation,
 * e.g. {@code n < 1} for a prediction or {@code n < 2} for an asymptotic seed.
 */
public class InvalidIndexException extends InvalidInputException {

    private final BigInteger index;

    public InvalidIndexException(BigInteger index, String message) {
        super(message);
        this.index = index;
    }

    /**
     * Creates the standard "n must be >= 1" failure.
     *
     * @param index the rejected index
     * @return a new exception
     */
    public static InvalidIndexException notPositive(BigInteger index) {
        return new InvalidIndexException(index,
            String.format("Prime index must be a positive integer (n >= 1), got: %s", index));
    }

    public BigInteger getIndex() {
        return index;
    }
}
