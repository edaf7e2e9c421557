package com.adobe.nthprime.exception;

/**
 * Raised when the working precision required for a magnitude cannot be
 * provided: the magnitude is beyond the supported cap, or an explicit
 * override is below the floor, above the maximum, or below what the
 * magnitude requires.
 */
public class PrecisionException extends PredictionException {

    public PrecisionException(String message) {
        super(message);
    }
}
