package com.adobe.nthprime.exception;

/**
 * Base type for failures raised inside the prediction engine once the
 * input has been accepted.
 * 
 * <p>All subclasses are unchecked and synchronous. No partial result is
 * ever returned alongside one of these exceptions.</p>
 * 
 * @author Adobe AEM Engineering Assessment
 * @version 1.0.0
 */
public abstract class PredictionException extends RuntimeException {

    protected PredictionException(String message) {
        super(message);
    }

    protected PredictionException(String message, Throwable cause) {
        super(message, cause);
    }
}
