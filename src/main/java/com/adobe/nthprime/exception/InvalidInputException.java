package com.adobe.nthprime.exception;

/**
 * Exception thrown when request input fails validation.
 * 
 * <p>This exception is used to indicate invalid user input, such as:</p>
 * <ul>
 *   <li>Non-integer prime index</li>
 *   <li>Invalid range parameters (min >= max, oversized batch)</li>
 *   <li>Missing required parameters</li>
 *   <li>Unknown estimator method name</li>
 * </ul>
 * 
 * <p>This exception results in a 400 Bad Request HTTP response with a
 * plain text error message.</p>
 * 
 * @author Adobe AEM Engineering Assessment
 * @version 2.0.0
 */
public class InvalidInputException extends RuntimeException {

    /**
     * Constructs an InvalidInputException with the specified message.
     * 
     * @param message the error message describing the validation failure
     */
    public InvalidInputException(String message) {
        super(message);
    }

    /**
     * Constructs an InvalidInputException with a message and cause.
     * 
     * @param message the error message
     * @param cause   the underlying cause of the exception
     */
    public InvalidInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
