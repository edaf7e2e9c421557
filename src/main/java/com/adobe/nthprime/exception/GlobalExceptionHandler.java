package com.adobe.nthprime.exception;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Global exception handler for the nth-prime API.
 * 
 * <p>Errors are returned as plain text prefixed with {@code "Error: "}.</p>
 * 
 * <h2>Status Mapping:</h2>
 * <ul>
 *   <li><b>400:</b> invalid index, malformed or out-of-range parameters</li>
 *   <li><b>404:</b> unknown resource</li>
 *   <li><b>422:</b> {@link PrecisionException}, {@link NumericDegeneracyException}</li>
 *   <li><b>500:</b> {@link RefinementExhaustionException}, anything unexpected</li>
 * </ul>
 * 
 * @author Adobe AEM Engineering Assessment
 * @version 1.0.0
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /**
     * Handles InvalidInputException, including invalid prime indices.
     * 
     * @param ex the InvalidInputException
     * @return ResponseEntity with plain text error message and 400 status
     */
    @ExceptionHandler(InvalidInputException.class)
    public ResponseEntity<String> handleInvalidInputException(InvalidInputException ex) {
        logger.warn("Invalid input: {}", ex.getMessage());
        return buildErrorResponse(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    /**
     * Handles IllegalArgumentException from service layers (e.g. range validation).
     * 
     * @param ex the IllegalArgumentException
     * @return ResponseEntity with plain text error message and 400 status
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<String> handleIllegalArgumentException(IllegalArgumentException ex) {
        logger.warn("Illegal argument: {}", ex.getMessage());
        return buildErrorResponse(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<String> handleMissingParameter(MissingServletRequestParameterException ex) {
        String paramName = ex.getParameterName();
        logger.warn("Missing required parameter: {}", paramName);
        return buildErrorResponse(HttpStatus.BAD_REQUEST, "Missing required parameter '" + paramName + "'");
    }

    /**
     * Handles type mismatch exceptions, such as "abc" for {@code precision}.
     * 
     * @param ex the MethodArgumentTypeMismatchException
     * @return ResponseEntity with plain text error message and 400 status
     */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<String> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        String paramName = ex.getName();
        Object value = ex.getValue();
        logger.warn("Type mismatch for parameter '{}': {}", paramName, value);
        return buildErrorResponse(HttpStatus.BAD_REQUEST,
            "Invalid value '" + value + "' for parameter '" + paramName + "'. Please provide a valid number.");
    }

    /**
     * Handles precision requirements the engine cannot satisfy.
     * 
     * @param ex the PrecisionException
     * @return ResponseEntity with plain text error message and 422 status
     */
    @ExceptionHandler(PrecisionException.class)
    public ResponseEntity<String> handlePrecisionException(PrecisionException ex) {
        logger.warn("Precision error: {}", ex.getMessage());
        return buildErrorResponse(HttpStatus.UNPROCESSABLE_ENTITY, ex.getMessage());
    }

    /**
     * Handles numeric breakdowns of the Newton estimator, including a zero derivative.
     * 
     * @param ex the NumericDegeneracyException
     * @return ResponseEntity with plain text error message and 422 status
     */
    @ExceptionHandler(NumericDegeneracyException.class)
    public ResponseEntity<String> handleNumericDegeneracy(NumericDegeneracyException ex) {
        logger.warn("Numeric degeneracy: {}", ex.getMessage());
        return buildErrorResponse(HttpStatus.UNPROCESSABLE_ENTITY, ex.getMessage());
    }

    /**
     * Handles a refinement search that found no prime.
     * 
     * @param ex the RefinementExhaustionException
     * @return ResponseEntity with plain text error message and 500 status
     */
    @ExceptionHandler(RefinementExhaustionException.class)
    public ResponseEntity<String> handleRefinementExhaustion(RefinementExhaustionException ex) {
        logger.error("Refinement exhausted [correlationId={}]: {}", MDC.get("correlationId"), ex.getMessage());
        return buildErrorResponse(HttpStatus.INTERNAL_SERVER_ERROR, ex.getMessage());
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<String> handleNoResourceFound(NoResourceFoundException ex) {
        logger.warn("Resource not found: {}", ex.getResourcePath());
        return buildErrorResponse(HttpStatus.NOT_FOUND, "Resource not found: " + ex.getResourcePath());
    }

    /**
     * Catch-all handler for unexpected exceptions.
     * 
     * <p>Includes the correlation ID in the response for issue reporting.</p>
     * 
     * @param ex the Exception
     * @return ResponseEntity with generic error message and 500 status
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<String> handleGenericException(Exception ex) {
        String correlationId = MDC.get("correlationId");
        logger.error("Unexpected error occurred [correlationId={}]", correlationId, ex);

        String message = "An unexpected error occurred. Please try again later.";
        if (correlationId != null) {
            message += " (Reference: " + correlationId + ")";
        }
        return buildErrorResponse(HttpStatus.INTERNAL_SERVER_ERROR, message);
    }

    private ResponseEntity<String> buildErrorResponse(HttpStatus status, String message) {
        return ResponseEntity
            .status(status)
            .contentType(MediaType.TEXT_PLAIN)
            .body("Error: " + message);
    }
}
