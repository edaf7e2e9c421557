package com.adobe.nthprime.model;

import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;
import io.swagger.v3.oas.annotations.media.Schema;

import java.math.BigInteger;

/**
 * Response model for a single nth-prime prediction.
 * 
 * <p>Integers of arbitrary size are written as JSON strings so that clients
 * parsing numbers into doubles do not lose digits.</p>
 * 
 * <h2>Response Format:</h2>
 * <pre>
 * {
 *     "index": "1234567",
 *     "prime": "19402949",
 *     "estimate": "19402960",
 *     "iterations": 0,
 *     "converged": true,
 *     "elapsedMillis": 3,
 *     "method": "closed_form",
 *     "precisionDigits": 128,
 *     "candidatesTested": 9,
 *     "offset": -11
 * }
 * </pre>
 * 
 * @param index            the prime index n
 * @param prime            the probable prime returned for n
 * @param estimate         the continuous estimate rounded half-up
 * @param iterations       Newton iterations used (0 for lookup and closed form)
 * @param converged        whether the estimator met its tolerance
 * @param elapsedMillis    wall-clock time of the call
 * @param method           provenance of the answer
 * @param precisionDigits  working precision, 0 when answered from a table
 * @param candidatesTested primality tests run during refinement
 * @param offset           prime minus the rounded estimate
 * 
 * @author Adobe AEM Engineering Assessment
 * @version 1.0.0
 */
@Schema(description = "Predicted nth prime with provenance metadata")
public record PredictionResult(

    @Schema(description = "Prime index n", example = "1234567", type = "string")
    @JsonSerialize(using = ToStringSerializer.class)
    BigInteger index,

    @Schema(description = "Predicted probable prime", example = "19402949", type = "string")
    @JsonSerialize(using = ToStringSerializer.class)
    BigInteger prime,

    @Schema(description = "Estimator output rounded to the nearest integer", example = "19402960", type = "string")
    @JsonSerialize(using = ToStringSerializer.class)
    BigInteger estimate,

    @Schema(description = "Newton iterations performed", example = "0")
    int iterations,

    @Schema(description = "Whether the estimator converged", example = "true")
    boolean converged,

    @Schema(description = "Elapsed wall-clock time in milliseconds", example = "3")
    long elapsedMillis,

    @Schema(description = "How the prime was obtained", example = "closed_form",
        allowableValues = {"lookup", "closed_form", "newton"})
    PredictionMethod method,

    @Schema(description = "Working precision in decimal digits (0 for table answers)", example = "128")
    int precisionDigits,

    @Schema(description = "Candidates submitted to the primality test", example = "9")
    long candidatesTested,

    @Schema(description = "Prime minus rounded estimate", example = "-11", type = "string")
    @JsonSerialize(using = ToStringSerializer.class)
    BigInteger offset

) {
    /**
     * Creates a result for an index answered exactly from a table.
     * 
     * @param index         the prime index
     * @param prime         the tabulated prime
     * @param elapsedMillis elapsed time
     * @return a lookup result
     */
    public static PredictionResult lookup(BigInteger index, BigInteger prime, long elapsedMillis) {
        return new PredictionResult(index, prime, prime, 0, true, elapsedMillis,
            PredictionMethod.LOOKUP, 0, 0, BigInteger.ZERO);
    }
}
