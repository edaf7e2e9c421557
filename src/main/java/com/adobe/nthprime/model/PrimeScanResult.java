package com.adobe.nthprime.model;

import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;
import io.swagger.v3.oas.annotations.media.Schema;

import java.math.BigInteger;
import java.util.List;

/**
 * Response model for a prime scan.
 * 
 * <pre>
 * {
 *     "start": "2147483640",
 *     "primes": [
 *         {"position": 1, "prime": "2147483647", "mersenne": true, "elapsedMillis": 0},
 *         {"position": 2, "prime": "2147483659", "mersenne": false, "elapsedMillis": 0}
 *     ]
 * }
 * </pre>
 * 
 * @param start  inclusive lower bound of the scan
 * @param primes consecutive probable primes in ascending order
 * 
 * @author Adobe AEM Engineering Assessment
 * @version 1.0.0
 */
@Schema(description = "Consecutive probable primes from a starting point")
public record PrimeScanResult(

    @Schema(description = "Inclusive starting point", example = "2147483640", type = "string")
    @JsonSerialize(using = ToStringSerializer.class)
    BigInteger start,

    @Schema(description = "Primes in ascending order")
    List<ScannedPrime> primes

) {
    public static PrimeScanResult of(BigInteger start, List<ScannedPrime> primes) {
        return new PrimeScanResult(start, List.copyOf(primes));
    }

    public int size() {
        return primes != null ? primes.size() : 0;
    }
}
