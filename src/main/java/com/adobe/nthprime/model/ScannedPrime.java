package com.adobe.nthprime.model;

import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;
import io.swagger.v3.oas.annotations.media.Schema;

import java.math.BigInteger;

/**
 * One prime found by a scan.
 * 
 * @param position      1-based position within the scan
 * @param prime         the probable prime
 * @param mersenne      whether the prime has the form 2^p - 1
 * @param elapsedMillis time spent finding this prime
 */
@Schema(description = "A probable prime found by a forward scan")
public record ScannedPrime(

    @Schema(description = "Position within the scan, starting at 1", example = "1")
    int position,

    @Schema(description = "Probable prime", example = "2147483647", type = "string")
    @JsonSerialize(using = ToStringSerializer.class)
    BigInteger prime,

    @Schema(description = "Whether the prime is a Mersenne prime", example = "true")
    boolean mersenne,

    @Schema(description = "Elapsed wall-clock time in milliseconds", example = "0")
    long elapsedMillis

) {
}
