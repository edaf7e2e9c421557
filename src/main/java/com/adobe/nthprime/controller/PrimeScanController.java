package com.adobe.nthprime.controller;

import com.adobe.nthprime.exception.InvalidInputException;
import com.adobe.nthprime.model.PrimeScanResult;
import com.adobe.nthprime.service.PrimeScanService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigInteger;

/**
 * REST Controller listing consecutive primes.
 * 
 * <p>{@code start} is a decimal integer or a power written {@code a^b}
 * (for example {@code 10^50}).</p>
 * 
 * <h3>Example:</h3>
 * <pre>
 * Request:  GET /primes?start=100&amp;count=3
 * Response: {"start": "100", "primes": [{"position": 1, "prime": "101", "mersenne": false, ...}, ...]}
 * </pre>
 */
@RestController
@Tag(name = "Prime Scan", description = "List consecutive probable primes")
public class PrimeScanController {

    private static final Logger logger = LoggerFactory.getLogger(PrimeScanController.class);

    // 4 bits per decimal digit bounds the power before it is computed
    private static final long MAX_POWER_BITS = 4L * PrimeScanService.MAX_START_DIGITS;

    private final PrimeScanService primeScanService;

    public PrimeScanController(PrimeScanService primeScanService) {
        this.primeScanService = primeScanService;
    }

    @GetMapping(value = "/primes", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(
        summary = "List consecutive primes",
        description = "Returns the first 'count' probable primes at or above 'start', flagging Mersenne primes."
    )
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Successful scan",
            content = @Content(mediaType = "application/json",
                schema = @Schema(implementation = PrimeScanResult.class))),
        @ApiResponse(responseCode = "400", description = "Invalid input",
            content = @Content(mediaType = "text/plain")),
        @ApiResponse(responseCode = "500", description = "Prime gap exceeded the scan limit",
            content = @Content(mediaType = "text/plain"))
    })
    public ResponseEntity<PrimeScanResult> scan(
            @Parameter(description = "Inclusive starting point: integer >= 1 or a^b, at most 1000 digits")
            @RequestParam String start,

            @Parameter(description = "Number of primes to return (1-100)")
            @RequestParam int count) {

        BigInteger from = parseStart(start);
        logger.info("Processing prime scan request: start of {} digits, count={}", from.toString().length(), count);

        PrimeScanResult result = primeScanService.scan(from, count);

        logger.info("Scanned {} primes, last {}", result.size(), result.primes().get(result.size() - 1).prime());
        return ResponseEntity.ok(result);
    }

    static BigInteger parseStart(String value) {
        String trimmed = value.trim();
        int caret = trimmed.indexOf('^');
        try {
            if (caret < 0) {
                return new BigInteger(trimmed);
            }
            BigInteger base = new BigInteger(trimmed.substring(0, caret));
            int exponent = Integer.parseInt(trimmed.substring(caret + 1));
            if (base.signum() <= 0 || exponent < 0) {
                throw new InvalidInputException(
                    "Invalid value '" + value + "' for parameter 'start'. " +
                    "The base must be positive and the exponent non-negative.");
            }
            if ((long) base.bitLength() * exponent > MAX_POWER_BITS) {
                throw new InvalidInputException(String.format(
                    "Parameter 'start' exceeds the maximum of %d digits: %s",
                    PrimeScanService.MAX_START_DIGITS, value));
            }
            return base.pow(exponent);
        } catch (NumberFormatException ex) {
            throw new InvalidInputException(
                "Invalid value '" + value + "' for parameter 'start'. Please provide an integer or a^b.", ex);
        }
    }
}
