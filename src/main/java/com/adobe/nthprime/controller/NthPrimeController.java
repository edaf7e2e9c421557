package com.adobe.nthprime.controller;

import com.adobe.nthprime.exception.InvalidInputException;
import com.adobe.nthprime.model.BatchPredictionResult;
import com.adobe.nthprime.model.PredictionConfig;
import com.adobe.nthprime.model.PredictionMethod;
import com.adobe.nthprime.model.PredictionResult;
import com.adobe.nthprime.service.NthPrimeService;
import com.adobe.nthprime.service.ParallelBatchProcessor;
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

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * REST Controller for nth-prime prediction endpoints.
 * 
 * <ul>
 *   <li>Single prediction: GET /nthprime?n={index}</li>
 *   <li>Range prediction: GET /nthprime?min={index}&amp;max={index}</li>
 * </ul>
 * 
 * <p>Both forms accept optional tuning parameters ({@code method}, {@code k},
 * {@code maxIterations}, {@code tolerance}, {@code precision}, {@code c},
 * {@code kappaStar}); anything omitted falls back to the application
 * defaults.</p>
 * 
 * <h2>Response Formats:</h2>
 * <ul>
 *   <li><b>Success:</b> JSON, with integers rendered as strings</li>
 *   <li><b>Error:</b> Plain text message</li>
 * </ul>
 * 
 * @author Adobe AEM Engineering Assessment
 * @version 1.0.0
 */
@RestController
@Tag(name = "nth Prime Prediction", description = "Predict the nth prime number")
public class NthPrimeController {

    private static final Logger logger = LoggerFactory.getLogger(NthPrimeController.class);

    private final NthPrimeService nthPrimeService;
    private final ParallelBatchProcessor batchProcessor;

    /**
     * Constructs the controller with the required services.
     * 
     * @param nthPrimeService the prediction service
     * @param batchProcessor  the parallel range processor
     */
    public NthPrimeController(NthPrimeService nthPrimeService, ParallelBatchProcessor batchProcessor) {
        this.nthPrimeService = nthPrimeService;
        this.batchProcessor = batchProcessor;
    }

    /**
     * Predicts the nth prime, or every prime in an index range.
     * 
     * <h3>Example:</h3>
     * <pre>
     * Request:  GET /nthprime?n=1000000
     * Response: {"index": "1000000", "prime": "15485863", "method": "lookup", ...}
     * </pre>
     * 
     * @return ResponseEntity containing the prediction(s) as JSON
     */
    @GetMapping(value = "/nthprime", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(
        summary = "Predict the nth prime",
        description = "Predicts p_n for a single index 'n', or for every index between 'min' and 'max'. " +
                      "Optional parameters tune the estimator; omitted ones use the service defaults."
    )
    @ApiResponses(value = {
        @ApiResponse(
            responseCode = "200",
            description = "Successful prediction",
            content = @Content(
                mediaType = "application/json",
                schema = @Schema(oneOf = {PredictionResult.class, BatchPredictionResult.class})
            )
        ),
        @ApiResponse(responseCode = "400", description = "Invalid input",
            content = @Content(mediaType = "text/plain")),
        @ApiResponse(responseCode = "422", description = "Index outside the supported precision or numerically degenerate",
            content = @Content(mediaType = "text/plain")),
        @ApiResponse(responseCode = "500", description = "No prime found within refinement limits",
            content = @Content(mediaType = "text/plain"))
    })
    public ResponseEntity<?> predict(
            @Parameter(description = "Prime index (integer >= 1, arbitrary size)")
            @RequestParam(required = false) String n,

            @Parameter(description = "First index of a range (inclusive)")
            @RequestParam(required = false) String min,

            @Parameter(description = "Last index of a range (inclusive, at most 500 indices)")
            @RequestParam(required = false) String max,

            @Parameter(description = "Estimator: closed_form or newton")
            @RequestParam(required = false) String method,

            @Parameter(description = "Riemann R series depth K (newton, 1-100)")
            @RequestParam(required = false) Integer k,

            @Parameter(description = "Newton iteration budget (1-100)")
            @RequestParam(required = false) Integer maxIterations,

            @Parameter(description = "Relative Newton convergence tolerance, e.g. 1e-50")
            @RequestParam(required = false) BigDecimal tolerance,

            @Parameter(description = "Working precision override in decimal digits (50-1024)")
            @RequestParam(required = false) Integer precision,

            @Parameter(description = "Closed-form calibration constant c")
            @RequestParam(required = false) BigDecimal c,

            @Parameter(description = "Closed-form calibration constant kappa*")
            @RequestParam(required = false) BigDecimal kappaStar) {

        PredictionConfig config = buildConfig(method, k, maxIterations, tolerance, precision, c, kappaStar);

        if (min != null || max != null) {
            if (n != null) {
                throw new InvalidInputException(
                    "Parameter 'n' cannot be combined with 'min'/'max'. Provide either a single index or a range.");
            }
            return handleRangePrediction(min, max, config);
        }
        if (n != null) {
            return handleSinglePrediction(n, config);
        }
        throw new InvalidInputException(
            "Missing required parameter. Provide 'n' for a single prediction, " +
            "or both 'min' and 'max' for a range.");
    }

    private ResponseEntity<PredictionResult> handleSinglePrediction(String n, PredictionConfig config) {
        BigInteger index = parseIndex("n", n);
        logger.info("Processing prediction request for n={} (method={})", index, config.method().wireName());

        PredictionResult result = nthPrimeService.predict(index, config);

        logger.info("Predicted p_{} = {} via {} in {}ms",
            result.index(), result.prime(), result.method().wireName(), result.elapsedMillis());
        return ResponseEntity.ok(result);
    }

    private ResponseEntity<BatchPredictionResult> handleRangePrediction(String min, String max,
                                                                        PredictionConfig config) {
        if (min == null || max == null) {
            throw new InvalidInputException(
                "Both 'min' and 'max' parameters are required for range prediction.");
        }
        long from = parseRangeBound("min", min);
        long to = parseRangeBound("max", max);
        logger.info("Processing range prediction request: min={}, max={}", from, to);

        BatchPredictionResult result = batchProcessor.processRange(from, to, config);

        logger.info("Successfully predicted range [{}-{}]: {} predictions", from, to, result.size());
        return ResponseEntity.ok(result);
    }

    private PredictionConfig buildConfig(String method, Integer k, Integer maxIterations, BigDecimal tolerance,
                                         Integer precision, BigDecimal c, BigDecimal kappaStar) {
        PredictionConfig config = nthPrimeService.getDefaultConfig();
        if (method != null) {
            config = config.withMethod(PredictionMethod.fromEstimatorName(method));
        }
        if (k != null) {
            config = config.withSeriesTerms(k);
        }
        if (maxIterations != null) {
            config = config.withMaxIterations(maxIterations);
        }
        if (tolerance != null) {
            config = config.withTolerance(tolerance);
        }
        if (precision != null) {
            config = config.withPrecisionOverride(precision);
        }
        if (c != null || kappaStar != null) {
            config = config.withCalibration(
                c != null ? c : config.calibrationC(),
                kappaStar != null ? kappaStar : config.kappaStar());
        }
        return config;
    }

    private static BigInteger parseIndex(String name, String value) {
        try {
            return new BigInteger(value.trim());
        } catch (NumberFormatException ex) {
            throw new InvalidInputException(
                "Invalid value '" + value + "' for parameter '" + name + "'. Please provide a valid integer.", ex);
        }
    }

    private static long parseRangeBound(String name, String value) {
        BigInteger bound = parseIndex(name, value);
        if (bound.bitLength() >= Long.SIZE) {
            throw new InvalidInputException(
                "Parameter '" + name + "' is too large for a range request: " + value);
        }
        return bound.longValue();
    }
}
