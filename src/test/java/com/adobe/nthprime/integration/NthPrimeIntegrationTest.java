package com.adobe.nthprime.integration;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Integration tests for the nth-prime API.
 * 
 * <p>These tests verify the complete request/response cycle including:</p>
 * <ul>
 *   <li>JSON response format, with integers as strings</li>
 *   <li>Plain text response format for error cases</li>
 *   <li>HTTP status mapping of the error taxonomy</li>
 *   <li>Correlation ID propagation</li>
 * </ul>
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("nth Prime API Integration Tests")
class NthPrimeIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Nested
    @DisplayName("Single Prediction Endpoint")
    class SinglePredictionTests {

        @Test
        @DisplayName("GET /nthprime?n=1000000 returns the tabulated prime")
        void shouldReturnLookupForMillion() throws Exception {
            mockMvc.perform(get("/nthprime").param("n", "1000000"))
                .andExpect(status().isOk())
                .andExpect(content().contentType(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.index").value("1000000"))
                .andExpect(jsonPath("$.prime").value("15485863"))
                .andExpect(jsonPath("$.method").value("lookup"))
                .andExpect(jsonPath("$.iterations").value(0))
                .andExpect(jsonPath("$.converged").value(true));
        }

        @Test
        @DisplayName("GET /nthprime?n=1234567 uses the closed form by default")
        void shouldPredictWithClosedForm() throws Exception {
            mockMvc.perform(get("/nthprime").param("n", "1234567"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.prime").value("19402949"))
                .andExpect(jsonPath("$.estimate").value("19402960"))
                .andExpect(jsonPath("$.method").value("closed_form"))
                .andExpect(jsonPath("$.precisionDigits").value(128))
                .andExpect(jsonPath("$.offset").value("-11"));
        }

        @Test
        @DisplayName("GET /nthprime?n=1234567&method=newton inverts Riemann R")
        void shouldPredictWithNewton() throws Exception {
            mockMvc.perform(get("/nthprime").param("n", "1234567").param("method", "newton"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.prime").value("19395197"))
                .andExpect(jsonPath("$.method").value("newton"))
                .andExpect(jsonPath("$.converged").value(true))
                .andExpect(jsonPath("$.iterations").value(greaterThan(0)));
        }

        @Test
        @DisplayName("Very large indices are returned as strings")
        void shouldRenderLargeIntegersAsStrings() throws Exception {
            mockMvc.perform(get("/nthprime").param("n", "1000000000000000000"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.prime").value("44211790234832169331"));
        }

        @Test
        @DisplayName("Response carries the caller's correlation ID")
        void shouldEchoCorrelationId() throws Exception {
            mockMvc.perform(get("/nthprime").param("n", "10").header("X-Correlation-ID", "test-1234"))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Correlation-ID", "test-1234"));
        }
    }

    @Nested
    @DisplayName("Range Prediction Endpoint")
    class RangePredictionTests {

        @Test
        @DisplayName("GET /nthprime?min=20&max=30 returns predictions in order")
        void shouldPredictRange() throws Exception {
            mockMvc.perform(get("/nthprime").param("min", "20").param("max", "30"))
                .andExpect(status().isOk())
                .andExpect(content().contentType(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.predictions", hasSize(11)))
                .andExpect(jsonPath("$.predictions[0].index").value("20"))
                .andExpect(jsonPath("$.predictions[0].prime").value("71"))
                .andExpect(jsonPath("$.predictions[5].prime").value("97"))
                .andExpect(jsonPath("$.predictions[10].index").value("30"));
        }
    }

    @Nested
    @DisplayName("Error Handling - Plain Text Responses")
    class ErrorHandlingTests {

        @Test
        @DisplayName("n=0 returns 400")
        void shouldRejectZero() throws Exception {
            mockMvc.perform(get("/nthprime").param("n", "0"))
                .andExpect(status().isBadRequest())
                .andExpect(content().contentType(MediaType.TEXT_PLAIN))
                .andExpect(content().string(containsString("positive integer")));
        }

        @Test
        @DisplayName("Non-integer n returns 400")
        void shouldRejectNonInteger() throws Exception {
            mockMvc.perform(get("/nthprime").param("n", "abc"))
                .andExpect(status().isBadRequest())
                .andExpect(content().string(containsString("Invalid value 'abc'")));
        }

        @Test
        @DisplayName("No parameters returns 400")
        void shouldRejectMissingParameters() throws Exception {
            mockMvc.perform(get("/nthprime"))
                .andExpect(status().isBadRequest())
                .andExpect(content().string(containsString("Missing required parameter")));
        }

        @Test
        @DisplayName("Unknown method returns 400")
        void shouldRejectUnknownMethod() throws Exception {
            mockMvc.perform(get("/nthprime").param("n", "12345").param("method", "bisection"))
                .andExpect(status().isBadRequest())
                .andExpect(content().string(containsString("Unknown method")));
        }

        @Test
        @DisplayName("Malformed numeric option returns 400")
        void shouldRejectMalformedPrecision() throws Exception {
            mockMvc.perform(get("/nthprime").param("n", "12345").param("precision", "lots"))
                .andExpect(status().isBadRequest())
                .andExpect(content().string(containsString("precision")));
        }

        @Test
        @DisplayName("Only min returns 400")
        void shouldRejectHalfRange() throws Exception {
            mockMvc.perform(get("/nthprime").param("min", "5"))
                .andExpect(status().isBadRequest())
                .andExpect(content().string(containsString("Both 'min' and 'max'")));
        }

        @Test
        @DisplayName("n together with min and max returns 400")
        void shouldRejectSingleAndRangeTogether() throws Exception {
            mockMvc.perform(get("/nthprime").param("n", "100").param("min", "5").param("max", "10"))
                .andExpect(status().isBadRequest())
                .andExpect(content().contentType(MediaType.TEXT_PLAIN))
                .andExpect(content().string(containsString("cannot be combined")));
        }

        @Test
        @DisplayName("n together with only max returns 400")
        void shouldRejectSingleWithHalfRange() throws Exception {
            mockMvc.perform(get("/nthprime").param("n", "100").param("max", "10"))
                .andExpect(status().isBadRequest())
                .andExpect(content().string(containsString("cannot be combined")));
        }

        @Test
        @DisplayName("Series depth above the cap returns 400")
        void shouldRejectOversizedSeriesDepth() throws Exception {
            mockMvc.perform(get("/nthprime").param("n", "1234567").param("method", "newton").param("k", "2000"))
                .andExpect(status().isBadRequest())
                .andExpect(content().string(containsString("between 1 and 100")));
        }

        @Test
        @DisplayName("Iteration budget above the cap returns 400")
        void shouldRejectOversizedIterationBudget() throws Exception {
            mockMvc.perform(get("/nthprime").param("n", "1234567").param("method", "newton")
                    .param("tolerance", "1e-5000").param("maxIterations", "2147483647"))
                .andExpect(status().isBadRequest())
                .andExpect(content().string(containsString("maxIterations must be between 1 and 100")));
        }

        @Test
        @DisplayName("min == max returns 400")
        void shouldRejectEmptyRange() throws Exception {
            mockMvc.perform(get("/nthprime").param("min", "5").param("max", "5"))
                .andExpect(status().isBadRequest())
                .andExpect(content().string(containsString("must be less than")));
        }

        @Test
        @DisplayName("Oversized range returns 400")
        void shouldRejectOversizedRange() throws Exception {
            mockMvc.perform(get("/nthprime").param("min", "1").param("max", "1000"))
                .andExpect(status().isBadRequest())
                .andExpect(content().string(containsString("exceeds maximum allowed")));
        }

        @Test
        @DisplayName("Insufficient precision override returns 422")
        void shouldRejectLowPrecision() throws Exception {
            mockMvc.perform(get("/nthprime").param("n", "12345").param("precision", "10"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(content().contentType(MediaType.TEXT_PLAIN))
                .andExpect(content().string(containsString("below the minimum")));
        }

        @Test
        @DisplayName("Index at the supported cap returns 422")
        void shouldRejectIndexAboveCap() throws Exception {
            mockMvc.perform(get("/nthprime").param("n", "1" + "0".repeat(100)))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(content().string(containsString("supported cap")));
        }
    }
}
