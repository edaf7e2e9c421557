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
 * Integration tests for the prime scan endpoint.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("Prime Scan API Integration Tests")
class PrimeScanIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Nested
    @DisplayName("Scan Endpoint")
    class ScanTests {

        @Test
        @DisplayName("GET /primes?start=100&count=3 lists the next primes")
        void shouldListPrimes() throws Exception {
            mockMvc.perform(get("/primes").param("start", "100").param("count", "3"))
                .andExpect(status().isOk())
                .andExpect(content().contentType(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.start").value("100"))
                .andExpect(jsonPath("$.primes", hasSize(3)))
                .andExpect(jsonPath("$.primes[0].position").value(1))
                .andExpect(jsonPath("$.primes[0].prime").value("101"))
                .andExpect(jsonPath("$.primes[1].prime").value("103"))
                .andExpect(jsonPath("$.primes[2].prime").value("107"))
                .andExpect(jsonPath("$.primes[2].mersenne").value(false));
        }

        @Test
        @DisplayName("Power notation is accepted for the start")
        void shouldAcceptPowerNotation() throws Exception {
            mockMvc.perform(get("/primes").param("start", "10^12").param("count", "1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.start").value("1000000000000"))
                .andExpect(jsonPath("$.primes[0].prime").value("1000000000039"));
        }

        @Test
        @DisplayName("Mersenne prime 2^31 - 1 is flagged")
        void shouldFlagMersennePrime() throws Exception {
            mockMvc.perform(get("/primes").param("start", "2147483647").param("count", "1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.primes[0].prime").value("2147483647"))
                .andExpect(jsonPath("$.primes[0].mersenne").value(true));
        }
    }

    @Nested
    @DisplayName("Error Handling - Plain Text Responses")
    class ErrorHandlingTests {

        @Test
        @DisplayName("count=0 returns 400")
        void shouldRejectZeroCount() throws Exception {
            mockMvc.perform(get("/primes").param("start", "100").param("count", "0"))
                .andExpect(status().isBadRequest())
                .andExpect(content().contentType(MediaType.TEXT_PLAIN))
                .andExpect(content().string(containsString("count must be between 1 and 100")));
        }

        @Test
        @DisplayName("Non-integer start returns 400")
        void shouldRejectMalformedStart() throws Exception {
            mockMvc.perform(get("/primes").param("start", "ten").param("count", "3"))
                .andExpect(status().isBadRequest())
                .andExpect(content().string(containsString("Invalid value 'ten'")));
        }

        @Test
        @DisplayName("Oversized power returns 400 before it is computed")
        void shouldRejectOversizedPower() throws Exception {
            mockMvc.perform(get("/primes").param("start", "10^100000").param("count", "1"))
                .andExpect(status().isBadRequest())
                .andExpect(content().string(containsString("maximum of 1000 digits")));
        }

        @Test
        @DisplayName("Missing count returns 400")
        void shouldRejectMissingCount() throws Exception {
            mockMvc.perform(get("/primes").param("start", "100"))
                .andExpect(status().isBadRequest())
                .andExpect(content().string(containsString("count")));
        }
    }
}
