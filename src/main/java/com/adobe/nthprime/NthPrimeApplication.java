package com.adobe.nthprime;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the nth-Prime Prediction Service.
 * 
 * <p>This service predicts the nth prime for arbitrarily large indices by
 * combining an asymptotic estimate with a local primality search.</p>
 * 
 * <h2>Features:</h2>
 * <ul>
 *   <li>Closed-form calibrated estimate and Newton inversion of Riemann R(x)</li>
 *   <li>Arbitrary-precision arithmetic scoped per request</li>
 *   <li>Exact answers for canonical indices (powers of ten, n ≤ 25)</li>
 *   <li>Parallel range predictions with metrics, logging, and health checks</li>
 * </ul>
 * 
 * <h2>API Endpoints:</h2>
 * <ul>
 *   <li>GET /nthprime?n={index} - Single prediction</li>
 *   <li>GET /nthprime?min={index}&amp;max={index} - Range prediction</li>
 * </ul>
 * 
 * @author Adobe AEM Engineering Assessment
 * @version 1.0.0
 */
@SpringBootApplication
public class NthPrimeApplication {

    /**
     * Application entry point.
     * 
     * @param args command line arguments
     */
    public static void main(String[] args) {
        SpringApplication.run(NthPrimeApplication.class, args);
    }
}
