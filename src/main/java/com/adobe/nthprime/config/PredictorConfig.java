package com.adobe.nthprime.config;

import com.adobe.nthprime.model.PredictionConfig;
import com.adobe.nthprime.model.PredictionMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;

/**
 * Builds the default {@link PredictionConfig} from {@code app.predictor.*}.
 * 
 * <h2>Properties:</h2>
 * <ul>
 *   <li>{@code series-terms}: Riemann R depth K (default 10)</li>
 *   <li>{@code max-iterations}: Newton budget (default 10)</li>
 *   <li>{@code tolerance}: relative Newton tolerance (default 1e-50)</li>
 *   <li>{@code calibration.c}, {@code calibration.kappa-star}: closed-form constants</li>
 *   <li>{@code method}: {@code closed_form} or {@code newton}</li>
 *   <li>{@code refinement.forward-scan-limit}: fallback scan cap (default 1,000,000)</li>
 * </ul>
 * 
 * <p>The older calibration pair (c = -0.00247, κ* = 0.04449) can be restored
 * by setting the two calibration properties.</p>
 * 
 * @author Adobe AEM Engineering Assessment
 * @version 1.0.0
 */
@Configuration
public class PredictorConfig {

    private static final Logger logger = LoggerFactory.getLogger(PredictorConfig.class);

    @Value("${app.predictor.series-terms:10}")
    private int seriesTerms;

    @Value("${app.predictor.max-iterations:10}")
    private int maxIterations;

    @Value("${app.predictor.tolerance:1e-50}")
    private String tolerance;

    @Value("${app.predictor.calibration.c:-0.00016667}")
    private String calibrationC;

    @Value("${app.predictor.calibration.kappa-star:0.065}")
    private String kappaStar;

    @Value("${app.predictor.method:closed_form}")
    private String method;

    @Value("${app.predictor.refinement.forward-scan-limit:1000000}")
    private long forwardScanLimit;

    /**
     * @return the configuration applied to requests that do not override it
     */
    @Bean
    public PredictionConfig defaultPredictionConfig() {
        PredictionConfig config = new PredictionConfig(
            null,
            seriesTerms,
            maxIterations,
            new BigDecimal(tolerance),
            new BigDecimal(calibrationC),
            new BigDecimal(kappaStar),
            PredictionMethod.fromEstimatorName(method),
            forwardScanLimit);
        logger.info("Default prediction config: method={}, K={}, maxIterations={}, tolerance={}, c={}, kappaStar={}",
            config.method().wireName(), config.seriesTerms(), config.maxIterations(),
            config.tolerance(), config.calibrationC(), config.kappaStar());
        return config;
    }
}
