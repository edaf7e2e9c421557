package com.adobe.nthprime.estimator;

import com.adobe.nthprime.function.BigDecimalMath;
import com.adobe.nthprime.model.PredictionConfig;
import com.adobe.nthprime.model.PredictionMethod;
import com.adobe.nthprime.precision.PrecisionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Calibrated prime-number-theorem estimate of p_n.
 * 
 * <h2>Formula:</h2>
 * <pre>
 *   L = ln n,  L2 = ln L
 *   pnt    = n · (L + L2 - 1 + (L2 - 2)/L)          (pnt ≤ 0 → n)
 *   d_term = (ln(pnt) / e⁴)² · pnt · c              (0 when ln(pnt) ≤ 0)
 *   e_term = pnt^(-1/3) · pnt · κ*
 *   result = round_half_up(pnt + d_term + e_term)  (sum ≤ 0 → pnt)
 * </pre>
 * 
 * <p>With the default calibration (c = -0.00016667, κ* = 0.065) the estimate
 * stays within 100 ppm of p_n for n between 10^10 and 10^18. Small indices are
 * poorly served; the service answers those from a table before reaching
 * this estimator.</p>
 * 
 * <h2>Thread Safety:</h2>
 * <p>Stateless.</p>
 * 
 * @author Adobe AEM Engineering Assessment
 * @version 1.0.0
 */
@Component
public class ClosedFormEstimator implements PrimeEstimator {

    private static final Logger logger = LoggerFactory.getLogger(ClosedFormEstimator.class);

    private static final BigDecimal TWO = BigDecimal.valueOf(2);
    private static final BigDecimal FOUR = BigDecimal.valueOf(4);
    private static final BigDecimal THREE = BigDecimal.valueOf(3);

    @Override
    public EstimateResult estimate(BigInteger n, PredictionConfig config, PrecisionContext ctx) {
        if (n.compareTo(BigInteger.TWO) < 0) {
            return EstimateResult.direct(BigDecimal.valueOf(2), PredictionMethod.CLOSED_FORM);
        }
        MathContext wmc = ctx.widen(BigDecimalMath.GUARD_DIGITS).mathContext();
        BigDecimal bigN = new BigDecimal(n);

        BigDecimal l = BigDecimalMath.ln(bigN, wmc);
        BigDecimal l2 = BigDecimalMath.ln(l, wmc);
        BigDecimal pnt = bigN.multiply(
            l.add(l2, wmc)
                .subtract(BigDecimal.ONE, wmc)
                .add(l2.subtract(TWO, wmc).divide(l, wmc), wmc),
            wmc);
        if (pnt.signum() <= 0) {
            pnt = bigN;
        }

        BigDecimal lnPnt = BigDecimalMath.ln(pnt, wmc);
        BigDecimal dTerm = BigDecimal.ZERO;
        if (lnPnt.signum() > 0) {
            BigDecimal ratio = lnPnt.divide(BigDecimalMath.exp(FOUR, wmc), wmc);
            dTerm = ratio.multiply(ratio, wmc).multiply(pnt, wmc).multiply(config.calibrationC(), wmc);
        }

        BigDecimal minusOneThird = BigDecimal.ONE.negate().divide(THREE, wmc);
        BigDecimal eTerm = BigDecimalMath.pow(pnt, minusOneThird, wmc)
            .multiply(pnt, wmc)
            .multiply(config.kappaStar(), wmc);

        BigDecimal total = pnt.add(dTerm, wmc).add(eTerm, wmc);
        if (total.signum() <= 0) {
            total = pnt;
        }
        BigDecimal rounded = total.setScale(0, RoundingMode.HALF_UP);

        logger.debug("Closed-form estimate for n={}: pnt={}, result={}",
            n, pnt.round(MathContext.DECIMAL64), rounded);
        return EstimateResult.direct(rounded, PredictionMethod.CLOSED_FORM);
    }

    @Override
    public PredictionMethod method() {
        return PredictionMethod.CLOSED_FORM;
    }
}
