package com.adobe.nthprime.function;

import com.adobe.nthprime.precision.PrecisionContext;

import java.math.BigDecimal;
import java.math.MathContext;

/**
 * The logarithmic integral li(x) = ∫₀ˣ dt / ln t for x &gt; 1.
 * 
 * <p>Evaluated through the convergent series</p>
 * <pre>
 *   li(x) = ln(ln x) + γ + Σ_{j≥1} (ln x)^j / (j · j!)
 * </pre>
 * <p>truncated once a term drops below {@code 10^-(digits - 5)} of the
 * supplied precision context. Terms grow until {@code j ≈ ln x} and decay
 * factorially after that, so the loop always terminates; the hard cap on the
 * number of terms only guards against a corrupted context.</p>
 */
public final class LogarithmicIntegral {

    static final int MAX_TERMS = 200_000;

    private LogarithmicIntegral() {
    }

    /**
     * Evaluates li(x).
     * 
     * @param x   argument, must be greater than 1
     * @param ctx precision of the result
     * @return li(x)
     * @throws IllegalArgumentException if {@code x <= 1}
     */
    public static BigDecimal li(BigDecimal x, PrecisionContext ctx) {
        if (x.compareTo(BigDecimal.ONE) <= 0) {
            throw new IllegalArgumentException("li(x) requires x > 1, got: " + x.toPlainString());
        }

        MathContext wmc = ctx.widen(BigDecimalMath.GUARD_DIGITS).mathContext();
        BigDecimal tolerance = BigDecimal.ONE.movePointLeft(ctx.seriesToleranceExponent());

        BigDecimal lnX = BigDecimalMath.ln(x, wmc);
        BigDecimal sum = BigDecimalMath.ln(lnX, wmc).add(BigDecimalMath.eulerGamma(wmc), wmc);

        // powerOverFactorial = (ln x)^j / j!
        BigDecimal powerOverFactorial = BigDecimal.ONE;
        for (int j = 1; j <= MAX_TERMS; j++) {
            BigDecimal bigJ = BigDecimal.valueOf(j);
            powerOverFactorial = powerOverFactorial.multiply(lnX, wmc).divide(bigJ, wmc);
            BigDecimal term = powerOverFactorial.divide(bigJ, wmc);
            sum = sum.add(term, wmc);
            if (term.abs().compareTo(tolerance) < 0) {
                return sum.round(ctx.mathContext());
            }
        }
        throw new IllegalStateException("li(x) series did not converge within " + MAX_TERMS
            + " terms for x = " + x.toPlainString());
    }
}
