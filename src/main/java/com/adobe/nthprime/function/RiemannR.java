package com.adobe.nthprime.function;

import com.adobe.nthprime.precision.PrecisionContext;

import java.math.BigDecimal;
import java.math.MathContext;

/**
 * Riemann's prime-counting approximation and its derivative, truncated to
 * K terms:
 * 
 * <pre>
 *   R(x)  = Σ_{k=1..K} μ(k)/k · li(x^(1/k))
 *   R'(x) = (1/ln x) · Σ_{k=1..K} μ(k)/k · x^(1/k - 1)
 * </pre>
 * 
 * <p>Terms with μ(k) = 0 are skipped. Both functions require x &gt; 1 and
 * K ≥ 1.</p>
 * 
 * @author Adobe AEM Engineering Assessment
 * @version 1.0.0
 */
public final class RiemannR {

    private RiemannR() {
    }

    /**
     * Evaluates R(x).
     * 
     * @param x     argument, must be greater than 1
     * @param terms series depth K, at least 1
     * @param ctx   precision of the result
     * @return R(x)
     */
    public static BigDecimal value(BigDecimal x, int terms, PrecisionContext ctx) {
        validate(x, terms);
        PrecisionContext working = ctx.widen(BigDecimalMath.GUARD_DIGITS);
        MathContext wmc = working.mathContext();

        BigDecimal sum = BigDecimal.ZERO;
        for (int k = 1; k <= terms; k++) {
            int mu = MobiusFunction.mobius(k);
            if (mu == 0) {
                continue;
            }
            BigDecimal root = BigDecimalMath.root(x, k, wmc);
            BigDecimal li = LogarithmicIntegral.li(root, working);
            BigDecimal term = li.multiply(BigDecimal.valueOf(mu), wmc).divide(BigDecimal.valueOf(k), wmc);
            sum = sum.add(term, wmc);
        }
        return sum.round(ctx.mathContext());
    }

    /**
     * Evaluates R'(x).
     * 
     * @param x     argument, must be greater than 1
     * @param terms series depth K, at least 1
     * @param ctx   precision of the result
     * @return R'(x)
     */
    public static BigDecimal derivative(BigDecimal x, int terms, PrecisionContext ctx) {
        validate(x, terms);
        MathContext wmc = ctx.widen(BigDecimalMath.GUARD_DIGITS).mathContext();

        BigDecimal sum = BigDecimal.ZERO;
        for (int k = 1; k <= terms; k++) {
            int mu = MobiusFunction.mobius(k);
            if (mu == 0) {
                continue;
            }
            // x^(1/k - 1) = x^((1 - k) / k)
            BigDecimal exponent = BigDecimal.valueOf(1L - k).divide(BigDecimal.valueOf(k), wmc);
            BigDecimal power = BigDecimalMath.pow(x, exponent, wmc);
            BigDecimal term = power.multiply(BigDecimal.valueOf(mu), wmc).divide(BigDecimal.valueOf(k), wmc);
            sum = sum.add(term, wmc);
        }
        return sum.divide(BigDecimalMath.ln(x, wmc), wmc).round(ctx.mathContext());
    }

    private static void validate(BigDecimal x, int terms) {
        if (x.compareTo(BigDecimal.ONE) <= 0) {
            throw new IllegalArgumentException("R(x) requires x > 1, got: " + x.toPlainString());
        }
        if (terms < 1) {
            throw new IllegalArgumentException("R(x) requires at least one series term, got: " + terms);
        }
    }
}
