package com.adobe.nthprime.estimator;

import com.adobe.nthprime.exception.InvalidIndexException;
import com.adobe.nthprime.function.BigDecimalMath;
import com.adobe.nthprime.precision.PrecisionContext;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;

/**
 * Three-term Cipolla/Dusart expansion of p_n, used to seed Newton iteration:
 * 
 * <pre>
 *   x0 = n · (L + L2 - 1 + (L2 - 2)/L - (L2² - 6·L2 + 11)/(2·L²))
 * </pre>
 * 
 * <p>where L = ln n and L2 = ln ln n.</p>
 */
public final class DusartSeed {

    private static final BigDecimal TWO = BigDecimal.valueOf(2);
    private static final BigDecimal SIX = BigDecimal.valueOf(6);
    private static final BigDecimal ELEVEN = BigDecimal.valueOf(11);

    private DusartSeed() {
    }

    /**
     * @param n   prime index, at least 2
     * @param ctx working precision
     * @return the seed x0
     * @throws InvalidIndexException if {@code n < 2}
     */
    public static BigDecimal seed(BigInteger n, PrecisionContext ctx) {
        if (n.compareTo(BigInteger.TWO) < 0) {
            throw new InvalidIndexException(n, "Asymptotic seed requires n >= 2, got: " + n);
        }
        MathContext wmc = ctx.widen(BigDecimalMath.GUARD_DIGITS).mathContext();
        BigDecimal bigN = new BigDecimal(n);
        BigDecimal l = BigDecimalMath.ln(bigN, wmc);
        BigDecimal l2 = BigDecimalMath.ln(l, wmc);

        BigDecimal bracket = l.add(l2, wmc)
            .subtract(BigDecimal.ONE, wmc)
            .add(l2.subtract(TWO, wmc).divide(l, wmc), wmc);

        BigDecimal numerator = l2.multiply(l2, wmc)
            .subtract(SIX.multiply(l2, wmc), wmc)
            .add(ELEVEN, wmc);
        BigDecimal denominator = TWO.multiply(l.multiply(l, wmc), wmc);
        bracket = bracket.subtract(numerator.divide(denominator, wmc), wmc);

        return bigN.multiply(bracket, wmc).round(ctx.mathContext());
    }
}
