package com.adobe.nthprime.function;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Transcendental functions on {@link BigDecimal} evaluated to an explicit
 * {@link MathContext}.
 *
 * <p>Every method takes the precision it must honour as an argument; nothing
 * here reads or writes a global precision setting. Results are computed with
 * {@value #GUARD_DIGITS} guard digits and rounded to the caller's context.</p>
 *
 * <h2>Algorithms:</h2>
 * <ul>
 *   <li><b>ln:</b> reduce by a power of two into [1, 2), then
 *       {@code ln m = 2·atanh((m-1)/(m+1))} as an odd power series</li>
 *   <li><b>exp:</b> reduce by multiples of ln 2, halve eight times, Taylor
 *       series, then square back</li>
 *   <li><b>pow:</b> {@code exp(y·ln x)} for {@code x > 0}</li>
 *   <li><b>Euler's γ:</b> Brent–McMillan with error below {@code π·e^(-4N)}</li>
 * </ul>
 *
 * <h2>Thread Safety:</h2>
 * <p>Stateless apart from memoized constants keyed by precision. The memo maps
 * hold immutable values and are safe for concurrent use.</p>
 *
 * @author Adobe AEM Engineering Assessment
 * @version 1.0.0
 */
public final class BigDecimalMath {

    /**
     * Extra digits carried by intermediate results.
     */
    public static final int GUARD_DIGITS = 10;

    private static final int EXP_HALVINGS = 8;
    private static final BigDecimal TWO = BigDecimal.valueOf(2);
    private static final BigDecimal EXP_HALVING_DIVISOR = TWO.pow(EXP_HALVINGS);

    private static final Map<Integer, BigDecimal> LN2_MEMO = new ConcurrentHashMap<>();
    private static final Map<Integer, BigDecimal> GAMMA_MEMO = new ConcurrentHashMap<>();

    private BigDecimalMath() {
    }

    /**
     * Natural logarithm.
     *
     * @param x  argument, must be positive
     * @param mc precision of the result
     * @return ln(x) rounded to {@code mc}
     * @throws ArithmeticException if {@code x <= 0}
     */
    public static BigDecimal ln(BigDecimal x, MathContext mc) {
        if (x.signum() <= 0) {
            throw new ArithmeticException("ln of non-positive value: " + x.toPlainString());
        }
        if (x.compareTo(BigDecimal.ONE) == 0) {
            return BigDecimal.ZERO;
        }

        MathContext wmc = working(mc, GUARD_DIGITS);
        if (x.compareTo(BigDecimal.ONE) < 0) {
            return ln(BigDecimal.ONE.divide(x, wmc), wmc).negate().round(mc);
        }

        // x = m * 2^k with m in [1, 2)
        int k = x.toBigInteger().bitLength() - 1;
        BigDecimal m = k == 0 ? x : x.divide(TWO.pow(k), wmc);
        BigDecimal result = lnNearOne(m, wmc);
        if (k != 0) {
            result = result.add(ln2(wmc).multiply(BigDecimal.valueOf(k), wmc), wmc);
        }
        return result.round(mc);
    }

    /**
     * Exponential function.
     *
     * @param x  argument
     * @param mc precision of the result
     * @return e^x rounded to {@code mc}
     * @throws ArithmeticException if the result exponent overflows an {@code int}
     */
    public static BigDecimal exp(BigDecimal x, MathContext mc) {
        if (x.signum() == 0) {
            return BigDecimal.ONE;
        }

        // the absolute error of the reduced argument grows with |x|
        MathContext wmc = working(mc, GUARD_DIGITS + integerDigits(x));
        BigDecimal ln2 = ln2(wmc);
        int k = x.divide(ln2, wmc).setScale(0, RoundingMode.HALF_EVEN).intValueExact();
        BigDecimal r = x.subtract(ln2.multiply(BigDecimal.valueOf(k), wmc), wmc);
        r = r.divide(EXP_HALVING_DIVISOR, wmc);

        BigDecimal threshold = BigDecimal.ONE.movePointLeft(wmc.getPrecision() + 1);
        BigDecimal sum = BigDecimal.ONE;
        BigDecimal term = BigDecimal.ONE;
        for (int i = 1; ; i++) {
            term = term.multiply(r, wmc).divide(BigDecimal.valueOf(i), wmc);
            sum = sum.add(term, wmc);
            if (term.abs().compareTo(threshold) < 0) {
                break;
            }
        }
        for (int i = 0; i < EXP_HALVINGS; i++) {
            sum = sum.multiply(sum, wmc);
        }

        BigDecimal scaled = k >= 0
            ? sum.multiply(TWO.pow(k), wmc)
            : sum.divide(TWO.pow(-k), wmc);
        return scaled.round(mc);
    }

    /**
     * Real power {@code x^y} for positive base.
     *
     * @param x  base, must be positive
     * @param y  exponent
     * @param mc precision of the result
     * @return x^y rounded to {@code mc}
     */
    public static BigDecimal pow(BigDecimal x, BigDecimal y, MathContext mc) {
        if (x.signum() <= 0) {
            throw new ArithmeticException("pow requires a positive base, got: " + x.toPlainString());
        }
        if (y.signum() == 0 || x.compareTo(BigDecimal.ONE) == 0) {
            return BigDecimal.ONE;
        }
        MathContext wmc = working(mc, GUARD_DIGITS + 8);
        BigDecimal exponent = y.multiply(ln(x, wmc), wmc);
        return exp(exponent, wmc).round(mc);
    }

    /**
     * k-th root {@code x^(1/k)} for positive base.
     *
     * @param x  base, must be positive
     * @param k  root order, at least 1
     * @param mc precision of the result
     * @return the k-th root rounded to {@code mc}
     */
    public static BigDecimal root(BigDecimal x, int k, MathContext mc) {
        if (k < 1) {
            throw new IllegalArgumentException("Root order must be >= 1, got: " + k);
        }
        if (k == 1) {
            return x.round(mc);
        }
        if (k == 2) {
            return x.sqrt(mc);
        }
        MathContext wmc = working(mc, GUARD_DIGITS);
        return pow(x, BigDecimal.ONE.divide(BigDecimal.valueOf(k), wmc), mc);
    }

    /**
     * ln 2, memoized per precision.
     *
     * @param mc precision of the result
     * @return ln 2 rounded to {@code mc}
     */
    public static BigDecimal ln2(MathContext mc) {
        return LN2_MEMO.computeIfAbsent(mc.getPrecision(),
            digits -> lnNearOne(TWO, working(mc, GUARD_DIGITS)).round(mc));
    }

    /**
     * The Euler–Mascheroni constant γ, memoized per precision.
     *
     * @param mc precision of the result
     * @return γ rounded to {@code mc}
     */
    public static BigDecimal eulerGamma(MathContext mc) {
        return GAMMA_MEMO.computeIfAbsent(mc.getPrecision(), digits -> brentMcMillan(mc));
    }

    /**
     * {@code ln m = 2·Σ z^(2i+1)/(2i+1)} with {@code z = (m-1)/(m+1)}.
     * Converges quickly for m in [1, 2] where |z| <= 1/3.
     */
    private static BigDecimal lnNearOne(BigDecimal m, MathContext wmc) {
        if (m.compareTo(BigDecimal.ONE) == 0) {
            return BigDecimal.ZERO;
        }
        BigDecimal z = m.subtract(BigDecimal.ONE).divide(m.add(BigDecimal.ONE), wmc);
        BigDecimal zSquared = z.multiply(z, wmc);
        BigDecimal power = z;
        BigDecimal sum = z;
        for (int i = 1; ; i++) {
            power = power.multiply(zSquared, wmc);
            BigDecimal term = power.divide(BigDecimal.valueOf(2L * i + 1), wmc);
            sum = sum.add(term, wmc);
            if (term.abs().compareTo(sum.abs().movePointLeft(wmc.getPrecision())) < 0) {
                break;
            }
        }
        return sum.multiply(TWO, wmc);
    }

    /**
     * Brent–McMillan: with B_0 = 1, A_0 = -ln N,
     * B_k = B_{k-1}·N²/k², A_k = (A_{k-1}·N²/k + B_k)/k, γ ≈ ΣA_k / ΣB_k.
     */
    private static BigDecimal brentMcMillan(MathContext mc) {
        MathContext wmc = working(mc, 2 * GUARD_DIGITS);
        int precision = wmc.getPrecision();
        long n = (long) Math.ceil(precision * Math.log(10) / 4) + 1;
        BigDecimal nSquared = new BigDecimal(BigInteger.valueOf(n).pow(2));

        BigDecimal a = ln(BigDecimal.valueOf(n), wmc).negate();
        BigDecimal b = BigDecimal.ONE;
        BigDecimal u = a;
        BigDecimal v = b;
        for (long k = 1; ; k++) {
            BigDecimal bigK = BigDecimal.valueOf(k);
            b = b.multiply(nSquared, wmc).divide(bigK.multiply(bigK), wmc);
            a = a.multiply(nSquared, wmc).divide(bigK, wmc).add(b, wmc).divide(bigK, wmc);
            u = u.add(a, wmc);
            v = v.add(b, wmc);
            if (k > n) {
                BigDecimal bound = v.movePointLeft(precision);
                if (b.compareTo(bound) < 0 && a.abs().compareTo(bound) < 0) {
                    break;
                }
            }
        }
        return u.divide(v, wmc).round(mc);
    }

    private static MathContext working(MathContext mc, int extraDigits) {
        return new MathContext(mc.getPrecision() + extraDigits, RoundingMode.HALF_EVEN);
    }

    private static int integerDigits(BigDecimal x) {
        return Math.max(0, x.precision() - x.scale());
    }
}
