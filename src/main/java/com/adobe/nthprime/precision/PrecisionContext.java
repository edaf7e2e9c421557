package com.adobe.nthprime.precision;

import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Working precision for a single prediction call.
 * 
 * <p>A context is created per call by {@link PrecisionManager} and passed
 * explicitly into every numeric operation. There is no ambient or global
 * precision setting anywhere in the engine, so concurrent calls running at
 * different precisions cannot interfere with each other.</p>
 * 
 * @param digits      working precision in significant decimal digits
 * @param mathContext the {@link MathContext} used for {@code BigDecimal} arithmetic
 */
public record PrecisionContext(int digits, MathContext mathContext) {

    private static final double BITS_PER_DIGIT = Math.log(10) / Math.log(2);

    public PrecisionContext {
        if (digits < 1) {
            throw new IllegalArgumentException("Precision must be at least one digit, got: " + digits);
        }
        if (mathContext == null || mathContext.getPrecision() != digits) {
            throw new IllegalArgumentException("MathContext precision must equal digits (" + digits + ")");
        }
    }

    /**
     * Creates a context with half-even rounding at the given number of digits.
     * 
     * @param digits significant decimal digits
     * @return a new context
     */
    public static PrecisionContext ofDigits(int digits) {
        return new PrecisionContext(digits, new MathContext(digits, RoundingMode.HALF_EVEN));
    }

    /**
     * @return the approximate binary precision, rounded up
     */
    public int bits() {
        return (int) Math.ceil(digits * BITS_PER_DIGIT);
    }

    /**
     * Returns a context carrying extra guard digits for intermediate results.
     * 
     * @param guardDigits digits to add
     * @return a wider context
     */
    public PrecisionContext widen(int guardDigits) {
        return ofDigits(digits + guardDigits);
    }

    /**
     * Default convergence bound for series evaluated in this context:
     * {@code 10^-(digits - 5)}.
     * 
     * @return the exponent {@code digits - 5}, never below 1
     */
    public int seriesToleranceExponent() {
        return Math.max(1, digits - 5);
    }
}
