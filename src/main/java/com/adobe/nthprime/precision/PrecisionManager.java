package com.adobe.nthprime.precision;

import com.adobe.nthprime.exception.PrecisionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.List;

/**
 * Derives the arithmetic precision required for a given magnitude.
 * 
 * <p>Magnitudes are mapped to precision levels through a monotone step
 * table. Each band is an exclusive upper bound on the magnitude together with
 * the number of significant decimal digits used below it:</p>
 * 
 * <pre>
 *   magnitude &lt; 10^14   →  128 digits
 *   magnitude &lt; 10^15   →  160
 *   magnitude &lt; 10^16   →  192
 *   magnitude &lt; 10^17   →  224
 *   magnitude &lt; 10^18   →  256
 *   magnitude &lt; 10^20   →  320
 *   magnitude &lt; 10^40   →  512
 *   magnitude &lt; 10^100  → 1024 (maximum, supported cap)
 * </pre>
 * 
 * <h2>Above the cap</h2>
 * <p>Magnitudes at or beyond 10^100 fail with {@link PrecisionException}
 * unless {@code app.predictor.precision.clamp-above-cap} is enabled, in which
 * case the maximum level is used.</p>
 * 
 * <h2>Thread Safety:</h2>
 * <p>Stateless apart from the immutable band table and the clamp flag.</p>
 * 
 * @author Adobe AEM Engineering Assessment
 * @version 1.0.0
 */
@Component
public class PrecisionManager {

    private static final Logger logger = LoggerFactory.getLogger(PrecisionManager.class);

    /**
     * Lowest precision any context may use.
     */
    public static final int FLOOR_DIGITS = 50;

    /**
     * Highest precision the engine will run at.
     */
    public static final int MAX_DIGITS = 1024;

    /**
     * Magnitudes at or above this value are outside the supported range.
     */
    public static final BigInteger MAGNITUDE_CAP = BigInteger.TEN.pow(100);

    private static final List<Band> BANDS = List.of(
        new Band(BigInteger.TEN.pow(14), 128),
        new Band(BigInteger.TEN.pow(15), 160),
        new Band(BigInteger.TEN.pow(16), 192),
        new Band(BigInteger.TEN.pow(17), 224),
        new Band(BigInteger.TEN.pow(18), 256),
        new Band(BigInteger.TEN.pow(20), 320),
        new Band(BigInteger.TEN.pow(40), 512),
        new Band(MAGNITUDE_CAP, MAX_DIGITS)
    );

    private final boolean clampAboveCap;

    public PrecisionManager(@Value("${app.predictor.precision.clamp-above-cap:false}") boolean clampAboveCap) {
        this.clampAboveCap = clampAboveCap;
    }

    /**
     * Returns the precision required for the given magnitude.
     * 
     * @param magnitude a non-negative magnitude (typically the prime index)
     * @return a fresh context for one call
     * @throws PrecisionException if the magnitude exceeds the cap and clamping is disabled
     */
    public PrecisionContext requiredPrecision(BigInteger magnitude) {
        return PrecisionContext.ofDigits(requiredDigits(magnitude));
    }

    /**
     * Resolves the context for a call, honouring an optional override.
     * 
     * <p>An override may only raise precision: it must lie within
     * [{@value #FLOOR_DIGITS}, {@value #MAX_DIGITS}] and must not be lower than
     * the digits required for the magnitude.</p>
     * 
     * @param magnitude      the magnitude being processed
     * @param overrideDigits requested digits, or {@code null} for the table value
     * @return the context to use
     * @throws PrecisionException if the override is out of bounds or insufficient
     */
    public PrecisionContext resolve(BigInteger magnitude, Integer overrideDigits) {
        int required = requiredDigits(magnitude);
        if (overrideDigits == null) {
            return PrecisionContext.ofDigits(required);
        }

        int requested = overrideDigits;
        if (requested < FLOOR_DIGITS) {
            throw new PrecisionException(String.format(
                "Precision %d digits is below the minimum of %d digits", requested, FLOOR_DIGITS));
        }
        if (requested > MAX_DIGITS) {
            throw new PrecisionException(String.format(
                "Precision %d digits exceeds the maximum of %d digits", requested, MAX_DIGITS));
        }
        if (requested < required) {
            throw new PrecisionException(String.format(
                "Insufficient precision for magnitude %s: required %d digits, got %d",
                abbreviate(magnitude), required, requested));
        }
        return PrecisionContext.ofDigits(requested);
    }

    /**
     * Returns the digits from the band table for a magnitude.
     * 
     * @param magnitude the magnitude
     * @return decimal digits, never below {@value #FLOOR_DIGITS}
     */
    public int requiredDigits(BigInteger magnitude) {
        BigInteger value = magnitude.abs();
        for (Band band : BANDS) {
            if (value.compareTo(band.upperExclusive()) < 0) {
                return Math.max(FLOOR_DIGITS, band.digits());
            }
        }

        if (clampAboveCap) {
            logger.warn("Magnitude {} exceeds supported cap; clamping to {} digits",
                abbreviate(value), MAX_DIGITS);
            return MAX_DIGITS;
        }
        throw new PrecisionException(String.format(
            "Magnitude %s exceeds the supported cap of 10^100", abbreviate(value)));
    }

    public boolean isClampAboveCap() {
        return clampAboveCap;
    }

    private static String abbreviate(BigInteger value) {
        String digits = value.toString();
        if (digits.length() <= 24) {
            return digits;
        }
        return digits.charAt(0) + "." + digits.substring(1, 6) + "e" + (digits.length() - 1);
    }

    private record Band(BigInteger upperExclusive, int digits) {
    }
}
