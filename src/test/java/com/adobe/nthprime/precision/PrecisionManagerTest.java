package com.adobe.nthprime.precision;

import com.adobe.nthprime.exception.PrecisionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigInteger;
import java.math.RoundingMode;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for PrecisionManager.
 * 
 * Tests cover:
 * - Band boundaries of the step table
 * - Monotonicity over the supported range
 * - Behaviour at and above the cap (fail vs clamp)
 * - Precision overrides
 */
@DisplayName("PrecisionManager Tests")
class PrecisionManagerTest {

    private PrecisionManager manager;

    @BeforeEach
    void setUp() {
        manager = new PrecisionManager(false);
    }

    @Nested
    @DisplayName("Step Table")
    class StepTable {

        @ParameterizedTest(name = "10^{0} + {1} requires {2} digits")
        @CsvSource({
            "0, 0, 128",
            "13, 0, 128",
            "14, -1, 128",
            "14, 0, 160",
            "15, 0, 192",
            "16, 0, 224",
            "17, 0, 256",
            "18, 0, 320",
            "19, 0, 320",
            "20, 0, 512",
            "39, 0, 512",
            "40, 0, 1024",
            "99, 0, 1024"
        })
        void shouldMapMagnitudeToBand(int exponent, int adjustment, int expectedDigits) {
            BigInteger magnitude = BigInteger.TEN.pow(exponent).add(BigInteger.valueOf(adjustment));
            assertEquals(expectedDigits, manager.requiredDigits(magnitude));
        }

        @Test
        @DisplayName("Precision never decreases as magnitude grows")
        void shouldBeMonotone() {
            int previous = 0;
            for (int k = 0; k < 100; k++) {
                int digits = manager.requiredDigits(BigInteger.TEN.pow(k));
                assertTrue(digits >= previous, "precision dropped at 10^" + k);
                assertTrue(digits >= PrecisionManager.FLOOR_DIGITS);
                previous = digits;
            }
        }

        @Test
        @DisplayName("Context carries a half-even MathContext of the same width")
        void shouldBuildMatchingMathContext() {
            PrecisionContext ctx = manager.requiredPrecision(BigInteger.valueOf(1234567));

            assertEquals(128, ctx.digits());
            assertEquals(128, ctx.mathContext().getPrecision());
            assertEquals(RoundingMode.HALF_EVEN, ctx.mathContext().getRoundingMode());
            assertTrue(ctx.bits() >= 425);
        }
    }

    @Nested
    @DisplayName("Supported Cap")
    class SupportedCap {

        @Test
        @DisplayName("Magnitude at the cap fails by default")
        void shouldRejectMagnitudeAtCap() {
            PrecisionException ex = assertThrows(PrecisionException.class,
                () -> manager.requiredPrecision(PrecisionManager.MAGNITUDE_CAP));
            assertTrue(ex.getMessage().contains("cap"));
        }

        @Test
        @DisplayName("Magnitude above the cap clamps to the maximum when enabled")
        void shouldClampWhenEnabled() {
            PrecisionManager clamping = new PrecisionManager(true);

            PrecisionContext ctx = clamping.requiredPrecision(BigInteger.TEN.pow(150));

            assertTrue(clamping.isClampAboveCap());
            assertEquals(PrecisionManager.MAX_DIGITS, ctx.digits());
        }
    }

    @Nested
    @DisplayName("Overrides")
    class Overrides {

        @Test
        @DisplayName("No override uses the table value")
        void shouldUseTableWithoutOverride() {
            assertEquals(192, manager.resolve(BigInteger.TEN.pow(15), null).digits());
        }

        @Test
        @DisplayName("Override above the requirement is honoured")
        void shouldHonourSufficientOverride() {
            assertEquals(300, manager.resolve(BigInteger.TEN.pow(15), 300).digits());
        }

        @Test
        @DisplayName("Override below the requirement is rejected")
        void shouldRejectInsufficientOverride() {
            PrecisionException ex = assertThrows(PrecisionException.class,
                () -> manager.resolve(BigInteger.TEN.pow(15), 100));
            assertTrue(ex.getMessage().contains("Insufficient precision"));
        }

        @Test
        @DisplayName("Override below the floor is rejected")
        void shouldRejectOverrideBelowFloor() {
            assertThrows(PrecisionException.class, () -> manager.resolve(BigInteger.TEN, 40));
        }

        @Test
        @DisplayName("Override above the maximum is rejected")
        void shouldRejectOverrideAboveMaximum() {
            assertThrows(PrecisionException.class, () -> manager.resolve(BigInteger.TEN, 2048));
        }
    }
}
