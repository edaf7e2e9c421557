package com.adobe.nthprime.refinement;

import com.adobe.nthprime.exception.RefinementExhaustionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.function.Predicate;

/**
 * Turns a continuous estimate into a probable prime close to it.
 * 
 * <h2>Algorithm:</h2>
 * <ol>
 *   <li>Round half-up. Values up to 2 give 2, exactly 3 gives 3.</li>
 *   <li>Otherwise make the value odd and move it forward onto the 6k±1
 *       lattice, then test it.</li>
 *   <li>Search symmetrically outwards for {@code max(256, ceil(4·ln c))}
 *       steps. At each step the candidate above is tried before the one
 *       below; each is forced odd and snapped onto 6k±1 in its own
 *       direction, and a value already tested in that direction is skipped.</li>
 *   <li>If the window holds no prime, scan forward by 2 from its upper edge
 *       for at most the configured number of steps.</li>
 * </ol>
 * 
 * <p>Running out of forward-scan steps raises
 * {@link RefinementExhaustionException}.</p>
 * 
 * <p>{@link #nextPrime(BigInteger, long)} runs the same lattice walk from an
 * exact starting point and backs the prime scanner.</p>
 * 
 * <h2>Thread Safety:</h2>
 * <p>Stateless.</p>
 * 
 * @author Adobe AEM Engineering Assessment
 * @version 1.0.0
 */
@Component
public class PrimeRefiner {

    private static final Logger logger = LoggerFactory.getLogger(PrimeRefiner.class);

    /**
     * Smallest half-width of the symmetric search window.
     */
    public static final int MIN_WINDOW = 256;

    private static final BigInteger THREE = BigInteger.valueOf(3);
    private static final BigInteger FIVE = BigInteger.valueOf(5);
    private static final BigInteger SIX = BigInteger.valueOf(6);
    private static final double LN2 = Math.log(2);

    private final Predicate<BigInteger> primalityTest;

    public PrimeRefiner() {
        this(PrimalityTester::isProbablePrime);
    }

    PrimeRefiner(Predicate<BigInteger> primalityTest) {
        this.primalityTest = primalityTest;
    }

    /**
     * Finds a probable prime near {@code estimate}.
     * 
     * @param estimate         a positive continuous estimate
     * @param forwardScanLimit maximum steps of the fallback scan
     * @return the prime and refinement metadata
     * @throws RefinementExhaustionException if no prime is found within the limits
     */
    public RefinementResult refine(BigDecimal estimate, long forwardScanLimit) {
        BigInteger rounded = estimate.setScale(0, RoundingMode.HALF_UP).toBigIntegerExact();

        if (rounded.compareTo(BigInteger.TWO) <= 0) {
            return found(BigInteger.TWO, rounded, 0, false);
        }
        if (rounded.equals(THREE)) {
            return found(THREE, rounded, 0, false);
        }

        BigInteger center = snap(rounded.testBit(0) ? rounded : rounded.add(BigInteger.ONE), 1);
        long tested = 1;
        if (primalityTest.test(center)) {
            return found(center, rounded, tested, false);
        }

        int window = windowSize(center);
        BigInteger lastAbove = center;
        BigInteger lastBelow = center;
        for (int step = 1; step <= window; step++) {
            for (int direction : new int[] {1, -1}) {
                BigInteger candidate = center.add(BigInteger.valueOf((long) direction * step));
                if (candidate.compareTo(FIVE) < 0) {
                    continue;
                }
                if (!candidate.testBit(0)) {
                    candidate = candidate.add(BigInteger.valueOf(direction));
                }
                candidate = snap(candidate, direction);
                if (candidate.compareTo(FIVE) < 0) {
                    continue;
                }
                BigInteger last = direction > 0 ? lastAbove : lastBelow;
                if (candidate.equals(last)) {
                    continue;
                }
                if (direction > 0) {
                    lastAbove = candidate;
                } else {
                    lastBelow = candidate;
                }

                tested++;
                if (primalityTest.test(candidate)) {
                    logger.trace("Refinement accepted {} at step {} ({} candidates)",
                        RefinementCandidate.of(candidate, rounded, direction), step, tested);
                    return found(candidate, rounded, tested, false);
                }
            }
        }

        logger.warn("No prime within {} steps of {}; falling back to forward scan (limit {})",
            window, center, forwardScanLimit);
        BigInteger candidate = lastAbove;
        for (long i = 1; i <= forwardScanLimit; i++) {
            candidate = snap(candidate.add(BigInteger.TWO), 1);
            tested++;
            if (primalityTest.test(candidate)) {
                return found(candidate, rounded, tested, true);
            }
        }
        throw new RefinementExhaustionException(lastAbove, forwardScanLimit);
    }

    /**
     * Returns the smallest probable prime at or above {@code from}.
     * 
     * <p>Candidates run along the 6k±1 lattice, so at most {@code stepLimit}
     * values are tested.</p>
     * 
     * @param from      inclusive lower bound
     * @param stepLimit maximum number of candidates to test
     * @return the first probable prime not below {@code from}
     * @throws RefinementExhaustionException if none is found within the limit
     */
    public BigInteger nextPrime(BigInteger from, long stepLimit) {
        if (from.compareTo(BigInteger.TWO) <= 0) {
            return BigInteger.TWO;
        }
        if (from.equals(THREE)) {
            return THREE;
        }
        BigInteger candidate = snap(from.testBit(0) ? from : from.add(BigInteger.ONE), 1);
        for (long i = 0; i < stepLimit; i++) {
            if (primalityTest.test(candidate)) {
                return candidate;
            }
            candidate = snap(candidate.add(BigInteger.TWO), 1);
        }
        throw new RefinementExhaustionException(from, stepLimit);
    }

    /**
     * Moves an odd value onto the nearest 6k±1 residue in the given direction.
     * 
     * @param value     the value to move
     * @param direction +1 to move up, -1 to move down
     * @return a value congruent to 1 or 5 modulo 6
     */
    static BigInteger snap(BigInteger value, int direction) {
        int residue = value.mod(SIX).intValue();
        int shift;
        if (direction > 0) {
            shift = switch (residue) {
                case 0, 4 -> 1;
                case 2 -> 3;
                case 3 -> 2;
                default -> 0;
            };
        } else {
            shift = switch (residue) {
                case 0, 2 -> -1;
                case 3 -> -2;
                case 4 -> -3;
                default -> 0;
            };
        }
        return shift == 0 ? value : value.add(BigInteger.valueOf(shift));
    }

    /**
     * @return {@code max(256, ceil(4·ln value))}
     */
    static int windowSize(BigInteger value) {
        double ln = value.bitLength() < 1000
            ? Math.log(value.doubleValue())
            : value.bitLength() * LN2;
        return Math.max(MIN_WINDOW, (int) Math.ceil(4 * ln));
    }

    private static RefinementResult found(BigInteger prime, BigInteger rounded, long tested, boolean forwardScan) {
        return new RefinementResult(prime, rounded, tested, prime.subtract(rounded), forwardScan);
    }
}
