package com.adobe.nthprime.refinement;

import java.math.BigInteger;
import java.util.List;
import java.util.stream.IntStream;

/**
 * Primality test used to accept refinement candidates.
 * 
 * <ol>
 *   <li>Trial division by the 25 primes up to 97. A candidate equal to one of
 *       them is prime.</li>
 *   <li>Miller–Rabin with the first twelve primes (2 through 37) as
 *       witnesses. This witness set has no strong pseudoprimes below
 *       3.317·10^24, so the answer is exact in that range and probabilistic
 *       above it.</li>
 * </ol>
 * 
 * @author Adobe AEM Engineering Assessment
 * @version 1.0.0
 */
public final class PrimalityTester {

    /**
     * The primes below 100, in ascending order.
     */
    public static final List<BigInteger> SMALL_PRIMES = IntStream.of(
        2, 3, 5, 7, 11, 13, 17, 19, 23, 29, 31, 37, 41, 43, 47, 53, 59, 61, 67, 71, 73, 79, 83, 89, 97
    ).mapToObj(BigInteger::valueOf).toList();

    static final List<BigInteger> WITNESSES = SMALL_PRIMES.subList(0, 12);

    /**
     * Upper bound of the range in which {@link #WITNESSES} make the test deterministic.
     */
    public static final BigInteger DETERMINISTIC_BOUND = new BigInteger("3317044064679887385961981");

    private PrimalityTester() {
    }

    /**
     * @param candidate any integer
     * @return {@code true} if the candidate passes trial division and Miller–Rabin
     */
    public static boolean isProbablePrime(BigInteger candidate) {
        if (candidate.compareTo(BigInteger.TWO) < 0) {
            return false;
        }
        for (BigInteger p : SMALL_PRIMES) {
            if (candidate.equals(p)) {
                return true;
            }
            if (candidate.mod(p).signum() == 0) {
                return false;
            }
        }
        return millerRabin(candidate);
    }

    /**
     * @param candidate an odd integer greater than 97
     */
    static boolean millerRabin(BigInteger candidate) {
        BigInteger minusOne = candidate.subtract(BigInteger.ONE);
        int s = minusOne.getLowestSetBit();
        BigInteger d = minusOne.shiftRight(s);

        for (BigInteger witness : WITNESSES) {
            BigInteger x = witness.modPow(d, candidate);
            if (x.equals(BigInteger.ONE) || x.equals(minusOne)) {
                continue;
            }
            boolean passed = false;
            for (int r = 1; r < s; r++) {
                x = x.modPow(BigInteger.TWO, candidate);
                if (x.equals(minusOne)) {
                    passed = true;
                    break;
                }
            }
            if (!passed) {
                return false;
            }
        }
        return true;
    }
}
