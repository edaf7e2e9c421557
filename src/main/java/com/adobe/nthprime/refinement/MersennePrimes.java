package com.adobe.nthprime.refinement;

import java.math.BigInteger;

/**
 * Recognises Mersenne primes M_p = 2^p - 1.
 * 
 * <p>A value qualifies when {@code n + 1} is a power of two and the
 * Lucas–Lehmer sequence for its exponent p vanishes:</p>
 * <pre>
 *   s_0 = 4,  s_{i+1} = (s_i² - 2) mod M_p,  M_p prime ⇔ s_{p-2} = 0   (p &gt; 2)
 * </pre>
 * 
 * <p>M_2 = 3 is handled directly. A composite exponent never yields a zero
 * residue, so no separate exponent check is needed.</p>
 * 
 * @author Adobe AEM Engineering Assessment
 * @version 1.0.0
 */
public final class MersennePrimes {

    private static final BigInteger THREE = BigInteger.valueOf(3);
    private static final BigInteger FOUR = BigInteger.valueOf(4);

    private MersennePrimes() {
    }

    /**
     * @param n any integer
     * @return {@code true} if {@code n} is 2^p - 1 and prime
     */
    public static boolean isMersennePrime(BigInteger n) {
        if (n.compareTo(THREE) < 0) {
            return false;
        }
        BigInteger next = n.add(BigInteger.ONE);
        if (next.bitCount() != 1) {
            return false;
        }
        return lucasLehmer(next.bitLength() - 1);
    }

    /**
     * @param p exponent, at least 2
     * @return {@code true} if 2^p - 1 is prime
     */
    static boolean lucasLehmer(int p) {
        if (p == 2) {
            return true;
        }
        if (p < 2) {
            return false;
        }
        BigInteger mersenne = BigInteger.ONE.shiftLeft(p).subtract(BigInteger.ONE);
        BigInteger s = FOUR;
        for (int i = 0; i < p - 2; i++) {
            s = s.multiply(s).subtract(BigInteger.TWO).mod(mersenne);
        }
        return s.signum() == 0;
    }
}
