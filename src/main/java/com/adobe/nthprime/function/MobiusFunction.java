package com.adobe.nthprime.function;

/**
 * The Möbius function μ(k).
 * 
 * <ul>
 *   <li>μ(1) = 1</li>
 *   <li>μ(k) = 0 if k has a squared prime factor</li>
 *   <li>μ(k) = (-1)^r if k is a product of r distinct primes</li>
 * </ul>
 * 
 * <p>Values for k ≤ {@value #TABLE_LIMIT} come from a precomputed table, which
 * covers the default Riemann R series depth. Larger arguments are factored by
 * trial division, returning 0 as soon as a squared factor shows up.</p>
 */
public final class MobiusFunction {

    /**
     * Largest argument served from the table.
     */
    public static final int TABLE_LIMIT = 15;

    // index 0 unused
    private static final int[] TABLE = {0, 1, -1, -1, 0, -1, 1, -1, 0, 0, 1, -1, 0, -1, 1, 1};

    private MobiusFunction() {
    }

    /**
     * Evaluates μ(k).
     * 
     * @param k a positive integer
     * @return -1, 0 or 1
     * @throws IllegalArgumentException if {@code k < 1}
     */
    public static int mobius(int k) {
        if (k < 1) {
            throw new IllegalArgumentException("Möbius function requires k >= 1, got: " + k);
        }
        if (k <= TABLE_LIMIT) {
            return TABLE[k];
        }

        int distinctFactors = 0;
        int remaining = k;
        for (int p = 2; (long) p * p <= remaining; p++) {
            if (remaining % p == 0) {
                remaining /= p;
                if (remaining % p == 0) {
                    return 0;
                }
                distinctFactors++;
            }
        }
        if (remaining > 1) {
            distinctFactors++;
        }
        return (distinctFactors & 1) == 0 ? 1 : -1;
    }
}
