package com.adobe.nthprime.lookup;

import com.adobe.nthprime.refinement.PrimalityTester;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Exact values of p_n for canonical indices.
 * 
 * <p>Two sources are consulted:</p>
 * <ul>
 *   <li>p_(10^k) for k = 0..18</li>
 *   <li>p_1 through p_25, taken from the small-prime table of
 *       {@link PrimalityTester}</li>
 * </ul>
 * 
 * <p>The map is built once at construction and never modified.</p>
 * 
 * @author Adobe AEM Engineering Assessment
 * @version 1.0.0
 */
@Component
public class KnownPrimeTable {

    private static final Logger logger = LoggerFactory.getLogger(KnownPrimeTable.class);

    /**
     * p_(10^k) indexed by k.
     */
    static final List<String> POWER_OF_TEN_PRIMES = List.of(
        "2",
        "29",
        "541",
        "7919",
        "104729",
        "1299709",
        "15485863",
        "179424673",
        "2038074743",
        "22801763489",
        "252097800623",
        "2760727302517",
        "29996224275833",
        "323780508946331",
        "3475385758524527",
        "37124508045065437",
        "394906913903735329",
        "4185296581467695669",
        "44211790234832169331"
    );

    private final Map<BigInteger, BigInteger> table;

    public KnownPrimeTable() {
        Map<BigInteger, BigInteger> entries = new HashMap<>();
        List<BigInteger> small = PrimalityTester.SMALL_PRIMES;
        for (int i = 0; i < small.size(); i++) {
            entries.put(BigInteger.valueOf(i + 1L), small.get(i));
        }
        for (int k = 0; k < POWER_OF_TEN_PRIMES.size(); k++) {
            entries.put(BigInteger.TEN.pow(k), new BigInteger(POWER_OF_TEN_PRIMES.get(k)));
        }
        this.table = Map.copyOf(entries);
        logger.info("Known-prime table initialized with {} entries", table.size());
    }

    /**
     * @param n a prime index
     * @return p_n if tabulated
     */
    public Optional<BigInteger> lookup(BigInteger n) {
        return Optional.ofNullable(table.get(n));
    }

    public int size() {
        return table.size();
    }
}
