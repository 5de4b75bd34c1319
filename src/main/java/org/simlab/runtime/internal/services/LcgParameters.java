package org.simlab.runtime.internal.services;

import org.apache.commons.math3.util.ArithmeticUtils;
import org.simlab.runtime.spi.NumericOverflowRiskException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The constants of a linear congruential generator {@code X' = (a X + c) mod m}.
 * <p>
 * Instances are immutable and validated on construction:
 * </p>
 * <ul>
 *   <li>{@code 0 < m}, {@code 0 < a < m}, {@code 0 <= c < m}.</li>
 *   <li>The largest intermediate value of the advancing step, {@code (m-1)*a + c}, must be
 *       below {@code 2^53} so that double arithmetic stays exact. Otherwise a
 *       {@link NumericOverflowRiskException} is thrown.</li>
 *   <li>The Hull-Dobell conditions are checked: {@code c} and {@code m} coprime, {@code a-1}
 *       divisible by every prime factor of {@code m}, and by 4 if {@code m} is. Parameters that
 *       fail them are accepted with a warning, since the generator then simply has a period
 *       shorter than {@code m}.</li>
 * </ul>
 */
public final class LcgParameters {

    private static final Logger LOG = LoggerFactory.getLogger(LcgParameters.class);

    /** Integers with absolute value below this are exactly representable as doubles. */
    public static final long EXACT_DOUBLE_LIMIT = 1L << 53;

    /**
     * The standard parameters: {@code m = 2^32}, {@code a = 1,664,525 = 5 x 5 x 139 x 479},
     * {@code c = 1,013,904,223} (prime). {@code a - 1 = 2 x 2 x 71 x 5861}, so the
     * Hull-Dobell conditions hold. The largest intermediate is about {@code 7.15e15}.
     */
    public static final LcgParameters STANDARD = new LcgParameters(1L << 32, 1_664_525L, 1_013_904_223L);

    private final long modulus;
    private final long multiplier;
    private final long increment;
    private final boolean fullPeriod;

    /**
     * Creates and validates a parameter set.
     *
     * @param modulus the modulus {@code m}
     * @param multiplier the multiplier {@code a}
     * @param increment the increment {@code c}
     * @throws IllegalArgumentException if a parameter is out of its range
     * @throws NumericOverflowRiskException if {@code (m-1)*a + c >= 2^53}
     */
    public LcgParameters(long modulus, long multiplier, long increment) {
        if (modulus <= 0) {
            throw new IllegalArgumentException("LCG modulus must be positive, was " + modulus);
        }
        if (multiplier <= 0 || multiplier >= modulus) {
            throw new IllegalArgumentException("LCG multiplier must be in (0, " + modulus + "), was " + multiplier);
        }
        if (increment < 0 || increment >= modulus) {
            throw new IllegalArgumentException("LCG increment must be in [0, " + modulus + "), was " + increment);
        }
        this.modulus = modulus;
        this.multiplier = multiplier;
        this.increment = increment;
        checkExactArithmetic();
        this.fullPeriod = satisfiesHullDobell(modulus, multiplier, increment);
        if (!fullPeriod) {
            LOG.warn("LCG parameters {} do not satisfy the Hull-Dobell conditions, the period is shorter than the modulus", this);
        }
    }

    private void checkExactArithmetic() {
        long max;
        try {
            max = Math.addExact(Math.multiplyExact(modulus - 1, multiplier), increment);
        } catch (ArithmeticException e) {
            throw new NumericOverflowRiskException(Double.POSITIVE_INFINITY,
                    "LCG parameters " + this + " overflow 64-bit arithmetic, double precision cannot be exact", e);
        }
        if (max >= EXACT_DOUBLE_LIMIT) {
            throw new NumericOverflowRiskException(max,
                    "LCG parameters " + this + " produce intermediate value " + max
                            + " which is not below 2^53 = " + EXACT_DOUBLE_LIMIT);
        }
    }

    /**
     * Checks the Hull-Dobell theorem, which for {@code c != 0} is necessary and sufficient
     * for a full period over all seeds.
     */
    static boolean satisfiesHullDobell(long m, long a, long c) {
        if (c == 0 || ArithmeticUtils.gcd(c, m) != 1) {
            return false;
        }
        for (long p : primeFactors(m)) {
            if ((a - 1) % p != 0) {
                return false;
            }
        }
        return m % 4 != 0 || (a - 1) % 4 == 0;
    }

    /**
     * Returns the distinct prime factors of {@code n} in ascending order.
     */
    static List<Long> primeFactors(long n) {
        List<Long> factors = new ArrayList<>();
        long rest = n;
        for (long p = 2; p * p <= rest; p++) {
            if (rest % p == 0) {
                factors.add(p);
                while (rest % p == 0) {
                    rest /= p;
                }
            }
        }
        if (rest > 1) {
            factors.add(rest);
        }
        return factors;
    }

    public long getModulus() {
        return modulus;
    }

    public long getMultiplier() {
        return multiplier;
    }

    public long getIncrement() {
        return increment;
    }

    /**
     * @return true if these parameters give a full period of {@code m} for every seed
     */
    public boolean isFullPeriod() {
        return fullPeriod;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LcgParameters)) return false;
        LcgParameters that = (LcgParameters) o;
        return modulus == that.modulus && multiplier == that.multiplier && increment == that.increment;
    }

    @Override
    public int hashCode() {
        return Objects.hash(modulus, multiplier, increment);
    }

    @Override
    public String toString() {
        return "LcgParameters{m: " + modulus + ", a: " + multiplier + ", c: " + increment + "}";
    }
}
