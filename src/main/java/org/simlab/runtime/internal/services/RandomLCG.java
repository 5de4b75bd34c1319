package org.simlab.runtime.internal.services;

import org.simlab.runtime.spi.IRandom;
import org.simlab.runtime.spi.ISeedSource;
import org.simlab.runtime.spi.InvalidRangeException;
import org.simlab.runtime.spi.InvalidSeedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * Pseudo-random number generator using a linear congruential generator (LCG),
 * {@code X' = (a X + c) mod m}.
 * <p>
 * The generator is designed to give exactly the same numbers as implementations in other
 * languages, so that simulations and tests using it have the same results everywhere.
 * All arithmetic of the advancing step is done in double precision, which is how numbers
 * are held on platforms without integer types. {@link LcgParameters} guarantees that no
 * intermediate value reaches {@code 2^53}, so every step is exact. The step is computed as
 * {@code r - floor(r/m)*m} rather than with the remainder operator, and that literal formula
 * must be kept to preserve bit-for-bit agreement.
 * </p>
 * <p>
 * This is not a secure generator. Instances are not thread-safe.
 * </p>
 */
public final class RandomLCG implements IRandom {

    private static final Logger LOG = LoggerFactory.getLogger(RandomLCG.class);

    private final LcgParameters params;
    private final double m;
    private final double a;
    private final double c;
    private double seed;

    /**
     * Creates a generator seeded from the current time in milliseconds. The sequence is
     * not reproducible; use {@link #RandomLCG(long)} when it must be.
     */
    public RandomLCG() {
        this(new SystemClockSeedSource());
    }

    /**
     * Creates a generator seeded from the given source. The source value is normalized as
     * in {@link #RandomLCG(long)}.
     * @param seedSource The source of the initial seed.
     */
    public RandomLCG(ISeedSource seedSource) {
        this(LcgParameters.STANDARD, Objects.requireNonNull(seedSource, "Seed source cannot be null.").nextSeed());
    }

    /**
     * Creates a generator with the standard parameters. The seed is normalized: its absolute
     * value is reduced modulo {@code 2^32}.
     * @param seed The initial seed.
     */
    public RandomLCG(long seed) {
        this(LcgParameters.STANDARD, seed);
    }

    /**
     * Creates a generator with the standard parameters. The seed is normalized: its absolute
     * value is floored and reduced modulo {@code 2^32}.
     * @param seed The initial seed.
     * @throws InvalidSeedException if the seed is NaN or infinite
     */
    public RandomLCG(double seed) {
        this(LcgParameters.STANDARD, seed);
    }

    /**
     * Creates a generator with the given parameters and a normalized seed.
     * @param params The generator constants.
     * @param seed The initial seed, normalized into {@code [0, m)}.
     */
    public RandomLCG(LcgParameters params, long seed) {
        this.params = Objects.requireNonNull(params, "LCG parameters cannot be null.");
        this.m = params.getModulus();
        this.a = params.getMultiplier();
        this.c = params.getIncrement();
        long reduced = seed % params.getModulus();
        this.seed = reduced < 0 ? -reduced : reduced;
        checkSeed(this.seed);
    }

    /**
     * Creates a generator with the given parameters and a normalized seed.
     * @param params The generator constants.
     * @param seed The initial seed, normalized into {@code [0, m)}.
     * @throws InvalidSeedException if the seed is NaN or infinite
     */
    public RandomLCG(LcgParameters params, double seed) {
        this.params = Objects.requireNonNull(params, "LCG parameters cannot be null.");
        this.m = params.getModulus();
        this.a = params.getMultiplier();
        this.c = params.getIncrement();
        this.seed = Math.floor(Math.abs(seed)) % m;
        checkSeed(this.seed);
    }

    /**
     * Ensures the seed is an integer between 0 (inclusive) and the modulus (exclusive).
     */
    private void checkSeed(double s) {
        if (s < 0) {
            throw new InvalidSeedException(s, "random seed must be 0 or greater, was " + s);
        }
        if (s >= m) {
            throw new InvalidSeedException(s, "random seed must be less than " + params.getModulus() + ", was " + s);
        }
        if (s != Math.floor(s)) {
            throw new InvalidSeedException(s, "random seed must be an integer, was " + s);
        }
    }

    public LcgParameters getParameters() {
        return params;
    }

    @Override
    public long getModulus() {
        return params.getModulus();
    }

    @Override
    public long getSeed() {
        return (long) seed;
    }

    @Override
    public void setSeed(long seed) {
        setSeed((double) seed);
    }

    @Override
    public void setSeed(double seed) {
        checkSeed(seed);
        this.seed = seed;
    }

    /**
     * The advancing step. Every draw goes through here exactly once.
     */
    private double advance() {
        double r = seed * a + c;
        seed = r - Math.floor(r / m) * m;
        checkSeed(seed);
        return seed;
    }

    @Override
    public long nextInt() {
        long x = (long) advance();
        if (LOG.isTraceEnabled()) {
            LOG.trace("nextInt {}", x);
        }
        return x;
    }

    @Override
    public double nextFloat() {
        double x = advance() / (m - 1);
        if (LOG.isTraceEnabled()) {
            LOG.trace("nextFloat {}", x);
        }
        return x;
    }

    @Override
    public int nextRange(int n) {
        int x = range(n);
        if (LOG.isTraceEnabled()) {
            LOG.trace("nextRange({}) {}", n, x);
        }
        return x;
    }

    private int range(int n) {
        if (n <= 0) {
            throw new InvalidRangeException(n, "range must be positive, was " + n);
        }
        // Scale instead of taking a remainder: the low-order bits of an LCG are weak.
        double randomUnder1 = advance() / m;
        return (int) Math.floor(randomUnder1 * n);
    }

    @Override
    public int[] randomInts(int n) {
        if (n < 0) {
            throw new InvalidRangeException(n, "number of integers must be 0 or greater, was " + n);
        }
        int[] result = new int[n];
        int[] source = new int[n];
        for (int i = 0; i < n; i++) {
            source[i] = i;
        }
        // Move numbers from source to result in random order; -1 marks a placed entry.
        for (int placed = 0; placed < n; placed++) {
            int k = range(n - placed);
            int available = 0;
            for (int j = 0; j < n; j++) {
                if (source[j] < 0) {
                    continue;
                }
                if (available++ == k) {
                    result[placed] = source[j];
                    source[j] = -1;
                    break;
                }
            }
        }
        if (LOG.isTraceEnabled()) {
            LOG.trace("randomInts({}) {}", n, Arrays.toString(result));
        }
        return result;
    }

    @Override
    public IRandom deriveFor(String scope, long key) {
        long h = mix64(getSeed());
        h = mix64(h ^ mix64(hashString(scope)));
        h = mix64(h ^ mix64(key));
        return new RandomLCG(params, Math.floorMod(h, params.getModulus()));
    }

    /**
     * Hashes a string using the FNV-1a 64-bit algorithm.
     */
    private static long hashString(String s) {
        if (s == null) return 0L;
        long h = 1469598103934665603L; // FNV-1a 64-bit offset basis
        for (byte value : s.getBytes(StandardCharsets.UTF_8)) {
            h ^= (value & 0xFF);
            h *= 1099511628211L; // FNV-1a prime
        }
        return h;
    }

    /**
     * SplitMix64 finalizer.
     */
    private static long mix64(long z) {
        z = (z ^ (z >>> 33)) * 0xff51afd7ed558ccdL;
        z = (z ^ (z >>> 33)) * 0xc4ceb9fe1a85ec53L;
        return z ^ (z >>> 33);
    }

    @Override
    public byte[] saveState() {
        return ByteBuffer.allocate(Long.BYTES).putLong(getSeed()).array();
    }

    @Override
    public void loadState(byte[] state) {
        if (state == null) {
            throw new IllegalArgumentException("RNG state cannot be null");
        }
        if (state.length != Long.BYTES) {
            throw new IllegalArgumentException("RNG state must be " + Long.BYTES + " bytes, was " + state.length);
        }
        setSeed(ByteBuffer.wrap(state).getLong());
    }

    @Override
    public String toString() {
        return "RandomLCG{seed: " + getSeed() + "}";
    }
}
