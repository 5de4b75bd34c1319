package org.simlab.runtime.spi;

/**
 * Provides deterministic pseudo-randomness for a simulation.
 * <p>
 * Implementations must produce the same values for the same seed and the same sequence
 * of calls, on every platform. Every draw advances the internal seed, so an instance
 * must be owned by a single stream of draws; concurrent use of one instance is undefined.
 * Use {@link #deriveFor(String, long)} to give each thread or body its own stream.
 * </p>
 * <p>
 * Implements {@link ISerializable} to support simulation checkpointing and resume.
 * </p>
 */
public interface IRandom extends ISerializable {

    /**
     * Returns the modulus of the generator. Seeds and the values returned by
     * {@link #nextInt()} lie in {@code [0, modulus)}.
     *
     * @return the modulus
     */
    long getModulus();

    /**
     * Returns the current seed without advancing the generator.
     *
     * @return the current seed, in {@code [0, modulus)}
     */
    long getSeed();

    /**
     * Sets the seed. Unlike construction, no normalization is applied.
     *
     * @param seed new seed, must be in {@code [0, modulus)}
     * @throws InvalidSeedException if the seed is out of range
     */
    void setSeed(long seed);

    /**
     * Sets the seed from a floating point value, which must be an exact integer.
     *
     * @param seed new seed, must be an integer in {@code [0, modulus)}
     * @throws InvalidSeedException if the seed is not integral or out of range
     */
    void setSeed(double seed);

    /**
     * Advances the generator and returns the new seed.
     *
     * @return the next value, in {@code [0, modulus)}
     */
    long nextInt();

    /**
     * Advances the generator and returns the new seed scaled by {@code 1 / (modulus - 1)}.
     * Note that the upper bound is inclusive: {@code 1.0} is returned when the new seed
     * equals {@code modulus - 1}.
     *
     * @return the next value, in {@code [0, 1]}
     */
    double nextFloat();

    /**
     * Returns a value uniformly distributed in {@code [0, n)}. Uses the high-order bits
     * of the next value rather than a remainder, since the low-order bits of a linear
     * congruential generator are weak.
     *
     * @param n exclusive upper bound, must be &gt; 0
     * @return the random value
     * @throws InvalidRangeException if {@code n <= 0}; the generator is not advanced
     */
    int nextRange(int n);

    /**
     * Returns the integers {@code 0 .. n-1} in random order, each exactly once.
     * The generator is advanced exactly {@code n} times.
     *
     * @param n number of integers, must be &gt;= 0
     * @return the permutation, empty when {@code n == 0}
     * @throws InvalidRangeException if {@code n < 0}
     */
    int[] randomInts(int n);

    /**
     * Creates an independent generator whose seed is derived deterministically from this
     * generator's current seed and the given scope and key. This generator is not advanced.
     *
     * @param scope a stable, descriptive scope name (e.g., "body", "initialConditions")
     * @param key a stable numeric key (e.g., body index)
     * @return a derived generator
     */
    IRandom deriveFor(String scope, long key);
}
