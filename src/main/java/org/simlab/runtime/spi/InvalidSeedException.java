package org.simlab.runtime.spi;

/**
 * Thrown when a seed is not an integer in {@code [0, modulus)}.
 * <p>
 * Raised by strict seed assignment and checkpoint restore. When raised from inside a
 * draw it signals a defect in the generator, not a caller error.
 * </p>
 */
public class InvalidSeedException extends IllegalArgumentException {

    private final double seed;

    public InvalidSeedException(double seed, String message) {
        super(message);
        this.seed = seed;
    }

    /**
     * @return the rejected seed value
     */
    public double getSeed() {
        return seed;
    }
}
