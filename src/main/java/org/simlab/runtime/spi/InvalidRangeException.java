package org.simlab.runtime.spi;

/**
 * Thrown when a caller-supplied bound for a ranged draw is out of range.
 */
public class InvalidRangeException extends IllegalArgumentException {

    private final int bound;

    public InvalidRangeException(int bound, String message) {
        super(message);
        this.bound = bound;
    }

    public int getBound() {
        return bound;
    }
}
