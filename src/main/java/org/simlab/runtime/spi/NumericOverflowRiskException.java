package org.simlab.runtime.spi;

/**
 * Thrown when generator parameters would let an intermediate value of the advancing
 * step leave the range of integers that a double represents exactly ({@code < 2^53}).
 * This is a configuration defect and is detected once, when the parameters are created.
 */
public class NumericOverflowRiskException extends IllegalStateException {

    private final double maxIntermediate;

    public NumericOverflowRiskException(double maxIntermediate, String message) {
        super(message);
        this.maxIntermediate = maxIntermediate;
    }

    public NumericOverflowRiskException(double maxIntermediate, String message, Throwable cause) {
        this(maxIntermediate, message);
        initCause(cause);
    }

    /**
     * @return the largest intermediate value {@code (m-1)*a + c} the parameters can produce
     */
    public double getMaxIntermediate() {
        return maxIntermediate;
    }
}
