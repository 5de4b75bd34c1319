package org.simlab.runtime.spi;

/**
 * Interface for components whose state can be captured and restored, so that a
 * simulation can be checkpointed and later resumed on exactly the same random sequence.
 * <p>
 * The serialized form must be deterministic: saving the same state twice yields the
 * same bytes.
 * </p>
 */
public interface ISerializable {

    /**
     * Serializes the complete internal state of this component.
     *
     * @return Byte array containing the complete internal state.
     */
    byte[] saveState();

    /**
     * Restores the internal state of this component from previously saved state.
     * On failure the current state is left untouched.
     *
     * @param state The state bytes previously returned by {@link #saveState()}.
     * @throws IllegalArgumentException if state is null, malformed, or describes an invalid state.
     */
    void loadState(byte[] state);
}
