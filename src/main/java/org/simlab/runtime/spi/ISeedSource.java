package org.simlab.runtime.spi;

/**
 * Supplies a seed for generators constructed without an explicit one.
 * <p>
 * Seeds produced this way are not reproducible. Tests and replays should inject a
 * fixed source, or pass an explicit seed.
 * </p>
 */
@FunctionalInterface
public interface ISeedSource {

    /**
     * Returns a seed value. The generator normalizes it into its own seed range.
     *
     * @return the raw seed value
     */
    long nextSeed();
}
