package org.simlab.runtime.internal.services;

import org.simlab.runtime.spi.ISeedSource;

import java.time.Clock;
import java.util.Objects;

/**
 * Seed source backed by a {@link Clock}, returning the current time in milliseconds.
 */
public final class SystemClockSeedSource implements ISeedSource {

    private final Clock clock;

    /**
     * Creates a seed source reading the system UTC clock.
     */
    public SystemClockSeedSource() {
        this(Clock.systemUTC());
    }

    /**
     * Creates a seed source reading the given clock. Pass a fixed clock for reproducible seeds.
     * @param clock The clock to read.
     */
    public SystemClockSeedSource(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null.");
    }

    @Override
    public long nextSeed() {
        return clock.millis();
    }
}
