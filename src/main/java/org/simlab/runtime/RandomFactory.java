package org.simlab.runtime;

import com.typesafe.config.Config;
import org.simlab.runtime.internal.services.RandomLCG;
import org.simlab.runtime.internal.services.SystemClockSeedSource;
import org.simlab.runtime.spi.IRandom;
import org.simlab.runtime.spi.ISeedSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Creates random generators from configuration.
 * <pre>
 * random {
 *   seed = 12345   # optional, absent means seed from the clock
 * }
 * </pre>
 * A configured seed is normalized as for construction, it is not validated strictly.
 */
public final class RandomFactory {

    private static final Logger LOG = LoggerFactory.getLogger(RandomFactory.class);
    private static final String SEED_PATH = "random.seed";

    private RandomFactory() {}

    /**
     * Creates a generator from the {@code random} block, falling back to the system clock
     * when no seed is configured.
     * @param config The application configuration.
     * @return The generator.
     */
    public static IRandom create(Config config) {
        return create(config, new SystemClockSeedSource());
    }

    /**
     * Creates a generator from the {@code random} block, falling back to the given seed
     * source when no seed is configured.
     * @param config The application configuration.
     * @param fallback Seed source used when {@code random.seed} is absent.
     * @return The generator.
     */
    public static IRandom create(Config config, ISeedSource fallback) {
        Objects.requireNonNull(fallback, "Seed source cannot be null.");
        if (config.hasPath(SEED_PATH)) {
            Number seed = config.getNumber(SEED_PATH);
            RandomLCG random = (seed instanceof Double)
                    ? new RandomLCG(seed.doubleValue())
                    : new RandomLCG(seed.longValue());
            LOG.debug("Created {} from configured seed {}", random, seed);
            return random;
        }
        RandomLCG random = new RandomLCG(fallback);
        // Logged so that a run seeded from the clock can be replayed.
        LOG.info("No random seed configured, seeded from clock: {}", random.getSeed());
        return random;
    }
}
