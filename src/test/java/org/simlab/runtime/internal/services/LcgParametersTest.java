package org.simlab.runtime.internal.services;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.simlab.junit.extensions.logging.ExpectLog;
import org.simlab.junit.extensions.logging.LogLevel;
import org.simlab.junit.extensions.logging.LogWatchExtension;
import org.simlab.runtime.spi.NumericOverflowRiskException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link LcgParameters} validation and for the full-period property of
 * generators built on them.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class LcgParametersTest {

    /** The standard multiplier and increment reduced modulo 2^16; still satisfies Hull-Dobell. */
    private static final LcgParameters REDUCED = new LcgParameters(1L << 16, 26125L, 62303L);

    @Test
    void standard_hasReferenceConstants() {
        assertEquals(4294967296L, LcgParameters.STANDARD.getModulus());
        assertEquals(1664525L, LcgParameters.STANDARD.getMultiplier());
        assertEquals(1013904223L, LcgParameters.STANDARD.getIncrement());
        assertTrue(LcgParameters.STANDARD.isFullPeriod());
    }

    @Test
    void standard_keepsIntermediatesExactInDoublePrecision() {
        long m = LcgParameters.STANDARD.getModulus();
        long max = (m - 1) * LcgParameters.STANDARD.getMultiplier() + LcgParameters.STANDARD.getIncrement();

        assertEquals(7149081450614098L, max);
        assertThat(max).isLessThan(LcgParameters.EXACT_DOUBLE_LIMIT);
        assertEquals(max, (long) (double) max);
    }

    @Test
    void reducedModulus_visitsEveryStateOnceBeforeReturning() {
        long m = REDUCED.getModulus();
        assertTrue(REDUCED.isFullPeriod());
        for (long start : new long[]{0L, 1L, 12345L, m - 1}) {
            RandomLCG random = new RandomLCG(REDUCED, start);
            boolean[] seen = new boolean[(int) m];
            int returns = 0;
            for (long i = 1; i <= m; i++) {
                long x = random.nextInt();
                final long step = i;
                assertFalse(seen[(int) x], () -> "state " + x + " repeated at step " + step);
                seen[(int) x] = true;
                if (x == start) {
                    returns++;
                    assertEquals(m, i);
                }
            }
            assertEquals(1, returns);
        }
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, loggerPattern = ".*LcgParameters", messagePattern = ".*Hull-Dobell.*")
    void hullDobellViolation_isAcceptedWithWarning() {
        // a - 1 = 2 is not a multiple of 4
        LcgParameters params = new LcgParameters(256, 3, 1);

        assertFalse(params.isFullPeriod());
        RandomLCG random = new RandomLCG(params, 0L);
        int period = 0;
        do {
            random.nextInt();
            period++;
        } while (random.getSeed() != 0 && period <= 256);
        assertThat(period).isLessThan(256);
    }

    @Test
    void hullDobell_checksAllConditions() {
        assertTrue(LcgParameters.satisfiesHullDobell(1L << 32, 1664525, 1013904223));
        assertFalse(LcgParameters.satisfiesHullDobell(1L << 32, 1664525, 0));
        // c shares the factor 2 with m
        assertFalse(LcgParameters.satisfiesHullDobell(1L << 32, 1664525, 2));
        // a - 1 not divisible by the prime factor 3 of m
        assertFalse(LcgParameters.satisfiesHullDobell(9, 2, 1));
        assertTrue(LcgParameters.satisfiesHullDobell(9, 4, 1));
        // m = 12: a - 1 = 6 is divisible by 2 and 3 but not by 4
        assertFalse(LcgParameters.satisfiesHullDobell(12, 7, 5));
        assertTrue(LcgParameters.satisfiesHullDobell(12, 1, 5));
    }

    @Test
    void primeFactors_areDistinctAndAscending() {
        assertThat(LcgParameters.primeFactors(1L << 32)).containsExactly(2L);
        assertThat(LcgParameters.primeFactors(1664525L)).containsExactly(5L, 139L, 479L);
        assertThat(LcgParameters.primeFactors(1664524L)).containsExactly(2L, 71L, 5861L);
        assertThat(LcgParameters.primeFactors(1013904223L)).containsExactly(1013904223L);
    }

    @Test
    void parametersBeyondExactDoubleRange_areRejected() {
        assertThatThrownBy(() -> new LcgParameters(1L << 32, (1L << 22) + 1, 1013904223L))
                .isInstanceOfSatisfying(NumericOverflowRiskException.class,
                        e -> assertThat(e.getMaxIntermediate()).isGreaterThanOrEqualTo(9.007199254740992E15))
                .hasMessageContaining("2^53");
        assertThatThrownBy(() -> new LcgParameters(1L << 62, (1L << 40) + 1, 1L))
                .isInstanceOf(NumericOverflowRiskException.class)
                .hasCauseInstanceOf(ArithmeticException.class);
    }

    @Test
    void outOfRangeParameters_areRejected() {
        assertThatThrownBy(() -> new LcgParameters(0, 1, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new LcgParameters(16, 0, 1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new LcgParameters(16, 16, 1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new LcgParameters(16, 5, 16)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new LcgParameters(16, 5, -1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void equalParameters_areEqual() {
        assertEquals(new LcgParameters(1L << 16, 26125L, 62303L), REDUCED);
        assertEquals(REDUCED.hashCode(), new LcgParameters(1L << 16, 26125L, 62303L).hashCode());
        assertEquals("LcgParameters{m: 65536, a: 26125, c: 62303}", REDUCED.toString());
    }
}
