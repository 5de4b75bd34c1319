package org.simlab.runtime.path;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Tag("unit")
class CardioidPathTest {

    private static final double EPS = 1e-12;

    @Test
    void defaults_coverFullTurnAndAreOpen() {
        CardioidPath path = new CardioidPath(2.0);

        assertEquals(-Math.PI, path.getStartValue());
        assertEquals(Math.PI, path.getFinishValue());
        assertFalse(path.isClosedLoop());
        assertEquals("Cardioid", path.getName());
        assertEquals(2.0, path.getRadius());
    }

    @Test
    void evaluate_followsCardioidEquations() {
        CardioidPath path = new CardioidPath(2.0);

        PathPoint bottom = path.evaluate(0);
        assertThat(bottom.x()).isCloseTo(0.0, within(EPS));
        assertThat(bottom.y()).isCloseTo(-4.0, within(EPS));

        PathPoint side = path.evaluate(Math.PI / 2);
        assertThat(side.x()).isCloseTo(2.0, within(EPS));
        assertThat(side.y()).isCloseTo(0.0, within(EPS));

        double t = 0.7;
        PathPoint p = path.evaluate(t);
        assertThat(p.x()).isCloseTo(2.0 * Math.sin(t) * (1 + Math.cos(t)), within(EPS));
        assertThat(p.y()).isCloseTo(-2.0 * Math.cos(t) * (1 + Math.cos(t)), within(EPS));
    }

    @Test
    void evaluate_endPointsMeetAtOrigin() {
        CardioidPath path = new CardioidPath(1.5);

        PathPoint start = path.evaluate(path.getStartValue());
        PathPoint finish = path.evaluate(path.getFinishValue());

        assertThat(start.x()).isCloseTo(0.0, within(EPS));
        assertThat(start.y()).isCloseTo(0.0, within(EPS));
        assertThat(finish.x()).isCloseTo(0.0, within(EPS));
        assertThat(finish.y()).isCloseTo(0.0, within(EPS));
    }

    @Test
    void evaluate_rejectsParameterOutsideDomain() {
        CardioidPath path = new CardioidPath(1.0, 0.0, 1.0, false);

        assertThatThrownBy(() -> path.evaluate(1.5)).isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("outside path domain");
        assertThatThrownBy(() -> path.evaluate(-0.1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> path.evaluate(Double.NaN)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void customDomain_isKept() {
        CardioidPath path = new CardioidPath(1.0, -1.0, 2.0, true);

        assertEquals(-1.0, path.getStartValue());
        assertEquals(2.0, path.getFinishValue());
        assertTrue(path.isClosedLoop());
    }

    @Test
    void emptyDomain_isRejected() {
        assertThatThrownBy(() -> new CardioidPath(1.0, 1.0, 1.0, false)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new CardioidPath(1.0, 2.0, 1.0, false)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new CardioidPath(1.0, 0.0, Double.POSITIVE_INFINITY, false))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void toString_describesShape() {
        assertEquals("CardioidPath{name: Cardioid, start: 0.0, finish: 1.0, closedLoop: false, radius: 3.0}",
                new CardioidPath(3.0, 0.0, 1.0, false).toString());
    }
}
