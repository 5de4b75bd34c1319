package org.simlab.runtime.path;

/**
 * A cardioid, a vaguely heart shaped figure:
 * <pre>
 *   x = a sin t (1 + cos t)
 *   y = -a cos t (1 + cos t)
 * </pre>
 * By default the path is not closed: its end points are at the origin, where the
 * derivative is discontinuous.
 */
public final class CardioidPath extends AbstractPath {

    public static final String NAME = "Cardioid";

    private final double radius;

    /**
     * Creates a cardioid over {@code [-PI, PI]} that is not a closed loop.
     * @param radius The scale factor {@code a}.
     */
    public CardioidPath(double radius) {
        this(radius, -Math.PI, Math.PI, false);
    }

    /**
     * @param radius The scale factor {@code a}.
     * @param start Smallest parameter value.
     * @param finish Largest parameter value.
     * @param closedLoop Whether the path joins at its ends.
     */
    public CardioidPath(double radius, double start, double finish, boolean closedLoop) {
        super(NAME, start, finish, closedLoop);
        this.radius = radius;
    }

    public double getRadius() {
        return radius;
    }

    @Override
    protected double xFunc(double t) {
        double c = Math.cos(t);
        return radius * Math.sin(t) * (1 + c);
    }

    @Override
    protected double yFunc(double t) {
        double c = Math.cos(t);
        return -radius * c * (1 + c);
    }

    @Override
    public String toString() {
        return super.toString().substring(0, super.toString().length() - 1) + ", radius: " + radius + "}";
    }
}
