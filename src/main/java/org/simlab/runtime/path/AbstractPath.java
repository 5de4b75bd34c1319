package org.simlab.runtime.path;

import java.util.Objects;

/**
 * Base class for paths given by separate closed-form functions {@code x(t)} and {@code y(t)}.
 * Holds the parameter domain and checks that evaluated parameters lie within it.
 */
public abstract class AbstractPath implements IPath {

    private final String name;
    private final double start;
    private final double finish;
    private final boolean closedLoop;

    protected AbstractPath(String name, double start, double finish, boolean closedLoop) {
        this.name = Objects.requireNonNull(name, "Path name cannot be null.");
        if (!Double.isFinite(start) || !Double.isFinite(finish) || start >= finish) {
            throw new IllegalArgumentException(
                    String.format("Path domain must satisfy start < finish, was [%s, %s]", start, finish));
        }
        this.start = start;
        this.finish = finish;
        this.closedLoop = closedLoop;
    }

    /**
     * @param t the parameter
     * @return the horizontal coordinate at {@code t}
     */
    protected abstract double xFunc(double t);

    /**
     * @param t the parameter
     * @return the vertical coordinate at {@code t}
     */
    protected abstract double yFunc(double t);

    @Override
    public PathPoint evaluate(double t) {
        if (!(t >= start && t <= finish)) {
            throw new IllegalArgumentException(
                    String.format("Parameter %s is outside path domain [%s, %s]", t, start, finish));
        }
        return new PathPoint(xFunc(t), yFunc(t));
    }

    @Override
    public double getStartValue() {
        return start;
    }

    @Override
    public double getFinishValue() {
        return finish;
    }

    @Override
    public boolean isClosedLoop() {
        return closedLoop;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{name: " + name + ", start: " + start
                + ", finish: " + finish + ", closedLoop: " + closedLoop + "}";
    }
}
