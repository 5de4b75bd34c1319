package org.simlab.runtime.path;

/**
 * A curve in the plane defined by a parameter {@code t} ranging over
 * {@code [getStartValue(), getFinishValue()]}. Implementations are immutable and
 * {@link #evaluate(double)} is a pure function of the shape parameters.
 */
public interface IPath {

    /**
     * Returns the point of the path at parameter {@code t}.
     *
     * @param t the parameter, within {@code [start, finish]}
     * @return the point at {@code t}
     * @throws IllegalArgumentException if {@code t} is outside the domain
     */
    PathPoint evaluate(double t);

    /**
     * @return the smallest parameter value of the path
     */
    double getStartValue();

    /**
     * @return the largest parameter value of the path
     */
    double getFinishValue();

    /**
     * @return true if the path joins at its ends, so that start and finish are the same point
     */
    boolean isClosedLoop();

    /**
     * @return the name of the path
     */
    String getName();
}
