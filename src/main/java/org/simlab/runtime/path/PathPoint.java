package org.simlab.runtime.path;

/**
 * A point in the plane produced by evaluating a path.
 *
 * @param x horizontal coordinate
 * @param y vertical coordinate
 */
public record PathPoint(double x, double y) {
}
