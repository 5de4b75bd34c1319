package org.simlab.runtime.path;

import org.simlab.runtime.spi.IRandom;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Draws random positions along a path, e.g. for randomized initial conditions of bodies
 * placed on a track. The parameter is sampled as {@code start + u * (finish - start)} with
 * {@code u = random.nextFloat()}, so each sample advances the generator exactly once.
 */
public final class PathSampler {

    private final IRandom random;

    /**
     * @param random Source of randomness, owned by the caller's stream.
     */
    public PathSampler(IRandom random) {
        this.random = Objects.requireNonNull(random, "Random cannot be null.");
    }

    /**
     * Returns a random parameter value in {@code [start, finish]} of the path.
     * @param path The path to sample.
     * @return The parameter value.
     */
    public double sampleParameter(IPath path) {
        double start = path.getStartValue();
        double finish = path.getFinishValue();
        double t = start + random.nextFloat() * (finish - start);
        // rounding may carry t a hair past finish when nextFloat() returns 1.0
        return Math.min(t, finish);
    }

    /**
     * Returns the point of the path at a random parameter value.
     * @param path The path to sample.
     * @return The point.
     */
    public PathPoint samplePoint(IPath path) {
        return path.evaluate(sampleParameter(path));
    }

    /**
     * Returns {@code count} random points along the path, drawn in order.
     * @param path The path to sample.
     * @param count The number of points, must be &gt;= 0.
     * @return The points.
     */
    public List<PathPoint> samplePoints(IPath path, int count) {
        if (count < 0) {
            throw new IllegalArgumentException("Sample count must be 0 or greater, was " + count);
        }
        List<PathPoint> points = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            points.add(samplePoint(path));
        }
        return points;
    }
}
