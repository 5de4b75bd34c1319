package org.simlab.runtime.path;

import java.util.Map;

/**
 * A functional interface for creating paths from parameters.
 */
@FunctionalInterface
public interface IPathCreator {
    /**
     * Creates a new path.
     * @param params The shape parameters of the path.
     * @return The created path.
     */
    IPath create(Map<String, Object> params);
}
