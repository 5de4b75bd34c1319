package org.simlab.runtime.path;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigUtil;
import com.typesafe.config.ConfigValue;
import com.typesafe.config.ConfigValueType;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * A factory for creating paths by type name.
 * It uses a registry to store the creators of the known path types.
 */
public final class PathFactory {

    private static final Map<String, IPathCreator> registry = new HashMap<>();

    static {
        register("cardioid", params -> new CardioidPath(
                number(params, "radius", 1.0),
                number(params, "start", -Math.PI),
                number(params, "finish", Math.PI),
                flag(params, "closedLoop", false)));
    }

    private PathFactory() {}

    private static double number(Map<String, Object> params, String key, double defaultValue) {
        Object value = params.getOrDefault(key, defaultValue);
        if (!(value instanceof Number)) {
            throw new IllegalArgumentException("Path parameter '" + key + "' must be a number, was: " + value);
        }
        return ((Number) value).doubleValue();
    }

    private static boolean flag(Map<String, Object> params, String key, boolean defaultValue) {
        Object value = params.getOrDefault(key, defaultValue);
        if (!(value instanceof Boolean)) {
            throw new IllegalArgumentException("Path parameter '" + key + "' must be a boolean, was: " + value);
        }
        return (Boolean) value;
    }

    /**
     * Registers a new path creator.
     * @param type The type name of the path.
     * @param creator The creator for the path.
     */
    public static void register(String type, IPathCreator creator) {
        registry.put(type.toLowerCase(Locale.ROOT), creator);
    }

    /**
     * Creates a new path.
     * @param type The type name of the path.
     * @param params The shape parameters of the path.
     * @return The created path.
     * @throws IllegalArgumentException if the path type is unknown.
     */
    public static IPath create(String type, Map<String, Object> params) {
        Objects.requireNonNull(type, "Path type cannot be null.");
        IPathCreator creator = registry.get(type.toLowerCase(Locale.ROOT));
        if (creator == null) {
            throw new IllegalArgumentException("Unknown path type: " + type);
        }
        return creator.create(params != null ? params : Map.of());
    }

    /**
     * Creates a path from a configuration block of the form
     * <pre>
     * path {
     *   type = "cardioid"
     *   radius = 1.0
     *   start = -3.141592653589793
     *   finish = 3.141592653589793
     *   closedLoop = false
     * }
     * </pre>
     * @param config Configuration containing a {@code path} block.
     * @return The created path.
     */
    public static IPath create(Config config) {
        Config pathConfig = config.getConfig("path");
        if (!pathConfig.hasPath("type")) {
            throw new IllegalArgumentException("Path configuration is missing 'type'");
        }
        Map<String, Object> params = new HashMap<>();
        for (String key : pathConfig.root().keySet()) {
            if (!key.equals("type")) {
                params.put(key, typedValue(pathConfig, key));
            }
        }
        return create(pathConfig.getString("type"), params);
    }

    /**
     * Values set as system properties or quoted in HOCON arrive as strings; let Typesafe
     * coerce those to booleans or numbers where it can.
     */
    private static Object typedValue(Config pathConfig, String key) {
        String quotedKey = ConfigUtil.quoteString(key);
        ConfigValue value = pathConfig.getValue(quotedKey);
        if (value.valueType() != ConfigValueType.STRING) {
            return value.unwrapped();
        }
        try {
            return pathConfig.getBoolean(quotedKey);
        } catch (ConfigException.WrongType notBoolean) {
            try {
                return pathConfig.getDouble(quotedKey);
            } catch (ConfigException.WrongType notNumber) {
                return value.unwrapped();
            }
        }
    }
}
