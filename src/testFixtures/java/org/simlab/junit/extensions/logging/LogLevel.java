package org.simlab.junit.extensions.logging;

import ch.qos.logback.classic.Level;

/**
 * Log levels usable in the logging test annotations.
 */
public enum LogLevel {
    TRACE(Level.TRACE),
    DEBUG(Level.DEBUG),
    INFO(Level.INFO),
    WARN(Level.WARN),
    ERROR(Level.ERROR);

    private final Level logbackLevel;

    LogLevel(Level logbackLevel) {
        this.logbackLevel = logbackLevel;
    }

    Level toLogback() {
        return logbackLevel;
    }
}
