package org.simlab.junit.extensions.logging;

import java.lang.annotation.ElementType;
import java.lang.annotation.Repeatable;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Requires matching log events during a test. The test fails if fewer than
 * {@link #occurrences()} events match.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.TYPE, ElementType.METHOD})
@Repeatable(ExpectLogs.class)
public @interface ExpectLog {
    LogLevel level();
    String loggerPattern() default ".*";
    String messagePattern() default ".*";
    int occurrences() default 1;
}
