package org.simlab.junit.extensions.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.turbo.TurboFilter;
import ch.qos.logback.core.spi.FilterReply;
import org.junit.jupiter.api.extension.AfterAllCallback;
import org.junit.jupiter.api.extension.AfterEachCallback;
import org.junit.jupiter.api.extension.BeforeAllCallback;
import org.junit.jupiter.api.extension.BeforeEachCallback;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.slf4j.LoggerFactory;
import org.slf4j.Marker;
import org.slf4j.helpers.MessageFormatter;

import java.lang.reflect.AnnotatedElement;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * JUnit extension that fails a test when it logs at or above WARN (configurable with
 * {@link FailOnLog}) unless the event is permitted by {@link AllowLog} or required by
 * {@link ExpectLog}. Missing expected events fail the test as well.
 * <p>
 * Events are captured with a Logback {@link TurboFilter}, so expectations also match events
 * whose logger level would suppress them. Permitted and expected events are not printed.
 * </p>
 */
public class LogWatchExtension implements BeforeAllCallback, BeforeEachCallback, AfterEachCallback, AfterAllCallback {

    private static final ExtensionContext.Namespace NAMESPACE = ExtensionContext.Namespace.create(LogWatchExtension.class);
    private static final String FILTER_KEY = "filter";

    @Override
    public void beforeAll(ExtensionContext context) {
        CapturingFilter filter = new CapturingFilter();
        filter.rules = Rules.resolve(context);
        filter.start();
        loggerContext().addTurboFilter(filter);
        context.getStore(NAMESPACE).put(FILTER_KEY, filter);
    }

    @Override
    public void beforeEach(ExtensionContext context) {
        CapturingFilter filter = context.getStore(NAMESPACE).get(FILTER_KEY, CapturingFilter.class);
        if (filter != null) {
            filter.rules = Rules.resolve(context);
            filter.events.clear();
        }
    }

    @Override
    public void afterEach(ExtensionContext context) {
        CapturingFilter filter = context.getStore(NAMESPACE).get(FILTER_KEY, CapturingFilter.class);
        if (filter == null) {
            return;
        }
        Rules rules = filter.rules;
        List<CapturedEvent> events = new ArrayList<>(filter.events);
        filter.events.clear();

        List<String> problems = new ArrayList<>();
        if (!rules.disabled) {
            for (CapturedEvent e : events) {
                if (e.level.isGreaterOrEqual(rules.minLevel.toLogback()) && !rules.permits(e)) {
                    problems.add("Unexpected log: " + e);
                }
            }
        }
        for (ExpectLog expected : rules.expects) {
            long count = events.stream().filter(e -> matches(e, expected.level(), expected.loggerPattern(), expected.messagePattern())).count();
            if (count < expected.occurrences()) {
                problems.add(String.format("Missing expected log: %d x [%s] logger=\"%s\" message=\"%s\", found %d",
                        expected.occurrences(), expected.level(), expected.loggerPattern(), expected.messagePattern(), count));
            }
        }
        if (!problems.isEmpty()) {
            throw new AssertionError(String.join("\n", problems));
        }
    }

    @Override
    public void afterAll(ExtensionContext context) {
        CapturingFilter filter = context.getStore(NAMESPACE).remove(FILTER_KEY, CapturingFilter.class);
        if (filter != null) {
            loggerContext().getTurboFilterList().remove(filter);
            filter.stop();
        }
    }

    private static LoggerContext loggerContext() {
        return (LoggerContext) LoggerFactory.getILoggerFactory();
    }

    private static boolean matches(CapturedEvent e, LogLevel level, String loggerPattern, String messagePattern) {
        return e.level.equals(level.toLogback())
                && Pattern.matches(loggerPattern, e.loggerName)
                && Pattern.matches(messagePattern, e.message);
    }

    private static final class CapturingFilter extends TurboFilter {
        private final List<CapturedEvent> events = new CopyOnWriteArrayList<>();
        private volatile Rules rules;

        @Override
        public FilterReply decide(Marker marker, ch.qos.logback.classic.Logger logger, Level level, String format, Object[] params, Throwable t) {
            // a null format is an isXxxEnabled() query, not an event
            if (format == null) {
                return FilterReply.NEUTRAL;
            }
            CapturedEvent event = new CapturedEvent(logger.getName(), level, MessageFormatter.arrayFormat(format, params).getMessage());
            events.add(event);
            return rules.permits(event) ? FilterReply.DENY : FilterReply.NEUTRAL;
        }
    }

    private static final class CapturedEvent {
        final String loggerName;
        final Level level;
        final String message;

        CapturedEvent(String loggerName, Level level, String message) {
            this.loggerName = loggerName;
            this.level = level;
            this.message = message != null ? message : "";
        }

        @Override
        public String toString() {
            return String.format("[%s] %s - %s", level, loggerName, message);
        }
    }

    private static final class Rules {
        final LogLevel minLevel;
        final boolean disabled;
        final AllowLog[] allows;
        final ExpectLog[] expects;

        private Rules(LogLevel minLevel, boolean disabled, AllowLog[] allows, ExpectLog[] expects) {
            this.minLevel = minLevel;
            this.disabled = disabled;
            this.allows = allows;
            this.expects = expects;
        }

        /** Merges class-level and method-level annotations; a method-level FailOnLog wins. */
        static Rules resolve(ExtensionContext context) {
            AnnotatedElement element = context.getElement().orElse(null);
            Class<?> testClass = context.getTestClass().orElse(null);
            FailOnLog fail = element != null ? element.getAnnotation(FailOnLog.class) : null;
            if (fail == null && testClass != null) {
                fail = testClass.getAnnotation(FailOnLog.class);
            }
            return new Rules(
                    fail != null ? fail.level() : LogLevel.WARN,
                    fail != null && fail.disabled(),
                    collect(testClass, element, AllowLog.class, new AllowLog[0]),
                    collect(testClass, element, ExpectLog.class, new ExpectLog[0]));
        }

        private static <A extends java.lang.annotation.Annotation> A[] collect(Class<?> testClass, AnnotatedElement element, Class<A> type, A[] empty) {
            Stream<A> fromClass = testClass != null ? Arrays.stream(testClass.getAnnotationsByType(type)) : Stream.empty();
            Stream<A> fromElement = element != null && element != testClass ? Arrays.stream(element.getAnnotationsByType(type)) : Stream.empty();
            return Stream.concat(fromClass, fromElement).toArray(n -> Arrays.copyOf(empty, n));
        }

        boolean permits(CapturedEvent e) {
            for (AllowLog a : allows) {
                if (matches(e, a.level(), a.loggerPattern(), a.messagePattern())) {
                    return true;
                }
            }
            for (ExpectLog exp : expects) {
                if (matches(e, exp.level(), exp.loggerPattern(), exp.messagePattern())) {
                    return true;
                }
            }
            return false;
        }
    }
}
