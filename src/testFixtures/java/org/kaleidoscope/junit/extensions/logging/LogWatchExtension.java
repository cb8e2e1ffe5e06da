package org.kaleidoscope.junit.extensions.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.turbo.TurboFilter;
import ch.qos.logback.core.spi.FilterReply;
import org.junit.jupiter.api.extension.AfterEachCallback;
import org.junit.jupiter.api.extension.BeforeEachCallback;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.slf4j.LoggerFactory;
import org.slf4j.Marker;
import org.slf4j.helpers.MessageFormatter;

import java.lang.reflect.AnnotatedElement;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.regex.Pattern;

/**
 * Watches the Logback context while a test runs. The test fails if an event at or above the
 * {@link FailOnLog} level (WARN by default) is neither allowed by {@link AllowLog} nor expected by
 * {@link ExpectLog}, or if an {@link ExpectLog} is not matched exactly its number of times. Allowed
 * and expected events are kept out of the console.
 */
public class LogWatchExtension implements BeforeEachCallback, AfterEachCallback {

    private static final ExtensionContext.Namespace NAMESPACE = ExtensionContext.Namespace.create(LogWatchExtension.class);
    private static final String FILTER_KEY = "filter";

    @Override
    public void beforeEach(ExtensionContext context) {
        WatchingTurboFilter filter = new WatchingTurboFilter(resolveRules(context));
        filter.start();
        loggerContext().addTurboFilter(filter);
        context.getStore(NAMESPACE).put(FILTER_KEY, filter);
    }

    @Override
    public void afterEach(ExtensionContext context) {
        WatchingTurboFilter filter = context.getStore(NAMESPACE).remove(FILTER_KEY, WatchingTurboFilter.class);
        if (filter == null) {
            return;
        }
        loggerContext().getTurboFilterList().remove(filter);
        filter.stop();

        Rules rules = filter.rules;
        List<String> problems = new ArrayList<>();
        if (!rules.disabled) {
            for (CapturedEvent event : filter.events) {
                if (!rules.isAllowed(event) && !rules.isExpected(event)) {
                    problems.add("Unexpected log: " + event);
                }
            }
        }
        for (ExpectLog expect : rules.expects) {
            long count = filter.events.stream().filter(e -> Rules.matchesExactly(e, expect)).count();
            if (count != expect.occurrences()) {
                problems.add(String.format("Expected %d x [%s] logger=\"%s\" message=\"%s\", but found %d.",
                        expect.occurrences(), expect.level(), expect.loggerPattern(), expect.messagePattern(), count));
            }
        }
        if (!problems.isEmpty()) {
            throw new AssertionError(String.join("\n", problems));
        }
    }

    private static LoggerContext loggerContext() {
        return (LoggerContext) LoggerFactory.getILoggerFactory();
    }

    private static Rules resolveRules(ExtensionContext context) {
        AnnotatedElement method = context.getRequiredTestMethod();
        Class<?> testClass = context.getRequiredTestClass();

        FailOnLog fail = method.getAnnotation(FailOnLog.class);
        if (fail == null) {
            fail = testClass.getAnnotation(FailOnLog.class);
        }
        List<AllowLog> allows = new ArrayList<>(List.of(testClass.getAnnotationsByType(AllowLog.class)));
        allows.addAll(List.of(method.getAnnotationsByType(AllowLog.class)));
        List<ExpectLog> expects = new ArrayList<>(List.of(testClass.getAnnotationsByType(ExpectLog.class)));
        expects.addAll(List.of(method.getAnnotationsByType(ExpectLog.class)));

        LogLevel minLevel = fail != null ? fail.level() : LogLevel.WARN;
        boolean disabled = fail != null && fail.disabled();
        return new Rules(minLevel, disabled, allows, expects);
    }

    private static Level toLogback(LogLevel level) {
        return switch (level) {
            case INFO -> Level.INFO;
            case WARN -> Level.WARN;
            case ERROR -> Level.ERROR;
        };
    }

    private record Rules(LogLevel minLevel, boolean disabled, List<AllowLog> allows, List<ExpectLog> expects) {

        boolean watches(Level level) {
            if (level.isGreaterOrEqual(toLogback(minLevel))) return true;
            // Expectations below the failing threshold must still be seen.
            return expects.stream().anyMatch(e -> level.isGreaterOrEqual(toLogback(e.level())));
        }

        boolean isAllowed(CapturedEvent event) {
            if (!event.level.isGreaterOrEqual(toLogback(minLevel))) return true;
            return allows.stream().anyMatch(a -> matches(event, a.level(), a.loggerPattern(), a.messagePattern()));
        }

        boolean isExpected(CapturedEvent event) {
            return expects.stream().anyMatch(e -> matchesExactly(event, e));
        }

        static boolean matches(CapturedEvent event, LogLevel level, String loggerPattern, String messagePattern) {
            return event.level.isGreaterOrEqual(toLogback(level))
                    && Pattern.matches(loggerPattern, event.loggerName)
                    && Pattern.matches(messagePattern, event.message);
        }

        // Expectations count events at their own level only.
        static boolean matchesExactly(CapturedEvent event, ExpectLog expect) {
            return event.level.toInt() == toLogback(expect.level()).toInt()
                    && Pattern.matches(expect.loggerPattern(), event.loggerName)
                    && Pattern.matches(expect.messagePattern(), event.message);
        }
    }

    private record CapturedEvent(String loggerName, Level level, String message) {
        @Override
        public String toString() {
            return String.format("[%s] %s - %s", level, loggerName, message);
        }
    }

    private static class WatchingTurboFilter extends TurboFilter {
        private final Rules rules;
        private final List<CapturedEvent> events = new CopyOnWriteArrayList<>();

        WatchingTurboFilter(Rules rules) {
            this.rules = rules;
        }

        @Override
        public FilterReply decide(Marker marker, ch.qos.logback.classic.Logger logger, Level level, String format, Object[] params, Throwable t) {
            // isXxxEnabled() checks arrive without a format.
            if (format == null || !rules.watches(level)) {
                return FilterReply.NEUTRAL;
            }
            CapturedEvent event = new CapturedEvent(logger.getName(), level,
                    MessageFormatter.arrayFormat(format, params).getMessage());
            events.add(event);
            if (rules.isExpected(event) || (rules.isAllowed(event) && event.level.isGreaterOrEqual(toLogback(rules.minLevel)))) {
                return FilterReply.DENY;
            }
            return FilterReply.NEUTRAL;
        }
    }
}
