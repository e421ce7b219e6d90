package org.shellsafe.junit.extensions.logging;

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
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Fails a test that logs at WARN or above unless the event was announced with {@link ExpectLog},
 * and fails it when an announced event did not occur. Announced events are swallowed so they do
 * not clutter the build output.
 */
public class LogWatchExtension implements BeforeAllCallback, BeforeEachCallback, AfterEachCallback, AfterAllCallback {

    private static final ExtensionContext.Namespace NAMESPACE = ExtensionContext.Namespace.create(LogWatchExtension.class);
    private static final String FILTER_KEY = "filter";

    @Override
    public void beforeAll(ExtensionContext context) {
        CapturingFilter filter = new CapturingFilter(resolveRules(context));
        filter.start();
        loggerContext().addTurboFilter(filter);
        context.getStore(NAMESPACE).put(FILTER_KEY, filter);
    }

    @Override
    public void beforeEach(ExtensionContext context) {
        CapturingFilter filter = filter(context);
        if (filter != null) {
            filter.clear();
            filter.rules = resolveRules(context);
        }
    }

    @Override
    public void afterEach(ExtensionContext context) {
        CapturingFilter filter = filter(context);
        if (filter == null) {
            return;
        }
        Rules rules = filter.rules;
        List<CapturedEvent> events = filter.events();
        filter.clear();

        List<String> problems = new ArrayList<>();
        for (CapturedEvent event : events) {
            if (event.level().isGreaterOrEqual(Level.WARN) && !rules.announces(event)) {
                problems.add("Unexpected log: " + event);
            }
        }
        for (Expectation expectation : rules.expected()) {
            long count = events.stream().filter(expectation.pattern()::matches).count();
            if (count < expectation.occurrences()) {
                problems.add("Missing log: expected " + expectation.occurrences() + " x " + expectation.pattern() + ", found " + count);
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

    private static CapturingFilter filter(ExtensionContext context) {
        return context.getStore(NAMESPACE).get(FILTER_KEY, CapturingFilter.class);
    }

    private static LoggerContext loggerContext() {
        return (LoggerContext) LoggerFactory.getILoggerFactory();
    }

    /**
     * Collects the {@link ExpectLog} announcements of the test class and, for a test method, of the method.
     */
    private static Rules resolveRules(ExtensionContext context) {
        Function<AnnotatedElement, ExpectLog[]> lookup = element -> element.getAnnotationsByType(ExpectLog.class);
        List<ExpectLog> announcements = new ArrayList<>();
        context.getTestClass().ifPresent(c -> announcements.addAll(List.of(lookup.apply(c))));
        context.getTestMethod().ifPresent(m -> announcements.addAll(List.of(lookup.apply(m))));

        List<Expectation> expected = new ArrayList<>();
        for (ExpectLog expect : announcements) {
            expected.add(new Expectation(new LogPattern(expect.level(), expect.loggerPattern(), expect.messagePattern()),
                    expect.occurrences()));
        }
        return new Rules(expected);
    }

    private static Level toLogback(LogLevel level) {
        return switch (level) {
            case INFO -> Level.INFO;
            case WARN -> Level.WARN;
            case ERROR -> Level.ERROR;
        };
    }

    private record CapturedEvent(String loggerName, Level level, String message) {
        @Override
        public String toString() {
            return "[" + level + "] " + loggerName + " - " + message;
        }
    }

    private record LogPattern(LogLevel level, String logger, String message) {
        boolean matches(CapturedEvent event) {
            return event.level().isGreaterOrEqual(toLogback(level))
                    && Pattern.matches(logger, event.loggerName())
                    && Pattern.matches(message, event.message());
        }

        @Override
        public String toString() {
            return "[" + level + "] logger=\"" + logger + "\" message=\"" + message + "\"";
        }
    }

    private record Expectation(LogPattern pattern, int occurrences) {}

    private record Rules(List<Expectation> expected) {
        boolean announces(CapturedEvent event) {
            return expected.stream().anyMatch(e -> e.pattern().matches(event));
        }
    }

    /**
     * Records every event at INFO or above and denies the announced ones.
     */
    private static final class CapturingFilter extends TurboFilter {
        private final List<CapturedEvent> events = new CopyOnWriteArrayList<>();
        private volatile Rules rules;

        CapturingFilter(Rules rules) {
            this.rules = rules;
        }

        @Override
        public FilterReply decide(Marker marker, ch.qos.logback.classic.Logger logger, Level level, String format,
                                  Object[] params, Throwable t) {
            Rules current = rules;
            if (format == null || !level.isGreaterOrEqual(Level.INFO)) {
                return FilterReply.NEUTRAL;
            }
            CapturedEvent event = new CapturedEvent(logger.getName(), level, MessageFormatter.arrayFormat(format, params).getMessage());
            events.add(event);
            return current.announces(event) ? FilterReply.DENY : FilterReply.NEUTRAL;
        }

        List<CapturedEvent> events() {
            return List.copyOf(events);
        }

        void clear() {
            events.clear();
        }
    }
}
