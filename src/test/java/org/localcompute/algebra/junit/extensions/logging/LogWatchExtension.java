package org.localcompute.algebra.junit.extensions.logging;

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

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.regex.Pattern;

/**
 * Fails a test when it logs at WARN or above, unless the event is permitted with {@link AllowLog}.
 * The threshold can be moved or switched off per class or method with {@link FailOnLog}.
 */
public class LogWatchExtension implements BeforeAllCallback, BeforeEachCallback, AfterEachCallback, AfterAllCallback {

    private static final ExtensionContext.Namespace NAMESPACE =
            ExtensionContext.Namespace.create(LogWatchExtension.class.getName());
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
        CapturingFilter filter = context.getStore(NAMESPACE).get(FILTER_KEY, CapturingFilter.class);
        if (filter != null) {
            filter.rules = resolveRules(context);
        }
    }

    @Override
    public void afterEach(ExtensionContext context) {
        CapturingFilter filter = context.getStore(NAMESPACE).get(FILTER_KEY, CapturingFilter.class);
        if (filter == null) {
            return;
        }
        Rules rules = resolveRules(context);
        List<String> unexpected = new ArrayList<>();
        if (!rules.disabled()) {
            for (Captured event : filter.events) {
                if (!rules.isAllowed(event)) {
                    unexpected.add(String.format("[%s] %s - %s", event.level(), event.logger(), event.message()));
                }
            }
        }
        filter.events.clear();
        if (!unexpected.isEmpty()) {
            throw new AssertionError("Unexpected logs:\n  " + String.join("\n  ", unexpected));
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

    private static Rules resolveRules(ExtensionContext context) {
        FailOnLog fail = context.getElement().map(el -> el.getAnnotation(FailOnLog.class))
                .orElse(context.getTestClass().map(c -> c.getAnnotation(FailOnLog.class)).orElse(null));
        List<AllowLog> allows = new ArrayList<>();
        context.getTestClass().ifPresent(c -> allows.addAll(List.of(c.getAnnotationsByType(AllowLog.class))));
        context.getTestMethod().ifPresent(m -> allows.addAll(List.of(m.getAnnotationsByType(AllowLog.class))));
        return new Rules(fail != null ? fail.level() : LogLevel.WARN, fail != null && fail.disabled(), allows);
    }

    private static Level toLogback(LogLevel level) {
        return switch (level) {
            case INFO -> Level.INFO;
            case WARN -> Level.WARN;
            case ERROR -> Level.ERROR;
        };
    }

    private record Captured(String logger, Level level, String message) {
    }

    private record Rules(LogLevel minLevel, boolean disabled, List<AllowLog> allows) {

        boolean isAllowed(Captured event) {
            for (AllowLog allow : allows) {
                if (event.level().isGreaterOrEqual(toLogback(allow.level()))
                        && Pattern.matches(allow.loggerPattern(), event.logger())
                        && Pattern.matches(allow.messagePattern(), event.message())) {
                    return true;
                }
            }
            return false;
        }
    }

    private static final class CapturingFilter extends TurboFilter {

        private final List<Captured> events = new CopyOnWriteArrayList<>();
        private volatile Rules rules;

        CapturingFilter(Rules rules) {
            this.rules = rules;
        }

        @Override
        public FilterReply decide(Marker marker, ch.qos.logback.classic.Logger logger, Level level,
                                  String format, Object[] params, Throwable t) {
            Rules current = rules;
            if (!level.isGreaterOrEqual(toLogback(current.minLevel()))) {
                return FilterReply.NEUTRAL;
            }
            String message = format == null ? "" : MessageFormatter.arrayFormat(format, params).getMessage();
            Captured event = new Captured(logger.getName(), level, message);
            events.add(event);
            // allowed events are kept out of the console
            return current.isAllowed(event) ? FilterReply.DENY : FilterReply.NEUTRAL;
        }
    }
}
