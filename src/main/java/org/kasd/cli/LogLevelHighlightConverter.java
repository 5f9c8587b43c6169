package org.kasd.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.pattern.CompositeConverter;
import org.kasd.compiler.diagnostics.AnsiColor;

import java.util.Map;

/**
 * Logback converter behind {@code %highlightLevel(...)} in logback.xml. Errors use the same red
 * as rendered diagnostics, so a failed run reads consistently on stderr. TRACE is dimmed and
 * levels without a colour are passed through unchanged.
 */
public class LogLevelHighlightConverter extends CompositeConverter<ILoggingEvent> {

    private static final Map<Integer, AnsiColor> COLORS = Map.of(
            Level.ERROR_INT, AnsiColor.RED,
            Level.WARN_INT, AnsiColor.YELLOW,
            Level.INFO_INT, AnsiColor.GREEN,
            Level.DEBUG_INT, AnsiColor.BLUE,
            Level.TRACE_INT, AnsiColor.GRAY
    );

    @Override
    protected String transform(ILoggingEvent event, String in) {
        AnsiColor color = COLORS.get(event.getLevel().toInt());
        return color == null ? in : color.wrap(in);
    }
}
