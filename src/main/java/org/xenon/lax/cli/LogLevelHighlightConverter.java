package org.xenon.lax.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.pattern.CompositeConverter;

/**
 * Logback converter coloring the level of console log lines.
 *
 * <p>ERROR is bold red (stage failures), WARN yellow, INFO blue (stage progress) and
 * DEBUG dim (per-group pass counts, pruning detail). TRACE is left uncolored.
 * Setting the {@code NO_COLOR} environment variable disables all coloring.
 */
public class LogLevelHighlightConverter extends CompositeConverter<ILoggingEvent> {

    static final String ANSI_RESET = "\u001B[0m";
    static final String ANSI_BOLD_RED = "\u001B[1;31m";
    static final String ANSI_YELLOW = "\u001B[33m";
    static final String ANSI_BLUE = "\u001B[34m";
    static final String ANSI_DIM = "\u001B[2m";

    private final boolean enabled;

    public LogLevelHighlightConverter() {
        this(System.getenv("NO_COLOR") == null);
    }

    LogLevelHighlightConverter(boolean enabled) {
        this.enabled = enabled;
    }

    @Override
    protected String transform(ILoggingEvent event, String in) {
        if (!enabled) {
            return in;
        }
        String color = colorFor(event.getLevel());
        return color == null ? in : color + in + ANSI_RESET;
    }

    /**
     * @return the ANSI prefix for the level, or {@code null} when the level stays uncolored
     */
    static String colorFor(Level level) {
        return switch (level.toInt()) {
            case Level.ERROR_INT -> ANSI_BOLD_RED;
            case Level.WARN_INT -> ANSI_YELLOW;
            case Level.INFO_INT -> ANSI_BLUE;
            case Level.DEBUG_INT -> ANSI_DIM;
            default -> null;
        };
    }
}
