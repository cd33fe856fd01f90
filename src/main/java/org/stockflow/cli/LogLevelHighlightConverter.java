package org.stockflow.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.pattern.CompositeConverter;

import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Colors the level column of console log lines. Registered in {@code logback.xml} as
 * {@code %highlightLevel}. Setting the {@code NO_COLOR} environment variable to any
 * non-empty value turns coloring off.
 */
public class LogLevelHighlightConverter extends CompositeConverter<ILoggingEvent> {

    static final String ANSI_RESET = "\u001B[0m";
    static final String ANSI_RED = "\u001B[31m";
    static final String ANSI_YELLOW = "\u001B[33m";
    static final String ANSI_CYAN = "\u001B[36m";
    static final String ANSI_DIM = "\u001B[2m";

    static final String NO_COLOR = "NO_COLOR";

    private static final Map<Level, String> PALETTE = Map.of(
            Level.ERROR, ANSI_RED,
            Level.WARN, ANSI_YELLOW,
            Level.INFO, ANSI_CYAN,
            Level.DEBUG, ANSI_DIM);

    private final UnaryOperator<String> environment;
    private boolean colored = true;

    public LogLevelHighlightConverter() {
        this(System::getenv);
    }

    LogLevelHighlightConverter(UnaryOperator<String> environment) {
        this.environment = environment;
    }

    @Override
    public void start() {
        String noColor = environment.apply(NO_COLOR);
        colored = noColor == null || noColor.isEmpty();
        super.start();
    }

    @Override
    protected String transform(ILoggingEvent event, String in) {
        return colored ? highlight(event.getLevel(), in) : in;
    }

    boolean isColored() {
        return colored;
    }

    /**
     * Wraps {@code in} in the color of {@code level}. TRACE stays uncolored.
     */
    static String highlight(Level level, String in) {
        String color = PALETTE.get(level);
        return color != null ? color + in + ANSI_RESET : in;
    }
}
