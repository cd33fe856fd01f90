package org.stockflow.cli;

import ch.qos.logback.classic.Level;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class LogLevelHighlightConverterTest {

    @Test
    void colorsLevelsAndLeavesTraceUntouched() {
        assertThat(LogLevelHighlightConverter.highlight(Level.ERROR, "ERROR"))
                .isEqualTo(LogLevelHighlightConverter.ANSI_RED + "ERROR" + LogLevelHighlightConverter.ANSI_RESET);
        assertThat(LogLevelHighlightConverter.highlight(Level.WARN, "WARN"))
                .startsWith(LogLevelHighlightConverter.ANSI_YELLOW);
        assertThat(LogLevelHighlightConverter.highlight(Level.DEBUG, "DEBUG"))
                .startsWith(LogLevelHighlightConverter.ANSI_DIM);
        assertThat(LogLevelHighlightConverter.highlight(Level.TRACE, "TRACE")).isEqualTo("TRACE");
    }

    @Test
    void noColorVariableTurnsColoringOff() {
        LogLevelHighlightConverter converter = new LogLevelHighlightConverter(name -> "1");
        converter.start();

        assertThat(converter.isColored()).isFalse();
    }

    @Test
    void emptyOrMissingNoColorKeepsColoring() {
        LogLevelHighlightConverter missing = new LogLevelHighlightConverter(name -> null);
        missing.start();
        LogLevelHighlightConverter empty = new LogLevelHighlightConverter(name -> "");
        empty.start();

        assertThat(missing.isColored()).isTrue();
        assertThat(empty.isColored()).isTrue();
    }
}
