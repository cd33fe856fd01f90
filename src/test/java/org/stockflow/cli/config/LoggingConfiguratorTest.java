package org.stockflow.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class LoggingConfiguratorTest {

    private final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

    @AfterEach
    void tearDown() {
        context.getLogger("org.stockflow.runtime").setLevel(null);
        context.getLogger("org.stockflow.compiler").setLevel(null);
    }

    @Test
    void appliesQuotedAndUnquotedLoggerNames() {
        Config config = ConfigFactory.parseString(
                "stockflow.logging.levels { \"org.stockflow.runtime\" = DEBUG, org.stockflow.compiler = ERROR }");

        LoggingConfigurator.configure(config);

        Logger runtime = context.getLogger("org.stockflow.runtime");
        Logger compiler = context.getLogger("org.stockflow.compiler");
        assertThat(runtime.getLevel()).isEqualTo(Level.DEBUG);
        assertThat(compiler.getLevel()).isEqualTo(Level.ERROR);
    }

    @Test
    void ignoresMissingLevels() {
        LoggingConfigurator.configure(ConfigFactory.empty());

        assertThat(context.getLogger("org.stockflow.runtime").getLevel()).isNull();
    }
}
