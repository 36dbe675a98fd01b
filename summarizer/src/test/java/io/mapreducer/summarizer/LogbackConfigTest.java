package io.mapreducer.summarizer;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import org.junit.jupiter.api.Test;

import java.net.URL;

import static org.junit.jupiter.api.Assertions.*;

public class LogbackConfigTest {
    @Test
    void root_level_follows_the_log_level_variable() throws Exception {
        URL config = getClass().getResource("/logback.xml");
        assertNotNull(config);
        LoggerContext ctx = new LoggerContext();
        try {
            JoranConfigurator configurator = new JoranConfigurator();
            configurator.setContext(ctx);
            configurator.doConfigure(config);

            String env = System.getenv("MAPREDUCER_LOG_LEVEL");
            Level expected = Level.toLevel(env == null || env.isEmpty() ? "INFO" : env, Level.DEBUG);
            Logger root = ctx.getLogger(Logger.ROOT_LOGGER_NAME);
            assertEquals(expected, root.getLevel());
            assertEquals(expected, ctx.getLogger(SummarizeMain.class).getEffectiveLevel());
        } finally {
            ctx.stop();
        }
    }
}
