package ai.docsite.bridge.logging;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.LoggingEvent;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SimpleJsonLayoutTest {

    @Test
    void formatsEventAsJson() {
        LoggerContext context = new LoggerContext();
        context.start();
        SimpleJsonLayout layout = new SimpleJsonLayout();
        layout.setContext(context);
        layout.start();
        LoggingEvent event = new LoggingEvent();
        event.setLevel(Level.WARN);
        event.setLoggerName("test.logger");
        event.setMessage("section \"overview\" drifted");
        event.setThreadName("main");
        event.setTimeStamp(0L);
        event.setLoggerContext(context);
        event.setMDCPropertyMap(Map.of("section", "overview", "command", "repair", "level", "ignored"));

        String json = layout.doLayout(event);

        assertThat(json).startsWith("{\"timestamp\":\"1970-01-01T00:00:00Z\"");
        assertThat(json).contains("\"level\":\"WARN\"");
        assertThat(json).contains("\"logger\":\"test.logger\"");
        assertThat(json).contains("\"message\":\"section \\\"overview\\\" drifted\"");
        assertThat(json).contains("\"command\":\"repair\",\"section\":\"overview\"");
        assertThat(json).doesNotContain("ignored");
        assertThat(json).endsWith("}\n");
    }
}
