package dev.flows.engine;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class Slf4jFlowEventLoggerTest {

    private final Logger events = (Logger) LoggerFactory.getLogger("dev.flows.events");
    private final ListAppender<ILoggingEvent> appender = new ListAppender<>();
    private Level previousLevel;

    @BeforeEach
    void attach() {
        previousLevel = events.getLevel();
        events.setLevel(Level.INFO);
        appender.start();
        events.addAppender(appender);
    }

    @AfterEach
    void detach() {
        events.detachAppender(appender);
        events.setLevel(previousLevel);
    }

    @Test
    void writesEventNameAndJsonPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("flowRunId", "run-1");
        payload.put("startedAt", Instant.parse("2026-01-02T03:04:05Z"));
        payload.put("took", Duration.ofMillis(1500));

        new Slf4jFlowEventLogger().log("flow.started", payload);

        assertThat(appender.list).singleElement().satisfies(event -> {
            assertThat(event.getLevel()).isEqualTo(Level.INFO);
            assertThat(event.getFormattedMessage()).isEqualTo(
                "flow.started {\"flowRunId\":\"run-1\",\"startedAt\":\"2026-01-02T03:04:05Z\",\"took\":\"PT1.5S\"}");
        });
    }

    @Test
    void failureEventsAreWarnings() {
        new Slf4jFlowEventLogger().log("flow.step.failed", Map.of("error", "boom"));

        assertThat(appender.list).singleElement()
            .satisfies(event -> assertThat(event.getLevel()).isEqualTo(Level.WARN));
    }
}
