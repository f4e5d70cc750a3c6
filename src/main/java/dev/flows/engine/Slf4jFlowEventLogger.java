package dev.flows.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Writes each flow event as one line on the {@code dev.flows.events} logger, payload as JSON.
 * Events ending in {@code .failed} are logged at WARN, everything else at INFO.
 */
public final class Slf4jFlowEventLogger implements FlowEventLogger {

    private static final Logger log = LoggerFactory.getLogger("dev.flows.events");

    private final ObjectMapper mapper = new ObjectMapper()
        .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
        .registerModule(new SimpleModule()
            .addSerializer(Instant.class, ToStringSerializer.instance)
            .addSerializer(Duration.class, ToStringSerializer.instance));

    @Override
    public void log(String event, Map<String, Object> payload) {
        boolean warn = event.endsWith(".failed");
        if (warn ? !log.isWarnEnabled() : !log.isInfoEnabled()) {
            return;
        }
        String body = render(payload);
        if (warn) {
            log.warn("{} {}", event, body);
        } else {
            log.info("{} {}", event, body);
        }
    }

    private String render(Map<String, Object> payload) {
        try {
            return mapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            return String.valueOf(payload);
        }
    }
}
