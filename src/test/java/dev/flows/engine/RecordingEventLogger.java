package dev.flows.engine;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Collects emitted events in order for assertions.
 */
final class RecordingEventLogger implements FlowEventLogger {

    record Event(String name, Map<String, Object> payload) {}

    private final List<Event> events = new CopyOnWriteArrayList<>();

    @Override
    public void log(String event, Map<String, Object> payload) {
        events.add(new Event(event, Map.copyOf(payload)));
    }

    List<Event> events() {
        return events;
    }

    List<String> names() {
        return events.stream().map(Event::name).toList();
    }

    List<Event> named(String name) {
        return events.stream().filter(e -> e.name().equals(name)).toList();
    }
}
