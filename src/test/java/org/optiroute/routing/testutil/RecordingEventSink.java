package org.optiroute.routing.testutil;

import org.optiroute.routing.event.EventSink;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Sink that keeps every published event.
 */
public final class RecordingEventSink implements EventSink {
    private final List<Published> events = new CopyOnWriteArrayList<>();

    @Override
    public void publish(String eventName, Object payload) {
        events.add(new Published(eventName, payload));
    }

    public List<Published> events() {
        return List.copyOf(events);
    }

    public record Published(String name, Object payload) {
    }
}
