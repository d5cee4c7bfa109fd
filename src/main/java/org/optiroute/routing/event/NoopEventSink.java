package org.optiroute.routing.event;

/**
 * Sink that drops every event.
 */
public final class NoopEventSink implements EventSink {
    public static final NoopEventSink INSTANCE = new NoopEventSink();

    private NoopEventSink() {
    }

    @Override
    public void publish(String eventName, Object payload) {
        // dropped
    }
}
