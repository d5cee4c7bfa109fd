package org.optiroute.routing.event;

/**
 * Event-notification collaborator.
 *
 * <p>Publishing is best effort for the engine: a thrown exception is logged and reported as a
 * warning, never as a failed run.</p>
 */
public interface EventSink {

    void publish(String eventName, Object payload);
}
