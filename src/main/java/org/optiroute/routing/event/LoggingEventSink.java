package org.optiroute.routing.event;

import lombok.extern.slf4j.Slf4j;

/**
 * Sink that writes each event to the log at INFO.
 */
@Slf4j
public final class LoggingEventSink implements EventSink {

    @Override
    public void publish(String eventName, Object payload) {
        log.info("event {}: {}", eventName, payload);
    }
}
