package com.koni.mobility.application.port;

import com.koni.mobility.domain.event.IngestionCompleted;

/**
 * Port for publishing ingestion events to the event bus.
 * Implementations never fail the caller: a lost notification only delays the
 * refresh of derived views.
 */
public interface EventPublisher {

    void publish(IngestionCompleted event);
}
