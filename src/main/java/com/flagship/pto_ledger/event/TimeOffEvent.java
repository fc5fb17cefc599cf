package com.flagship.pto_ledger.event;

import java.time.Instant;
import java.util.UUID;

/**
 * A fact about a balance or a request, published through the outbox.
 */
public interface TimeOffEvent {

    /**
     * Unique per event instance; consumers deduplicate on it.
     */
    UUID getEventId();

    /**
     * The request or balance-affecting record the event is about. Used as the Kafka key.
     */
    UUID getAggregateId();

    String getEventType();

    Instant getOccurredAt();
}
