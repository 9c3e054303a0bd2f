package com.whereq.augur.broker;

import reactor.core.publisher.Mono;

/**
 * Writes predictions into the shared context broker
 */
public interface BrokerPublisher {
    /**
     * Upsert the Prediction entity keyed by (tenant, entity, attribute).
     * Publishing again for the same key replaces the entity when the new generation is newer
     * and is an acknowledged no-op otherwise.
     *
     * @param prediction the forecast to publish
     * @return Mono with the acknowledgement, or an error of {@code BrokerWriteException}
     *         once retries are exhausted or the broker rejects the entity
     */
    Mono<PublishAck> publish(Prediction prediction);
}
