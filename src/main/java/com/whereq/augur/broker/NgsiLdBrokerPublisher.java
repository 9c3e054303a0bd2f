package com.whereq.augur.broker;

import com.fasterxml.jackson.databind.JsonNode;
import com.whereq.augur.config.AugurProperties;
import com.whereq.augur.exception.BrokerWriteException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.io.IOException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Publishes predictions to an NGSI-LD context broker such as Orion-LD.
 *
 * Each attempt reads the stored {@code generatedAt} first and only upserts when its own
 * generation is newer, so redelivered or out-of-order jobs never roll the entity back.
 *
 * @author WhereQ Inc.
 */
@Slf4j
@Service
public class NgsiLdBrokerPublisher implements BrokerPublisher {

    static final String ENTITIES_PATH = "/ngsi-ld/v1/entities/{id}";
    static final String UPSERT_PATH = "/ngsi-ld/v1/entityOperations/upsert";

    static final String TENANT_HEADER = "NGSILD-Tenant";
    static final String FIWARE_SERVICE_HEADER = "Fiware-Service";
    static final String FIWARE_SERVICE_PATH_HEADER = "Fiware-ServicePath";

    private static final MediaType LD_JSON = MediaType.parseMediaType("application/ld+json");

    private final WebClient webClient;
    private final GenerationClock generationClock;
    private final AugurProperties.BrokerConfig config;
    private final Counter writtenCounter;
    private final Counter skippedCounter;
    private final Counter failedCounter;

    public NgsiLdBrokerPublisher(@Qualifier("brokerWebClient") WebClient webClient,
                                 GenerationClock generationClock,
                                 AugurProperties properties,
                                 MeterRegistry meterRegistry) {
        this.webClient = webClient;
        this.generationClock = generationClock;
        this.config = properties.getBroker();
        this.writtenCounter = writes(meterRegistry, "written");
        this.skippedCounter = writes(meterRegistry, "skipped_stale");
        this.failedCounter = writes(meterRegistry, "failed");
    }

    @Override
    public Mono<PublishAck> publish(Prediction prediction) {
        String entityId = PredictionEntities.entityId(
            prediction.getTenantId(), prediction.getEntityRef(), prediction.getAttribute());
        AtomicInteger attempts = new AtomicInteger();
        AtomicReference<Instant> lastStamp = new AtomicReference<>();

        return Mono.defer(() -> {
                int attempt = attempts.incrementAndGet();
                Instant stamp = attempt == 1 && prediction.getGeneratedAt() != null
                    ? prediction.getGeneratedAt()
                    : generationClock.nextAfter(lastStamp.get() != null ? lastStamp.get() : Instant.EPOCH);
                lastStamp.set(stamp);
                return attempt(entityId, prediction, stamp, attempt);
            })
            .retryWhen(Retry.backoff(config.getMaxRetries(), config.getInitialBackoff())
                .maxBackoff(config.getMaxBackoff())
                .filter(NgsiLdBrokerPublisher::isTransient)
                .doBeforeRetry(signal -> log.warn("Broker write of {} failed (attempt {}), retrying: {}",
                    entityId, signal.totalRetries() + 1, signal.failure().getMessage()))
                .onRetryExhaustedThrow((spec, signal) -> new BrokerWriteException(
                    "Broker write of " + entityId + " failed after " + (signal.totalRetries() + 1)
                        + " attempts: " + signal.failure().getMessage(), signal.failure())))
            .onErrorMap(e -> !(e instanceof BrokerWriteException),
                e -> new BrokerWriteException("Broker rejected " + entityId + ": " + e.getMessage(), e))
            .doOnNext(ack -> {
                if (ack.getOutcome() == PublishAck.Outcome.WRITTEN) {
                    writtenCounter.increment();
                    log.info("Upserted {} for tenant {} (generatedAt={}, attempts={})",
                        entityId, prediction.getTenantId(), ack.getGeneratedAt(), ack.getAttempts());
                } else {
                    skippedCounter.increment();
                    log.info("Skipped {} for tenant {}: broker already holds a newer generation",
                        entityId, prediction.getTenantId());
                }
            })
            .doOnError(e -> {
                failedCounter.increment();
                log.error("Failed to publish {} for tenant {}: {}", entityId, prediction.getTenantId(), e.getMessage());
            });
    }

    private Mono<PublishAck> attempt(String entityId, Prediction prediction, Instant stamp, int attempt) {
        return readGeneratedAt(entityId, prediction.getTenantId())
            .filter(existing -> !existing.isBefore(stamp))
            .map(existing -> PublishAck.builder()
                .entityId(entityId)
                .generatedAt(existing)
                .outcome(PublishAck.Outcome.SKIPPED_STALE)
                .attempts(attempt)
                .build())
            .switchIfEmpty(Mono.defer(() -> upsert(entityId, prediction, stamp)
                .thenReturn(PublishAck.builder()
                    .entityId(entityId)
                    .generatedAt(stamp)
                    .outcome(PublishAck.Outcome.WRITTEN)
                    .attempts(attempt)
                    .build())))
            .timeout(config.getRequestTimeout());
    }

    /**
     * Generation timestamp stored in the broker, empty if the entity does not exist
     */
    Mono<Instant> readGeneratedAt(String entityId, String tenantId) {
        return webClient.get()
            .uri(uriBuilder -> uriBuilder.path(ENTITIES_PATH)
                .queryParam("attrs", PredictionEntities.GENERATED_AT)
                .build(entityId))
            .headers(headers -> tenantHeaders(headers, tenantId))
            .header(HttpHeaders.LINK, contextLink())
            .accept(MediaType.APPLICATION_JSON)
            .exchangeToMono(response -> {
                if (response.statusCode().value() == HttpStatus.NOT_FOUND.value()) {
                    return response.releaseBody().then(Mono.<JsonNode>empty());
                }
                if (response.statusCode().is2xxSuccessful()) {
                    return response.bodyToMono(JsonNode.class);
                }
                return response.createException().flatMap(e -> Mono.<JsonNode>error(e));
            })
            .flatMap(body -> Mono.justOrEmpty(parseGeneratedAt(entityId, body)));
    }

    private Mono<Void> upsert(String entityId, Prediction prediction, Instant stamp) {
        Map<String, Object> entity = PredictionEntities.toEntity(entityId, prediction, stamp, config.getContextUrl());

        return webClient.post()
            .uri(uriBuilder -> uriBuilder.path(UPSERT_PATH)
                .queryParam("options", "replace")
                .build())
            .headers(headers -> tenantHeaders(headers, prediction.getTenantId()))
            .contentType(LD_JSON)
            .bodyValue(List.of(entity))
            .exchangeToMono(response -> {
                if (response.statusCode().value() == HttpStatus.MULTI_STATUS.value()) {
                    return response.bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .flatMap(body -> Mono.<Void>error(new BrokerWriteException(
                            "Broker reported a partial failure for " + entityId + ": " + body)));
                }
                if (response.statusCode().is2xxSuccessful()) {
                    return response.releaseBody();
                }
                return response.createException().flatMap(e -> Mono.<Void>error(e));
            });
    }

    private static Instant parseGeneratedAt(String entityId, JsonNode body) {
        JsonNode value = body.path(PredictionEntities.GENERATED_AT).path("value");
        String text = value.isObject() ? value.path("@value").asText(null) : value.asText(null);
        if (text == null || text.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException e) {
            log.warn("Ignoring unparseable generatedAt '{}' on {}", text, entityId);
            return null;
        }
    }

    private static void tenantHeaders(HttpHeaders headers, String tenantId) {
        headers.set(TENANT_HEADER, tenantId);
        headers.set(FIWARE_SERVICE_HEADER, tenantId);
        headers.set(FIWARE_SERVICE_PATH_HEADER, "/");
    }

    private String contextLink() {
        return "<" + config.getContextUrl() + ">; rel=\"http://www.w3.org/ns/json-ld#context\"; type=\"application/ld+json\"";
    }

    static boolean isTransient(Throwable error) {
        if (error instanceof WebClientResponseException responseException) {
            return responseException.getStatusCode().is5xxServerError()
                || responseException.getStatusCode().value() == HttpStatus.TOO_MANY_REQUESTS.value();
        }
        return error instanceof WebClientRequestException
            || error instanceof TimeoutException
            || error instanceof IOException;
    }

    private static Counter writes(MeterRegistry meterRegistry, String outcome) {
        return Counter.builder("augur.broker.writes")
            .description("Prediction entity publications by outcome")
            .tag("outcome", outcome)
            .register(meterRegistry);
    }
}
