package com.whereq.augur.queue;

import com.whereq.augur.config.AugurProperties;
import com.whereq.augur.model.Delivery;
import com.whereq.augur.store.RedisKeys;
import com.whereq.augur.store.RedisScripts;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Reliable Redis queue built from three keys:
 * the pending list, a processing list filled by BRPOPLPUSH, and a sorted set
 * holding the visibility deadline of every in-flight reference.
 *
 * @author WhereQ Inc.
 */
@Slf4j
@Service
public class RedisJobQueue implements JobQueue {

    // BRPOPLPUSH treats 0 as "block forever"
    private static final Duration MIN_BLOCKING_TIMEOUT = Duration.ofSeconds(1);

    private final ReactiveRedisTemplate<String, String> redisTemplate;
    private final RedisKeys keys;
    private final Clock clock;
    private final Duration visibilityTimeout;

    public RedisJobQueue(ReactiveRedisTemplate<String, String> redisTemplate,
                         RedisKeys keys,
                         Clock clock,
                         AugurProperties properties) {
        this.redisTemplate = redisTemplate;
        this.keys = keys;
        this.clock = clock;
        this.visibilityTimeout = properties.getQueue().getVisibilityTimeout();
    }

    @Override
    public Mono<Void> enqueue(String jobId) {
        return redisTemplate.opsForList().leftPush(keys.queue(), jobId)
            .doOnSuccess(size -> log.info("Enqueued job {}, queue size: {}", jobId, size))
            .then();
    }

    @Override
    public Mono<Delivery> dequeue(Duration blockingTimeout) {
        Duration timeout = blockingTimeout.compareTo(MIN_BLOCKING_TIMEOUT) < 0 ? MIN_BLOCKING_TIMEOUT : blockingTimeout;

        return redisTemplate.opsForList()
            .rightPopAndLeftPush(keys.queue(), keys.processing(), timeout)
            .flatMap(jobId -> {
                Instant now = clock.instant();
                Instant visibleAgainAt = now.plus(visibilityTimeout);
                return redisTemplate.opsForZSet()
                    .add(keys.inFlight(), jobId, visibleAgainAt.toEpochMilli())
                    .thenReturn(Delivery.builder()
                        .jobId(jobId)
                        .deliveredAt(now)
                        .visibleAgainAt(visibleAgainAt)
                        .build());
            })
            .doOnNext(delivery -> log.debug("Consumed job {} from queue", delivery.getJobId()));
    }

    @Override
    public Mono<Void> acknowledge(Delivery delivery) {
        return redisTemplate.execute(RedisScripts.QUEUE_ACK,
                List.of(keys.processing(), keys.inFlight()),
                List.of(delivery.getJobId()))
            .next()
            .doOnNext(removed -> {
                if (removed > 0) {
                    log.debug("Acknowledged job {}", delivery.getJobId());
                } else {
                    log.warn("Acknowledged job {} that was no longer in flight", delivery.getJobId());
                }
            })
            .then();
    }

    @Override
    public Mono<Long> requeueExpired() {
        Instant now = clock.instant();

        return redisTemplate.execute(RedisScripts.QUEUE_REQUEUE_EXPIRED,
                List.of(keys.queue(), keys.processing(), keys.inFlight()),
                List.of(String.valueOf(now.toEpochMilli()),
                    String.valueOf(now.plus(visibilityTimeout).toEpochMilli())))
            .next()
            .defaultIfEmpty(0L)
            .doOnNext(count -> {
                if (count > 0) {
                    log.warn("Requeued {} job(s) whose visibility timeout expired", count);
                }
            });
    }

    @Override
    public Mono<Long> size() {
        return redisTemplate.opsForList().size(keys.queue())
            .defaultIfEmpty(0L);
    }
}
