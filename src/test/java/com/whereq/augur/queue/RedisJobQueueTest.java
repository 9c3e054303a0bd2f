package com.whereq.augur.queue;

import com.whereq.augur.config.AugurProperties;
import com.whereq.augur.model.Delivery;
import com.whereq.augur.store.RedisKeys;
import com.whereq.augur.store.RedisScripts;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.ReactiveListOperations;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.core.ReactiveZSetOperations;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RedisJobQueueTest {

    private static final Instant NOW = Instant.parse("2025-06-01T08:00:00Z");

    @Mock
    private ReactiveRedisTemplate<String, String> redisTemplate;

    @Mock
    private ReactiveListOperations<String, String> listOperations;

    @Mock
    private ReactiveZSetOperations<String, String> zSetOperations;

    private RedisJobQueue queue;

    @BeforeEach
    void setUp() {
        AugurProperties properties = new AugurProperties();
        properties.getQueue().setVisibilityTimeout(Duration.ofMinutes(5));
        queue = new RedisJobQueue(redisTemplate, new RedisKeys("intelligence"), Clock.fixed(NOW, ZoneOffset.UTC), properties);
    }

    @Test
    void testDequeue_RecordsVisibilityDeadline() {
        when(redisTemplate.opsForList()).thenReturn(listOperations);
        when(redisTemplate.opsForZSet()).thenReturn(zSetOperations);
        when(listOperations.rightPopAndLeftPush("intelligence:queue", "intelligence:queue:processing", Duration.ofSeconds(5)))
            .thenReturn(Mono.just("job-1"));
        when(zSetOperations.add(anyString(), anyString(), anyDouble())).thenReturn(Mono.just(true));

        Delivery delivery = queue.dequeue(Duration.ofSeconds(5)).block();

        assertEquals("job-1", delivery.getJobId());
        assertEquals(NOW.plus(Duration.ofMinutes(5)), delivery.getVisibleAgainAt());
        verify(zSetOperations).add("intelligence:queue:inflight", "job-1",
            (double) NOW.plus(Duration.ofMinutes(5)).toEpochMilli());
    }

    @Test
    void testDequeue_ShortTimeoutRaisedToOneSecond() {
        when(redisTemplate.opsForList()).thenReturn(listOperations);
        when(listOperations.rightPopAndLeftPush(anyString(), anyString(), any(Duration.class))).thenReturn(Mono.empty());

        assertNull(queue.dequeue(Duration.ofMillis(10)).block());

        verify(listOperations).rightPopAndLeftPush("intelligence:queue", "intelligence:queue:processing", Duration.ofSeconds(1));
    }

    @Test
    void testRequeueExpired_PassesNowAndFreshDeadline() {
        when(redisTemplate.execute(eq(RedisScripts.QUEUE_REQUEUE_EXPIRED), anyList(), anyList())).thenReturn(Flux.just(2L));

        assertEquals(2L, queue.requeueExpired().block());

        ArgumentCaptor<List<String>> args = ArgumentCaptor.forClass(List.class);
        verify(redisTemplate).execute(eq(RedisScripts.QUEUE_REQUEUE_EXPIRED),
            eq(List.of("intelligence:queue", "intelligence:queue:processing", "intelligence:queue:inflight")),
            args.capture());
        assertEquals(List.of(String.valueOf(NOW.toEpochMilli()), String.valueOf(NOW.plusSeconds(300).toEpochMilli())),
            args.getValue());
    }

    @Test
    void testSizeDefaultsToZero() {
        when(redisTemplate.opsForList()).thenReturn(listOperations);
        when(listOperations.size("intelligence:queue")).thenReturn(Mono.empty());

        assertEquals(0L, queue.size().block());
        assertFalse(queue.isFull(10).block());
    }
}
