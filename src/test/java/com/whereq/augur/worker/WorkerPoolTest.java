package com.whereq.augur.worker;

import com.whereq.augur.config.AugurProperties;
import com.whereq.augur.model.Delivery;
import com.whereq.augur.support.InMemoryJobQueue;
import com.whereq.augur.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class WorkerPoolTest {

    @Mock
    private JobProcessor jobProcessor;

    private InMemoryJobQueue queue;
    private AugurProperties properties;
    private WorkerPool pool;

    @BeforeEach
    void setUp() {
        properties = new AugurProperties();
        properties.getWorker().setCount(3);
        properties.getWorker().setDequeueTimeout(Duration.ofMillis(50));
        properties.getWorker().setPluginTimeout(Duration.ofMillis(100));
        properties.getWorker().setErrorBackoff(Duration.ofMillis(10));
        properties.getWorker().setMaxErrorBackoff(Duration.ofMillis(40));

        queue = new InMemoryJobQueue(new MutableClock(Instant.parse("2025-01-01T00:00:00Z")), Duration.ofMinutes(5));
        pool = new WorkerPool(queue, jobProcessor, properties);
    }

    @AfterEach
    void tearDown() {
        pool.stop();
    }

    @Test
    void testWorkersProcessEveryDelivery() throws Exception {
        // Given
        CountDownLatch processed = new CountDownLatch(10);
        Set<String> seen = ConcurrentHashMap.newKeySet();
        when(jobProcessor.process(any(Delivery.class))).thenAnswer(invocation -> {
            Delivery delivery = invocation.getArgument(0);
            seen.add(delivery.getJobId());
            processed.countDown();
            return ProcessingOutcome.COMPLETED;
        });
        for (int i = 0; i < 10; i++) {
            queue.enqueue("job-" + i).block();
        }

        // When
        pool.start();

        // Then
        assertTrue(processed.await(5, TimeUnit.SECONDS));
        assertEquals(10, seen.size());
        assertTrue(pool.isRunning());
        assertEquals(3, pool.getConfiguredWorkers());
    }

    @Test
    void testLoopSurvivesProcessingErrors() throws Exception {
        CountDownLatch processed = new CountDownLatch(3);
        when(jobProcessor.process(any(Delivery.class)))
            .thenThrow(new IllegalStateException("redis connection reset"))
            .thenAnswer(invocation -> {
                processed.countDown();
                return ProcessingOutcome.COMPLETED;
            });
        properties.getWorker().setCount(1);
        for (int i = 0; i < 4; i++) {
            queue.enqueue("job-" + i).block();
        }

        pool.start();

        assertTrue(processed.await(5, TimeUnit.SECONDS));
        assertEquals(1, pool.getAliveWorkers());
    }

    @Test
    void testStopEndsAllWorkers() throws Exception {
        pool.start();
        waitFor(() -> pool.getAliveWorkers() == 3);

        pool.stop();

        assertFalse(pool.isRunning());
        waitFor(() -> pool.getAliveWorkers() == 0);
        verifyNoInteractions(jobProcessor);
    }

    @Test
    void testDisabledPoolDoesNotStart() {
        properties.getWorker().setEnabled(false);

        pool.startIfEnabled();

        assertFalse(pool.isRunning());
        assertEquals(0, pool.getAliveWorkers());
    }

    private static void waitFor(java.util.function.BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("condition not met within 5s");
            }
            Thread.sleep(10);
        }
    }
}
