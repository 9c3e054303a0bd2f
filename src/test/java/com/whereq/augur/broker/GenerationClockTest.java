package com.whereq.augur.broker;

import com.whereq.augur.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GenerationClockTest {

    private static final Instant T0 = Instant.parse("2025-06-01T12:00:00.123456Z");

    @Test
    void testTruncatesToMillis() {
        GenerationClock clock = new GenerationClock(new MutableClock(T0));

        assertEquals(Instant.parse("2025-06-01T12:00:00.123Z"), clock.next());
    }

    @Test
    void testStrictlyIncreasingWhenTimeStandsStill() {
        GenerationClock clock = new GenerationClock(new MutableClock(T0));

        Instant first = clock.next();
        Instant second = clock.next();
        Instant third = clock.next();

        assertEquals(first.plusMillis(1), second);
        assertEquals(second.plusMillis(1), third);
    }

    @Test
    void testFollowsWallClockWhenItMovesAhead() {
        MutableClock wall = new MutableClock(T0);
        GenerationClock clock = new GenerationClock(wall);
        clock.next();

        wall.advance(Duration.ofSeconds(5));

        assertEquals(Instant.parse("2025-06-01T12:00:05.123Z"), clock.next());
    }

    @Test
    void testNextAfterFloor() {
        GenerationClock clock = new GenerationClock(new MutableClock(T0));
        Instant floor = T0.plusSeconds(30);

        Instant stamp = clock.nextAfter(floor);

        assertTrue(stamp.isAfter(floor));
        assertTrue(clock.next().isAfter(stamp));
    }

    @Test
    void testUniqueAcrossThreads() throws Exception {
        GenerationClock clock = new GenerationClock(new MutableClock(T0));
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<Instant>> futures = new ArrayList<>();
            for (int i = 0; i < 400; i++) {
                futures.add(executor.submit(clock::next));
            }
            Set<Instant> stamps = new HashSet<>();
            for (Future<Instant> future : futures) {
                stamps.add(future.get());
            }
            assertEquals(400, stamps.size());
        } finally {
            executor.shutdownNow();
        }
    }
}
