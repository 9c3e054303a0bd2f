package com.whereq.augur.broker;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-wide source of strictly increasing generation timestamps at millisecond precision
 */
@Component
public class GenerationClock {

    private final Clock clock;
    private final AtomicReference<Instant> last = new AtomicReference<>(Instant.EPOCH);

    public GenerationClock(Clock clock) {
        this.clock = clock;
    }

    /**
     * Next timestamp, later than every timestamp handed out before
     */
    public Instant next() {
        return nextAfter(Instant.EPOCH);
    }

    /**
     * Next timestamp, later than every timestamp handed out before and later than {@code floor}
     */
    public Instant nextAfter(Instant floor) {
        Instant now = clock.instant().truncatedTo(ChronoUnit.MILLIS);
        return last.updateAndGet(previous -> {
            Instant lowerBound = previous.isAfter(floor) ? previous : floor;
            return now.isAfter(lowerBound) ? now : lowerBound.truncatedTo(ChronoUnit.MILLIS).plusMillis(1);
        });
    }
}
