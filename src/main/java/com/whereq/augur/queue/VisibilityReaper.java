package com.whereq.augur.queue;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Periodically hands deliveries of crashed workers back to the queue
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "augur.worker", name = "enabled", havingValue = "true", matchIfMissing = true)
public class VisibilityReaper {

    private static final Duration REAP_TIMEOUT = Duration.ofSeconds(10);

    private final JobQueue jobQueue;

    @Scheduled(fixedDelayString = "${augur.queue.reaper-interval-ms:5000}")
    public void requeueExpiredDeliveries() {
        try {
            jobQueue.requeueExpired().block(REAP_TIMEOUT);
        } catch (RuntimeException e) {
            log.error("Failed to requeue expired deliveries: {}", e.getMessage(), e);
        }
    }
}
