package com.whereq.augur.worker;

import com.whereq.augur.config.AugurProperties;
import com.whereq.augur.model.Delivery;
import com.whereq.augur.queue.JobQueue;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed pool of worker threads, each blocking on the queue and processing one job at a time
 *
 * @author WhereQ Inc.
 */
@Slf4j
@Service
public class WorkerPool {

    private static final Duration DEQUEUE_GRACE = Duration.ofSeconds(2);

    private final JobQueue jobQueue;
    private final JobProcessor jobProcessor;
    private final AugurProperties.WorkerConfig config;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicInteger aliveWorkers = new AtomicInteger();
    private ExecutorService executor;

    public WorkerPool(JobQueue jobQueue, JobProcessor jobProcessor, AugurProperties properties) {
        this.jobQueue = jobQueue;
        this.jobProcessor = jobProcessor;
        this.config = properties.getWorker();
    }

    @PostConstruct
    public void startIfEnabled() {
        if (config.isEnabled()) {
            start();
        } else {
            log.info("Worker pool disabled");
        }
    }

    /**
     * Start the configured number of workers
     */
    public synchronized void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        int count = config.getCount();
        AtomicInteger threadIndex = new AtomicInteger();
        executor = Executors.newFixedThreadPool(count,
            runnable -> new Thread(runnable, "augur-worker-" + threadIndex.incrementAndGet()));

        for (int i = 1; i <= count; i++) {
            int workerId = i;
            executor.execute(() -> runLoop(workerId));
        }
        log.info("Started {} worker(s) (dequeue timeout {}, plugin timeout {})",
            count, config.getDequeueTimeout(), config.getPluginTimeout());
    }

    /**
     * Stop taking new deliveries and wait for in-progress jobs to finish
     */
    @PreDestroy
    public synchronized void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        log.info("Stopping worker pool");
        executor.shutdown();
        try {
            Duration wait = config.getDequeueTimeout().plus(config.getPluginTimeout()).plus(DEQUEUE_GRACE);
            if (!executor.awaitTermination(wait.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Workers did not stop within {}, interrupting", wait);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public int getConfiguredWorkers() {
        return config.getCount();
    }

    public int getAliveWorkers() {
        return aliveWorkers.get();
    }

    private void runLoop(int workerId) {
        aliveWorkers.incrementAndGet();
        log.debug("Worker {} started", workerId);
        Duration backoff = config.getErrorBackoff();
        try {
            while (running.get() && !Thread.currentThread().isInterrupted()) {
                try {
                    Delivery delivery = jobQueue.dequeue(config.getDequeueTimeout())
                        .block(config.getDequeueTimeout().plus(DEQUEUE_GRACE));
                    backoff = config.getErrorBackoff();
                    if (delivery == null) {
                        continue;
                    }
                    ProcessingOutcome outcome = jobProcessor.process(delivery);
                    log.debug("Worker {} finished delivery of job {}: {}", workerId, delivery.getJobId(), outcome);
                } catch (RuntimeException e) {
                    if (!running.get()) {
                        break;
                    }
                    log.error("Worker {} loop error, retrying in {}ms: {}", workerId, backoff.toMillis(), e.getMessage(), e);
                    if (!pause(backoff)) {
                        break;
                    }
                    backoff = backoff.multipliedBy(2);
                    if (backoff.compareTo(config.getMaxErrorBackoff()) > 0) {
                        backoff = config.getMaxErrorBackoff();
                    }
                }
            }
        } finally {
            aliveWorkers.decrementAndGet();
            log.info("Worker {} stopped", workerId);
        }
    }

    private boolean pause(Duration duration) {
        try {
            Thread.sleep(duration.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
