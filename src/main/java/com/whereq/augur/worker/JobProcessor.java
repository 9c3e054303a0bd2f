package com.whereq.augur.worker;

import com.whereq.augur.broker.BrokerPublisher;
import com.whereq.augur.broker.GenerationClock;
import com.whereq.augur.broker.Prediction;
import com.whereq.augur.broker.PublishAck;
import com.whereq.augur.config.AugurProperties;
import com.whereq.augur.exception.AugurException;
import com.whereq.augur.exception.BrokerWriteException;
import com.whereq.augur.exception.IllegalTransitionException;
import com.whereq.augur.exception.JobCancelledException;
import com.whereq.augur.model.Delivery;
import com.whereq.augur.model.ErrorKind;
import com.whereq.augur.model.Forecast;
import com.whereq.augur.model.Job;
import com.whereq.augur.model.JobPayload;
import com.whereq.augur.model.JobResult;
import com.whereq.augur.model.JobStatus;
import com.whereq.augur.model.JobTransition;
import com.whereq.augur.plugin.ForecastPlugin;
import com.whereq.augur.plugin.PluginInvoker;
import com.whereq.augur.plugin.PluginRegistry;
import com.whereq.augur.queue.JobQueue;
import com.whereq.augur.store.JobStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Runs one delivery through the job lifecycle:
 * load, claim, cancellation checkpoint, plugin execution, broker publication, completion, acknowledgement.
 *
 * Failures of the job itself are recorded on the job. Store and queue failures propagate to the
 * caller and leave the delivery unacknowledged, so it is redelivered after the visibility timeout.
 *
 * @author WhereQ Inc.
 */
@Slf4j
@Component
public class JobProcessor {

    private final JobStore jobStore;
    private final JobQueue jobQueue;
    private final PluginRegistry pluginRegistry;
    private final PluginInvoker pluginInvoker;
    private final BrokerPublisher brokerPublisher;
    private final GenerationClock generationClock;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    private final Duration pluginTimeout;
    private final Duration leaseDuration;
    private final Duration storeTimeout;
    private final Duration publishTimeout;

    private final Counter completedCounter;
    private final Timer executionTimer;

    public JobProcessor(JobStore jobStore,
                        JobQueue jobQueue,
                        PluginRegistry pluginRegistry,
                        PluginInvoker pluginInvoker,
                        BrokerPublisher brokerPublisher,
                        GenerationClock generationClock,
                        Clock clock,
                        MeterRegistry meterRegistry,
                        AugurProperties properties) {
        this.jobStore = jobStore;
        this.jobQueue = jobQueue;
        this.pluginRegistry = pluginRegistry;
        this.pluginInvoker = pluginInvoker;
        this.brokerPublisher = brokerPublisher;
        this.generationClock = generationClock;
        this.clock = clock;
        this.meterRegistry = meterRegistry;

        this.pluginTimeout = properties.getWorker().getPluginTimeout();
        this.leaseDuration = properties.getQueue().getVisibilityTimeout();
        this.storeTimeout = properties.getStore().getOperationTimeout();
        this.publishTimeout = properties.getBroker().worstCasePublishDuration();

        this.completedCounter = Counter.builder("augur.jobs.completed")
            .description("Number of successfully completed jobs")
            .register(meterRegistry);
        this.executionTimer = Timer.builder("augur.jobs.execution.time")
            .description("Job execution time")
            .register(meterRegistry);

        Duration budget = pluginTimeout.plus(publishTimeout).plus(storeTimeout.multipliedBy(2));
        if (budget.compareTo(leaseDuration) >= 0) {
            log.warn("Visibility timeout {} does not exceed the worst case job duration {}; "
                + "slow jobs may be redelivered while still running", leaseDuration, budget);
        }
    }

    /**
     * Process one delivery
     *
     * @param delivery the delivery taken from the queue
     * @return what happened to it
     */
    public ProcessingOutcome process(Delivery delivery) {
        String jobId = delivery.getJobId();
        Job job = await(jobStore.findById(jobId));

        if (job == null) {
            log.warn("Dropping delivery of unknown job {}", jobId);
            acknowledge(delivery);
            return ProcessingOutcome.MISSING;
        }
        if (job.getStatus().isTerminal()) {
            log.info("Job {} already {}, acknowledging duplicate delivery", jobId, job.getStatus());
            acknowledge(delivery);
            return ProcessingOutcome.DUPLICATE;
        }

        Instant now = clock.instant();
        if (job.isLeaseActive(now)) {
            log.info("Job {} is held by another worker until {}, leaving delivery in flight",
                jobId, job.getLeaseExpiresAt());
            return ProcessingOutcome.LEASE_HELD;
        }

        Job running;
        try {
            running = await(jobStore.updateStatus(jobId, JobTransition.claim(now.plus(leaseDuration))));
        } catch (IllegalTransitionException e) {
            log.info("Lost claim on job {}: {}", jobId, e.getMessage());
            acknowledge(delivery);
            return ProcessingOutcome.SUPERSEDED;
        }
        if (running.getAttempts() > 1) {
            log.warn("Re-claimed job {} after an expired lease (attempt {})", jobId, running.getAttempts());
        }

        ProcessingOutcome outcome = execute(running);
        acknowledge(delivery);
        return outcome;
    }

    private ProcessingOutcome execute(Job job) {
        log.info("Starting execution of job {} ({}, plugin={})", job.getId(), job.getKind(), job.getPluginName());

        JobTransition transition;
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            transition = JobTransition.complete(run(job));
        } catch (AugurException e) {
            log.warn("Job {} failed with {}: {}", job.getId(), e.getKind(), e.getMessage());
            transition = JobTransition.fail(e.toJobError());
        } catch (RuntimeException e) {
            log.error("Unexpected error processing job {}: {}", job.getId(), e.getMessage(), e);
            transition = JobTransition.fail(ErrorKind.INTERNAL_ERROR, String.valueOf(e.getMessage()));
        } finally {
            sample.stop(executionTimer);
        }

        Job finished;
        try {
            finished = await(jobStore.updateStatus(job.getId(), transition));
        } catch (IllegalTransitionException e) {
            log.warn("Result of job {} discarded, another worker finished it first: {}", job.getId(), e.getMessage());
            return ProcessingOutcome.SUPERSEDED;
        }

        if (finished.getStatus() == JobStatus.COMPLETED) {
            completedCounter.increment();
            log.info("Job {} completed successfully", job.getId());
            return ProcessingOutcome.COMPLETED;
        }
        Counter.builder("augur.jobs.failed")
            .description("Number of failed jobs")
            .tag("kind", finished.getError().getKind().name())
            .register(meterRegistry)
            .increment();
        return ProcessingOutcome.FAILED;
    }

    private JobResult run(Job job) {
        // cancellation is only honoured before execution starts
        if (job.isCancelRequested()) {
            throw new JobCancelledException(job.getId());
        }

        ForecastPlugin plugin = pluginRegistry.resolve(job.getPluginName());
        JobPayload payload = job.getPayload();

        long startNanos = System.nanoTime();
        Forecast forecast = pluginInvoker.invoke(plugin, payload.getSamples(), payload.getHorizon(), pluginTimeout);
        JobResult result = JobResult.from(forecast, Duration.ofNanos(System.nanoTime() - startNanos).toMillis());

        if (job.getKind().publishesToBroker()) {
            PublishAck ack = publish(job, forecast);
            result.setBrokerEntityId(ack.getEntityId());
            result.setGeneratedAt(ack.getGeneratedAt());
        }
        return result;
    }

    private PublishAck publish(Job job, Forecast forecast) {
        Prediction prediction = Prediction.builder()
            .tenantId(job.getTenantId())
            .entityRef(job.getPayload().getEntityId())
            .attribute(job.getPayload().getAttribute())
            .forecast(forecast)
            .sourceJobId(job.getId())
            .generatedAt(generationClock.next())
            .build();
        try {
            return brokerPublisher.publish(prediction).block(publishTimeout);
        } catch (BrokerWriteException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new BrokerWriteException("Broker write for job " + job.getId() + " did not finish: " + e.getMessage(), e);
        }
    }

    private void acknowledge(Delivery delivery) {
        await(jobQueue.acknowledge(delivery));
    }

    private <T> T await(Mono<T> operation) {
        return operation.block(storeTimeout);
    }
}
