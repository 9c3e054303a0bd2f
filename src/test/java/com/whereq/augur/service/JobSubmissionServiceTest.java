package com.whereq.augur.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.whereq.augur.config.AugurProperties;
import com.whereq.augur.dto.AnalysisRequest;
import com.whereq.augur.dto.JobCancellationResponse;
import com.whereq.augur.dto.JobStatusResponse;
import com.whereq.augur.dto.JobSubmitResponse;
import com.whereq.augur.dto.TimeSeriesSample;
import com.whereq.augur.dto.WebhookRequest;
import com.whereq.augur.exception.JobNotFoundException;
import com.whereq.augur.exception.QueueFullException;
import com.whereq.augur.exception.ServiceUnavailableException;
import com.whereq.augur.exception.ValidationException;
import com.whereq.augur.model.Job;
import com.whereq.augur.model.JobKind;
import com.whereq.augur.model.JobStatus;
import com.whereq.augur.plugin.PluginRegistry;
import com.whereq.augur.plugin.builtin.SimplePredictorPlugin;
import com.whereq.augur.queue.JobQueue;
import com.whereq.augur.store.JobStore;
import com.whereq.augur.support.InMemoryJobStore;
import com.whereq.augur.support.MutableClock;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.data.redis.RedisConnectionFailureException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for JobSubmissionService.
 */
@ExtendWith(MockitoExtension.class)
class JobSubmissionServiceTest {

    private static final Instant NOW = Instant.parse("2025-06-01T08:00:00Z");
    private static final String TENANT = "farm-1";

    @Mock
    private JobStore jobStore;

    @Mock
    private JobQueue jobQueue;

    private AugurProperties properties;
    private MeterRegistry meterRegistry;
    private MutableClock clock;
    private JobSubmissionService service;

    @BeforeEach
    void setUp() {
        properties = new AugurProperties();
        properties.getIntake().setStoreBackoff(Duration.ofMillis(1));
        meterRegistry = new SimpleMeterRegistry();
        clock = new MutableClock(NOW);
        service = newService(jobStore);
    }

    private JobSubmissionService newService(JobStore store) {
        ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        return new JobSubmissionService(store, jobQueue,
            new PluginRegistry(List.of(new SimplePredictorPlugin())),
            objectMapper, clock, properties, meterRegistry);
    }

    @Test
    void testSubmit_CreatesPendingJobAndEnqueues() {
        // Given
        when(jobQueue.isFull(anyLong())).thenReturn(Mono.just(false));
        when(jobStore.create(any(Job.class))).thenAnswer(invocation -> Mono.just(((Job) invocation.getArgument(0)).getId()));
        when(jobQueue.enqueue(anyString())).thenReturn(Mono.empty());

        // When
        JobSubmitResponse response = service.submit(request(), JobKind.PREDICT, TENANT).block();

        // Then
        assertNotNull(response);
        assertTrue(response.getJobId().startsWith("job-"));
        assertEquals(JobStatus.PENDING, response.getStatus());
        assertEquals(JobKind.PREDICT, response.getKind());
        assertEquals(NOW, response.getSubmittedAt());

        ArgumentCaptor<Job> captor = ArgumentCaptor.forClass(Job.class);
        verify(jobStore).create(captor.capture());
        Job job = captor.getValue();
        assertEquals(TENANT, job.getTenantId());
        assertEquals("simple_predictor", job.getPluginName());
        assertEquals(24, job.getPayload().getHorizon());
        assertEquals(2, job.getPayload().getSamples().size());
        verify(jobQueue).enqueue(job.getId());
    }

    @Test
    void testSubmit_ValidationFailuresNeverReachStore() {
        AnalysisRequest noEntity = request();
        noEntity.setEntityId(" ");
        AnalysisRequest noSamples = request();
        noSamples.setHistoricalData(List.of());
        AnalysisRequest horizonTooLarge = request();
        horizonTooLarge.setPredictionHorizon(169);
        AnalysisRequest horizonZero = request();
        horizonZero.setPredictionHorizon(0);
        AnalysisRequest unordered = request();
        unordered.setHistoricalData(List.of(
            new TimeSeriesSample(NOW, 1.0),
            new TimeSeriesSample(NOW.minusSeconds(60), 2.0)));

        for (AnalysisRequest invalid : List.of(noEntity, noSamples, horizonTooLarge, horizonZero, unordered)) {
            assertThrows(ValidationException.class, () -> service.submit(invalid, JobKind.PREDICT, TENANT).block());
        }
        assertThrows(ValidationException.class, () -> service.submit(request(), JobKind.PREDICT, null).block());
        assertThrows(ValidationException.class, () -> service.submit(request(), JobKind.PREDICT, "bad tenant!").block());

        verifyNoInteractions(jobStore, jobQueue);
    }

    @Test
    void testSubmit_UnknownPluginAcceptedByDefault() {
        when(jobQueue.isFull(anyLong())).thenReturn(Mono.just(false));
        when(jobStore.create(any(Job.class))).thenReturn(Mono.just("id"));
        when(jobQueue.enqueue(anyString())).thenReturn(Mono.empty());
        AnalysisRequest request = request();
        request.setPlugin("nonexistent");

        JobSubmitResponse response = service.submit(request, JobKind.PREDICT, TENANT).block();

        assertEquals(JobStatus.PENDING, response.getStatus());
    }

    @Test
    void testSubmit_UnknownPluginRejectedWhenConfigured() {
        properties.getIntake().setRejectUnknownPlugins(true);
        AnalysisRequest request = request();
        request.setPlugin("nonexistent");

        assertThrows(ValidationException.class, () -> service.submit(request, JobKind.PREDICT, TENANT).block());
        verifyNoInteractions(jobStore);
    }

    @Test
    void testSubmit_QueueFull() {
        when(jobQueue.isFull(anyLong())).thenReturn(Mono.just(true));

        assertThrows(QueueFullException.class, () -> service.submit(request(), JobKind.PREDICT, TENANT).block());

        verifyNoInteractions(jobStore);
        assertEquals(1.0, meterRegistry.counter("augur.intake.rejected").count());
    }

    @Test
    void testSubmit_TransientStoreFailureIsRetried() {
        when(jobQueue.isFull(anyLong())).thenReturn(Mono.just(false));
        when(jobQueue.enqueue(anyString())).thenReturn(Mono.empty());
        List<Integer> calls = new ArrayList<>();
        when(jobStore.create(any(Job.class))).thenReturn(Mono.defer(() -> {
            calls.add(1);
            return calls.size() < 3
                ? Mono.error(new QueryTimeoutException("timeout"))
                : Mono.just("id");
        }));

        JobSubmitResponse response = service.submit(request(), JobKind.ANALYZE, TENANT).block();

        assertNotNull(response.getJobId());
        assertEquals(3, calls.size());
    }

    @Test
    void testSubmit_StoreUnavailableAfterRetries() {
        when(jobQueue.isFull(anyLong())).thenReturn(Mono.just(false));
        when(jobStore.create(any(Job.class)))
            .thenReturn(Mono.error(new RedisConnectionFailureException("connection refused")));

        ServiceUnavailableException e = assertThrows(ServiceUnavailableException.class,
            () -> service.submit(request(), JobKind.PREDICT, TENANT).block());

        assertTrue(e.getCause() instanceof RedisConnectionFailureException);
        verify(jobQueue, never()).enqueue(anyString());
    }

    @Test
    void testWebhook_MapsDataFields() {
        when(jobQueue.isFull(anyLong())).thenReturn(Mono.just(false));
        when(jobStore.create(any(Job.class))).thenReturn(Mono.just("id"));
        when(jobQueue.enqueue(anyString())).thenReturn(Mono.empty());

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("historical_data", List.of(
            Map.of("timestamp", "2025-06-01T06:00:00Z", "value", 18.5),
            Map.of("timestamp", "2025-06-01T07:00:00Z", "value", 19)));
        data.put("prediction_horizon", 12);
        data.put("plugin", "simple_predictor");
        WebhookRequest webhook = WebhookRequest.builder()
            .entityId("urn:ngsi-ld:AgriSensor:sensor-123")
            .attribute("temperature")
            .analysisType("analyze")
            .data(data)
            .build();

        JobSubmitResponse response = service.submitWebhook(webhook, TENANT).block();

        assertEquals(JobKind.ANALYZE, response.getKind());
        ArgumentCaptor<Job> captor = ArgumentCaptor.forClass(Job.class);
        verify(jobStore).create(captor.capture());
        assertEquals(12, captor.getValue().getPayload().getHorizon());
        assertEquals(19.0, captor.getValue().getPayload().getSamples().get(1).getValue());
    }

    @Test
    void testWebhook_UnknownAnalysisTypeRejected() {
        WebhookRequest webhook = WebhookRequest.builder()
            .entityId("urn:ngsi-ld:AgriSensor:sensor-123")
            .attribute("temperature")
            .analysisType("classify")
            .data(Map.of("historical_data", List.of(Map.of("timestamp", "2025-06-01T06:00:00Z", "value", 1))))
            .build();

        assertThrows(ValidationException.class, () -> service.submitWebhook(webhook, TENANT).block());
        verifyNoInteractions(jobStore);
    }

    @Test
    void testTenantIsolation() {
        InMemoryJobStore store = new InMemoryJobStore(clock);
        JobSubmissionService isolated = newService(store);
        when(jobQueue.isFull(anyLong())).thenReturn(Mono.just(false));
        when(jobQueue.enqueue(anyString())).thenReturn(Mono.empty());

        String jobId = isolated.submit(request(), JobKind.PREDICT, "tenant-a").block().getJobId();

        JobStatusResponse own = isolated.getJob(jobId, "tenant-a").block();
        assertEquals(JobStatus.PENDING, own.getStatus());
        assertEquals("urn:ngsi-ld:AgriSensor:sensor-123", own.getEntityId());
        assertThrows(JobNotFoundException.class, () -> isolated.getJob(jobId, "tenant-b").block());
        assertThrows(JobNotFoundException.class, () -> isolated.cancelJob(jobId, "tenant-b").block());
        assertEquals(1, isolated.listPending("tenant-a").collectList().block().size());
        assertTrue(isolated.listPending("tenant-b").collectList().block().isEmpty());
    }

    @Test
    void testListPending_RequiresTenant() {
        assertThrows(ValidationException.class, () -> service.listPending(null).collectList().block());

        verifyNoInteractions(jobStore);
    }

    @Test
    void testCancelPendingJob() {
        InMemoryJobStore store = new InMemoryJobStore(clock);
        JobSubmissionService cancelling = newService(store);
        when(jobQueue.isFull(anyLong())).thenReturn(Mono.just(false));
        when(jobQueue.enqueue(anyString())).thenReturn(Mono.empty());
        String jobId = cancelling.submit(request(), JobKind.PREDICT, TENANT).block().getJobId();

        JobCancellationResponse response = cancelling.cancelJob(jobId, TENANT).block();

        assertTrue(response.isCancelRequested());
        assertEquals(JobStatus.PENDING, response.getStatus());
        assertTrue(store.snapshot(jobId).isCancelRequested());
    }

    private static AnalysisRequest request() {
        return AnalysisRequest.builder()
            .entityId("urn:ngsi-ld:AgriSensor:sensor-123")
            .attribute("temperature")
            .historicalData(new ArrayList<>(List.of(
                new TimeSeriesSample(NOW.minusSeconds(3600), 20.0),
                new TimeSeriesSample(NOW, 22.0))))
            .build();
    }
}
