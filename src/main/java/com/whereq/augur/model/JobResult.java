package com.whereq.augur.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of a completed job
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobResult {
    /**
     * Forecast points, exactly {@code horizon} of them
     */
    @Builder.Default
    private List<DataPoint> predictions = new ArrayList<>();

    /**
     * Model used by the plugin
     */
    private String model;

    /**
     * Plugin confidence score
     */
    private double confidence;

    /**
     * Plugin diagnostics
     */
    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();

    /**
     * Prediction entity id in the context broker (predictions only)
     */
    private String brokerEntityId;

    /**
     * Generation timestamp written with the prediction entity (predictions only)
     */
    private Instant generatedAt;

    /**
     * Execution time of the plugin in milliseconds
     */
    private long executionTimeMs;

    public static JobResult from(Forecast forecast, long executionTimeMs) {
        return JobResult.builder()
            .predictions(forecast.getPoints())
            .model(forecast.getModel())
            .confidence(forecast.getConfidence())
            .metadata(forecast.getMetadata())
            .executionTimeMs(executionTimeMs)
            .build();
    }
}
