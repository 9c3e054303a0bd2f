package com.whereq.augur.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request body of the analyze and predict endpoints.
 *
 * Serialized in snake_case: {@code entity_id}, {@code attribute}, {@code historical_data},
 * {@code prediction_horizon}, {@code plugin}.
 *
 * @author WhereQ Inc.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisRequest {
    /**
     * Entity to analyse, e.g. {@code urn:ngsi-ld:AgriSensor:sensor-123}
     */
    @NotBlank(message = "entity_id is required")
    private String entityId;

    /**
     * Attribute to forecast, e.g. {@code temperature}
     */
    @NotBlank(message = "attribute is required")
    private String attribute;

    /**
     * Historical samples
     */
    @NotNull(message = "historical_data is required")
    private List<@Valid @NotNull TimeSeriesSample> historicalData;

    /**
     * Number of future points. Defaults to 24.
     */
    private Integer predictionHorizon;

    /**
     * Plugin name. Defaults to {@code simple_predictor}.
     */
    private String plugin;
}
