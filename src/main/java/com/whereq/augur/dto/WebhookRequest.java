package com.whereq.augur.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Request body of the n8n webhook.
 * {@code entity_id} and {@code attribute} may also be given inside {@code data}.
 *
 * @author WhereQ Inc.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WebhookRequest {
    private String entityId;

    private String attribute;

    /**
     * {@code predict} (default) or {@code analyze}
     */
    @Builder.Default
    private String analysisType = "predict";

    /**
     * May carry {@code historical_data}, {@code prediction_horizon} and {@code plugin}
     */
    @Builder.Default
    private Map<String, Object> data = new LinkedHashMap<>();
}
