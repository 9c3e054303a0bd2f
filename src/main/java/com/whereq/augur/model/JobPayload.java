package com.whereq.augur.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Input of an analysis job
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobPayload implements Serializable {
    private static final long serialVersionUID = 1L;

    /**
     * Entity the samples belong to, e.g. {@code urn:ngsi-ld:AgriSensor:sensor-123}
     */
    private String entityId;

    /**
     * Attribute being analysed, e.g. {@code temperature}
     */
    private String attribute;

    /**
     * Historical samples, ordered by timestamp
     */
    @Builder.Default
    private List<DataPoint> samples = new ArrayList<>();

    /**
     * Number of future points to forecast
     */
    private int horizon;
}
