package com.whereq.augur.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Output of a forecast plugin
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Forecast {

    /**
     * Predicted points, one per horizon step
     */
    @Builder.Default
    private List<DataPoint> points = new ArrayList<>();

    /**
     * Model name reported by the plugin
     */
    private String model;

    /**
     * Confidence score in [0, 1]
     */
    private double confidence;

    /**
     * Plugin specific diagnostics
     */
    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();
}
