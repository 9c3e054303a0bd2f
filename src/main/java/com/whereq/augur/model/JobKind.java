package com.whereq.augur.model;

import java.util.Locale;

/**
 * Kind of analysis requested. Only {@link #PREDICT} results are published to the context broker.
 */
public enum JobKind {
    ANALYZE,
    PREDICT;

    public boolean publishesToBroker() {
        return this == PREDICT;
    }

    /**
     * Parse an external analysis type such as {@code "predict"} or {@code "analyze"}.
     *
     * @throws IllegalArgumentException for unknown values
     */
    public static JobKind fromAnalysisType(String analysisType) {
        if (analysisType == null || analysisType.isBlank()) {
            return PREDICT;
        }
        return switch (analysisType.trim().toLowerCase(Locale.ROOT)) {
            case "predict", "prediction" -> PREDICT;
            case "analyze", "analyse", "analysis" -> ANALYZE;
            default -> throw new IllegalArgumentException("Unknown analysis type: " + analysisType);
        };
    }
}
