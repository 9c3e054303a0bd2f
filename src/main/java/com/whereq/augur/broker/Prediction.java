package com.whereq.augur.broker;

import com.whereq.augur.model.Forecast;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A completed forecast ready to be written as a Prediction entity
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Prediction {
    private String tenantId;

    /**
     * Entity the forecast refers to
     */
    private String entityRef;

    private String attribute;

    private Forecast forecast;

    /**
     * Job that produced the forecast
     */
    private String sourceJobId;

    /**
     * Generation timestamp of the first write attempt
     */
    private Instant generatedAt;
}
