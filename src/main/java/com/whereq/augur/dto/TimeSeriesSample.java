package com.whereq.augur.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One historical sample as submitted by the caller
 *
 * @author WhereQ Inc.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TimeSeriesSample {
    /**
     * ISO-8601 instant, e.g. {@code 2024-01-15T10:00:00Z}
     */
    @NotNull(message = "timestamp is required")
    private Instant timestamp;

    @NotNull(message = "value is required")
    private Double value;
}
