package com.whereq.augur.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;

/**
 * One (timestamp, value) sample of a time series, historical or forecast
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DataPoint implements Serializable {
    private static final long serialVersionUID = 1L;

    private Instant timestamp;

    private double value;

    public static DataPoint of(Instant timestamp, double value) {
        return new DataPoint(timestamp, value);
    }
}
