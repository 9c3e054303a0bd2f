package com.whereq.augur.plugin;

import com.whereq.augur.model.DataPoint;
import com.whereq.augur.model.Forecast;

import java.util.List;

/**
 * Named forecasting capability.
 *
 * Implementations are stateless: they never keep data between calls and never touch
 * the job store or the queue. A run may be repeated for the same job after a redelivery.
 */
public interface ForecastPlugin {

    /**
     * Unique registry name, e.g. {@code simple_predictor}
     */
    String name();

    default String description() {
        return "Analysis plugin";
    }

    /**
     * Compute a forecast of exactly {@code horizon} points
     *
     * @param samples historical samples ordered by timestamp
     * @param horizon number of future points
     * @return the forecast
     * @throws com.whereq.augur.exception.PluginExecutionException if the input cannot be forecast
     */
    Forecast execute(List<DataPoint> samples, int horizon);
}
