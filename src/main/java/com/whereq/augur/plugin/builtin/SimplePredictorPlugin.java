package com.whereq.augur.plugin.builtin;

import com.whereq.augur.exception.PluginExecutionException;
import com.whereq.augur.model.DataPoint;
import com.whereq.augur.model.Forecast;
import com.whereq.augur.plugin.ForecastPlugin;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Linear trend extrapolation at hourly steps.
 *
 * The trend is {@code (last - first) / n}; point {@code h} is {@code last + trend * h}.
 * Confidence degrades with the horizon and never drops below 0.5.
 */
@Component
public class SimplePredictorPlugin implements ForecastPlugin {

    public static final String NAME = "simple_predictor";

    private static final Duration STEP = Duration.ofHours(1);

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Linear trend extrapolation with hourly steps";
    }

    @Override
    public Forecast execute(List<DataPoint> samples, int horizon) {
        if (samples.size() < 2) {
            throw new PluginExecutionException("Need at least 2 historical data points");
        }

        double first = samples.get(0).getValue();
        DataPoint lastPoint = samples.get(samples.size() - 1);
        double last = lastPoint.getValue();
        double trend = (last - first) / samples.size();

        List<DataPoint> points = new ArrayList<>(horizon);
        Instant lastTimestamp = lastPoint.getTimestamp();
        for (int step = 1; step <= horizon; step++) {
            points.add(DataPoint.of(lastTimestamp.plus(STEP.multipliedBy(step)), round(last + trend * step, 2)));
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("trend", round(trend, 4));
        metadata.put("data_points", samples.size());

        return Forecast.builder()
            .points(points)
            .model(NAME)
            .confidence(round(Math.max(0.5, 0.9 - horizon / 100.0), 2))
            .metadata(metadata)
            .build();
    }

    private static double round(double value, int decimals) {
        double scale = Math.pow(10, decimals);
        return Math.round(value * scale) / scale;
    }
}
