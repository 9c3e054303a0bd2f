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
 * Flat forecast at the mean of the most recent samples.
 * Steps follow the median spacing of the input, or one hour when it cannot be derived.
 */
@Component
public class MovingAveragePlugin implements ForecastPlugin {

    public static final String NAME = "moving_average";

    static final int MAX_WINDOW = 24;

    private static final Duration DEFAULT_STEP = Duration.ofHours(1);

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Mean of the last " + MAX_WINDOW + " samples held flat over the horizon";
    }

    @Override
    public Forecast execute(List<DataPoint> samples, int horizon) {
        if (samples.isEmpty()) {
            throw new PluginExecutionException("Need at least 1 historical data point");
        }

        int window = Math.min(MAX_WINDOW, samples.size());
        double mean = samples.subList(samples.size() - window, samples.size()).stream()
            .mapToDouble(DataPoint::getValue)
            .average()
            .orElseThrow();
        double value = Math.round(mean * 100) / 100.0;

        Duration step = medianStep(samples);
        Instant lastTimestamp = samples.get(samples.size() - 1).getTimestamp();
        List<DataPoint> points = new ArrayList<>(horizon);
        for (int i = 1; i <= horizon; i++) {
            points.add(DataPoint.of(lastTimestamp.plus(step.multipliedBy(i)), value));
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("window", window);
        metadata.put("step_seconds", step.toSeconds());

        return Forecast.builder()
            .points(points)
            .model(NAME)
            .confidence(Math.round(Math.max(0.3, 0.8 - horizon / 200.0) * 100) / 100.0)
            .metadata(metadata)
            .build();
    }

    static Duration medianStep(List<DataPoint> samples) {
        if (samples.size() < 2) {
            return DEFAULT_STEP;
        }
        List<Long> gaps = new ArrayList<>(samples.size() - 1);
        for (int i = 1; i < samples.size(); i++) {
            gaps.add(Duration.between(samples.get(i - 1).getTimestamp(), samples.get(i).getTimestamp()).toMillis());
        }
        gaps.sort(Long::compareTo);
        long median = gaps.get(gaps.size() / 2);
        return median > 0 ? Duration.ofMillis(median) : DEFAULT_STEP;
    }
}
