package com.whereq.augur.broker;

import com.whereq.augur.model.DataPoint;
import com.whereq.augur.model.Forecast;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * NGSI-LD representation of Prediction entities
 */
public final class PredictionEntities {

    public static final String ENTITY_TYPE = "Prediction";

    public static final String GENERATED_AT = "generatedAt";

    private static final String URN_PREFIX = "urn:ngsi-ld:" + ENTITY_TYPE + ":";

    private PredictionEntities() {
    }

    /**
     * Stable entity id for (tenant, entity, attribute), e.g.
     * {@code urn:ngsi-ld:Prediction:farm-1:urn%3Angsi-ld%3AAgriSensor%3Asensor-123:temperature}.
     * Entity ref and attribute are URL-encoded so neither contains a raw ':' and distinct keys
     * never share an id.
     */
    public static String entityId(String tenantId, String entityRef, String attribute) {
        return URN_PREFIX + tenantId + ":" + encode(entityRef) + ":" + encode(attribute);
    }

    private static String encode(String part) {
        return URLEncoder.encode(part, StandardCharsets.UTF_8);
    }

    /**
     * Build the normalized entity body
     */
    public static Map<String, Object> toEntity(String entityId, Prediction prediction, Instant generatedAt,
                                               String contextUrl) {
        Forecast forecast = prediction.getForecast();

        Map<String, Object> entity = new LinkedHashMap<>();
        entity.put("@context", contextUrl == null || contextUrl.isBlank() ? List.of() : List.of(contextUrl));
        entity.put("id", entityId);
        entity.put("type", ENTITY_TYPE);
        entity.put("refEntity", Map.of("type", "Relationship", "object", prediction.getEntityRef()));
        entity.put("predictedAttribute", property(prediction.getAttribute()));
        entity.put("predictions", property(forecast.getPoints().stream()
            .map(PredictionEntities::point)
            .toList()));
        entity.put("model", property(forecast.getModel()));

        Map<String, Object> confidence = new LinkedHashMap<>();
        confidence.put("type", "Property");
        confidence.put("value", forecast.getConfidence());
        confidence.put("unitCode", "C62");
        entity.put("confidence", confidence);

        entity.put(GENERATED_AT, property(Map.of("@type", "DateTime", "@value", generatedAt.toString())));
        entity.put("sourceJob", property(prediction.getSourceJobId()));
        return entity;
    }

    private static Map<String, Object> property(Object value) {
        Map<String, Object> property = new LinkedHashMap<>();
        property.put("type", "Property");
        property.put("value", value);
        return property;
    }

    private static Map<String, Object> point(DataPoint point) {
        Map<String, Object> value = new LinkedHashMap<>();
        value.put("timestamp", point.getTimestamp().toString());
        value.put("value", point.getValue());
        return value;
    }
}
