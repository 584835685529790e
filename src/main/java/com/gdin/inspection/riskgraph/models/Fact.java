package com.gdin.inspection.riskgraph.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * 三元组事实 (subject, predicate, object) + 来源信息。
 * 不可变；严重度标注会通过 toBuilder 产生新对象。
 */
@Value
@Jacksonized
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Fact {

    public static final String PREDICATE_HAS_METRIC = "has_metric";
    public static final String PREDICATE_HAS_SYMPTOM = "has_symptom";
    public static final String PREDICATE_LOCATED_AT = "located_at";

    @JsonProperty("subject_id")
    String subjectId;

    @JsonProperty("subject_type")
    String subjectType;

    @JsonProperty("predicate")
    String predicate;

    @JsonProperty("object_id")
    String objectId;

    @JsonProperty("object_type")
    String objectType;

    @JsonProperty("metric")
    String metric;

    @JsonProperty("value")
    Double value;

    @JsonProperty("unit")
    String unit;

    @JsonProperty("severity")
    Severity severity;

    @JsonProperty("location_id")
    String locationId;

    @JsonProperty("equipment_id")
    String equipmentId;

    @JsonProperty("timestamp")
    Instant timestamp;

    /**
     * 带 metric 的事实是定量观测。
     */
    @JsonIgnore
    public boolean isMetricReading() {
        return metric != null && !metric.isBlank();
    }
}
