package com.gdin.inspection.riskgraph.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * 按位置分组展示的高风险事实（只保留展示需要的字段）。
 */
@Value
@Jacksonized
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LocationRiskFact {

    @JsonProperty("subject_id")
    String subjectId;

    @JsonProperty("predicate")
    String predicate;

    @JsonProperty("object_id")
    String objectId;

    @JsonProperty("severity")
    Severity severity;

    @JsonProperty("metric")
    String metric;

    @JsonProperty("value")
    Double value;

    @JsonProperty("unit")
    String unit;

    @JsonProperty("timestamp")
    Instant timestamp;

    public static LocationRiskFact from(Fact fact) {
        return LocationRiskFact.builder()
                .subjectId(fact.getSubjectId())
                .predicate(fact.getPredicate())
                .objectId(fact.getObjectId())
                .severity(fact.getSeverity())
                .metric(fact.getMetric())
                .value(fact.getValue())
                .unit(fact.getUnit())
                .timestamp(fact.getTimestamp())
                .build();
    }
}
