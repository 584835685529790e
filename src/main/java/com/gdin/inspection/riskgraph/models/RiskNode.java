package com.gdin.inspection.riskgraph.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Jacksonized
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RiskNode {

    @JsonProperty("node_id")
    String nodeId;

    @JsonProperty("type")
    String type;

    @JsonProperty("severity")
    Severity severity;

    @JsonProperty("degree")
    double degree;

    @JsonProperty("betweenness")
    double betweenness;

    @JsonProperty("closeness")
    double closeness;

    @JsonProperty("page_rank")
    double pageRank;
}
