package com.gdin.inspection.riskgraph.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Jacksonized
@Builder
public class CentralityScore {

    public static final CentralityScore ZERO = CentralityScore.builder().build();

    @JsonProperty("degree")
    double degree;

    @JsonProperty("betweenness")
    double betweenness;

    @JsonProperty("closeness")
    double closeness;

    @JsonProperty("page_rank")
    double pageRank;
}
