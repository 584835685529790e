package com.gdin.inspection.riskgraph.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;
import lombok.extern.jackson.Jacksonized;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 有向边 source -> target。同一有序节点对只有一条边，多个谓词合并进 predicates（保持出现顺序）。
 */
@Data
@Jacksonized
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GraphEdge {

    @JsonProperty("source")
    String source;

    @JsonProperty("target")
    String target;

    @JsonProperty("predicates")
    @Builder.Default
    Set<String> predicates = new LinkedHashSet<>();

    @JsonIgnore
    public boolean isSelfLoop() {
        return source != null && source.equals(target);
    }
}
