package com.gdin.inspection.riskgraph.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;
import lombok.extern.jackson.Jacksonized;

/**
 * 图节点：id + 固定的属性记录 (entity_type, severity, label)。
 * severity 只升不降，由 {@link #upgradeSeverity(Severity)} 维护。
 */
@Data
@Jacksonized
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GraphNode {

    @JsonProperty("id")
    String id;

    @JsonProperty("entity_type")
    String entityType;

    @JsonProperty("label")
    String label;

    @JsonProperty("severity")
    @Builder.Default
    Severity severity = Severity.NORMAL;

    /**
     * 首次出现时的顺序号，排序时作为稳定的兜底键。
     */
    @JsonProperty("first_seen")
    int firstSeen;

    public void upgradeSeverity(Severity observed) {
        this.severity = Severity.max(this.severity, observed);
    }
}
