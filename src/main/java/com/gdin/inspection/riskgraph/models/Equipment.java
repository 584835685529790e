package com.gdin.inspection.riskgraph.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * 设备登记：设备 id -> 所在位置（pad）+ 设备类型（engine / transmission / ...）。
 */
@Value
@Jacksonized
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Equipment {

    @JsonProperty("equipment_id")
    String equipmentId;

    @JsonProperty("location_id")
    String locationId;

    @JsonProperty("equipment_type")
    String equipmentType;
}
