package com.gdin.inspection.riskgraph.models;

import cn.hutool.core.util.StrUtil;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * 指标阈值定义。同一 metric 可以在不同作用域（全局 / 设备类型 / 具体设备）各有一条，
 * 声明顺序有意义：同分时先声明者胜出。
 */
@Value
@Jacksonized
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Threshold {

    @JsonProperty("metric")
    String metric;

    @JsonProperty("scope_equipment_id")
    String scopeEquipmentId;

    @JsonProperty("scope_equipment_type")
    String scopeEquipmentType;

    @JsonProperty("unit")
    String unit;

    @JsonProperty("warn_low")
    Double warnLow;

    @JsonProperty("warn_high")
    Double warnHigh;

    @JsonProperty("alarm_low")
    Double alarmLow;

    @JsonProperty("alarm_high")
    Double alarmHigh;

    @JsonProperty("active")
    @Builder.Default
    boolean active = true;

    @JsonIgnore
    public boolean isGlobal() {
        return StrUtil.isBlank(scopeEquipmentId) && StrUtil.isBlank(scopeEquipmentType);
    }
}
