package com.gdin.inspection.riskgraph.exception;

import lombok.Getter;

/**
 * 指标读数不可分级（缺失 / NaN / 无穷大）。局部可恢复：该事实跳过分级，但仍参与建图。
 */
@Getter
public class InvalidMetricValueException extends RiskAnalysisException {

    private final String metric;
    private final Double value;

    public InvalidMetricValueException(String metric, Double value) {
        super("invalid value for metric " + metric + ": " + value);
        this.metric = metric;
        this.value = value;
    }
}
