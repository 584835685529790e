package com.gdin.inspection.riskgraph.index.severity;

import com.gdin.inspection.riskgraph.exception.InvalidMetricValueException;
import com.gdin.inspection.riskgraph.models.Severity;
import com.gdin.inspection.riskgraph.models.Threshold;
import org.springframework.stereotype.Component;

/**
 * 方向性分级：越下界 -> LOW，越上界 -> HIGH，区间内 -> MED。
 * 判断顺序固定为 alarm_low, warn_low, alarm_high, warn_high。
 *
 * 只在已解析到阈值时调用；没有阈值时的兜底由调用方决定。
 */
@Component
public class SeverityClassifier {

    public Severity classify(Threshold threshold, Double value) {
        if (threshold == null) throw new IllegalArgumentException("threshold 不能为空");
        if (value == null || value.isNaN() || value.isInfinite()) {
            throw new InvalidMetricValueException(threshold.getMetric(), value);
        }
        double v = value;

        if (threshold.getAlarmLow() != null && v <= threshold.getAlarmLow()) return Severity.LOW;
        if (threshold.getWarnLow() != null && v <= threshold.getWarnLow()) return Severity.LOW;
        if (threshold.getAlarmHigh() != null && v >= threshold.getAlarmHigh()) return Severity.HIGH;
        if (threshold.getWarnHigh() != null && v >= threshold.getWarnHigh()) return Severity.HIGH;
        return Severity.MED;
    }

    /**
     * 越界（任一方向）即为 breach。
     */
    public static boolean isBreach(Severity severity) {
        return severity == Severity.LOW || severity == Severity.HIGH;
    }
}
