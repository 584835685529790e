package com.gdin.inspection.riskgraph.index.severity;

import cn.hutool.core.collection.CollectionUtil;
import cn.hutool.core.util.StrUtil;
import com.gdin.inspection.riskgraph.models.Threshold;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Optional;

/**
 * 为 (metric, 设备) 选出唯一最具体的阈值：
 * 设备 id 精确命中 3 分 > 设备类型命中 2 分 > 全局阈值 1 分，0 分不参与。
 * 同分时按声明顺序取第一条。
 */
@Component
public class ThresholdResolver {

    static final int SCORE_EQUIPMENT_ID = 3;
    static final int SCORE_EQUIPMENT_TYPE = 2;
    static final int SCORE_GLOBAL = 1;

    public Optional<Threshold> resolve(
            Collection<Threshold> thresholds,
            String metric,
            String equipmentType,
            String equipmentId
    ) {
        if (CollectionUtil.isEmpty(thresholds) || StrUtil.isBlank(metric)) return Optional.empty();

        Threshold best = null;
        int bestScore = 0;
        for (Threshold t : thresholds) {
            if (t == null || !t.isActive() || !metric.equals(t.getMetric())) continue;
            int score = score(t, equipmentType, equipmentId);
            // 严格大于：同分保留先声明的
            if (score > bestScore) {
                bestScore = score;
                best = t;
            }
        }
        return Optional.ofNullable(best);
    }

    int score(Threshold t, String equipmentType, String equipmentId) {
        if (StrUtil.isNotBlank(t.getScopeEquipmentId())
                && StrUtil.isNotBlank(equipmentId)
                && t.getScopeEquipmentId().equals(equipmentId)) {
            return SCORE_EQUIPMENT_ID;
        }
        if (StrUtil.isNotBlank(t.getScopeEquipmentType())
                && StrUtil.isNotBlank(equipmentType)
                && t.getScopeEquipmentType().equals(equipmentType)) {
            return SCORE_EQUIPMENT_TYPE;
        }
        if (t.isGlobal()) {
            return SCORE_GLOBAL;
        }
        return 0;
    }
}
