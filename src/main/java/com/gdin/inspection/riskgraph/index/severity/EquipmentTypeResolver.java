package com.gdin.inspection.riskgraph.index.severity;

import cn.hutool.core.util.StrUtil;
import com.gdin.inspection.riskgraph.config.properties.RiskProperties;
import com.gdin.inspection.riskgraph.models.Equipment;
import jakarta.annotation.Resource;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;

/**
 * 设备类型解析：先查设备登记，查不到再按 id 前缀推断（ENG-12 -> engine）。
 */
@Component
public class EquipmentTypeResolver {

    @Resource
    private RiskProperties riskProperties;

    public String resolve(String equipmentId, Map<String, Equipment> registry) {
        if (StrUtil.isBlank(equipmentId)) return null;

        Equipment registered = registry == null ? null : registry.get(equipmentId);
        if (registered != null && StrUtil.isNotBlank(registered.getEquipmentType())) {
            return registered.getEquipmentType();
        }
        return inferFromPrefix(equipmentId);
    }

    String inferFromPrefix(String equipmentId) {
        String normalized = equipmentId.trim().toUpperCase(Locale.ROOT).replace(' ', '_');
        // 配置顺序即匹配顺序，长前缀放前面
        for (Map.Entry<String, String> e : riskProperties.getClassification().getEquipmentTypePrefixes().entrySet()) {
            if (normalized.startsWith(e.getKey().toUpperCase(Locale.ROOT))) {
                return e.getValue();
            }
        }
        return null;
    }
}
