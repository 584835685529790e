package com.gdin.inspection.riskgraph.repository;

import com.gdin.inspection.riskgraph.models.Equipment;
import com.gdin.inspection.riskgraph.models.Fact;
import com.gdin.inspection.riskgraph.models.RiskSnapshot;
import com.gdin.inspection.riskgraph.models.Threshold;

import java.util.List;

/**
 * 风险分析输入的来源契约。可实现为数据库/文件/内存等。
 * 引擎每次运行只读一次，不回写。
 */
public interface RiskSnapshotRepository {
    /**
     * @return 全部事实（若无则返回空列表）
     */
    List<Fact> loadFacts();

    /**
     * @return 阈值定义，声明顺序即同分时的优先顺序
     */
    List<Threshold> loadThresholds();

    /**
     * @return 设备登记（若无则返回空列表）
     */
    List<Equipment> loadEquipment();

    default RiskSnapshot loadSnapshot() {
        return RiskSnapshot.builder()
                .facts(loadFacts())
                .thresholds(loadThresholds())
                .equipment(loadEquipment())
                .build();
    }
}
