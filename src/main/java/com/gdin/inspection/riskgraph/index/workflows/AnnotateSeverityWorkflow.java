package com.gdin.inspection.riskgraph.index.workflows;

import com.gdin.inspection.riskgraph.index.severity.SeverityAnnotationOperation;
import com.gdin.inspection.riskgraph.models.RiskSnapshot;
import jakarta.annotation.Resource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * workflow: annotate_severity
 *
 * 输入（来自 context.state）：
 * - snapshot
 *
 * 输出（写回 context.state）：
 * - facts（已标注严重度，含派生的 has_symptom 事实）
 */
@Slf4j
@Service
public class AnnotateSeverityWorkflow {

    @Resource
    private SeverityAnnotationOperation severityAnnotationOperation;

    public SeverityAnnotationOperation.Result run(RiskSnapshot snapshot) {
        if (snapshot == null) throw new IllegalStateException("snapshot 不能为空");

        log.info(
                "开始标注严重度：facts={}, thresholds={}, equipment={}",
                snapshot.getFacts().size(),
                snapshot.getThresholds().size(),
                snapshot.getEquipment().size()
        );

        return severityAnnotationOperation.annotate(
                snapshot.getFacts(),
                snapshot.getThresholds(),
                snapshot.getEquipment()
        );
    }
}
