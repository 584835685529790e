package com.gdin.inspection.riskgraph.index.severity;

import cn.hutool.core.collection.CollectionUtil;
import cn.hutool.core.util.StrUtil;
import com.gdin.inspection.riskgraph.config.properties.RiskProperties;
import com.gdin.inspection.riskgraph.exception.InvalidMetricValueException;
import com.gdin.inspection.riskgraph.models.Equipment;
import com.gdin.inspection.riskgraph.models.Fact;
import com.gdin.inspection.riskgraph.models.Severity;
import com.gdin.inspection.riskgraph.models.Threshold;
import jakarta.annotation.Resource;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 入图之前的严重度标注：
 *
 * 1. 对每条带 metric + value 的事实解析设备类型、选阈值、分级；
 * 2. 选不到阈值时按 unresolvedPolicy 兜底（分级器本身不兜底）；
 * 3. 读数非法的事实跳过分级，但原样保留，仍参与建图；
 * 4. 越界读数可派生一条 has_symptom 事实（exceeded_limits）。
 *
 * 输入事实不会被修改，标注结果是新的 Fact。
 */
@Slf4j
@Component
public class SeverityAnnotationOperation {

    @Resource
    private ThresholdResolver thresholdResolver;
    @Resource
    private SeverityClassifier severityClassifier;
    @Resource
    private EquipmentTypeResolver equipmentTypeResolver;
    @Resource
    private RiskProperties riskProperties;

    @Value
    public static class Result {
        List<Fact> facts;
        int classifiedCount;
        int unclassifiedCount;
        int derivedSymptomCount;
    }

    public Result annotate(List<Fact> facts, List<Threshold> thresholds, List<Equipment> equipment) {
        if (CollectionUtil.isEmpty(facts)) return new Result(Collections.emptyList(), 0, 0, 0);

        Map<String, Equipment> registry = new LinkedHashMap<>();
        if (equipment != null) {
            for (Equipment e : equipment) {
                if (e == null || StrUtil.isBlank(e.getEquipmentId())) continue;
                registry.putIfAbsent(e.getEquipmentId(), e);
            }
        }

        RiskProperties.Classification cfg = riskProperties.getClassification();
        List<Fact> out = new ArrayList<>(facts.size());
        int classified = 0;
        int unclassified = 0;
        int derived = 0;

        for (Fact fact : facts) {
            if (fact == null) continue;
            String equipmentId = equipmentKey(fact);
            Fact located = fillLocation(fact, equipmentId, registry);

            if (!located.isMetricReading()) {
                out.add(located);
                continue;
            }

            String equipmentType = equipmentTypeResolver.resolve(equipmentId, registry);

            Optional<Threshold> threshold = thresholdResolver.resolve(
                    thresholds, located.getMetric(), equipmentType, equipmentId);

            if (threshold.isEmpty()) {
                // 没有阈值 = 没有严重度信号，兜底策略在这里而不是在分级器里
                out.add(applyUnresolvedPolicy(located, cfg.getUnresolvedPolicy()));
                continue;
            }

            Severity severity;
            try {
                severity = severityClassifier.classify(threshold.get(), located.getValue());
            } catch (InvalidMetricValueException e) {
                log.warn("skip classification: subject={}, metric={}, value={}",
                        located.getSubjectId(), e.getMetric(), e.getValue());
                unclassified++;
                out.add(located);
                continue;
            }

            classified++;
            Fact annotated = located.toBuilder().severity(severity).build();
            out.add(annotated);

            if (Boolean.TRUE.equals(cfg.getDeriveSymptoms()) && SeverityClassifier.isBreach(severity)) {
                out.add(deriveSymptom(annotated, cfg.getSymptomLabel()));
                derived++;
            }
        }

        log.info("severity annotation: facts={}, classified={}, unclassified={}, derivedSymptoms={}",
                facts.size(), classified, unclassified, derived);
        return new Result(out, classified, unclassified, derived);
    }

    /**
     * 没有 equipment_id 时以 subject 作为设备 id，阈值与位置查找共用。
     */
    private static String equipmentKey(Fact fact) {
        return StrUtil.isNotBlank(fact.getEquipmentId()) ? fact.getEquipmentId() : fact.getSubjectId();
    }

    private Fact fillLocation(Fact fact, String equipmentId, Map<String, Equipment> registry) {
        if (StrUtil.isNotBlank(fact.getLocationId()) || StrUtil.isBlank(equipmentId)) return fact;
        Equipment e = registry.get(equipmentId);
        if (e == null || StrUtil.isBlank(e.getLocationId())) return fact;
        return fact.toBuilder().locationId(e.getLocationId()).build();
    }

    private Fact applyUnresolvedPolicy(Fact fact, RiskProperties.UnresolvedPolicy policy) {
        if (policy == RiskProperties.UnresolvedPolicy.NOMINAL) {
            return fact.toBuilder().severity(Severity.MED).build();
        }
        return fact;
    }

    private Fact deriveSymptom(Fact reading, String symptomLabel) {
        return Fact.builder()
                .subjectId(reading.getSubjectId())
                .subjectType(reading.getSubjectType())
                .predicate(Fact.PREDICATE_HAS_SYMPTOM)
                .objectId(symptomLabel)
                .objectType("symptom")
                .severity(reading.getSeverity())
                .locationId(reading.getLocationId())
                .equipmentId(reading.getEquipmentId())
                .timestamp(reading.getTimestamp())
                .build();
    }
}
