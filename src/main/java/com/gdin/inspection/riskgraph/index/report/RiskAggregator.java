package com.gdin.inspection.riskgraph.index.report;

import cn.hutool.core.collection.CollectionUtil;
import cn.hutool.core.util.StrUtil;
import com.gdin.inspection.riskgraph.models.Fact;
import com.gdin.inspection.riskgraph.models.LocationRiskFact;
import com.gdin.inspection.riskgraph.models.RiskNode;
import com.gdin.inspection.riskgraph.models.RiskReport;
import com.gdin.inspection.riskgraph.models.Severity;
import com.gdin.inspection.riskgraph.models.SimilarPair;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * 汇总报告：排好序的高风险节点 + 相似节点对原样放入，
 * 严重度属于 elevated 集合的事实按 location 分组（组内保持输入顺序，组按 location 字典序）。
 * 没有 location 的事实不进分组。
 */
@Slf4j
@Component
public class RiskAggregator {

    public RiskReport aggregate(
            List<Fact> facts,
            List<RiskNode> topRiskNodes,
            List<SimilarPair> topSimilarPairs,
            Collection<Severity> elevatedSeverities,
            RiskReport.Stats stats
    ) {
        Map<String, List<LocationRiskFact>> groups = groupByLocation(facts, elevatedSeverities);

        log.info("risk report: topRiskNodes={}, topSimilarPairs={}, locations={}",
                sizeOf(topRiskNodes), sizeOf(topSimilarPairs), groups.size());

        return RiskReport.builder()
                .topRiskNodes(topRiskNodes == null ? List.of() : List.copyOf(topRiskNodes))
                .topSimilarPairs(topSimilarPairs == null ? List.of() : List.copyOf(topSimilarPairs))
                .locationRiskGroups(groups)
                .stats(stats == null ? RiskReport.Stats.builder().build() : stats)
                .build();
    }

    Map<String, List<LocationRiskFact>> groupByLocation(List<Fact> facts, Collection<Severity> elevatedSeverities) {
        if (CollectionUtil.isEmpty(facts) || CollectionUtil.isEmpty(elevatedSeverities)) return Map.of();
        Set<Severity> elevated = EnumSet.copyOf(elevatedSeverities);

        Map<String, List<LocationRiskFact>> grouped = new TreeMap<>();
        for (Fact f : facts) {
            if (f == null || f.getSeverity() == null || !elevated.contains(f.getSeverity())) continue;
            if (StrUtil.isBlank(f.getLocationId())) continue;
            grouped.computeIfAbsent(f.getLocationId(), k -> new ArrayList<>()).add(LocationRiskFact.from(f));
        }

        Map<String, List<LocationRiskFact>> out = new LinkedHashMap<>();
        grouped.forEach((loc, list) -> out.put(loc, Collections.unmodifiableList(list)));
        return Collections.unmodifiableMap(out);
    }

    private static int sizeOf(List<?> list) {
        return list == null ? 0 : list.size();
    }
}
