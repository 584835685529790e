package com.gdin.inspection.riskgraph.config.properties;

import com.gdin.inspection.riskgraph.models.Severity;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.io.Serializable;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@ConfigurationProperties(prefix = "gdin.ai.risk")
@Component
public class RiskProperties implements Serializable {
    private Classification classification = new Classification();
    private Ranking ranking = new Ranking();
    private Embedding embedding = new Embedding();
    private Startup startup = new Startup();

    // 并行 worker 数（随机游走 / 相似度 / betweenness 共用）
    private Integer workers = 4;

    @Data
    public static class Classification implements Serializable {
        // 找不到阈值时的兜底策略：KEEP=保留上游给的严重度（可能为空）；NOMINAL=按区间内处理(MED)
        private UnresolvedPolicy unresolvedPolicy = UnresolvedPolicy.KEEP;
        // 越界读数是否派生 has_symptom 事实
        private Boolean deriveSymptoms = true;
        private String symptomLabel = "exceeded_limits";
        // 设备 id 前缀 -> 设备类型，设备登记里查不到时使用
        private Map<String, String> equipmentTypePrefixes = defaultPrefixes();
    }

    @Data
    public static class Ranking implements Serializable {
        // 严重度排序权重，缺省 HIGH:3, MED:2, LOW:1, NORMAL:0
        private Map<Severity, Integer> severityRank = defaultRanks();
        // 进入按位置分组的严重度
        private List<Severity> elevatedSeverities = List.of(
                Severity.MED,
                Severity.HIGH
        );
        private Integer topRiskNodes = 10;
    }

    @Data
    public static class Embedding implements Serializable {
        private Integer dimensions = 32;
        private Integer walkLength = 10;
        private Integer numWalks = 100;
        private Integer window = 5;
        // node2vec 返回参数 p / 进出参数 q，1/1 即均匀随机游走
        private Double returnParam = 1.0;
        private Double inOutParam = 1.0;
        private Integer epochs = 5;
        private Integer negativeSamples = 5;
        private Double learningRate = 0.025;
        private Double minLearningRate = 0.0001;
        private Long seed = 42L;
        private Integer topSimilarPairs = 10;
    }

    @Data
    public static class Startup implements Serializable {
        // 启动时是否对种子快照跑一次分析
        private Boolean enabled = false;
        private String factsResource = "classpath:seed/facts.json";
        private String thresholdsResource = "classpath:seed/thresholds.json";
        private String equipmentResource = "classpath:seed/equipment.json";
        // 报告 JSON 输出路径，为空则只打日志
        private String reportOutput;
    }

    public enum UnresolvedPolicy {
        KEEP,
        NOMINAL
    }

    private static Map<String, String> defaultPrefixes() {
        Map<String, String> prefixes = new LinkedHashMap<>();
        prefixes.put("POWER_END", "power_end");
        prefixes.put("FLUID_END", "fluid_end");
        prefixes.put("FLUEND", "fluid_end");
        prefixes.put("TRANS", "transmission");
        prefixes.put("LOCKUP", "lockup");
        prefixes.put("ENG", "engine");
        return prefixes;
    }

    private static Map<Severity, Integer> defaultRanks() {
        Map<Severity, Integer> ranks = new LinkedHashMap<>();
        for (Severity s : Severity.values()) {
            ranks.put(s, s.getDefaultRank());
        }
        return ranks;
    }
}
