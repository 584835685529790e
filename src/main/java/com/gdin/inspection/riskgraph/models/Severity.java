package com.gdin.inspection.riskgraph.models;

/**
 * 风险等级，按 rank 全序：NORMAL < LOW < MED < HIGH。
 *
 * NORMAL 只用于图节点属性（没有观察到任何严重度），阈值分级只会产出 LOW / MED / HIGH。
 */
public enum Severity {
    NORMAL(0),
    LOW(1),
    MED(2),
    HIGH(3);

    private final int defaultRank;

    Severity(int defaultRank) {
        this.defaultRank = defaultRank;
    }

    public int getDefaultRank() {
        return defaultRank;
    }

    /**
     * 取两者中更严重的一个，null 视为 NORMAL。
     */
    public static Severity max(Severity a, Severity b) {
        Severity x = a == null ? NORMAL : a;
        Severity y = b == null ? NORMAL : b;
        return x.defaultRank >= y.defaultRank ? x : y;
    }
}
