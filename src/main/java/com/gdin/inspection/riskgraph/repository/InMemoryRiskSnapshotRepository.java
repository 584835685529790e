package com.gdin.inspection.riskgraph.repository;

import com.gdin.inspection.riskgraph.models.Equipment;
import com.gdin.inspection.riskgraph.models.Fact;
import com.gdin.inspection.riskgraph.models.Threshold;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 线程安全的内存实现，仅用于测试/本地开发。
 */
public class InMemoryRiskSnapshotRepository implements RiskSnapshotRepository {

    private final List<Fact> facts = new CopyOnWriteArrayList<>();
    private final List<Threshold> thresholds = new CopyOnWriteArrayList<>();
    private final List<Equipment> equipment = new CopyOnWriteArrayList<>();

    public InMemoryRiskSnapshotRepository saveFacts(List<Fact> items) {
        facts.addAll(items);
        return this;
    }

    public InMemoryRiskSnapshotRepository saveThresholds(List<Threshold> items) {
        thresholds.addAll(items);
        return this;
    }

    public InMemoryRiskSnapshotRepository saveEquipment(List<Equipment> items) {
        equipment.addAll(items);
        return this;
    }

    @Override
    public List<Fact> loadFacts() {
        return new ArrayList<>(facts);
    }

    @Override
    public List<Threshold> loadThresholds() {
        return new ArrayList<>(thresholds);
    }

    @Override
    public List<Equipment> loadEquipment() {
        return new ArrayList<>(equipment);
    }
}
