package com.gdin.inspection.riskgraph.repository;

import cn.hutool.core.util.StrUtil;
import com.gdin.inspection.riskgraph.exception.RiskAnalysisException;
import com.gdin.inspection.riskgraph.models.Equipment;
import com.gdin.inspection.riskgraph.models.Fact;
import com.gdin.inspection.riskgraph.models.Threshold;
import com.gdin.inspection.riskgraph.util.IOUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.List;

/**
 * 从 JSON 资源（classpath: / file:）读取快照。资源路径为空或不存在时视为空列表。
 */
@Slf4j
public class JsonResourceRiskSnapshotRepository implements RiskSnapshotRepository {

    private final ResourceLoader resourceLoader;
    private final String factsLocation;
    private final String thresholdsLocation;
    private final String equipmentLocation;

    public JsonResourceRiskSnapshotRepository(
            ResourceLoader resourceLoader,
            String factsLocation,
            String thresholdsLocation,
            String equipmentLocation
    ) {
        this.resourceLoader = resourceLoader;
        this.factsLocation = factsLocation;
        this.thresholdsLocation = thresholdsLocation;
        this.equipmentLocation = equipmentLocation;
    }

    @Override
    public List<Fact> loadFacts() {
        return read(factsLocation, Fact.class);
    }

    @Override
    public List<Threshold> loadThresholds() {
        return read(thresholdsLocation, Threshold.class);
    }

    @Override
    public List<Equipment> loadEquipment() {
        return read(equipmentLocation, Equipment.class);
    }

    private <T> List<T> read(String location, Class<T> type) {
        if (StrUtil.isBlank(location)) return Collections.emptyList();
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            log.warn("snapshot resource not found: {}", location);
            return Collections.emptyList();
        }
        try (InputStream is = resource.getInputStream()) {
            List<T> items = IOUtil.readList(is, type);
            log.debug("loaded {} {} from {}", items.size(), type.getSimpleName(), location);
            return items;
        } catch (IOException e) {
            throw new RiskAnalysisException("读取快照资源失败: " + location, e);
        }
    }
}
