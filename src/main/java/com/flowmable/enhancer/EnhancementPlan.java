package com.flowmable.enhancer;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered stages chosen for one raster, with the statistics and report they
 * were planned from. Immutable; stage parameters are never recomputed.
 *
 * @param statistics  Statistics measured before any stage ran
 * @param diagnostics Classification of those statistics
 * @param stages      Stages in execution order
 */
public record EnhancementPlan(
        DetailedStatistics statistics,
        DiagnosticsReport diagnostics,
        List<EnhancementStage> stages
) {
    public EnhancementPlan {
        stages = List.copyOf(stages);
    }

    public List<StageType> stageTypes() {
        return stages.stream().map(EnhancementStage::type).toList();
    }

    public boolean includes(StageType type) {
        return stages.stream().anyMatch(s -> s.type() == type);
    }

    public List<Map<String, Object>> toList() {
        List<Map<String, Object>> out = new ArrayList<>(stages.size());
        for (EnhancementStage stage : stages) {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("stage", stage.type().key());
            map.put("name", stage.type().displayName());
            map.put("parameters", stage.parameters());
            out.add(map);
        }
        return out;
    }
}
