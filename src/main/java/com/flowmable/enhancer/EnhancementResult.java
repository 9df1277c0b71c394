package com.flowmable.enhancer;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one enhancement run.
 *
 * @param before          Full diagnostics of the input
 * @param after           Diagnostics of the output (only metrics and score are reported)
 * @param appliedStages   Stages actually executed, in order
 * @param output          Enhanced raster
 * @param statisticsBefore Statistics of the input
 * @param statisticsAfter  Statistics of the output
 */
public record EnhancementResult(
        DiagnosticsReport before,
        DiagnosticsReport after,
        List<StageType> appliedStages,
        RasterImage output,
        DetailedStatistics statisticsBefore,
        DetailedStatistics statisticsAfter
) {
    public EnhancementResult {
        appliedStages = List.copyOf(appliedStages);
    }

    public List<String> appliedStageNames() {
        return appliedStages.stream().map(StageType::displayName).toList();
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("resolution", output.width() + "x" + output.height());

        Map<String, Object> beforeMap = before.toMap();
        beforeMap.put("statistics", statisticsBefore.toMap());
        map.put("analysis_before", beforeMap);

        Map<String, Object> afterMap = after.toScoreMap();
        afterMap.put("statistics", statisticsAfter.toMap());
        map.put("analysis_after", afterMap);

        List<String> keys = new ArrayList<>(appliedStages.size());
        for (StageType type : appliedStages) {
            keys.add(type.key());
        }
        map.put("stages", keys);
        map.put("enhancements", appliedStageNames());
        return map;
    }
}
