package com.flowmable.enhancer;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One suggested enhancement and why it is suggested.
 */
public record Recommendation(String action, String reason) {

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("action", action);
        map.put("reason", reason);
        return map;
    }
}
