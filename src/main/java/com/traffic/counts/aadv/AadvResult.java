package com.traffic.counts.aadv;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

import com.traffic.counts.common.Direction;

/**
 * Annual average daily volume of one count, per direction and overall.
 */
public class AadvResult {

    private final Double overall;
    private final Map<Direction, Double> byDirection;

    public AadvResult(Double overall, Map<Direction, Double> byDirection) {
        this.overall = overall;
        this.byDirection = byDirection.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new EnumMap<>(byDirection));
    }

    /**
     * AADV across all directions, null if the count had no undirected totals.
     */
    public Double overall() {
        return overall;
    }

    public Double forDirection(Direction direction) {
        return byDirection.get(direction);
    }

    public Map<Direction, Double> byDirection() {
        return byDirection;
    }

    /**
     * Direction name (or "all") to value, for logging.
     */
    public Map<String, Double> asMap() {
        Map<String, Double> m = new LinkedHashMap<>();
        if (overall != null) {
            m.put("all", overall);
        }
        for (Map.Entry<Direction, Double> e : byDirection.entrySet()) {
            m.put(e.getKey().dbValue(), e.getValue());
        }
        return m;
    }

    @Override
    public String toString() {
        return "AadvResult" + asMap();
    }
}
