package com.hdlcov.instrument;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/** Number of coverage declarations created per report category. */
public final class CoverageStats {
    private final Map<String, Integer> byCategory = new TreeMap<>();

    void record(String category) {
        byCategory.merge(category, 1, Integer::sum);
    }

    public int count(String category) {
        return byCategory.getOrDefault(category, 0);
    }

    public int total() {
        int total = 0;
        for (int value : byCategory.values()) {
            total += value;
        }
        return total;
    }

    public Map<String, Integer> byCategory() {
        return Collections.unmodifiableMap(byCategory);
    }

    @Override
    public String toString() {
        return "CoverageStats" + byCategory;
    }
}
