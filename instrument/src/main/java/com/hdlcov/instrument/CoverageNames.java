package com.hdlcov.instrument;

import java.util.HashMap;
import java.util.Map;

/** Hands out names for generated variables, suffixing repeats with {@code _1}, {@code _2}... */
final class CoverageNames {
    private final Map<String, Integer> varNames = new HashMap<>();

    String unique(String base) {
        int suffix = varNames.merge(base, 1, Integer::sum) - 1;
        return suffix == 0 ? base : base + "_" + suffix;
    }

    /** Forgets all names; called when a new top-level module starts. */
    void clear() {
        varNames.clear();
    }
}
