package com.hdlcov.instrument.catalog;

import com.hdlcov.netlist.CoverDecl;
import com.hdlcov.netlist.Module;
import com.hdlcov.netlist.Netlist;
import com.hdlcov.netlist.Node;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Coverage declarations of an instrumented netlist, grouped by owning module. */
public final class CoverageCatalog {
    private final Map<String, List<CatalogEntry>> byModule;

    private CoverageCatalog(Map<String, List<CatalogEntry>> byModule) {
        this.byModule = byModule;
    }

    /** Collects the declarations of every module, nested classes included, in tree order. */
    public static CoverageCatalog collect(Netlist netlist) {
        Map<String, List<CatalogEntry>> byModule = new LinkedHashMap<>();
        for (Node node : netlist.preOrder()) {
            if (node instanceof Module modp) {
                List<CatalogEntry> entries = new ArrayList<>();
                for (Node stmt : modp.stmts()) {
                    if (stmt instanceof CoverDecl declp) {
                        entries.add(CatalogEntry.of(modp.prettyName(), declp));
                    }
                }
                if (!entries.isEmpty()) {
                    byModule.merge(modp.prettyName(), entries, CoverageCatalog::concat);
                }
            }
        }
        Map<String, List<CatalogEntry>> frozen = new LinkedHashMap<>();
        byModule.forEach((name, entries) -> frozen.put(name, List.copyOf(entries)));
        return new CoverageCatalog(Collections.unmodifiableMap(frozen));
    }

    private static List<CatalogEntry> concat(List<CatalogEntry> a, List<CatalogEntry> b) {
        List<CatalogEntry> merged = new ArrayList<>(a);
        merged.addAll(b);
        return merged;
    }

    public Map<String, List<CatalogEntry>> byModule() {
        return byModule;
    }

    public List<CatalogEntry> entries(String module) {
        return byModule.getOrDefault(module, List.of());
    }

    public int size() {
        int size = 0;
        for (List<CatalogEntry> entries : byModule.values()) {
            size += entries.size();
        }
        return size;
    }
}
