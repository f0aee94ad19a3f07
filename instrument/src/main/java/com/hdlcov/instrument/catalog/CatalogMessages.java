package com.hdlcov.instrument.catalog;

import com.hdlcov.proto.CatalogProto.CoverPoint;
import com.hdlcov.proto.CatalogProto.ModuleCatalog;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** Converts catalogs to their wire form. */
public final class CatalogMessages {

    private CatalogMessages() {}

    public static List<ModuleCatalog> toMessages(CoverageCatalog catalog) {
        List<ModuleCatalog> messages = new ArrayList<>();
        for (Map.Entry<String, List<CatalogEntry>> module : catalog.byModule().entrySet()) {
            ModuleCatalog.Builder builder = ModuleCatalog.newBuilder().setModule(module.getKey());
            for (CatalogEntry entry : module.getValue()) {
                builder.addPoints(toMessage(entry));
            }
            messages.add(builder.build());
        }
        return messages;
    }

    static CoverPoint toMessage(CatalogEntry entry) {
        return CoverPoint.newBuilder()
                .setPage(entry.page())
                .setHier(entry.hier())
                .setComment(entry.comment())
                .setLines(entry.linesCov())
                .setOffset(entry.offset())
                .setFilename(entry.filename())
                .setLine(entry.line())
                .build();
    }
}
