package com.hdlcov.instrument.catalog;

import com.hdlcov.netlist.CoverDecl;

/** Immutable view of one coverage declaration, detached from the tree. */
public record CatalogEntry(
        String module,
        String page,
        String hier,
        String comment,
        String linesCov,
        int offset,
        String filename,
        int line) {

    static CatalogEntry of(String module, CoverDecl declp) {
        return new CatalogEntry(
                module,
                declp.page(),
                declp.hier(),
                declp.comment(),
                declp.linesCov(),
                declp.offset(),
                declp.fileLine().filename(),
                declp.fileLine().lineno());
    }
}
