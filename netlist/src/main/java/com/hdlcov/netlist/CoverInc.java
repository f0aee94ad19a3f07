package com.hdlcov.netlist;

import java.util.Objects;

/** Increments the counter of its declaration when execution reaches it. */
public final class CoverInc extends Node {
    private final CoverDecl decl;

    public CoverInc(FileLine fileLine, CoverDecl decl) {
        super(fileLine);
        this.decl = Objects.requireNonNull(decl, "decl");
    }

    public CoverDecl decl() {
        return decl;
    }

    @Override
    public void accept(NodeVisitor visitor) {
        visitor.visit(this);
    }

    @Override
    protected String details() {
        return "-> " + decl.page() + " " + decl.comment();
    }
}
