package com.hdlcov.netlist;

import java.util.Objects;

/** An {@code initial}, {@code always} or {@code final} process. */
public final class Procedure extends BlockNode {

    public enum Kind {
        INITIAL,
        ALWAYS,
        ALWAYS_COMB,
        ALWAYS_FF,
        FINAL
    }

    private final Kind kind;

    public Procedure(FileLine fileLine, Kind kind) {
        super(fileLine);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public Kind kind() {
        return kind;
    }

    @Override
    public void accept(NodeVisitor visitor) {
        visitor.visit(this);
    }

    @Override
    protected String details() {
        return kind.name().toLowerCase();
    }
}
