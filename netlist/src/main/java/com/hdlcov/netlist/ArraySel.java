package com.hdlcov.netlist;

import java.util.List;
import java.util.Objects;

/** Constant element select of an unpacked array, indexed from zero. */
public final class ArraySel extends Expr {
    private final Expr from;
    private final int index;

    public ArraySel(FileLine fileLine, Expr from, int index) {
        super(fileLine);
        if (index < 0) {
            throw new IllegalArgumentException("Negative array index " + index);
        }
        this.from = adopt(Objects.requireNonNull(from, "from"));
        this.index = index;
    }

    public Expr from() {
        return from;
    }

    public int index() {
        return index;
    }

    @Override
    public List<Node> children() {
        return List.of(from);
    }

    @Override
    protected Expr copy(VarRef.Access access) {
        return new ArraySel(fileLine(), from.copy(access), index);
    }

    @Override
    protected String details() {
        return "[" + index + "]";
    }
}
