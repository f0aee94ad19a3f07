package com.hdlcov.netlist;

import java.util.List;
import java.util.Objects;

/** A while-style loop; for and repeat loops arrive already lowered to this form. */
public final class Loop extends BlockNode {
    private final Expr cond;

    public Loop(FileLine fileLine, Expr cond) {
        super(fileLine);
        this.cond = adopt(Objects.requireNonNull(cond, "cond"));
    }

    public Expr cond() {
        return cond;
    }

    @Override
    protected List<Node> leadingChildren() {
        return List.of(cond);
    }

    @Override
    public void accept(NodeVisitor visitor) {
        visitor.visit(this);
    }
}
