package com.hdlcov.netlist;

import java.util.List;
import java.util.Objects;

/** Procedural or continuous assignment {@code lhs = rhs}. */
public final class Assign extends Node {
    private final Expr lhs;
    private final Expr rhs;

    public Assign(FileLine fileLine, Expr lhs, Expr rhs) {
        super(fileLine);
        this.lhs = adopt(Objects.requireNonNull(lhs, "lhs"));
        this.rhs = adopt(Objects.requireNonNull(rhs, "rhs"));
    }

    public Expr lhs() {
        return lhs;
    }

    public Expr rhs() {
        return rhs;
    }

    @Override
    public List<Node> children() {
        return List.of(lhs, rhs);
    }

    @Override
    public void accept(NodeVisitor visitor) {
        visitor.visit(this);
    }
}
