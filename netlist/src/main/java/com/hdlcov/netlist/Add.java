package com.hdlcov.netlist;

import java.util.List;
import java.util.Objects;

public final class Add extends Expr {
    private final Expr lhs;
    private final Expr rhs;

    public Add(FileLine fileLine, Expr lhs, Expr rhs) {
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
    protected Expr copy(VarRef.Access access) {
        return new Add(fileLine(), lhs.copy(access), rhs.copy(access));
    }
}
