package com.hdlcov.netlist;

/** Base class of expressions. */
public abstract class Expr extends Node {

    protected Expr(FileLine fileLine) {
        super(fileLine);
    }

    /** Returns an independently owned copy of this expression tree. */
    public final Expr deepCopy() {
        return copy(null);
    }

    /** Returns a copy whose variable references all use the given access. */
    public final Expr deepCopy(VarRef.Access access) {
        return copy(access);
    }

    /** @param access access for copied variable references, {@code null} keeps the original */
    protected abstract Expr copy(VarRef.Access access);

    @Override
    public final void accept(NodeVisitor visitor) {
        visitor.visit(this);
    }
}
