package com.hdlcov.netlist;

import java.util.Objects;

/** Reference to a variable, read or written. */
public final class VarRef extends Expr {

    public enum Access {
        READ,
        WRITE
    }

    private final Var var;
    private final Access access;

    public VarRef(FileLine fileLine, Var var, Access access) {
        super(fileLine);
        this.var = Objects.requireNonNull(var, "var");
        this.access = Objects.requireNonNull(access, "access");
    }

    public Var var() {
        return var;
    }

    public Access access() {
        return access;
    }

    @Override
    protected Expr copy(Access newAccess) {
        return new VarRef(fileLine(), var, newAccess == null ? access : newAccess);
    }

    @Override
    protected String details() {
        return var.name() + (access == Access.WRITE ? " [LV]" : " [RV]");
    }
}
