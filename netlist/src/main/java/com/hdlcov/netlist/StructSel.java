package com.hdlcov.netlist;

import java.util.List;
import java.util.Objects;

/** Member access of an unpacked struct. */
public final class StructSel extends Expr {
    private final Expr from;
    private final String member;

    public StructSel(FileLine fileLine, Expr from, String member) {
        super(fileLine);
        this.from = adopt(Objects.requireNonNull(from, "from"));
        this.member = Objects.requireNonNull(member, "member");
    }

    public Expr from() {
        return from;
    }

    public String member() {
        return member;
    }

    @Override
    public List<Node> children() {
        return List.of(from);
    }

    @Override
    protected Expr copy(VarRef.Access access) {
        return new StructSel(fileLine(), from.copy(access), member);
    }

    @Override
    protected String details() {
        return "." + member;
    }
}
