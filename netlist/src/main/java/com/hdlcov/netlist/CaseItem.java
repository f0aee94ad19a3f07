package com.hdlcov.netlist;

import java.util.ArrayList;
import java.util.List;

/** One arm of a case statement. An arm without match expressions is the {@code default}. */
public final class CaseItem extends BlockNode {
    private final List<Expr> conds = new ArrayList<>();

    public CaseItem(FileLine fileLine, List<? extends Expr> conds) {
        super(fileLine);
        for (Expr cond : conds) {
            this.conds.add(adopt(cond));
        }
    }

    public List<Expr> conds() {
        return List.copyOf(conds);
    }

    public boolean isDefault() {
        return conds.isEmpty();
    }

    @Override
    protected List<Node> leadingChildren() {
        return List.copyOf(conds);
    }

    @Override
    public void accept(NodeVisitor visitor) {
        visitor.visit(this);
    }

    @Override
    protected String details() {
        return isDefault() ? "default" : "";
    }
}
