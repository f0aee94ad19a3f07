package com.hdlcov.netlist;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/** A {@code case} statement and its arms. */
public final class Case extends Node {
    private final Expr expr;
    private final List<CaseItem> items = new ArrayList<>();

    public Case(FileLine fileLine, Expr expr) {
        super(fileLine);
        this.expr = adopt(Objects.requireNonNull(expr, "expr"));
    }

    public Expr expr() {
        return expr;
    }

    public List<CaseItem> items() {
        return Collections.unmodifiableList(items);
    }

    public CaseItem addItem(CaseItem item) {
        items.add(adopt(item));
        return item;
    }

    @Override
    public List<Node> children() {
        List<Node> result = new ArrayList<>(1 + items.size());
        result.add(expr);
        result.addAll(items);
        return result;
    }

    @Override
    protected boolean removeChild(Node child) {
        return removeIdentity(items, child);
    }

    @Override
    public void accept(NodeVisitor visitor) {
        visitor.visit(this);
    }
}
