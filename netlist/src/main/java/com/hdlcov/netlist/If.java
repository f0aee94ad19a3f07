package com.hdlcov.netlist;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Procedural {@code if}. An {@code else if} chain is an If whose else list holds exactly one
 * nested If.
 */
public final class If extends Node {
    private final Expr cond;
    private final List<Node> thens = new ArrayList<>();
    private final List<Node> elses = new ArrayList<>();

    public If(FileLine fileLine, Expr cond) {
        super(fileLine);
        this.cond = adopt(Objects.requireNonNull(cond, "cond"));
    }

    public Expr cond() {
        return cond;
    }

    public List<Node> thens() {
        return Collections.unmodifiableList(thens);
    }

    public List<Node> elses() {
        return Collections.unmodifiableList(elses);
    }

    public void addThen(Node stmt) {
        thens.add(adopt(stmt));
    }

    public void addThens(Collection<? extends Node> stmts) {
        for (Node stmt : stmts) {
            addThen(stmt);
        }
    }

    public void addElse(Node stmt) {
        elses.add(adopt(stmt));
    }

    public void addElses(Collection<? extends Node> stmts) {
        for (Node stmt : stmts) {
            addElse(stmt);
        }
    }

    @Override
    public List<Node> children() {
        List<Node> result = new ArrayList<>(1 + thens.size() + elses.size());
        result.add(cond);
        result.addAll(thens);
        result.addAll(elses);
        return result;
    }

    @Override
    protected boolean removeChild(Node child) {
        return removeIdentity(thens, child) || removeIdentity(elses, child);
    }

    @Override
    public void accept(NodeVisitor visitor) {
        visitor.visit(this);
    }
}
