package com.hdlcov.netlist;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/** A node owning an ordered statement list. */
public abstract class BlockNode extends Node {
    private final List<Node> stmts = new ArrayList<>();

    protected BlockNode(FileLine fileLine) {
        super(fileLine);
    }

    public final List<Node> stmts() {
        return Collections.unmodifiableList(stmts);
    }

    /** Appends a statement at the end of the body. */
    public final void addStmt(Node stmt) {
        stmts.add(adopt(stmt));
    }

    public final void addStmts(Collection<? extends Node> newStmts) {
        for (Node stmt : newStmts) {
            addStmt(stmt);
        }
    }

    /** Children visited before the statements, such as a loop condition. */
    protected List<Node> leadingChildren() {
        return List.of();
    }

    @Override
    public List<Node> children() {
        List<Node> leading = leadingChildren();
        List<Node> result = new ArrayList<>(leading.size() + stmts.size());
        result.addAll(leading);
        result.addAll(stmts);
        return result;
    }

    @Override
    protected boolean removeChild(Node child) {
        return removeIdentity(stmts, child);
    }
}
