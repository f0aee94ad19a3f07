package com.hdlcov.netlist;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A user {@code cover property} statement.
 *
 * <p>The increments counting it live in a separate list so later stages can find them; an
 * earlier pass may have filled that list already.
 */
public final class Cover extends Node {
    private final String name;
    private final Expr prop;
    private final List<Node> stmts = new ArrayList<>();
    private final List<Node> coverIncs = new ArrayList<>();

    public Cover(FileLine fileLine, String name, Expr prop) {
        super(fileLine);
        this.name = Objects.requireNonNull(name, "name");
        this.prop = adopt(Objects.requireNonNull(prop, "prop"));
    }

    public String name() {
        return name;
    }

    public Expr prop() {
        return prop;
    }

    /** Pass statements executed when the property matches. */
    public List<Node> stmts() {
        return Collections.unmodifiableList(stmts);
    }

    public void addStmt(Node stmt) {
        stmts.add(adopt(stmt));
    }

    public List<Node> coverIncs() {
        return Collections.unmodifiableList(coverIncs);
    }

    public void addCoverIncs(Collection<? extends Node> incs) {
        for (Node inc : incs) {
            coverIncs.add(adopt(inc));
        }
    }

    @Override
    public List<Node> children() {
        List<Node> result = new ArrayList<>(1 + stmts.size() + coverIncs.size());
        result.add(prop);
        result.addAll(stmts);
        result.addAll(coverIncs);
        return result;
    }

    @Override
    protected boolean removeChild(Node child) {
        return removeIdentity(stmts, child) || removeIdentity(coverIncs, child);
    }

    @Override
    public void accept(NodeVisitor visitor) {
        visitor.visit(this);
    }

    @Override
    protected String details() {
        return name;
    }
}
