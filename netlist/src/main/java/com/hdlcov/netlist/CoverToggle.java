package com.hdlcov.netlist;

import java.util.List;
import java.util.Objects;

/**
 * Toggle point of one bit lane: counts when the current value differs from the shadow copy kept
 * from the previous evaluation, then refreshes the shadow through {@link #update()}.
 */
public final class CoverToggle extends Node {
    private final CoverInc inc;
    private final Expr current;
    private final Expr previous;
    private final Assign update;

    public CoverToggle(FileLine fileLine, CoverInc inc, Expr current, Expr previous, Assign update) {
        super(fileLine);
        this.inc = adopt(Objects.requireNonNull(inc, "inc"));
        this.current = adopt(Objects.requireNonNull(current, "current"));
        this.previous = adopt(Objects.requireNonNull(previous, "previous"));
        this.update = adopt(Objects.requireNonNull(update, "update"));
    }

    public CoverInc inc() {
        return inc;
    }

    public Expr current() {
        return current;
    }

    public Expr previous() {
        return previous;
    }

    public Assign update() {
        return update;
    }

    @Override
    public List<Node> children() {
        return List.of(inc, current, previous, update);
    }

    @Override
    public void accept(NodeVisitor visitor) {
        visitor.visit(this);
    }
}
