package com.hdlcov.netlist;

/** A {@code $stop} or {@code $fatal} call. Code leading to it is never worth covering. */
public final class Stop extends Node {
    private final boolean fatal;

    public Stop(FileLine fileLine, boolean fatal) {
        super(fileLine);
        this.fatal = fatal;
    }

    public boolean isFatal() {
        return fatal;
    }

    @Override
    public void accept(NodeVisitor visitor) {
        visitor.visit(this);
    }

    @Override
    protected String details() {
        return fatal ? "$fatal" : "$stop";
    }
}
