package com.hdlcov.netlist;

import java.util.Objects;

/** A {@code $display} style system task with a constant format. */
public final class Display extends Node {
    private final String format;

    public Display(FileLine fileLine, String format) {
        super(fileLine);
        this.format = Objects.requireNonNull(format, "format");
    }

    public String format() {
        return format;
    }

    @Override
    public void accept(NodeVisitor visitor) {
        visitor.visit(this);
    }

    @Override
    protected String details() {
        return "\"" + format + "\"";
    }
}
