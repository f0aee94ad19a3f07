package com.hdlcov.netlist;

import java.util.Objects;

/** A function or task. DPI imports have no body of their own. */
public final class Task extends BlockNode {
    private final String name;
    private final boolean function;
    private final boolean dpiImport;

    public Task(FileLine fileLine, String name, boolean function, boolean dpiImport) {
        super(fileLine);
        this.name = Objects.requireNonNull(name, "name");
        this.function = function;
        this.dpiImport = dpiImport;
    }

    public String name() {
        return name;
    }

    public boolean isFunction() {
        return function;
    }

    public boolean dpiImport() {
        return dpiImport;
    }

    @Override
    public void accept(NodeVisitor visitor) {
        visitor.visit(this);
    }

    @Override
    protected String details() {
        return (function ? "function " : "task ") + name + (dpiImport ? " [DPI-IMPORT]" : "");
    }
}
