package com.hdlcov.netlist;

import java.util.Objects;

/**
 * A module, interface, package or class.
 *
 * <p>Classes may be nested inside another module. The elaborator wraps the user's top module in
 * a generated shell module flagged with {@link #isTop()}.
 */
public final class Module extends BlockNode {

    public enum Kind {
        MODULE,
        INTERFACE,
        PACKAGE,
        CLASS
    }

    private final String name;
    private final Kind kind;
    private final boolean top;

    public Module(FileLine fileLine, String name, Kind kind, boolean top) {
        super(fileLine);
        this.name = Objects.requireNonNull(name, "name");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.top = top;
    }

    public Module(FileLine fileLine, String name) {
        this(fileLine, name, Kind.MODULE, false);
    }

    public String name() {
        return name;
    }

    /** Name as shown to users, with parameter and hierarchy escapes decoded. */
    public String prettyName() {
        return Names.pretty(name);
    }

    public Kind kind() {
        return kind;
    }

    public boolean isClass() {
        return kind == Kind.CLASS;
    }

    public boolean isTop() {
        return top;
    }

    @Override
    public void accept(NodeVisitor visitor) {
        visitor.visit(this);
    }

    @Override
    protected String details() {
        return kind.name().toLowerCase() + " " + name + (top ? " [TOP]" : "");
    }
}
