package com.hdlcov.netlist;

import java.util.Objects;

/** A {@code begin}/{@code end} block, possibly named or produced by a generate construct. */
public final class Begin extends BlockNode {
    private final String name;
    private final boolean generate;

    public Begin(FileLine fileLine, String name, boolean generate) {
        super(fileLine);
        this.name = Objects.requireNonNull(name, "name");
        this.generate = generate;
    }

    /** Block label, empty for an unnamed block. */
    public String name() {
        return name;
    }

    public boolean isGenerate() {
        return generate;
    }

    @Override
    public void accept(NodeVisitor visitor) {
        visitor.visit(this);
    }

    @Override
    protected String details() {
        return (generate ? "generate " : "") + (name.isEmpty() ? "<unnamed>" : name);
    }
}
