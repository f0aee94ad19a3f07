package com.hdlcov.netlist;

import java.util.Objects;

/**
 * A pragma left in the tree by the front end. Some pragmas carry the statements they apply to as
 * their body.
 */
public final class Pragma extends BlockNode {

    public enum Type {
        /** {@code coverage_block_off}: do not cover the enclosing block. */
        COVERAGE_BLOCK_OFF,
        HIER_BLOCK,
        INLINE_MODULE,
        NO_INLINE_MODULE,
        PUBLIC_MODULE
    }

    private final Type type;

    public Pragma(FileLine fileLine, Type type) {
        super(fileLine);
        this.type = Objects.requireNonNull(type, "type");
    }

    public Type type() {
        return type;
    }

    @Override
    public void accept(NodeVisitor visitor) {
        visitor.visit(this);
    }

    @Override
    protected String details() {
        return type.name();
    }
}
