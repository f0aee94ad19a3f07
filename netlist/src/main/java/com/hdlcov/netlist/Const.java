package com.hdlcov.netlist;

/** Sized integer constant. */
public final class Const extends Expr {
    private final int width;
    private final long value;

    public Const(FileLine fileLine, int width, long value) {
        super(fileLine);
        if (width <= 0 || width > 64) {
            throw new IllegalArgumentException("Unsupported constant width " + width);
        }
        this.width = width;
        this.value = value;
    }

    public int width() {
        return width;
    }

    public long value() {
        return value;
    }

    @Override
    protected Expr copy(VarRef.Access access) {
        return new Const(fileLine(), width, value);
    }

    @Override
    protected String details() {
        return width + "'h" + Long.toHexString(value);
    }
}
