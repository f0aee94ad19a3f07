package com.hdlcov.netlist;

import java.util.List;
import java.util.Objects;

/** Constant bit slice {@code from[lsb +: width]}. */
public final class Sel extends Expr {
    private final Expr from;
    private final int lsb;
    private final int width;

    public Sel(FileLine fileLine, Expr from, int lsb, int width) {
        super(fileLine);
        if (lsb < 0 || width <= 0) {
            throw new IllegalArgumentException("Bad selection lsb=" + lsb + " width=" + width);
        }
        this.from = adopt(Objects.requireNonNull(from, "from"));
        this.lsb = lsb;
        this.width = width;
    }

    public Expr from() {
        return from;
    }

    public int lsb() {
        return lsb;
    }

    public int width() {
        return width;
    }

    @Override
    public List<Node> children() {
        return List.of(from);
    }

    @Override
    protected Expr copy(VarRef.Access access) {
        return new Sel(fileLine(), from.copy(access), lsb, width);
    }

    @Override
    protected String details() {
        return "lsb=" + lsb + " width=" + width;
    }
}
