package com.hdlcov.netlist;

import java.util.Objects;

/**
 * Declaration of one coverage point, owned by the module it instruments.
 *
 * <p>The bin number is assigned when the module's counters are laid out by the emitter; until
 * then it stays {@link #UNASSIGNED}.
 */
public final class CoverDecl extends Node {
    public static final int UNASSIGNED = -1;

    private final String page;
    private final String comment;
    private final String linesCov;
    private final int offset;
    private String hier = "";
    private int binNum = UNASSIGNED;

    public CoverDecl(FileLine fileLine, String page, String comment, String linesCov, int offset) {
        super(fileLine);
        this.page = Objects.requireNonNull(page, "page");
        this.comment = Objects.requireNonNull(comment, "comment");
        this.linesCov = Objects.requireNonNull(linesCov, "linesCov");
        this.offset = offset;
    }

    /** Report page, {@code <category>/<module>}. */
    public String page() {
        return page;
    }

    public String comment() {
        return comment;
    }

    /** Covered source lines as a range list such as {@code 3-5,9}. */
    public String linesCov() {
        return linesCov;
    }

    /** Column offset separating points that share a source location. */
    public int offset() {
        return offset;
    }

    public String hier() {
        return hier;
    }

    public void hier(String hier) {
        this.hier = Objects.requireNonNull(hier, "hier");
    }

    public int binNum() {
        return binNum;
    }

    public void binNum(int binNum) {
        this.binNum = binNum;
    }

    @Override
    public void accept(NodeVisitor visitor) {
        visitor.visit(this);
    }

    @Override
    protected String details() {
        return "page=" + page + " comment=" + comment + " lines=" + linesCov
                + (offset != 0 ? " offset=" + offset : "")
                + (hier.isEmpty() ? "" : " hier=" + hier);
    }
}
