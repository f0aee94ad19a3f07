package com.hdlcov.netlist.dtype;

import java.util.Objects;

/** Built-in scalar or vector type such as {@code logic [7:0]}, {@code int} or {@code real}. */
public final class BasicDType extends DataType {

    public enum Keyword {
        BIT(1, true),
        LOGIC(1, true),
        BYTE(8, true),
        SHORTINT(16, true),
        INT(32, true),
        LONGINT(64, true),
        INTEGER(32, true),
        REAL(64, false),
        STRING(0, false);

        private final int width;
        private final boolean integral;

        Keyword(int width, boolean integral) {
            this.width = width;
            this.integral = integral;
        }

        /** True for keywords whose width can be given by an explicit range. */
        public boolean isRangeable() {
            return this == BIT || this == LOGIC;
        }
    }

    private final Keyword keyword;
    private final boolean ranged;
    private final int left;
    private final int right;

    private BasicDType(Keyword keyword, boolean ranged, int left, int right) {
        this.keyword = Objects.requireNonNull(keyword, "keyword");
        this.ranged = ranged;
        this.left = left;
        this.right = right;
    }

    /** Single bit {@code logic}. */
    public static BasicDType logic() {
        return new BasicDType(Keyword.LOGIC, false, 0, 0);
    }

    /** {@code logic [left:right]}. */
    public static BasicDType logic(int left, int right) {
        return ranged(Keyword.LOGIC, left, right);
    }

    public static BasicDType ranged(Keyword keyword, int left, int right) {
        if (!keyword.isRangeable()) {
            throw new IllegalArgumentException(keyword + " does not take a range");
        }
        return new BasicDType(keyword, true, left, right);
    }

    /**
     * Keyword type with its implied width. Sized integer keywords carry the implicit range
     * {@code [width-1:0]}.
     */
    public static BasicDType of(Keyword keyword) {
        if (keyword.integral && keyword.width > 1) {
            return new BasicDType(keyword, true, keyword.width - 1, 0);
        }
        return new BasicDType(keyword, false, 0, 0);
    }

    /** Unsigned 32-bit counter type used for generated variables. */
    public static BasicDType uint32() {
        return logic(31, 0);
    }

    public Keyword keyword() {
        return keyword;
    }

    public boolean isRanged() {
        return ranged;
    }

    public int left() {
        return left;
    }

    public int right() {
        return right;
    }

    public int lo() {
        return Math.min(left, right);
    }

    public int hi() {
        return Math.max(left, right);
    }

    @Override
    public int width() {
        if (ranged) {
            return hi() - lo() + 1;
        }
        return keyword.width;
    }

    @Override
    public boolean isIntegral() {
        return keyword.integral;
    }

    @Override
    public String prettyTypeName() {
        String name = keyword.name().toLowerCase();
        if (ranged && keyword.isRangeable()) {
            return name + "[" + left + ":" + right + "]";
        }
        return name;
    }
}
