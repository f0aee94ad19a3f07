package com.hdlcov.netlist.dtype;

import java.util.Objects;

/** Packed array of a packed element type, laid out with element {@code lo} at bit 0. */
public final class PackArrayDType extends DataType {
    private final DataType subDType;
    private final int left;
    private final int right;

    public PackArrayDType(DataType subDType, int left, int right) {
        this.subDType = Objects.requireNonNull(subDType, "subDType");
        this.left = left;
        this.right = right;
    }

    public DataType subDType() {
        return subDType;
    }

    public int lo() {
        return Math.min(left, right);
    }

    public int hi() {
        return Math.max(left, right);
    }

    public int elementsConst() {
        return hi() - lo() + 1;
    }

    @Override
    public int width() {
        return elementsConst() * subDType.skipRefp().width();
    }

    @Override
    public boolean isIntegral() {
        return subDType.isIntegral();
    }

    @Override
    public String prettyTypeName() {
        return subDType.prettyTypeName() + "[" + left + ":" + right + "]";
    }
}
