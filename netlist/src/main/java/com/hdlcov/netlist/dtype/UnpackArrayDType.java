package com.hdlcov.netlist.dtype;

import java.util.Objects;

/** Unpacked array {@code sub name [left:right]}. */
public final class UnpackArrayDType extends DataType {
    private final DataType subDType;
    private final int left;
    private final int right;

    public UnpackArrayDType(DataType subDType, int left, int right) {
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
        return subDType.skipRefp().width();
    }

    @Override
    public int arrayUnpackedElements() {
        return elementsConst() * subDType.skipRefp().arrayUnpackedElements();
    }

    @Override
    public boolean isIntegral() {
        return subDType.isIntegral();
    }

    @Override
    public String prettyTypeName() {
        return subDType.prettyTypeName() + "$[" + left + ":" + right + "]";
    }
}
