package com.hdlcov.netlist.dtype;

import java.util.Objects;

/** Dynamically sized queue {@code sub name[$]}. */
public final class QueueDType extends DataType {
    private final DataType subDType;

    public QueueDType(DataType subDType) {
        this.subDType = Objects.requireNonNull(subDType, "subDType");
    }

    public DataType subDType() {
        return subDType;
    }

    @Override
    public int width() {
        return subDType.skipRefp().width();
    }

    @Override
    public boolean isIntegral() {
        return subDType.isIntegral();
    }

    @Override
    public String prettyTypeName() {
        return subDType.prettyTypeName() + "$[$]";
    }
}
