package com.hdlcov.netlist.dtype;

import java.util.Objects;

/** Reference to a typedef. */
public final class RefDType extends DataType {
    private final String name;
    private final DataType target;

    public RefDType(String name, DataType target) {
        this.name = Objects.requireNonNull(name, "name");
        this.target = Objects.requireNonNull(target, "target");
    }

    public String name() {
        return name;
    }

    @Override
    public DataType skipRefp() {
        return target.skipRefp();
    }

    @Override
    public int width() {
        return target.width();
    }

    @Override
    public int arrayUnpackedElements() {
        return target.arrayUnpackedElements();
    }

    @Override
    public boolean isIntegral() {
        return target.isIntegral();
    }

    @Override
    public String prettyTypeName() {
        return name;
    }
}
