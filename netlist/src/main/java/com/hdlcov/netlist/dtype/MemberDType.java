package com.hdlcov.netlist.dtype;

import java.util.Objects;

/**
 * Named member of a struct or union. Members are immutable and may be shared between aggregates;
 * the bit offset of a member is a property of the enclosing type.
 */
public final class MemberDType {
    private final String name;
    private final DataType subDType;

    public MemberDType(String name, DataType subDType) {
        this.name = Objects.requireNonNull(name, "name");
        this.subDType = Objects.requireNonNull(subDType, "subDType");
    }

    public String name() {
        return name;
    }

    public DataType subDType() {
        return subDType;
    }

    public int width() {
        return subDType.skipRefp().width();
    }

    @Override
    public String toString() {
        return subDType.prettyTypeName() + " " + name;
    }
}
