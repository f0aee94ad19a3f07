package com.hdlcov.netlist.dtype;

import java.util.List;

/** Packed union; all members start at bit 0. */
public final class UnionDType extends DataType {
    private final List<MemberDType> members;

    public UnionDType(List<MemberDType> members) {
        if (members.isEmpty()) {
            throw new IllegalArgumentException("union without members");
        }
        this.members = List.copyOf(members);
    }

    public List<MemberDType> members() {
        return members;
    }

    @Override
    public int width() {
        int width = 0;
        for (MemberDType member : members) {
            width = Math.max(width, member.width());
        }
        return width;
    }

    @Override
    public boolean isIntegral() {
        for (MemberDType member : members) {
            if (!member.subDType().isIntegral()) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String prettyTypeName() {
        return "union" + members;
    }
}
