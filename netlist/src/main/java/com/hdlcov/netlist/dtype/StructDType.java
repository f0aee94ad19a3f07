package com.hdlcov.netlist.dtype;

import java.util.List;

/**
 * Packed or unpacked struct. As in SystemVerilog, the first declared member of a packed struct
 * occupies the most significant bits.
 */
public final class StructDType extends DataType {
    private final boolean packed;
    private final List<MemberDType> members;
    private final int[] memberLsbs;

    public StructDType(boolean packed, List<MemberDType> members) {
        if (members.isEmpty()) {
            throw new IllegalArgumentException("struct without members");
        }
        this.packed = packed;
        this.members = List.copyOf(members);
        this.memberLsbs = new int[this.members.size()];
        int lsb = 0;
        for (int i = this.members.size() - 1; i >= 0; i--) {
            memberLsbs[i] = lsb;
            lsb += this.members.get(i).width();
        }
    }

    public boolean packed() {
        return packed;
    }

    public List<MemberDType> members() {
        return members;
    }

    /** Offset of the least significant bit of the member at {@code index} in the packed layout. */
    public int memberLsb(int index) {
        return memberLsbs[index];
    }

    @Override
    public int width() {
        int width = 0;
        for (MemberDType member : members) {
            width += member.width();
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
        return "struct" + (packed ? " packed" : "") + members;
    }
}
