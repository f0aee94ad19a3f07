package com.hdlcov.netlist;

import com.hdlcov.netlist.dtype.DataType;
import java.util.Objects;

/** A variable, net, port or parameter declaration. */
public final class Var extends Node {

    public enum VarType {
        WIRE(true),
        VAR(true),
        PORT(true),
        PARAM(false),
        LOCALPARAM(false),
        GENVAR(false),
        MODULETEMP(false),
        BLOCKTEMP(false);

        private final boolean signal;

        VarType(boolean signal) {
            this.signal = signal;
        }

        public boolean isSignal() {
            return signal;
        }
    }

    private final String name;
    private final VarType varType;
    private final DataType dtype;
    private boolean trace;

    public Var(FileLine fileLine, VarType varType, String name, DataType dtype) {
        super(fileLine);
        this.varType = Objects.requireNonNull(varType, "varType");
        this.name = Objects.requireNonNull(name, "name");
        this.dtype = Objects.requireNonNull(dtype, "dtype");
    }

    public String name() {
        return name;
    }

    public String prettyName() {
        return Names.pretty(name);
    }

    public String shortName() {
        return Names.shortName(name);
    }

    public VarType varType() {
        return varType;
    }

    public DataType dtype() {
        return dtype;
    }

    public int width() {
        return dtype.width();
    }

    /** Signals of integral type are the only candidates for toggle coverage. */
    public boolean isToggleCoverable() {
        return varType.isSignal() && dtype.isIntegral();
    }

    public boolean isTrace() {
        return trace;
    }

    public void trace(boolean trace) {
        this.trace = trace;
    }

    @Override
    public void accept(NodeVisitor visitor) {
        visitor.visit(this);
    }

    @Override
    protected String details() {
        return varType.name() + " " + name + " " + dtype.prettyTypeName() + (trace ? " [T]" : "");
    }
}
