package com.hdlcov.netlist.dtype;

/**
 * Resolved data type of a variable or expression.
 *
 * <p>Widths are in bits. For unpacked arrays {@link #width()} is the width of one element and
 * {@link #arrayUnpackedElements()} the number of elements, so the storage of a variable is the
 * product of both.
 */
public abstract class DataType {

    public abstract int width();

    /** Number of elements across all unpacked dimensions, 1 for anything else. */
    public int arrayUnpackedElements() {
        return 1;
    }

    /** Whether values are made of two or four state bits, as opposed to reals or strings. */
    public abstract boolean isIntegral();

    /** Strips typedef references. */
    public DataType skipRefp() {
        return this;
    }

    public abstract String prettyTypeName();

    @Override
    public String toString() {
        return prettyTypeName();
    }
}
