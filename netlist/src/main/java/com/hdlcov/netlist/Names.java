package com.hdlcov.netlist;

/** Conversions between internal (mangled) names and the names shown to users. */
public final class Names {
    static final String DOT = "__DOT__";

    private Names() {}

    /** Decodes the hierarchy separators introduced by inlining. */
    public static String pretty(String name) {
        String pretty = name.replace(DOT, ".");
        if (pretty.startsWith("TOP.")) {
            pretty = pretty.substring("TOP.".length());
        }
        return pretty;
    }

    /** Name without the hierarchy prefix added by inlining. */
    public static String shortName(String name) {
        int pos = name.lastIndexOf(DOT);
        return pos < 0 ? name : name.substring(pos + DOT.length());
    }
}
