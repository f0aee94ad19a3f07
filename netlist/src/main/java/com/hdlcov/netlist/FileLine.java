package com.hdlcov.netlist;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Source location attached to every netlist node.
 *
 * <p>Besides the line span, a location carries the per-location coverage switch set by
 * {@code coverage_off}/{@code coverage_on} metacomments and the warnings disabled for it.
 */
public final class FileLine {

    public enum Warning {
        UNUSEDSIGNAL,
        WIDTH
    }

    private final int fileNo;
    private final String filename;
    private final int firstLine;
    private final int lastLine;
    private final boolean coverageOn;
    private final EnumSet<Warning> warningsOff;

    public FileLine(int fileNo, String filename, int firstLine, int lastLine, boolean coverageOn) {
        this(fileNo, filename, firstLine, lastLine, coverageOn, EnumSet.noneOf(Warning.class));
    }

    private FileLine(
            int fileNo,
            String filename,
            int firstLine,
            int lastLine,
            boolean coverageOn,
            EnumSet<Warning> warningsOff) {
        if (lastLine < firstLine) {
            throw new IllegalArgumentException(
                    "last line " + lastLine + " before first line " + firstLine);
        }
        this.fileNo = fileNo;
        this.filename = Objects.requireNonNull(filename, "filename");
        this.firstLine = firstLine;
        this.lastLine = lastLine;
        this.coverageOn = coverageOn;
        this.warningsOff = warningsOff;
    }

    public static FileLine of(int fileNo, String filename, int line) {
        return new FileLine(fileNo, filename, line, line, true);
    }

    public static FileLine span(int fileNo, String filename, int firstLine, int lastLine) {
        return new FileLine(fileNo, filename, firstLine, lastLine, true);
    }

    public int fileNo() {
        return fileNo;
    }

    public String filename() {
        return filename;
    }

    public int firstLine() {
        return firstLine;
    }

    public int lastLine() {
        return lastLine;
    }

    /** Line reported for the node, the first line of its span. */
    public int lineno() {
        return firstLine;
    }

    public boolean coverageOn() {
        return coverageOn;
    }

    public boolean warnIsOff(Warning warning) {
        return warningsOff.contains(warning);
    }

    public Set<Warning> warningsOff() {
        return EnumSet.copyOf(warningsOff);
    }

    /** Returns a copy of this location with coverage switched on or off. */
    public FileLine withCoverage(boolean on) {
        return new FileLine(fileNo, filename, firstLine, lastLine, on, EnumSet.copyOf(warningsOff));
    }

    /** Returns a copy of this location with the given warning disabled. */
    public FileLine withWarningOff(Warning warning) {
        EnumSet<Warning> off = EnumSet.copyOf(warningsOff);
        off.add(warning);
        return new FileLine(fileNo, filename, firstLine, lastLine, coverageOn, off);
    }

    /** File name without directories and without its extension. */
    public String filebasenameNoExt() {
        String base = filename;
        int slash = base.lastIndexOf('/');
        if (slash >= 0) {
            base = base.substring(slash + 1);
        }
        int dot = base.indexOf('.');
        if (dot > 0) {
            base = base.substring(0, dot);
        }
        return base;
    }

    @Override
    public String toString() {
        if (firstLine == lastLine) {
            return filename + ":" + firstLine;
        }
        return filename + ":" + firstLine + "-" + lastLine;
    }
}
