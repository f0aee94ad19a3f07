package com.hdlcov.instrument;

import java.util.HashMap;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

/** Source lines seen per coverage scope handle. */
final class LineTracker {
    private final Map<Integer, SortedSet<Integer>> handleLines = new HashMap<>();

    void track(int handle, int firstLine, int lastLine) {
        SortedSet<Integer> lines = handleLines.computeIfAbsent(handle, key -> new TreeSet<>());
        for (int lineno = firstLine; lineno <= lastLine; lineno++) {
            lines.add(lineno);
        }
    }

    SortedSet<Integer> lines(int handle) {
        SortedSet<Integer> lines = handleLines.get(handle);
        return lines == null ? new TreeSet<>() : new TreeSet<>(lines);
    }

    /** Lines of the handle as a comma separated list of ranges. */
    String render(int handle) {
        SortedSet<Integer> lines = handleLines.get(handle);
        return lines == null ? "" : renderRanges(lines);
    }

    void clear() {
        handleLines.clear();
    }

    /** Renders {@code {3,4,5,9,10,12}} as {@code 3-5,9-10,12}. */
    static String renderRanges(SortedSet<Integer> lines) {
        StringBuilder out = new StringBuilder();
        int first = 0;
        int last = 0;
        boolean open = false;
        for (int lineno : lines) {
            if (!open) {
                first = lineno;
                last = lineno;
                open = true;
            } else if (lineno == last + 1) {
                last = lineno;
            } else {
                appendRange(out, first, last);
                first = lineno;
                last = lineno;
            }
        }
        if (open) {
            appendRange(out, first, last);
        }
        return out.toString();
    }

    private static void appendRange(StringBuilder out, int first, int last) {
        if (out.length() > 0) {
            out.append(',');
        }
        out.append(first);
        if (last != first) {
            out.append('-').append(last);
        }
    }
}
