package com.hdlcov.instrument;

import com.hdlcov.netlist.Node;

/**
 * Coverage state of the innermost coverage scope. Saved before entering a nested scope and
 * restored when leaving it.
 *
 * @param on whether the scope is still worth covering; cleared by {@code $stop} and
 *     {@code coverage_block_off}
 * @param inModOff inside the generated top wrapper, which is never covered
 * @param handle key of the line set collected for this scope
 * @param node node that established the scope; lines of other files are not collected
 */
record CheckState(boolean on, boolean inModOff, int handle, Node node) {

    static final CheckState INITIAL = new CheckState(false, false, 0, null);

    boolean lineCoverageOn(Node nodep, boolean coverageLine) {
        return on && !inModOff && nodep.fileLine().coverageOn() && coverageLine;
    }

    CheckState withHandle(int newHandle, Node establishing) {
        return new CheckState(true, inModOff, newHandle, establishing);
    }

    CheckState withOn(boolean newOn) {
        return new CheckState(newOn, inModOff, handle, node);
    }

    CheckState withModOff(boolean newInModOff) {
        return new CheckState(on, newInModOff, handle, node);
    }
}
