package com.hdlcov.instrument;

import com.google.common.flogger.GoogleLogger;
import com.hdlcov.netlist.Begin;
import com.hdlcov.netlist.BlockNode;
import com.hdlcov.netlist.CaseItem;
import com.hdlcov.netlist.Cover;
import com.hdlcov.netlist.If;
import com.hdlcov.netlist.Loop;
import com.hdlcov.netlist.Module;
import com.hdlcov.netlist.Node;
import com.hdlcov.netlist.NodeVisitor;
import com.hdlcov.netlist.Pragma;
import com.hdlcov.netlist.Procedure;
import com.hdlcov.netlist.Stop;
import com.hdlcov.netlist.Task;
import com.hdlcov.netlist.Var;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;

/**
 * Inserts line, branch, user and toggle coverage in one walk over the netlist.
 *
 * <p>At each procedure, if/else and case arm that is not disabled by a {@code $stop} or a
 * {@code coverage_block_off} below it, a declaration is added to the module and an increment is
 * appended to the statements of the construct. Each construct opens a coverage scope; the scope
 * state, the named block path and the toggle switch are restored on every way out of it.
 */
final class CoverageVisitor extends NodeVisitor {
    private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

    private final CoverageOptions options;
    private final CoverageNames names;
    private final LineTracker lineTracker;
    private final CoverPointFactory points;
    private final ToggleExpander toggles;
    // Ifs reached as the single else statement of another If
    private final Set<If> elsifLinks = Collections.newSetFromMap(new IdentityHashMap<>());

    private CheckState state = CheckState.INITIAL;
    private int nextHandle = 0;
    private Module modp;
    private boolean inToggleOff;
    private String beginHier = "";

    CoverageVisitor(
            CoverageOptions options,
            CoverageNames names,
            LineTracker lineTracker,
            CoverPointFactory points,
            ToggleExpander toggles) {
        this.options = options;
        this.names = names;
        this.lineTracker = lineTracker;
        this.points = points;
        this.toggles = toggles;
    }

    // Line tracking

    /** Starts a new scope. An if and its else get separate handles over the same node. */
    private void createHandle(Node nodep) {
        state = state.withHandle(++nextHandle, nodep);
        logger.atFinest().log("line create h%d %s", state.handle(), nodep);
    }

    private boolean lineCoverageOn(CheckState checkState, Node nodep) {
        return checkState.lineCoverageOn(nodep, options.coverageLine);
    }

    private void lineTrack(Node nodep) {
        // Only lines from the file of the node that opened the scope
        if (lineCoverageOn(state, nodep)
                && state.node().fileLine().fileNo() == nodep.fileLine().fileNo()) {
            lineTracker.track(
                    state.handle(), nodep.fileLine().firstLine(), nodep.fileLine().lastLine());
        }
    }

    private String linesCov(CheckState checkState, Node nodep) {
        String out = lineTracker.render(checkState.handle());
        logger.atFinest().log("lines out %s for h%d %s", out, checkState.handle(), nodep);
        return out;
    }

    // Modules and procedures

    @Override
    public void visit(Module nodep) {
        Module origModp = modp;
        CheckState lastState = state;
        try {
            createHandle(nodep);
            modp = nodep;
            // The top module is a shell we created
            state = state.withModOff(nodep.isTop());
            if (origModp == null) {
                // No scope crosses a top-level module
                names.clear();
                lineTracker.clear();
            }
            iterateChildren(nodep);
        } finally {
            modp = origModp;
            state = lastState;
        }
    }

    @Override
    public void visit(Procedure nodep) {
        iterateProcedure(nodep);
    }

    @Override
    public void visit(Loop nodep) {
        iterateProcedure(nodep);
    }

    @Override
    public void visit(Task nodep) {
        if (!nodep.dpiImport()) {
            iterateProcedure(nodep);
        }
    }

    private void iterateProcedure(BlockNode nodep) {
        CheckState lastState = state;
        boolean lastToggleOff = inToggleOff;
        try {
            inToggleOff = true;
            createHandle(nodep);
            iterateChildren(nodep);
            if (lineCoverageOn(state, nodep)) {
                lineTrack(nodep);
                nodep.addStmts(
                        points.newCoverPoint(
                                modp,
                                nodep.fileLine(),
                                "",
                                "v_line",
                                "block",
                                linesCov(state, nodep),
                                0,
                                points.traceNameForLine(nodep, "block")));
            }
        } finally {
            state = lastState;
            inToggleOff = lastToggleOff;
        }
    }

    // Toggle coverage

    @Override
    public void visit(Var nodep) {
        iterateChildren(nodep);
        if (modp != null
                && !inToggleOff
                && !state.inModOff()
                && nodep.fileLine().coverageOn()
                && options.coverageToggle) {
            toggles.expand(modp, nodep);
        }
    }

    // Line coverage

    @Override
    public void visit(If nodep) {
        logger.atFine().log(" IF: %s", nodep);
        if (!state.on()) {
            return;
        }
        // An else-if: the nested if is visited as part of this chain
        boolean elsif =
                !nodep.thens().isEmpty()
                        && nodep.elses().size() == 1
                        && nodep.elses().get(0) instanceof If;
        if (elsif) {
            elsifLinks.add((If) nodep.elses().get(0));
        }
        boolean marked = elsifLinks.contains(nodep);
        boolean firstElsif = !marked && elsif;
        boolean contElsif = marked && elsif;
        boolean finalElsif = marked && !elsif && !nodep.elses().isEmpty();

        CheckState lastState = state;
        CheckState ifState;
        CheckState elseState;
        try {
            createHandle(nodep);
            iterateAll(nodep.thens());
            lineTrack(nodep);
            ifState = state;
            state = lastState;

            createHandle(nodep);
            iterateAll(nodep.elses());
            elseState = state;
        } finally {
            state = lastState;
        }

        if (!(firstElsif || contElsif || finalElsif)
                && lineCoverageOn(ifState, nodep)
                && lineCoverageOn(elseState, nodep)) {
            // Normal if. Line coverage shows what is inside the branches, not the condition
            logger.atFine().log("   COVER-branch: %s", nodep);
            nodep.addThens(
                    points.newCoverPoint(
                            modp,
                            nodep.fileLine(),
                            "",
                            "v_branch",
                            "if",
                            linesCov(ifState, nodep),
                            0,
                            points.traceNameForLine(nodep, "if")));
            // Column offset 1 keeps the else apart from the if; both keywords are wider than
            // one character so no other token is hit
            nodep.addElses(
                    points.newCoverPoint(
                            modp,
                            nodep.fileLine(),
                            "",
                            "v_branch",
                            "else",
                            linesCov(elseState, nodep),
                            1,
                            points.traceNameForLine(nodep, "else")));
        } else if (firstElsif || contElsif) {
            logger.atFine().log("   COVER-elsif: %s", nodep);
            if (lineCoverageOn(ifState, nodep)) {
                nodep.addThens(
                        points.newCoverPoint(
                                modp,
                                nodep.fileLine(),
                                "",
                                "v_line",
                                "elsif",
                                linesCov(ifState, nodep),
                                0,
                                points.traceNameForLine(nodep, "elsif")));
            }
            // The else side is covered by the nested if
        } else {
            // Not two-legged: cover each side as a separate block
            if (lineCoverageOn(ifState, nodep)) {
                logger.atFine().log("   COVER-half-if: %s", nodep);
                nodep.addThens(
                        points.newCoverPoint(
                                modp,
                                nodep.fileLine(),
                                "",
                                "v_line",
                                "if",
                                linesCov(ifState, nodep),
                                0,
                                points.traceNameForLine(nodep, "if")));
            }
            if (lineCoverageOn(elseState, nodep)) {
                logger.atFine().log("   COVER-half-el: %s", nodep);
                nodep.addElses(
                        points.newCoverPoint(
                                modp,
                                nodep.fileLine(),
                                "",
                                "v_line",
                                "else",
                                linesCov(elseState, nodep),
                                1,
                                points.traceNameForLine(nodep, "else")));
            }
        }
        logger.atFinest().log(" done HANDLE %d for %s", state.handle(), nodep);
    }

    @Override
    public void visit(CaseItem nodep) {
        // A missing default is reported by lint, it gets no point of its own
        logger.atFine().log(" CASEI: %s", nodep);
        if (!lineCoverageOn(state, nodep)) {
            return;
        }
        CheckState lastState = state;
        try {
            createHandle(nodep);
            iterateAll(nodep.stmts());
            if (lineCoverageOn(state, nodep)) {
                lineTrack(nodep);
                logger.atFine().log("   COVER: %s", nodep);
                nodep.addStmts(
                        points.newCoverPoint(
                                modp,
                                nodep.fileLine(),
                                "",
                                "v_line",
                                "case",
                                linesCov(state, nodep),
                                0,
                                points.traceNameForLine(nodep, "case")));
            }
        } finally {
            state = lastState;
        }
    }

    @Override
    public void visit(Cover nodep) {
        logger.atFine().log(" COVER: %s", nodep);
        CheckState lastState = state;
        try {
            // Cover statements are always counted, even below a $stop
            createHandle(nodep);
            iterateChildren(nodep);
            if (nodep.coverIncs().isEmpty() && options.coverageUser) {
                lineTrack(nodep);
                nodep.addCoverIncs(
                        points.newCoverPoint(
                                modp,
                                nodep.fileLine(),
                                beginHier,
                                "v_user",
                                "cover",
                                linesCov(state, nodep),
                                0,
                                names.unique(beginHier + "_vlCoverageUserTrace")));
            }
        } finally {
            state = lastState;
        }
    }

    @Override
    public void visit(Stop nodep) {
        logger.atFine().log("  STOP: %s", nodep);
        state = state.withOn(false);
    }

    @Override
    public void visit(Pragma nodep) {
        if (nodep.type() == Pragma.Type.COVERAGE_BLOCK_OFF) {
            // Disables the rest of this block and the if/case branch holding it
            logger.atFine().log("  OFF: h%d %s", state.handle(), nodep);
            state = state.withOn(false);
            nodep.unlinkFromParent();
        } else {
            if (state.on()) {
                iterateChildren(nodep);
            }
            lineTrack(nodep);
        }
    }

    @Override
    public void visit(Begin nodep) {
        // Named blocks prefix user cover points, so each generate iteration gets its own point.
        // Line coverage ignores them: any iteration covers the line.
        String lastBeginHier = beginHier;
        boolean lastToggleOff = inToggleOff;
        try {
            inToggleOff = true;
            if (!nodep.name().isEmpty()) {
                beginHier = beginHier + (beginHier.isEmpty() ? "" : ".") + nodep.name();
            }
            iterateChildren(nodep);
            lineTrack(nodep);
        } finally {
            beginHier = lastBeginHier;
            inToggleOff = lastToggleOff;
        }
    }

    @Override
    protected void visitNode(Node nodep) {
        iterateChildren(nodep);
        lineTrack(nodep);
    }
}
