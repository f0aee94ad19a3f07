package com.hdlcov.instrument;

import com.google.common.flogger.GoogleLogger;
import com.hdlcov.netlist.Add;
import com.hdlcov.netlist.Assign;
import com.hdlcov.netlist.Const;
import com.hdlcov.netlist.CoverDecl;
import com.hdlcov.netlist.CoverInc;
import com.hdlcov.netlist.FileLine;
import com.hdlcov.netlist.Module;
import com.hdlcov.netlist.Node;
import com.hdlcov.netlist.Var;
import com.hdlcov.netlist.VarRef;
import com.hdlcov.netlist.dtype.BasicDType;
import java.util.ArrayList;
import java.util.List;

/**
 * Creates coverage declarations in a module together with the increments pointing at them and,
 * when trace coverage is on, a traced counter variable bumped next to the increment.
 */
final class CoverPointFactory {
    private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

    private final CoverageOptions options;
    private final CoverageNames names;
    private final CoverageStats stats;

    CoverPointFactory(CoverageOptions options, CoverageNames names, CoverageStats stats) {
        this.options = options;
        this.names = names;
        this.stats = stats;
    }

    /**
     * Declares a point in {@code modp} and returns its increment.
     *
     * <p>The page is derived from the module rather than the file, so code from an include file
     * is reported under the module using it. Parameterized copies of a module carry their
     * parameters in the name and are counted separately.
     */
    CoverInc newCoverInc(
            Module modp,
            FileLine fl,
            String hier,
            String pagePrefix,
            String comment,
            String linesCov,
            int offset) {
        String page = pagePrefix + "/" + modp.prettyName();
        CoverDecl declp = new CoverDecl(fl, page, comment, linesCov, offset);
        declp.hier(hier);
        modp.addStmt(declp);
        stats.record(pagePrefix);
        logger.atFinest().log("new %s", declp);
        return new CoverInc(fl, declp);
    }

    /**
     * Like {@link #newCoverInc} but returns the statements to splice: the increment, followed by
     * the trace counter update when one is wanted.
     */
    List<Node> newCoverPoint(
            Module modp,
            FileLine fl,
            String hier,
            String pagePrefix,
            String comment,
            String linesCov,
            int offset,
            String traceVarName) {
        CoverInc incp = newCoverInc(modp, fl, hier, pagePrefix, comment, linesCov, offset);
        List<Node> stmts = new ArrayList<>(2);
        stmts.add(incp);
        // Classes have no module handle to trace inside
        if (!traceVarName.isEmpty() && options.traceCoverage && !modp.isClass()) {
            FileLine flNowarn = incp.fileLine().withWarningOff(FileLine.Warning.UNUSEDSIGNAL);
            Var varp =
                    new Var(flNowarn, Var.VarType.MODULETEMP, traceVarName, BasicDType.uint32());
            varp.trace(true);
            modp.addStmt(varp);
            logger.atFine().log("New coverage trace: %s", varp);
            FileLine ifl = incp.fileLine();
            stmts.add(
                    new Assign(
                            ifl,
                            new VarRef(ifl, varp, VarRef.Access.WRITE),
                            new Add(
                                    ifl,
                                    new VarRef(ifl, varp, VarRef.Access.READ),
                                    new Const(ifl, 32, 1))));
        }
        return stmts;
    }

    /** Trace counter name for a line oriented point, unique within the top-level module. */
    String traceNameForLine(Node nodep, String type) {
        FileLine fl = nodep.fileLine();
        return names.unique(
                "vlCoverageLineTrace_" + fl.filebasenameNoExt() + "__" + fl.lineno() + "_" + type);
    }
}
