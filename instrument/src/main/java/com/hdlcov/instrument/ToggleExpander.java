package com.hdlcov.instrument;

import com.google.common.flogger.GoogleLogger;
import com.hdlcov.netlist.ArraySel;
import com.hdlcov.netlist.Assign;
import com.hdlcov.netlist.CoverInc;
import com.hdlcov.netlist.CoverToggle;
import com.hdlcov.netlist.Expr;
import com.hdlcov.netlist.FileLine;
import com.hdlcov.netlist.Module;
import com.hdlcov.netlist.Sel;
import com.hdlcov.netlist.StructSel;
import com.hdlcov.netlist.Var;
import com.hdlcov.netlist.VarRef;
import com.hdlcov.netlist.dtype.BasicDType;
import com.hdlcov.netlist.dtype.DataType;
import com.hdlcov.netlist.dtype.MemberDType;
import com.hdlcov.netlist.dtype.PackArrayDType;
import com.hdlcov.netlist.dtype.StructDType;
import com.hdlcov.netlist.dtype.UnionDType;
import com.hdlcov.netlist.dtype.UnpackArrayDType;
import java.util.List;

/**
 * Expands a signal into one toggle point per bit.
 *
 * <p>The signal gets a shadow variable holding its previous value. Every bit lane then becomes a
 * {@link CoverToggle} in the module, comparing the lane against the same lane of the shadow. The
 * expansion is quadratic in the signal size, which is why wide signals are excluded up front.
 */
final class ToggleExpander {
    private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

    static final String SHADOW_PREFIX = "__Vtogcov__";

    /**
     * Path to one element of the variable. The references are templates: they are never
     * attached, every use takes a deep copy.
     */
    private record ToggleEnt(String comment, Expr varRef, Expr chgRef) {}

    private final CoverageOptions options;
    private final CoverageNames names;
    private final CoverPointFactory points;
    private final FatalErrorReporter reporter;

    ToggleExpander(
            CoverageOptions options,
            CoverageNames names,
            CoverPointFactory points,
            FatalErrorReporter reporter) {
        this.options = options;
        this.names = names;
        this.points = points;
        this.reporter = reporter;
    }

    /** Returns why the variable gets no toggle coverage, or {@code null} if it does. */
    String ignoreReason(Var varp) {
        if (!varp.isToggleCoverable()) {
            return "Not relevant signal type";
        }
        if (!options.coverageUnderscore) {
            String prettyName = varp.prettyName();
            if (prettyName.startsWith("_")) {
                return "Leading underscore";
            }
            if (prettyName.contains("._")) {
                return "Inlined leading underscore";
            }
        }
        long bits = (long) varp.width() * varp.dtype().arrayUnpackedElements();
        if (bits > options.coverageMaxWidth) {
            return "Wide bus/array > --coverage-max-width setting's bits";
        }
        return null;
    }

    void expand(Module modp, Var varp) {
        String disable = ignoreReason(varp);
        if (disable != null) {
            logger.atFine().log("    Disable Toggle: %s %s", disable, varp);
            return;
        }
        logger.atFine().log("    Toggle: %s", varp);

        FileLine flNowarn = varp.fileLine().withWarningOff(FileLine.Warning.UNUSEDSIGNAL);
        String shadowName = names.unique(SHADOW_PREFIX + varp.shortName());
        Var chgVarp = new Var(flNowarn, Var.VarType.MODULETEMP, shadowName, varp.dtype());
        modp.addStmt(chgVarp);

        ToggleEnt top =
                new ToggleEnt(
                        "",
                        new VarRef(flNowarn, varp, VarRef.Access.READ),
                        new VarRef(flNowarn, chgVarp, VarRef.Access.READ));
        recurse(modp, varp, varp.dtype().skipRefp(), top);
    }

    private void recurse(Module modp, Var varp, DataType dtypep, ToggleEnt above) {
        FileLine fl = varp.fileLine();
        if (dtypep instanceof BasicDType bdtypep) {
            if (bdtypep.isRanged()) {
                for (int indexDocs = bdtypep.lo(); indexDocs <= bdtypep.hi(); indexDocs++) {
                    int indexCode = indexDocs - bdtypep.lo();
                    ToggleEnt newent =
                            new ToggleEnt(
                                    above.comment() + "[" + indexDocs + "]",
                                    new Sel(fl, above.varRef().deepCopy(), indexCode, 1),
                                    new Sel(fl, above.chgRef().deepCopy(), indexCode, 1));
                    addToggle(modp, varp, newent);
                }
            } else {
                addToggle(modp, varp, above);
            }
        } else if (dtypep instanceof UnpackArrayDType adtypep) {
            DataType subtypep = adtypep.subDType().skipRefp();
            for (int indexDocs = adtypep.lo(); indexDocs <= adtypep.hi(); indexDocs++) {
                int indexCode = indexDocs - adtypep.lo();
                ToggleEnt newent =
                        new ToggleEnt(
                                above.comment() + "[" + indexDocs + "]",
                                new ArraySel(fl, above.varRef().deepCopy(), indexCode),
                                new ArraySel(fl, above.chgRef().deepCopy(), indexCode));
                recurse(modp, varp, subtypep, newent);
            }
        } else if (dtypep instanceof PackArrayDType adtypep) {
            DataType subtypep = adtypep.subDType().skipRefp();
            int elemWidth = subtypep.width();
            for (int indexDocs = adtypep.lo(); indexDocs <= adtypep.hi(); indexDocs++) {
                int indexCode = indexDocs - adtypep.lo();
                int lsb = indexCode * elemWidth;
                ToggleEnt newent =
                        new ToggleEnt(
                                above.comment() + "[" + indexDocs + "]",
                                new Sel(fl, above.varRef().deepCopy(), lsb, elemWidth),
                                new Sel(fl, above.chgRef().deepCopy(), lsb, elemWidth));
                recurse(modp, varp, subtypep, newent);
            }
        } else if (dtypep instanceof StructDType sdtypep) {
            List<MemberDType> members = sdtypep.members();
            for (int i = 0; i < members.size(); i++) {
                MemberDType itemp = members.get(i);
                DataType subtypep = itemp.subDType().skipRefp();
                ToggleEnt newent;
                if (sdtypep.packed()) {
                    int lsb = sdtypep.memberLsb(i);
                    int width = subtypep.width();
                    newent =
                            new ToggleEnt(
                                    above.comment() + "." + itemp.name(),
                                    new Sel(fl, above.varRef().deepCopy(), lsb, width),
                                    new Sel(fl, above.chgRef().deepCopy(), lsb, width));
                } else {
                    newent =
                            new ToggleEnt(
                                    above.comment() + "." + itemp.name(),
                                    new StructSel(fl, above.varRef().deepCopy(), itemp.name()),
                                    new StructSel(fl, above.chgRef().deepCopy(), itemp.name()));
                }
                recurse(modp, varp, subtypep, newent);
            }
        } else if (dtypep instanceof UnionDType udtypep) {
            // Only the first member is covered; the others alias the same bits
            MemberDType itemp = udtypep.members().get(0);
            ToggleEnt newent =
                    new ToggleEnt(
                            above.comment() + "." + itemp.name(),
                            above.varRef().deepCopy(),
                            above.chgRef().deepCopy());
            recurse(modp, varp, itemp.subDType().skipRefp(), newent);
        } else {
            throw reporter.fatal(
                    varp,
                    "Unexpected node data type in toggle coverage generation: "
                            + dtypep.prettyTypeName());
        }
    }

    private void addToggle(Module modp, Var varp, ToggleEnt above) {
        FileLine fl = varp.fileLine();
        CoverInc incp =
                points.newCoverInc(modp, fl, "", "v_toggle", varp.name() + above.comment(), "", 0);
        Assign update =
                new Assign(
                        fl,
                        above.chgRef().deepCopy(VarRef.Access.WRITE),
                        above.varRef().deepCopy());
        modp.addStmt(
                new CoverToggle(
                        fl, incp, above.varRef().deepCopy(), above.chgRef().deepCopy(), update));
    }
}
