package com.hdlcov.instrument;

import com.hdlcov.netlist.Assign;
import com.hdlcov.netlist.CoverDecl;
import com.hdlcov.netlist.CoverInc;
import com.hdlcov.netlist.CoverToggle;
import com.hdlcov.netlist.Display;
import com.hdlcov.netlist.FileLine;
import com.hdlcov.netlist.Module;
import com.hdlcov.netlist.Netlist;
import com.hdlcov.netlist.Node;
import com.hdlcov.netlist.Var;
import com.hdlcov.netlist.VarRef;
import com.hdlcov.netlist.dtype.BasicDType;
import com.hdlcov.netlist.dtype.DataType;
import java.util.ArrayList;
import java.util.List;

/** Small builders for hand-made netlists. */
public final class Fixtures {
    public static final String FILE = "t/t_cover.v";

    private Fixtures() {}

    public static FileLine at(int line) {
        return FileLine.of(1, FILE, line);
    }

    public static Netlist netlist(Module... modules) {
        Netlist netlist = new Netlist(at(1));
        for (Module module : modules) {
            netlist.addModule(module);
        }
        return netlist;
    }

    public static Module module(String name) {
        return new Module(at(1), name);
    }

    public static Var signal(Module modp, String name, DataType dtype, int line) {
        Var varp = new Var(at(line), Var.VarType.WIRE, name, dtype);
        modp.addStmt(varp);
        return varp;
    }

    public static Var bit(Module modp, String name, int line) {
        return signal(modp, name, BasicDType.logic(), line);
    }

    public static VarRef read(Var varp, int line) {
        return new VarRef(at(line), varp, VarRef.Access.READ);
    }

    public static Assign assign(Var lhs, Var rhs, int line) {
        return new Assign(at(line), new VarRef(at(line), lhs, VarRef.Access.WRITE), read(rhs, line));
    }

    public static Display display(int line) {
        return new Display(at(line), "line " + line);
    }

    public static CoverageOptions lineOnly() {
        CoverageOptions options = new CoverageOptions();
        options.coverageLine = true;
        return options;
    }

    public static CoverageOptions toggleOnly() {
        CoverageOptions options = new CoverageOptions();
        options.coverageToggle = true;
        return options;
    }

    public static List<CoverDecl> decls(Module modp) {
        return ofType(modp.stmts(), CoverDecl.class);
    }

    public static List<String> comments(Module modp) {
        List<String> comments = new ArrayList<>();
        for (CoverDecl declp : decls(modp)) {
            comments.add(declp.comment());
        }
        return comments;
    }

    public static List<CoverInc> incs(List<Node> stmts) {
        return ofType(stmts, CoverInc.class);
    }

    public static List<CoverToggle> toggles(Module modp) {
        return ofType(modp.stmts(), CoverToggle.class);
    }

    public static List<Var> vars(Module modp) {
        return ofType(modp.stmts(), Var.class);
    }

    public static Var findVar(Module modp, String name) {
        for (Var varp : vars(modp)) {
            if (varp.name().equals(name)) {
                return varp;
            }
        }
        throw new AssertionError("No variable " + name + " in " + modp);
    }

    public static <T extends Node> List<T> ofType(List<Node> nodes, Class<T> type) {
        List<T> result = new ArrayList<>();
        for (Node node : nodes) {
            if (type.isInstance(node)) {
                result.add(type.cast(node));
            }
        }
        return result;
    }
}
