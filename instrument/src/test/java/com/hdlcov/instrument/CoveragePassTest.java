package com.hdlcov.instrument;

import static com.hdlcov.instrument.Fixtures.*;
import static org.junit.jupiter.api.Assertions.*;

import com.hdlcov.netlist.Add;
import com.hdlcov.netlist.Assign;
import com.hdlcov.netlist.CoverDecl;
import com.hdlcov.netlist.CoverInc;
import com.hdlcov.netlist.Display;
import com.hdlcov.netlist.FileLine;
import com.hdlcov.netlist.Loop;
import com.hdlcov.netlist.Module;
import com.hdlcov.netlist.Netlist;
import com.hdlcov.netlist.Pragma;
import com.hdlcov.netlist.Procedure;
import com.hdlcov.netlist.Stop;
import com.hdlcov.netlist.Task;
import com.hdlcov.netlist.Var;
import com.hdlcov.netlist.VarRef;
import com.hdlcov.netlist.dtype.BasicDType;
import com.hdlcov.netlist.dtype.QueueDType;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

final class CoveragePassTest {

    private static Procedure always(Module modp, int line) {
        Procedure proc = new Procedure(at(line), Procedure.Kind.ALWAYS);
        modp.addStmt(proc);
        return proc;
    }

    @Test
    void procedureGetsBlockPoint() {
        Module m = module("m");
        Var a = bit(m, "a", 2);
        Var b = bit(m, "b", 2);
        Procedure proc = always(m, 4);
        proc.addStmt(assign(a, b, 5));
        proc.addStmt(display(6));

        CoverageStats stats = new CoveragePass(lineOnly()).run(netlist(m));

        assertEquals(3, proc.stmts().size());
        CoverInc inc = assertInstanceOf(CoverInc.class, proc.stmts().get(2));
        CoverDecl decl = inc.decl();
        assertSame(m, decl.parent());
        assertEquals("v_line/m", decl.page());
        assertEquals("block", decl.comment());
        assertEquals("4-6", decl.linesCov());
        assertEquals(0, decl.offset());
        assertEquals("", decl.hier());
        assertEquals(CoverDecl.UNASSIGNED, decl.binNum());
        assertEquals(1, stats.count("v_line"));
        assertEquals(1, stats.total());
    }

    @Test
    void nothingIsInstrumentedByDefault() {
        Module m = module("m");
        bit(m, "a", 2);
        always(m, 4).addStmt(display(5));

        CoverageStats stats = new CoveragePass(new CoverageOptions()).run(netlist(m));

        assertEquals(0, stats.total());
        assertTrue(decls(m).isEmpty());
        assertEquals(2, m.stmts().size());
    }

    @Test
    void stopDisablesEnclosingBlock() {
        Module m = module("m");
        Procedure proc = always(m, 4);
        proc.addStmt(display(5));
        proc.addStmt(new Stop(at(6), false));

        new CoveragePass(lineOnly()).run(netlist(m));

        assertEquals(2, proc.stmts().size());
        assertTrue(decls(m).isEmpty());
    }

    @Test
    void blockOffPragmaIsRemovedAndDisablesOnlyItsBlock() {
        Module m = module("m");
        Procedure off = always(m, 4);
        Display before = display(5);
        Display after = display(7);
        off.addStmt(before);
        off.addStmt(new Pragma(at(6), Pragma.Type.COVERAGE_BLOCK_OFF));
        off.addStmt(after);
        Procedure on = always(m, 9);
        on.addStmt(display(10));

        new CoveragePass(lineOnly()).run(netlist(m));

        assertEquals(List.of(before, after), off.stmts());
        assertEquals(1, decls(m).size());
        assertEquals("9-10", decls(m).get(0).linesCov());
        assertEquals(1, incs(on.stmts()).size());
    }

    @Test
    void otherPragmasStayAndAreCounted() {
        Module m = module("m");
        Procedure proc = always(m, 4);
        Pragma pragma = new Pragma(at(5), Pragma.Type.PUBLIC_MODULE);
        proc.addStmt(pragma);

        new CoveragePass(lineOnly()).run(netlist(m));

        assertSame(pragma, proc.stmts().get(0));
        assertEquals("4-5", decls(m).get(0).linesCov());
    }

    @Test
    void pragmaBodyLinesJoinTheEnclosingBlock() {
        Module m = module("m");
        Procedure proc = always(m, 4);
        Pragma pragma = new Pragma(at(5), Pragma.Type.PUBLIC_MODULE);
        Display inner = display(6);
        pragma.addStmt(inner);
        proc.addStmt(pragma);

        new CoveragePass(lineOnly()).run(netlist(m));

        assertSame(inner, pragma.stmts().get(0));
        assertEquals(1, decls(m).size());
        assertEquals("4-6", decls(m).get(0).linesCov());
    }

    @Test
    void generatedTopModuleIsNotCovered() {
        Module top = new Module(at(1), "TOP", Module.Kind.MODULE, true);
        always(top, 2).addStmt(display(3));
        Module m = module("m");
        always(m, 4).addStmt(display(5));

        new CoveragePass(lineOnly()).run(netlist(top, m));

        assertTrue(decls(top).isEmpty());
        assertEquals(List.of("block"), comments(m));
    }

    @Test
    void coverageOffLocationsAreSkipped() {
        Module m = module("m");
        Procedure proc = new Procedure(at(4).withCoverage(false), Procedure.Kind.ALWAYS);
        proc.addStmt(display(5));
        m.addStmt(proc);

        new CoveragePass(lineOnly()).run(netlist(m));

        assertTrue(decls(m).isEmpty());
    }

    @Test
    void linesFromOtherFilesAreNotListed() {
        Module m = module("m");
        Procedure proc = always(m, 4);
        proc.addStmt(new Display(FileLine.of(2, "inc.vh", 20), "included"));
        proc.addStmt(display(5));

        new CoveragePass(lineOnly()).run(netlist(m));

        assertEquals("4-5", decls(m).get(0).linesCov());
    }

    @Test
    void tasksAndLoopsGetBlockPointsButDpiImportsDoNot() {
        Module m = module("m");
        Task task = new Task(at(3), "work", false, false);
        task.addStmt(display(4));
        Task dpi = new Task(at(6), "c_func", true, true);
        Var i = bit(m, "i", 2);
        Loop loop = new Loop(at(8), read(i, 8));
        loop.addStmt(display(9));
        Procedure proc = always(m, 7);
        proc.addStmt(loop);
        m.addStmt(task);
        m.addStmt(dpi);

        new CoveragePass(lineOnly()).run(netlist(m));

        assertEquals(1, incs(task.stmts()).size());
        assertTrue(dpi.stmts().isEmpty());
        assertEquals(1, incs(loop.stmts()).size());
        assertEquals(1, incs(proc.stmts()).size());
        assertEquals(List.of("block", "block", "block"), comments(m));
        // Loop lines belong to the loop, procedure keeps only its own
        assertEquals("8-9", incs(loop.stmts()).get(0).decl().linesCov());
        assertEquals("7", incs(proc.stmts()).get(0).decl().linesCov());
    }

    @Test
    void traceCoverageAddsCounterNextToIncrement() {
        CoverageOptions options = lineOnly();
        options.traceCoverage = true;
        Module m = module("m");
        Procedure proc = always(m, 4);
        proc.addStmt(display(5));

        new CoveragePass(options).run(netlist(m));

        assertEquals(3, proc.stmts().size());
        assertInstanceOf(CoverInc.class, proc.stmts().get(1));
        Assign bump = assertInstanceOf(Assign.class, proc.stmts().get(2));
        Var counter = findVar(m, "vlCoverageLineTrace_t_cover__4_block");
        assertTrue(counter.isTrace());
        assertEquals(Var.VarType.MODULETEMP, counter.varType());
        assertEquals(32, counter.width());
        assertTrue(counter.fileLine().warnIsOff(FileLine.Warning.UNUSEDSIGNAL));
        VarRef lhs = assertInstanceOf(VarRef.class, bump.lhs());
        assertSame(counter, lhs.var());
        assertEquals(VarRef.Access.WRITE, lhs.access());
        Add add = assertInstanceOf(Add.class, bump.rhs());
        assertEquals(VarRef.Access.READ, ((VarRef) add.lhs()).access());
    }

    @Test
    void traceNamesAreUniquePerTopLevelModule() {
        CoverageOptions options = lineOnly();
        options.traceCoverage = true;
        Module m1 = module("m1");
        always(m1, 4);
        always(m1, 4);
        Module m2 = module("m2");
        always(m2, 4);

        new CoveragePass(options).run(netlist(m1, m2));

        findVar(m1, "vlCoverageLineTrace_t_cover__4_block");
        findVar(m1, "vlCoverageLineTrace_t_cover__4_block_1");
        findVar(m2, "vlCoverageLineTrace_t_cover__4_block");
    }

    @Test
    void classesGetNoTraceCounter() {
        CoverageOptions options = lineOnly();
        options.traceCoverage = true;
        Module m = module("m");
        Module cls = new Module(at(10), "Packet", Module.Kind.CLASS, false);
        Task task = new Task(at(11), "send", false, false);
        task.addStmt(display(12));
        cls.addStmt(task);
        m.addStmt(cls);

        new CoveragePass(options).run(netlist(m));

        assertEquals(2, task.stmts().size());
        assertTrue(vars(cls).isEmpty());
        assertEquals("v_line/Packet", decls(cls).get(0).page());
        assertTrue(decls(m).isEmpty(), "points belong to the innermost module");
    }

    @Test
    void fatalErrorsGoThroughTheReporter() {
        CoverageOptions options = toggleOnly();
        Module m = module("m");
        signal(m, "q", new QueueDType(BasicDType.logic(7, 0)), 2);
        IllegalStateException expected = new IllegalStateException("reported");

        IllegalStateException thrown =
                assertThrows(
                        IllegalStateException.class,
                        () -> new CoveragePass(options, (node, message) -> expected)
                                .run(netlist(m)));

        assertSame(expected, thrown);
    }

    @Test
    void dumpsInstrumentedTree(@TempDir Path dir) throws Exception {
        CoverageOptions options = lineOnly();
        options.dumpTreeDir = dir;
        Module m = module("m");
        always(m, 4).addStmt(display(5));
        Netlist netlist = netlist(m);

        new CoveragePass(options).run(netlist);

        String dump = Files.readString(dir.resolve(CoveragePass.DUMP_FILE));
        assertTrue(dump.contains("COVERDECL page=v_line/m comment=block lines=4-5"), dump);
        assertTrue(dump.contains("COVERINC -> v_line/m block"), dump);
    }
}
