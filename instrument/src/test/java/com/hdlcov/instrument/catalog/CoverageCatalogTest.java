package com.hdlcov.instrument.catalog;

import static com.hdlcov.instrument.Fixtures.*;
import static org.junit.jupiter.api.Assertions.*;

import com.hdlcov.instrument.CoverageOptions;
import com.hdlcov.instrument.CoveragePass;
import com.hdlcov.netlist.If;
import com.hdlcov.netlist.Module;
import com.hdlcov.netlist.Netlist;
import com.hdlcov.netlist.Procedure;
import com.hdlcov.netlist.Var;
import com.hdlcov.proto.CatalogProto.CoverPoint;
import com.hdlcov.proto.CatalogProto.ModuleCatalog;
import java.util.List;
import org.junit.jupiter.api.Test;

final class CoverageCatalogTest {

    /** {@code alu} has a branch pair and a block, {@code regs} one toggle bit. */
    static Netlist instrumentedDesign() {
        Module alu = module("alu");
        Var c = bit(alu, "c", 2);
        Procedure proc = new Procedure(at(3), Procedure.Kind.ALWAYS);
        If ifp = new If(at(4), read(c, 4));
        ifp.addThen(display(5));
        ifp.addElse(display(7));
        proc.addStmt(ifp);
        alu.addStmt(proc);
        Module regs = module("regs");
        bit(regs, "q", 10);
        Netlist netlist = netlist(alu, regs);

        CoverageOptions options = new CoverageOptions();
        options.coverageLine = true;
        options.coverageToggle = true;
        new CoveragePass(options).run(netlist);
        return netlist;
    }

    @Test
    void groupsDeclarationsByModule() {
        CoverageCatalog catalog = CoverageCatalog.collect(instrumentedDesign());

        assertEquals(List.of("alu", "regs"), List.copyOf(catalog.byModule().keySet()));
        // alu: toggle on c, branch pair, block
        assertEquals(4, catalog.entries("alu").size());
        assertEquals(1, catalog.entries("regs").size());
        assertEquals(5, catalog.size());
        assertTrue(catalog.entries("missing").isEmpty());

        CatalogEntry branchElse = catalog.entries("alu").get(2);
        assertEquals(
                new CatalogEntry("alu", "v_branch/alu", "", "else", "7", 1, FILE, 4), branchElse);
        assertEquals(
                new CatalogEntry("regs", "v_toggle/regs", "", "q", "", 0, FILE, 10),
                catalog.entries("regs").get(0));
    }

    @Test
    void emptyNetlistHasNoModules() {
        CoverageCatalog catalog = CoverageCatalog.collect(netlist(module("idle")));
        assertTrue(catalog.byModule().isEmpty());
        assertEquals(0, catalog.size());
    }

    @Test
    void convertsToWireMessages() {
        List<ModuleCatalog> messages =
                CatalogMessages.toMessages(CoverageCatalog.collect(instrumentedDesign()));

        assertEquals(2, messages.size());
        ModuleCatalog alu = messages.get(0);
        assertEquals("alu", alu.getModule());
        assertEquals(4, alu.getPointsCount());
        CoverPoint branchIf = alu.getPoints(1);
        assertEquals("v_branch/alu", branchIf.getPage());
        assertEquals("if", branchIf.getComment());
        assertEquals("4-5", branchIf.getLines());
        assertEquals(0, branchIf.getOffset());
        assertEquals(FILE, branchIf.getFilename());
        assertEquals(4, branchIf.getLine());
    }

    @Test
    void clientFormatsOnePointPerLine() {
        ModuleCatalog alu =
                CatalogMessages.toMessages(CoverageCatalog.collect(instrumentedDesign())).get(0);

        String[] lines = CatalogClient.format(alu).split("\n");

        assertEquals("module alu: 4 points", lines[0]);
        assertEquals("  v_toggle/alu c @" + FILE + ":2", lines[1]);
        assertEquals("  v_branch/alu else @" + FILE + ":4+1 lines=7", lines[3]);
    }
}
