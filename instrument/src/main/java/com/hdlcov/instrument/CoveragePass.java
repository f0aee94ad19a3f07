package com.hdlcov.instrument;

import com.google.common.flogger.GoogleLogger;
import com.hdlcov.netlist.Netlist;
import com.hdlcov.netlist.TreeDumper;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Entry point of the coverage transformation.
 *
 * <p>Instruments a netlist in place: coverage declarations are added to each module, increments
 * are spliced into procedures, branches and case arms, toggle shadows and their updates are added
 * at module scope, and {@code coverage_block_off} pragmas are removed. Numbering of the
 * declarations is left to the emitter.
 */
public final class CoveragePass {
    private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

    static final String DUMP_FILE = "coverage.tree";

    private final CoverageOptions options;
    private final FatalErrorReporter reporter;

    public CoveragePass(CoverageOptions options) {
        this(options, FatalErrorReporter.DEFAULT);
    }

    public CoveragePass(CoverageOptions options, FatalErrorReporter reporter) {
        this.options = Objects.requireNonNull(options, "options");
        this.reporter = Objects.requireNonNull(reporter, "reporter");
    }

    public CoverageStats run(Netlist netlist) {
        logger.atFine().log("coverage: %s", options);
        CoverageStats stats = new CoverageStats();
        CoverageNames names = new CoverageNames();
        CoverPointFactory points = new CoverPointFactory(options, names, stats);
        CoverageVisitor visitor =
                new CoverageVisitor(
                        options,
                        names,
                        new LineTracker(),
                        points,
                        new ToggleExpander(options, names, points, reporter));
        netlist.accept(visitor);
        logger.atInfo().log("Coverage points: %d %s", stats.total(), stats.byCategory());
        if (options.dumpTreeDir != null) {
            dumpTree(netlist, options.dumpTreeDir.resolve(DUMP_FILE));
        }
        return stats;
    }

    private static void dumpTree(Netlist netlist, Path file) {
        logger.atInfo().log("Dumping coverage tree to %s", file);
        try {
            TreeDumper.write(netlist, file);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to dump tree to " + file, e);
        }
    }
}
