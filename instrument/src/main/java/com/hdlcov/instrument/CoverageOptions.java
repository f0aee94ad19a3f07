package com.hdlcov.instrument;

import java.nio.file.Path;

/**
 * Switches of the coverage pass. Defaults match a run without any coverage option: nothing is
 * instrumented until a category is enabled.
 */
public final class CoverageOptions {
    public static final int DEFAULT_MAX_WIDTH = 256;

    public boolean coverageLine = false;
    public boolean coverageToggle = false;
    public boolean coverageUser = false;
    /** Also cover signals whose name, or an inlined scope of it, starts with an underscore. */
    public boolean coverageUnderscore = false;
    /** Signals wider than this many bits, unpacked elements included, get no toggle coverage. */
    public int coverageMaxWidth = DEFAULT_MAX_WIDTH;
    /** Add a traced counter variable next to every line, branch and user point. */
    public boolean traceCoverage = false;
    /** Directory receiving a dump of the instrumented tree, or {@code null}. */
    public Path dumpTreeDir = null;

    /** Enables line, toggle and user coverage. */
    public CoverageOptions all() {
        coverageLine = true;
        coverageToggle = true;
        coverageUser = true;
        return this;
    }

    public static CoverageOptions fromArgs(String... args) {
        CoverageOptions options = new CoverageOptions();
        if (args == null) {
            return options;
        }
        for (String arg : args) {
            if (arg == null) {
                continue;
            }
            switch (arg) {
                case "--coverage" -> options.all();
                case "--coverage-line" -> options.coverageLine = true;
                case "--coverage-toggle" -> options.coverageToggle = true;
                case "--coverage-user" -> options.coverageUser = true;
                case "--coverage-underscore" -> options.coverageUnderscore = true;
                case "--trace-coverage" -> options.traceCoverage = true;
                default -> parseValued(options, arg);
            }
        }
        return options;
    }

    private static void parseValued(CoverageOptions options, String arg) {
        if (arg.startsWith("--coverage-max-width=")) {
            String value = arg.substring("--coverage-max-width=".length());
            try {
                options.coverageMaxWidth = Integer.parseInt(value);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid --coverage-max-width value: " + value, e);
            }
            if (options.coverageMaxWidth < 0) {
                throw new IllegalArgumentException("--coverage-max-width must not be negative");
            }
        } else if (arg.startsWith("--dump-tree=")) {
            options.dumpTreeDir = Path.of(arg.substring("--dump-tree=".length()));
        } else {
            throw new IllegalArgumentException("Unknown coverage option: " + arg);
        }
    }

    @Override
    public String toString() {
        return "CoverageOptions{line=" + coverageLine
                + ", toggle=" + coverageToggle
                + ", user=" + coverageUser
                + ", underscore=" + coverageUnderscore
                + ", maxWidth=" + coverageMaxWidth
                + ", trace=" + traceCoverage
                + "}";
    }
}
