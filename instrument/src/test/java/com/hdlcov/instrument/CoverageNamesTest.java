package com.hdlcov.instrument;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

final class CoverageNamesTest {

    @Test
    void suffixesRepeatedNames() {
        CoverageNames names = new CoverageNames();
        assertEquals("x", names.unique("x"));
        assertEquals("x_1", names.unique("x"));
        assertEquals("y", names.unique("y"));
        assertEquals("x_2", names.unique("x"));
    }

    @Test
    void clearStartsOver() {
        CoverageNames names = new CoverageNames();
        names.unique("x");
        names.clear();
        assertEquals("x", names.unique("x"));
    }
}
