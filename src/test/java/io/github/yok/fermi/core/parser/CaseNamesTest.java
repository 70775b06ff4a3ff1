package io.github.yok.fermi.core.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class CaseNamesTest {

    @Test
    void stripsKnownExtensions() {
        assertEquals("LaSb_try3", CaseNames.extractCaseName("LaSb_try3.klist"));
        assertEquals("LaSb", CaseNames.extractCaseName("LaSb.energyso"));
        assertEquals("LaSb", CaseNames.extractCaseName("LaSb.outputkgen"));
        assertEquals("LaSb", CaseNames.extractCaseName("LaSb.struct"));
    }

    @Test
    void keepsUnknownNames() {
        assertEquals("notes.txt", CaseNames.extractCaseName("notes.txt"));
        assertThrows(IllegalArgumentException.class, () -> CaseNames.extractCaseName(null));
    }
}
