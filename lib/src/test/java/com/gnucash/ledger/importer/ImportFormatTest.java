package com.gnucash.ledger.importer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

final class ImportFormatTest {

    @Test
    void extensionIsCaseInsensitive() throws Exception {
        assertEquals(ImportFormat.QFX, ImportFormat.fromFilename("Checking.QFX"));
        assertEquals(ImportFormat.OFX, ImportFormat.fromFilename("a.b.ofx"));
        assertEquals(ImportFormat.CSV, ImportFormat.fromFilename("export.TXT"));
        assertEquals(ImportFormat.XLS, ImportFormat.fromFilename("old.xls"));
        assertTrue(ImportFormat.fromFilename("new.xlsx").isSpreadsheet());
        assertTrue(ImportFormat.QFX.isOfx());
    }

    @Test
    void unknownOrMissingExtension() {
        assertThrows(ImportFormatException.class, () -> ImportFormat.fromFilename("statement"));
        assertThrows(ImportFormatException.class, () -> ImportFormat.fromFilename("statement.pdf"));
        assertThrows(ImportFormatException.class, () -> ImportFormat.fromFilename(" "));
    }
}
