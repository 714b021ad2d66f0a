package com.gnucash.ledger.importer;

import java.util.Locale;

/** Statement file formats, chosen by file extension. */
public enum ImportFormat {
    QFX("qfx"),
    OFX("ofx"),
    CSV("csv"),
    XLSX("xlsx"),
    XLS("xls");

    private final String code;

    ImportFormat(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public boolean isOfx() {
        return this == QFX || this == OFX;
    }

    public boolean isSpreadsheet() {
        return this == XLSX || this == XLS;
    }

    /** Format for {@code filename}; {@code .txt} files are read as CSV. */
    public static ImportFormat fromFilename(String filename) throws ImportFormatException {
        if (filename == null || filename.isBlank()) {
            throw new ImportFormatException("Import file name is required to detect its format");
        }
        int dot = filename.lastIndexOf('.');
        String extension = dot < 0 ? "" : filename.substring(dot + 1).trim().toLowerCase(Locale.ROOT);
        return switch (extension) {
            case "qfx" -> QFX;
            case "ofx" -> OFX;
            case "csv", "txt" -> CSV;
            case "xlsx" -> XLSX;
            case "xls" -> XLS;
            default -> throw new ImportFormatException(
                    "Unsupported import file '" + filename + "'; expected .qfx, .ofx, .csv, .txt, .xlsx or .xls");
        };
    }
}
