package com.gnucash.ledger.importer;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Turns an uploaded bank statement into normalized {@link ImportRow}s. The format follows the
 * file extension; delimited and spreadsheet statements go through header detection and column
 * mapping, OFX/QFX statements are read record by record. Rows without a readable date and amount
 * are dropped without error, since exports routinely carry summary and boilerplate lines.
 */
public final class StatementImporter {

    private static final Logger LOGGER = Logger.getLogger(StatementImporter.class.getName());

    /**
     * @param headerRowOverride zero-based header row for delimited files, or null to detect it
     */
    public ImportResult parseImportFile(byte[] content, String filename, Integer headerRowOverride)
            throws ImportFormatException {
        Objects.requireNonNull(content, "content");
        ImportFormat format = ImportFormat.fromFilename(filename);
        ImportResult result;
        if (format.isOfx()) {
            result = OfxStatementParser.parse(decode(content), format);
        } else if (format.isSpreadsheet()) {
            result = CsvStatementParser.parse(SpreadsheetConverter.toCsv(content), headerRowOverride, format);
        } else {
            result = CsvStatementParser.parse(decode(content), headerRowOverride, format);
        }
        if (result.isNeedsMapping()) {
            LOGGER.log(Level.INFO, "Columns of {0} not recognised; {1} headers returned for mapping",
                    new Object[] {filename, result.getHeaders().size()});
        } else {
            LOGGER.log(Level.INFO, "Parsed {0} rows from {1} ({2})",
                    new Object[] {result.getRows().size(), filename, result.getLayoutName() == null
                            ? format.getCode()
                            : result.getLayoutName()});
        }
        return result;
    }

    public ImportResult parseImportFile(byte[] content, String filename) throws ImportFormatException {
        return parseImportFile(content, filename, null);
    }

    /** Second pass over a delimited statement with caller-chosen columns. */
    public List<ImportRow> parseImportFileWithMapping(byte[] content, ColumnMapping mapping)
            throws ImportFormatException {
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(mapping, "mapping");
        List<ImportRow> rows = CsvStatementParser.parseWithMapping(decode(content), mapping);
        LOGGER.log(Level.INFO, "Parsed {0} rows with {1}", new Object[] {rows.size(), mapping});
        return rows;
    }

    /** Spreadsheet variant of {@link #parseImportFileWithMapping(byte[], ColumnMapping)}. */
    public List<ImportRow> parseImportFileWithMapping(byte[] content, String filename, ColumnMapping mapping)
            throws ImportFormatException {
        ImportFormat format = ImportFormat.fromFilename(filename);
        if (format.isOfx()) {
            throw new ImportFormatException("Column mappings apply to delimited statements, not " + filename);
        }
        if (format.isSpreadsheet()) {
            return CsvStatementParser.parseWithMapping(SpreadsheetConverter.toCsv(content), mapping);
        }
        return parseImportFileWithMapping(content, mapping);
    }

    private static String decode(byte[] content) {
        return new String(content, StandardCharsets.UTF_8);
    }
}
