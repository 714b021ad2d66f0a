package com.gnucash.ledger.importer;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of parsing one statement file. When {@link #isNeedsMapping()} is true no columns could be
 * identified; {@link #getHeaders()} then lists the raw header cells for an explicit
 * {@link ColumnMapping}.
 */
public final class ImportResult {
    private final ImportFormat format;
    private final String suggestedAccountHint;
    private final boolean needsMapping;
    private final List<String> headers;
    private final int headerRowIndex;
    private final String layoutName;
    private final List<ImportRow> rows;

    public ImportResult(
            ImportFormat format,
            String suggestedAccountHint,
            boolean needsMapping,
            List<String> headers,
            int headerRowIndex,
            String layoutName,
            List<ImportRow> rows) {
        this.format = Objects.requireNonNull(format, "format");
        this.suggestedAccountHint = suggestedAccountHint;
        this.needsMapping = needsMapping;
        this.headers = headers == null ? List.of() : List.copyOf(headers);
        this.headerRowIndex = headerRowIndex;
        this.layoutName = layoutName;
        this.rows = rows == null ? List.of() : List.copyOf(rows);
    }

    static ImportResult needsMapping(ImportFormat format, List<String> headers, int headerRowIndex) {
        return new ImportResult(format, null, true, headers, headerRowIndex, null, List.of());
    }

    public ImportFormat getFormat() {
        return format;
    }

    /** "BANKID ACCTID ACCTTYPE" from an OFX header, or null. */
    public String getSuggestedAccountHint() {
        return suggestedAccountHint;
    }

    public boolean isNeedsMapping() {
        return needsMapping;
    }

    public List<String> getHeaders() {
        return headers;
    }

    /** Zero-based row of the header in the delimited text, or -1 when the format has none. */
    public int getHeaderRowIndex() {
        return headerRowIndex;
    }

    /** Known layout that mapped the columns ("Chase", "Generic", ...), or null. */
    public String getLayoutName() {
        return layoutName;
    }

    public List<ImportRow> getRows() {
        return rows;
    }

    /** Same result with {@code newRows}, e.g. after duplicate flags were set. */
    public ImportResult withRows(List<ImportRow> newRows) {
        return new ImportResult(format, suggestedAccountHint, needsMapping, headers, headerRowIndex, layoutName, newRows);
    }

    @Override
    public String toString() {
        return "ImportResult{format=" + format.getCode()
                + ", needsMapping=" + needsMapping
                + ", headerRow=" + headerRowIndex
                + ", layout=" + layoutName
                + ", rows=" + rows.size() + "}";
    }
}
