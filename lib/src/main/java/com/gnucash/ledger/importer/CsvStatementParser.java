package com.gnucash.ledger.importer;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/** Delimited-statement path: header detection, then known layout, generic match or explicit mapping. */
final class CsvStatementParser {

    static final String GENERIC_LAYOUT = "Generic";

    private CsvStatementParser() {}

    static ImportResult parse(String text, Integer headerRowOverride, ImportFormat format)
            throws ImportFormatException {
        List<List<String>> rows = CsvTokenizer.tokenize(text);
        if (rows.size() < 2) {
            return ImportResult.needsMapping(format, List.of(), -1);
        }
        int headerRow = headerRow(rows, headerRowOverride);
        List<String> headers = headers(rows.get(headerRow));
        List<List<String>> data = dataRows(rows, headerRow);

        KnownLayout layout = KnownLayout.detect(headers);
        if (layout != null) {
            List<ImportRow> parsed = new ArrayList<>();
            for (List<String> row : data) {
                ImportRow mapped = layout.map(row, headers);
                if (mapped != null) {
                    parsed.add(mapped);
                }
            }
            return new ImportResult(format, null, false, headers, headerRow, layout.getDisplayName(), parsed);
        }
        ColumnMapping mapping = GenericColumnMatcher.match(headers);
        if (mapping != null) {
            return new ImportResult(format, null, false, headers, headerRow, GENERIC_LAYOUT, apply(data, mapping));
        }
        return ImportResult.needsMapping(format, headers, headerRow);
    }

    static List<ImportRow> parseWithMapping(String text, ColumnMapping mapping) throws ImportFormatException {
        List<List<String>> rows = CsvTokenizer.tokenize(text);
        if (rows.size() < 2) {
            return List.of();
        }
        int headerRow = headerRow(rows, mapping.getHeaderRowIndex());
        return apply(dataRows(rows, headerRow), mapping);
    }

    /** Maps each row through {@code mapping}, dropping rows without a date or amount. */
    static List<ImportRow> apply(List<List<String>> data, ColumnMapping mapping) {
        List<ImportRow> parsed = new ArrayList<>();
        for (List<String> row : data) {
            LocalDate date = ImportDates.parse(Columns.cell(row, mapping.getDateColumn()));
            BigDecimal amount = AmountParser.parse(Columns.cell(row, mapping.getAmountColumn()));
            if (date == null || amount == null) {
                continue;
            }
            if (mapping.isNegateAmount()) {
                amount = amount.negate();
            }
            String memo = mapping.getMemoColumn() == null
                    ? null
                    : Columns.blankToNull(Columns.cell(row, mapping.getMemoColumn()));
            parsed.add(new ImportRow(
                    null, date, Columns.cell(row, mapping.getDescriptionColumn()), amount, memo));
        }
        return parsed;
    }

    private static int headerRow(List<List<String>> rows, Integer override) throws ImportFormatException {
        if (override == null) {
            return HeaderRowDetector.detect(rows);
        }
        if (override < 0 || override >= rows.size()) {
            throw new ImportFormatException(
                    "Header row " + override + " is outside the file's " + rows.size() + " rows");
        }
        return override;
    }

    private static List<String> headers(List<String> row) {
        List<String> headers = new ArrayList<>(row.size());
        for (String cell : row) {
            String header = cell;
            if (header.startsWith("\"")) {
                header = header.substring(1);
            }
            if (header.endsWith("\"")) {
                header = header.substring(0, header.length() - 1);
            }
            headers.add(header.trim());
        }
        return headers;
    }

    private static List<List<String>> dataRows(List<List<String>> rows, int headerRow) {
        List<List<String>> data = new ArrayList<>();
        for (List<String> row : rows.subList(headerRow + 1, rows.size())) {
            for (String cell : row) {
                if (!cell.isBlank()) {
                    data.add(row);
                    break;
                }
            }
        }
        return data;
    }
}
