package com.gnucash.ledger.importer;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;

/**
 * Renders the first sheet of an {@code .xlsx} or {@code .xls} workbook as comma-delimited text so
 * it can go through the delimited-statement path. Date cells become ISO dates, other numbers are
 * written unformatted, and rows without any content are skipped.
 */
public final class SpreadsheetConverter {

    private SpreadsheetConverter() {}

    public static String toCsv(byte[] workbookBytes) throws ImportFormatException {
        try (Workbook workbook = WorkbookFactory.create(new ByteArrayInputStream(workbookBytes))) {
            if (workbook.getNumberOfSheets() == 0) {
                return "";
            }
            Sheet sheet = workbook.getSheetAt(0);
            StringBuilder csv = new StringBuilder();
            for (Row row : sheet) {
                List<String> cells = new ArrayList<>();
                boolean hasContent = false;
                short last = row.getLastCellNum();
                for (int column = 0; column < last; column++) {
                    String text = cellText(row.getCell(column, Row.MissingCellPolicy.RETURN_BLANK_AS_NULL));
                    hasContent |= !text.isBlank();
                    cells.add(quote(text));
                }
                if (hasContent) {
                    csv.append(String.join(",", cells)).append('\n');
                }
            }
            return csv.toString();
        } catch (IOException | RuntimeException ex) {
            throw new ImportFormatException("Unreadable spreadsheet: " + ex.getMessage(), ex);
        }
    }

    static String cellText(Cell cell) {
        if (cell == null) {
            return "";
        }
        CellType type = cell.getCellType();
        if (type == CellType.FORMULA) {
            type = cell.getCachedFormulaResultType();
        }
        switch (type) {
            case STRING:
                return cell.getStringCellValue();
            case NUMERIC:
                if (DateUtil.isCellDateFormatted(cell)) {
                    return cell.getLocalDateTimeCellValue().toLocalDate().toString();
                }
                return BigDecimal.valueOf(cell.getNumericCellValue()).stripTrailingZeros().toPlainString();
            case BOOLEAN:
                return String.valueOf(cell.getBooleanCellValue());
            default:
                return "";
        }
    }

    private static String quote(String text) {
        if (text.indexOf(',') < 0 && text.indexOf('"') < 0 && text.indexOf('\n') < 0 && text.indexOf('\r') < 0) {
            return text;
        }
        return '"' + text.replace("\"", "\"\"") + '"';
    }
}
