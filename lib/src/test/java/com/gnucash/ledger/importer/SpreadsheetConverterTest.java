package com.gnucash.ledger.importer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import org.apache.poi.hssf.usermodel.HSSFWorkbook;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;

final class SpreadsheetConverterTest {

    @Test
    void firstSheetBecomesDelimitedText() throws Exception {
        byte[] xlsx = statement(new XSSFWorkbook());

        assertEquals(
                "Date,Description,Amount\n2024-01-15,\"TRADER JOES, INC\",-42.5\n2024-01-16,COFFEE,-4\n",
                SpreadsheetConverter.toCsv(xlsx));
    }

    @Test
    void legacyWorkbooksAreReadToo() throws Exception {
        byte[] xls = statement(new HSSFWorkbook());

        assertEquals(
                "Date,Description,Amount\n2024-01-15,\"TRADER JOES, INC\",-42.5\n2024-01-16,COFFEE,-4\n",
                SpreadsheetConverter.toCsv(xls));
    }

    @Test
    void notAWorkbook() {
        ImportFormatException ex = assertThrows(
                ImportFormatException.class,
                () -> SpreadsheetConverter.toCsv("Date,Amount\n".getBytes(StandardCharsets.UTF_8)));

        assertTrue(ex.getMessage().startsWith("Unreadable spreadsheet"));
    }

    /** Title row, header row, two data rows and an empty row in between. */
    static byte[] statement(Workbook workbook) throws IOException {
        try (workbook) {
            CellStyle dateStyle = workbook.createCellStyle();
            dateStyle.setDataFormat(workbook.getCreationHelper().createDataFormat().getFormat("m/d/yyyy"));
            Sheet sheet = workbook.createSheet("Activity");
            Row header = sheet.createRow(0);
            header.createCell(0).setCellValue("Date");
            header.createCell(1).setCellValue("Description");
            header.createCell(2).setCellValue("Amount");
            dataRow(sheet, 1, dateStyle, LocalDate.of(2024, 1, 15), "TRADER JOES, INC", -42.5);
            sheet.createRow(2);
            dataRow(sheet, 3, dateStyle, LocalDate.of(2024, 1, 16), "COFFEE", -4.0);
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            workbook.write(out);
            return out.toByteArray();
        }
    }

    private static void dataRow(Sheet sheet, int index, CellStyle dateStyle, LocalDate date, String description, double amount) {
        Row row = sheet.createRow(index);
        row.createCell(0).setCellValue(date);
        row.getCell(0).setCellStyle(dateStyle);
        row.createCell(1).setCellValue(description);
        row.createCell(2).setCellValue(amount);
    }
}
