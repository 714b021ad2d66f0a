package com.gnucash.ledger.importer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.Test;

final class OfxStatementParserTest {

    static final String STATEMENT = String.join("\n",
            "OFXHEADER:100",
            "DATA:OFXSGML",
            "<OFX>",
            "<BANKMSGSRSV1><STMTTRNRS><STMTRS>",
            "<CURDEF>USD",
            "<BANKACCTFROM>",
            "<BANKID>121000248",
            "<ACCTID>1234567890",
            "<ACCTTYPE>CHECKING",
            "</BANKACCTFROM>",
            "<BANKTRANLIST>",
            "<STMTTRN>",
            "<TRNTYPE>DEBIT",
            "<DTPOSTED>20240115120000[-5:EST]",
            "<TRNAMT>-42.50",
            "<FITID>1234",
            "<NAME>TRADER JOES #123",
            "<MEMO>POS PURCHASE",
            "<STMTTRN>",
            "<TRNTYPE>DEBIT",
            "<DTAVAIL>20240116",
            "<TRNAMT>-4.00",
            "<FITID>1235",
            "<MEMO>COFFEE SHOP",
            "</STMTTRN>",
            "<STMTTRN>",
            "<DTPOSTED>PENDING",
            "<TRNAMT>1.00",
            "<FITID>1236",
            "</STMTTRN>",
            "</BANKTRANLIST>",
            "</STMTRS></STMTTRNRS></BANKMSGSRSV1>",
            "</OFX>");

    @Test
    void readsRecordsAndAccountHint() {
        ImportResult result = OfxStatementParser.parse(STATEMENT, ImportFormat.QFX);

        assertEquals(ImportFormat.QFX, result.getFormat());
        assertEquals("121000248 1234567890 CHECKING", result.getSuggestedAccountHint());
        assertFalse(result.isNeedsMapping());
        assertEquals(-1, result.getHeaderRowIndex());
        assertEquals(2, result.getRows().size(), "the record without a readable date is dropped");

        ImportRow first = result.getRows().get(0);
        assertEquals("1234", first.getExternalId());
        assertEquals(LocalDate.of(2024, 1, 15), first.getDate());
        assertEquals(new BigDecimal("-42.50"), first.getAmount());
        assertEquals("TRADER JOES #123", first.getDescription());
        assertEquals("POS PURCHASE", first.getMemo());
    }

    @Test
    void unclosedRecordEndsAtTheNextOne() {
        List<String> records = OfxStatementParser.records(STATEMENT);

        assertEquals(3, records.size());
        assertNull(OfxStatementParser.tag("DTAVAIL", records.get(0)));
    }

    @Test
    void memoStandsInForAMissingName() {
        ImportRow second = OfxStatementParser.parse(STATEMENT, ImportFormat.OFX).getRows().get(1);

        assertEquals("1235", second.getExternalId());
        assertEquals(LocalDate.of(2024, 1, 16), second.getDate(), "available date when nothing was posted");
        assertEquals("COFFEE SHOP", second.getDescription());
    }

    @Test
    void statementWithoutAccountDetails() {
        ImportResult result = OfxStatementParser.parse(
                "<OFX><STMTTRN>\n<DTPOSTED>20240201\n<TRNAMT>10\n<FITID>a\n<name>refund\n</OFX>", ImportFormat.OFX);

        assertNull(result.getSuggestedAccountHint());
        assertEquals(1, result.getRows().size());
        assertEquals("refund", result.getRows().get(0).getDescription());
    }

    @Test
    void tagValueIsTrimmedToTheLine() {
        assertEquals("ACME", OfxStatementParser.tag("ORG", "<FI>\n<ORG> ACME \n<FID>10898"));
        assertNull(OfxStatementParser.tag("ORG", "<FI><FID>10898"));
    }
}
