package com.gnucash.ledger.importer;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * OFX/QFX statement reader. The SGML flavour of OFX leaves leaf elements unclosed, so values are
 * read line by line as {@code <TAG>value} rather than through an XML parser, and a
 * {@code <STMTTRN>} record ends at its closing tag, the next record or the end of the list.
 */
public final class OfxStatementParser {

    private static final Pattern RECORD_START = Pattern.compile("<STMTTRN>", Pattern.CASE_INSENSITIVE);
    private static final Pattern RECORD_END =
            Pattern.compile("</STMTTRN>|<STMTTRN>|</BANKTRANLIST>", Pattern.CASE_INSENSITIVE);
    private static final Map<String, Pattern> TAGS = new ConcurrentHashMap<>();

    private OfxStatementParser() {}

    public static ImportResult parse(String text, ImportFormat format) {
        List<String> hint = new ArrayList<>(3);
        for (String tag : List.of("BANKID", "ACCTID", "ACCTTYPE")) {
            String value = tag(tag, text);
            if (value != null && !value.isEmpty()) {
                hint.add(value);
            }
        }
        List<ImportRow> rows = new ArrayList<>();
        for (String record : records(text)) {
            ImportRow row = parseRecord(record);
            if (row != null) {
                rows.add(row);
            }
        }
        return new ImportResult(
                format, hint.isEmpty() ? null : String.join(" ", hint), false, List.of(), -1, null, rows);
    }

    /** Trimmed value of the first {@code <name>value} in {@code source}, or null. */
    public static String tag(String name, String source) {
        Pattern pattern = TAGS.computeIfAbsent(
                name, key -> Pattern.compile("<" + Pattern.quote(key) + ">([^<\\r\\n]+)", Pattern.CASE_INSENSITIVE));
        Matcher matcher = pattern.matcher(source);
        return matcher.find() ? matcher.group(1).trim() : null;
    }

    static List<String> records(String text) {
        List<String> records = new ArrayList<>();
        Matcher start = RECORD_START.matcher(text);
        Matcher end = RECORD_END.matcher(text);
        int from = 0;
        while (start.find(from)) {
            int bodyStart = start.end();
            int bodyEnd = end.find(bodyStart) ? end.start() : text.length();
            records.add(text.substring(bodyStart, bodyEnd));
            from = bodyEnd;
        }
        return records;
    }

    private static ImportRow parseRecord(String record) {
        String rawDate = tag("DTPOSTED", record);
        if (rawDate == null) {
            rawDate = tag("DTAVAIL", record);
        }
        LocalDate date = ImportDates.parse(rawDate);
        BigDecimal amount = AmountParser.parse(tag("TRNAMT", record));
        if (date == null || amount == null) {
            return null;
        }
        String name = tag("NAME", record);
        String memo = tag("MEMO", record);
        String description = name == null || name.isEmpty() ? memo : name;
        return new ImportRow(tag("FITID", record), date, description, amount, Columns.blankToNull(memo));
    }
}
