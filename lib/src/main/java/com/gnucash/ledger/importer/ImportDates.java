package com.gnucash.ledger.importer;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.apache.poi.ss.usermodel.DateUtil;

/** Lenient date parsing for the shapes banks put in statement exports. */
public final class ImportDates {

    private static final Pattern COMPACT = Pattern.compile("^(\\d{4})(\\d{2})(\\d{2})");
    private static final Pattern MONTH_DAY_YEAR = Pattern.compile("^(\\d{1,2})/(\\d{1,2})/(\\d{4})");
    private static final Pattern ISO = Pattern.compile("^(\\d{4})-(\\d{2})-(\\d{2})");
    private static final Pattern SERIAL = Pattern.compile("^\\d+(\\.\\d+)?$");

    /** Excel serials at or below this are too early to be statement dates. */
    private static final double MIN_SERIAL = 40000;

    private ImportDates() {}

    /**
     * Accepts {@code YYYYMMDD[HHMMSS...]} (OFX), {@code M/D/YYYY}, {@code YYYY-MM-DD[...]} and
     * Excel serial day numbers above 40000. Returns null for anything else, including impossible
     * calendar dates.
     */
    public static LocalDate parse(String raw) {
        if (raw == null) {
            return null;
        }
        String text = raw.trim();
        if (text.isEmpty()) {
            return null;
        }
        try {
            Matcher matcher = COMPACT.matcher(text);
            if (matcher.find()) {
                return date(matcher.group(1), matcher.group(2), matcher.group(3));
            }
            matcher = MONTH_DAY_YEAR.matcher(text);
            if (matcher.find()) {
                return date(matcher.group(3), matcher.group(1), matcher.group(2));
            }
            matcher = ISO.matcher(text);
            if (matcher.find()) {
                return date(matcher.group(1), matcher.group(2), matcher.group(3));
            }
        } catch (DateTimeException ex) {
            return null;
        }
        if (SERIAL.matcher(text).matches()) {
            double serial = Double.parseDouble(text);
            if (serial > MIN_SERIAL && DateUtil.isValidExcelDate(serial)) {
                return DateUtil.getLocalDateTime(serial).toLocalDate();
            }
        }
        return null;
    }

    private static LocalDate date(String year, String month, String day) {
        return LocalDate.of(Integer.parseInt(year), Integer.parseInt(month), Integer.parseInt(day));
    }
}
