package com.gnucash.ledger.importer;

import java.math.BigDecimal;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Statement amount parser. Currency signs, grouping commas and spaces are removed, then the
 * longest leading decimal number is read; trailing text such as a currency code is ignored.
 */
public final class AmountParser {

    private static final Pattern STRIPPED = Pattern.compile("[$, ]");
    private static final Pattern LEADING_NUMBER =
            Pattern.compile("^[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");
    private static final int MAX_EXPONENT = 20;

    private AmountParser() {}

    /** Returns null when no number can be read or its exponent is beyond {@value #MAX_EXPONENT}. */
    public static BigDecimal parse(String raw) {
        if (raw == null) {
            return null;
        }
        String text = STRIPPED.matcher(raw).replaceAll("").strip();
        if (text.isEmpty()) {
            return null;
        }
        Matcher matcher = LEADING_NUMBER.matcher(text);
        if (!matcher.find()) {
            return null;
        }
        String number = matcher.group();
        if (number.endsWith(".")) {
            number = number.substring(0, number.length() - 1);
        }
        BigDecimal value;
        try {
            value = new BigDecimal(number.startsWith("+") ? number.substring(1) : number);
        } catch (NumberFormatException ex) {
            return null;
        }
        if (value.scale() < -MAX_EXPONENT || value.scale() - value.precision() > MAX_EXPONENT) {
            return null;
        }
        return value.scale() < 0 ? value.setScale(0) : value;
    }
}
