package com.gnucash.ledger.codec;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Converts between decimal amounts and the {@code numerator/denominator} text GnuCash uses for
 * split values and quantities.
 *
 * <p>Amounts are written over a fixed denominator of 100. Rounding to the cent is half away from
 * zero ({@link RoundingMode#HALF_UP}), so {@code fromFraction(toFraction(x))} always equals
 * {@code x.setScale(2, RoundingMode.HALF_UP)}.</p>
 */
public final class FractionCodec {

    public static final int DENOMINATOR = 100;
    public static final RoundingMode ROUNDING = RoundingMode.HALF_UP;

    private static final int CENT_SCALE = 2;
    private static final MathContext NON_DECIMAL_CONTEXT = new MathContext(20, RoundingMode.HALF_EVEN);

    private FractionCodec() {}

    /** Rounds an amount to whole cents the same way {@link #toFraction(BigDecimal)} does. */
    public static BigDecimal round(BigDecimal amount) {
        if (amount == null) {
            return BigDecimal.ZERO.setScale(CENT_SCALE);
        }
        return amount.setScale(CENT_SCALE, ROUNDING);
    }

    /** Formats {@code amount} as {@code cents/100}; a null amount encodes as zero. */
    public static String toFraction(BigDecimal amount) {
        BigInteger cents = round(amount).unscaledValue();
        return cents + "/" + DENOMINATOR;
    }

    /**
     * Parses {@code N/D} or a bare number. Returns zero for null or blank input. Power-of-ten
     * denominators decode exactly; any other denominator is divided out to 20 significant digits.
     *
     * @throws NumberFormatException when either side is not an integer or the denominator is zero
     */
    public static BigDecimal fromFraction(String text) {
        if (text == null) {
            return BigDecimal.ZERO.setScale(CENT_SCALE);
        }
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return BigDecimal.ZERO.setScale(CENT_SCALE);
        }
        int slash = trimmed.indexOf('/');
        if (slash < 0) {
            return new BigDecimal(trimmed);
        }
        BigInteger numerator = new BigInteger(trimmed.substring(0, slash).trim());
        BigInteger denominator = new BigInteger(trimmed.substring(slash + 1).trim());
        if (denominator.signum() == 0) {
            throw new NumberFormatException("Zero denominator: " + text);
        }
        if (denominator.signum() < 0) {
            numerator = numerator.negate();
            denominator = denominator.negate();
        }
        int scale = powerOfTen(denominator);
        if (scale >= 0) {
            return new BigDecimal(numerator, scale);
        }
        return new BigDecimal(numerator).divide(new BigDecimal(denominator), NON_DECIMAL_CONTEXT);
    }

    private static int powerOfTen(BigInteger value) {
        String digits = value.toString();
        if (digits.charAt(0) != '1') {
            return -1;
        }
        for (int i = 1; i < digits.length(); i++) {
            if (digits.charAt(i) != '0') {
                return -1;
            }
        }
        return digits.length() - 1;
    }
}
