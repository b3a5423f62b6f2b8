package io.instiflow.institutional.parse;

import java.math.BigDecimal;

/**
 * Parses share counts as published: comma grouped, optionally signed, sometimes with a decimal part.
 */
public final class ShareCounts {
    private ShareCounts() {}

    /** @return the count, or null unless the text is a whole number that fits a long */
    public static Long parse(String text) {
        if (text == null) return null;
        String s = text.replace(",", "").trim();
        if (s.isEmpty()) return null;
        try {
            return Long.parseLong(s);
        } catch (NumberFormatException notLong) {
            try {
                // "1,000.00" passes, "1.9" does not
                return new BigDecimal(s).longValueExact();
            } catch (NumberFormatException | ArithmeticException notWholeCount) {
                return null;
            }
        }
    }
}
