package io.instiflow.institutional.fetch;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

/**
 * How a publisher expects the trading date in its query string.
 */
public enum DateStyle {
    /** {@code 20240102} */
    GREGORIAN_COMPACT {
        @Override
        public String format(LocalDate date) {
            return date.format(DateTimeFormatter.BASIC_ISO_DATE);
        }
    },
    /** Republic of China calendar, {@code 113/01/02}. */
    ROC_SLASHED {
        @Override
        public String format(LocalDate date) {
            return String.format("%d/%02d/%02d", date.getYear() - ROC_YEAR_OFFSET, date.getMonthValue(), date.getDayOfMonth());
        }
    };

    static final int ROC_YEAR_OFFSET = 1911;

    public abstract String format(LocalDate date);
}
