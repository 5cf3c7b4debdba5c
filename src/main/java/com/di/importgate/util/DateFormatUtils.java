package com.di.importgate.util;

import java.util.regex.Pattern;

/**
 * Date helpers for summary and mapping values, which carry ISO dates at year,
 * month or day granularity.
 */
public final class DateFormatUtils {

    private static final Pattern YEAR = Pattern.compile("^\\d{4}$");
    private static final Pattern YEAR_MONTH = Pattern.compile("^\\d{4}-(0[1-9]|1[0-2])$");
    private static final Pattern YEAR_MONTH_DAY = Pattern.compile("^\\d{4}-(0[1-9]|1[0-2])-(0[1-9]|[12]\\d|3[01])$");

    private DateFormatUtils() {
    }

    /** True for a bare four-digit year such as {@code 2020}. */
    public static boolean isBareYear(String value) {
        return value != null && YEAR.matcher(value.trim()).matches();
    }

    /** True for {@code YYYY}, {@code YYYY-MM} or {@code YYYY-MM-DD}. */
    public static boolean isIsoDate(String value) {
        if (value == null) {
            return false;
        }
        String v = value.trim();
        return YEAR.matcher(v).matches() || YEAR_MONTH.matcher(v).matches() || YEAR_MONTH_DAY.matcher(v).matches();
    }

    /**
     * Expands a bare year to January 1st of that year ({@code 2020} → {@code 2020-01-01}).
     * Any other value is returned unchanged.
     */
    public static String yearToCalendarDate(String value) {
        if (!isBareYear(value)) {
            return value;
        }
        return value.trim() + "-01-01";
    }
}
