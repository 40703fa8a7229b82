package com.plazaintel.comparisons.model;

import java.math.BigDecimal;

/**
 * Integer encoding of a (year, month) period as {@code year * 100 + month}.
 *
 * Two-digit years are normalised to 20xx, so "24" and "2024" map to the same key.
 * e.g. (2024, 3) → 202403, label "Marzo 2024", index label "2024-03"
 */
public final class PeriodKey {

    public static final int MIN_YEAR = 2000;
    public static final int MAX_YEAR = 9999;

    private static final String[] MONTH_NAMES = {
            "Enero", "Febrero", "Marzo", "Abril", "Mayo", "Junio",
            "Julio", "Agosto", "Septiembre", "Octubre", "Noviembre", "Diciembre"
    };

    private PeriodKey() {
    }

    public record YearMonth(int year, int month) {}

    public static int encode(int year, int month) {
        int normalised = normaliseYear(year);
        if (month < 1 || month > 12) {
            throw new InvalidPeriodException("Month must be between 1 and 12, got " + month);
        }
        if (normalised < MIN_YEAR || normalised > MAX_YEAR) {
            throw new InvalidPeriodException("Year must be between " + MIN_YEAR + " and " + MAX_YEAR + ", got " + year);
        }
        return normalised * 100 + month;
    }

    /**
     * Lenient variant for values coming from query strings or dataset cells:
     * accepts "06", "6" and "6.0".
     */
    public static int encode(String year, String month) {
        return encode(parseComponent(year, "year"), parseComponent(month, "month"));
    }

    public static YearMonth decode(int key) {
        int year = key / 100;
        int month = key % 100;
        if (month < 1 || month > 12 || year < MIN_YEAR || year > MAX_YEAR) {
            throw new InvalidPeriodException("Not a valid period key: " + key);
        }
        return new YearMonth(year, month);
    }

    public static int year(int key) {
        return key / 100;
    }

    public static int month(int key) {
        return key % 100;
    }

    public static int normaliseYear(int year) {
        return year < 100 ? year + 2000 : year;
    }

    /** Display label, e.g. "Enero 2024". */
    public static String label(int year, int month) {
        if (month < 1 || month > 12) {
            return String.format("%02d %d", month, normaliseYear(year));
        }
        return MONTH_NAMES[month - 1] + " " + normaliseYear(year);
    }

    public static String label(int key) {
        return label(year(key), month(key));
    }

    /** Remote index label, e.g. "2024-01". */
    public static String indexLabel(int year, int month) {
        return String.format("%d-%02d", normaliseYear(year), month);
    }

    public static String indexLabel(int key) {
        return indexLabel(year(key), month(key));
    }

    public static int parseComponent(String raw, String field) {
        if (raw == null || raw.isBlank()) {
            throw new InvalidPeriodException("Missing " + field);
        }
        try {
            return new BigDecimal(raw.trim()).intValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            throw new InvalidPeriodException("Invalid " + field + ": " + raw);
        }
    }
}
