package io.github.riemr.cpe.application.util;

import io.github.riemr.cpe.exception.ReportFormatException;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.Month;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.TextStyle;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the time strings found in webinar exports and meeting settings.
 * Resolution is whole seconds.
 */
public final class ReportDateParser {
    private ReportDateParser() {}

    private static final Pattern MONTH_DAY_YEAR_12H = Pattern.compile(
            "(\\w+)\\s+(\\d+),\\s+(\\d{4})\\s+(\\d{1,2}):(\\d{2})(?::(\\d{2}))?\\s*(AM|PM)", Pattern.CASE_INSENSITIVE);
    private static final Pattern MONTH_DAY_YEAR_24H = Pattern.compile(
            "(\\w+)\\s+(\\d+),\\s+(\\d{4})\\s+(\\d{1,2}):(\\d{2}):(\\d{2})");
    private static final Pattern ISO_LIKE = Pattern.compile(
            "(\\d{4})-(\\d{2})-(\\d{2})\\s(\\d{2}):(\\d{2}):(\\d{2})");

    private static final List<DateTimeFormatter> FALLBACK_DATE_TIMES = List.of(
            caseInsensitive("M/d/yyyy h:mm:ss a"),
            caseInsensitive("M/d/yyyy h:mm a"),
            caseInsensitive("M/d/yyyy H:mm:ss"),
            caseInsensitive("M/d/yyyy H:mm"),
            caseInsensitive("yyyy-MM-dd H:mm"),
            DateTimeFormatter.ISO_LOCAL_DATE_TIME);

    private static final List<DateTimeFormatter> FALLBACK_DATES = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE,
            caseInsensitive("M/d/yyyy"),
            caseInsensitive("MMM d, yyyy"),
            caseInsensitive("MMMM d, yyyy"),
            caseInsensitive("d MMM yyyy"),
            caseInsensitive("d MMMM yyyy"));

    public static LocalDateTime parse(String text) {
        if (text == null) {
            throw new ReportFormatException("undefined date string");
        }
        String s = text.trim();
        try {
            Matcher m = MONTH_DAY_YEAR_12H.matcher(s);
            if (m.find()) {
                int hour = Integer.parseInt(m.group(4)) % 12;
                if (m.group(7).equalsIgnoreCase("PM")) hour += 12;
                int second = m.group(6) == null ? 0 : Integer.parseInt(m.group(6));
                return LocalDateTime.of(Integer.parseInt(m.group(3)), decodeMonth(m.group(1), s),
                        Integer.parseInt(m.group(2)), hour, Integer.parseInt(m.group(5)), second);
            }
            m = MONTH_DAY_YEAR_24H.matcher(s);
            if (m.find()) {
                return LocalDateTime.of(Integer.parseInt(m.group(3)), decodeMonth(m.group(1), s),
                        Integer.parseInt(m.group(2)), Integer.parseInt(m.group(4)),
                        Integer.parseInt(m.group(5)), Integer.parseInt(m.group(6)));
            }
            m = ISO_LIKE.matcher(s);
            if (m.find()) {
                return LocalDateTime.of(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)),
                        Integer.parseInt(m.group(3)), Integer.parseInt(m.group(4)),
                        Integer.parseInt(m.group(5)), Integer.parseInt(m.group(6)));
            }
        } catch (DateTimeException | NumberFormatException e) {
            throw new ReportFormatException("failed to parse date '" + text + "': " + e.getMessage(), e);
        }
        return parseFallback(s, text);
    }

    private static LocalDateTime parseFallback(String s, String original) {
        for (DateTimeFormatter f : FALLBACK_DATE_TIMES) {
            try {
                return LocalDateTime.parse(s, f).withNano(0);
            } catch (DateTimeParseException ignored) {
                // next format
            }
        }
        for (DateTimeFormatter f : FALLBACK_DATES) {
            try {
                return LocalDate.parse(s, f).atStartOfDay();
            } catch (DateTimeParseException ignored) {
                // next format
            }
        }
        throw new ReportFormatException("failed to parse date '" + original + "'");
    }

    /** Month from its English name or any prefix of at least three letters. */
    static int decodeMonth(String name, String context) {
        String n = name.toLowerCase(Locale.ROOT);
        if (n.length() >= 3) {
            for (Month month : Month.values()) {
                String full = month.getDisplayName(TextStyle.FULL, Locale.ENGLISH).toLowerCase(Locale.ROOT);
                if (full.startsWith(n)) {
                    return month.getValue();
                }
            }
        }
        throw new ReportFormatException("unknown month '" + name + "' in date '" + context + "'");
    }

    private static DateTimeFormatter caseInsensitive(String pattern) {
        return new DateTimeFormatterBuilder()
                .parseCaseInsensitive()
                .appendPattern(pattern)
                .toFormatter(Locale.US);
    }
}
