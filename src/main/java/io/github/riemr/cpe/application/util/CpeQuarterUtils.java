package io.github.riemr.cpe.application.util;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Locale;

public final class CpeQuarterUtils {
    private CpeQuarterUtils() {}

    private static final int QUARTERS_PER_HOUR = 4;
    private static final double ROUNDING_BIAS = 0.45;

    public static double minutesBetween(LocalDateTime from, LocalDateTime to) {
        return Duration.between(from, to).getSeconds() / 60.0;
    }

    /**
     * Converts minutes to quarter-unit credits, rounding up from 0.55 of a quarter, then clamps to
     * {@code [0, max]}.
     */
    public static double toQuarterCredits(double minutes, int max) {
        double quarters = (long) (minutes / 60.0 * QUARTERS_PER_HOUR + ROUNDING_BIAS);
        double cpe = quarters / QUARTERS_PER_HOUR;
        if (cpe > max) return max;
        return Math.max(0.0, cpe);
    }

    public static String formatMinutes(double minutes) {
        return String.format(Locale.ROOT, "%.3f", minutes);
    }

    /** Credit without trailing zeros: 2, 1.5, 0.25. */
    public static String formatCredits(double cpe) {
        BigDecimal v = BigDecimal.valueOf(cpe).stripTrailingZeros();
        if (v.signum() == 0) return "0";
        return v.toPlainString();
    }
}
