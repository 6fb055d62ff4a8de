package com.premiergroup.campaign_health.util;

import com.premiergroup.campaign_health.enums.MetricType;

import java.util.Locale;

/**
 * Fixed-locale formatting for the human-readable strings the engine emits, so
 * the same input always renders the same text.
 */
public final class MetricFormat {

    private MetricFormat() {
    }

    public static String money(double amount) {
        return String.format(Locale.US, "%,.0f", amount);
    }

    public static String roas(double roas) {
        return String.format(Locale.US, "%.2fx", roas);
    }

    public static String percent(double percent) {
        return String.format(Locale.US, "%.2f%%", percent);
    }

    public static String signedPercent(double percent) {
        return String.format(Locale.US, "%+.0f%%", percent);
    }

    public static String sigma(double zScore) {
        return String.format(Locale.US, "%+.1fσ", zScore);
    }

    public static String value(MetricType metric, double value) {
        return switch (metric) {
            case CPP, SPEND -> money(value);
            case CTR -> percent(value);
            case ROAS -> roas(value);
        };
    }
}
