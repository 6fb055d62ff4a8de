package com.premiergroup.campaign_health.enums;

import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;

/**
 * Analysis range. Ranges end yesterday because today's numbers are still moving.
 */
public enum DateFilter {

    LAST_7_DAYS,
    LAST_14_DAYS,
    LAST_30_DAYS,
    LAST_90_DAYS,
    THIS_MONTH,
    LAST_MONTH,
    CUSTOM;

    public LocalDate getStartDate(LocalDate today) {
        return switch (this) {
            case LAST_7_DAYS -> today.minusDays(7);
            case LAST_14_DAYS -> today.minusDays(14);
            case LAST_30_DAYS -> today.minusDays(30);
            case LAST_90_DAYS -> today.minusDays(90);
            case THIS_MONTH -> today.with(TemporalAdjusters.firstDayOfMonth());
            case LAST_MONTH -> today.minusMonths(1).with(TemporalAdjusters.firstDayOfMonth());
            case CUSTOM -> throw new IllegalArgumentException("CUSTOM range needs explicit dates");
        };
    }

    public LocalDate getEndDate(LocalDate today) {
        return switch (this) {
            case LAST_7_DAYS, LAST_14_DAYS, LAST_30_DAYS, LAST_90_DAYS -> today.minusDays(1);
            case THIS_MONTH -> today.minusDays(1).isBefore(today.with(TemporalAdjusters.firstDayOfMonth()))
                    ? today
                    : today.minusDays(1);
            case LAST_MONTH -> today.minusMonths(1).with(TemporalAdjusters.lastDayOfMonth());
            case CUSTOM -> throw new IllegalArgumentException("CUSTOM range needs explicit dates");
        };
    }
}
