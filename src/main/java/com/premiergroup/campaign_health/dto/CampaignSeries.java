package com.premiergroup.campaign_health.dto;

import java.time.LocalDate;
import java.util.List;

/**
 * A campaign and its chronologically ordered daily metrics. Immutable; totals are
 * computed once when the series is built.
 */
public record CampaignSeries(
        String campaignId,
        String name,
        String status,
        List<DailyMetric> dailyMetrics,
        SeriesTotals totals,
        LocalDate createdDate,
        Double dailyBudget
) {

    public CampaignSeries {
        dailyMetrics = List.copyOf(dailyMetrics);
        validate(dailyMetrics);
    }

    public static CampaignSeries of(
            String campaignId,
            String name,
            String status,
            List<DailyMetric> dailyMetrics,
            LocalDate createdDate,
            Double dailyBudget
    ) {
        return new CampaignSeries(campaignId, name, status, dailyMetrics,
                SeriesTotals.from(dailyMetrics), createdDate, dailyBudget);
    }

    public int dayCount() {
        return dailyMetrics.size();
    }

    public boolean isEmpty() {
        return dailyMetrics.isEmpty();
    }

    public DailyMetric latest() {
        return dailyMetrics.isEmpty() ? null : dailyMetrics.get(dailyMetrics.size() - 1);
    }

    private static void validate(List<DailyMetric> metrics) {
        LocalDate previous = null;
        for (DailyMetric m : metrics) {
            if (m.date() == null) {
                throw new IllegalArgumentException("Daily metric without a date");
            }
            if (previous != null && !m.date().isAfter(previous)) {
                throw new IllegalArgumentException(
                        "Daily metrics must be strictly ascending by date, got " + m.date() + " after " + previous);
            }
            if (m.spend() < 0 || m.revenue() < 0 || m.impressions() < 0 || m.clicks() < 0 || m.purchases() < 0) {
                throw new IllegalArgumentException("Negative metric value on " + m.date());
            }
            previous = m.date();
        }
    }
}
