package com.premiergroup.campaign_health.engine;

import com.premiergroup.campaign_health.dto.DailyMetric;

import java.util.List;

/**
 * Ratio-of-sums view over a run of days. Ratios are null when their denominator is zero.
 */
record PeriodAggregate(int days, double spend, int purchases, double revenue, long impressions, long clicks) {

    static PeriodAggregate of(List<DailyMetric> metrics) {
        double spend = 0;
        double revenue = 0;
        int purchases = 0;
        long impressions = 0;
        long clicks = 0;
        for (DailyMetric m : metrics) {
            spend += m.spend();
            revenue += m.revenue();
            purchases += m.purchases();
            impressions += m.impressions();
            clicks += m.clicks();
        }
        return new PeriodAggregate(metrics.size(), spend, purchases, revenue, impressions, clicks);
    }

    static PeriodAggregate trailing(List<DailyMetric> metrics, int days) {
        int from = Math.max(0, metrics.size() - days);
        return of(metrics.subList(from, metrics.size()));
    }

    Double cpp() {
        return purchases > 0 ? spend / purchases : null;
    }

    Double roas() {
        return spend > 0 ? revenue / spend : null;
    }

    Double ctr() {
        return impressions > 0 ? (double) clicks / impressions * 100 : null;
    }
}
