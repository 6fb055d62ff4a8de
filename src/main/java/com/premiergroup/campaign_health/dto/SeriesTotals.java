package com.premiergroup.campaign_health.dto;

import java.util.List;

/**
 * Lifetime sums over a whole series plus the ratios derived from them.
 */
public record SeriesTotals(
        double spend,
        int purchases,
        double revenue,
        long impressions,
        long clicks,
        double cpp,
        double roas,
        double ctr
) {

    public static SeriesTotals from(List<DailyMetric> metrics) {
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
        return new SeriesTotals(
                spend,
                purchases,
                revenue,
                impressions,
                clicks,
                purchases > 0 ? spend / purchases : 0,
                spend > 0 ? revenue / spend : 0,
                impressions > 0 ? (double) clicks / impressions * 100 : 0
        );
    }
}
