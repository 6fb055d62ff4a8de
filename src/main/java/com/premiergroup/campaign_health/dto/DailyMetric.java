package com.premiergroup.campaign_health.dto;

import java.time.LocalDate;

/**
 * One calendar day of a single campaign. Ratios whose denominator is zero are 0,
 * which every consumer reads as "no signal for that day".
 *
 * @param ctr click-through rate in percent
 * @param cpp cost per purchase, 0 when the day has no purchases
 * @param roas revenue / spend, 0 when the day has no spend
 * @param frequency average impressions per person, null when the platform did not report it
 */
public record DailyMetric(
        LocalDate date,
        double spend,
        long impressions,
        long clicks,
        int purchases,
        double revenue,
        double ctr,
        double cpc,
        double cpm,
        double cpp,
        double roas,
        Double frequency
) {

    public static DailyMetric of(
            LocalDate date,
            double spend,
            long impressions,
            long clicks,
            int purchases,
            double revenue,
            Double frequency
    ) {
        double ctr = impressions > 0 ? (double) clicks / impressions * 100 : 0;
        double cpc = clicks > 0 ? spend / clicks : 0;
        double cpm = impressions > 0 ? spend / impressions * 1000 : 0;
        double cpp = purchases > 0 ? spend / purchases : 0;
        double roas = spend > 0 ? revenue / spend : 0;
        return new DailyMetric(date, spend, impressions, clicks, purchases, revenue,
                ctr, cpc, cpm, cpp, roas, frequency);
    }

    public boolean hasPurchases() {
        return purchases > 0;
    }
}
