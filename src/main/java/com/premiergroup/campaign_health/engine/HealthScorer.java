package com.premiergroup.campaign_health.engine;

import com.premiergroup.campaign_health.config.AnalysisThresholds;
import com.premiergroup.campaign_health.dto.CampaignSeries;
import com.premiergroup.campaign_health.dto.DailyMetric;
import com.premiergroup.campaign_health.dto.HealthScoreBreakdown;
import com.premiergroup.campaign_health.dto.SeriesTotals;
import com.premiergroup.campaign_health.util.MetricFormat;

import java.util.List;

/**
 * Weighted 0-100 health score. Financial, trend and creative look at the trailing
 * days rather than lifetime totals, so a campaign with a great history and a bad
 * last few days still scores low.
 */
public class HealthScorer {

    static final int NEUTRAL = 50;

    private final AnalysisThresholds thresholds;

    public HealthScorer(AnalysisThresholds thresholds) {
        this.thresholds = thresholds;
    }

    public HealthScoreBreakdown score(CampaignSeries series) {
        List<DailyMetric> metrics = series.dailyMetrics();
        if (metrics.size() < thresholds.getMinHealthDays()) {
            String alert = "Not enough data: " + metrics.size() + " day(s), need at least "
                    + thresholds.getMinHealthDays();
            return new HealthScoreBreakdown(NEUTRAL, NEUTRAL, NEUTRAL, NEUTRAL, NEUTRAL, alert, false);
        }

        SeriesTotals totals = series.totals();
        PeriodAggregate recent = PeriodAggregate.trailing(metrics, thresholds.getTrailingDays());

        int financial = financialScore(recent);
        TrendScore trend = trendScore(recent, totals);
        int creative = creativeScore(recent, totals, series.latest());
        int stability = stabilityScore(metrics);

        int total = (int) Math.round(financial * thresholds.getFinancialWeight()
                + trend.score() * thresholds.getTrendWeight()
                + creative * thresholds.getCreativeWeight()
                + stability * thresholds.getStabilityWeight());

        return new HealthScoreBreakdown(financial, trend.score(), creative, stability,
                clamp(total), trend.alert(), true);
    }

    int financialScore(PeriodAggregate recent) {
        Double roas = recent.roas();
        if (roas == null) {
            return NEUTRAL;
        }
        if (roas >= 5) return 100;
        if (roas >= 4) return 90;
        if (roas >= 3) return 80;
        if (roas >= 2.5) return 70;
        if (roas >= 2) return 55;
        if (roas >= 1.5) return 35;
        if (roas >= 1) return 20;
        if (recent.purchases() == 0 && recent.spend() > thresholds.getZeroPurchaseTrailingSpend()) {
            return 5;
        }
        return 10;
    }

    TrendScore trendScore(PeriodAggregate recent, SeriesTotals totals) {
        int score = NEUTRAL;
        String alert = "";

        Double recentRoas = recent.roas();
        if (recentRoas != null && totals.roas() > 0) {
            double ratio = recentRoas / totals.roas();
            score = roasRatioScore(ratio);
            if (ratio < 0.7) {
                alert = "ROAS last " + recent.days() + " days " + MetricFormat.roas(recentRoas)
                        + " vs lifetime " + MetricFormat.roas(totals.roas())
                        + " (" + MetricFormat.signedPercent((ratio - 1) * 100) + ")";
            }
        }

        Double recentCpp = recent.cpp();
        if (recentCpp != null && totals.cpp() > 0) {
            double cppRatio = recentCpp / totals.cpp();
            int cap = score;
            if (cppRatio >= thresholds.getCppSevereCapRatio()) {
                cap = 15;
            } else if (cppRatio >= thresholds.getCppCapRatio()) {
                cap = 30;
            }
            if (cap < score) {
                score = cap;
                if (alert.isEmpty()) {
                    alert = "CPP last " + recent.days() + " days " + MetricFormat.money(recentCpp)
                            + " vs lifetime " + MetricFormat.money(totals.cpp())
                            + " (" + MetricFormat.signedPercent((cppRatio - 1) * 100) + ")";
                }
            }
        }
        return new TrendScore(score, alert);
    }

    private static int roasRatioScore(double ratio) {
        if (ratio < 0.3) return 5;
        if (ratio < 0.5) return 15;
        if (ratio < 0.7) return 30;
        if (ratio < 0.9) return 50;
        if (ratio <= 1.1) return 70;
        if (ratio <= 1.3) return 85;
        return 95;
    }

    int creativeScore(PeriodAggregate recent, SeriesTotals totals, DailyMetric latest) {
        int score = NEUTRAL;
        Double recentCtr = recent.ctr();
        if (recentCtr != null && totals.ctr() > 0) {
            double ratio = recentCtr / totals.ctr();
            if (ratio >= 1.1) score = 90;
            else if (ratio >= 0.95) score = 75;
            else if (ratio >= 0.85) score = 55;
            else if (ratio >= 0.75) score = 35;
            else score = 15;
        }

        Double frequency = latest.frequency();
        if (frequency != null) {
            if (frequency > 3) score = Math.min(score, 10);
            else if (frequency > 2.5) score = Math.min(score, 30);
            else if (frequency > 2) score = Math.min(score, 50);
        }
        return score;
    }

    /**
     * Coefficient of variation of every positive daily CPP.
     */
    int stabilityScore(List<DailyMetric> metrics) {
        double[] cpps = metrics.stream()
                .mapToDouble(DailyMetric::cpp)
                .filter(v -> v > 0)
                .toArray();
        if (cpps.length < 2) {
            return NEUTRAL;
        }
        double mean = BandCalculator.mean(cpps);
        double squares = 0;
        for (double v : cpps) {
            squares += (v - mean) * (v - mean);
        }
        double cv = Math.sqrt(squares / cpps.length) / mean;

        if (cv < 0.15) return 90;
        if (cv < 0.3) return 70;
        if (cv < 0.5) return 50;
        if (cv < 0.7) return 30;
        return 10;
    }

    private static int clamp(int score) {
        return Math.max(0, Math.min(100, score));
    }

    record TrendScore(int score, String alert) {
    }
}
