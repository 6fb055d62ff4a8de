package com.premiergroup.campaign_health.engine;

import com.premiergroup.campaign_health.config.AnalysisThresholds;
import com.premiergroup.campaign_health.dto.CampaignSeries;
import com.premiergroup.campaign_health.dto.SeriesTotals;
import com.premiergroup.campaign_health.dto.TrendSnapshot;
import com.premiergroup.campaign_health.enums.TrendDirection;
import com.premiergroup.campaign_health.util.MetricFormat;

/**
 * Trailing-days CPP and ROAS against lifetime, as percentages.
 */
public class TrendCalculator {

    private final AnalysisThresholds thresholds;

    public TrendCalculator(AnalysisThresholds thresholds) {
        this.thresholds = thresholds;
    }

    public TrendSnapshot calculate(CampaignSeries series) {
        if (series.dayCount() < thresholds.getMinHealthDays()) {
            return new TrendSnapshot(false, null, null, null, null, null, null,
                    TrendDirection.STABLE, "Not enough data for trend analysis");
        }

        SeriesTotals totals = series.totals();
        PeriodAggregate recent = PeriodAggregate.trailing(series.dailyMetrics(), thresholds.getTrailingDays());

        Double recentCpp = recent.cpp();
        Double lifetimeCpp = totals.purchases() > 0 ? totals.cpp() : null;
        Double cppChange = change(recentCpp, lifetimeCpp);

        Double recentRoas = recent.roas();
        Double lifetimeRoas = totals.spend() > 0 ? totals.roas() : null;
        Double roasChange = change(recentRoas, lifetimeRoas);

        TrendDirection direction = direction(cppChange, roasChange);
        String summary = summary(recent.days(), recentCpp, cppChange, lifetimeCpp, recentRoas, roasChange, lifetimeRoas);

        return new TrendSnapshot(true, recentCpp, lifetimeCpp, cppChange,
                recentRoas, lifetimeRoas, roasChange, direction, summary);
    }

    private TrendDirection direction(Double cppChange, Double roasChange) {
        double variance = thresholds.getTrendVariancePercent();
        // CPP leads, ROAS only decides when there is no CPP signal
        if (cppChange != null) {
            if (cppChange > variance) return TrendDirection.WORSENING;
            if (cppChange < -variance) return TrendDirection.IMPROVING;
            return TrendDirection.STABLE;
        }
        if (roasChange != null) {
            if (roasChange < -variance) return TrendDirection.WORSENING;
            if (roasChange > variance) return TrendDirection.IMPROVING;
        }
        return TrendDirection.STABLE;
    }

    private static String summary(int days, Double recentCpp, Double cppChange, Double lifetimeCpp,
                                  Double recentRoas, Double roasChange, Double lifetimeRoas) {
        StringBuilder sb = new StringBuilder("Last ").append(days).append(" days: ");
        if (recentCpp != null) {
            sb.append("CPP ").append(MetricFormat.money(recentCpp));
            if (cppChange != null) {
                sb.append(" (").append(MetricFormat.signedPercent(cppChange))
                        .append(" vs lifetime ").append(MetricFormat.money(lifetimeCpp)).append(')');
            }
        } else {
            sb.append("no purchases");
        }
        sb.append(", ");
        if (recentRoas != null) {
            sb.append("ROAS ").append(MetricFormat.roas(recentRoas));
            if (roasChange != null) {
                sb.append(" (").append(MetricFormat.signedPercent(roasChange))
                        .append(" vs lifetime ").append(MetricFormat.roas(lifetimeRoas)).append(')');
            }
        } else {
            sb.append("no spend");
        }
        return sb.toString();
    }

    private static Double change(Double recent, Double lifetime) {
        if (recent == null || lifetime == null || lifetime <= 0) {
            return null;
        }
        return (recent - lifetime) / lifetime * 100;
    }
}
