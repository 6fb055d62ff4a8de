package com.premiergroup.campaign_health.engine;

import com.premiergroup.campaign_health.config.AnalysisThresholds;
import com.premiergroup.campaign_health.dto.CampaignSeries;
import com.premiergroup.campaign_health.dto.DailyMetric;
import com.premiergroup.campaign_health.dto.Issue;
import com.premiergroup.campaign_health.dto.MetricTag;
import com.premiergroup.campaign_health.dto.SeriesTotals;
import com.premiergroup.campaign_health.enums.IssueType;
import com.premiergroup.campaign_health.enums.Severity;
import com.premiergroup.campaign_health.util.MetricFormat;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Absolute threshold checks first, then one issue per bad-direction tag.
 * <p>
 * A zero-purchase day counts here (it is exactly what the burn check looks for)
 * although it contributes no CPP sample to the bands.
 */
public class IssueDetector {

    private final AnalysisThresholds thresholds;

    public IssueDetector(AnalysisThresholds thresholds) {
        this.thresholds = thresholds;
    }

    public List<Issue> detect(CampaignSeries series, List<MetricTag> tags) {
        List<Issue> issues = new ArrayList<>();
        if (!series.isEmpty()) {
            absoluteChecks(series, issues);
        }
        for (MetricTag tag : tags) {
            if (tag.isBadDirection()) {
                issues.add(fromTag(tag));
            }
        }
        return List.copyOf(issues);
    }

    private void absoluteChecks(CampaignSeries series, List<Issue> issues) {
        List<DailyMetric> metrics = series.dailyMetrics();
        SeriesTotals totals = series.totals();
        DailyMetric latest = series.latest();

        // 1. spending without a single order
        if (latest.spend() >= thresholds.getBurnSpendFloor() && latest.purchases() == 0) {
            issues.add(new Issue(
                    IssueType.BURNING_MONEY,
                    Severity.CRITICAL,
                    "Burning money with no orders",
                    "Spent " + MetricFormat.money(latest.spend()) + " on " + latest.date() + ", 0 purchases",
                    "Stop the campaign immediately"));
        }

        // 2. orders, but below break-even
        if (totals.purchases() > 0 && totals.roas() < thresholds.getBreakevenRoas()) {
            double loss = totals.spend() - totals.revenue();
            issues.add(new Issue(
                    IssueType.LOSING_MONEY,
                    Severity.CRITICAL,
                    "Getting orders but losing money",
                    "ROAS " + MetricFormat.roas(totals.roas()) + ", loss " + MetricFormat.money(loss)
                            + " (spend " + MetricFormat.money(totals.spend())
                            + ", revenue " + MetricFormat.money(totals.revenue()) + ")",
                    "Cut budget by 50% or stop the campaign"));
        }

        // 3. audience saturation
        Double frequency = latest.frequency();
        if (frequency != null) {
            String detail = String.format(Locale.US, "Frequency %.1f on %s", frequency, latest.date());
            if (frequency > thresholds.getFrequencyCritical()) {
                issues.add(new Issue(IssueType.HIGH_FREQUENCY, Severity.CRITICAL,
                        "Audience exhausted", detail,
                        "Stop or switch to a completely new audience"));
            } else if (frequency >= thresholds.getFrequencyWarning()) {
                issues.add(new Issue(IssueType.HIGH_FREQUENCY, Severity.WARNING,
                        "Audience close to saturation", detail,
                        "Refresh creative within 1-2 days"));
            } else if (frequency >= thresholds.getFrequencyInfo()) {
                issues.add(new Issue(IssueType.HIGH_FREQUENCY, Severity.INFO,
                        "Frequency climbing", detail,
                        "Prepare replacement creative"));
            }
        }

        // 4. people click but nobody buys
        if (totals.ctr() >= thresholds.getGoodCtr()
                && totals.purchases() == 0
                && totals.spend() > thresholds.getClicksNoSalesMinSpend()) {
            issues.add(new Issue(IssueType.CLICKS_NO_SALES, Severity.WARNING,
                    "Plenty of clicks but no sales",
                    "CTR " + MetricFormat.percent(totals.ctr()) + ", 0 purchases",
                    "Check the landing page and the offer"));
        }

        if (metrics.size() >= thresholds.getSpikeMinDays()) {
            List<DailyMetric> previous = metrics.subList(0, metrics.size() - 1);

            // 5. CPM spike
            double avgCpm = previous.stream().mapToDouble(DailyMetric::cpm).average().orElse(0);
            if (avgCpm > 0) {
                double increase = (latest.cpm() - avgCpm) / avgCpm * 100;
                if (increase >= thresholds.getCpmSpikePercent()) {
                    issues.add(new Issue(IssueType.CPM_SPIKE, Severity.INFO,
                            "CPM jumped",
                            "Latest " + MetricFormat.money(latest.cpm()) + ", average " + MetricFormat.money(avgCpm)
                                    + " (" + MetricFormat.signedPercent(increase) + ")",
                            "Likely auction pressure, keep watching"));
                }
            }

            // 6. spend spike
            double avgSpend = previous.stream().mapToDouble(DailyMetric::spend).average().orElse(0);
            if (avgSpend > 0 && latest.spend() > avgSpend * (thresholds.getSpendSpikePercent() / 100)) {
                issues.add(new Issue(IssueType.SPEND_SPIKE, Severity.INFO,
                        "Unusually high spend",
                        "Latest " + MetricFormat.money(latest.spend()) + ", average " + MetricFormat.money(avgSpend),
                        "Check that the extra spend is converting"));
            }
        }
    }

    private static Issue fromTag(MetricTag tag) {
        return switch (tag.metric()) {
            case CPP -> new Issue(IssueType.CPP_RISING, tag.severity(),
                    "Cost per purchase rising", tag.detail(),
                    "Refresh creative and review targeting");
            case CTR -> new Issue(IssueType.CTR_DECLINING, tag.severity(),
                    "Click-through rate declining, creative is wearing out", tag.detail(),
                    "Replace the creative with new content");
            case ROAS -> new Issue(IssueType.ROAS_DECLINING, tag.severity(),
                    "Return on ad spend declining", tag.detail(),
                    "Reduce budget and review the offer and landing page");
            case SPEND -> throw new IllegalStateException("Spend is not tagged");
        };
    }
}
