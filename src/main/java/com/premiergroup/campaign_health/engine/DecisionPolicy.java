package com.premiergroup.campaign_health.engine;

import com.premiergroup.campaign_health.config.AnalysisThresholds;
import com.premiergroup.campaign_health.dto.CampaignSeries;
import com.premiergroup.campaign_health.dto.HealthScoreBreakdown;
import com.premiergroup.campaign_health.dto.SeriesTotals;
import com.premiergroup.campaign_health.enums.ActionType;
import com.premiergroup.campaign_health.util.MetricFormat;

/**
 * Ordered rule table, first match wins:
 * <ol>
 *     <li>STOP: lifetime ROAS under the loss line on enough spend, or heavy spend with no purchases</li>
 *     <li>SCALE: health and lifetime ROAS both excellent on enough spend</li>
 *     <li>GOOD: health and lifetime ROAS both good</li>
 *     <li>ADJUST: fair health, or good lifetime ROAS with a weak recent trend</li>
 *     <li>WATCH: everything else</li>
 * </ol>
 * Health-based conditions only hold when the health score was actually measured;
 * the neutral default of a too-short series never qualifies.
 */
public class DecisionPolicy {

    private final AnalysisThresholds thresholds;

    public DecisionPolicy(AnalysisThresholds thresholds) {
        this.thresholds = thresholds;
    }

    public Verdict decide(CampaignSeries series, HealthScoreBreakdown health) {
        SeriesTotals totals = series.totals();
        boolean measured = health.measured();
        int score = health.total();

        boolean burning = totals.spend() > thresholds.getZeroPurchaseStopSpend() && totals.purchases() == 0;
        boolean losing = totals.roas() < thresholds.getLossRoas() && totals.spend() >= thresholds.getMinAnalysisSpend();
        if (burning) {
            return new Verdict(ActionType.STOP, "stop.zero-purchases",
                    "Spent " + MetricFormat.money(totals.spend()) + " with no purchases, stop now");
        }
        if (losing) {
            return new Verdict(ActionType.STOP, "stop.below-loss-roas",
                    "Lifetime ROAS " + MetricFormat.roas(totals.roas()) + " is under "
                            + MetricFormat.roas(thresholds.getLossRoas()) + " on "
                            + MetricFormat.money(totals.spend()) + " spend, the campaign is losing money");
        }

        if (measured && score >= thresholds.getScaleHealth()
                && totals.roas() >= thresholds.getScaleRoas()
                && totals.spend() >= thresholds.getMinAnalysisSpend()) {
            return new Verdict(ActionType.SCALE, "scale",
                    "Health " + score + "/100 with lifetime ROAS " + MetricFormat.roas(totals.roas())
                            + ", raise budget by 20-30%");
        }

        if (measured && score >= thresholds.getGoodHealth() && totals.roas() >= thresholds.getGoodRoas()) {
            return new Verdict(ActionType.GOOD, "good",
                    "Health " + score + "/100 with lifetime ROAS " + MetricFormat.roas(totals.roas())
                            + ", keep the current setup");
        }

        boolean fairHealth = measured && score >= thresholds.getAdjustHealth();
        boolean goodLifetime = totals.roas() >= thresholds.getGoodRoas();
        if (fairHealth || goodLifetime) {
            String reason;
            if (goodLifetime) {
                reason = "Lifetime ROAS " + MetricFormat.roas(totals.roas()) + " looks good but health is only "
                        + score + "/100";
            } else {
                reason = "Health " + score + "/100 with lifetime ROAS " + MetricFormat.roas(totals.roas())
                        + ", tune creative, audience or budget";
            }
            if (health.hasWindowAlert()) {
                reason += ": " + health.windowAlert();
            }
            return new Verdict(ActionType.ADJUST, "adjust", reason);
        }

        return new Verdict(ActionType.WATCH, "watch", watchReason(series, health));
    }

    private String watchReason(CampaignSeries series, HealthScoreBreakdown health) {
        SeriesTotals totals = series.totals();
        if (!health.measured()) {
            return "Not enough data yet (" + series.dayCount() + " day(s)), keep watching";
        }
        if (totals.purchases() < thresholds.getMinTrustedPurchases()) {
            return "Only " + totals.purchases() + " purchase(s) so far, need more data";
        }
        if (health.hasWindowAlert()) {
            return health.windowAlert();
        }
        return "Health " + health.total() + "/100 with lifetime ROAS " + MetricFormat.roas(totals.roas())
                + ", needs improvement";
    }

    /**
     * @param rule stable identifier of the rule that matched, kept in diagnostics
     */
    public record Verdict(ActionType action, String rule, String reason) {
    }
}
