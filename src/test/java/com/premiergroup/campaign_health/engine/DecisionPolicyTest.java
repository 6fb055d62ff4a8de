package com.premiergroup.campaign_health.engine;

import com.premiergroup.campaign_health.config.AnalysisThresholds;
import com.premiergroup.campaign_health.dto.CampaignSeries;
import com.premiergroup.campaign_health.dto.HealthScoreBreakdown;
import com.premiergroup.campaign_health.enums.ActionType;
import org.junit.jupiter.api.Test;

import static com.premiergroup.campaign_health.MetricSeriesFixtures.series;
import static com.premiergroup.campaign_health.MetricSeriesFixtures.steady;
import static org.assertj.core.api.Assertions.assertThat;

class DecisionPolicyTest {

    private final DecisionPolicy policy = new DecisionPolicy(AnalysisThresholds.defaults());

    private static HealthScoreBreakdown measured(int total) {
        return measured(total, "");
    }

    private static HealthScoreBreakdown measured(int total, String alert) {
        return new HealthScoreBreakdown(total, total, total, total, total, alert, true);
    }

    private static HealthScoreBreakdown unmeasured(int total) {
        return new HealthScoreBreakdown(total, total, total, total, total, "Not enough data", false);
    }

    @Test
    void decide_HeavySpendWithoutPurchasesStops() {
        CampaignSeries series = series(steady(0, 4, 300_000, 0, 0));

        DecisionPolicy.Verdict verdict = policy.decide(series, measured(90));

        assertThat(verdict.action()).isEqualTo(ActionType.STOP);
        assertThat(verdict.rule()).isEqualTo("stop.zero-purchases");
        assertThat(verdict.reason()).isEqualTo("Spent 1,200,000 with no purchases, stop now");
    }

    @Test
    void decide_LifetimeRoasUnderLossLineStops() {
        CampaignSeries series = series(steady(0, 5, 200_000, 2, 100_000));

        DecisionPolicy.Verdict verdict = policy.decide(series, measured(70));

        assertThat(verdict.action()).isEqualTo(ActionType.STOP);
        assertThat(verdict.rule()).isEqualTo("stop.below-loss-roas");
        assertThat(verdict.reason()).contains("0.50x").contains("1,000,000");
    }

    @Test
    void decide_LossLineNeedsEnoughSpend() {
        CampaignSeries series = series(steady(0, 2, 100_000, 1, 50_000));

        DecisionPolicy.Verdict verdict = policy.decide(series, unmeasured(50));

        assertThat(verdict.action()).isEqualTo(ActionType.WATCH);
        assertThat(verdict.reason()).isEqualTo("Not enough data yet (2 day(s)), keep watching");
    }

    @Test
    void decide_ExcellentHealthAndRoasScales() {
        CampaignSeries series = series(steady(0, 10, 500_000, 10, 2_500_000));

        DecisionPolicy.Verdict verdict = policy.decide(series, measured(80));

        assertThat(verdict.action()).isEqualTo(ActionType.SCALE);
        assertThat(verdict.reason()).contains("80/100").contains("5.00x");
    }

    @Test
    void decide_ScaleNeedsEnoughSpend() {
        CampaignSeries series = series(steady(0, 3, 100_000, 2, 500_000));

        assertThat(policy.decide(series, measured(80)).action()).isEqualTo(ActionType.GOOD);
    }

    @Test
    void decide_GoodHealthAndRoasIsGood() {
        CampaignSeries series = series(steady(0, 10, 500_000, 10, 1_500_000));

        DecisionPolicy.Verdict verdict = policy.decide(series, measured(65));

        assertThat(verdict.action()).isEqualTo(ActionType.GOOD);
        assertThat(verdict.rule()).isEqualTo("good");
    }

    @Test
    void decide_UnmeasuredHealthNeverScalesOrIsGood() {
        CampaignSeries series = series(steady(0, 10, 500_000, 10, 2_500_000));

        DecisionPolicy.Verdict verdict = policy.decide(series, unmeasured(80));

        assertThat(verdict.action()).isEqualTo(ActionType.ADJUST);
    }

    @Test
    void decide_GoodLifetimeWithWeakHealthAdjustsAndQuotesTheAlert() {
        CampaignSeries series = series(steady(0, 10, 500_000, 10, 3_000_000));

        DecisionPolicy.Verdict verdict = policy.decide(series, measured(25, "ROAS last 3 days 0.80x vs lifetime 6.00x (-87%)"));

        assertThat(verdict.action()).isEqualTo(ActionType.ADJUST);
        assertThat(verdict.reason()).isEqualTo(
                "Lifetime ROAS 6.00x looks good but health is only 25/100: ROAS last 3 days 0.80x vs lifetime 6.00x (-87%)");
    }

    @Test
    void decide_FairHealthAdjusts() {
        CampaignSeries series = series(steady(0, 5, 200_000, 2, 440_000));

        DecisionPolicy.Verdict verdict = policy.decide(series, measured(40));

        assertThat(verdict.action()).isEqualTo(ActionType.ADJUST);
        assertThat(verdict.reason()).isEqualTo("Health 40/100 with lifetime ROAS 2.20x, tune creative, audience or budget");
    }

    @Test
    void decide_FewPurchasesWatches() {
        CampaignSeries series = series(steady(0, 3, 200_000, 1, 440_000));

        DecisionPolicy.Verdict verdict = policy.decide(series, measured(30));

        assertThat(verdict.action()).isEqualTo(ActionType.WATCH);
        assertThat(verdict.reason()).isEqualTo("Only 3 purchase(s) so far, need more data");
    }

    @Test
    void decide_WeakHealthWatchesWithTheAlert() {
        CampaignSeries series = series(steady(0, 5, 200_000, 2, 440_000));

        DecisionPolicy.Verdict verdict = policy.decide(series, measured(30, "CPP last 3 days 200,000 vs lifetime 100,000 (+100%)"));

        assertThat(verdict.action()).isEqualTo(ActionType.WATCH);
        assertThat(verdict.reason()).isEqualTo("CPP last 3 days 200,000 vs lifetime 100,000 (+100%)");
    }
}
