package com.premiergroup.campaign_health.engine;

import com.premiergroup.campaign_health.config.AnalysisThresholds;
import com.premiergroup.campaign_health.dto.CampaignSeries;
import com.premiergroup.campaign_health.dto.DailyMetric;
import com.premiergroup.campaign_health.dto.MetricBand;
import com.premiergroup.campaign_health.dto.MetricTag;
import com.premiergroup.campaign_health.dto.SeriesSplit;
import com.premiergroup.campaign_health.enums.LifeStage;
import com.premiergroup.campaign_health.enums.MetricType;
import com.premiergroup.campaign_health.enums.Severity;
import com.premiergroup.campaign_health.enums.TagDirection;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.premiergroup.campaign_health.MetricSeriesFixtures.day;
import static com.premiergroup.campaign_health.MetricSeriesFixtures.risingCppSeries;
import static com.premiergroup.campaign_health.MetricSeriesFixtures.steady;
import static org.assertj.core.api.Assertions.assertThat;

class AnomalyTaggerTest {

    private final AnalysisThresholds thresholds = AnalysisThresholds.defaults();
    private final SeriesSplitter splitter = new SeriesSplitter(thresholds);
    private final BandCalculator bandCalculator = new BandCalculator(thresholds);
    private final AnomalyTagger tagger = new AnomalyTagger(thresholds);

    private List<MetricTag> tag(List<DailyMetric> metrics) {
        SeriesSplit split = splitter.split(metrics, null);
        return tagger.tag(split, metrics, bandCalculator.calculate(split));
    }

    @Test
    void tag_MatureCampaignWithRisingCppGetsCriticalTags() {
        CampaignSeries series = risingCppSeries();

        List<MetricTag> tags = tag(series.dailyMetrics());

        assertThat(tags).extracting(MetricTag::metric).containsExactly(MetricType.CPP, MetricType.ROAS);

        MetricTag cpp = tags.get(0);
        assertThat(cpp.direction()).isEqualTo(TagDirection.UP);
        assertThat(cpp.severity()).isEqualTo(Severity.CRITICAL);
        assertThat(cpp.label()).isEqualTo("CPP rising");
        assertThat(cpp.zScore()).isEqualTo(3.0);
        assertThat(cpp.benchmark()).isFalse();
        assertThat(cpp.detail()).isEqualTo("CPP 80,000 vs history 50,000 (+3.0σ)");

        MetricTag roas = tags.get(1);
        assertThat(roas.direction()).isEqualTo(TagDirection.DOWN);
        assertThat(roas.severity()).isEqualTo(Severity.CRITICAL);
        assertThat(roas.label()).isEqualTo("ROAS declining");
        assertThat(roas.isBadDirection()).isTrue();
    }

    @Test
    void zScoreTag_BadDirectionSeverityFollowsThresholds() {
        assertThat(tagger.zScoreTag(band(MetricType.CPP, 0.9), LifeStage.MATURE)).isNull();
        assertThat(tagger.zScoreTag(band(MetricType.CPP, 1.0), LifeStage.MATURE).severity()).isEqualTo(Severity.WARNING);
        assertThat(tagger.zScoreTag(band(MetricType.CPP, 1.99), LifeStage.MATURE).severity()).isEqualTo(Severity.WARNING);
        assertThat(tagger.zScoreTag(band(MetricType.CPP, 2.0), LifeStage.MATURE).severity()).isEqualTo(Severity.CRITICAL);

        MetricTag ctr = tagger.zScoreTag(band(MetricType.CTR, -2.5), LifeStage.MATURE);
        assertThat(ctr.direction()).isEqualTo(TagDirection.DOWN);
        assertThat(ctr.severity()).isEqualTo(Severity.CRITICAL);
        assertThat(ctr.label()).isEqualTo("CTR declining");
    }

    @Test
    void zScoreTag_GoodDirectionIsInfoOnlyPastItsOwnThreshold() {
        assertThat(tagger.zScoreTag(band(MetricType.CPP, -1.2), LifeStage.MATURE)).isNull();

        MetricTag falling = tagger.zScoreTag(band(MetricType.CPP, -1.6), LifeStage.MATURE);
        assertThat(falling.severity()).isEqualTo(Severity.INFO);
        assertThat(falling.direction()).isEqualTo(TagDirection.DOWN);
        assertThat(falling.label()).isEqualTo("CPP falling");
        assertThat(falling.isBadDirection()).isFalse();

        MetricTag roasUp = tagger.zScoreTag(band(MetricType.ROAS, 2.5), LifeStage.VETERAN);
        assertThat(roasUp.severity()).isEqualTo(Severity.INFO);
        assertThat(roasUp.label()).isEqualTo("ROAS improving");
    }

    @Test
    void zScoreTag_ZeroIsNeverTagged() {
        assertThat(tagger.zScoreTag(band(MetricType.ROAS, 0.0), LifeStage.VETERAN)).isNull();
    }

    @Test
    void zScoreTag_VeteranUsesItsOwnThresholds() {
        AnomalyTagger strict = new AnomalyTagger(AnalysisThresholds.builder()
                .veteranWarningZ(1.5)
                .veteranCriticalZ(2.5)
                .build());

        assertThat(strict.zScoreTag(band(MetricType.CPP, 1.2), LifeStage.MATURE).severity()).isEqualTo(Severity.WARNING);
        assertThat(strict.zScoreTag(band(MetricType.CPP, 1.2), LifeStage.VETERAN)).isNull();
        assertThat(strict.zScoreTag(band(MetricType.CPP, 2.2), LifeStage.MATURE).severity()).isEqualTo(Severity.CRITICAL);
        assertThat(strict.zScoreTag(band(MetricType.CPP, 2.2), LifeStage.VETERAN).severity()).isEqualTo(Severity.WARNING);
    }

    @Test
    void tag_EarlyCampaignIsComparedWithBenchmarks() {
        // 7 days: EARLY, CPP 200,000 and ROAS 0.2
        List<MetricTag> tags = tag(steady(0, 7, 200_000, 1, 40_000));

        assertThat(tags).extracting(MetricTag::metric).containsExactly(MetricType.CPP, MetricType.ROAS);
        assertThat(tags).allSatisfy(t -> {
            assertThat(t.benchmark()).isTrue();
            assertThat(t.severity()).isEqualTo(Severity.WARNING);
            assertThat(t.zScore()).isZero();
        });
        assertThat(tags.get(0).detail()).isEqualTo("CPP 200,000 > benchmark 150,000");
        assertThat(tags.get(1).detail()).isEqualTo("ROAS 0.20x < benchmark 0.50x");
    }

    @Test
    void tag_LearningCampaignWithLowCtrGetsBenchmarkWarning() {
        List<DailyMetric> metrics = List.of(
                day(0, 100_000, 100_000, 200, 2, 400_000, null),
                day(1, 100_000, 100_000, 200, 2, 400_000, null),
                day(2, 100_000, 100_000, 200, 2, 400_000, null));

        List<MetricTag> tags = tag(metrics);

        assertThat(tags).singleElement().satisfies(t -> {
            assertThat(t.metric()).isEqualTo(MetricType.CTR);
            assertThat(t.direction()).isEqualTo(TagDirection.DOWN);
            assertThat(t.label()).isEqualTo("CTR declining");
        });
    }

    @Test
    void tag_MatureCampaignWithoutEnoughHistoryFallsBackToBenchmarks() {
        // 8 days: MATURE but only one history day
        List<DailyMetric> metrics = new ArrayList<>(steady(0, 7, 500_000, 10, 1_500_000));
        metrics.add(day(7, 8_000_000, 10, 1_500_000));

        List<MetricTag> tags = tag(metrics);

        assertThat(tags).isNotEmpty().allSatisfy(t -> assertThat(t.benchmark()).isTrue());
        assertThat(tags).extracting(MetricTag::metric).contains(MetricType.CPP);
    }

    @Test
    void tag_SteadyMatureCampaignHasNoTags() {
        assertThat(tag(steady(0, 14, 500_000, 10, 1_500_000))).isEmpty();
    }

    private static MetricBand band(MetricType metric, double zScore) {
        return new MetricBand(metric, 5, 3, 100.0, 10.0, 80.0, 120.0, 100 + zScore * 10, zScore);
    }
}
