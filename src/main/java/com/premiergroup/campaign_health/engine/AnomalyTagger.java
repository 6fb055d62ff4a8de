package com.premiergroup.campaign_health.engine;

import com.premiergroup.campaign_health.config.AnalysisThresholds;
import com.premiergroup.campaign_health.dto.DailyMetric;
import com.premiergroup.campaign_health.dto.MetricBand;
import com.premiergroup.campaign_health.dto.MetricTag;
import com.premiergroup.campaign_health.dto.SeriesSplit;
import com.premiergroup.campaign_health.enums.LifeStage;
import com.premiergroup.campaign_health.enums.MetricType;
import com.premiergroup.campaign_health.enums.Severity;
import com.premiergroup.campaign_health.enums.TagDirection;
import com.premiergroup.campaign_health.util.MetricFormat;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Turns bands into directional, severity-graded tags.
 * <p>
 * Policy per life stage:
 * <ul>
 *     <li>LEARNING, EARLY: no z-score tagging, window aggregates are compared with fixed
 *     benchmarks instead and can only produce warnings.</li>
 *     <li>MATURE, VETERAN: bad-direction moves of at least the stage's warning z are
 *     warnings, at least its critical z are critical. When the history has fewer points
 *     than a band needs, the benchmark comparison is used as for young campaigns.</li>
 * </ul>
 * Good-direction moves are tagged {@code INFO} once they pass the good-direction z,
 * whatever the stage.
 */
public class AnomalyTagger {

    private static final List<MetricType> TAGGED_METRICS = List.of(MetricType.CPP, MetricType.CTR, MetricType.ROAS);

    private final AnalysisThresholds thresholds;

    public AnomalyTagger(AnalysisThresholds thresholds) {
        this.thresholds = thresholds;
    }

    public List<MetricTag> tag(SeriesSplit split, List<DailyMetric> series, Map<MetricType, MetricBand> bands) {
        LifeStage stage = split.lifeStage();
        if (stage.usesBenchmarks() || split.history().size() < thresholds.getMinBandSamples()) {
            return benchmarkTags(split.window().isEmpty() ? series : split.window());
        }

        List<MetricTag> tags = new ArrayList<>();
        for (MetricType metric : TAGGED_METRICS) {
            MetricBand band = bands.get(metric);
            if (band != null && band.hasZScore()) {
                MetricTag tag = zScoreTag(band, stage);
                if (tag != null) {
                    tags.add(tag);
                }
            }
        }
        return List.copyOf(tags);
    }

    MetricTag zScoreTag(MetricBand band, LifeStage stage) {
        double z = band.zScore();
        if (z == 0) {
            return null;
        }
        MetricType metric = band.metric();
        TagDirection direction = metric.directionOf(z);
        boolean bad = direction == metric.badDirection();
        double absZ = Math.abs(z);

        Severity severity;
        if (bad) {
            if (absZ >= thresholds.criticalZ(stage)) {
                severity = Severity.CRITICAL;
            } else if (absZ >= thresholds.warningZ(stage)) {
                severity = Severity.WARNING;
            } else {
                return null;
            }
        } else if (absZ >= thresholds.getGoodDirectionInfoZ()) {
            severity = Severity.INFO;
        } else {
            return null;
        }

        String detail = String.format("%s %s vs history %s (%s)",
                metric,
                MetricFormat.value(metric, band.windowAverage()),
                MetricFormat.value(metric, band.movingAverage()),
                MetricFormat.sigma(z));
        return new MetricTag(metric, direction, severity, label(metric, direction), detail, z, false);
    }

    List<MetricTag> benchmarkTags(List<DailyMetric> window) {
        if (window.isEmpty()) {
            return List.of();
        }
        PeriodAggregate aggregate = PeriodAggregate.of(window);
        List<MetricTag> tags = new ArrayList<>();

        Double cpp = aggregate.cpp();
        if (cpp != null && cpp > thresholds.getBenchmarkCppCeiling()) {
            tags.add(benchmarkTag(MetricType.CPP, TagDirection.UP, cpp, thresholds.getBenchmarkCppCeiling(), ">"));
        }
        Double ctr = aggregate.ctr();
        if (ctr != null && ctr > 0 && ctr < thresholds.getBenchmarkCtrFloor()) {
            tags.add(benchmarkTag(MetricType.CTR, TagDirection.DOWN, ctr, thresholds.getBenchmarkCtrFloor(), "<"));
        }
        Double roas = aggregate.roas();
        if (roas != null && roas > 0 && roas < thresholds.getBenchmarkRoasFloor()) {
            tags.add(benchmarkTag(MetricType.ROAS, TagDirection.DOWN, roas, thresholds.getBenchmarkRoasFloor(), "<"));
        }
        return List.copyOf(tags);
    }

    private MetricTag benchmarkTag(MetricType metric, TagDirection direction, double value, double benchmark, String comparison) {
        String detail = String.format("%s %s %s benchmark %s",
                metric,
                MetricFormat.value(metric, value),
                comparison,
                MetricFormat.value(metric, benchmark));
        return new MetricTag(metric, direction, Severity.WARNING, label(metric, direction), detail, 0, true);
    }

    static String label(MetricType metric, TagDirection direction) {
        return switch (metric) {
            case CPP -> direction == TagDirection.UP ? "CPP rising" : "CPP falling";
            case CTR -> direction == TagDirection.UP ? "CTR improving" : "CTR declining";
            case ROAS -> direction == TagDirection.UP ? "ROAS improving" : "ROAS declining";
            case SPEND -> direction == TagDirection.UP ? "Spend rising" : "Spend falling";
        };
    }
}
