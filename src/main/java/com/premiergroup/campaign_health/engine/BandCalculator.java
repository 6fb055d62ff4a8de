package com.premiergroup.campaign_health.engine;

import com.premiergroup.campaign_health.config.AnalysisThresholds;
import com.premiergroup.campaign_health.dto.DailyMetric;
import com.premiergroup.campaign_health.dto.MetricBand;
import com.premiergroup.campaign_health.dto.SeriesSplit;
import com.premiergroup.campaign_health.enums.MetricType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Bollinger-style bands per metric. Only strictly positive daily observations are
 * sampled: a day without purchases has no CPP, it does not have a CPP of zero.
 */
public class BandCalculator {

    private final AnalysisThresholds thresholds;

    public BandCalculator(AnalysisThresholds thresholds) {
        this.thresholds = thresholds;
    }

    public Map<MetricType, MetricBand> calculate(SeriesSplit split) {
        Map<MetricType, MetricBand> bands = new EnumMap<>(MetricType.class);
        for (MetricType metric : MetricType.values()) {
            bands.put(metric, band(metric, split.history(), split.window()));
        }
        return Collections.unmodifiableMap(bands);
    }

    MetricBand band(MetricType metric, List<DailyMetric> history, List<DailyMetric> window) {
        double[] historyValues = positiveValues(metric, history);
        double[] windowValues = positiveValues(metric, window);

        Double windowAverage = windowValues.length > 0 ? mean(windowValues) : null;

        if (historyValues.length < thresholds.getMinBandSamples()) {
            return new MetricBand(metric, historyValues.length, windowValues.length,
                    null, null, null, null, windowAverage, null);
        }

        double movingAverage = mean(historyValues);
        double standardDeviation = sampleStandardDeviation(historyValues, movingAverage);
        double lowest = historyValues[0];
        double highest = historyValues[0];
        for (double v : historyValues) {
            lowest = Math.min(lowest, v);
            highest = Math.max(highest, v);
        }

        Double zScore = null;
        if (windowAverage != null && standardDeviation > 0) {
            double raw = (windowAverage - movingAverage) / standardDeviation;
            double clamp = thresholds.getZScoreClamp();
            zScore = Math.max(-clamp, Math.min(clamp, raw));
        }

        return new MetricBand(metric, historyValues.length, windowValues.length,
                movingAverage, standardDeviation, lowest, highest, windowAverage, zScore);
    }

    static double valueOf(MetricType metric, DailyMetric m) {
        return switch (metric) {
            case CPP -> m.cpp();
            case CTR -> m.ctr();
            case ROAS -> m.roas();
            case SPEND -> m.spend();
        };
    }

    private static double[] positiveValues(MetricType metric, List<DailyMetric> metrics) {
        return metrics.stream()
                .mapToDouble(m -> valueOf(metric, m))
                .filter(v -> v > 0 && Double.isFinite(v))
                .toArray();
    }

    static double mean(double[] values) {
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    private static double sampleStandardDeviation(double[] values, double mean) {
        if (values.length < 2) {
            return 0;
        }
        double squares = 0;
        for (double v : values) {
            squares += (v - mean) * (v - mean);
        }
        return Math.sqrt(squares / (values.length - 1));
    }
}
