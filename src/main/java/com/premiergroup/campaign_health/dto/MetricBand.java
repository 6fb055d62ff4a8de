package com.premiergroup.campaign_health.dto;

import com.premiergroup.campaign_health.enums.MetricType;

/**
 * Moving average and deviation of one metric over the history segment, compared
 * with its average over the trailing window. Null components are unavailable.
 *
 * @param lowest smallest positive history observation
 * @param highest largest positive history observation
 * @param zScore (windowAverage - movingAverage) / standardDeviation, clamped
 */
public record MetricBand(
        MetricType metric,
        int historySamples,
        int windowSamples,
        Double movingAverage,
        Double standardDeviation,
        Double lowest,
        Double highest,
        Double windowAverage,
        Double zScore
) {

    public boolean isAvailable() {
        return movingAverage != null && standardDeviation != null;
    }

    public boolean hasZScore() {
        return zScore != null;
    }
}
