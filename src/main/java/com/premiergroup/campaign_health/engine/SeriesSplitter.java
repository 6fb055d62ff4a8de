package com.premiergroup.campaign_health.engine;

import com.premiergroup.campaign_health.config.AnalysisThresholds;
import com.premiergroup.campaign_health.dto.DailyMetric;
import com.premiergroup.campaign_health.dto.SeriesSplit;
import com.premiergroup.campaign_health.enums.LifeStage;

import java.time.LocalDate;
import java.util.List;

import static java.time.temporal.ChronoUnit.DAYS;

/**
 * Splits a daily series into a baseline history and the trailing window, and
 * derives the campaign's life stage.
 * <p>
 * Age is measured from the creation date to the last day of the series, both
 * inclusive, so re-running on the same series never depends on the wall clock.
 * Without a creation date the number of days in the series is used instead.
 */
public class SeriesSplitter {

    private final AnalysisThresholds thresholds;

    public SeriesSplitter(AnalysisThresholds thresholds) {
        this.thresholds = thresholds;
    }

    public SeriesSplit split(List<DailyMetric> metrics, LocalDate createdDate) {
        int size = metrics.size();
        int windowSize = Math.min(thresholds.getWindowDays(), size);

        List<DailyMetric> history = metrics.subList(0, size - windowSize);
        List<DailyMetric> window = metrics.subList(size - windowSize, size);

        return new SeriesSplit(history, window, lifeStage(metrics, createdDate));
    }

    LifeStage lifeStage(List<DailyMetric> metrics, LocalDate createdDate) {
        // shorter than one window: no baseline at all
        if (metrics.size() < thresholds.getWindowDays()) {
            return LifeStage.LEARNING;
        }
        if (createdDate != null) {
            LocalDate lastDay = metrics.get(metrics.size() - 1).date();
            return thresholds.lifeStageForAge(DAYS.between(createdDate, lastDay) + 1);
        }
        return thresholds.lifeStageForAge(metrics.size());
    }
}
