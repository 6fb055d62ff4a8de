package com.premiergroup.campaign_health.dto;

import com.premiergroup.campaign_health.enums.LifeStage;

import java.util.List;

/**
 * History (baseline) and trailing window of a series, plus the derived life stage.
 */
public record SeriesSplit(
        List<DailyMetric> history,
        List<DailyMetric> window,
        LifeStage lifeStage
) {

    public SeriesSplit {
        history = List.copyOf(history);
        window = List.copyOf(window);
    }

    public boolean hasBaseline() {
        return !history.isEmpty();
    }
}
