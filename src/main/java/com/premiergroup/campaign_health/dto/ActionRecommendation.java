package com.premiergroup.campaign_health.dto;

import com.premiergroup.campaign_health.enums.ActionType;
import com.premiergroup.campaign_health.enums.LifeStage;

import java.util.List;

public record ActionRecommendation(
        ActionType action,
        String reason,
        int healthScore,
        String trendInfo,
        String windowAlert,
        List<MetricTag> metricTags,
        LifeStage lifeStage,
        HealthScoreBreakdown health,
        Diagnostics diagnostics
) {

    public ActionRecommendation {
        metricTags = List.copyOf(metricTags);
    }
}
