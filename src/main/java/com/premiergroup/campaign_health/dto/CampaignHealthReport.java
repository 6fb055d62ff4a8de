package com.premiergroup.campaign_health.dto;

import com.premiergroup.campaign_health.enums.HealthClass;

import java.util.List;

public record CampaignHealthReport(
        String campaignId,
        String campaignName,
        List<Issue> issues,
        ActionRecommendation recommendation,
        HealthClass classification
) {

    public CampaignHealthReport {
        issues = List.copyOf(issues);
    }
}
