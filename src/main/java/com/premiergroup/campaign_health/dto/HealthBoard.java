package com.premiergroup.campaign_health.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * Daily action board: analysed campaigns bucketed by classification.
 */
public record HealthBoard(
        List<CampaignHealthReport> critical,
        List<CampaignHealthReport> warning,
        List<CampaignHealthReport> good,
        Summary summary
) {

    @JsonIgnore
    public boolean isEmpty() {
        return summary.total() == 0;
    }

    public record Summary(
            int total,
            int critical,
            int warning,
            int good,
            double totalSpend,
            double totalRevenue
    ) {
    }
}
