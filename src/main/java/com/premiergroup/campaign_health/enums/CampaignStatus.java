package com.premiergroup.campaign_health.enums;

import java.util.List;

public enum CampaignStatus {
    ACTIVE,
    ENABLED,
    PAUSED,
    BUDGET_PAUSED,
    DELETED,
    REMOVED,
    SUSPENDED,
    PENDING,
    DRAFT;

    /**
     * Statuses of campaigns that are currently delivering and worth analysing.
     */
    public static List<String> running() {
        return List.of(ACTIVE.name(), ENABLED.name());
    }

    public static boolean isRunning(String status) {
        return status != null && running().contains(status.toUpperCase());
    }
}
