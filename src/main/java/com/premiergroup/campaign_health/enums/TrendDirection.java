package com.premiergroup.campaign_health.enums;

public enum TrendDirection {
    IMPROVING,
    STABLE,
    WORSENING
}
