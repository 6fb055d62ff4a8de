package com.premiergroup.campaign_health.enums;

public enum HealthClass {
    CRITICAL,
    WARNING,
    GOOD
}
