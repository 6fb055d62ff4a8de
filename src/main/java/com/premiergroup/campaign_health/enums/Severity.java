package com.premiergroup.campaign_health.enums;

public enum Severity {
    INFO,
    WARNING,
    CRITICAL
}
