package com.premiergroup.campaign_health.enums;

public enum ActionType {
    STOP,
    ADJUST,
    WATCH,
    GOOD,
    SCALE;

    public HealthClass toHealthClass() {
        return switch (this) {
            case STOP -> HealthClass.CRITICAL;
            case ADJUST, WATCH -> HealthClass.WARNING;
            case GOOD, SCALE -> HealthClass.GOOD;
        };
    }
}
