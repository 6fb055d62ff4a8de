package com.premiergroup.campaign_health.enums;

/**
 * Age bucket of a campaign. Controls how sensitive anomaly tagging is.
 */
public enum LifeStage {
    LEARNING,
    EARLY,
    MATURE,
    VETERAN;

    /**
     * LEARNING and EARLY campaigns do not have enough history for z-score tagging.
     */
    public boolean usesBenchmarks() {
        return this == LEARNING || this == EARLY;
    }
}
