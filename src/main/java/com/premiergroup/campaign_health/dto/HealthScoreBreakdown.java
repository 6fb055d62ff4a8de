package com.premiergroup.campaign_health.dto;

/**
 * Sub-scores and weighted total, each in [0, 100].
 *
 * @param measured false when the series was too short and every score is the neutral default
 * @param windowAlert sharpest recent-vs-lifetime divergence, empty when there is none
 */
public record HealthScoreBreakdown(
        int financial,
        int trend,
        int creative,
        int stability,
        int total,
        String windowAlert,
        boolean measured
) {

    public boolean hasWindowAlert() {
        return windowAlert != null && !windowAlert.isEmpty();
    }
}
