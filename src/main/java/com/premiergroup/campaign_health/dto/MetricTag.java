package com.premiergroup.campaign_health.dto;

import com.premiergroup.campaign_health.enums.MetricType;
import com.premiergroup.campaign_health.enums.Severity;
import com.premiergroup.campaign_health.enums.TagDirection;

/**
 * @param zScore signed z-score of the band the tag came from, 0 for benchmark tags
 * @param benchmark true when the tag comes from a fixed benchmark rather than the campaign's own history
 */
public record MetricTag(
        MetricType metric,
        TagDirection direction,
        Severity severity,
        String label,
        String detail,
        double zScore,
        boolean benchmark
) {

    public boolean isBadDirection() {
        return direction == metric.badDirection();
    }
}
