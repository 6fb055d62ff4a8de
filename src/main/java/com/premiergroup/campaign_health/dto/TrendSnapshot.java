package com.premiergroup.campaign_health.dto;

import com.premiergroup.campaign_health.enums.TrendDirection;

/**
 * Trailing days against lifetime. Change percentages are null when either side has no signal.
 */
public record TrendSnapshot(
        boolean hasEnoughData,
        Double recentCpp,
        Double lifetimeCpp,
        Double cppChangePercent,
        Double recentRoas,
        Double lifetimeRoas,
        Double roasChangePercent,
        TrendDirection direction,
        String summary
) {
}
