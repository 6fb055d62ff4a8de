package com.premiergroup.campaign_health.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.time.LocalDate;
import java.util.List;

/**
 * Body of an ad-hoc analysis: a campaign and the daily rows to analyse.
 */
public record AnalyzeSeriesRequest(
        @NotBlank String campaignId,
        String name,
        String status,
        LocalDate createdDate,
        Double dailyBudget,
        @NotEmpty List<@Valid DailyRow> metrics
) {

    public CampaignSeries toSeries() {
        List<DailyMetric> daily = metrics.stream()
                .map(DailyRow::toDailyMetric)
                .toList();
        return CampaignSeries.of(campaignId, name, status, daily, createdDate, dailyBudget);
    }

    public record DailyRow(
            @NotNull LocalDate date,
            @PositiveOrZero double spend,
            @PositiveOrZero long impressions,
            @PositiveOrZero long clicks,
            @PositiveOrZero int purchases,
            @PositiveOrZero double revenue,
            Double frequency
    ) {

        DailyMetric toDailyMetric() {
            return DailyMetric.of(date, spend, impressions, clicks, purchases, revenue, frequency);
        }
    }
}
