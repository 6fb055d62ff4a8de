package com.premiergroup.campaign_health.service;

import com.premiergroup.campaign_health.dto.DailyMetric;

import java.time.LocalDate;
import java.util.List;

/**
 * Where daily campaign metrics come from. Implementations return one entry per
 * day, ascending by date, already aggregated at campaign level.
 */
public interface DailyMetricSource {

    List<DailyMetric> fetchDailyMetrics(Integer campaignId, LocalDate start, LocalDate end);
}
