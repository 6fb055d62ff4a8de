package com.premiergroup.campaign_health.service;

import com.premiergroup.campaign_health.dto.DailyMetric;
import com.premiergroup.campaign_health.entity.CampaignMetric;
import com.premiergroup.campaign_health.repository.CampaignMetricRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Reads synced insight rows from the database. Several rows for the same day are
 * summed into one, the way the dashboards group by day.
 */
@Component
@Log4j2
@RequiredArgsConstructor
public class JpaDailyMetricSource implements DailyMetricSource {

    private final CampaignMetricRepository campaignMetricRepository;

    @Override
    public List<DailyMetric> fetchDailyMetrics(Integer campaignId, LocalDate start, LocalDate end) {
        List<CampaignMetric> rows = campaignMetricRepository
                .findByCampaign_IdAndStatsDateBetweenOrderByStatsDateAsc(campaignId, start, end);

        Map<LocalDate, DayTotals> byDay = new TreeMap<>();
        for (CampaignMetric row : rows) {
            byDay.computeIfAbsent(row.getStatsDate(), d -> new DayTotals()).add(row);
        }
        if (byDay.size() < rows.size()) {
            log.debug("Campaign {}: merged {} rows into {} days", campaignId, rows.size(), byDay.size());
        }

        return byDay.entrySet().stream()
                .map(e -> e.getValue().toDailyMetric(e.getKey()))
                .toList();
    }

    private static final class DayTotals {
        private BigDecimal spend = BigDecimal.ZERO;
        private BigDecimal revenue = BigDecimal.ZERO;
        private long impressions;
        private long clicks;
        private int purchases;
        private Double frequency;

        void add(CampaignMetric row) {
            spend = spend.add(orZero(row.getCost()));
            revenue = revenue.add(orZero(row.getRevenue()));
            impressions += row.getImpressions() != null ? row.getImpressions() : 0;
            clicks += row.getClicks() != null ? row.getClicks() : 0;
            purchases += row.getPurchases() != null ? row.getPurchases() : 0;
            if (row.getFrequency() != null) {
                // frequency does not add up across rows, keep the highest
                double f = row.getFrequency().doubleValue();
                frequency = frequency == null ? f : Math.max(frequency, f);
            }
        }

        DailyMetric toDailyMetric(LocalDate date) {
            return DailyMetric.of(date, spend.doubleValue(), impressions, clicks, purchases,
                    revenue.doubleValue(), frequency);
        }

        private static BigDecimal orZero(BigDecimal value) {
            return value != null ? value : BigDecimal.ZERO;
        }
    }
}
