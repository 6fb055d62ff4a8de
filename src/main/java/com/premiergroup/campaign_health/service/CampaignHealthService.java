package com.premiergroup.campaign_health.service;

import com.premiergroup.campaign_health.dto.AnalyzeSeriesRequest;
import com.premiergroup.campaign_health.dto.CampaignHealthReport;
import com.premiergroup.campaign_health.dto.CampaignSeries;
import com.premiergroup.campaign_health.dto.DailyMetric;
import com.premiergroup.campaign_health.dto.HealthBoard;
import com.premiergroup.campaign_health.engine.CampaignHealthEngine;
import com.premiergroup.campaign_health.entity.Campaign;
import com.premiergroup.campaign_health.enums.CampaignStatus;
import com.premiergroup.campaign_health.enums.DateFilter;
import com.premiergroup.campaign_health.exception.CampaignNotFoundException;
import com.premiergroup.campaign_health.exception.InsufficientDataException;
import com.premiergroup.campaign_health.repository.CampaignRepository;
import com.premiergroup.campaign_health.repository.MarketingChannelRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

@Service
@Log4j2
@RequiredArgsConstructor
public class CampaignHealthService {

    private final CampaignHealthEngine campaignHealthEngine;
    private final DailyMetricSource dailyMetricSource;
    private final CampaignRepository campaignRepository;
    private final MarketingChannelRepository marketingChannelRepository;
    private final Clock clock;

    @Transactional(readOnly = true)
    public CampaignHealthReport analyzeCampaign(
            Integer campaignId,
            DateFilter dateRange,
            String startDate,
            String endDate
    ) {
        DateWindow range = resolve(dateRange, startDate, endDate);
        Campaign campaign = campaignRepository.findById(campaignId)
                .orElseThrow(() -> new CampaignNotFoundException(campaignId));

        log.info("Analysing campaign {} ({}) from {} to {}", campaignId, campaign.getName(), range.start(), range.end());
        CampaignSeries series = loadSeries(campaign, range);
        if (series.isEmpty()) {
            log.warn("Campaign {} has no metrics between {} and {}", campaignId, range.start(), range.end());
            throw new InsufficientDataException(String.valueOf(campaignId),
                    "No metrics for campaign " + campaignId + " between " + range.start() + " and " + range.end());
        }
        return campaignHealthEngine.analyze(series);
    }

    @Transactional(readOnly = true)
    public HealthBoard buildBoard(
            Integer marketingChannelId,
            DateFilter dateRange,
            String startDate,
            String endDate
    ) {
        DateWindow range = resolve(dateRange, startDate, endDate);
        if (!marketingChannelRepository.existsById(marketingChannelId)) {
            throw new IllegalArgumentException("Unknown marketing channel: " + marketingChannelId);
        }

        List<Campaign> campaigns = campaignRepository
                .findByMarketingChannel_IdAndStatusIn(marketingChannelId, CampaignStatus.running());
        log.info("Building health board for channel {} with {} running campaigns", marketingChannelId, campaigns.size());

        // only campaigns that actually spent in the range
        List<CampaignSeries> series = campaigns.stream()
                .map(c -> loadSeries(c, range))
                .filter(s -> s.totals().spend() > 0)
                .toList();

        return campaignHealthEngine.analyzeAll(series);
    }

    public CampaignHealthReport analyzeSeries(AnalyzeSeriesRequest request) {
        log.info("Analysing posted series for campaign {} ({} days)", request.campaignId(), request.metrics().size());
        return campaignHealthEngine.analyze(request.toSeries());
    }

    private CampaignSeries loadSeries(Campaign campaign, DateWindow range) {
        List<DailyMetric> metrics = dailyMetricSource.fetchDailyMetrics(campaign.getId(), range.start(), range.end());
        return CampaignSeries.of(
                String.valueOf(campaign.getId()),
                campaign.getName(),
                campaign.getStatus(),
                metrics,
                campaign.getCreatedTime() != null ? campaign.getCreatedTime().toLocalDate() : null,
                campaign.getDailyBudget() != null ? campaign.getDailyBudget().doubleValue() : null);
    }

    DateWindow resolve(DateFilter dateRange, String startDate, String endDate) {
        DateFilter filter = Objects.requireNonNullElse(dateRange, DateFilter.LAST_30_DAYS);
        if (filter == DateFilter.CUSTOM) {
            LocalDate start;
            LocalDate end;
            try {
                start = LocalDate.parse(startDate);
                end = LocalDate.parse(endDate);
            } catch (Exception e) {
                log.error("Invalid date format for custom date range: {} to {}", startDate, endDate, e);
                throw new IllegalArgumentException("Invalid date format for custom date range");
            }
            if (end.isBefore(start)) {
                throw new IllegalArgumentException("End date " + end + " is before start date " + start);
            }
            return new DateWindow(start, end);
        }
        LocalDate today = LocalDate.now(clock);
        return new DateWindow(filter.getStartDate(today), filter.getEndDate(today));
    }

    record DateWindow(LocalDate start, LocalDate end) {
    }
}
