package com.premiergroup.campaign_health.service;

import com.premiergroup.campaign_health.config.AnalysisThresholds;
import com.premiergroup.campaign_health.dto.AnalyzeSeriesRequest;
import com.premiergroup.campaign_health.dto.CampaignHealthReport;
import com.premiergroup.campaign_health.dto.HealthBoard;
import com.premiergroup.campaign_health.engine.CampaignHealthEngine;
import com.premiergroup.campaign_health.entity.Campaign;
import com.premiergroup.campaign_health.enums.ActionType;
import com.premiergroup.campaign_health.enums.DateFilter;
import com.premiergroup.campaign_health.enums.LifeStage;
import com.premiergroup.campaign_health.exception.CampaignNotFoundException;
import com.premiergroup.campaign_health.exception.InsufficientDataException;
import com.premiergroup.campaign_health.repository.CampaignRepository;
import com.premiergroup.campaign_health.repository.MarketingChannelRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static com.premiergroup.campaign_health.MetricSeriesFixtures.START;
import static com.premiergroup.campaign_health.MetricSeriesFixtures.risingCppSeries;
import static com.premiergroup.campaign_health.MetricSeriesFixtures.steady;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CampaignHealthServiceTest {

    private static final LocalDate TODAY = LocalDate.of(2026, 3, 20);

    @Mock
    private DailyMetricSource dailyMetricSource;

    @Mock
    private CampaignRepository campaignRepository;

    @Mock
    private MarketingChannelRepository marketingChannelRepository;

    private CampaignHealthService campaignHealthService;

    private Campaign testCampaign;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(TODAY.atStartOfDay().toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
        campaignHealthService = new CampaignHealthService(
                new CampaignHealthEngine(AnalysisThresholds.defaults()),
                dailyMetricSource,
                campaignRepository,
                marketingChannelRepository,
                clock);

        testCampaign = Campaign.builder()
                .id(7)
                .campaignId("120210000000007")
                .name("Spring sale")
                .status("ACTIVE")
                .createdTime(LocalDateTime.of(2026, 1, 10, 9, 30))
                .dailyBudget(new BigDecimal("500000"))
                .build();
    }

    @Test
    void analyzeCampaign_ShouldAnalyseTheRequestedRange() {
        // Given
        when(campaignRepository.findById(7)).thenReturn(Optional.of(testCampaign));
        when(dailyMetricSource.fetchDailyMetrics(7, TODAY.minusDays(7), TODAY.minusDays(1)))
                .thenReturn(risingCppSeries().dailyMetrics());

        // When
        CampaignHealthReport report = campaignHealthService.analyzeCampaign(7, DateFilter.LAST_7_DAYS, null, null);

        // Then
        assertThat(report.campaignId()).isEqualTo("7");
        assertThat(report.campaignName()).isEqualTo("Spring sale");
        // created in January: old enough to be a veteran
        assertThat(report.recommendation().lifeStage()).isEqualTo(LifeStage.VETERAN);
        assertThat(report.recommendation().diagnostics().input().createdDate()).isEqualTo(LocalDate.of(2026, 1, 10));
        verify(dailyMetricSource).fetchDailyMetrics(7, TODAY.minusDays(7), TODAY.minusDays(1));
    }

    @Test
    void analyzeCampaign_ShouldThrowWhenCampaignIsUnknown() {
        // Given
        when(campaignRepository.findById(99)).thenReturn(Optional.empty());

        // When & Then
        assertThatThrownBy(() -> campaignHealthService.analyzeCampaign(99, DateFilter.LAST_7_DAYS, null, null))
                .isInstanceOf(CampaignNotFoundException.class);
        verifyNoInteractions(dailyMetricSource);
    }

    @Test
    void analyzeCampaign_ShouldThrowWhenRangeHasNoMetrics() {
        // Given
        when(campaignRepository.findById(7)).thenReturn(Optional.of(testCampaign));
        when(dailyMetricSource.fetchDailyMetrics(eq(7), any(), any())).thenReturn(List.of());

        // When & Then
        assertThatThrownBy(() -> campaignHealthService.analyzeCampaign(7, DateFilter.LAST_30_DAYS, null, null))
                .isInstanceOf(InsufficientDataException.class)
                .hasMessageContaining("No metrics for campaign 7");
    }

    @Test
    void buildBoard_ShouldSkipCampaignsWithoutSpend() {
        // Given
        Campaign idle = Campaign.builder().id(8).name("Idle").status("ACTIVE").build();
        when(marketingChannelRepository.existsById(1)).thenReturn(true);
        when(campaignRepository.findByMarketingChannel_IdAndStatusIn(eq(1), anyList()))
                .thenReturn(List.of(testCampaign, idle));
        when(dailyMetricSource.fetchDailyMetrics(eq(7), any(), any()))
                .thenReturn(steady(0, 10, 500_000, 10, 2_500_000));
        when(dailyMetricSource.fetchDailyMetrics(eq(8), any(), any()))
                .thenReturn(steady(0, 10, 0, 0, 0));

        // When
        HealthBoard board = campaignHealthService.buildBoard(1, DateFilter.LAST_14_DAYS, null, null);

        // Then
        assertThat(board.summary().total()).isEqualTo(1);
        assertThat(board.good()).singleElement()
                .satisfies(r -> assertThat(r.recommendation().action()).isEqualTo(ActionType.SCALE));
    }

    @Test
    void buildBoard_ShouldRejectUnknownChannel() {
        // Given
        when(marketingChannelRepository.existsById(5)).thenReturn(false);

        // When & Then
        assertThatThrownBy(() -> campaignHealthService.buildBoard(5, null, null, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown marketing channel");
        verifyNoInteractions(campaignRepository);
    }

    @Test
    void analyzeSeries_ShouldAnalysePostedRows() {
        // Given
        AnalyzeSeriesRequest request = new AnalyzeSeriesRequest("ext-1", "Posted", "ACTIVE", null, null, List.of(
                new AnalyzeSeriesRequest.DailyRow(START, 200_000, 100_000, 1_500, 2, 100_000, null),
                new AnalyzeSeriesRequest.DailyRow(START.plusDays(1), 200_000, 100_000, 1_500, 2, 100_000, null),
                new AnalyzeSeriesRequest.DailyRow(START.plusDays(2), 200_000, 100_000, 1_500, 2, 100_000, null)));

        // When
        CampaignHealthReport report = campaignHealthService.analyzeSeries(request);

        // Then
        assertThat(report.campaignId()).isEqualTo("ext-1");
        assertThat(report.recommendation().action()).isEqualTo(ActionType.STOP);
        verifyNoInteractions(dailyMetricSource, campaignRepository);
    }

    @Test
    void analyzeSeries_ShouldRejectUnorderedRows() {
        // Given
        AnalyzeSeriesRequest request = new AnalyzeSeriesRequest("ext-2", null, null, null, null, List.of(
                new AnalyzeSeriesRequest.DailyRow(START.plusDays(1), 100, 10, 1, 0, 0, null),
                new AnalyzeSeriesRequest.DailyRow(START, 100, 10, 1, 0, 0, null)));

        // When & Then
        assertThatThrownBy(() -> campaignHealthService.analyzeSeries(request))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("strictly ascending");
    }

    @Test
    void resolve_ShouldDefaultToLastThirtyDays() {
        CampaignHealthService.DateWindow window = campaignHealthService.resolve(null, null, null);

        assertThat(window.start()).isEqualTo(LocalDate.of(2026, 2, 18));
        assertThat(window.end()).isEqualTo(LocalDate.of(2026, 3, 19));
    }

    @Test
    void resolve_ShouldParseCustomRange() {
        CampaignHealthService.DateWindow window =
                campaignHealthService.resolve(DateFilter.CUSTOM, "2026-02-01", "2026-02-28");

        assertThat(window.start()).isEqualTo(LocalDate.of(2026, 2, 1));
        assertThat(window.end()).isEqualTo(LocalDate.of(2026, 2, 28));
    }

    @Test
    void resolve_ShouldRejectBadCustomRanges() {
        assertThatThrownBy(() -> campaignHealthService.resolve(DateFilter.CUSTOM, "yesterday", "2026-02-28"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Invalid date format for custom date range");
        assertThatThrownBy(() -> campaignHealthService.resolve(DateFilter.CUSTOM, null, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> campaignHealthService.resolve(DateFilter.CUSTOM, "2026-03-01", "2026-02-01"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("before start date");
    }
}
