package com.premiergroup.campaign_health.controller;

import com.premiergroup.campaign_health.dto.AnalyzeSeriesRequest;
import com.premiergroup.campaign_health.dto.CampaignHealthReport;
import com.premiergroup.campaign_health.dto.HealthBoard;
import com.premiergroup.campaign_health.enums.DateFilter;
import com.premiergroup.campaign_health.service.CampaignHealthService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Positive;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/health")
@RequiredArgsConstructor
@Validated
public class CampaignHealthController {

    private final CampaignHealthService campaignHealthService;

    /**
     * Health report for one stored campaign.
     * <p>
     * Example: GET api/health/campaigns/12?dateRange=LAST_30_DAYS
     */
    @GetMapping("/campaigns/{campaignId}")
    public ResponseEntity<CampaignHealthReport> getCampaignHealth(
            @PathVariable @Positive(message = "campaignId must be positive") Integer campaignId,
            @RequestParam(defaultValue = "LAST_30_DAYS") DateFilter dateRange,
            @RequestParam(required = false) String startDate,
            @RequestParam(required = false) String endDate
    ) {
        return ResponseEntity.ok(campaignHealthService.analyzeCampaign(campaignId, dateRange, startDate, endDate));
    }

    /**
     * Daily action board for every running campaign of a marketing channel.
     */
    @GetMapping("/board")
    public ResponseEntity<HealthBoard> getHealthBoard(
            @RequestParam @Positive(message = "marketingChannelId must be positive") Integer marketingChannelId,
            @RequestParam(defaultValue = "LAST_30_DAYS") DateFilter dateRange,
            @RequestParam(required = false) String startDate,
            @RequestParam(required = false) String endDate
    ) {
        HealthBoard board = campaignHealthService.buildBoard(marketingChannelId, dateRange, startDate, endDate);
        if (board.isEmpty()) {
            return ResponseEntity.noContent().build();
        }
        return ResponseEntity.ok(board);
    }

    @PostMapping("/analyze")
    public ResponseEntity<CampaignHealthReport> analyzeSeries(@Valid @RequestBody AnalyzeSeriesRequest request) {
        return ResponseEntity.ok(campaignHealthService.analyzeSeries(request));
    }
}
