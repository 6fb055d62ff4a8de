package com.premiergroup.campaign_health.repository;

import com.premiergroup.campaign_health.entity.CampaignMetric;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.LocalDate;
import java.util.List;

public interface CampaignMetricRepository extends JpaRepository<CampaignMetric, Integer> {

    List<CampaignMetric> findByCampaign_IdAndStatsDateBetweenOrderByStatsDateAsc(
            Integer campaignId,
            LocalDate start,
            LocalDate end
    );
}
