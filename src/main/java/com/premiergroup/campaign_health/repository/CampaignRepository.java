package com.premiergroup.campaign_health.repository;

import com.premiergroup.campaign_health.entity.Campaign;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface CampaignRepository extends JpaRepository<Campaign, Integer> {

    List<Campaign> findByMarketingChannel_IdAndStatusIn(
            Integer marketingChannelId,
            List<String> statuses
    );
}
