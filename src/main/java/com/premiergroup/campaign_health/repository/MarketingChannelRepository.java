package com.premiergroup.campaign_health.repository;

import com.premiergroup.campaign_health.entity.MarketingChannel;
import org.springframework.data.jpa.repository.JpaRepository;

public interface MarketingChannelRepository extends JpaRepository<MarketingChannel, Integer> {
}
