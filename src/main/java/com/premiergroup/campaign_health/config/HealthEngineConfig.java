package com.premiergroup.campaign_health.config;

import com.premiergroup.campaign_health.engine.CampaignHealthEngine;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration(proxyBeanMethods = false)
public class HealthEngineConfig {

    @Bean
    @ConfigurationProperties(prefix = "campaign-health.thresholds")
    public AnalysisThresholds analysisThresholds() {
        return AnalysisThresholds.defaults();
    }

    @Bean
    public CampaignHealthEngine campaignHealthEngine(AnalysisThresholds analysisThresholds) {
        return new CampaignHealthEngine(analysisThresholds);
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
