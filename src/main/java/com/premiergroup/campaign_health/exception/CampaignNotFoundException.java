package com.premiergroup.campaign_health.exception;

public class CampaignNotFoundException extends RuntimeException {

    public CampaignNotFoundException(Integer campaignId) {
        super("Campaign not found: " + campaignId);
    }
}
