package com.premiergroup.campaign_health.exception;

/**
 * Raised only when there is nothing to analyse at all. Short or sparse series are
 * not errors, they produce neutral results.
 */
public class InsufficientDataException extends RuntimeException {

    private final String campaignId;

    public InsufficientDataException(String campaignId, String message) {
        super(message);
        this.campaignId = campaignId;
    }

    public String getCampaignId() {
        return campaignId;
    }
}
