package com.premiergroup.campaign_health.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum IssueType {
    BURNING_MONEY("burning_money"),
    LOSING_MONEY("losing_money"),
    HIGH_FREQUENCY("high_frequency"),
    CLICKS_NO_SALES("clicks_no_sales"),
    CPM_SPIKE("cpm_spike"),
    SPEND_SPIKE("spend_spike"),
    CPP_RISING("cpp_rising"),
    CTR_DECLINING("ctr_declining"),
    ROAS_DECLINING("roas_declining");

    private final String code;

    IssueType(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
