package com.premiergroup.campaign_health.dto;

import com.premiergroup.campaign_health.enums.IssueType;
import com.premiergroup.campaign_health.enums.Severity;

public record Issue(
        IssueType type,
        Severity severity,
        String message,
        String detail,
        String action
) {
}
