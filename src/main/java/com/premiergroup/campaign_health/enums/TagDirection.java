package com.premiergroup.campaign_health.enums;

public enum TagDirection {
    UP,
    DOWN
}
