package com.premiergroup.campaign_health.enums;

public enum MetricType {
    CPP,
    CTR,
    ROAS,
    SPEND;

    /**
     * For CPP a rising value is bad, for CTR and ROAS a falling one is.
     */
    public TagDirection badDirection() {
        return switch (this) {
            case CPP, SPEND -> TagDirection.UP;
            case CTR, ROAS -> TagDirection.DOWN;
        };
    }

    public TagDirection directionOf(double zScore) {
        return zScore > 0 ? TagDirection.UP : TagDirection.DOWN;
    }
}
