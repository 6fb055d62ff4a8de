package com.premiergroup.campaign_health.dto;

import com.premiergroup.campaign_health.enums.ActionType;
import com.premiergroup.campaign_health.enums.IssueType;
import com.premiergroup.campaign_health.enums.LifeStage;

import java.time.LocalDate;
import java.util.List;

/**
 * Audit snapshot of every intermediate value of one analysis. Bump
 * {@link #SCHEMA_VERSION} whenever a field is added, renamed or removed.
 */
public record Diagnostics(
        int schemaVersion,
        InputSnapshot input,
        ProcessingSnapshot processing,
        OutputSnapshot output
) {

    public static final int SCHEMA_VERSION = 1;

    public static Diagnostics of(InputSnapshot input, ProcessingSnapshot processing, OutputSnapshot output) {
        return new Diagnostics(SCHEMA_VERSION, input, processing, output);
    }

    public record InputSnapshot(
            String campaignId,
            int dayCount,
            LocalDate firstDate,
            LocalDate lastDate,
            LocalDate createdDate,
            SeriesTotals totals
    ) {
    }

    public record ProcessingSnapshot(
            LifeStage lifeStage,
            int historyDays,
            int windowDays,
            LocalDate windowStart,
            List<MetricBand> bands,
            HealthScoreBreakdown health,
            TrendSnapshot trend
    ) {

        public ProcessingSnapshot {
            bands = List.copyOf(bands);
        }
    }

    /**
     * @param matchedRule name of the decision rule that fired
     */
    public record OutputSnapshot(
            ActionType action,
            String matchedRule,
            List<MetricTag> tags,
            List<IssueType> issueTypes
    ) {

        public OutputSnapshot {
            tags = List.copyOf(tags);
            issueTypes = List.copyOf(issueTypes);
        }
    }
}
