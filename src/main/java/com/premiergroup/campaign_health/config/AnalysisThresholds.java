package com.premiergroup.campaign_health.config;

import com.premiergroup.campaign_health.enums.LifeStage;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Every numeric cut-off the health engine uses. Amounts are in the advertiser's
 * settlement currency, CTR values are percentages.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisThresholds {

    // series split & life stage
    @Builder.Default
    private int windowDays = 7;
    @Builder.Default
    private int learningMaxDays = 3;
    @Builder.Default
    private int earlyMaxDays = 7;
    @Builder.Default
    private int matureMaxDays = 21;

    // bands
    @Builder.Default
    private int minBandSamples = 3;
    @Builder.Default
    private double zScoreClamp = 3.0;

    // anomaly tagging
    @Builder.Default
    private double matureWarningZ = 1.0;
    @Builder.Default
    private double matureCriticalZ = 2.0;
    @Builder.Default
    private double veteranWarningZ = 1.0;
    @Builder.Default
    private double veteranCriticalZ = 2.0;
    @Builder.Default
    private double goodDirectionInfoZ = 1.5;
    @Builder.Default
    private double benchmarkCtrFloor = 0.5;
    @Builder.Default
    private double benchmarkCppCeiling = 150_000;
    @Builder.Default
    private double benchmarkRoasFloor = 0.5;

    // absolute issue checks
    @Builder.Default
    private double burnSpendFloor = 500_000;
    @Builder.Default
    private double breakevenRoas = 1.0;
    @Builder.Default
    private double frequencyCritical = 3.0;
    @Builder.Default
    private double frequencyWarning = 2.5;
    @Builder.Default
    private double frequencyInfo = 2.0;
    @Builder.Default
    private double goodCtr = 1.5;
    @Builder.Default
    private double clicksNoSalesMinSpend = 200_000;
    @Builder.Default
    private int spikeMinDays = 7;
    @Builder.Default
    private double cpmSpikePercent = 30;
    @Builder.Default
    private double spendSpikePercent = 200;

    // health score
    @Builder.Default
    private int minHealthDays = 3;
    @Builder.Default
    private int trailingDays = 3;
    @Builder.Default
    private double zeroPurchaseTrailingSpend = 200_000;
    @Builder.Default
    private double cppCapRatio = 1.5;
    @Builder.Default
    private double cppSevereCapRatio = 2.0;
    @Builder.Default
    private double financialWeight = 0.30;
    @Builder.Default
    private double trendWeight = 0.30;
    @Builder.Default
    private double creativeWeight = 0.25;
    @Builder.Default
    private double stabilityWeight = 0.15;

    // decision policy
    @Builder.Default
    private double lossRoas = 2.0;
    @Builder.Default
    private double minAnalysisSpend = 500_000;
    @Builder.Default
    private double zeroPurchaseStopSpend = 1_000_000;
    @Builder.Default
    private int scaleHealth = 75;
    @Builder.Default
    private double scaleRoas = 4.0;
    @Builder.Default
    private int goodHealth = 60;
    @Builder.Default
    private double goodRoas = 2.5;
    @Builder.Default
    private int adjustHealth = 35;
    @Builder.Default
    private int minTrustedPurchases = 5;
    @Builder.Default
    private double trendVariancePercent = 20;

    public static AnalysisThresholds defaults() {
        return AnalysisThresholds.builder().build();
    }

    public LifeStage lifeStageForAge(long ageDays) {
        if (ageDays <= learningMaxDays) return LifeStage.LEARNING;
        if (ageDays <= earlyMaxDays) return LifeStage.EARLY;
        if (ageDays <= matureMaxDays) return LifeStage.MATURE;
        return LifeStage.VETERAN;
    }

    public double warningZ(LifeStage stage) {
        return stage == LifeStage.VETERAN ? veteranWarningZ : matureWarningZ;
    }

    public double criticalZ(LifeStage stage) {
        return stage == LifeStage.VETERAN ? veteranCriticalZ : matureCriticalZ;
    }
}
