package com.premiergroup.campaign_health.engine;

import com.premiergroup.campaign_health.config.AnalysisThresholds;
import com.premiergroup.campaign_health.dto.ActionRecommendation;
import com.premiergroup.campaign_health.dto.CampaignHealthReport;
import com.premiergroup.campaign_health.dto.CampaignSeries;
import com.premiergroup.campaign_health.dto.DailyMetric;
import com.premiergroup.campaign_health.dto.Diagnostics;
import com.premiergroup.campaign_health.dto.HealthBoard;
import com.premiergroup.campaign_health.dto.HealthScoreBreakdown;
import com.premiergroup.campaign_health.dto.Issue;
import com.premiergroup.campaign_health.dto.MetricBand;
import com.premiergroup.campaign_health.dto.MetricTag;
import com.premiergroup.campaign_health.dto.SeriesSplit;
import com.premiergroup.campaign_health.dto.TrendSnapshot;
import com.premiergroup.campaign_health.enums.HealthClass;
import com.premiergroup.campaign_health.enums.MetricType;
import com.premiergroup.campaign_health.exception.InsufficientDataException;
import lombok.extern.log4j.Log4j2;

import java.util.List;
import java.util.Map;

/**
 * Runs the whole pipeline for a campaign:
 * split, bands, tags, issues, health, decision.
 * <p>
 * Stateless and side-effect free, so one instance can analyse many campaigns
 * concurrently.
 */
@Log4j2
public class CampaignHealthEngine {

    private final SeriesSplitter seriesSplitter;
    private final BandCalculator bandCalculator;
    private final AnomalyTagger anomalyTagger;
    private final IssueDetector issueDetector;
    private final HealthScorer healthScorer;
    private final TrendCalculator trendCalculator;
    private final DecisionPolicy decisionPolicy;

    public CampaignHealthEngine(AnalysisThresholds thresholds) {
        this.seriesSplitter = new SeriesSplitter(thresholds);
        this.bandCalculator = new BandCalculator(thresholds);
        this.anomalyTagger = new AnomalyTagger(thresholds);
        this.issueDetector = new IssueDetector(thresholds);
        this.healthScorer = new HealthScorer(thresholds);
        this.trendCalculator = new TrendCalculator(thresholds);
        this.decisionPolicy = new DecisionPolicy(thresholds);
    }

    public CampaignHealthReport analyze(CampaignSeries series) {
        if (series == null) {
            throw new InsufficientDataException(null, "No campaign series supplied");
        }
        if (series.isEmpty()) {
            throw new InsufficientDataException(series.campaignId(),
                    "Campaign " + series.campaignId() + " has no daily metrics to analyse");
        }

        List<DailyMetric> metrics = series.dailyMetrics();
        SeriesSplit split = seriesSplitter.split(metrics, series.createdDate());
        Map<MetricType, MetricBand> bands = bandCalculator.calculate(split);
        List<MetricTag> tags = anomalyTagger.tag(split, metrics, bands);
        List<Issue> issues = issueDetector.detect(series, tags);
        HealthScoreBreakdown health = healthScorer.score(series);
        TrendSnapshot trend = trendCalculator.calculate(series);
        DecisionPolicy.Verdict verdict = decisionPolicy.decide(series, health);

        Diagnostics diagnostics = Diagnostics.of(
                new Diagnostics.InputSnapshot(
                        series.campaignId(),
                        series.dayCount(),
                        metrics.get(0).date(),
                        series.latest().date(),
                        series.createdDate(),
                        series.totals()),
                new Diagnostics.ProcessingSnapshot(
                        split.lifeStage(),
                        split.history().size(),
                        split.window().size(),
                        split.window().isEmpty() ? null : split.window().get(0).date(),
                        List.copyOf(bands.values()),
                        health,
                        trend),
                new Diagnostics.OutputSnapshot(
                        verdict.action(),
                        verdict.rule(),
                        tags,
                        issues.stream().map(Issue::type).toList()));

        ActionRecommendation recommendation = new ActionRecommendation(
                verdict.action(),
                verdict.reason(),
                health.total(),
                trend.summary(),
                health.windowAlert(),
                tags,
                split.lifeStage(),
                health,
                diagnostics);

        log.debug("Campaign {} analysed: stage={}, health={}, action={}, issues={}",
                series.campaignId(), split.lifeStage(), health.total(), verdict.action(), issues.size());

        return new CampaignHealthReport(
                series.campaignId(),
                series.name(),
                issues,
                recommendation,
                verdict.action().toHealthClass());
    }

    /**
     * Analyses every campaign independently and buckets the reports. Campaigns
     * without any daily metric are skipped. Bucket order follows input order.
     */
    public HealthBoard analyzeAll(List<CampaignSeries> campaigns) {
        List<CampaignSeries> analysable = campaigns.stream()
                .filter(c -> c != null && !c.isEmpty())
                .toList();

        List<CampaignHealthReport> reports = analysable.parallelStream()
                .map(this::analyze)
                .toList();

        List<CampaignHealthReport> critical = filter(reports, HealthClass.CRITICAL);
        List<CampaignHealthReport> warning = filter(reports, HealthClass.WARNING);
        List<CampaignHealthReport> good = filter(reports, HealthClass.GOOD);

        double totalSpend = analysable.stream().mapToDouble(c -> c.totals().spend()).sum();
        double totalRevenue = analysable.stream().mapToDouble(c -> c.totals().revenue()).sum();

        log.info("Health board built: total={}, critical={}, warning={}, good={}",
                reports.size(), critical.size(), warning.size(), good.size());

        return new HealthBoard(critical, warning, good, new HealthBoard.Summary(
                reports.size(), critical.size(), warning.size(), good.size(), totalSpend, totalRevenue));
    }

    private static List<CampaignHealthReport> filter(List<CampaignHealthReport> reports, HealthClass healthClass) {
        return reports.stream()
                .filter(r -> r.classification() == healthClass)
                .toList();
    }
}
