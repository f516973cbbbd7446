package org.carball.compadvisor.analysis;

import lombok.extern.slf4j.Slf4j;
import org.carball.compadvisor.config.AdvisorSettings;
import org.carball.compadvisor.ddl.DdlGenerator;
import org.carball.compadvisor.engine.DatabaseEngine;
import org.carball.compadvisor.estimator.CompressionRatioEstimator;
import org.carball.compadvisor.execution.ExecutionOptions;
import org.carball.compadvisor.execution.ExecutionPipeline;
import org.carball.compadvisor.model.AnalysisRun;
import org.carball.compadvisor.model.BatchSummary;
import org.carball.compadvisor.model.ExecutionRecord;
import org.carball.compadvisor.model.ExecutionStatus;
import org.carball.compadvisor.model.Recommendation;
import org.carball.compadvisor.model.Strategy;
import org.carball.compadvisor.repository.AnalysisRunRepository;
import org.carball.compadvisor.repository.ExecutionRecordRepository;
import org.carball.compadvisor.repository.InMemoryAnalysisRunRepository;
import org.carball.compadvisor.repository.InMemoryExecutionRecordRepository;
import org.carball.compadvisor.repository.InMemoryRecommendationRepository;
import org.carball.compadvisor.repository.RecommendationFilter;
import org.carball.compadvisor.repository.RecommendationRepository;
import org.carball.compadvisor.repository.StateStore;
import org.carball.compadvisor.rules.RuleCache;
import org.carball.compadvisor.rules.StrategyRuleEngine;
import org.carball.compadvisor.scoring.ActivityScorer;

import java.io.IOException;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Entry point for callers: analysis, recommendation listings, DDL, execution and history.
 */
@Slf4j
public class CompressionAdvisor implements AutoCloseable {

    public static final String NOT_FOUND = "NOT_FOUND";

    private final AdvisorSettings settings;
    private final RuleCache ruleCache;
    private final AnalysisRunRepository runs;
    private final RecommendationRepository recommendations;
    private final ExecutionRecordRepository executions;
    private final DdlGenerator ddlGenerator;
    private final AnalysisCoordinator coordinator;
    private final ExecutionPipeline pipeline;

    public CompressionAdvisor(DatabaseEngine engine, AdvisorSettings settings, RuleCache ruleCache) {
        this(engine, settings, ruleCache, new InMemoryAnalysisRunRepository(),
                new InMemoryRecommendationRepository(), new InMemoryExecutionRecordRepository());
    }

    public CompressionAdvisor(DatabaseEngine engine,
                              AdvisorSettings settings,
                              RuleCache ruleCache,
                              AnalysisRunRepository runs,
                              RecommendationRepository recommendations,
                              ExecutionRecordRepository executions) {
        this.settings = settings;
        this.ruleCache = ruleCache;
        this.runs = runs;
        this.recommendations = recommendations;
        this.executions = executions;
        this.ddlGenerator = new DdlGenerator();

        ObjectAnalyzer analyzer = new ObjectAnalyzer(engine,
                new ActivityScorer(settings.getHotnessCap(), settings.getAccessCap()),
                new CompressionRatioEstimator(engine, settings.getSampleSize()),
                new StrategyRuleEngine(ruleCache),
                settings);
        this.coordinator = new AnalysisCoordinator(engine, analyzer, ruleCache, runs, recommendations, settings);
        this.pipeline = new ExecutionPipeline(engine, recommendations, executions, ddlGenerator, settings);
    }

    /**
     * Analyzes every object in scope and returns the id of the new run.
     *
     * @param scope owner to analyze, or null for every non-system schema
     */
    public long startAnalysis(String scope, int strategyId, int parallelism) throws AnalysisAbortedException {
        return coordinator.analyze(scope, strategyId, parallelism).getRunId();
    }

    public AnalysisRun getRun(long runId) {
        return runs.findById(runId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown analysis run: " + runId));
    }

    public List<AnalysisRun> getRuns() {
        return runs.findAll();
    }

    /**
     * Actionable recommendations from the latest analysis of each object, largest savings first.
     */
    public List<Recommendation> getRecommendations(Integer strategyId, Double minSavingsPct) {
        return recommendations.query(RecommendationFilter.builder()
                .strategyId(strategyId)
                .minSavingsPct(minSavingsPct)
                .build());
    }

    public List<Recommendation> getRecommendations(RecommendationFilter filter) {
        return recommendations.query(filter);
    }

    public long totalProjectedSavings(Integer strategyId) {
        return recommendations.totalProjectedSavings(RecommendationFilter.builder().strategyId(strategyId).build());
    }

    /**
     * DDL for one recommendation, or for every actionable recommendation when {@code recommendationId} is null.
     */
    public List<String> generateDdl(Long recommendationId, boolean online) {
        if (recommendationId != null) {
            Recommendation recommendation = recommendations.findById(recommendationId)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown recommendation: " + recommendationId));
            return List.of(ddlGenerator.generate(recommendation, online));
        }
        return ddlGenerator.generateAll(recommendations.query(RecommendationFilter.actionable()), online);
    }

    public ExecutionRecord execute(long recommendationId, boolean dryRun, boolean online) {
        return pipeline.execute(recommendationId, ExecutionOptions.builder().dryRun(dryRun).online(online).build());
    }

    public ExecutionRecord execute(long recommendationId, ExecutionOptions options) {
        return pipeline.execute(recommendationId, options);
    }

    public BatchSummary batchExecute(int strategyId, int maxObjects, long maxTotalSizeBytes, boolean online, boolean dryRun) {
        return pipeline.batchExecute(strategyId, maxObjects, maxTotalSizeBytes,
                ExecutionOptions.builder().dryRun(dryRun).online(online).build());
    }

    public ExecutionRecord revert(long executionId, boolean dryRun) {
        return pipeline.revert(executionId, ExecutionOptions.builder().dryRun(dryRun).build());
    }

    /**
     * Status name of an execution, or {@value #NOT_FOUND}.
     */
    public String getExecutionStatus(long executionId) {
        return pipeline.getExecutionStatus(executionId).map(Enum::name).orElse(NOT_FOUND);
    }

    public List<ExecutionRecord> getHistory(int daysBack, String owner, ExecutionStatus status) {
        return pipeline.getHistory(daysBack, owner, status);
    }

    /**
     * Removes recommendations older than {@code daysOld} days. Recommendations referenced by an
     * execution and those of each strategy's latest completed run are kept.
     */
    public int purgeRecommendations(int daysOld) {
        Instant cutoff = Instant.now().minus(Math.max(0, daysOld), ChronoUnit.DAYS);
        Set<Long> latestRuns = new HashSet<>();
        for (Strategy strategy : ruleCache.strategies()) {
            runs.latestCompleted(strategy.getId()).ifPresent(run -> latestRuns.add(run.getRunId()));
        }
        return recommendations.purgeOlderThan(cutoff, executions.referencedRecommendationIds(), latestRuns);
    }

    public List<Strategy> getStrategies() {
        return ruleCache.strategies();
    }

    public Strategy resolveStrategy(String idOrName) {
        return ruleCache.resolve(idOrName);
    }

    public AdvisorSettings getSettings() {
        return settings;
    }

    public void loadState(StateStore store) throws IOException {
        store.loadInto(runs, recommendations, executions);
    }

    public void saveState(StateStore store) throws IOException {
        store.save(runs, recommendations, executions);
    }

    @Override
    public void close() {
        pipeline.close();
    }
}
