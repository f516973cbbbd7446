package org.carball.compadvisor.analysis;

import lombok.extern.slf4j.Slf4j;
import org.carball.compadvisor.config.AdvisorSettings;
import org.carball.compadvisor.engine.DatabaseEngine;
import org.carball.compadvisor.engine.EngineException;
import org.carball.compadvisor.model.AnalysisRun;
import org.carball.compadvisor.model.CatalogObject;
import org.carball.compadvisor.model.ObjectType;
import org.carball.compadvisor.model.Recommendation;
import org.carball.compadvisor.model.RunStatus;
import org.carball.compadvisor.model.Strategy;
import org.carball.compadvisor.repository.AnalysisRunRepository;
import org.carball.compadvisor.repository.RecommendationRepository;
import org.carball.compadvisor.rules.RuleCache;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Runs one analysis: builds the scope from the engine's catalog and analyzes the objects on a
 * bounded worker pool, largest first. Each object is limited by the per-object timeout; an object
 * that times out or fails is recorded as failed-to-analyze instead of holding up the run.
 */
@Slf4j
public class AnalysisCoordinator {

    private final DatabaseEngine engine;
    private final ObjectAnalyzer analyzer;
    private final RuleCache ruleCache;
    private final AnalysisRunRepository runs;
    private final RecommendationRepository recommendations;
    private final AdvisorSettings settings;

    public AnalysisCoordinator(DatabaseEngine engine, ObjectAnalyzer analyzer, RuleCache ruleCache,
                               AnalysisRunRepository runs, RecommendationRepository recommendations,
                               AdvisorSettings settings) {
        this.engine = engine;
        this.analyzer = analyzer;
        this.ruleCache = ruleCache;
        this.runs = runs;
        this.recommendations = recommendations;
        this.settings = settings;
    }

    public AnalysisRun analyze(String scopeOwner, int strategyId, int parallelism) throws AnalysisAbortedException {
        Strategy strategy = ruleCache.strategy(strategyId);
        int workers = Math.max(1, parallelism);

        AnalysisRun run = runs.create(AnalysisRun.builder()
                .strategyId(strategyId)
                .strategyName(strategy.getName())
                .scopeOwner(scopeOwner)
                .parallelism(workers)
                .status(RunStatus.RUNNING)
                .startedAt(Instant.now())
                .build());
        log.info("Analysis run {} started: scope {}, strategy {}, {} worker(s)", run.getRunId(),
                scopeOwner == null ? "all schemas" : scopeOwner, strategy.getName(), workers);

        List<CatalogObject> scope;
        try {
            scope = buildScope(engine.listObjects(scopeOwner));
        } catch (EngineException e) {
            runs.finish(run.toBuilder()
                    .status(RunStatus.FAILED)
                    .finishedAt(Instant.now())
                    .errorDetail(e.getMessage())
                    .build());
            log.error("Analysis run {} aborted: {}", run.getRunId(), e.getMessage());
            throw new AnalysisAbortedException(run.getRunId(), "Analysis run " + run.getRunId()
                    + " aborted: cannot list objects: " + e.getMessage(), e);
        }
        log.info("Analyzing {} objects", scope.size());

        AtomicInteger analyzed = new AtomicInteger();
        AtomicInteger failed = new AtomicInteger();
        AtomicInteger created = new AtomicInteger();
        Duration timeout = settings.getObjectTimeout();

        ExecutorService workerPool = Executors.newFixedThreadPool(workers);
        ExecutorService analysisThreads = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "compadvisor-analysis");
            thread.setDaemon(true);
            return thread;
        });
        boolean interrupted = false;
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (CatalogObject object : scope) {
                futures.add(workerPool.submit(() -> {
                    List<Recommendation> results = analyzeBounded(object, strategyId, run.getRunId(),
                            timeout, analysisThreads);
                    for (Recommendation recommendation : results) {
                        recommendations.save(recommendation);
                        created.incrementAndGet();
                        if (recommendation.isAnalysisFailed()) {
                            failed.incrementAndGet();
                        }
                    }
                    analyzed.incrementAndGet();
                }));
            }
            for (Future<?> future : futures) {
                try {
                    future.get();
                } catch (ExecutionException e) {
                    log.error("Analysis worker failed: {}", e.getCause().getMessage(), e.getCause());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            interrupted = true;
        } finally {
            workerPool.shutdownNow();
            analysisThreads.shutdownNow();
        }

        AnalysisRun finished = runs.finish(run.toBuilder()
                .status(interrupted ? RunStatus.FAILED : RunStatus.COMPLETED)
                .finishedAt(Instant.now())
                .objectsAnalyzed(analyzed.get())
                .objectsFailed(failed.get())
                .recommendationsCreated(created.get())
                .errorDetail(interrupted ? "interrupted" : null)
                .build());

        log.info("Analysis run {} {}: {} objects, {} recommendations, {} failed to analyze",
                finished.getRunId(), finished.getStatus(), finished.getObjectsAnalyzed(),
                finished.getRecommendationsCreated(), finished.getObjectsFailed());
        return finished;
    }

    private List<Recommendation> analyzeBounded(CatalogObject object, int strategyId, long runId,
                                                Duration timeout, ExecutorService analysisThreads) {
        Future<List<Recommendation>> future = analysisThreads.submit(
                () -> analyzer.analyze(object.ref(), object.sizeBytes(), strategyId, runId));
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Analysis of {} timed out after {}s", object.ref(), timeout.toSeconds());
            return List.of(ObjectAnalyzer.failed(object.ref(), object.sizeBytes(), strategyId, runId,
                    "timed out after " + timeout.toSeconds() + "s"));
        } catch (ExecutionException e) {
            log.warn("Analysis of {} failed: {}", object.ref(), e.getCause().getMessage());
            return List.of(ObjectAnalyzer.failed(object.ref(), object.sizeBytes(), strategyId, runId,
                    String.valueOf(e.getCause().getMessage())));
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return List.of(ObjectAnalyzer.failed(object.ref(), object.sizeBytes(), strategyId, runId, "interrupted"));
        }
    }

    /**
     * Objects worth analyzing, largest first.
     */
    List<CatalogObject> buildScope(List<CatalogObject> catalog) {
        return catalog.stream()
                .filter(this::inScope)
                .sorted(Comparator.comparingLong(CatalogObject::sizeBytes).reversed()
                        .thenComparing(o -> o.ref().toString()))
                .collect(Collectors.toList());
    }

    private boolean inScope(CatalogObject object) {
        if (settings.isExcludedSchema(object.ref().owner())) {
            return false;
        }
        if (!object.compressible()) {
            log.info("Skipping {}: {} cannot be compressed", object.ref(),
                    object.detail() == null ? object.ref().objectType().getDisplayName() : object.detail());
            return false;
        }
        long minimum = object.ref().objectType() == ObjectType.TABLE
                ? settings.getMinTableSizeBytes()
                : settings.getMinSegmentSizeBytes();
        if (object.sizeBytes() < minimum) {
            log.debug("Skipping {}: {} bytes is below the minimum of {}", object.ref(), object.sizeBytes(), minimum);
            return false;
        }
        return true;
    }
}
