package org.carball.compadvisor.analysis;

import lombok.extern.slf4j.Slf4j;
import org.carball.compadvisor.config.AdvisorSettings;
import org.carball.compadvisor.engine.DatabaseEngine;
import org.carball.compadvisor.engine.EngineException;
import org.carball.compadvisor.estimator.CompressionRatioEstimator;
import org.carball.compadvisor.estimator.EstimationResult;
import org.carball.compadvisor.model.Encoding;
import org.carball.compadvisor.model.ObjectMetrics;
import org.carball.compadvisor.model.ObjectRef;
import org.carball.compadvisor.model.ObjectType;
import org.carball.compadvisor.model.PartitionMetrics;
import org.carball.compadvisor.model.Recommendation;
import org.carball.compadvisor.model.RecommendationPriority;
import org.carball.compadvisor.rules.EvaluationInput;
import org.carball.compadvisor.rules.RuleDecision;
import org.carball.compadvisor.rules.StrategyRuleEngine;
import org.carball.compadvisor.scoring.ActivityScore;
import org.carball.compadvisor.scoring.ActivityScorer;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Produces the recommendations for one catalog object: one for a plain table, index or LOB
 * column, one per partition for a partitioned table.
 */
@Slf4j
public class ObjectAnalyzer {

    private final DatabaseEngine engine;
    private final ActivityScorer scorer;
    private final CompressionRatioEstimator estimator;
    private final StrategyRuleEngine ruleEngine;
    private final AdvisorSettings settings;

    public ObjectAnalyzer(DatabaseEngine engine, ActivityScorer scorer, CompressionRatioEstimator estimator,
                          StrategyRuleEngine ruleEngine, AdvisorSettings settings) {
        this.engine = engine;
        this.scorer = scorer;
        this.estimator = estimator;
        this.ruleEngine = ruleEngine;
        this.settings = settings;
    }

    public List<Recommendation> analyze(ObjectRef ref, long catalogSizeBytes, int strategyId, long runId) {
        ObjectMetrics metrics;
        try {
            Optional<ObjectMetrics> found = engine.getObjectMetrics(ref);
            if (found.isEmpty()) {
                log.info("{} disappeared before it could be analyzed; skipping", ref);
                return List.of();
            }
            metrics = found.get();
        } catch (EngineException e) {
            log.warn("Could not read metrics for {}: {}", ref, e.getMessage());
            return List.of(failed(ref, catalogSizeBytes, strategyId, runId, "metrics unavailable: " + e.getMessage()));
        }

        if (ref.objectType() == ObjectType.TABLE && metrics.isPartitioned()) {
            return analyzePartitions(metrics, strategyId, runId);
        }
        return List.of(analyzeSingle(ref, metrics, strategyId, runId));
    }

    private List<Recommendation> analyzePartitions(ObjectMetrics table, int strategyId, long runId) {
        ObjectRef tableRef = table.getRef();
        List<Recommendation> results = new ArrayList<>();
        for (PartitionMetrics partition : table.getPartitions()) {
            if (partition.sizeBytes() < settings.getMinTableSizeBytes()) {
                log.debug("Skipping partition {} of {}: below minimum size", partition.partitionName(), tableRef);
                continue;
            }
            ObjectRef partitionRef = ObjectRef.partition(tableRef.owner(), tableRef.objectName(), partition.partitionName());
            results.add(analyzeSingle(partitionRef, partitionMetrics(partitionRef, partition, table), strategyId, runId));
        }
        log.debug("Analyzed {} partitions of {}", results.size(), tableRef);
        return results;
    }

    private ObjectMetrics partitionMetrics(ObjectRef partitionRef, PartitionMetrics partition, ObjectMetrics table) {
        try {
            Optional<ObjectMetrics> own = engine.getObjectMetrics(partitionRef);
            if (own.isPresent()) {
                return own.get();
            }
        } catch (EngineException e) {
            log.warn("Could not read metrics for {}; using table level figures: {}", partitionRef, e.getMessage());
        }
        return ObjectMetrics.builder()
                .ref(partitionRef)
                .sizeBytes(partition.sizeBytes())
                .currentEncoding(partition.currentEncoding())
                .storageArea(partition.storageArea())
                .readCounters(table.getReadCounters())
                .build();
    }

    Recommendation analyzeSingle(ObjectRef ref, ObjectMetrics metrics, int strategyId, long runId) {
        ActivityScore hotness = ref.objectType() == ObjectType.TABLE
                ? scorer.scoreHotness(engine, ref, settings.getModificationWindow())
                : new ActivityScore(0, 0, true, false);
        ActivityScore access = scorer.scoreAccess(metrics);
        double writeRatio = ActivityScorer.writeRatio(hotness.activity(), access.activity());

        EstimationResult estimation = estimator.estimate(ref);

        RuleDecision decision = ruleEngine.evaluate(strategyId, EvaluationInput.builder()
                .objectType(ref.objectType())
                .sizeBytes(metrics.getSizeBytes())
                .hotness(hotness.score())
                .access(access.score())
                .writeRatio(writeRatio)
                .ratio(estimation.bestRatio())
                .monitored(hotness.monitored())
                .partitionName(ref.partitionName())
                .build());

        Encoding encoding = decision.encoding();
        long size = metrics.getSizeBytes();
        double ratio = encoding == Encoding.NONE ? estimation.bestRatio() : estimation.ratioFor(encoding);
        String rationale = decision.rationale();
        if (encoding != Encoding.NONE && !estimation.isTested(encoding)) {
            log.info("{}: {} chosen by the strategy could not be estimated; no savings projected", ref, encoding);
            rationale = rationale + " " + encoding + " could not be estimated on this object; no savings projected.";
        }

        long projected = size;
        if (encoding != Encoding.NONE && encoding != metrics.getCurrentEncoding() && ratio > 1.0) {
            projected = Math.round(size / ratio);
        }
        long savings = size - projected;
        double savingsPct = size > 0 ? round2(savings * 100.0 / size) : 0;

        log.debug("{}: hotness {}, access {}, best {} at {}:1, decision {}", ref, hotness.score(), access.score(),
                estimation.bestEncoding(), estimation.bestRatio(), encoding);

        return Recommendation.builder()
                .runId(runId)
                .strategyId(strategyId)
                .ref(ref)
                .storageArea(metrics.getStorageArea())
                .sizeBytes(size)
                .currentEncoding(metrics.getCurrentEncoding())
                .candidateRatios(estimation.ratios())
                .recommendedEncoding(encoding)
                .compressionRatio(round2(ratio))
                .hotnessScore(hotness.score())
                .accessScore(access.score())
                .writeRatio(writeRatio)
                .rationale(rationale)
                .projectedSizeBytes(projected)
                .projectedSavingsBytes(savings)
                .savingsPct(savingsPct)
                .priority(RecommendationPriority.fromSavingsPct(savingsPct))
                .analysisFailed(false)
                .createdAt(Instant.now())
                .build();
    }

    /**
     * Placeholder for an object that could not be analyzed: scores 0, ratio 1.0, no change. The
     * current encoding was never read and stays null.
     */
    static Recommendation failed(ObjectRef ref, long sizeBytes, int strategyId, long runId, String reason) {
        return Recommendation.builder()
                .runId(runId)
                .strategyId(strategyId)
                .ref(ref)
                .sizeBytes(sizeBytes)
                .candidateRatios(Map.of())
                .recommendedEncoding(Encoding.NONE)
                .compressionRatio(1.0)
                .rationale("Analysis failed: " + reason)
                .projectedSizeBytes(sizeBytes)
                .projectedSavingsBytes(0)
                .savingsPct(0)
                .priority(RecommendationPriority.LOW)
                .analysisFailed(true)
                .createdAt(Instant.now())
                .build();
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
