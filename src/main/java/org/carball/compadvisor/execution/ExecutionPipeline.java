package org.carball.compadvisor.execution;

import lombok.extern.slf4j.Slf4j;
import org.carball.compadvisor.config.AdvisorSettings;
import org.carball.compadvisor.ddl.DdlGenerator;
import org.carball.compadvisor.engine.DatabaseEngine;
import org.carball.compadvisor.engine.EngineException;
import org.carball.compadvisor.execution.PreconditionViolation.Reason;
import org.carball.compadvisor.model.BatchSummary;
import org.carball.compadvisor.model.Encoding;
import org.carball.compadvisor.model.ExecutionOperation;
import org.carball.compadvisor.model.ExecutionRecord;
import org.carball.compadvisor.model.ExecutionStatus;
import org.carball.compadvisor.model.ObjectMetrics;
import org.carball.compadvisor.model.ObjectRef;
import org.carball.compadvisor.model.ObjectType;
import org.carball.compadvisor.model.Recommendation;
import org.carball.compadvisor.repository.ExecutionRecordRepository;
import org.carball.compadvisor.repository.RecommendationFilter;
import org.carball.compadvisor.repository.RecommendationRepository;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Applies recommendations safely.
 * <p>
 * Each attempt moves through PENDING, PRECHECK, then DRY_RUN or APPLYING, and ends SUCCEEDED or
 * FAILED. At most one attempt per object is in flight at a time. A failed or timed-out statement
 * leaves the object in its previous encoding: if the object changed anyway, the previous encoding
 * is restored before the attempt is recorded as FAILED. A timed-out statement is cancelled and the
 * rollback check waits until the statement has actually stopped; if it does not stop within the
 * cancellation grace period, the attempt stays in flight (and keeps the object locked) until it does.
 */
@Slf4j
public class ExecutionPipeline implements AutoCloseable {

    /** HIGH priority first, ties broken by projected savings. */
    static final Comparator<Recommendation> BATCH_ORDER = Comparator
            .comparing(Recommendation::getPriority)
            .thenComparing(Comparator.comparingLong(Recommendation::getProjectedSavingsBytes).reversed())
            .thenComparing(Comparator.comparingDouble(Recommendation::getSavingsPct).reversed())
            .thenComparingLong(Recommendation::getId);

    private final DatabaseEngine engine;
    private final RecommendationRepository recommendations;
    private final ExecutionRecordRepository executions;
    private final DdlGenerator ddlGenerator;
    private final PrecheckValidator precheck;
    private final AdvisorSettings settings;
    private final ExecutorService statementRunner;
    private final Set<CompletableFuture<Void>> abandonedStatements = ConcurrentHashMap.newKeySet();

    public ExecutionPipeline(DatabaseEngine engine,
                             RecommendationRepository recommendations,
                             ExecutionRecordRepository executions,
                             DdlGenerator ddlGenerator,
                             AdvisorSettings settings) {
        this.engine = engine;
        this.recommendations = recommendations;
        this.executions = executions;
        this.ddlGenerator = ddlGenerator;
        this.settings = settings;
        this.precheck = new PrecheckValidator(engine, ddlGenerator, settings.getSpaceSafetyFactor());
        this.statementRunner = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "compadvisor-statement");
            thread.setDaemon(true);
            return thread;
        });
    }

    public ExecutionRecord execute(long recommendationId, ExecutionOptions options) {
        Recommendation recommendation = recommendations.findById(recommendationId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown recommendation: " + recommendationId));
        return execute(recommendation, options);
    }

    public ExecutionRecord execute(Recommendation recommendation, ExecutionOptions options) {
        String statement = ddlGenerator.generate(recommendation, options.isOnline());
        ExecutionRecord pending = ExecutionRecord.builder()
                .recommendationId(recommendation.getId())
                .ref(recommendation.getRef())
                .operation(ExecutionOperation.COMPRESS)
                .encodingBefore(recommendation.getCurrentEncoding())
                .encodingAfter(recommendation.getRecommendedEncoding())
                .statement(statement)
                .dryRun(options.isDryRun())
                .online(options.isOnline())
                .status(ExecutionStatus.PENDING)
                .startedAt(Instant.now())
                .sizeBeforeBytes(recommendation.getSizeBytes())
                .build();

        if (!recommendation.isActionable()) {
            return rejected(pending, new PreconditionViolation(Reason.NOT_ACTIONABLE,
                    "Recommendation " + recommendation.getId() + " for " + recommendation.getRef()
                            + " does not change the storage encoding"));
        }
        return run(pending, options);
    }

    /**
     * Applies the highest-priority actionable recommendations of a strategy.
     * <p>
     * Recommendations are taken in priority order until {@code maxObjects} are selected; a
     * recommendation that would push the selected total past {@code maxTotalSizeBytes} is skipped.
     * A limit of zero or less does not constrain. Changes to distinct objects run concurrently up to
     * the configured execution parallelism; changes sharing a table run one after another. The batch
     * always runs to the end and reports how many changes succeeded and failed.
     */
    public BatchSummary batchExecute(int strategyId, int maxObjects, long maxTotalSizeBytes, ExecutionOptions options) {
        List<Recommendation> queue = new ArrayList<>(recommendations.query(
                RecommendationFilter.builder().strategyId(strategyId).build()));
        queue.sort(BATCH_ORDER);

        List<Recommendation> selected = select(queue, maxObjects, maxTotalSizeBytes);
        if (selected.isEmpty()) {
            log.info("No actionable recommendations to execute for strategy {}", strategyId);
            return new BatchSummary(0, 0, 0, 0, List.of());
        }

        Map<String, List<Recommendation>> byObject = new LinkedHashMap<>();
        for (Recommendation recommendation : selected) {
            byObject.computeIfAbsent(recommendation.getRef().lockKey(), key -> new ArrayList<>()).add(recommendation);
        }

        int threads = Math.max(1, Math.min(settings.getExecutionParallelism(), byObject.size()));
        log.info("Executing {} recommendations of strategy {} ({}) with {} worker(s)",
                selected.size(), strategyId, options.isDryRun() ? "dry run" : "apply", threads);

        Map<Long, ExecutionRecord> results = new ConcurrentHashMap<>();
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (List<Recommendation> group : byObject.values()) {
                futures.add(pool.submit(() -> {
                    for (Recommendation recommendation : group) {
                        results.put(recommendation.getId(), executeSafely(recommendation, options));
                    }
                }));
            }
            for (Future<?> future : futures) {
                awaitQuietly(future);
            }
        } finally {
            pool.shutdown();
        }

        List<ExecutionRecord> ordered = selected.stream()
                .map(r -> results.get(r.getId()))
                .filter(Objects::nonNull)
                .collect(Collectors.toList());

        int succeeded = 0;
        long savings = 0;
        for (ExecutionRecord record : ordered) {
            if (record.getStatus() == ExecutionStatus.SUCCEEDED) {
                succeeded++;
                savings += record.isDryRun() ? projectedSavings(selected, record) : record.spaceSavedBytes();
            }
        }
        int failed = selected.size() - succeeded;

        log.info("Batch complete: {} processed, {} succeeded, {} failed, {} bytes saved",
                selected.size(), succeeded, failed, savings);
        return new BatchSummary(selected.size(), succeeded, failed, savings, ordered);
    }

    /**
     * Restores the encoding an applied compression replaced. The revert is itself an execution
     * (operation REVERT); when it is applied successfully a ROLLED_BACK marker referencing the
     * original execution is appended.
     */
    public ExecutionRecord revert(long executionId, ExecutionOptions options) {
        ExecutionRecord original = executions.findById(executionId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown execution: " + executionId));
        if (original.getOperation() != ExecutionOperation.COMPRESS
                || original.getStatus() != ExecutionStatus.SUCCEEDED
                || original.isDryRun()) {
            throw new IllegalStateException("Only an applied, succeeded compression can be reverted; execution "
                    + executionId + " is a " + (original.isDryRun() ? "dry-run " : "")
                    + original.getOperation() + " in state " + original.getStatus());
        }
        if (isRolledBack(executionId)) {
            throw new IllegalStateException("Execution " + executionId + " has already been rolled back");
        }

        ObjectRef ref = original.getRef();
        String statement = ddlGenerator.statementFor(ref, original.getEncodingBefore(),
                currentStorageArea(ref), options.isOnline());

        ExecutionRecord pending = ExecutionRecord.builder()
                .recommendationId(original.getRecommendationId())
                .ref(ref)
                .operation(ExecutionOperation.REVERT)
                .encodingBefore(original.getEncodingAfter())
                .encodingAfter(original.getEncodingBefore())
                .statement(statement)
                .dryRun(options.isDryRun())
                .online(options.isOnline())
                .status(ExecutionStatus.PENDING)
                .startedAt(Instant.now())
                .sizeBeforeBytes(original.getSizeAfterBytes())
                .revertOf(executionId)
                .build();

        ExecutionRecord result = run(pending, options);
        if (result.getStatus() == ExecutionStatus.SUCCEEDED && !result.isDryRun()) {
            Instant now = Instant.now();
            executions.append(result.toBuilder()
                    .status(ExecutionStatus.ROLLED_BACK)
                    .startedAt(now)
                    .endedAt(now)
                    .revertOf(executionId)
                    .build());
            log.info("Execution {} on {} rolled back to {}", executionId, ref, original.getEncodingBefore());
        }
        return result;
    }

    /**
     * Status of an execution; a succeeded execution that was later reverted reports ROLLED_BACK.
     */
    public Optional<ExecutionStatus> getExecutionStatus(long executionId) {
        return executions.findById(executionId)
                .map(record -> isRolledBack(executionId) ? ExecutionStatus.ROLLED_BACK : record.getStatus());
    }

    public List<ExecutionRecord> getHistory(int daysBack, String owner, ExecutionStatus status) {
        Instant since = Instant.now().minus(Math.max(0, daysBack), ChronoUnit.DAYS);
        return executions.history(since, owner, status);
    }

    @Override
    public void close() {
        CompletableFuture<?>[] pending = abandonedStatements.toArray(new CompletableFuture<?>[0]);
        if (pending.length > 0) {
            log.warn("Waiting for {} timed-out statement(s) to end before shutting down", pending.length);
            try {
                CompletableFuture.allOf(pending).get(settings.getStatementCancelGrace().toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (ExecutionException | TimeoutException e) {
                log.error("{} timed-out statement(s) still running at shutdown; their executions stay in flight",
                        abandonedStatements.size());
            }
        }
        statementRunner.shutdownNow();
    }

    private ExecutionRecord run(ExecutionRecord pending, ExecutionOptions options) {
        ObjectRef ref = pending.getRef();

        Optional<ExecutionRecord> begun = executions.beginIfIdle(pending);
        if (begun.isEmpty()) {
            String holder = executions.findInFlight(ref.lockKey())
                    .map(r -> "execution " + r.getExecutionId())
                    .orElse("another execution");
            return rejected(pending, new PreconditionViolation(Reason.EXECUTION_IN_PROGRESS,
                    ref + " is already being changed by " + holder));
        }

        ExecutionRecord record = executions.update(begun.get().toBuilder().status(ExecutionStatus.PRECHECK).build());
        PrecheckResult check = precheck.check(ref, record.getEncodingBefore(), record.getEncodingAfter(), record.getStatement());
        if (!check.passed()) {
            return finish(record, ExecutionStatus.FAILED, null, check.describe());
        }

        record = executions.update(record.toBuilder()
                .sizeBeforeBytes(check.metrics().getSizeBytes())
                .status(options.isDryRun() ? ExecutionStatus.DRY_RUN : ExecutionStatus.APPLYING)
                .build());

        if (options.isDryRun()) {
            log.info("Dry run passed for {}: {}", ref, record.getStatement());
            return finish(record, ExecutionStatus.SUCCEEDED, null, null);
        }

        Duration timeout = options.getTimeout() != null ? options.getTimeout() : settings.getExecutionTimeout();
        log.info("Applying to {}: {}", ref, record.getStatement());
        try {
            apply(record.getStatement(), timeout);
        } catch (StatementStillRunningException e) {
            return awaitAbandonedStatement(record, e, timeout);
        } catch (EngineException e) {
            log.error("Statement failed for {}: {}", ref, e.getMessage());
            String rollbackProblem = rollBack(record, timeout);
            String detail = rollbackProblem == null ? e.getMessage() : e.getMessage() + "; " + rollbackProblem;
            return finish(record, ExecutionStatus.FAILED, null, detail);
        }

        Long sizeAfter = measure(ref);
        if (options.isRebuildIndexes() && ref.objectType() == ObjectType.TABLE && !ref.isPartition()) {
            rebuildIndexes(ref, options.isOnline(), timeout);
        }
        return finish(record, ExecutionStatus.SUCCEEDED, sizeAfter, null);
    }

    /**
     * Keeps a timed-out attempt in flight until its statement ends, then runs the rollback check and
     * records the failure.
     */
    private ExecutionRecord awaitAbandonedStatement(ExecutionRecord record, StatementStillRunningException e,
                                                    Duration timeout) {
        ObjectRef ref = record.getRef();
        log.error("Statement on {} timed out and has not stopped; execution {} stays in flight until it ends",
                ref, record.getExecutionId());
        ExecutionRecord inFlight = executions.update(record.toBuilder()
                .errorDetail(e.getMessage() + "; statement still running")
                .build());

        CompletableFuture<Void> ended = e.ended();
        abandonedStatements.add(ended);
        ended.whenComplete((ignored, error) -> {
            String detail = e.getMessage();
            try {
                String rollbackProblem = rollBack(inFlight, timeout);
                if (rollbackProblem != null) {
                    detail = detail + "; " + rollbackProblem;
                }
            } catch (RuntimeException rollbackError) {
                detail = detail + "; rollback failed: " + rollbackError.getMessage();
            } finally {
                finish(inFlight, ExecutionStatus.FAILED, null, detail);
                abandonedStatements.remove(ended);
            }
        });
        return inFlight;
    }

    private void apply(String statement, Duration timeout) throws EngineException {
        CompletableFuture<Void> ended = new CompletableFuture<>();
        Future<?> future = statementRunner.submit(() -> {
            try {
                engine.executeStatement(statement, timeout);
                return null;
            } finally {
                ended.complete(null);
            }
        });
        try {
            future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            String message = "Statement timed out after " + timeout.toMillis() + " ms";
            // interrupting the caller does not stop a statement already running on the engine
            if (!awaitEnd(ended)) {
                throw new StatementStillRunningException(message, ended);
            }
            throw new EngineException(message);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new EngineException("Interrupted while waiting for statement", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof EngineException) {
                throw (EngineException) cause;
            }
            throw new EngineException(String.valueOf(cause.getMessage()), cause);
        }
    }

    /**
     * Puts the object back into the encoding recorded before the attempt if the failed statement
     * changed it anyway.
     *
     * @return a description of a rollback that could not be completed, or null
     */
    private String rollBack(ExecutionRecord record, Duration timeout) {
        ObjectRef ref = record.getRef();
        try {
            Optional<ObjectMetrics> after = engine.getObjectMetrics(ref);
            if (after.isEmpty()) {
                return "rollback check failed: " + ref + " not found";
            }
            Encoding current = after.get().getCurrentEncoding();
            if (current == record.getEncodingBefore()) {
                log.info("{} unchanged after failed statement; nothing to roll back", ref);
                return null;
            }
            String restore = ddlGenerator.statementFor(ref, record.getEncodingBefore(),
                    after.get().getStorageArea(), record.isOnline());
            log.warn("{} is now {} despite the failure; restoring {}", ref, current, record.getEncodingBefore());
            apply(restore, timeout);
            return null;
        } catch (EngineException e) {
            log.error("Rollback of {} failed: {}", ref, e.getMessage());
            return "rollback failed: " + e.getMessage();
        }
    }

    private void rebuildIndexes(ObjectRef table, boolean online, Duration timeout) {
        List<ObjectRef> indexes;
        try {
            indexes = engine.listIndexes(table.owner(), table.objectName());
        } catch (EngineException e) {
            log.warn("Could not list indexes of {} for rebuild: {}", table, e.getMessage());
            return;
        }
        for (ObjectRef index : indexes) {
            try {
                apply(ddlGenerator.rebuildIndex(index, online), timeout);
                log.debug("Rebuilt index {}", index);
            } catch (EngineException e) {
                log.warn("Index {} could not be rebuilt after moving {}: {}", index, table, e.getMessage());
            }
        }
    }

    private Long measure(ObjectRef ref) {
        try {
            return engine.getObjectMetrics(ref).map(ObjectMetrics::getSizeBytes).orElse(null);
        } catch (EngineException e) {
            log.warn("Could not measure {} after the change: {}", ref, e.getMessage());
            return null;
        }
    }

    private String currentStorageArea(ObjectRef ref) {
        try {
            return engine.getObjectMetrics(ref).map(ObjectMetrics::getStorageArea).orElse(null);
        } catch (EngineException e) {
            log.warn("Could not read storage area of {}: {}", ref, e.getMessage());
            return null;
        }
    }

    private ExecutionRecord finish(ExecutionRecord record, ExecutionStatus status, Long sizeAfter, String errorDetail) {
        ExecutionRecord finished = executions.update(record.toBuilder()
                .status(status)
                .endedAt(Instant.now())
                .sizeAfterBytes(sizeAfter)
                .errorDetail(errorDetail)
                .build());
        if (status == ExecutionStatus.SUCCEEDED) {
            log.info("Execution {} on {} succeeded{}", finished.getExecutionId(), finished.getRef(),
                    finished.isDryRun() ? " (dry run)" : "");
        } else {
            log.warn("Execution {} on {} failed: {}", finished.getExecutionId(), finished.getRef(), errorDetail);
        }
        return finished;
    }

    private ExecutionRecord rejected(ExecutionRecord pending, PreconditionViolation violation) {
        log.warn("Execution on {} rejected: {}", pending.getRef(), violation);
        return executions.append(pending.toBuilder()
                .status(ExecutionStatus.FAILED)
                .endedAt(Instant.now())
                .errorDetail(violation.toString())
                .build());
    }

    private ExecutionRecord executeSafely(Recommendation recommendation, ExecutionOptions options) {
        try {
            return execute(recommendation, options);
        } catch (RuntimeException e) {
            log.error("Unexpected error executing recommendation {}: {}", recommendation.getId(), e.getMessage(), e);
            return executions.append(ExecutionRecord.builder()
                    .recommendationId(recommendation.getId())
                    .ref(recommendation.getRef())
                    .operation(ExecutionOperation.COMPRESS)
                    .encodingBefore(recommendation.getCurrentEncoding())
                    .encodingAfter(recommendation.getRecommendedEncoding())
                    .dryRun(options.isDryRun())
                    .online(options.isOnline())
                    .status(ExecutionStatus.FAILED)
                    .startedAt(Instant.now())
                    .endedAt(Instant.now())
                    .errorDetail(e.toString())
                    .build());
        }
    }

    private boolean isRolledBack(long executionId) {
        return executions.findAll().stream()
                .anyMatch(r -> r.getStatus() == ExecutionStatus.ROLLED_BACK
                        && Objects.equals(r.getRevertOf(), executionId));
    }

    private static List<Recommendation> select(List<Recommendation> queue, int maxObjects, long maxTotalSizeBytes) {
        List<Recommendation> selected = new ArrayList<>();
        long total = 0;
        for (Recommendation recommendation : queue) {
            if (maxObjects > 0 && selected.size() >= maxObjects) {
                break;
            }
            if (maxTotalSizeBytes > 0 && total + recommendation.getSizeBytes() > maxTotalSizeBytes) {
                log.debug("Skipping {}: would exceed the batch size limit", recommendation.getRef());
                continue;
            }
            selected.add(recommendation);
            total += recommendation.getSizeBytes();
        }
        return selected;
    }

    private static long projectedSavings(List<Recommendation> selected, ExecutionRecord record) {
        return selected.stream()
                .filter(r -> r.getId() == record.getRecommendationId())
                .mapToLong(Recommendation::getProjectedSavingsBytes)
                .findFirst()
                .orElse(0);
    }

    private boolean awaitEnd(CompletableFuture<Void> ended) throws EngineException {
        try {
            ended.get(settings.getStatementCancelGrace().toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (ExecutionException e) {
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EngineException("Interrupted while waiting for a cancelled statement to end", e);
        }
    }

    private static void awaitQuietly(Future<?> future) {
        try {
            future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for batch workers");
        } catch (ExecutionException e) {
            log.error("Batch worker failed: {}", e.getCause().getMessage(), e.getCause());
        }
    }
}
