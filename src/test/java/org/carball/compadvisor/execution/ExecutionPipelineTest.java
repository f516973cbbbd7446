package org.carball.compadvisor.execution;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.carball.compadvisor.config.AdvisorSettings;
import org.carball.compadvisor.ddl.DdlGenerator;
import org.carball.compadvisor.engine.EngineException;
import org.carball.compadvisor.engine.FakeDatabaseEngine;
import org.carball.compadvisor.engine.FakeDatabaseEngine.FakeObject;
import org.carball.compadvisor.model.BatchSummary;
import org.carball.compadvisor.model.Encoding;
import org.carball.compadvisor.model.ExecutionOperation;
import org.carball.compadvisor.model.ExecutionRecord;
import org.carball.compadvisor.model.ExecutionStatus;
import org.carball.compadvisor.model.Recommendation;
import org.carball.compadvisor.model.RecommendationPriority;
import org.carball.compadvisor.repository.InMemoryExecutionRecordRepository;
import org.carball.compadvisor.repository.InMemoryRecommendationRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.carball.compadvisor.engine.FakeDatabaseEngine.MB;

public class ExecutionPipelineTest {

    private ListAppender<ILoggingEvent> logAppender;
    private Logger logger;

    private FakeDatabaseEngine engine;
    private InMemoryRecommendationRepository recommendations;
    private InMemoryExecutionRecordRepository executions;
    private ExecutionPipeline pipeline;

    @BeforeEach
    void setUp() {
        logger = (Logger) LoggerFactory.getLogger(ExecutionPipeline.class);
        logAppender = new ListAppender<>();
        logAppender.start();
        logger.addAppender(logAppender);
        logger.setLevel(Level.DEBUG);
        logger.setAdditive(false);

        engine = new FakeDatabaseEngine();
        recommendations = new InMemoryRecommendationRepository();
        executions = new InMemoryExecutionRecordRepository();
        pipeline = pipeline(AdvisorSettings.defaults());
    }

    @AfterEach
    void tearDown() {
        pipeline.close();
        logger.detachAppender(logAppender);
    }

    @Test
    void shouldLeaveObjectUntouchedOnDryRun() {
        // Given
        FakeObject orders = engine.addTable("APP", "ORDERS", 100 * MB).ratio(Encoding.OLTP, 2.5);
        Recommendation rec = save(orders, Encoding.OLTP, RecommendationPriority.HIGH);

        // When
        ExecutionRecord result = pipeline.execute(rec.getId(), ExecutionOptions.dryRun());

        // Then
        assertThat(result.getStatus()).isEqualTo(ExecutionStatus.SUCCEEDED);
        assertThat(result.isDryRun()).isTrue();
        assertThat(result.getStatement()).isEqualTo("ALTER TABLE APP.ORDERS MOVE COMPRESS FOR OLTP;");
        assertThat(orders.currentEncoding()).isEqualTo(Encoding.NONE);
        assertThat(engine.executedStatements()).isEmpty();
        assertThat(pipeline.getExecutionStatus(result.getExecutionId())).contains(ExecutionStatus.SUCCEEDED);
    }

    @Test
    void shouldApplyChangeAndMeasureSavings() {
        // Given
        FakeObject orders = engine.addTable("APP", "ORDERS", 100 * MB).ratio(Encoding.OLTP, 2.0);
        engine.addIndex("APP", "ORDERS", "PK_ORDERS", 20 * MB);
        Recommendation rec = save(orders, Encoding.OLTP, RecommendationPriority.HIGH);

        // When
        ExecutionRecord result = pipeline.execute(rec.getId(), ExecutionOptions.apply());

        // Then
        assertThat(result.getStatus()).isEqualTo(ExecutionStatus.SUCCEEDED);
        assertThat(result.getOperation()).isEqualTo(ExecutionOperation.COMPRESS);
        assertThat(orders.currentEncoding()).isEqualTo(Encoding.OLTP);
        assertThat(result.getSizeBeforeBytes()).isEqualTo(100 * MB);
        assertThat(result.getSizeAfterBytes()).isEqualTo(50 * MB);
        assertThat(result.spaceSavedBytes()).isEqualTo(50 * MB);
        assertThat(result.getEndedAt()).isAfterOrEqualTo(result.getStartedAt());
        assertThat(engine.executedStatements()).containsExactly(
                "ALTER TABLE APP.ORDERS MOVE COMPRESS FOR OLTP;",
                "ALTER INDEX APP.PK_ORDERS REBUILD;");
    }

    @Test
    void shouldNotRebuildIndexesAfterPartitionMove() {
        FakeObject partition = engine.addPartition("APP", "SALES", "P2023", 100 * MB).ratio(Encoding.QUERY_HIGH, 5.0);
        engine.addIndex("APP", "SALES", "IX_SALES_DATE", 20 * MB);
        Recommendation rec = save(partition, Encoding.QUERY_HIGH, RecommendationPriority.HIGH);

        ExecutionRecord result = pipeline.execute(rec.getId(), ExecutionOptions.apply());

        assertThat(result.getStatus()).isEqualTo(ExecutionStatus.SUCCEEDED);
        assertThat(partition.currentEncoding()).isEqualTo(Encoding.QUERY_HIGH);
        assertThat(engine.executedStatements())
                .containsExactly("ALTER TABLE APP.SALES MOVE PARTITION P2023 COMPRESS FOR QUERY HIGH;");
    }

    @Test
    void shouldSucceedWithWarningWhenIndexRebuildFails() {
        // Given
        FakeObject orders = engine.addTable("APP", "ORDERS", 100 * MB).ratio(Encoding.OLTP, 2.0);
        engine.addIndex("APP", "ORDERS", "PK_ORDERS", 20 * MB);
        engine.failStatementsContaining("REBUILD", "ORA-01652: unable to extend temp segment");
        Recommendation rec = save(orders, Encoding.OLTP, RecommendationPriority.HIGH);

        // When
        ExecutionRecord result = pipeline.execute(rec.getId(), ExecutionOptions.apply());

        // Then
        assertThat(result.getStatus()).isEqualTo(ExecutionStatus.SUCCEEDED);
        assertThat(logAppender.list)
                .filteredOn(e -> e.getLevel() == Level.WARN)
                .anyMatch(e -> e.getFormattedMessage().contains("APP.PK_ORDERS could not be rebuilt"));
    }

    @Test
    void shouldRejectSecondExecutionWhileObjectIsInFlight() {
        // Given an execution already holding the table
        FakeObject orders = engine.addTable("APP", "ORDERS", 100 * MB).ratio(Encoding.OLTP, 2.0);
        Recommendation rec = save(orders, Encoding.OLTP, RecommendationPriority.HIGH);
        ExecutionRecord holder = executions.beginIfIdle(ExecutionRecord.builder()
                .recommendationId(99)
                .ref(orders.ref())
                .operation(ExecutionOperation.COMPRESS)
                .status(ExecutionStatus.APPLYING)
                .startedAt(Instant.now())
                .build()).orElseThrow();

        // When
        ExecutionRecord result = pipeline.execute(rec.getId(), ExecutionOptions.apply());

        // Then
        assertThat(result.getStatus()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(result.getErrorDetail())
                .startsWith("EXECUTION_IN_PROGRESS")
                .contains("execution " + holder.getExecutionId());
        assertThat(engine.executedStatements()).isEmpty();
        assertThat(orders.currentEncoding()).isEqualTo(Encoding.NONE);
    }

    @Test
    void shouldFailPrecheckWhenObjectIsLocked() {
        FakeObject orders = engine.addTable("APP", "ORDERS", 100 * MB).ratio(Encoding.OLTP, 2.0).locked(true);
        Recommendation rec = save(orders, Encoding.OLTP, RecommendationPriority.HIGH);

        ExecutionRecord result = pipeline.execute(rec.getId(), ExecutionOptions.dryRun());

        assertThat(result.getStatus()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(result.getErrorDetail()).startsWith("LOCKED");
    }

    @Test
    void shouldFailPrecheckWithoutEnoughFreeSpace() {
        // Given a 100 MB table in a tablespace with 150 MB free and a safety factor of 2
        FakeObject orders = engine.addTable("APP", "ORDERS", 100 * MB).ratio(Encoding.OLTP, 2.0).storageArea("USERS");
        engine.setFreeBytes("USERS", 150 * MB);
        Recommendation rec = save(orders, Encoding.OLTP, RecommendationPriority.HIGH);

        // When
        ExecutionRecord result = pipeline.execute(rec.getId(), ExecutionOptions.apply());

        // Then
        assertThat(result.getStatus()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(result.getErrorDetail()).startsWith("INSUFFICIENT_SPACE").contains("USERS");
        assertThat(engine.executedStatements()).isEmpty();
    }

    @Test
    void shouldSkipSpaceCheckForLobs() {
        FakeObject body = engine.addLob("APP", "DOCS", "BODY", 100 * MB).ratio(Encoding.LOB_MEDIUM, 2.0).storageArea("LOBS");
        engine.setFreeBytes("LOBS", 0);
        Recommendation rec = save(body, Encoding.LOB_MEDIUM, RecommendationPriority.HIGH);

        ExecutionRecord result = pipeline.execute(rec.getId(), ExecutionOptions.apply());

        assertThat(result.getStatus()).isEqualTo(ExecutionStatus.SUCCEEDED);
        assertThat(body.currentEncoding()).isEqualTo(Encoding.LOB_MEDIUM);
    }

    @Test
    void shouldFailPrecheckWhenEncodingChangedSinceAnalysis() {
        FakeObject orders = engine.addTable("APP", "ORDERS", 100 * MB).ratio(Encoding.OLTP, 2.0);
        Recommendation rec = save(orders, Encoding.OLTP, RecommendationPriority.HIGH);
        orders.encoding(Encoding.BASIC);

        ExecutionRecord result = pipeline.execute(rec.getId(), ExecutionOptions.apply());

        assertThat(result.getStatus()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(result.getErrorDetail()).isEqualTo("ENCODING_CHANGED: Expected APP.ORDERS in NONE but found BASIC");
        assertThat(orders.currentEncoding()).isEqualTo(Encoding.BASIC);
    }

    @Test
    void shouldFailPrecheckWhenObjectWasDropped() {
        FakeObject orders = engine.addTable("APP", "ORDERS", 100 * MB).ratio(Encoding.OLTP, 2.0);
        Recommendation rec = save(orders, Encoding.OLTP, RecommendationPriority.HIGH);
        engine.drop(orders.ref());

        ExecutionRecord result = pipeline.execute(rec.getId(), ExecutionOptions.dryRun());

        assertThat(result.getStatus()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(result.getErrorDetail()).startsWith("OBJECT_MISSING");
    }

    @Test
    void shouldRecordEngineErrorVerbatimAndKeepEncoding() {
        // Given
        FakeObject orders = engine.addTable("APP", "ORDERS", 100 * MB).ratio(Encoding.OLTP, 2.0);
        engine.failStatementsContaining("COMPRESS FOR OLTP", "ORA-01652: unable to extend temp segment by 128 in tablespace TEMP");
        Recommendation rec = save(orders, Encoding.OLTP, RecommendationPriority.HIGH);

        // When
        ExecutionRecord result = pipeline.execute(rec.getId(), ExecutionOptions.apply());

        // Then
        assertThat(result.getStatus()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(result.getErrorDetail())
                .isEqualTo("ORA-01652: unable to extend temp segment by 128 in tablespace TEMP");
        assertThat(orders.currentEncoding()).isEqualTo(Encoding.NONE);
        assertThat(result.getSizeAfterBytes()).isNull();
    }

    @Test
    void shouldRestorePreviousEncodingWhenFailedStatementChangedObject() {
        // Given a statement that changes the table and then reports an error
        FakeObject orders = engine.addTable("APP", "ORDERS", 100 * MB).ratio(Encoding.OLTP, 2.0);
        engine.failStatementsContaining("COMPRESS FOR OLTP", "ORA-03113: end-of-file on communication channel");
        engine.applyBeforeFailing(true);
        Recommendation rec = save(orders, Encoding.OLTP, RecommendationPriority.HIGH);

        // When
        ExecutionRecord result = pipeline.execute(rec.getId(), ExecutionOptions.apply());

        // Then
        assertThat(result.getStatus()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(result.getErrorDetail()).isEqualTo("ORA-03113: end-of-file on communication channel");
        assertThat(orders.currentEncoding()).isEqualTo(Encoding.NONE);
        assertThat(engine.executedStatements()).last().isEqualTo("ALTER TABLE APP.ORDERS MOVE NOCOMPRESS;");
    }

    @Test
    void shouldReportRollbackThatCouldNotComplete() {
        FakeObject orders = engine.addTable("APP", "ORDERS", 100 * MB).ratio(Encoding.OLTP, 2.0);
        engine.failStatementsContaining("APP.ORDERS MOVE", "ORA-03113: end-of-file on communication channel");
        engine.applyBeforeFailing(true);
        Recommendation rec = save(orders, Encoding.OLTP, RecommendationPriority.HIGH);

        ExecutionRecord result = pipeline.execute(rec.getId(), ExecutionOptions.apply());

        assertThat(result.getStatus()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(result.getErrorDetail())
                .startsWith("ORA-03113: end-of-file on communication channel; rollback failed: ");
    }

    @Test
    void shouldFailStatementThatExceedsTimeout() {
        // Given
        FakeObject orders = engine.addTable("APP", "ORDERS", 100 * MB).ratio(Encoding.OLTP, 2.0);
        engine.setStatementDelay(Duration.ofSeconds(5));
        Recommendation rec = save(orders, Encoding.OLTP, RecommendationPriority.HIGH);

        // When
        ExecutionRecord result = pipeline.execute(rec.getId(),
                ExecutionOptions.apply().toBuilder().timeout(Duration.ofMillis(100)).build());

        // Then
        assertThat(result.getStatus()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(result.getErrorDetail()).isEqualTo("Statement timed out after 100 ms");
        assertThat(orders.currentEncoding()).isEqualTo(Encoding.NONE);
    }

    @Test
    void shouldRollBackTimedOutStatementOnlyAfterItEnds() {
        // Given a statement that keeps running after cancellation and then completes
        useEngine(new UninterruptibleEngine(500), AdvisorSettings.defaults());
        FakeObject orders = engine.addTable("APP", "ORDERS", 100 * MB).ratio(Encoding.OLTP, 2.0);
        Recommendation rec = save(orders, Encoding.OLTP, RecommendationPriority.HIGH);

        // When
        ExecutionRecord result = pipeline.execute(rec.getId(),
                ExecutionOptions.apply().toBuilder().timeout(Duration.ofMillis(100)).build());

        // Then the late change is undone before the failure is recorded
        assertThat(result.getStatus()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(result.getErrorDetail()).isEqualTo("Statement timed out after 100 ms");
        assertThat(orders.currentEncoding()).isEqualTo(Encoding.NONE);
        assertThat(engine.executedStatements()).containsExactly(
                "ALTER TABLE APP.ORDERS MOVE COMPRESS FOR OLTP;",
                "ALTER TABLE APP.ORDERS MOVE NOCOMPRESS;");
        assertThat(executions.findInFlight(orders.ref().lockKey())).isEmpty();
    }

    @Test
    void shouldKeepObjectLockedWhileTimedOutStatementIsStillRunning() throws InterruptedException {
        // Given a statement that outlives both the timeout and the cancellation grace period
        useEngine(new UninterruptibleEngine(1000),
                AdvisorSettings.builder().statementCancelGraceMillis(50).build());
        FakeObject orders = engine.addTable("APP", "ORDERS", 100 * MB).ratio(Encoding.OLTP, 2.0);
        Recommendation rec = save(orders, Encoding.OLTP, RecommendationPriority.HIGH);
        ExecutionOptions options = ExecutionOptions.apply().toBuilder().timeout(Duration.ofMillis(100)).build();

        // When
        ExecutionRecord result = pipeline.execute(rec.getId(), options);
        ExecutionRecord second = pipeline.execute(rec.getId(), options);

        // Then the first attempt still holds the table
        assertThat(result.getStatus()).isEqualTo(ExecutionStatus.APPLYING);
        assertThat(result.getErrorDetail()).contains("still running");
        assertThat(second.getStatus()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(second.getErrorDetail()).startsWith("EXECUTION_IN_PROGRESS");
        assertThat(logAppender.list).anyMatch(event -> event.getLevel() == Level.ERROR
                && event.getFormattedMessage().contains("stays in flight"));

        // And once it ends, the change is rolled back and the failure recorded
        waitForStatus(result.getExecutionId(), ExecutionStatus.FAILED, Duration.ofSeconds(10));
        ExecutionRecord finished = executions.findById(result.getExecutionId()).orElseThrow();
        assertThat(finished.getErrorDetail()).isEqualTo("Statement timed out after 100 ms");
        assertThat(orders.currentEncoding()).isEqualTo(Encoding.NONE);
        assertThat(executions.findInFlight(orders.ref().lockKey())).isEmpty();
    }

    @Test
    void shouldRejectRecommendationWithoutStorageChange() {
        FakeObject flat = engine.addTable("APP", "FLAT", 100 * MB);
        Recommendation rec = save(flat, Encoding.NONE, RecommendationPriority.LOW);

        ExecutionRecord result = pipeline.execute(rec.getId(), ExecutionOptions.apply());

        assertThat(result.getStatus()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(result.getErrorDetail()).startsWith("NOT_ACTIONABLE");
        assertThat(result.getStatement()).startsWith(DdlGenerator.PLACEHOLDER_PREFIX);
    }

    @Test
    void shouldRejectUnknownRecommendation() {
        assertThatThrownBy(() -> pipeline.execute(404L, ExecutionOptions.dryRun()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown recommendation: 404");
    }

    @Test
    void shouldBatchHighestPriorityFirstUpToLimit() {
        // Given
        Recommendation high = save(engine.addTable("APP", "HIGH_T", 10 * MB).ratio(Encoding.OLTP, 2.0),
                Encoding.OLTP, RecommendationPriority.HIGH);
        Recommendation medium = save(engine.addTable("APP", "MEDIUM_T", 100 * MB).ratio(Encoding.OLTP, 2.0),
                Encoding.OLTP, RecommendationPriority.MEDIUM);
        save(engine.addTable("APP", "LOW_T", 500 * MB).ratio(Encoding.OLTP, 2.0),
                Encoding.OLTP, RecommendationPriority.LOW);

        // When
        BatchSummary summary = pipeline.batchExecute(1, 2, 0, ExecutionOptions.dryRun());

        // Then
        assertThat(summary.processed()).isEqualTo(2);
        assertThat(summary.succeeded()).isEqualTo(2);
        assertThat(summary.failed()).isZero();
        assertThat(summary.executions())
                .extracting(ExecutionRecord::getRecommendationId)
                .containsExactly(high.getId(), medium.getId());
        assertThat(summary.totalSavingsBytes())
                .isEqualTo(high.getProjectedSavingsBytes() + medium.getProjectedSavingsBytes());
    }

    @Test
    void shouldSkipRecommendationsBeyondSizeLimit() {
        save(engine.addTable("APP", "BIG", 500 * MB).ratio(Encoding.OLTP, 2.0), Encoding.OLTP, RecommendationPriority.HIGH);
        Recommendation small = save(engine.addTable("APP", "SMALL", 50 * MB).ratio(Encoding.OLTP, 2.0),
                Encoding.OLTP, RecommendationPriority.HIGH);

        BatchSummary summary = pipeline.batchExecute(1, 10, 100 * MB, ExecutionOptions.dryRun());

        assertThat(summary.processed()).isEqualTo(1);
        assertThat(summary.executions()).singleElement()
                .extracting(ExecutionRecord::getRecommendationId)
                .isEqualTo(small.getId());
    }

    @Test
    void shouldReportPartialSuccess() {
        // Given
        save(engine.addTable("APP", "GOOD", 100 * MB).ratio(Encoding.OLTP, 2.0), Encoding.OLTP, RecommendationPriority.HIGH);
        save(engine.addTable("APP", "BAD", 100 * MB).ratio(Encoding.OLTP, 2.0).locked(true),
                Encoding.OLTP, RecommendationPriority.HIGH);

        // When
        BatchSummary summary = pipeline.batchExecute(1, 10, 0, ExecutionOptions.apply());

        // Then
        assertThat(summary.processed()).isEqualTo(2);
        assertThat(summary.succeeded()).isEqualTo(1);
        assertThat(summary.failed()).isEqualTo(1);
        assertThat(summary.totalSavingsBytes()).isEqualTo(50 * MB);
    }

    @Test
    void shouldBoundConcurrencyByExecutionParallelism() {
        // Given
        pipeline.close();
        pipeline = pipeline(AdvisorSettings.builder().executionParallelism(2).build());
        for (int i = 0; i < 4; i++) {
            save(engine.addTable("APP", "T" + i, 10 * MB).ratio(Encoding.OLTP, 2.0), Encoding.OLTP,
                    RecommendationPriority.HIGH);
        }
        engine.setStatementDelay(Duration.ofMillis(150));

        // When
        BatchSummary summary = pipeline.batchExecute(1, 0, 0, ExecutionOptions.apply());

        // Then
        assertThat(summary.succeeded()).isEqualTo(4);
        assertThat(engine.maxConcurrentStatements()).isBetween(1, 2);
    }

    @Test
    void shouldSerializeChangesToTheSameTable() {
        pipeline.close();
        pipeline = pipeline(AdvisorSettings.builder().executionParallelism(4).build());
        save(engine.addPartition("APP", "SALES", "P1", 10 * MB).ratio(Encoding.OLTP, 2.0), Encoding.OLTP,
                RecommendationPriority.HIGH);
        save(engine.addPartition("APP", "SALES", "P2", 10 * MB).ratio(Encoding.OLTP, 2.0), Encoding.OLTP,
                RecommendationPriority.HIGH);
        engine.setStatementDelay(Duration.ofMillis(100));

        BatchSummary summary = pipeline.batchExecute(1, 0, 0, ExecutionOptions.apply());

        assertThat(summary.succeeded()).isEqualTo(2);
        assertThat(engine.maxConcurrentStatements()).isEqualTo(1);
    }

    @Test
    void shouldRevertAppliedCompression() {
        // Given
        FakeObject orders = engine.addTable("APP", "ORDERS", 100 * MB).ratio(Encoding.OLTP, 2.0);
        Recommendation rec = save(orders, Encoding.OLTP, RecommendationPriority.HIGH);
        ExecutionRecord applied = pipeline.execute(rec.getId(), ExecutionOptions.apply());

        // When
        ExecutionRecord revert = pipeline.revert(applied.getExecutionId(), ExecutionOptions.apply());

        // Then
        assertThat(revert.getOperation()).isEqualTo(ExecutionOperation.REVERT);
        assertThat(revert.getStatus()).isEqualTo(ExecutionStatus.SUCCEEDED);
        assertThat(revert.getRevertOf()).isEqualTo(applied.getExecutionId());
        assertThat(revert.getStatement()).isEqualTo("ALTER TABLE APP.ORDERS MOVE NOCOMPRESS;");
        assertThat(orders.currentEncoding()).isEqualTo(Encoding.NONE);
        assertThat(pipeline.getExecutionStatus(applied.getExecutionId())).contains(ExecutionStatus.ROLLED_BACK);
        assertThatThrownBy(() -> pipeline.revert(applied.getExecutionId(), ExecutionOptions.apply()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("already been rolled back");
    }

    @Test
    void shouldDryRunRevertWithoutMarkingRolledBack() {
        FakeObject orders = engine.addTable("APP", "ORDERS", 100 * MB).ratio(Encoding.OLTP, 2.0);
        Recommendation rec = save(orders, Encoding.OLTP, RecommendationPriority.HIGH);
        ExecutionRecord applied = pipeline.execute(rec.getId(), ExecutionOptions.apply());

        ExecutionRecord revert = pipeline.revert(applied.getExecutionId(), ExecutionOptions.dryRun());

        assertThat(revert.getStatus()).isEqualTo(ExecutionStatus.SUCCEEDED);
        assertThat(orders.currentEncoding()).isEqualTo(Encoding.OLTP);
        assertThat(pipeline.getExecutionStatus(applied.getExecutionId())).contains(ExecutionStatus.SUCCEEDED);
    }

    @Test
    void shouldRefuseToRevertDryRun() {
        FakeObject orders = engine.addTable("APP", "ORDERS", 100 * MB).ratio(Encoding.OLTP, 2.0);
        Recommendation rec = save(orders, Encoding.OLTP, RecommendationPriority.HIGH);
        ExecutionRecord dryRun = pipeline.execute(rec.getId(), ExecutionOptions.dryRun());

        assertThatThrownBy(() -> pipeline.revert(dryRun.getExecutionId(), ExecutionOptions.apply()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Only an applied, succeeded compression can be reverted");
        assertThatThrownBy(() -> pipeline.revert(999, ExecutionOptions.apply()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldFilterHistory() {
        FakeObject good = engine.addTable("APP", "GOOD", 100 * MB).ratio(Encoding.OLTP, 2.0);
        FakeObject locked = engine.addTable("HR", "LOCKED", 100 * MB).ratio(Encoding.OLTP, 2.0).locked(true);
        pipeline.execute(save(good, Encoding.OLTP, RecommendationPriority.HIGH).getId(), ExecutionOptions.dryRun());
        pipeline.execute(save(locked, Encoding.OLTP, RecommendationPriority.HIGH).getId(), ExecutionOptions.dryRun());

        assertThat(pipeline.getHistory(30, null, null)).hasSize(2);
        assertThat(pipeline.getHistory(30, "hr", null)).singleElement()
                .extracting(ExecutionRecord::getStatus)
                .isEqualTo(ExecutionStatus.FAILED);
        assertThat(pipeline.getHistory(30, null, ExecutionStatus.SUCCEEDED)).hasSize(1);
        assertThat(pipeline.getExecutionStatus(12345)).isEmpty();
    }

    private void useEngine(FakeDatabaseEngine replacement, AdvisorSettings settings) {
        pipeline.close();
        engine = replacement;
        pipeline = pipeline(settings);
    }

    private void waitForStatus(long executionId, ExecutionStatus expected, Duration limit) throws InterruptedException {
        Instant deadline = Instant.now().plus(limit);
        while (Instant.now().isBefore(deadline)
                && executions.findById(executionId).map(ExecutionRecord::getStatus).orElse(null) != expected) {
            Thread.sleep(20);
        }
        assertThat(executions.findById(executionId).map(ExecutionRecord::getStatus)).contains(expected);
    }

    private ExecutionPipeline pipeline(AdvisorSettings settings) {
        return new ExecutionPipeline(engine, recommendations, executions, new DdlGenerator(), settings);
    }

    private Recommendation save(FakeObject object, Encoding encoding, RecommendationPriority priority) {
        long savings = encoding == Encoding.NONE ? 0 : object.size() / 2;
        return recommendations.save(Recommendation.builder()
                .runId(1)
                .strategyId(1)
                .ref(object.ref())
                .sizeBytes(object.size())
                .currentEncoding(object.currentEncoding())
                .recommendedEncoding(encoding)
                .compressionRatio(encoding == Encoding.NONE ? 1.0 : 2.0)
                .projectedSizeBytes(object.size() - savings)
                .projectedSavingsBytes(savings)
                .savingsPct(encoding == Encoding.NONE ? 0 : 50.0)
                .priority(priority)
                .rationale("test")
                .build());
    }

    /**
     * Runs OLTP moves to completion regardless of interrupts, the way a statement already executing
     * on the server ignores the client giving up on it.
     */
    private static class UninterruptibleEngine extends FakeDatabaseEngine {

        private final long runMillis;

        UninterruptibleEngine(long runMillis) {
            this.runMillis = runMillis;
        }

        @Override
        public void executeStatement(String statement, Duration timeout) throws EngineException {
            if (statement.contains("COMPRESS FOR OLTP")) {
                long until = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(runMillis);
                while (System.nanoTime() < until) {
                    Thread.onSpinWait();
                }
            }
            super.executeStatement(statement, timeout);
        }
    }
}
