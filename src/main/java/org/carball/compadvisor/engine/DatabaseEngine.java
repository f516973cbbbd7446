package org.carball.compadvisor.engine;

import org.carball.compadvisor.model.CatalogObject;
import org.carball.compadvisor.model.Encoding;
import org.carball.compadvisor.model.ModificationCounters;
import org.carball.compadvisor.model.ObjectMetrics;
import org.carball.compadvisor.model.ObjectRef;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Everything the advisor needs from the database: catalog facts, workload counters, the native
 * ratio estimator and the statement execution primitive.
 */
public interface DatabaseEngine {

    /**
     * Lists tables, indexes and LOB columns owned by {@code owner}, or by every schema when null.
     */
    List<CatalogObject> listObjects(String owner) throws EngineException;

    /**
     * Returns current facts for an object, or empty when it no longer exists. For a partition
     * reference the size, encoding and storage area are those of the partition itself.
     */
    Optional<ObjectMetrics> getObjectMetrics(ObjectRef ref) throws EngineException;

    /**
     * Returns DML counters recorded within {@code sinceWindow}, or empty when the engine has
     * no monitoring data for the object.
     */
    Optional<ModificationCounters> listModificationCounters(ObjectRef ref, Duration sinceWindow) throws EngineException;

    /**
     * Estimates the compression ratio of {@code encoding} on a sample of at most {@code sampleSize} rows.
     */
    RatioSample estimateCompressionRatio(ObjectRef ref, Encoding encoding, long sampleSize) throws EngineException;

    /**
     * Executes one DDL statement. The statement is atomic: on failure the object is unchanged.
     */
    void executeStatement(String statement, Duration timeout) throws EngineException;

    /**
     * True when another session holds a lock on the object.
     */
    boolean isLocked(ObjectRef ref) throws EngineException;

    /**
     * Free bytes in a storage area (tablespace).
     */
    long freeBytes(String storageArea) throws EngineException;

    /**
     * Indexes defined on a table; they become unusable after the table is moved.
     */
    List<ObjectRef> listIndexes(String owner, String tableName) throws EngineException;
}
