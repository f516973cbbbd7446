package org.carball.compadvisor.engine;

import org.carball.compadvisor.model.CatalogObject;
import org.carball.compadvisor.model.Encoding;
import org.carball.compadvisor.model.ModificationCounters;
import org.carball.compadvisor.model.ObjectMetrics;
import org.carball.compadvisor.model.ObjectRef;
import org.carball.compadvisor.model.ObjectType;
import org.carball.compadvisor.model.PartitionMetrics;
import org.carball.compadvisor.model.ReadCounters;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * In-memory database engine for tests. Objects are registered with fluent handles; executed
 * statements change the registered object's encoding and size the way the real engine would.
 */
public class FakeDatabaseEngine implements DatabaseEngine {

    public static final long MB = 1024L * 1024L;

    private final Map<ObjectRef, FakeObject> objects = new LinkedHashMap<>();
    private final Map<ObjectRef, List<ObjectRef>> indexesByTable = new HashMap<>();
    private final Map<String, Long> freeSpace = new HashMap<>();
    private final List<String> executedStatements = Collections.synchronizedList(new ArrayList<>());
    private final Map<String, String> statementFailures = new LinkedHashMap<>();
    private final AtomicInteger inFlightStatements = new AtomicInteger();
    private final AtomicInteger maxConcurrentStatements = new AtomicInteger();

    private volatile String listObjectsFailure;
    private volatile Duration statementDelay = Duration.ZERO;
    private volatile boolean applyBeforeFailing;

    public synchronized FakeObject addTable(String owner, String name, long sizeBytes) {
        return add(ObjectRef.table(owner, name), sizeBytes);
    }

    public synchronized FakeObject addPartition(String owner, String table, String partition, long sizeBytes) {
        return add(ObjectRef.partition(owner, table, partition), sizeBytes);
    }

    public synchronized FakeObject addIndex(String owner, String table, String name, long sizeBytes) {
        ObjectRef ref = ObjectRef.index(owner, name);
        indexesByTable.computeIfAbsent(ObjectRef.table(owner, table), t -> new ArrayList<>()).add(ref);
        return add(ref, sizeBytes);
    }

    public synchronized FakeObject addLob(String owner, String table, String column, long sizeBytes) {
        return add(ObjectRef.lob(owner, table, column), sizeBytes);
    }

    private FakeObject add(ObjectRef ref, long sizeBytes) {
        FakeObject object = new FakeObject(ref, sizeBytes);
        objects.put(ref, object);
        return object;
    }

    public synchronized FakeObject object(ObjectRef ref) {
        return objects.get(ref);
    }

    public synchronized void drop(ObjectRef ref) {
        objects.remove(ref);
    }

    public synchronized void setFreeBytes(String storageArea, long bytes) {
        freeSpace.put(storageArea, bytes);
    }

    public void failListObjects(String message) {
        this.listObjectsFailure = message;
    }

    /**
     * Statements containing {@code fragment} fail with {@code message}.
     */
    public synchronized void failStatementsContaining(String fragment, String message) {
        statementFailures.put(fragment, message);
    }

    /**
     * Failing statements still change the object before raising their error.
     */
    public void applyBeforeFailing(boolean apply) {
        this.applyBeforeFailing = apply;
    }

    public void setStatementDelay(Duration delay) {
        this.statementDelay = delay;
    }

    public List<String> executedStatements() {
        synchronized (executedStatements) {
            return new ArrayList<>(executedStatements);
        }
    }

    public int maxConcurrentStatements() {
        return maxConcurrentStatements.get();
    }

    @Override
    public synchronized List<CatalogObject> listObjects(String owner) throws EngineException {
        if (listObjectsFailure != null) {
            throw new EngineException(listObjectsFailure);
        }
        return objects.values().stream()
                .filter(o -> !o.ref.isPartition())
                .filter(o -> owner == null || o.ref.owner().equalsIgnoreCase(owner))
                .map(o -> new CatalogObject(o.ref, o.size, o.compressible, o.detail))
                .collect(Collectors.toList());
    }

    @Override
    public Optional<ObjectMetrics> getObjectMetrics(ObjectRef ref) throws EngineException {
        FakeObject object;
        synchronized (this) {
            object = objects.get(ref);
        }
        if (object == null) {
            return Optional.empty();
        }
        sleep(object.metricsDelay);
        synchronized (this) {
            if (object.metricsFailure != null) {
                throw new EngineException(object.metricsFailure);
            }
            return Optional.of(ObjectMetrics.builder()
                    .ref(ref)
                    .sizeBytes(object.size)
                    .rowCount(object.size / 100)
                    .blockCount(object.size / 8192)
                    .writeCounters(object.writes)
                    .readCounters(object.reads)
                    .currentEncoding(object.encoding)
                    .storageArea(object.storageArea)
                    .partitions(partitionsOf(ref))
                    .build());
        }
    }

    private List<PartitionMetrics> partitionsOf(ObjectRef ref) {
        if (ref.objectType() != ObjectType.TABLE || ref.isPartition()) {
            return List.of();
        }
        return objects.values().stream()
                .filter(o -> o.ref.isPartition()
                        && o.ref.owner().equals(ref.owner())
                        && o.ref.objectName().equals(ref.objectName()))
                .map(o -> new PartitionMetrics(o.ref.partitionName(), o.size, o.encoding, o.storageArea))
                .collect(Collectors.toList());
    }

    @Override
    public synchronized Optional<ModificationCounters> listModificationCounters(ObjectRef ref, Duration sinceWindow)
            throws EngineException {
        FakeObject object = objects.get(ref);
        if (object == null) {
            return Optional.empty();
        }
        if (object.countersFailure != null) {
            throw new EngineException(object.countersFailure);
        }
        return Optional.ofNullable(object.writes);
    }

    @Override
    public synchronized RatioSample estimateCompressionRatio(ObjectRef ref, Encoding encoding, long sampleSize)
            throws EngineException {
        FakeObject object = objects.get(ref);
        if (object == null) {
            throw new EngineException("ORA-00942: table or view does not exist");
        }
        if (object.unsupported.contains(encoding)) {
            throw new EngineException("ORA-64307: " + encoding + " is not supported on this storage");
        }
        double ratio = object.ratios.getOrDefault(encoding, 1.0);
        return new RatioSample(ratio, Math.round(object.baseSize / ratio));
    }

    @Override
    public void executeStatement(String statement, Duration timeout) throws EngineException {
        executedStatements.add(statement);
        int running = inFlightStatements.incrementAndGet();
        maxConcurrentStatements.accumulateAndGet(running, Math::max);
        try {
            if (!statementDelay.isZero()) {
                try {
                    Thread.sleep(statementDelay.toMillis());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new EngineException("ORA-01013: user requested cancel of current operation");
                }
            }
            synchronized (this) {
                String failure = statementFailures.entrySet().stream()
                        .filter(e -> statement.contains(e.getKey()))
                        .map(Map.Entry::getValue)
                        .findFirst()
                        .orElse(null);
                if (failure != null && !applyBeforeFailing) {
                    throw new EngineException(failure);
                }
                apply(statement);
                if (failure != null) {
                    throw new EngineException(failure);
                }
            }
        } finally {
            inFlightStatements.decrementAndGet();
        }
    }

    private void apply(String statement) throws EngineException {
        for (FakeObject object : objects.values()) {
            boolean partitionStatement = statement.contains(" MOVE PARTITION ");
            if (object.ref.objectType() == ObjectType.TABLE && object.ref.isPartition() != partitionStatement) {
                continue;
            }
            if (statement.startsWith(targetPrefix(object.ref))) {
                Encoding encoding = clauseOf(statement, object.ref.objectType());
                if (encoding != null) {
                    object.encoding = encoding;
                    object.size = Math.round(object.baseSize / object.ratios.getOrDefault(encoding, 1.0));
                }
                return;
            }
        }
        throw new EngineException("ORA-00942: table or view does not exist");
    }

    private static String targetPrefix(ObjectRef ref) {
        String table = "ALTER TABLE " + ref.owner() + "." + ref.objectName();
        switch (ref.objectType()) {
            case INDEX:
                return "ALTER INDEX " + ref.qualifiedName() + " ";
            case LOB:
                return table + " MODIFY LOB (" + ref.columnName() + ")";
            default:
                return ref.isPartition() ? table + " MOVE PARTITION " + ref.partitionName() + " " : table + " MOVE ";
        }
    }

    private static Encoding clauseOf(String statement, ObjectType type) {
        Encoding found = null;
        for (Encoding encoding : Encoding.values()) {
            if (encoding.appliesTo(type) && statement.contains(encoding.getStorageClause())
                    && (found == null || encoding.getStorageClause().length() > found.getStorageClause().length())) {
                found = encoding;
            }
        }
        return found;
    }

    @Override
    public synchronized boolean isLocked(ObjectRef ref) {
        FakeObject object = objects.get(ref);
        return object != null && object.locked;
    }

    @Override
    public synchronized long freeBytes(String storageArea) {
        return freeSpace.getOrDefault(storageArea, Long.MAX_VALUE);
    }

    @Override
    public synchronized List<ObjectRef> listIndexes(String owner, String tableName) {
        return List.copyOf(indexesByTable.getOrDefault(ObjectRef.table(owner, tableName), List.of()));
    }

    private static void sleep(Duration delay) throws EngineException {
        if (delay == null || delay.isZero()) {
            return;
        }
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EngineException("interrupted");
        }
    }

    /**
     * Mutable state of one fake object, configured fluently.
     */
    public static class FakeObject {
        final ObjectRef ref;
        final long baseSize;
        long size;
        Encoding encoding = Encoding.NONE;
        String storageArea;
        ModificationCounters writes = ModificationCounters.ZERO;
        ReadCounters reads = ReadCounters.ZERO;
        final Map<Encoding, Double> ratios = new EnumMap<>(Encoding.class);
        final Set<Encoding> unsupported = EnumSet.noneOf(Encoding.class);
        boolean compressible = true;
        String detail;
        boolean locked;
        Duration metricsDelay = Duration.ZERO;
        String metricsFailure;
        String countersFailure;

        FakeObject(ObjectRef ref, long sizeBytes) {
            this.ref = ref;
            this.baseSize = sizeBytes;
            this.size = sizeBytes;
        }

        public ObjectRef ref() {
            return ref;
        }

        public FakeObject writes(long inserts, long updates, long deletes) {
            this.writes = new ModificationCounters(inserts, updates, deletes);
            return this;
        }

        public FakeObject unmonitored() {
            this.writes = null;
            this.reads = null;
            return this;
        }

        public FakeObject reads(long logical, long physical) {
            this.reads = new ReadCounters(logical, physical);
            return this;
        }

        public FakeObject ratio(Encoding encoding, double ratio) {
            this.ratios.put(encoding, ratio);
            return this;
        }

        public FakeObject unsupported(Encoding encoding) {
            this.unsupported.add(encoding);
            return this;
        }

        public FakeObject encoding(Encoding encoding) {
            this.encoding = encoding;
            return this;
        }

        public FakeObject storageArea(String storageArea) {
            this.storageArea = storageArea;
            return this;
        }

        public FakeObject notCompressible(String detail) {
            this.compressible = false;
            this.detail = detail;
            return this;
        }

        public FakeObject locked(boolean locked) {
            this.locked = locked;
            return this;
        }

        public FakeObject metricsDelay(Duration delay) {
            this.metricsDelay = delay;
            return this;
        }

        public FakeObject metricsFailure(String message) {
            this.metricsFailure = message;
            return this;
        }

        public FakeObject countersFailure(String message) {
            this.countersFailure = message;
            return this;
        }

        public Encoding currentEncoding() {
            return encoding;
        }

        public long size() {
            return size;
        }
    }
}
