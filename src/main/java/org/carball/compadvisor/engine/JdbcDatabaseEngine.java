package org.carball.compadvisor.engine;

import lombok.extern.slf4j.Slf4j;
import org.carball.compadvisor.model.CatalogObject;
import org.carball.compadvisor.model.Encoding;
import org.carball.compadvisor.model.ModificationCounters;
import org.carball.compadvisor.model.ObjectMetrics;
import org.carball.compadvisor.model.ObjectRef;
import org.carball.compadvisor.model.ObjectType;
import org.carball.compadvisor.model.PartitionMetrics;
import org.carball.compadvisor.model.ReadCounters;

import java.sql.*;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Oracle implementation of {@link DatabaseEngine} over the data dictionary views and
 * {@code DBMS_COMPRESSION}. Each call opens its own connection.
 */
@Slf4j
public class JdbcDatabaseEngine implements DatabaseEngine {

    private static final String LIST_TABLES = """
        SELECT t.owner, t.table_name, NVL(SUM(s.bytes), 0) AS size_bytes
        FROM dba_tables t
        JOIN dba_segments s ON s.owner = t.owner AND s.segment_name = t.table_name
        WHERE (? IS NULL OR t.owner = ?)
          AND t.temporary = 'N'
          AND s.segment_type IN ('TABLE', 'TABLE PARTITION')
        GROUP BY t.owner, t.table_name
    """;

    private static final String LIST_INDEXES = """
        SELECT i.owner, i.index_name, i.index_type, NVL(SUM(s.bytes), 0) AS size_bytes
        FROM dba_indexes i
        JOIN dba_segments s ON s.owner = i.owner AND s.segment_name = i.index_name
        WHERE (? IS NULL OR i.owner = ?)
          AND s.segment_type LIKE 'INDEX%'
        GROUP BY i.owner, i.index_name, i.index_type
    """;

    private static final String LIST_LOBS = """
        SELECT l.owner, l.table_name, l.column_name, l.securefile, NVL(SUM(s.bytes), 0) AS size_bytes
        FROM dba_lobs l
        JOIN dba_segments s ON s.owner = l.owner AND s.segment_name = l.segment_name
        WHERE (? IS NULL OR l.owner = ?)
        GROUP BY l.owner, l.table_name, l.column_name, l.securefile
    """;

    private static final String TABLE_METRICS = """
        SELECT t.compress_for, t.compression, t.tablespace_name, NVL(t.num_rows, 0) AS num_rows,
               NVL(t.blocks, 0) AS blocks,
               (SELECT NVL(SUM(bytes), 0) FROM dba_segments s
                 WHERE s.owner = t.owner AND s.segment_name = t.table_name
                   AND (? IS NULL OR s.partition_name = ?)) AS size_bytes
        FROM dba_tables t
        WHERE t.owner = ? AND t.table_name = ?
    """;

    private static final String TABLE_PARTITIONS = """
        SELECT p.partition_name, p.compress_for, p.tablespace_name,
               (SELECT NVL(SUM(bytes), 0) FROM dba_segments s
                 WHERE s.owner = p.table_owner AND s.segment_name = p.table_name
                   AND s.partition_name = p.partition_name) AS size_bytes
        FROM dba_tab_partitions p
        WHERE p.table_owner = ? AND p.table_name = ?
        ORDER BY p.partition_position
    """;

    private static final String INDEX_METRICS = """
        SELECT i.compression, i.tablespace_name, NVL(i.num_rows, 0) AS num_rows,
               NVL(i.leaf_blocks, 0) AS blocks,
               (SELECT NVL(SUM(bytes), 0) FROM dba_segments s
                 WHERE s.owner = i.owner AND s.segment_name = i.index_name) AS size_bytes
        FROM dba_indexes i
        WHERE i.owner = ? AND i.index_name = ?
    """;

    private static final String LOB_METRICS = """
        SELECT l.compression, l.tablespace_name,
               (SELECT NVL(SUM(bytes), 0) FROM dba_segments s
                 WHERE s.owner = l.owner AND s.segment_name = l.segment_name) AS size_bytes
        FROM dba_lobs l
        WHERE l.owner = ? AND l.table_name = ? AND l.column_name = ?
    """;

    private static final String READ_COUNTERS = """
        SELECT NVL(SUM(CASE WHEN statistic_name = 'logical reads' THEN value ELSE 0 END), 0) AS logical_reads,
               NVL(SUM(CASE WHEN statistic_name = 'physical reads' THEN value ELSE 0 END), 0) AS physical_reads,
               COUNT(*) AS samples
        FROM v$segment_statistics
        WHERE owner = ? AND object_name = ?
    """;

    private static final String MODIFICATION_COUNTERS = """
        SELECT NVL(inserts, 0) AS inserts, NVL(updates, 0) AS updates, NVL(deletes, 0) AS deletes
        FROM all_tab_modifications
        WHERE table_owner = ? AND table_name = ?
          AND ((? IS NULL AND partition_name IS NULL) OR partition_name = ?)
          AND timestamp >= SYSDATE - ?
    """;

    private static final String LOCK_COUNT = """
        SELECT COUNT(*)
        FROM v$locked_object l
        JOIN dba_objects o ON l.object_id = o.object_id
        WHERE o.owner = ? AND o.object_name = ?
          AND l.session_id <> SYS_CONTEXT('USERENV', 'SID')
    """;

    private static final String FREE_SPACE = """
        SELECT NVL(SUM(bytes), 0) FROM dba_free_space WHERE tablespace_name = ?
    """;

    private static final String TABLE_INDEXES = """
        SELECT owner, index_name FROM dba_indexes
        WHERE table_owner = ? AND table_name = ?
          AND index_type NOT IN ('LOB', 'IOT - TOP')
        ORDER BY index_name
    """;

    private static final String ESTIMATE_SEGMENT = """
        DECLARE
          v_blkcnt_cmp   PLS_INTEGER;
          v_blkcnt_uncmp PLS_INTEGER;
          v_row_cmp      PLS_INTEGER;
          v_row_uncmp    PLS_INTEGER;
          v_ratio        NUMBER;
          v_comptype     VARCHAR2(200);
          v_scratch      VARCHAR2(128);
        BEGIN
          SELECT default_tablespace INTO v_scratch FROM dba_users WHERE username = ?;
          DBMS_COMPRESSION.GET_COMPRESSION_RATIO(
            scratchtbsname => v_scratch,
            ownname        => ?,
            objname        => ?,
            subobjname     => ?,
            comptype       => %s,
            blkcnt_cmp     => v_blkcnt_cmp,
            blkcnt_uncmp   => v_blkcnt_uncmp,
            row_cmp        => v_row_cmp,
            row_uncmp      => v_row_uncmp,
            cmp_ratio      => v_ratio,
            comptype_str   => v_comptype,
            subset_numrows => ?,
            objtype        => %s);
          ? := v_ratio;
        END;
    """;

    private static final String ESTIMATE_LOB = """
        DECLARE
          v_blkcnt_cmp   PLS_INTEGER;
          v_blkcnt_uncmp PLS_INTEGER;
          v_lobcnt       PLS_INTEGER;
          v_ratio        NUMBER;
          v_comptype     VARCHAR2(200);
          v_scratch      VARCHAR2(128);
        BEGIN
          SELECT default_tablespace INTO v_scratch FROM dba_users WHERE username = ?;
          DBMS_COMPRESSION.GET_COMPRESSION_RATIO(
            scratchtbsname => v_scratch,
            tabowner       => ?,
            tabname        => ?,
            lobname        => ?,
            partname       => NULL,
            comptype       => %s,
            blkcnt_cmp     => v_blkcnt_cmp,
            blkcnt_uncmp   => v_blkcnt_uncmp,
            lobcnt         => v_lobcnt,
            cmp_ratio      => v_ratio,
            comptype_str   => v_comptype,
            subset_numrows => ?);
          ? := v_ratio;
        END;
    """;

    private final String connectionString;

    public JdbcDatabaseEngine(String connectionString) {
        this.connectionString = connectionString;
    }

    @Override
    public List<CatalogObject> listObjects(String owner) throws EngineException {
        List<CatalogObject> objects = new ArrayList<>();
        try (Connection conn = connect()) {
            try (PreparedStatement stmt = conn.prepareStatement(LIST_TABLES)) {
                bindOwner(stmt, owner);
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        objects.add(new CatalogObject(
                                ObjectRef.table(rs.getString("owner"), rs.getString("table_name")),
                                rs.getLong("size_bytes"), true, "TABLE"));
                    }
                }
            }
            try (PreparedStatement stmt = conn.prepareStatement(LIST_INDEXES)) {
                bindOwner(stmt, owner);
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        String indexType = rs.getString("index_type");
                        boolean btree = "NORMAL".equals(indexType) || "NORMAL/REV".equals(indexType);
                        objects.add(new CatalogObject(
                                ObjectRef.index(rs.getString("owner"), rs.getString("index_name")),
                                rs.getLong("size_bytes"), btree, indexType));
                    }
                }
            }
            try (PreparedStatement stmt = conn.prepareStatement(LIST_LOBS)) {
                bindOwner(stmt, owner);
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        boolean secureFile = "YES".equals(rs.getString("securefile"));
                        objects.add(new CatalogObject(
                                ObjectRef.lob(rs.getString("owner"), rs.getString("table_name"), rs.getString("column_name")),
                                rs.getLong("size_bytes"), secureFile, secureFile ? "SECUREFILE" : "BASICFILE"));
                    }
                }
            }
        } catch (SQLException e) {
            throw new EngineException("Failed to list objects for " + (owner != null ? owner : "all schemas")
                    + ": " + e.getMessage(), e);
        }
        log.debug("Catalog returned {} objects for owner {}", objects.size(), owner);
        return objects;
    }

    @Override
    public Optional<ObjectMetrics> getObjectMetrics(ObjectRef ref) throws EngineException {
        try (Connection conn = connect()) {
            return switch (ref.objectType()) {
                case TABLE -> tableMetrics(conn, ref);
                case INDEX -> indexMetrics(conn, ref);
                case LOB -> lobMetrics(conn, ref);
            };
        } catch (SQLException e) {
            throw new EngineException("Failed to read metrics for " + ref + ": " + e.getMessage(), e);
        }
    }

    private Optional<ObjectMetrics> tableMetrics(Connection conn, ObjectRef ref) throws SQLException {
        ObjectMetrics.ObjectMetricsBuilder builder = ObjectMetrics.builder().ref(ref);
        try (PreparedStatement stmt = conn.prepareStatement(TABLE_METRICS)) {
            stmt.setString(1, ref.partitionName());
            stmt.setString(2, ref.partitionName());
            stmt.setString(3, ref.owner());
            stmt.setString(4, ref.objectName());
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                String compressFor = "ENABLED".equals(rs.getString("compression")) ? rs.getString("compress_for") : null;
                builder.currentEncoding(Encoding.fromDictionary(compressFor, ObjectType.TABLE))
                        .storageArea(rs.getString("tablespace_name"))
                        .rowCount(rs.getLong("num_rows"))
                        .blockCount(rs.getLong("blocks"))
                        .sizeBytes(rs.getLong("size_bytes"));
            }
        }

        List<PartitionMetrics> partitions = new ArrayList<>();
        try (PreparedStatement stmt = conn.prepareStatement(TABLE_PARTITIONS)) {
            stmt.setString(1, ref.owner());
            stmt.setString(2, ref.objectName());
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    PartitionMetrics partition = new PartitionMetrics(
                            rs.getString("partition_name"),
                            rs.getLong("size_bytes"),
                            Encoding.fromDictionary(rs.getString("compress_for"), ObjectType.TABLE),
                            rs.getString("tablespace_name"));
                    if (ref.isPartition() && ref.partitionName().equals(partition.partitionName())) {
                        builder.currentEncoding(partition.currentEncoding()).storageArea(partition.storageArea());
                    }
                    partitions.add(partition);
                }
            }
        }
        if (!ref.isPartition()) {
            builder.partitions(partitions);
        } else if (partitions.stream().noneMatch(p -> p.partitionName().equals(ref.partitionName()))) {
            return Optional.empty();
        }

        builder.readCounters(readCounters(conn, ref).orElse(null));
        return Optional.of(builder.build());
    }

    private Optional<ObjectMetrics> indexMetrics(Connection conn, ObjectRef ref) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(INDEX_METRICS)) {
            stmt.setString(1, ref.owner());
            stmt.setString(2, ref.objectName());
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(ObjectMetrics.builder()
                        .ref(ref)
                        .currentEncoding(Encoding.fromDictionary(rs.getString("compression"), ObjectType.INDEX))
                        .storageArea(rs.getString("tablespace_name"))
                        .rowCount(rs.getLong("num_rows"))
                        .blockCount(rs.getLong("blocks"))
                        .sizeBytes(rs.getLong("size_bytes"))
                        .readCounters(readCounters(conn, ref).orElse(null))
                        .build());
            }
        }
    }

    private Optional<ObjectMetrics> lobMetrics(Connection conn, ObjectRef ref) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(LOB_METRICS)) {
            stmt.setString(1, ref.owner());
            stmt.setString(2, ref.objectName());
            stmt.setString(3, ref.columnName());
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(ObjectMetrics.builder()
                        .ref(ref)
                        .currentEncoding(Encoding.fromDictionary(rs.getString("compression"), ObjectType.LOB))
                        .storageArea(rs.getString("tablespace_name"))
                        .sizeBytes(rs.getLong("size_bytes"))
                        .build());
            }
        }
    }

    private Optional<ReadCounters> readCounters(Connection conn, ObjectRef ref) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(READ_COUNTERS)) {
            stmt.setString(1, ref.owner());
            stmt.setString(2, ref.objectName());
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next() || rs.getLong("samples") == 0) {
                    return Optional.empty();
                }
                return Optional.of(new ReadCounters(rs.getLong("logical_reads"), rs.getLong("physical_reads")));
            }
        }
    }

    @Override
    public Optional<ModificationCounters> listModificationCounters(ObjectRef ref, Duration sinceWindow) throws EngineException {
        try (Connection conn = connect()) {
            try (CallableStatement flush = conn.prepareCall("BEGIN DBMS_STATS.FLUSH_DATABASE_MONITORING_INFO; END;")) {
                flush.execute();
            }
            try (PreparedStatement stmt = conn.prepareStatement(MODIFICATION_COUNTERS)) {
                stmt.setString(1, ref.owner());
                stmt.setString(2, ref.objectName());
                stmt.setString(3, ref.partitionName());
                stmt.setString(4, ref.partitionName());
                stmt.setDouble(5, sinceWindow.toMinutes() / (24.0 * 60.0));
                try (ResultSet rs = stmt.executeQuery()) {
                    if (!rs.next()) {
                        return Optional.empty();
                    }
                    return Optional.of(new ModificationCounters(
                            rs.getLong("inserts"), rs.getLong("updates"), rs.getLong("deletes")));
                }
            }
        } catch (SQLException e) {
            throw new EngineException("Failed to read modification counters for " + ref + ": " + e.getMessage(), e);
        }
    }

    @Override
    public RatioSample estimateCompressionRatio(ObjectRef ref, Encoding encoding, long sampleSize) throws EngineException {
        String block = ref.objectType() == ObjectType.LOB
                ? String.format(ESTIMATE_LOB, compTypeConstant(encoding))
                : String.format(ESTIMATE_SEGMENT, compTypeConstant(encoding),
                        ref.objectType() == ObjectType.INDEX ? "DBMS_COMPRESSION.OBJTYPE_INDEX" : "DBMS_COMPRESSION.OBJTYPE_TABLE");

        try (Connection conn = connect();
             CallableStatement stmt = conn.prepareCall(block)) {
            int i = 1;
            stmt.setString(i++, ref.owner());
            stmt.setString(i++, ref.owner());
            stmt.setString(i++, ref.objectName());
            stmt.setString(i++, ref.objectType() == ObjectType.LOB ? ref.columnName() : ref.partitionName());
            stmt.setLong(i++, sampleSize);
            stmt.registerOutParameter(i, Types.NUMERIC);
            stmt.execute();

            double ratio = stmt.getDouble(i);
            if (ratio <= 0) {
                throw new EngineException("Engine returned no ratio for " + encoding + " on " + ref);
            }
            long size = getObjectMetrics(ref).map(ObjectMetrics::getSizeBytes).orElse(0L);
            return new RatioSample(ratio, Math.round(size / ratio));
        } catch (SQLException e) {
            throw new EngineException("Ratio estimation for " + encoding + " on " + ref + " failed: " + e.getMessage(), e);
        }
    }

    private static String compTypeConstant(Encoding encoding) {
        return switch (encoding) {
            case BASIC -> "DBMS_COMPRESSION.COMP_BASIC";
            case OLTP -> "DBMS_COMPRESSION.COMP_ADVANCED";
            case QUERY_LOW -> "DBMS_COMPRESSION.COMP_QUERY_LOW";
            case QUERY_HIGH -> "DBMS_COMPRESSION.COMP_QUERY_HIGH";
            case ARCHIVE_LOW -> "DBMS_COMPRESSION.COMP_ARCHIVE_LOW";
            case ARCHIVE_HIGH -> "DBMS_COMPRESSION.COMP_ARCHIVE_HIGH";
            case INDEX_ADVANCED_LOW -> "DBMS_COMPRESSION.COMP_INDEX_ADVANCED_LOW";
            case INDEX_ADVANCED_HIGH -> "DBMS_COMPRESSION.COMP_INDEX_ADVANCED_HIGH";
            case LOB_LOW -> "DBMS_COMPRESSION.COMP_LOB_LOW";
            case LOB_MEDIUM -> "DBMS_COMPRESSION.COMP_LOB_MEDIUM";
            case LOB_HIGH -> "DBMS_COMPRESSION.COMP_LOB_HIGH";
            case NONE -> "DBMS_COMPRESSION.COMP_NOCOMPRESS";
        };
    }

    @Override
    public void executeStatement(String statement, Duration timeout) throws EngineException {
        // JDBC rejects the trailing terminator used in listings
        String sql = statement.endsWith(";") ? statement.substring(0, statement.length() - 1) : statement;
        try (Connection conn = connect();
             Statement stmt = conn.createStatement()) {
            if (timeout != null && !timeout.isZero()) {
                stmt.setQueryTimeout((int) Math.max(1, timeout.toSeconds()));
            }
            stmt.execute(sql);
        } catch (SQLTimeoutException e) {
            throw new EngineException("Statement timed out after " + timeout + ": " + e.getMessage(), e);
        } catch (SQLException e) {
            throw new EngineException(e.getMessage(), e);
        }
    }

    @Override
    public boolean isLocked(ObjectRef ref) throws EngineException {
        try (Connection conn = connect();
             PreparedStatement stmt = conn.prepareStatement(LOCK_COUNT)) {
            stmt.setString(1, ref.owner());
            stmt.setString(2, ref.objectName());
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() && rs.getInt(1) > 0;
            }
        } catch (SQLException e) {
            throw new EngineException("Failed to check locks on " + ref + ": " + e.getMessage(), e);
        }
    }

    @Override
    public long freeBytes(String storageArea) throws EngineException {
        try (Connection conn = connect();
             PreparedStatement stmt = conn.prepareStatement(FREE_SPACE)) {
            stmt.setString(1, storageArea);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0;
            }
        } catch (SQLException e) {
            throw new EngineException("Failed to read free space of " + storageArea + ": " + e.getMessage(), e);
        }
    }

    @Override
    public List<ObjectRef> listIndexes(String owner, String tableName) throws EngineException {
        List<ObjectRef> indexes = new ArrayList<>();
        try (Connection conn = connect();
             PreparedStatement stmt = conn.prepareStatement(TABLE_INDEXES)) {
            stmt.setString(1, owner);
            stmt.setString(2, tableName);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    indexes.add(ObjectRef.index(rs.getString("owner"), rs.getString("index_name")));
                }
            }
        } catch (SQLException e) {
            throw new EngineException("Failed to list indexes of " + owner + "." + tableName + ": " + e.getMessage(), e);
        }
        return indexes;
    }

    private Connection connect() throws SQLException {
        return DriverManager.getConnection(connectionString);
    }

    private static void bindOwner(PreparedStatement stmt, String owner) throws SQLException {
        stmt.setString(1, owner);
        stmt.setString(2, owner);
    }
}
