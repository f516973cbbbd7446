package org.carball.compadvisor.model;

/**
 * Identifies one analyzable object: a table, a single table partition, an index, or a LOB column.
 * <p>
 * For LOB columns {@code objectName} is the owning table and {@code columnName} the LOB column.
 */
public record ObjectRef(
        String owner,
        String objectName,
        ObjectType objectType,
        String partitionName,
        String columnName
) {

    public ObjectRef {
        if (owner == null || owner.isBlank()) {
            throw new IllegalArgumentException("Object owner must not be blank");
        }
        if (objectName == null || objectName.isBlank()) {
            throw new IllegalArgumentException("Object name must not be blank");
        }
        if (objectType == null) {
            throw new IllegalArgumentException("Object type must not be null");
        }
        if (objectType == ObjectType.LOB && (columnName == null || columnName.isBlank())) {
            throw new IllegalArgumentException("LOB reference requires a column name: " + owner + "." + objectName);
        }
    }

    public static ObjectRef table(String owner, String tableName) {
        return new ObjectRef(owner, tableName, ObjectType.TABLE, null, null);
    }

    public static ObjectRef partition(String owner, String tableName, String partitionName) {
        return new ObjectRef(owner, tableName, ObjectType.TABLE, partitionName, null);
    }

    public static ObjectRef index(String owner, String indexName) {
        return new ObjectRef(owner, indexName, ObjectType.INDEX, null, null);
    }

    public static ObjectRef lob(String owner, String tableName, String columnName) {
        return new ObjectRef(owner, tableName, ObjectType.LOB, null, columnName);
    }

    public boolean isPartition() {
        return partitionName != null && !partitionName.isBlank();
    }

    /**
     * OWNER.NAME, or OWNER.TABLE.COLUMN for LOB columns.
     */
    public String qualifiedName() {
        if (objectType == ObjectType.LOB) {
            return owner + "." + objectName + "." + columnName;
        }
        return owner + "." + objectName;
    }

    /**
     * Key under which at most one storage change may be in flight. Partitions and LOB columns
     * serialize on their table because the database locks the table for both.
     */
    public String lockKey() {
        String prefix = objectType == ObjectType.INDEX ? "INDEX:" : "TABLE:";
        return prefix + owner + "." + objectName;
    }

    @Override
    public String toString() {
        return isPartition() ? qualifiedName() + " (partition " + partitionName + ")" : qualifiedName();
    }
}
