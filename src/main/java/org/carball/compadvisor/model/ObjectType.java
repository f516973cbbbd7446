package org.carball.compadvisor.model;

/**
 * Kinds of database objects the advisor can analyze and compress.
 */
public enum ObjectType {
    TABLE("Table"),
    INDEX("Index"),
    LOB("LOB column");

    private final String displayName;

    ObjectType(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Finds an object type by name (case-insensitive), accepting "LOB_COLUMN" as an alias of LOB.
     */
    public static ObjectType fromName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Object type must not be null");
        }
        String normalized = name.trim().toUpperCase().replace(' ', '_');
        if ("LOB_COLUMN".equals(normalized)) {
            return LOB;
        }
        for (ObjectType type : values()) {
            if (type.name().equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown object type: " + name + ". Use TABLE, INDEX or LOB");
    }
}
