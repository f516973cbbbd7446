package org.carball.compadvisor.ddl;

import lombok.Getter;
import org.carball.compadvisor.model.ObjectRef;
import org.carball.compadvisor.model.ObjectType;

/**
 * Statement shapes per kind of object. Each template renders from its request alone.
 */
@Getter
public enum DdlTemplate {

    TABLE("ALTER TABLE ") {
        @Override
        public String render(DdlRequest request) {
            return prefix + request.ref().qualifiedName() + " MOVE " + request.encoding().getStorageClause()
                    + storageArea(request) + online(request) + ";";
        }
    },

    PARTITION("ALTER TABLE ") {
        @Override
        public String render(DdlRequest request) {
            ObjectRef ref = request.ref();
            return prefix + ref.qualifiedName() + " MOVE PARTITION " + ref.partitionName() + " "
                    + request.encoding().getStorageClause() + storageArea(request) + online(request) + ";";
        }
    },

    INDEX("ALTER INDEX ") {
        @Override
        public String render(DdlRequest request) {
            return prefix + request.ref().qualifiedName() + " REBUILD " + request.encoding().getStorageClause()
                    + storageArea(request) + online(request) + ";";
        }
    },

    LOB("ALTER TABLE ") {
        @Override
        public String render(DdlRequest request) {
            ObjectRef ref = request.ref();
            return prefix + ref.owner() + "." + ref.objectName() + " MODIFY LOB (" + ref.columnName() + ") ("
                    + request.encoding().getStorageClause() + ");";
        }
    };

    protected final String prefix;

    DdlTemplate(String prefix) {
        this.prefix = prefix;
    }

    public abstract String render(DdlRequest request);

    public static DdlTemplate forRef(ObjectRef ref) {
        if (ref.objectType() == ObjectType.TABLE) {
            return ref.isPartition() ? PARTITION : TABLE;
        }
        return ref.objectType() == ObjectType.INDEX ? INDEX : LOB;
    }

    static String storageArea(DdlRequest request) {
        String area = request.storageArea();
        return area == null || area.isBlank() ? "" : " TABLESPACE " + area;
    }

    static String online(DdlRequest request) {
        return request.online() ? " ONLINE" : "";
    }
}
