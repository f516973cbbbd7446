package org.carball.compadvisor.model;

/**
 * One entry of the engine's object catalog, used to build the analysis scope.
 *
 * @param compressible false for objects the engine cannot compress (non-B-tree indexes, BasicFiles LOBs)
 * @param detail       engine-specific subtype shown when the object is skipped
 */
public record CatalogObject(
        ObjectRef ref,
        long sizeBytes,
        boolean compressible,
        String detail
) {}
