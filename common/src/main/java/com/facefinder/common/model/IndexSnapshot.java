package com.facefinder.common.model;

import lombok.Builder;

/**
 * Persistable shape of a room index. Raw vectors are not part of the snapshot:
 * ids are resolved against the embedding store when the index is loaded.
 *
 * @param dimension  dimension tag, checked against the room on load
 * @param centroids  quantizer centroids, empty for an exact index
 * @param lists      face ids per cluster; an exact index has exactly one list
 * @param trainedOn  number of faces the quantizer was trained on
 * @param tombstones ids still present in the lists but logically deleted
 */
@Builder
public record IndexSnapshot(
    int dimension,
    IndexKind kind,
    boolean trained,
    int probeCount,
    long trainedOn,
    float[][] centroids,
    long[][] lists,
    long[] tombstones
) {
    public IndexSnapshot {
        if (dimension <= 0) {
            throw new IllegalArgumentException("Dimension must be positive");
        }
        if (kind == null) {
            throw new IllegalArgumentException("Index kind is required");
        }
        centroids = centroids == null ? new float[0][] : centroids;
        lists = lists == null ? new long[0][] : lists;
        tombstones = tombstones == null ? new long[0] : tombstones;
    }

    public int entryCount() {
        int count = 0;
        for (long[] list : lists) {
            count += list.length;
        }
        return count;
    }
}
