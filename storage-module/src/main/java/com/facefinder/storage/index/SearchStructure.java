package com.facefinder.storage.index;

import com.facefinder.common.model.FaceRecord;
import com.facefinder.common.model.IndexKind;
import com.facefinder.common.model.IndexSnapshot;

import java.util.List;
import java.util.Set;

/**
 * Immutable in-memory search structure of one room.
 * Mutations return a new structure; the current one stays valid for readers still using it.
 */
interface SearchStructure {

    IndexKind kind();

    int dimension();

    /** Number of indexed entries, tombstoned ones included */
    int size();

    int clusterCount();

    boolean trained();

    /**
     * @param query    unit-length query vector
     * @param excluded ids skipped during the scan
     */
    List<ScoredFace> search(float[] query, int k, double threshold, Set<Long> excluded);

    SearchStructure withAdded(List<FaceRecord> records);

    /** Ids of every indexed entry */
    long[] ids();

    IndexSnapshot toSnapshot(Set<Long> tombstones);
}
