package com.facefinder.storage.index;

import com.facefinder.common.model.FaceRecord;
import com.facefinder.common.model.IndexKind;
import com.facefinder.common.model.IndexSnapshot;
import com.facefinder.storage.similarity.VectorSimilarity;

import java.util.Arrays;
import java.util.List;
import java.util.Set;

/**
 * Exact index: linear inner-product scan over all entries.
 */
final class FlatStructure implements SearchStructure {

    private final int dimension;
    private final FaceRecord[] entries;
    private final VectorSimilarity similarity;

    private FlatStructure(int dimension, FaceRecord[] entries, VectorSimilarity similarity) {
        this.dimension = dimension;
        this.entries = entries;
        this.similarity = similarity;
    }

    static FlatStructure of(int dimension, List<FaceRecord> records, VectorSimilarity similarity) {
        return new FlatStructure(dimension, records.toArray(new FaceRecord[0]), similarity);
    }

    @Override
    public IndexKind kind() {
        return IndexKind.EXACT;
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public int size() {
        return entries.length;
    }

    @Override
    public int clusterCount() {
        return 0;
    }

    @Override
    public boolean trained() {
        return true;
    }

    @Override
    public List<ScoredFace> search(float[] query, int k, double threshold, Set<Long> excluded) {
        TopKCollector collector = new TopKCollector(k, threshold);
        for (FaceRecord entry : entries) {
            if (excluded.contains(entry.id())) {
                continue;
            }
            collector.offer(entry, similarity.innerProduct(query, entry.embedding()));
        }
        return collector.results();
    }

    @Override
    public SearchStructure withAdded(List<FaceRecord> records) {
        FaceRecord[] grown = Arrays.copyOf(entries, entries.length + records.size());
        for (int i = 0; i < records.size(); i++) {
            grown[entries.length + i] = records.get(i);
        }
        return new FlatStructure(dimension, grown, similarity);
    }

    @Override
    public long[] ids() {
        long[] ids = new long[entries.length];
        for (int i = 0; i < entries.length; i++) {
            ids[i] = entries[i].id();
        }
        return ids;
    }

    @Override
    public IndexSnapshot toSnapshot(Set<Long> tombstones) {
        return IndexSnapshot.builder()
            .dimension(dimension)
            .kind(IndexKind.EXACT)
            .trained(true)
            .probeCount(0)
            .trainedOn(0)
            .lists(new long[][]{ids()})
            .tombstones(tombstones.stream().mapToLong(Long::longValue).sorted().toArray())
            .build();
    }
}
