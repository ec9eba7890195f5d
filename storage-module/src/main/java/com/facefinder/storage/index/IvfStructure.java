package com.facefinder.storage.index;

import com.facefinder.common.model.FaceRecord;
import com.facefinder.common.model.IndexKind;
import com.facefinder.common.model.IndexSnapshot;
import com.facefinder.storage.similarity.VectorSimilarity;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

/**
 * Приближённый индекс: инвертированные списки по кластерам k-means.
 * Запрос просматривает {@code probeCount} ближайших кластеров;
 * если {@code k} покрывает весь индекс, просматриваются все.
 */
final class IvfStructure implements SearchStructure {

    private final int dimension;
    private final float[][] centroids;
    private final FaceRecord[][] lists;
    private final int probeCount;
    private final long trainedOn;
    private final int size;
    private final KMeansQuantizer quantizer;
    private final VectorSimilarity similarity;

    private IvfStructure(int dimension, float[][] centroids, FaceRecord[][] lists, int probeCount,
                         long trainedOn, KMeansQuantizer quantizer, VectorSimilarity similarity) {
        this.dimension = dimension;
        this.centroids = centroids;
        this.lists = lists;
        this.probeCount = probeCount;
        this.trainedOn = trainedOn;
        this.quantizer = quantizer;
        this.similarity = similarity;
        int total = 0;
        for (FaceRecord[] list : lists) {
            total += list.length;
        }
        this.size = total;
    }

    /**
     * Обучить квантизатор на {@code corpus} и разложить векторы по кластерам
     */
    static IvfStructure train(int dimension, List<FaceRecord> corpus, int clusterCount, int probeCount,
                              KMeansQuantizer quantizer, VectorSimilarity similarity) {
        List<float[]> vectors = new ArrayList<>(corpus.size());
        for (FaceRecord record : corpus) {
            vectors.add(record.embedding());
        }
        float[][] centroids = quantizer.train(vectors, clusterCount);

        List<List<FaceRecord>> buckets = new ArrayList<>(centroids.length);
        for (int c = 0; c < centroids.length; c++) {
            buckets.add(new ArrayList<>());
        }
        for (FaceRecord record : corpus) {
            buckets.get(quantizer.nearest(centroids, record.embedding())).add(record);
        }

        FaceRecord[][] lists = new FaceRecord[centroids.length][];
        for (int c = 0; c < centroids.length; c++) {
            lists[c] = buckets.get(c).toArray(new FaceRecord[0]);
        }
        return new IvfStructure(dimension, centroids, lists, probeCount, corpus.size(), quantizer, similarity);
    }

    /**
     * Собрать структуру из сохранённых центроидов и готовых списков
     */
    static IvfStructure restore(int dimension, float[][] centroids, FaceRecord[][] lists, int probeCount,
                                long trainedOn, KMeansQuantizer quantizer, VectorSimilarity similarity) {
        if (centroids.length != lists.length) {
            throw new IllegalArgumentException("Centroid and list counts differ");
        }
        return new IvfStructure(dimension, centroids, lists, probeCount, trainedOn, quantizer, similarity);
    }

    @Override
    public IndexKind kind() {
        return IndexKind.APPROXIMATE;
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public int size() {
        return size;
    }

    @Override
    public int clusterCount() {
        return centroids.length;
    }

    @Override
    public boolean trained() {
        return centroids.length > 0;
    }

    long trainedOn() {
        return trainedOn;
    }

    int probeCount() {
        return probeCount;
    }

    @Override
    public List<ScoredFace> search(float[] query, int k, double threshold, Set<Long> excluded) {
        TopKCollector collector = new TopKCollector(k, threshold);
        if (!trained()) {
            return collector.results();
        }

        int[] probes;
        if (k >= size - excluded.size()) {
            probes = new int[centroids.length];
            for (int c = 0; c < probes.length; c++) {
                probes[c] = c;
            }
        } else {
            probes = quantizer.nearest(centroids, query, probeCount);
        }

        for (int cluster : probes) {
            for (FaceRecord entry : lists[cluster]) {
                if (excluded.contains(entry.id())) {
                    continue;
                }
                collector.offer(entry, similarity.innerProduct(query, entry.embedding()));
            }
        }
        return collector.results();
    }

    @Override
    public SearchStructure withAdded(List<FaceRecord> records) {
        if (!trained()) {
            throw new IllegalStateException("Approximate index must be trained before inserting");
        }
        FaceRecord[][] grown = Arrays.copyOf(lists, lists.length);
        List<List<FaceRecord>> additions = new ArrayList<>(lists.length);
        for (int c = 0; c < lists.length; c++) {
            additions.add(null);
        }
        for (FaceRecord record : records) {
            int cluster = quantizer.nearest(centroids, record.embedding());
            if (additions.get(cluster) == null) {
                additions.set(cluster, new ArrayList<>());
            }
            additions.get(cluster).add(record);
        }
        for (int c = 0; c < lists.length; c++) {
            List<FaceRecord> added = additions.get(c);
            if (added == null) {
                continue;
            }
            FaceRecord[] list = Arrays.copyOf(lists[c], lists[c].length + added.size());
            for (int i = 0; i < added.size(); i++) {
                list[lists[c].length + i] = added.get(i);
            }
            grown[c] = list;
        }
        return new IvfStructure(dimension, centroids, grown, probeCount, trainedOn, quantizer, similarity);
    }

    @Override
    public long[] ids() {
        long[] ids = new long[size];
        int i = 0;
        for (FaceRecord[] list : lists) {
            for (FaceRecord entry : list) {
                ids[i++] = entry.id();
            }
        }
        return ids;
    }

    @Override
    public IndexSnapshot toSnapshot(Set<Long> tombstones) {
        long[][] listIds = new long[lists.length][];
        for (int c = 0; c < lists.length; c++) {
            listIds[c] = Arrays.stream(lists[c]).mapToLong(FaceRecord::id).toArray();
        }
        return IndexSnapshot.builder()
            .dimension(dimension)
            .kind(IndexKind.APPROXIMATE)
            .trained(trained())
            .probeCount(probeCount)
            .trainedOn(trainedOn)
            .centroids(centroids)
            .lists(listIds)
            .tombstones(tombstones.stream().mapToLong(Long::longValue).sorted().toArray())
            .build();
    }
}
