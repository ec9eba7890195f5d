package com.facefinder.storage.index;

import com.facefinder.common.exception.DimensionMismatchException;
import com.facefinder.common.model.FaceRecord;
import com.facefinder.common.model.IndexKind;
import com.facefinder.common.model.IndexSnapshot;
import com.facefinder.common.model.NewFace;
import com.facefinder.common.model.RoomInfo;
import com.facefinder.common.serialization.IndexSnapshotDeserializer;
import com.facefinder.common.serialization.IndexSnapshotSerializer;
import com.facefinder.storage.TestFaces;
import com.facefinder.storage.config.StorageProperties;
import com.facefinder.storage.kv.RocksDbEmbeddingStore;
import com.facefinder.storage.similarity.VectorSimilarity;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

import static com.facefinder.storage.TestFaces.axis;
import static com.facefinder.storage.TestFaces.face;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.offset;

class ClusteredVectorIndexTest {

    private static final String ROOM = "room";
    private static final int DIMENSION = 8;

    @TempDir
    Path tempDir;

    private final VectorSimilarity similarity = new VectorSimilarity();
    private RocksDbEmbeddingStore store;
    private StorageProperties properties;
    private IndexPersistence persistence;
    private ClusteredVectorIndex index;

    @BeforeEach
    void setUp() {
        properties = new StorageProperties();
        properties.setDataPath(tempDir.toString());
        properties.setApproximateThreshold(40);
        properties.setProbeCount(2);

        store = new RocksDbEmbeddingStore(similarity, properties);
        store.initialize();
        store.putRoomInfo(RoomInfo.forNewRoom(ROOM, "Room", DIMENSION));

        persistence = new IndexPersistence(new IndexSnapshotSerializer(), new IndexSnapshotDeserializer(),
            properties);
        index = newIndex();
        index.rebuild(ROOM);
    }

    @AfterEach
    void tearDown() {
        store.cleanup();
    }

    @Test
    void emptyIndexReturnsNothing() {
        assertThat(index.search(ROOM, axis(DIMENSION, 0), 10, 0.0)).isEmpty();
        assertThat(index.kind(ROOM)).isEqualTo(IndexKind.EXACT);
        assertThat(index.activeCount(ROOM)).isZero();
    }

    @Test
    @DisplayName("Results are ranked by similarity, ties by ascending id, threshold inclusive")
    void exactSearchRanking() {
        float[] diagonal = {1, 1, 0, 0, 0, 0, 0, 0};
        insert(List.of(
            face("a.jpg", axis(DIMENSION, 1)),
            face("b.jpg", axis(DIMENSION, 0)),
            face("c.jpg", diagonal),
            face("d.jpg", axis(DIMENSION, 0))));

        List<ScoredFace> results = index.search(ROOM, axis(DIMENSION, 0), 10, 0.5);

        assertThat(results).extracting(ScoredFace::id).containsExactly(2L, 4L, 3L);
        assertThat(results.get(0).similarity()).isCloseTo(1.0, offset(1e-6));
        assertThat(results.get(2).similarity()).isCloseTo(Math.sqrt(0.5), offset(1e-6));

        assertThat(index.search(ROOM, axis(DIMENSION, 0), 1, 0.0)).extracting(ScoredFace::id).containsExactly(2L);
        assertThat(index.search(ROOM, axis(DIMENSION, 0), 10, 1.0 - 1e-6)).hasSize(2);
    }

    @Test
    void queryIsNormalizedBeforeSearch() {
        insert(List.of(face("a.jpg", axis(DIMENSION, 3))));

        float[] query = new float[DIMENSION];
        query[3] = 25f;

        assertThat(index.search(ROOM, query, 1, 0.99)).hasSize(1);
    }

    @Test
    void wrongQueryDimensionFails() {
        insert(List.of(face("a.jpg", axis(DIMENSION, 0))));

        assertThatThrownBy(() -> index.search(ROOM, new float[DIMENSION + 1], 5, 0.0))
            .isInstanceOf(DimensionMismatchException.class);
        assertThatThrownBy(() -> index.search(ROOM, axis(DIMENSION, 0), 0, 0.0))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Crossing the threshold rebuilds from the whole store, not just the last batch")
    void migrationToApproximateKeepsEveryVector() {
        Random random = new Random(11);
        Set<Long> ids = new HashSet<>();
        for (int batch = 0; batch < 5; batch++) {
            ids.addAll(insert(TestFaces.randomFaces(random, 10, DIMENSION, "b" + batch + "-", 2)));
        }

        assertThat(index.kind(ROOM)).isEqualTo(IndexKind.APPROXIMATE);
        // trained when the fourth batch reached the threshold, the fifth was assigned to existing clusters
        assertThat(index.clusterCount(ROOM)).isEqualTo((int) Math.ceil(Math.sqrt(40)));
        assertThat(index.activeIds(ROOM)).isEqualTo(ids);
        assertThat(searchAllIds()).isEqualTo(ids);
    }

    @Test
    @DisplayName("Threshold 0 and k covering the corpus returns every active id once")
    void approximateFullScanReturnsEveryId() {
        Random random = new Random(5);
        List<Long> ids = insert(TestFaces.randomFaces(random, 120, DIMENSION, "p", 3));

        float[] query = TestFaces.randomNonNegativeUnit(random, DIMENSION);
        List<ScoredFace> results = index.search(ROOM, query, ids.size(), 0.0);

        assertThat(index.kind(ROOM)).isEqualTo(IndexKind.APPROXIMATE);
        assertThat(results).extracting(ScoredFace::id).doesNotHaveDuplicates().containsExactlyInAnyOrderElementsOf(ids);
    }

    @Test
    void approximateSearchFindsStoredVectorItself() {
        Random random = new Random(9);
        List<FaceRecord> records = store.appendBatch(ROOM, TestFaces.randomFaces(random, 200, DIMENSION, "p", 1));
        index.insert(ROOM, records);

        for (FaceRecord record : records.subList(0, 20)) {
            List<ScoredFace> top = index.search(ROOM, record.embedding(), 1, 0.0);
            assertThat(top).extracting(ScoredFace::id).containsExactly(record.id());
            assertThat(top.get(0).similarity()).isCloseTo(1.0, offset(1e-5));
        }
    }

    @Test
    @DisplayName("Quantizer is retrained once the corpus doubles")
    void retrainsAfterGrowth() {
        Random random = new Random(2);
        insert(TestFaces.randomFaces(random, 40, DIMENSION, "a", 1));
        assertThat(index.clusterCount(ROOM)).isEqualTo(7);

        insert(TestFaces.randomFaces(random, 20, DIMENSION, "b", 1));
        assertThat(index.clusterCount(ROOM)).isEqualTo(7);
        assertThat(index.activeCount(ROOM)).isEqualTo(60);

        insert(TestFaces.randomFaces(random, 20, DIMENSION, "c", 1));
        assertThat(index.clusterCount(ROOM)).isEqualTo((int) Math.ceil(Math.sqrt(80)));
        assertThat(index.activeCount(ROOM)).isEqualTo(80);
    }

    @Test
    void explicitRebuildOfApproximateIndexKeepsActiveIds() {
        Random random = new Random(21);
        insert(TestFaces.randomFaces(random, 90, DIMENSION, "p", 3));
        index.markDeleted(ROOM, store.removeByPhoto(ROOM, "p4.jpg"));
        Set<Long> before = index.activeIds(ROOM);
        assertThat(index.kind(ROOM)).isEqualTo(IndexKind.APPROXIMATE);

        index.rebuild(ROOM);

        assertThat(index.kind(ROOM)).isEqualTo(IndexKind.APPROXIMATE);
        assertThat(index.tombstoneCount(ROOM)).isZero();
        assertThat(index.activeIds(ROOM)).isEqualTo(before).hasSize(87);
        assertThat(searchAllIds()).isEqualTo(before);
    }

    @Test
    @DisplayName("Readers see only complete indexes while a writer crosses the approximate threshold")
    void concurrentReadersDuringMigration() throws Exception {
        int readers = 4;
        int batches = 30;
        ExecutorService executor = Executors.newFixedThreadPool(readers);
        AtomicBoolean writing = new AtomicBoolean(true);
        CountDownLatch started = new CountDownLatch(readers);
        List<Future<Integer>> results = new ArrayList<>();
        try {
            for (int r = 0; r < readers; r++) {
                results.add(executor.submit(() -> {
                    started.countDown();
                    int previous = 0;
                    int searches = 0;
                    while (writing.get() || searches == 0) {
                        List<ScoredFace> hits = index.search(ROOM, axis(DIMENSION, 0), Integer.MAX_VALUE, 0.0);
                        Set<Long> unique = hits.stream().map(ScoredFace::id).collect(Collectors.toSet());
                        assertThat(unique).hasSameSizeAs(hits);
                        // inserts only: a later snapshot never holds fewer faces
                        assertThat(hits.size()).isGreaterThanOrEqualTo(previous);
                        previous = hits.size();
                        searches++;
                    }
                    return searches;
                }));
            }
            assertThat(started.await(10, TimeUnit.SECONDS)).isTrue();

            Random random = new Random(33);
            for (int batch = 0; batch < batches; batch++) {
                insert(TestFaces.randomFaces(random, 5, DIMENSION, "b" + batch + "-", 1));
            }
            writing.set(false);

            for (Future<Integer> result : results) {
                assertThat(result.get(30, TimeUnit.SECONDS)).isPositive();
            }
        } finally {
            writing.set(false);
            executor.shutdownNow();
        }

        Set<Long> stored = store.allActive(ROOM).stream().map(FaceRecord::id).collect(Collectors.toSet());
        assertThat(index.kind(ROOM)).isEqualTo(IndexKind.APPROXIMATE);
        assertThat(index.activeIds(ROOM)).isEqualTo(stored).hasSize(batches * 5);
        assertThat(searchAllIds()).isEqualTo(stored);
    }

    @Test
    void markDeletedHidesFacesAndCompacts() {
        Random random = new Random(4);
        List<Long> ids = insert(TestFaces.randomFaces(random, 10, DIMENSION, "p", 1));

        List<Long> removed = store.removeByPhoto(ROOM, "p0.jpg");
        assertThat(index.markDeleted(ROOM, removed)).isEqualTo(1);
        assertThat(index.tombstoneCount(ROOM)).isEqualTo(1);
        assertThat(searchAllIds()).doesNotContain(ids.get(0)).hasSize(9);
        assertThat(index.markDeleted(ROOM, removed)).isZero();

        List<Long> more = new ArrayList<>(store.removeByPhoto(ROOM, "p1.jpg"));
        more.addAll(store.removeByPhoto(ROOM, "p2.jpg"));
        index.markDeleted(ROOM, more);

        // 3 of 10 tombstoned crosses the 20% compaction ratio
        assertThat(index.tombstoneCount(ROOM)).isZero();
        assertThat(index.activeCount(ROOM)).isEqualTo(7);
        assertThat(searchAllIds()).hasSize(7);
    }

    @Test
    void snapshotIsLoadedWithoutRebuild() {
        Random random = new Random(8);
        insert(TestFaces.randomFaces(random, 60, DIMENSION, "p", 2));
        index.markDeleted(ROOM, store.removeByPhoto(ROOM, "p0.jpg"));
        Set<Long> before = searchAllIds();
        float[] query = TestFaces.randomNonNegativeUnit(random, DIMENSION);
        List<Long> top = index.search(ROOM, query, 5, 0.0).stream().map(ScoredFace::id).toList();

        ClusteredVectorIndex reloaded = newIndex();

        assertThat(reloaded.load(ROOM)).isTrue();
        assertThat(reloaded.kind(ROOM)).isEqualTo(IndexKind.APPROXIMATE);
        assertThat(reloaded.clusterCount(ROOM)).isEqualTo(index.clusterCount(ROOM));
        assertThat(reloaded.tombstoneCount(ROOM)).isZero();
        assertThat(reloaded.activeIds(ROOM)).isEqualTo(before);
        assertThat(reloaded.search(ROOM, query, 5, 0.0)).extracting(ScoredFace::id).containsExactlyElementsOf(top);
    }

    @Test
    void corruptSnapshotTriggersRebuild() throws Exception {
        insert(List.of(face("a.jpg", axis(DIMENSION, 0)), face("b.jpg", axis(DIMENSION, 1))));
        Files.write(persistence.snapshotPath(ROOM), new byte[]{1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12, 13, 14});

        ClusteredVectorIndex reloaded = newIndex();

        assertThat(reloaded.load(ROOM)).isFalse();
        assertThat(reloaded.activeCount(ROOM)).isEqualTo(2);
        // the rebuild wrote a fresh snapshot
        assertThat(newIndex().load(ROOM)).isTrue();
    }

    @Test
    void snapshotOfAnotherDimensionIsDiscarded() {
        insert(List.of(face("a.jpg", axis(DIMENSION, 0))));
        persistence.save(ROOM, IndexSnapshot.builder()
            .dimension(DIMENSION * 2)
            .kind(IndexKind.EXACT)
            .trained(true)
            .lists(new long[][]{{1}})
            .build());

        ClusteredVectorIndex reloaded = newIndex();

        assertThat(reloaded.load(ROOM)).isFalse();
        assertThat(reloaded.search(ROOM, axis(DIMENSION, 0), 5, 0.5)).hasSize(1);
    }

    @Test
    @DisplayName("A snapshot that disagrees with the store is rebuilt")
    void staleSnapshotTriggersRebuild() {
        insert(List.of(face("a.jpg", axis(DIMENSION, 0)), face("b.jpg", axis(DIMENSION, 1))));
        // the store changes behind the index's back
        store.removeByPhoto(ROOM, "a.jpg");
        store.append(ROOM, face("c.jpg", axis(DIMENSION, 2)));

        ClusteredVectorIndex reloaded = newIndex();

        assertThat(reloaded.load(ROOM)).isFalse();
        assertThat(reloaded.activeIds(ROOM)).containsExactlyInAnyOrder(2L, 3L);
    }

    @Test
    void missingSnapshotBuildsFromStore() {
        properties.setPersistIndex(false);
        ClusteredVectorIndex fresh = newIndex();
        store.append(ROOM, face("a.jpg", axis(DIMENSION, 0)));
        persistence.delete(ROOM);

        assertThat(fresh.isLoaded(ROOM)).isFalse();
        assertThat(fresh.load(ROOM)).isFalse();
        assertThat(fresh.isLoaded(ROOM)).isTrue();
        assertThat(fresh.activeCount(ROOM)).isEqualTo(1);
    }

    @Test
    void clearRemovesSnapshot() {
        insert(List.of(face("a.jpg", axis(DIMENSION, 0))));
        assertThat(Files.exists(persistence.snapshotPath(ROOM))).isTrue();

        index.clear(ROOM);

        assertThat(index.isLoaded(ROOM)).isFalse();
        assertThat(Files.exists(persistence.snapshotPath(ROOM))).isFalse();
    }

    @Test
    void clusterCountHonoursConfiguration() {
        assertThat(index.clusterCountFor(50)).isEqualTo(8);
        assertThat(index.clusterCountFor(1)).isEqualTo(1);

        properties.setClusterCount(16);
        assertThat(newIndex().clusterCountFor(100)).isEqualTo(16);
        assertThat(newIndex().clusterCountFor(10)).isEqualTo(10);
    }

    private List<Long> insert(List<NewFace> faces) {
        List<FaceRecord> records = store.appendBatch(ROOM, faces);
        index.insert(ROOM, records);
        return records.stream().map(FaceRecord::id).collect(Collectors.toList());
    }

    private Set<Long> searchAllIds() {
        return index.search(ROOM, axis(DIMENSION, 0), Integer.MAX_VALUE, 0.0).stream()
            .map(ScoredFace::id)
            .collect(Collectors.toSet());
    }

    private ClusteredVectorIndex newIndex() {
        return new ClusteredVectorIndex(store, similarity, properties, persistence);
    }
}
