package com.facefinder.storage.service;

import com.facefinder.common.exception.DimensionMismatchException;
import com.facefinder.common.exception.RoomNotFoundException;
import com.facefinder.common.model.FaceHit;
import com.facefinder.common.model.FaceMetadata;
import com.facefinder.common.model.FaceRecord;
import com.facefinder.common.model.IndexKind;
import com.facefinder.common.model.RoomInfo;
import com.facefinder.common.model.RoomStats;
import com.facefinder.common.model.SearchQuery;
import com.facefinder.common.serialization.IndexSnapshotDeserializer;
import com.facefinder.common.serialization.IndexSnapshotSerializer;
import com.facefinder.storage.TestFaces;
import com.facefinder.storage.config.StorageProperties;
import com.facefinder.storage.index.ClusteredVectorIndex;
import com.facefinder.storage.index.IndexPersistence;
import com.facefinder.storage.index.VectorIndex;
import com.facefinder.storage.kv.RocksDbEmbeddingStore;
import com.facefinder.storage.similarity.VectorSimilarity;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.facefinder.storage.TestFaces.axis;
import static com.facefinder.storage.TestFaces.face;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.offset;

class FaceStorageServiceImplTest {

    private static final String ROOM = "wedding";

    @TempDir
    Path tempDir;

    private final VectorSimilarity similarity = new VectorSimilarity();
    private StorageProperties properties;
    private RocksDbEmbeddingStore store;
    private VectorIndex index;
    private FaceStorageServiceImpl service;

    @BeforeEach
    void setUp() {
        properties = new StorageProperties();
        properties.setDataPath(tempDir.toString());
        properties.setDimension(4);
        properties.setApproximateThreshold(30);
        properties.setProbeCount(2);
        start();
        service.createRoom(ROOM, "Wedding", null);
    }

    @AfterEach
    void tearDown() {
        store.cleanup();
    }

    @Test
    void initCreatesDefaultRoom() {
        assertThat(service.getRoomInfo("default")).isPresent();
        assertThat(service.listRooms()).extracting(RoomInfo::id).containsExactlyInAnyOrder("default", ROOM);
    }

    @Test
    void createRoomValidatesInput() {
        assertThat(service.getRoomInfo(ROOM).orElseThrow().dimension()).isEqualTo(4);

        assertThatThrownBy(() -> service.createRoom(ROOM, "again", null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.createRoom("bad id!", "x", null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.createRoom("r", "x", 0))
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(service.createRoom("wide", null, 512).name()).isEqualTo("wide");
    }

    @Test
    void concurrentCreatesOfSameRoomLetExactlyOneWin() throws Exception {
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<RoomInfo>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                String name = "Party " + i;
                futures.add(executor.submit(() -> {
                    start.await();
                    return service.createRoom("party", name, null);
                }));
            }
            start.countDown();

            List<RoomInfo> created = new ArrayList<>();
            int rejected = 0;
            for (Future<RoomInfo> future : futures) {
                try {
                    created.add(future.get(10, TimeUnit.SECONDS));
                } catch (ExecutionException e) {
                    assertThat(e.getCause()).isInstanceOf(IllegalArgumentException.class)
                        .hasMessageContaining("already exists");
                    rejected++;
                }
            }

            assertThat(created).hasSize(1);
            assertThat(rejected).isEqualTo(threads - 1);
            assertThat(service.getRoomInfo("party").orElseThrow().name()).isEqualTo(created.get(0).name());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("Query identical to one of p1's faces at 0.99 finds only that face")
    void twoPhotoScenario() {
        service.insertBatch(ROOM, List.of(
            face("p1.jpg", 1, 0, 0, 0),
            face("p1.jpg", 0, 1, 0, 0),
            face("p1.jpg", 0, 0, 1, 0),
            face("p2.jpg", 0, 0, 0, 1),
            face("p2.jpg", 1, 1, 0, 0)));

        List<FaceHit> hits = service.search(SearchQuery.withThreshold(new float[]{0, 1, 0, 0}, 10, ROOM, 0.99));

        assertThat(hits).hasSize(1);
        assertThat(hits.get(0).photo()).isEqualTo("p1.jpg");
        assertThat(hits.get(0).faceId()).isEqualTo(2L);
        assertThat(hits.get(0).similarity()).isCloseTo(1.0, offset(1e-6));
        assertThat(hits.get(0).expanded()).isFalse();
    }

    @Test
    void deletedPhotoNeverComesBack() {
        service.insertBatch(ROOM, List.of(
            face("p1.jpg", 1, 0, 0, 0),
            face("p1.jpg", 0.9f, 0.1f, 0, 0),
            face("p2.jpg", 0.8f, 0.2f, 0, 0)));

        assertThat(service.deleteByPhoto(ROOM, "p1.jpg")).isEqualTo(2);
        assertThat(service.deleteByPhoto(ROOM, "p1.jpg")).isZero();

        List<FaceHit> hits = service.search(SearchQuery.withThreshold(axis(4, 0), 10, ROOM, 0.0));
        assertThat(hits).extracting(FaceHit::photo).containsOnly("p2.jpg");

        RoomStats stats = service.stats(ROOM);
        assertThat(stats.totalActive()).isEqualTo(1);
        assertThat(stats.tombstoned()).isEqualTo(2);
    }

    @Test
    void batchWithWrongDimensionIsRejectedWhole() {
        service.insert(ROOM, face("p1.jpg", 1, 0, 0, 0));

        assertThatThrownBy(() -> service.insertBatch(ROOM, List.of(
            face("p2.jpg", 0, 1, 0, 0),
            face("p2.jpg", 0, 1, 0))))
            .isInstanceOf(DimensionMismatchException.class);

        assertThat(service.stats(ROOM).totalActive()).isEqualTo(1);
        assertThatThrownBy(() -> service.search(SearchQuery.withThreshold(new float[]{1, 0}, 10, ROOM, 0.0)))
            .isInstanceOf(DimensionMismatchException.class);
    }

    @Test
    @DisplayName("Switching to the approximate index keeps every previously inserted face")
    void migrationKeepsAllFaces() {
        Random random = new Random(17);
        Set<Long> ids = new HashSet<>();
        for (int batch = 0; batch < 8; batch++) {
            service.insertBatch(ROOM, TestFaces.randomFaces(random, 10, 4, "b" + batch + "-", 5))
                .forEach(record -> ids.add(record.id()));
        }

        assertThat(service.stats(ROOM).indexKind()).isEqualTo(IndexKind.APPROXIMATE);
        List<FaceHit> all = service.search(SearchQuery.withThreshold(axis(4, 0), ids.size(), ROOM, 0.0));
        assertThat(all).extracting(FaceHit::faceId).doesNotHaveDuplicates().containsExactlyInAnyOrderElementsOf(ids);
    }

    @Test
    void resetEmptiesRoomButKeepsIt() {
        service.insertBatch(ROOM, List.of(face("p1.jpg", 1, 0, 0, 0), face("p2.jpg", 0, 1, 0, 0)));

        service.reset(ROOM);

        assertThat(service.getRoomInfo(ROOM)).isPresent();
        assertThat(service.search(SearchQuery.withThreshold(axis(4, 0), 10, ROOM, 0.0))).isEmpty();
        assertThat(service.stats(ROOM).totalActive()).isZero();
        assertThat(service.insert(ROOM, face("p3.jpg", 0, 0, 1, 0)).id()).isEqualTo(3L);
    }

    @Test
    void listLocationsIsDistinctAndSorted() {
        service.insertBatch(ROOM, List.of(
            face("p1.jpg", FaceMetadata.builder().locationName("Paris").build(), 1, 0, 0, 0),
            face("p2.jpg", FaceMetadata.builder().locationName("Lyon").build(), 0, 1, 0, 0),
            face("p3.jpg", FaceMetadata.builder().locationName("Paris").build(), 0, 0, 1, 0),
            face("p4.jpg", 0, 0, 0, 1)));

        assertThat(service.listLocations(ROOM)).containsExactly("Lyon", "Paris");
    }

    @Test
    void restartRestoresIndex() {
        List<FaceRecord> records = service.insertBatch(ROOM, TestFaces.randomFaces(new Random(3), 35, 4, "p", 1));
        service.deleteByPhoto(ROOM, "p0.jpg");

        store.cleanup();
        start();

        RoomStats stats = service.stats(ROOM);
        assertThat(stats.totalActive()).isEqualTo(34);
        assertThat(stats.indexKind()).isEqualTo(IndexKind.APPROXIMATE);
        FaceRecord last = records.get(records.size() - 1);
        List<FaceHit> top = service.search(SearchQuery.withThreshold(last.embedding(), 1, ROOM, 0.0));
        assertThat(top).extracting(FaceHit::faceId).containsExactly(last.id());
    }

    @Test
    void droppedRoomIsGone() {
        service.insert(ROOM, face("p1.jpg", 1, 0, 0, 0));

        assertThat(service.dropRoom(ROOM)).isTrue();
        assertThat(service.dropRoom(ROOM)).isFalse();
        assertThatThrownBy(() -> service.search(SearchQuery.withThreshold(axis(4, 0), 10, ROOM, 0.0)))
            .isInstanceOf(RoomNotFoundException.class);
        assertThatThrownBy(() -> service.insert(ROOM, face("p1.jpg", 1, 0, 0, 0)))
            .isInstanceOf(RoomNotFoundException.class);
        assertThat(service.rebuildIndex(ROOM)).isFalse();
    }

    @Test
    void healthReflectsStore() {
        assertThat(service.isHealthy()).isTrue();
    }

    private void start() {
        store = new RocksDbEmbeddingStore(similarity, properties);
        store.initialize();
        IndexPersistence persistence = new IndexPersistence(
            new IndexSnapshotSerializer(), new IndexSnapshotDeserializer(), properties);
        index = new ClusteredVectorIndex(store, similarity, properties, persistence);
        service = new FaceStorageServiceImpl(store, index, properties);
        service.init();
    }
}
