package com.facefinder.storage.index;

import com.facefinder.common.exception.CorruptIndexException;
import com.facefinder.common.exception.DimensionMismatchException;
import com.facefinder.common.exception.FaceFinderException;
import com.facefinder.common.exception.InvariantViolationException;
import com.facefinder.common.exception.RoomNotFoundException;
import com.facefinder.common.model.FaceRecord;
import com.facefinder.common.model.IndexKind;
import com.facefinder.common.model.IndexSnapshot;
import com.facefinder.common.model.RoomInfo;
import com.facefinder.storage.config.StorageProperties;
import com.facefinder.storage.kv.EmbeddingStore;
import com.facefinder.storage.similarity.VectorSimilarity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Векторный индекс комнат: точный (линейный) для малых комнат,
 * кластерный (IVF поверх spherical k-means) начиная с порога активных лиц.
 * Читатели работают со снимком состояния без блокировок; писатели одной комнаты
 * сериализуются блокировкой и публикуют новое состояние атомарной заменой ссылки.
 */
@Component
@Slf4j
public class ClusteredVectorIndex implements VectorIndex {

    private final EmbeddingStore store;
    private final VectorSimilarity similarity;
    private final StorageProperties properties;
    private final IndexPersistence persistence;
    private final KMeansQuantizer quantizer;

    /** Опубликованное состояние индекса по комнатам; null внутри ссылки означает "не загружен" */
    private final Map<String, AtomicReference<RoomIndexState>> rooms = new ConcurrentHashMap<>();

    /** Блокировки писателей по комнатам */
    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public ClusteredVectorIndex(EmbeddingStore store,
                                VectorSimilarity similarity,
                                StorageProperties properties,
                                IndexPersistence persistence) {
        this.store = store;
        this.similarity = similarity;
        this.properties = properties;
        this.persistence = persistence;
        this.quantizer = new KMeansQuantizer(similarity, properties.getKmeansIterations(),
            properties.getTrainingSampleSize(), properties.getSeed());
        log.info("Initialized clustered index: approximateThreshold={}, clusterCount={}, probeCount={}",
            properties.getApproximateThreshold(), properties.getClusterCount(), properties.getProbeCount());
    }

    @Override
    public void rebuild(String roomId) {
        ReentrantLock lock = lockFor(roomId);
        lock.lock();
        try {
            doRebuild(roomId);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void insert(String roomId, List<FaceRecord> records) {
        if (records.isEmpty()) {
            return;
        }
        ReentrantLock lock = lockFor(roomId);
        lock.lock();
        try {
            RoomIndexState current = reference(roomId).get();
            if (current == null) {
                // записи уже в хранилище, полная загрузка их подхватит
                load(roomId);
                return;
            }
            SearchStructure structure = current.structure();
            for (FaceRecord record : records) {
                if (record.dimension() != structure.dimension()) {
                    throw new DimensionMismatchException(structure.dimension(), record.dimension());
                }
            }

            long newActive = (long) current.activeCount() + records.size();
            if (needsRebuild(structure, newActive)) {
                log.info("Room {} reached {} active faces, rebuilding {} index",
                    roomId, newActive, structure.kind());
                doRebuild(roomId);
                return;
            }

            RoomIndexState next = current.withStructure(structure.withAdded(records));
            reference(roomId).set(next);
            log.debug("Inserted {} faces into {} index of room {}", records.size(), structure.kind(), roomId);
            persist(roomId, next);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int markDeleted(String roomId, Collection<Long> ids) {
        if (ids.isEmpty()) {
            return 0;
        }
        ReentrantLock lock = lockFor(roomId);
        lock.lock();
        try {
            RoomIndexState current = reference(roomId).get();
            if (current == null) {
                load(roomId);
                return ids.size();
            }

            Set<Long> indexed = new HashSet<>();
            for (long id : current.structure().ids()) {
                indexed.add(id);
            }
            Set<Long> added = new HashSet<>();
            for (Long id : ids) {
                if (indexed.contains(id) && !current.tombstones().contains(id)) {
                    added.add(id);
                }
            }
            if (added.isEmpty()) {
                return 0;
            }

            RoomIndexState next = current.withTombstones(added);
            double ratio = (double) next.tombstones().size() / next.structure().size();
            if (ratio > properties.getCompactionRatio()) {
                log.info("Room {} has {} tombstoned of {} indexed faces, compacting",
                    roomId, next.tombstones().size(), next.structure().size());
                doRebuild(roomId);
            } else {
                reference(roomId).set(next);
                persist(roomId, next);
            }
            return added.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<ScoredFace> search(String roomId, float[] query, int k, double threshold) {
        if (k <= 0) {
            throw new IllegalArgumentException("k must be positive");
        }
        RoomIndexState state = state(roomId);
        SearchStructure structure = state.structure();
        if (query.length != structure.dimension()) {
            throw new DimensionMismatchException(structure.dimension(), query.length);
        }
        if (state.activeCount() == 0) {
            return List.of();
        }
        float[] normalized = similarity.normalize(query);
        return structure.search(normalized, k, threshold, state.tombstones());
    }

    @Override
    public boolean load(String roomId) {
        ReentrantLock lock = lockFor(roomId);
        lock.lock();
        try {
            Optional<IndexSnapshot> snapshot;
            try {
                snapshot = persistence.load(roomId);
            } catch (CorruptIndexException e) {
                log.warn("Index snapshot of room {} is unreadable, rebuilding: {}", roomId, e.getMessage());
                doRebuild(roomId);
                return false;
            }
            if (snapshot.isEmpty()) {
                log.info("No index snapshot for room {}, building from store", roomId);
                doRebuild(roomId);
                return false;
            }

            try {
                RoomIndexState restored = restore(roomId, snapshot.get());
                reference(roomId).set(restored);
                log.info("Loaded {} index of room {}: {} active faces, {} clusters",
                    restored.structure().kind(), roomId, restored.activeCount(), restored.structure().clusterCount());
                return true;
            } catch (CorruptIndexException | InvariantViolationException | DimensionMismatchException e) {
                log.warn("Index snapshot of room {} rejected, rebuilding: {}", roomId, e.getMessage());
                doRebuild(roomId);
                return false;
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int activeCount(String roomId) {
        return state(roomId).activeCount();
    }

    @Override
    public int tombstoneCount(String roomId) {
        return state(roomId).tombstones().size();
    }

    @Override
    public Set<Long> activeIds(String roomId) {
        RoomIndexState state = state(roomId);
        Set<Long> ids = new HashSet<>();
        for (long id : state.structure().ids()) {
            if (!state.tombstones().contains(id)) {
                ids.add(id);
            }
        }
        return ids;
    }

    @Override
    public IndexKind kind(String roomId) {
        return state(roomId).structure().kind();
    }

    @Override
    public int clusterCount(String roomId) {
        return state(roomId).structure().clusterCount();
    }

    @Override
    public boolean isLoaded(String roomId) {
        AtomicReference<RoomIndexState> ref = rooms.get(roomId);
        return ref != null && ref.get() != null;
    }

    @Override
    public void clear(String roomId) {
        ReentrantLock lock = lockFor(roomId);
        lock.lock();
        try {
            rooms.remove(roomId);
            persistence.delete(roomId);
            log.info("Cleared index of room {}", roomId);
        } finally {
            lock.unlock();
        }
    }

    private void doRebuild(String roomId) {
        int dimension = dimensionOf(roomId);
        List<FaceRecord> records = store.allActive(roomId);
        long start = System.currentTimeMillis();
        SearchStructure structure = build(dimension, records);
        RoomIndexState next = RoomIndexState.of(structure);
        reference(roomId).set(next);
        log.info("Rebuilt {} index of room {}: {} faces, {} clusters in {} ms",
            structure.kind(), roomId, structure.size(), structure.clusterCount(),
            System.currentTimeMillis() - start);
        persist(roomId, next);
    }

    private SearchStructure build(int dimension, List<FaceRecord> records) {
        if (records.size() < properties.getApproximateThreshold()) {
            return FlatStructure.of(dimension, records, similarity);
        }
        return IvfStructure.train(dimension, records, clusterCountFor(records.size()),
            properties.getProbeCount(), quantizer, similarity);
    }

    int clusterCountFor(int corpusSize) {
        int configured = properties.getClusterCount();
        if (configured > 0) {
            return Math.min(configured, corpusSize);
        }
        return Math.max(1, (int) Math.ceil(Math.sqrt(corpusSize)));
    }

    private boolean needsRebuild(SearchStructure structure, long newActive) {
        if (structure.kind() == IndexKind.EXACT) {
            return newActive >= properties.getApproximateThreshold();
        }
        if (!structure.trained()) {
            return true;
        }
        long trainedOn = ((IvfStructure) structure).trainedOn();
        return trainedOn > 0 && newActive >= trainedOn * properties.getRetrainGrowthFactor();
    }

    private RoomIndexState restore(String roomId, IndexSnapshot snapshot) {
        int dimension = dimensionOf(roomId);
        if (snapshot.dimension() != dimension) {
            throw new DimensionMismatchException(dimension, snapshot.dimension());
        }

        List<FaceRecord> active = store.allActive(roomId);
        Map<Long, FaceRecord> byId = new HashMap<>(active.size() * 2);
        for (FaceRecord record : active) {
            byId.put(record.id(), record);
        }
        Set<Long> tombstones = new HashSet<>();
        for (long id : snapshot.tombstones()) {
            tombstones.add(id);
        }

        // удалённые записи при загрузке выбрасываются из списков
        long[][] lists = snapshot.lists();
        FaceRecord[][] resolved = new FaceRecord[lists.length][];
        int found = 0;
        for (int c = 0; c < lists.length; c++) {
            List<FaceRecord> list = new ArrayList<>(lists[c].length);
            for (long id : lists[c]) {
                if (tombstones.contains(id)) {
                    continue;
                }
                FaceRecord record = byId.get(id);
                if (record == null) {
                    throw new InvariantViolationException(roomId, active.size(), found);
                }
                list.add(record);
                found++;
            }
            resolved[c] = list.toArray(new FaceRecord[0]);
        }
        if (found != active.size()) {
            throw new InvariantViolationException(roomId, active.size(), found);
        }

        if (snapshot.kind() == IndexKind.EXACT) {
            List<FaceRecord> all = new ArrayList<>(found);
            for (FaceRecord[] list : resolved) {
                all.addAll(List.of(list));
            }
            return RoomIndexState.of(FlatStructure.of(dimension, all, similarity));
        }

        float[][] centroids = snapshot.centroids();
        if (!snapshot.trained() || centroids.length == 0 || centroids.length != lists.length) {
            throw new CorruptIndexException("Approximate snapshot of room " + roomId + " has no usable centroids");
        }
        for (float[] centroid : centroids) {
            if (centroid.length != dimension) {
                throw new CorruptIndexException("Centroid dimension " + centroid.length + " != " + dimension);
            }
        }
        int probeCount = snapshot.probeCount() > 0 ? snapshot.probeCount() : properties.getProbeCount();
        return RoomIndexState.of(IvfStructure.restore(dimension, centroids, resolved, probeCount,
            snapshot.trainedOn(), quantizer, similarity));
    }

    private void persist(String roomId, RoomIndexState state) {
        if (!properties.isPersistIndex()) {
            return;
        }
        try {
            persistence.save(roomId, state.structure().toSnapshot(state.tombstones()));
        } catch (FaceFinderException e) {
            // индекс в памяти остаётся корректным, при старте он будет перестроен из хранилища
            log.error("Failed to persist index of room {}", roomId, e);
        }
    }

    private RoomIndexState state(String roomId) {
        RoomIndexState state = reference(roomId).get();
        if (state == null) {
            load(roomId);
            state = reference(roomId).get();
        }
        return state;
    }

    private int dimensionOf(String roomId) {
        return store.getRoomInfo(roomId)
            .map(RoomInfo::dimension)
            .orElseThrow(() -> new RoomNotFoundException(roomId));
    }

    private AtomicReference<RoomIndexState> reference(String roomId) {
        return rooms.computeIfAbsent(roomId, id -> new AtomicReference<>());
    }

    private ReentrantLock lockFor(String roomId) {
        return locks.computeIfAbsent(roomId, id -> new ReentrantLock());
    }
}
