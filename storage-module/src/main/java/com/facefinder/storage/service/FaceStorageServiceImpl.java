package com.facefinder.storage.service;

import com.facefinder.common.exception.InvariantViolationException;
import com.facefinder.common.exception.RoomNotFoundException;
import com.facefinder.common.model.FaceHit;
import com.facefinder.common.model.FaceMetadata;
import com.facefinder.common.model.FaceRecord;
import com.facefinder.common.model.NewFace;
import com.facefinder.common.model.RoomInfo;
import com.facefinder.common.model.RoomStats;
import com.facefinder.common.model.SearchQuery;
import com.facefinder.storage.config.StorageProperties;
import com.facefinder.storage.index.ScoredFace;
import com.facefinder.storage.index.VectorIndex;
import com.facefinder.storage.kv.EmbeddingStore;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.regex.Pattern;

@Service
@RequiredArgsConstructor
@Slf4j
public class FaceStorageServiceImpl implements FaceStorageService {

    private static final Pattern ROOM_ID = Pattern.compile("[A-Za-z0-9_-]{1,64}");

    private final EmbeddingStore store;
    private final VectorIndex vectorIndex;
    private final StorageProperties properties;

    /** Блокировки приёма данных по комнатам: append в хранилище и вставка в индекс идут под одной блокировкой */
    private final Map<String, ReentrantLock> ingestLocks = new ConcurrentHashMap<>();

    @PostConstruct
    public void init() {
        log.info("Initializing face storage service...");

        List<RoomInfo> rooms = store.getAllRooms();
        log.info("Found {} existing rooms in storage", rooms.size());

        int restored = 0;
        for (RoomInfo room : rooms) {
            try {
                log.info("Restoring room {}: dimension={}, activeCount={}",
                    room.id(), room.dimension(), room.activeCount());
                boolean fromSnapshot = vectorIndex.load(room.id());
                verifyInvariant(room.id());
                log.info("Room {} ready ({}), index size: {}", room.id(),
                    fromSnapshot ? "snapshot" : "rebuilt", vectorIndex.activeCount(room.id()));
                restored++;
            } catch (RuntimeException e) {
                log.error("Failed to restore room {}", room.id(), e);
            }
        }

        String defaultRoom = properties.getDefaultRoom();
        if (defaultRoom != null && !defaultRoom.isBlank() && store.getRoomInfo(defaultRoom).isEmpty()) {
            createRoom(defaultRoom, defaultRoom, null);
        }

        log.info("Face storage service initialization complete - restored {} of {} rooms", restored, rooms.size());
    }

    @Override
    public FaceRecord insert(String roomId, NewFace face) {
        return insertBatch(roomId, List.of(face)).get(0);
    }

    @Override
    public List<FaceRecord> insertBatch(String roomId, List<NewFace> faces) {
        requireRoom(roomId);
        if (faces.isEmpty()) {
            return List.of();
        }

        ReentrantLock lock = ingestLock(roomId);
        lock.lock();
        try {
            List<FaceRecord> records = store.appendBatch(roomId, faces);
            vectorIndex.insert(roomId, records);
            verifyInvariant(roomId);

            log.debug("Added {} faces to room {}", records.size(), roomId);
            return records;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int deleteByPhoto(String roomId, String photo) {
        requireRoom(roomId);

        ReentrantLock lock = ingestLock(roomId);
        lock.lock();
        try {
            List<Long> removed = store.removeByPhoto(roomId, photo);
            if (removed.isEmpty()) {
                log.info("No active faces of photo {} in room {}", photo, roomId);
                return 0;
            }
            vectorIndex.markDeleted(roomId, removed);
            verifyInvariant(roomId);

            log.info("Deleted {} faces of photo {} from room {}", removed.size(), photo, roomId);
            return removed.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<FaceHit> search(SearchQuery query) {
        String roomId = query.roomId();
        if (roomId == null) {
            throw new IllegalArgumentException("Room ID is required for search");
        }
        requireRoom(roomId);

        List<ScoredFace> scored = vectorIndex.search(roomId, query.embedding(), query.k(), query.threshold());
        List<FaceHit> hits = new ArrayList<>(scored.size());
        for (ScoredFace face : scored) {
            hits.add(FaceHit.of(face.face(), face.similarity()));
        }
        log.debug("Search in room {} at threshold {} returned {} faces", roomId, query.threshold(), hits.size());
        return hits;
    }

    @Override
    public void reset(String roomId) {
        requireRoom(roomId);

        ReentrantLock lock = ingestLock(roomId);
        lock.lock();
        try {
            store.reset(roomId);
            vectorIndex.rebuild(roomId);
            log.info("Reset room {}", roomId);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public RoomInfo createRoom(String roomId, String name, Integer dimension) {
        if (roomId == null || !ROOM_ID.matcher(roomId).matches()) {
            throw new IllegalArgumentException("Room ID must match " + ROOM_ID.pattern() + ": " + roomId);
        }
        int effectiveDimension = dimension != null ? dimension : properties.getDimension();
        if (effectiveDimension <= 0) {
            throw new IllegalArgumentException("Dimension must be positive");
        }

        ReentrantLock lock = ingestLock(roomId);
        lock.lock();
        try {
            if (store.getRoomInfo(roomId).isPresent()) {
                throw new IllegalArgumentException("Room already exists: " + roomId);
            }

            RoomInfo info = RoomInfo.forNewRoom(roomId, name == null || name.isBlank() ? roomId : name,
                effectiveDimension);
            store.putRoomInfo(info);
            vectorIndex.rebuild(roomId);

            log.info("Created room: {} with dimension: {}", roomId, effectiveDimension);
            return info;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean dropRoom(String roomId) {
        ReentrantLock lock = ingestLock(roomId);
        lock.lock();
        try {
            boolean deleted = store.deleteRoom(roomId);
            if (deleted) {
                vectorIndex.clear(roomId);
                log.info("Dropped room {}", roomId);
            }
            return deleted;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<RoomInfo> getRoomInfo(String roomId) {
        return store.getRoomInfo(roomId);
    }

    @Override
    public List<RoomInfo> listRooms() {
        return store.getAllRooms();
    }

    @Override
    public boolean rebuildIndex(String roomId) {
        if (store.getRoomInfo(roomId).isEmpty()) {
            return false;
        }
        vectorIndex.rebuild(roomId);
        return true;
    }

    @Override
    public RoomStats stats(String roomId) {
        RoomInfo info = requireRoom(roomId);
        return new RoomStats(
            roomId,
            store.activeCount(roomId),
            store.tombstoneCount(roomId),
            vectorIndex.kind(roomId),
            vectorIndex.clusterCount(roomId),
            info.dimension()
        );
    }

    @Override
    public List<String> listLocations(String roomId) {
        requireRoom(roomId);
        TreeSet<String> locations = new TreeSet<>();
        for (FaceRecord record : store.allActive(roomId)) {
            FaceMetadata metadata = record.metadata();
            if (metadata.locationName() != null && !metadata.locationName().isBlank()) {
                locations.add(metadata.locationName());
            }
        }
        return List.copyOf(locations);
    }

    @Override
    public boolean isHealthy() {
        try {
            store.getAllRooms();
            return true;
        } catch (RuntimeException e) {
            log.error("Health check failed", e);
            return false;
        }
    }

    /**
     * Сверяет количество активных лиц в индексе и хранилище; при расхождении индекс перестраивается.
     */
    private void verifyInvariant(String roomId) {
        long storeCount = store.activeCount(roomId);
        long indexCount = vectorIndex.activeCount(roomId);
        if (storeCount != indexCount) {
            InvariantViolationException violation = new InvariantViolationException(roomId, storeCount, indexCount);
            log.warn("{}, rebuilding index", violation.getMessage());
            vectorIndex.rebuild(roomId);
        }
    }

    private RoomInfo requireRoom(String roomId) {
        return store.getRoomInfo(roomId).orElseThrow(() -> new RoomNotFoundException(roomId));
    }

    private ReentrantLock ingestLock(String roomId) {
        return ingestLocks.computeIfAbsent(roomId, id -> new ReentrantLock());
    }
}
