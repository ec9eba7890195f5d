package com.facefinder.storage.kv;

import com.facefinder.common.exception.CorruptStoreException;
import com.facefinder.common.exception.DimensionMismatchException;
import com.facefinder.common.exception.FaceFinderException;
import com.facefinder.common.exception.RoomNotFoundException;
import com.facefinder.common.model.FaceRecord;
import com.facefinder.common.model.NewFace;
import com.facefinder.common.model.RoomInfo;
import com.facefinder.storage.config.StorageProperties;
import com.facefinder.storage.similarity.VectorSimilarity;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.rocksdb.ColumnFamilyDescriptor;
import org.rocksdb.ColumnFamilyHandle;
import org.rocksdb.DBOptions;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.RocksIterator;
import org.rocksdb.WriteBatch;
import org.rocksdb.WriteOptions;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * RocksDB backed {@link EmbeddingStore}.
 * Face keys are {@code roomId 0x00 id(8 bytes big-endian)} so a prefix scan walks a room in id order.
 * Every write that touches faces also rewrites the room info in the same {@link WriteBatch},
 * which keeps the id sequence and the active count consistent with the records.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class RocksDbEmbeddingStore implements EmbeddingStore {
    private static final String FACES_CF = "faces";
    private static final String ROOMS_CF = "rooms";
    private static final byte KEY_SEPARATOR = 0x00;

    private final VectorSimilarity vectorSimilarity;
    private final StorageProperties properties;

    private RocksDB rocksDB;
    private DBOptions dbOptions;
    private WriteOptions writeOptions;
    private final Map<String, ColumnFamilyHandle> columnFamilyHandles = new ConcurrentHashMap<>();
    private final Map<String, Object> roomMonitors = new ConcurrentHashMap<>();
    private final ObjectMapper objectMapper = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    @PostConstruct
    public void initialize() {
        RocksDB.loadLibrary();

        try {
            Path dbPath = Paths.get(properties.getDataPath(), "store");
            dbPath.toFile().mkdirs();

            List<ColumnFamilyDescriptor> columnFamilyDescriptors = Arrays.asList(
                new ColumnFamilyDescriptor(RocksDB.DEFAULT_COLUMN_FAMILY),
                new ColumnFamilyDescriptor(FACES_CF.getBytes(StandardCharsets.UTF_8)),
                new ColumnFamilyDescriptor(ROOMS_CF.getBytes(StandardCharsets.UTF_8))
            );

            List<ColumnFamilyHandle> handles = new ArrayList<>();

            dbOptions = new DBOptions()
                .setCreateIfMissing(true)
                .setCreateMissingColumnFamilies(true);
            writeOptions = new WriteOptions().setSync(true);

            rocksDB = RocksDB.open(dbOptions, dbPath.toString(), columnFamilyDescriptors, handles);

            columnFamilyHandles.put("default", handles.get(0));
            columnFamilyHandles.put(FACES_CF, handles.get(1));
            columnFamilyHandles.put(ROOMS_CF, handles.get(2));

            log.info("Embedding store opened at path: {}", dbPath);

        } catch (RocksDBException e) {
            log.error("Failed to open embedding store", e);
            throw new CorruptStoreException("Failed to open embedding store at " + properties.getDataPath(), e);
        }
    }

    @Override
    public FaceRecord append(String roomId, NewFace face) {
        return appendBatch(roomId, List.of(face)).get(0);
    }

    @Override
    public List<FaceRecord> appendBatch(String roomId, List<NewFace> faces) {
        if (faces == null || faces.isEmpty()) {
            return List.of();
        }
        synchronized (monitor(roomId)) {
            RoomInfo info = requireRoom(roomId);

            // validate the whole batch before anything is written
            List<float[]> normalized = new ArrayList<>(faces.size());
            for (NewFace face : faces) {
                if (face.embedding().length != info.dimension()) {
                    throw new DimensionMismatchException(info.dimension(), face.embedding().length);
                }
                normalized.add(vectorSimilarity.normalizeIfNeeded(face.embedding(), properties.getNormalizationTolerance()));
            }

            Instant now = Instant.now();
            long nextId = info.nextFaceId();
            List<FaceRecord> records = new ArrayList<>(faces.size());
            for (int i = 0; i < faces.size(); i++) {
                NewFace face = faces.get(i);
                records.add(FaceRecord.builder()
                    .id(nextId + i)
                    .roomId(roomId)
                    .photo(face.photo())
                    .bbox(face.bbox())
                    .confidence(face.confidence())
                    .metadata(face.metadata())
                    .embedding(normalized.get(i))
                    .deleted(false)
                    .createdAt(now)
                    .build());
            }

            RoomInfo updated = info.withReservedIds(records.size());
            write(batch -> {
                for (FaceRecord record : records) {
                    batch.put(faces(), faceKey(roomId, record.id()), toBytes(record));
                }
                batch.put(rooms(), roomKey(roomId), toBytes(updated));
            });

            log.debug("Appended {} faces to room {} (ids {}..{})",
                records.size(), roomId, nextId, nextId + records.size() - 1);
            return records;
        }
    }

    @Override
    public List<Long> removeByPhoto(String roomId, String photo) {
        synchronized (monitor(roomId)) {
            RoomInfo info = requireRoom(roomId);

            List<FaceRecord> matching = new ArrayList<>();
            scanRoom(roomId, record -> {
                if (!record.deleted() && record.photo().equals(photo)) {
                    matching.add(record);
                }
            });

            if (matching.isEmpty()) {
                return List.of();
            }

            RoomInfo updated = info.withActiveCount(Math.max(0, info.activeCount() - matching.size()));
            write(batch -> {
                for (FaceRecord record : matching) {
                    batch.put(faces(), faceKey(roomId, record.id()), toBytes(record.asDeleted()));
                }
                batch.put(rooms(), roomKey(roomId), toBytes(updated));
            });

            log.info("Tombstoned {} faces of photo {} in room {}", matching.size(), photo, roomId);
            return matching.stream().map(FaceRecord::id).toList();
        }
    }

    @Override
    public List<FaceRecord> allActive(String roomId) {
        List<FaceRecord> records = new ArrayList<>();
        scanRoom(roomId, record -> {
            if (!record.deleted()) {
                records.add(record);
            }
        });
        return records;
    }

    @Override
    public Optional<FaceRecord> get(String roomId, long id) {
        try {
            byte[] value = rocksDB.get(faces(), faceKey(roomId, id));
            if (value == null) {
                return Optional.empty();
            }
            return Optional.of(fromBytes(value, FaceRecord.class));
        } catch (RocksDBException e) {
            throw new FaceFinderException("Failed to read face " + id + " of room " + roomId, e);
        }
    }

    @Override
    public long activeCount(String roomId) {
        return getRoomInfo(roomId).map(RoomInfo::activeCount).orElse(0L);
    }

    @Override
    public long tombstoneCount(String roomId) {
        long[] count = {0};
        scanRoom(roomId, record -> {
            if (record.deleted()) {
                count[0]++;
            }
        });
        return count[0];
    }

    @Override
    public void reset(String roomId) {
        synchronized (monitor(roomId)) {
            RoomInfo info = requireRoom(roomId);
            write(batch -> {
                batch.deleteRange(faces(), roomPrefix(roomId), roomPrefixEnd(roomId));
                batch.put(rooms(), roomKey(roomId), toBytes(info.withActiveCount(0)));
            });
            log.info("Reset room {}", roomId);
        }
    }

    @Override
    public void putRoomInfo(RoomInfo roomInfo) {
        try {
            rocksDB.put(rooms(), writeOptions, roomKey(roomInfo.id()), toBytes(roomInfo));
        } catch (RocksDBException e) {
            throw new FaceFinderException("Failed to write room " + roomInfo.id(), e);
        }
    }

    @Override
    public Optional<RoomInfo> getRoomInfo(String roomId) {
        try {
            byte[] value = rocksDB.get(rooms(), roomKey(roomId));
            if (value == null) {
                return Optional.empty();
            }
            return Optional.of(fromBytes(value, RoomInfo.class));
        } catch (RocksDBException e) {
            throw new FaceFinderException("Failed to read room " + roomId, e);
        }
    }

    @Override
    public boolean deleteRoom(String roomId) {
        synchronized (monitor(roomId)) {
            if (getRoomInfo(roomId).isEmpty()) {
                return false;
            }
            write(batch -> {
                batch.deleteRange(faces(), roomPrefix(roomId), roomPrefixEnd(roomId));
                batch.delete(rooms(), roomKey(roomId));
            });
            log.info("Deleted room {}", roomId);
            return true;
        }
    }

    @Override
    public List<RoomInfo> getAllRooms() {
        List<RoomInfo> result = new ArrayList<>();

        try (RocksIterator iterator = rocksDB.newIterator(rooms())) {
            iterator.seekToFirst();

            while (iterator.isValid()) {
                result.add(fromBytes(iterator.value(), RoomInfo.class));
                iterator.next();
            }
        }

        return result;
    }

    private RoomInfo requireRoom(String roomId) {
        return getRoomInfo(roomId).orElseThrow(() -> new RoomNotFoundException(roomId));
    }

    private void scanRoom(String roomId, Consumer<FaceRecord> consumer) {
        byte[] prefix = roomPrefix(roomId);

        try (RocksIterator iterator = rocksDB.newIterator(faces())) {
            iterator.seek(prefix);

            while (iterator.isValid() && startsWith(iterator.key(), prefix)) {
                consumer.accept(fromBytes(iterator.value(), FaceRecord.class));
                iterator.next();
            }
        }
    }

    private void write(BatchWriter writer) {
        try (WriteBatch batch = new WriteBatch()) {
            writer.fill(batch);
            rocksDB.write(writeOptions, batch);
        } catch (RocksDBException e) {
            throw new FaceFinderException("Failed to write batch to embedding store", e);
        }
    }

    private byte[] toBytes(Object value) {
        try {
            return objectMapper.writeValueAsBytes(value);
        } catch (IOException e) {
            throw new FaceFinderException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private <T> T fromBytes(byte[] value, Class<T> type) {
        try {
            return objectMapper.readValue(value, type);
        } catch (IOException | IllegalArgumentException e) {
            throw new CorruptStoreException("Unreadable " + type.getSimpleName() + " in embedding store", e);
        }
    }

    private Object monitor(String roomId) {
        return roomMonitors.computeIfAbsent(roomId, id -> new Object());
    }

    private ColumnFamilyHandle faces() {
        return columnFamilyHandles.get(FACES_CF);
    }

    private ColumnFamilyHandle rooms() {
        return columnFamilyHandles.get(ROOMS_CF);
    }

    static byte[] roomKey(String roomId) {
        return roomId.getBytes(StandardCharsets.UTF_8);
    }

    static byte[] roomPrefix(String roomId) {
        byte[] room = roomKey(roomId);
        byte[] prefix = Arrays.copyOf(room, room.length + 1);
        prefix[room.length] = KEY_SEPARATOR;
        return prefix;
    }

    static byte[] roomPrefixEnd(String roomId) {
        byte[] end = roomPrefix(roomId);
        end[end.length - 1] = KEY_SEPARATOR + 1;
        return end;
    }

    static byte[] faceKey(String roomId, long id) {
        byte[] prefix = roomPrefix(roomId);
        return ByteBuffer.allocate(prefix.length + Long.BYTES)
            .put(prefix)
            .putLong(id)
            .array();
    }

    private static boolean startsWith(byte[] key, byte[] prefix) {
        if (key.length < prefix.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if (key[i] != prefix[i]) {
                return false;
            }
        }
        return true;
    }

    @FunctionalInterface
    private interface BatchWriter {
        void fill(WriteBatch batch) throws RocksDBException;
    }

    @PreDestroy
    public void cleanup() {
        if (rocksDB != null) {
            columnFamilyHandles.values().forEach(ColumnFamilyHandle::close);
            columnFamilyHandles.clear();
            rocksDB.close();
            rocksDB = null;
            writeOptions.close();
            dbOptions.close();
            log.info("Embedding store closed");
        }
    }
}
