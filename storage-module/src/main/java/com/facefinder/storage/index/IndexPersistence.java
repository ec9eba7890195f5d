package com.facefinder.storage.index;

import com.facefinder.common.exception.CorruptIndexException;
import com.facefinder.common.exception.FaceFinderException;
import com.facefinder.common.model.IndexSnapshot;
import com.facefinder.common.serialization.IndexSnapshotDeserializer;
import com.facefinder.common.serialization.IndexSnapshotSerializer;
import com.facefinder.storage.config.StorageProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Снимки индексов на диске, один файл на комнату.
 * Снимок пишется во временный файл и атомарно переносится поверх старого.
 */
@Component
@Slf4j
public class IndexPersistence {

    private static final String SUFFIX = ".idx";
    private static final String TMP_SUFFIX = ".idx.tmp";

    private final IndexSnapshotSerializer serializer;
    private final IndexSnapshotDeserializer deserializer;
    private final Path directory;

    public IndexPersistence(IndexSnapshotSerializer serializer,
                            IndexSnapshotDeserializer deserializer,
                            StorageProperties properties) {
        this.serializer = serializer;
        this.deserializer = deserializer;
        this.directory = Paths.get(properties.getDataPath(), "indexes");
    }

    public void save(String roomId, IndexSnapshot snapshot) {
        Path target = directory.resolve(roomId + SUFFIX);
        Path temp = directory.resolve(roomId + TMP_SUFFIX);
        try {
            Files.createDirectories(directory);
            Files.write(temp, serializer.serialize(snapshot));
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                log.warn("Atomic move not supported in {}, falling back to replace", directory);
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("Saved {} index snapshot of room {} ({} entries)",
                snapshot.kind(), roomId, snapshot.entryCount());
        } catch (IOException e) {
            throw new FaceFinderException("Failed to save index snapshot of room " + roomId, e);
        }
    }

    /**
     * @throws CorruptIndexException если файл есть, но не декодируется
     */
    public Optional<IndexSnapshot> load(String roomId) {
        Path target = directory.resolve(roomId + SUFFIX);
        if (!Files.exists(target)) {
            return Optional.empty();
        }
        try {
            return Optional.of(deserializer.deserialize(Files.readAllBytes(target)));
        } catch (IOException e) {
            throw new CorruptIndexException("Failed to read index snapshot " + target, e);
        }
    }

    public void delete(String roomId) {
        try {
            Files.deleteIfExists(directory.resolve(roomId + SUFFIX));
            Files.deleteIfExists(directory.resolve(roomId + TMP_SUFFIX));
        } catch (IOException e) {
            throw new FaceFinderException("Failed to delete index snapshot of room " + roomId, e);
        }
    }

    Path snapshotPath(String roomId) {
        return directory.resolve(roomId + SUFFIX);
    }
}
