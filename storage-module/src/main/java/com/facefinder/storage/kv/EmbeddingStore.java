package com.facefinder.storage.kv;

import com.facefinder.common.model.FaceRecord;
import com.facefinder.common.model.NewFace;
import com.facefinder.common.model.RoomInfo;

import java.util.List;
import java.util.Optional;

/**
 * Durable, append-only record of every face embedding, partitioned by room.
 * The only component allowed to assign face ids; source of truth for every index rebuild.
 */
public interface EmbeddingStore {

    /** Добавить лицо, вернуть запись с присвоенным ID */
    FaceRecord append(String roomId, NewFace face);

    /** Добавить батч лиц одной атомарной записью */
    List<FaceRecord> appendBatch(String roomId, List<NewFace> faces);

    /** Пометить все лица фотографии как удалённые, вернуть ID помеченных записей */
    List<Long> removeByPhoto(String roomId, String photo);

    /** Все активные (не удалённые) записи комнаты в порядке возрастания ID */
    List<FaceRecord> allActive(String roomId);

    /** Получить запись по ID, включая удалённые */
    Optional<FaceRecord> get(String roomId, long id);

    /** Количество активных записей */
    long activeCount(String roomId);

    /** Количество удалённых записей */
    long tombstoneCount(String roomId);

    /** Удалить все записи комнаты; последовательность ID сохраняется */
    void reset(String roomId);

    /** Сохранить метаданные комнаты */
    void putRoomInfo(RoomInfo roomInfo);

    /** Получить метаданные комнаты */
    Optional<RoomInfo> getRoomInfo(String roomId);

    /** Удалить комнату вместе со всеми записями */
    boolean deleteRoom(String roomId);

    /** Список всех комнат */
    List<RoomInfo> getAllRooms();
}
