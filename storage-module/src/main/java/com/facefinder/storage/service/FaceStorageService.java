package com.facefinder.storage.service;

import com.facefinder.common.model.FaceHit;
import com.facefinder.common.model.FaceRecord;
import com.facefinder.common.model.NewFace;
import com.facefinder.common.model.RoomInfo;
import com.facefinder.common.model.RoomStats;
import com.facefinder.common.model.SearchQuery;

import java.util.List;
import java.util.Optional;

/** Интерфейс для операций с хранилищем лиц и их индексом */
public interface FaceStorageService {

    /** Добавить лицо в комнату */
    FaceRecord insert(String roomId, NewFace face);

    /** Добавить батч лиц; ID последовательны и возрастают */
    List<FaceRecord> insertBatch(String roomId, List<NewFace> faces);

    /** Удалить все лица фотографии, вернуть количество удалённых */
    int deleteByPhoto(String roomId, String photo);

    /** Поиск похожих лиц с порогом сходства */
    List<FaceHit> search(SearchQuery query);

    /** Удалить все лица комнаты */
    void reset(String roomId);

    /** Создать новую комнату; dimension == null означает размерность по умолчанию */
    RoomInfo createRoom(String roomId, String name, Integer dimension);

    /** Удалить комнату */
    boolean dropRoom(String roomId);

    /** Получить информацию о комнате */
    Optional<RoomInfo> getRoomInfo(String roomId);

    /** Список всех комнат */
    List<RoomInfo> listRooms();

    /** Перестроить индекс комнаты */
    boolean rebuildIndex(String roomId);

    RoomStats stats(String roomId);

    /** Различные названия мест среди активных лиц комнаты */
    List<String> listLocations(String roomId);

    /** Проверить здоровье хранилища */
    boolean isHealthy();
}
