package com.facefinder.storage.index;

import com.facefinder.common.model.FaceRecord;
import com.facefinder.common.model.IndexKind;

import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Интерфейс для операций с векторным индексом комнат.
 * Индекс производен от хранилища эмбеддингов и может быть перестроен из него в любой момент.
 */
public interface VectorIndex {

    /**
     * Перестроить индекс комнаты из всех активных записей хранилища
     * @param roomId ID комнаты
     */
    void rebuild(String roomId);

    /**
     * Добавить записи, уже сохранённые в хранилище
     * @param roomId ID комнаты
     * @param records новые записи
     */
    void insert(String roomId, List<FaceRecord> records);

    /**
     * Пометить записи как удалённые
     * @return количество новых пометок
     */
    int markDeleted(String roomId, Collection<Long> ids);

    /**
     * Поиск k ближайших соседей с порогом сходства
     * @param query вектор запроса, нормализуется перед поиском
     * @return не более k результатов, отсортированных по убыванию сходства
     */
    List<ScoredFace> search(String roomId, float[] query, int k, double threshold);

    /**
     * Загрузить сохранённый индекс; при любой несогласованности индекс перестраивается
     * @return true если индекс восстановлен из снимка без перестройки
     */
    boolean load(String roomId);

    /** Количество активных записей в индексе */
    int activeCount(String roomId);

    /** Количество удалённых записей, ещё присутствующих в индексе */
    int tombstoneCount(String roomId);

    /** Активные ID в индексе */
    Set<Long> activeIds(String roomId);

    IndexKind kind(String roomId);

    int clusterCount(String roomId);

    /** Проверить, загружен ли индекс комнаты */
    boolean isLoaded(String roomId);

    /** Очистить индекс комнаты вместе с сохранённым снимком */
    void clear(String roomId);
}
