package com.facefinder.main.search;

import com.facefinder.common.model.FaceHit;
import com.facefinder.common.model.SearchQuery;
import com.facefinder.main.config.SearchProperties;
import com.facefinder.storage.service.FaceStorageService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Поэтапный поиск лиц: строгий основной проход, расширяемый при нехватке результатов.
 * <ul>
 *   <li>основных совпадений не меньше порога достаточности: только основной результат</li>
 *   <li>есть основные совпадения: EXPAND с порогом {@code max(floor, primary - delta)}</li>
 *   <li>основных совпадений нет: FALLBACK с резервным порогом</li>
 * </ul>
 * Лица, найденные только ослабленным этапом, помечаются как expanded.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SearchOrchestrator {

    /** Лучшие первыми, при равенстве по возрастанию id */
    static final Comparator<FaceHit> RANKING = Comparator
        .comparingDouble(FaceHit::similarity).reversed()
        .thenComparingLong(FaceHit::faceId);

    private final FaceStorageService storageService;
    private final SearchProperties properties;

    /**
     * Поиск с настроенными основным порогом и лимитом
     */
    public OrchestratedSearch search(String roomId, float[] embedding) {
        return search(roomId, embedding, properties.getPrimaryThreshold(), properties.getMaxResults());
    }

    /**
     * @param primaryThreshold порог основного этапа
     * @param maxResults       k для каждого этапа
     */
    public OrchestratedSearch search(String roomId, float[] embedding, double primaryThreshold, int maxResults) {
        List<SearchStage> stages = new ArrayList<>();

        List<FaceHit> primary = storageService.search(
            SearchQuery.withThreshold(embedding, maxResults, roomId, primaryThreshold));
        stages.add(SearchStage.PRIMARY);
        log.debug("Primary stage in room {} at {}: {} faces", roomId, primaryThreshold, primary.size());

        List<FaceHit> relaxed = List.of();
        if (primary.isEmpty()) {
            relaxed = storageService.search(
                SearchQuery.withThreshold(embedding, maxResults, roomId, properties.getFallbackThreshold()));
            stages.add(SearchStage.FALLBACK);
            log.debug("Fallback stage in room {} at {}: {} faces",
                roomId, properties.getFallbackThreshold(), relaxed.size());
        } else if (primary.size() < properties.getSufficiencyCount()) {
            double expandThreshold = Math.max(properties.getFloorThreshold(),
                primaryThreshold - properties.getExpandDelta());
            relaxed = storageService.search(
                SearchQuery.withThreshold(embedding, maxResults, roomId, expandThreshold));
            stages.add(SearchStage.EXPAND);
            log.debug("Expand stage in room {} at {}: {} faces", roomId, expandThreshold, relaxed.size());
        }

        List<FaceHit> merged = merge(primary, relaxed);
        stages.add(SearchStage.MERGED);
        log.info("Search in room {}: {} primary, {} merged faces, stages {}",
            roomId, primary.size(), merged.size(), stages);
        return new OrchestratedSearch(merged, stages, primary.size());
    }

    public double defaultPrimaryThreshold() {
        return properties.getPrimaryThreshold();
    }

    public int defaultMaxResults() {
        return properties.getMaxResults();
    }

    /**
     * Объединение этапов без повторов; найденное только ослабленным этапом помечается expanded
     */
    static List<FaceHit> merge(List<FaceHit> primary, List<FaceHit> relaxed) {
        Map<Long, FaceHit> byId = new LinkedHashMap<>();
        for (FaceHit hit : primary) {
            byId.putIfAbsent(hit.faceId(), hit);
        }
        for (FaceHit hit : relaxed) {
            byId.putIfAbsent(hit.faceId(), hit.asExpanded());
        }
        List<FaceHit> merged = new ArrayList<>(byId.values());
        merged.sort(RANKING);
        return merged;
    }
}
