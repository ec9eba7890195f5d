package com.facefinder.main.service;

import com.facefinder.common.exception.DimensionMismatchException;
import com.facefinder.common.exception.RoomNotFoundException;
import com.facefinder.common.model.FaceRecord;
import com.facefinder.common.model.MatchGroup;
import com.facefinder.common.model.NewFace;
import com.facefinder.common.model.RoomInfo;
import com.facefinder.common.model.RoomStats;
import com.facefinder.main.filter.SearchCriteria;
import com.facefinder.main.search.MatchAggregator;
import com.facefinder.main.search.OrchestratedSearch;
import com.facefinder.main.search.SearchOrchestrator;
import com.facefinder.main.session.SearchSession;
import com.facefinder.main.session.SearchSessionRegistry;
import com.facefinder.main.session.SessionQueryResult;
import com.facefinder.main.session.SessionSearchService;
import com.facefinder.storage.service.FaceStorageService;
import com.facefinder.storage.similarity.VectorSimilarity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Service for face operations.
 * Ingestion goes straight to the storage layer, searches run through the staged orchestrator.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FaceSearchService {

    private final FaceStorageService storageService;
    private final SearchOrchestrator orchestrator;
    private final MatchAggregator aggregator;
    private final SearchSessionRegistry sessionRegistry;
    private final SessionSearchService sessionSearchService;
    private final VectorSimilarity vectorSimilarity;

    /**
     * Add one face to a room
     * @return id assigned to the face
     */
    public long insert(String roomId, NewFace face) {
        log.debug("Adding face of photo {} to room {}", face.photo(), roomId);
        return storageService.insert(roomId, face).id();
    }

    /**
     * Add faces to a room in one atomic batch
     * @return assigned ids, contiguous and increasing
     */
    public List<Long> insertBatch(String roomId, List<NewFace> faces) {
        log.debug("Adding {} faces to room {}", faces.size(), roomId);
        return storageService.insertBatch(roomId, faces).stream().map(FaceRecord::id).toList();
    }

    /**
     * Staged search grouped by photo
     * @param threshold primary threshold, configured default when null
     * @param k         result cap per stage, configured default when null
     */
    public List<MatchGroup> search(String roomId, float[] embedding, Integer k, Double threshold) {
        OrchestratedSearch result = orchestrator.search(roomId, embedding,
            threshold != null ? threshold : orchestrator.defaultPrimaryThreshold(),
            k != null ? k : orchestrator.defaultMaxResults());
        return aggregator.aggregate(result.hits());
    }

    public int deleteByPhoto(String roomId, String photo) {
        log.debug("Deleting faces of photo {} from room {}", photo, roomId);
        return storageService.deleteByPhoto(roomId, photo);
    }

    public void reset(String roomId) {
        storageService.reset(roomId);
    }

    public RoomStats stats(String roomId) {
        return storageService.stats(roomId);
    }

    public RoomInfo createRoom(String roomId, String name, Integer dimension) {
        return storageService.createRoom(roomId, name, dimension);
    }

    public boolean dropRoom(String roomId) {
        return storageService.dropRoom(roomId);
    }

    public Optional<RoomInfo> getRoom(String roomId) {
        return storageService.getRoomInfo(roomId);
    }

    public List<RoomInfo> listRooms() {
        return storageService.listRooms();
    }

    public List<String> listLocations(String roomId) {
        return storageService.listLocations(roomId);
    }

    public boolean rebuildIndex(String roomId) {
        return storageService.rebuildIndex(roomId);
    }

    public boolean isHealthy() {
        return storageService.isHealthy();
    }

    /**
     * Open a session bound to a reference face; the session keeps a normalized copy
     * @throws RoomNotFoundException      when the room does not exist
     * @throws DimensionMismatchException when the face does not match the room's dimension
     * @throws IllegalArgumentException   for a zero vector
     */
    public SearchSession createSession(String roomId, float[] referenceEmbedding) {
        RoomInfo room = storageService.getRoomInfo(roomId)
            .orElseThrow(() -> new RoomNotFoundException(roomId));
        if (referenceEmbedding.length != room.dimension()) {
            throw new DimensionMismatchException(room.dimension(), referenceEmbedding.length);
        }
        return sessionRegistry.create(roomId, vectorSimilarity.normalize(referenceEmbedding));
    }

    public Optional<SearchSession> getSession(String sessionId) {
        return sessionRegistry.get(sessionId);
    }

    public SessionQueryResult query(String sessionId, String text, SearchCriteria criteria) {
        return sessionSearchService.query(sessionId, text, criteria);
    }
}
