package com.facefinder.main.controller;

import com.facefinder.common.model.MatchGroup;
import com.facefinder.common.model.NewFace;
import com.facefinder.main.dto.AddFaceRequest;
import com.facefinder.main.dto.AddFacesRequest;
import com.facefinder.main.dto.SearchRequest;
import com.facefinder.main.service.FaceSearchService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/api/rooms/{roomId}")
@RequiredArgsConstructor
@Tag(name = "Face Operations", description = "Adding, deleting and searching faces of a room")
public class FaceController {

    private final FaceSearchService faceSearchService;

    @PostMapping("/faces")
    @Operation(summary = "Add a face", description = "Store a face embedding and index it")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Face successfully added, id returned"),
        @ApiResponse(responseCode = "400", description = "Wrong embedding dimension or invalid face"),
        @ApiResponse(responseCode = "404", description = "Room not found")
    })
    public ResponseEntity<Long> addFace(@PathVariable String roomId, @Valid @RequestBody AddFaceRequest request) {
        log.info("Received add face request: roomId={}, photo={}, embedding length={}",
            roomId, request.getPhoto(), request.getEmbedding() != null ? request.getEmbedding().length : 0);

        return ResponseEntity.ok(faceSearchService.insert(roomId, request.toNewFace()));
    }

    @PostMapping("/faces/batch")
    @Operation(summary = "Add faces", description = "Store a batch of faces atomically; ids are contiguous")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Faces successfully added, ids returned"),
        @ApiResponse(responseCode = "400", description = "A face in the batch is invalid, nothing was stored"),
        @ApiResponse(responseCode = "404", description = "Room not found")
    })
    public ResponseEntity<List<Long>> addFaces(@PathVariable String roomId,
                                               @Valid @RequestBody AddFacesRequest request) {
        log.info("Received add faces request: roomId={}, count={}", roomId, request.faces().size());

        List<NewFace> faces = request.faces().stream().map(AddFaceRequest::toNewFace).toList();
        return ResponseEntity.ok(faceSearchService.insertBatch(roomId, faces));
    }

    @DeleteMapping("/faces")
    @Operation(summary = "Delete faces of a photo", description = "Delete every face of the given photo")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Number of deleted faces"),
        @ApiResponse(responseCode = "404", description = "Room not found")
    })
    public ResponseEntity<Integer> deleteByPhoto(@PathVariable String roomId, @RequestParam String photo) {
        log.info("Received delete faces request: roomId={}, photo={}", roomId, photo);
        return ResponseEntity.ok(faceSearchService.deleteByPhoto(roomId, photo));
    }

    @PostMapping("/search")
    @Operation(summary = "Find photos of a face",
               description = "Staged similarity search grouped by photo, best photo first")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Matched photos"),
        @ApiResponse(responseCode = "400", description = "Wrong embedding dimension"),
        @ApiResponse(responseCode = "404", description = "Room not found")
    })
    public ResponseEntity<List<MatchGroup>> search(@PathVariable String roomId,
                                                   @Valid @RequestBody SearchRequest request) {
        log.info("Received search request: roomId={}, embedding length={}, k={}, threshold={}",
            roomId, request.getEmbedding() != null ? request.getEmbedding().length : 0,
            request.getK(), request.getThreshold());

        return ResponseEntity.ok(faceSearchService.search(
            roomId, request.getEmbedding(), request.getK(), request.getThreshold()));
    }
}
