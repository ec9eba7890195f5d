package com.facefinder.main.controller;

import com.facefinder.common.exception.RoomNotFoundException;
import com.facefinder.common.model.RoomInfo;
import com.facefinder.common.model.RoomStats;
import com.facefinder.main.dto.CreateRoomRequest;
import com.facefinder.main.service.FaceSearchService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/api/rooms")
@RequiredArgsConstructor
@Tag(name = "Room Management", description = "Operations for managing rooms and their indexes")
public class RoomController {

    private final FaceSearchService faceSearchService;

    @PostMapping
    @Operation(summary = "Create a room", description = "Create a new room with its own face store and index")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "201", description = "Room successfully created"),
        @ApiResponse(responseCode = "400", description = "Invalid room id or room already exists")
    })
    public ResponseEntity<RoomInfo> createRoom(@Valid @RequestBody CreateRoomRequest request) {
        log.info("Received create room request: id={}, dimension={}", request.id(), request.dimension());

        RoomInfo room = faceSearchService.createRoom(request.id(), request.name(), request.dimension());
        return ResponseEntity.status(HttpStatus.CREATED).body(room);
    }

    @GetMapping
    @Operation(summary = "List rooms", description = "Get the list of all rooms")
    @ApiResponse(responseCode = "200", description = "Rooms successfully retrieved")
    public ResponseEntity<List<RoomInfo>> listRooms() {
        log.info("Received list rooms request");
        return ResponseEntity.ok(faceSearchService.listRooms());
    }

    @GetMapping("/{roomId}")
    @Operation(summary = "Get a room", description = "Get the catalogue entry of a room")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Room found"),
        @ApiResponse(responseCode = "404", description = "Room not found")
    })
    public ResponseEntity<RoomInfo> getRoom(@PathVariable String roomId) {
        log.info("Received get room request: roomId={}", roomId);
        return faceSearchService.getRoom(roomId)
            .map(ResponseEntity::ok)
            .orElseThrow(() -> new RoomNotFoundException(roomId));
    }

    @DeleteMapping("/{roomId}")
    @Operation(summary = "Drop a room", description = "Delete a room with all its faces and its index")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "204", description = "Room dropped"),
        @ApiResponse(responseCode = "404", description = "Room not found")
    })
    public ResponseEntity<Void> dropRoom(@PathVariable String roomId) {
        log.info("Received drop room request: roomId={}", roomId);
        if (!faceSearchService.dropRoom(roomId)) {
            throw new RoomNotFoundException(roomId);
        }
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{roomId}/stats")
    @Operation(summary = "Room statistics", description = "Active and tombstoned faces, index kind and cluster count")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Statistics retrieved"),
        @ApiResponse(responseCode = "404", description = "Room not found")
    })
    public ResponseEntity<RoomStats> stats(@PathVariable String roomId) {
        log.info("Received stats request: roomId={}", roomId);
        return ResponseEntity.ok(faceSearchService.stats(roomId));
    }

    @GetMapping("/{roomId}/locations")
    @Operation(summary = "List locations", description = "Distinct location names among the room's faces")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Locations retrieved"),
        @ApiResponse(responseCode = "404", description = "Room not found")
    })
    public ResponseEntity<List<String>> locations(@PathVariable String roomId) {
        log.info("Received list locations request: roomId={}", roomId);
        return ResponseEntity.ok(faceSearchService.listLocations(roomId));
    }

    @PostMapping("/{roomId}/reset")
    @Operation(summary = "Reset a room", description = "Remove every face of the room; the room itself stays")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "204", description = "Room reset"),
        @ApiResponse(responseCode = "404", description = "Room not found")
    })
    public ResponseEntity<Void> reset(@PathVariable String roomId) {
        log.info("Received reset request: roomId={}", roomId);
        faceSearchService.reset(roomId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{roomId}/rebuild")
    @Operation(summary = "Rebuild the index", description = "Rebuild the room index from the face store")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "204", description = "Index rebuilt"),
        @ApiResponse(responseCode = "404", description = "Room not found")
    })
    public ResponseEntity<Void> rebuild(@PathVariable String roomId) {
        log.info("Received rebuild request: roomId={}", roomId);
        if (!faceSearchService.rebuildIndex(roomId)) {
            throw new RoomNotFoundException(roomId);
        }
        return ResponseEntity.noContent().build();
    }
}
