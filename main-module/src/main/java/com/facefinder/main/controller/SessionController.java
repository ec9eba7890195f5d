package com.facefinder.main.controller;

import com.facefinder.common.exception.SessionExpiredException;
import com.facefinder.main.dto.CreateSessionRequest;
import com.facefinder.main.dto.SessionQueryRequest;
import com.facefinder.main.dto.SessionResponse;
import com.facefinder.main.service.FaceSearchService;
import com.facefinder.main.session.SearchSession;
import com.facefinder.main.session.SessionQueryResult;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping("/api/sessions")
@RequiredArgsConstructor
@Tag(name = "Search Sessions", description = "Short-lived sessions bound to a guest's reference face")
public class SessionController {

    private final FaceSearchService faceSearchService;

    @PostMapping
    @Operation(summary = "Open a session", description = "Bind a reference face to a new session")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "201", description = "Session created"),
        @ApiResponse(responseCode = "404", description = "Room not found")
    })
    public ResponseEntity<SessionResponse> createSession(@Valid @RequestBody CreateSessionRequest request) {
        log.info("Received create session request: roomId={}, embedding length={}",
            request.roomId(), request.embedding().length);

        SearchSession session = faceSearchService.createSession(request.roomId(), request.embedding());
        return ResponseEntity.status(HttpStatus.CREATED).body(SessionResponse.from(session));
    }

    @GetMapping("/{sessionId}")
    @Operation(summary = "Get a session", description = "Session details and its query log")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Session found"),
        @ApiResponse(responseCode = "410", description = "Session expired or unknown")
    })
    public ResponseEntity<SessionResponse> getSession(@PathVariable String sessionId) {
        log.info("Received get session request: sessionId={}", sessionId);
        return faceSearchService.getSession(sessionId)
            .map(SessionResponse::from)
            .map(ResponseEntity::ok)
            .orElseThrow(() -> new SessionExpiredException(sessionId));
    }

    @PostMapping("/{sessionId}/query")
    @Operation(summary = "Query a session", description = "Search the session's room for the reference face and filter the photos")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Matched photos and summary"),
        @ApiResponse(responseCode = "400", description = "Invalid criteria"),
        @ApiResponse(responseCode = "410", description = "Session expired or unknown")
    })
    public ResponseEntity<SessionQueryResult> query(@PathVariable String sessionId,
                                                    @Valid @RequestBody SessionQueryRequest request) {
        log.info("Received session query: sessionId={}, query='{}'", sessionId, request.query());
        return ResponseEntity.ok(faceSearchService.query(sessionId, request.query(), request.criteria()));
    }
}
