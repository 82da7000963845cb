package com.weave.graph.service.api.controller;

import com.weave.graph.service.api.advice.ResourceNotFoundException;
import com.weave.graph.service.api.dto.ApiResponse;
import com.weave.graph.service.model.GraphSnapshot;
import com.weave.graph.service.model.GraphStats;
import com.weave.graph.service.persistence.GraphPersistenceManager.SessionSummary;
import com.weave.graph.service.session.GraphSessionService;
import com.weave.graph.service.session.MaintenanceResult;
import com.weave.graph.service.session.SessionContext;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Controller for session lifecycle and session-wide views.
 */
@Slf4j
@RestController
@Tag(name = "Sessions", description = "Endpoints for listing, inspecting and managing chat sessions")
@RequiredArgsConstructor
public class SessionController {

    private final GraphSessionService sessionService;

    @GetMapping("/sessions")
    @Operation(summary = "List sessions", description = "Returns summaries of persisted and open sessions")
    public ResponseEntity<ApiResponse<List<SessionSummary>>> listSessions() {
        var sessions = sessionService.listSessions();
        log.debug("Returning {} session summaries", sessions.size());
        return ResponseEntity.ok(ApiResponse.success(sessions));
    }

    @GetMapping("/sessions/{chatId}")
    @Operation(summary = "Get session context",
               description = "Returns statistics, context-window usage and the most frequent nodes")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Session found"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Session not found")
    })
    public ResponseEntity<ApiResponse<SessionContext>> getSessionContext(
            @Parameter(description = "Chat ID") @PathVariable String chatId) {
        return ResponseEntity.ok(ApiResponse.success(sessionService.getSessionContext(chatId)));
    }

    @GetMapping("/sessions/{chatId}/stats")
    @Operation(summary = "Get graph statistics", description = "Node and edge counts by type")
    public ResponseEntity<ApiResponse<GraphStats>> getStats(
            @Parameter(description = "Chat ID") @PathVariable String chatId) {
        return ResponseEntity.ok(ApiResponse.success(sessionService.getStats(chatId)));
    }

    @GetMapping("/sessions/{chatId}/snapshot")
    @Operation(summary = "Export snapshot", description = "Returns the complete serializable graph of the session")
    public ResponseEntity<ApiResponse<GraphSnapshot>> exportSnapshot(
            @Parameter(description = "Chat ID") @PathVariable String chatId) {
        return ResponseEntity.ok(ApiResponse.success(sessionService.exportSnapshot(chatId)));
    }

    @PostMapping("/sessions/{chatId}/save")
    @Operation(summary = "Save session", description = "Persists an open session immediately")
    public ResponseEntity<ApiResponse<Boolean>> saveSession(
            @Parameter(description = "Chat ID") @PathVariable String chatId) {
        if (!sessionService.saveSession(chatId)) {
            throw new ResourceNotFoundException("Open session", chatId);
        }
        return ResponseEntity.ok(ApiResponse.success(true));
    }

    @PostMapping("/sessions/{chatId}/maintenance")
    @Operation(summary = "Run maintenance cycle", description = "Applies Hebbian decay then prunes weak edges")
    public ResponseEntity<ApiResponse<MaintenanceResult>> runMaintenance(
            @Parameter(description = "Chat ID") @PathVariable String chatId) {
        requireSession(chatId);
        var result = sessionService.runMaintenanceCycle(chatId);
        log.info("Maintenance for chat {}: decayed={}, pruned={}", chatId, result.edgesDecayed(), result.edgesPruned());
        return ResponseEntity.ok(ApiResponse.success(result));
    }

    @DeleteMapping("/sessions/{chatId}")
    @Operation(summary = "Delete session", description = "Closes the session and deletes its persisted graph")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "204", description = "Session deleted"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Session not found")
    })
    public ResponseEntity<Void> deleteSession(
            @Parameter(description = "Chat ID") @PathVariable String chatId) {
        if (!sessionService.deleteSession(chatId)) {
            throw new ResourceNotFoundException("Session", chatId);
        }
        return ResponseEntity.noContent().build();
    }

    private void requireSession(String chatId) {
        if (!sessionService.sessionExists(chatId)) {
            throw new ResourceNotFoundException("Session", chatId);
        }
    }
}
