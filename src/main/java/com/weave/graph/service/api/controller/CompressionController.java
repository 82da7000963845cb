package com.weave.graph.service.api.controller;

import com.weave.graph.service.api.dto.ApiResponse;
import com.weave.graph.service.api.dto.RestoreArchiveRequest;
import com.weave.graph.service.engine.CompressionEngine;
import com.weave.graph.service.session.GraphSessionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Controller for context compression and the node archive.
 */
@Slf4j
@RestController
@Tag(name = "Compression", description = "Endpoints for archiving low-importance nodes and restoring them")
@RequiredArgsConstructor
public class CompressionController {

    private final GraphSessionService sessionService;

    @PostMapping("/sessions/{chatId}/compress")
    @Operation(summary = "Compress session",
               description = "Archives the least important share of nodes with their edges")
    public ResponseEntity<ApiResponse<CompressionEngine.CompressionResult>> compress(
            @Parameter(description = "Chat ID") @PathVariable String chatId,
            @Parameter(description = "Share of nodes to archive (0..1); configured default when absent")
            @RequestParam(required = false) Double targetReduction) {
        return ResponseEntity.ok(ApiResponse.success(sessionService.compress(chatId, targetReduction)));
    }

    @GetMapping("/sessions/{chatId}/archive")
    @Operation(summary = "Archive contents", description = "Archived node ids and archive counts")
    public ResponseEntity<ApiResponse<Map<String, Object>>> getArchive(
            @Parameter(description = "Chat ID") @PathVariable String chatId) {
        var stats = sessionService.getArchiveStats(chatId);
        Map<String, Object> body = Map.of(
                "archivedNodes", stats.archivedNodes(),
                "archivedEdges", stats.archivedEdges(),
                "nodeIds", sessionService.getArchivedNodeIds(chatId)
        );
        return ResponseEntity.ok(ApiResponse.success(body));
    }

    @PostMapping("/sessions/{chatId}/archive/restore")
    @Operation(summary = "Restore archived nodes",
               description = "Moves archived nodes and their edges back into the active graph")
    public ResponseEntity<ApiResponse<CompressionEngine.Archived>> restore(
            @Parameter(description = "Chat ID") @PathVariable String chatId,
            @Valid @RequestBody RestoreArchiveRequest request) {
        var restored = sessionService.restoreArchived(chatId, request.getNodeIds());
        log.info("Restored {} nodes into chat {}", restored.nodes().size(), chatId);
        return ResponseEntity.ok(ApiResponse.success(restored));
    }
}
