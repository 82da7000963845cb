package com.weave.graph.service.api.controller;

import com.weave.graph.service.api.advice.ResourceNotFoundException;
import com.weave.graph.service.api.dto.ApiResponse;
import com.weave.graph.service.api.dto.CreateEdgeRequest;
import com.weave.graph.service.api.dto.UpdateEdgeRequest;
import com.weave.graph.service.model.Edge;
import com.weave.graph.service.model.EdgeType;
import com.weave.graph.service.model.EdgeUpdate;
import com.weave.graph.service.session.EdgeDraft;
import com.weave.graph.service.session.GraphSessionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Controller for explicit edge management.
 */
@Slf4j
@RestController
@Tag(name = "Edges", description = "Endpoints for creating, reading and updating edges")
@RequiredArgsConstructor
public class EdgeController {

    private final GraphSessionService sessionService;

    @PostMapping("/sessions/{chatId}/edges")
    @Operation(summary = "Create edge", description = "Both endpoints must exist in the session")
    public ResponseEntity<ApiResponse<Edge>> createEdge(
            @Parameter(description = "Chat ID") @PathVariable String chatId,
            @Valid @RequestBody CreateEdgeRequest request) {
        var draft = EdgeDraft.builder()
                .sourceId(request.getSourceId())
                .targetId(request.getTargetId())
                .type(request.getType())
                .weight(request.getWeight())
                .metadata(request.getMetadata())
                .build();
        var edge = sessionService.addEdge(chatId, draft);
        log.debug("Edge {} created in chat {}", edge.id(), chatId);
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success(edge));
    }

    @GetMapping("/sessions/{chatId}/edges")
    @Operation(summary = "List edges by type")
    public ResponseEntity<ApiResponse<List<Edge>>> listEdgesByType(
            @Parameter(description = "Chat ID") @PathVariable String chatId,
            @Parameter(description = "Edge type") @RequestParam EdgeType type) {
        return ResponseEntity.ok(ApiResponse.success(sessionService.queryEdgesByType(chatId, type)));
    }

    @GetMapping("/sessions/{chatId}/edges/{edgeId}")
    @Operation(summary = "Get edge")
    public ResponseEntity<ApiResponse<Edge>> getEdge(
            @Parameter(description = "Chat ID") @PathVariable String chatId,
            @Parameter(description = "Edge ID") @PathVariable String edgeId) {
        return sessionService.getEdge(chatId, edgeId)
                .map(edge -> ResponseEntity.ok(ApiResponse.success(edge)))
                .orElseThrow(() -> new ResourceNotFoundException("Edge", edgeId));
    }

    @PatchMapping("/sessions/{chatId}/edges/{edgeId}")
    @Operation(summary = "Update edge", description = "Partial update of type, weight or metadata")
    public ResponseEntity<ApiResponse<Edge>> updateEdge(
            @Parameter(description = "Chat ID") @PathVariable String chatId,
            @Parameter(description = "Edge ID") @PathVariable String edgeId,
            @RequestBody UpdateEdgeRequest request) {
        var update = EdgeUpdate.builder()
                .type(request.getType())
                .weight(request.getWeight())
                .metadata(request.getMetadata())
                .build();
        return sessionService.updateEdge(chatId, edgeId, update)
                .map(edge -> ResponseEntity.ok(ApiResponse.success(edge)))
                .orElseThrow(() -> new ResourceNotFoundException("Edge", edgeId));
    }

    @DeleteMapping("/sessions/{chatId}/edges/{edgeId}")
    @Operation(summary = "Delete edge")
    public ResponseEntity<Void> deleteEdge(
            @Parameter(description = "Chat ID") @PathVariable String chatId,
            @Parameter(description = "Edge ID") @PathVariable String edgeId) {
        if (!sessionService.deleteEdge(chatId, edgeId)) {
            throw new ResourceNotFoundException("Edge", edgeId);
        }
        return ResponseEntity.noContent().build();
    }
}
