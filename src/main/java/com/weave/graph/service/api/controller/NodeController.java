package com.weave.graph.service.api.controller;

import com.weave.graph.service.api.advice.ResourceNotFoundException;
import com.weave.graph.service.api.dto.ApiResponse;
import com.weave.graph.service.api.dto.SaveNodeRequest;
import com.weave.graph.service.api.dto.UpdateMilestoneRequest;
import com.weave.graph.service.api.dto.UpdateNodeRequest;
import com.weave.graph.service.model.Edge;
import com.weave.graph.service.model.Node;
import com.weave.graph.service.model.NodeUpdate;
import com.weave.graph.service.session.GraphSessionService;
import com.weave.graph.service.session.NodeDraft;
import com.weave.graph.service.session.NodeResult;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
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
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Controller for node storage, including milestone progress.
 */
@Slf4j
@RestController
@Tag(name = "Nodes", description = "Endpoints for saving, reading and updating nodes")
@RequiredArgsConstructor
public class NodeController {

    private static final String DIRECTION_IN = "in";

    private final GraphSessionService sessionService;

    @PostMapping("/sessions/{chatId}/nodes")
    @Operation(summary = "Save node",
               description = "Inserts a node and links it to similar historical nodes, " +
                       "or updates the node in place if the id already exists")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "201", description = "Node created"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Node updated"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Invalid request")
    })
    public ResponseEntity<ApiResponse<NodeResult>> saveNode(
            @Parameter(description = "Chat ID") @PathVariable String chatId,
            @Valid @RequestBody SaveNodeRequest request) {
        var result = sessionService.saveNode(chatId, toDraft(request));
        log.info("Node {} {} in chat {} ({} synapses)", result.node().id(),
                result.created() ? "created" : "updated", chatId, result.synapses().size());

        var status = result.created() ? HttpStatus.CREATED : HttpStatus.OK;
        return ResponseEntity.status(status).body(ApiResponse.success(result));
    }

    @GetMapping("/sessions/{chatId}/nodes/{nodeId}")
    @Operation(summary = "Get node")
    public ResponseEntity<ApiResponse<Node>> getNode(
            @Parameter(description = "Chat ID") @PathVariable String chatId,
            @Parameter(description = "Node ID") @PathVariable String nodeId) {
        return sessionService.getNode(chatId, nodeId)
                .map(node -> ResponseEntity.ok(ApiResponse.success(node)))
                .orElseThrow(() -> new ResourceNotFoundException("Node", nodeId));
    }

    @PatchMapping("/sessions/{chatId}/nodes/{nodeId}")
    @Operation(summary = "Update node", description = "Partial update; frequency is not updatable here")
    public ResponseEntity<ApiResponse<Node>> updateNode(
            @Parameter(description = "Chat ID") @PathVariable String chatId,
            @Parameter(description = "Node ID") @PathVariable String nodeId,
            @RequestBody UpdateNodeRequest request) {
        var update = NodeUpdate.builder()
                .type(request.getType())
                .label(request.getLabel())
                .description(request.getDescription())
                .metadata(request.getMetadata())
                .build();
        return sessionService.updateNode(chatId, nodeId, update)
                .map(node -> ResponseEntity.ok(ApiResponse.success(node)))
                .orElseThrow(() -> new ResourceNotFoundException("Node", nodeId));
    }

    @PostMapping("/sessions/{chatId}/nodes/{nodeId}/access")
    @Operation(summary = "Record node access", description = "Increments the node's frequency by one")
    public ResponseEntity<ApiResponse<Node>> recordAccess(
            @Parameter(description = "Chat ID") @PathVariable String chatId,
            @Parameter(description = "Node ID") @PathVariable String nodeId) {
        return sessionService.incrementFrequency(chatId, nodeId)
                .map(node -> ResponseEntity.ok(ApiResponse.success(node)))
                .orElseThrow(() -> new ResourceNotFoundException("Node", nodeId));
    }

    @DeleteMapping("/sessions/{chatId}/nodes/{nodeId}")
    @Operation(summary = "Delete node", description = "Deletes the node and every edge touching it")
    public ResponseEntity<Void> deleteNode(
            @Parameter(description = "Chat ID") @PathVariable String chatId,
            @Parameter(description = "Node ID") @PathVariable String nodeId) {
        if (!sessionService.deleteNode(chatId, nodeId)) {
            throw new ResourceNotFoundException("Node", nodeId);
        }
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/sessions/{chatId}/nodes/{nodeId}/edges")
    @Operation(summary = "List node edges", description = "Outgoing edges by default, incoming with direction=in")
    public ResponseEntity<ApiResponse<List<Edge>>> getNodeEdges(
            @Parameter(description = "Chat ID") @PathVariable String chatId,
            @Parameter(description = "Node ID") @PathVariable String nodeId,
            @Parameter(description = "out or in") @RequestParam(defaultValue = "out") String direction) {
        var edges = DIRECTION_IN.equalsIgnoreCase(direction)
                ? sessionService.getEdgesTo(chatId, nodeId)
                : sessionService.getEdgesFrom(chatId, nodeId);
        return ResponseEntity.ok(ApiResponse.success(edges));
    }

    @GetMapping("/sessions/{chatId}/orphans")
    @Operation(summary = "List orphan nodes", description = "Nodes with no incoming or outgoing edges")
    public ResponseEntity<ApiResponse<List<Node>>> listOrphans(
            @Parameter(description = "Chat ID") @PathVariable String chatId) {
        return ResponseEntity.ok(ApiResponse.success(sessionService.listOrphans(chatId)));
    }

    // ==================== Milestones ====================

    @PutMapping("/sessions/{chatId}/milestones/{milestoneId}")
    @Operation(summary = "Update milestone", description = "Records status and actual hours on a MILESTONE node")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Milestone updated"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Node not found"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Node is not a milestone")
    })
    public ResponseEntity<ApiResponse<Node>> updateMilestone(
            @Parameter(description = "Chat ID") @PathVariable String chatId,
            @Parameter(description = "Milestone node ID") @PathVariable String milestoneId,
            @Valid @RequestBody UpdateMilestoneRequest request) {
        var node = sessionService.updateMilestone(chatId, milestoneId, request.getStatus(), request.getActualHours());
        log.info("Milestone {} in chat {} set to {}", milestoneId, chatId, request.getStatus());
        return ResponseEntity.ok(ApiResponse.success(node));
    }

    @GetMapping("/sessions/{chatId}/milestones/next")
    @Operation(summary = "Next action", description = "First milestone whose status is not DONE")
    public ResponseEntity<ApiResponse<Node>> getNextAction(
            @Parameter(description = "Chat ID") @PathVariable String chatId) {
        return sessionService.getNextAction(chatId)
                .map(node -> ResponseEntity.ok(ApiResponse.success(node)))
                .orElseThrow(() -> new ResourceNotFoundException("No pending milestone in session " + chatId));
    }

    private NodeDraft toDraft(SaveNodeRequest request) {
        return NodeDraft.builder()
                .id(request.getId())
                .type(request.getType())
                .label(request.getLabel())
                .description(request.getDescription())
                .metadata(request.getMetadata())
                .frequency(request.getFrequency())
                .build();
    }
}
