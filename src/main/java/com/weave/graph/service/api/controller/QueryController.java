package com.weave.graph.service.api.controller;

import com.weave.graph.service.api.dto.ApiResponse;
import com.weave.graph.service.model.Node;
import com.weave.graph.service.model.NodeType;
import com.weave.graph.service.session.GraphSessionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Controller for graph retrieval. Queries returning two or more nodes
 * strengthen the edges among them.
 */
@Slf4j
@RestController
@Tag(name = "Queries", description = "Endpoints for label and type retrieval")
@RequiredArgsConstructor
public class QueryController {

    private final GraphSessionService sessionService;

    @GetMapping("/sessions/{chatId}/query")
    @Operation(summary = "Query by label",
               description = "Case-insensitive substring match on labels, most frequent first")
    public ResponseEntity<ApiResponse<List<Node>>> queryGraph(
            @Parameter(description = "Chat ID") @PathVariable String chatId,
            @Parameter(description = "Label substring") @RequestParam("q") String query,
            @Parameter(description = "Maximum results") @RequestParam(defaultValue = "10") int limit) {
        var results = sessionService.queryGraph(chatId, query, limit);
        log.debug("Query '{}' in chat {} returned {} nodes", query, chatId, results.size());
        return ResponseEntity.ok(ApiResponse.success(results));
    }

    @GetMapping("/sessions/{chatId}/nodes")
    @Operation(summary = "Query by type")
    public ResponseEntity<ApiResponse<List<Node>>> queryByType(
            @Parameter(description = "Chat ID") @PathVariable String chatId,
            @Parameter(description = "Node type") @RequestParam NodeType type) {
        return ResponseEntity.ok(ApiResponse.success(sessionService.queryByType(chatId, type)));
    }
}
