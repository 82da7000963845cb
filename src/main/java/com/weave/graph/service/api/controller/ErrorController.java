package com.weave.graph.service.api.controller;

import com.weave.graph.service.api.dto.ApiResponse;
import com.weave.graph.service.api.dto.CorrectedErrorResponse;
import com.weave.graph.service.api.dto.SuppressErrorRequest;
import com.weave.graph.service.api.dto.SuppressErrorResponse;
import com.weave.graph.service.engine.ErrorSuppression;
import com.weave.graph.service.model.Node;
import com.weave.graph.service.session.GraphSessionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Controller for error suppression and correction tracking.
 */
@Slf4j
@RestController
@Tag(name = "Errors", description = "Endpoints for suppressing errors and listing corrections")
@RequiredArgsConstructor
public class ErrorController {

    private final GraphSessionService sessionService;

    @PostMapping("/sessions/{chatId}/errors/{nodeId}/suppress")
    @Operation(summary = "Suppress error",
               description = "Marks the ERROR node suppressed and records a CORRECTION for it. " +
                       "A missing node is created as an ERROR first.")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Error suppressed"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Node is not an ERROR")
    })
    public ResponseEntity<ApiResponse<SuppressErrorResponse>> suppressError(
            @Parameter(description = "Chat ID") @PathVariable String chatId,
            @Parameter(description = "Error node ID") @PathVariable String nodeId,
            @Valid @RequestBody SuppressErrorRequest request) {
        var result = sessionService.suppressError(chatId, nodeId, request.getLabel(), request.getDescription());

        var response = SuppressErrorResponse.builder()
                .errorNodeId(result.error().id())
                .correctionNodeId(result.correction().id())
                .correctionEdgeId(result.correctionEdge().id())
                .errorLabel(request.getLabel())
                .suppressed(ErrorSuppression.isSuppressed(result.error()))
                .build();
        return ResponseEntity.ok(ApiResponse.success(response));
    }

    @GetMapping("/sessions/{chatId}/errors/uncorrected")
    @Operation(summary = "List uncorrected errors", description = "ERROR nodes with no CORRECTS edge pointing at them")
    public ResponseEntity<ApiResponse<List<Node>>> listUncorrected(
            @Parameter(description = "Chat ID") @PathVariable String chatId) {
        return ResponseEntity.ok(ApiResponse.success(sessionService.findUncorrectedErrors(chatId)));
    }

    @GetMapping("/sessions/{chatId}/errors/corrected")
    @Operation(summary = "List corrected errors", description = "ERROR nodes with the corrections pointing at them")
    public ResponseEntity<ApiResponse<List<CorrectedErrorResponse>>> listCorrected(
            @Parameter(description = "Chat ID") @PathVariable String chatId) {
        var corrected = sessionService.findCorrectedErrors(chatId).values().stream()
                .map(this::toResponse)
                .toList();
        return ResponseEntity.ok(ApiResponse.success(corrected));
    }

    private CorrectedErrorResponse toResponse(ErrorSuppression.CorrectedError corrected) {
        return CorrectedErrorResponse.builder()
                .errorNodeId(corrected.error().id())
                .errorLabel(corrected.error().label())
                .suppressed(ErrorSuppression.isSuppressed(corrected.error()))
                .correctionNodeIds(corrected.corrections().stream().map(Node::id).toList())
                .build();
    }
}
