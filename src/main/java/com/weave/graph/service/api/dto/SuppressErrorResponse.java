package com.weave.graph.service.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DTO for the outcome of an error suppression.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SuppressErrorResponse {
    private String errorNodeId;
    private String correctionNodeId;
    private String correctionEdgeId;
    private String errorLabel;
    private boolean suppressed;
}
