package com.weave.graph.service.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * DTO for an ERROR node and the corrections pointing at it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CorrectedErrorResponse {
    private String errorNodeId;
    private String errorLabel;
    private boolean suppressed;
    private List<String> correctionNodeIds;
}
