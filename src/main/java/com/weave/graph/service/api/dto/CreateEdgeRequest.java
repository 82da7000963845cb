package com.weave.graph.service.api.dto;

import com.weave.graph.service.model.EdgeType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * DTO for creating an edge between two existing nodes.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateEdgeRequest {

    @NotBlank(message = "sourceId is required")
    private String sourceId;

    @NotBlank(message = "targetId is required")
    private String targetId;

    @NotNull(message = "type is required")
    private EdgeType type;

    /**
     * Defaults to 1.0.
     */
    private Double weight;

    private Map<String, Object> metadata;
}
