package com.weave.graph.service.api.dto;

import com.weave.graph.service.model.EdgeType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * DTO for partial edge updates. Endpoints cannot be changed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateEdgeRequest {
    private EdgeType type;
    private Double weight;
    private Map<String, Object> metadata;
}
