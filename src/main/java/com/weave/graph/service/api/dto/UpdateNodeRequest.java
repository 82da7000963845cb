package com.weave.graph.service.api.dto;

import com.weave.graph.service.model.NodeType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * DTO for partial node updates. Null fields are left unchanged.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateNodeRequest {
    private NodeType type;
    private String label;
    private String description;
    private Map<String, Object> metadata;
}
