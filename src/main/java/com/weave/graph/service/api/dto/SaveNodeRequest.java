package com.weave.graph.service.api.dto;

import com.weave.graph.service.model.NodeType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * DTO for inserting or upserting a node.
 *
 * When {@code id} names an existing node, that node is updated in place and
 * {@code frequency} is ignored.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SaveNodeRequest {

    /**
     * Optional caller-chosen id; generated when absent.
     */
    private String id;

    @NotNull(message = "type is required")
    private NodeType type;

    @NotBlank(message = "label is required")
    private String label;

    private String description;

    private Map<String, Object> metadata;

    @PositiveOrZero(message = "frequency must not be negative")
    private Integer frequency;
}
