package com.weave.graph.service.api.dto;

import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * DTO naming archived nodes to bring back into the active graph.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RestoreArchiveRequest {

    @NotEmpty(message = "nodeIds are required")
    private List<String> nodeIds;
}
