package com.weave.graph.service.api.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DTO for suppressing an error with a correction.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SuppressErrorRequest {

    /**
     * Error label; the correction is labelled "Correction: &lt;label&gt;".
     * Also used as the error's label if the node does not exist yet.
     */
    @NotBlank(message = "label is required")
    private String label;

    /**
     * What fixed the error.
     */
    @NotBlank(message = "description is required")
    private String description;
}
