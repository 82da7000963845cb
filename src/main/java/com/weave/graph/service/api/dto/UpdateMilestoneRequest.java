package com.weave.graph.service.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DTO for milestone progress updates.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateMilestoneRequest {

    @NotBlank(message = "status is required")
    private String status;

    @PositiveOrZero(message = "actualHours must not be negative")
    private Double actualHours;
}
