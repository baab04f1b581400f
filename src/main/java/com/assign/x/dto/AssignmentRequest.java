package com.assign.x.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AssignmentRequest {
    @NotNull(message = "costs must not be null")
    private double[][] costs;
    private String strategy;
    private boolean traceSteps;
}
