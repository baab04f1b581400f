package com.assign.x.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AssignmentResponse {
    private String requestId;
    private String strategy;
    private int size;
    private int[] assignment;
    private double totalCost;
    private int augmentations;
    private int potentialAdjustments;
    private long durationMillis;
}
