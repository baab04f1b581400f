package com.assign.x.dto;

import lombok.Builder;
import lombok.Getter;

/**
 * Outcome of one solve: the row to column permutation and its cost against the original matrix.
 */
@Getter
@Builder
public class AssignmentResult {
    private final String strategy;
    private final int[] assignment;
    private final double totalCost;
    /** Sum of the row and column minima removed by the initial reduction. */
    private final double reductionOffset;
    private final int augmentations;
    private final int potentialAdjustments;
    private final int iterations;

    public int size() {
        return assignment.length;
    }
}
