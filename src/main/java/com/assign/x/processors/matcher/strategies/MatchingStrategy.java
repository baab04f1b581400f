package com.assign.x.processors.matcher.strategies;

import com.assign.x.dto.AssignmentResult;
import com.assign.x.processors.instrumentation.SolverStepListener;

public interface MatchingStrategy {
    AssignmentResult solve(double[][] costs, SolverStepListener listener);
    boolean supports(String mode);
    String name();
}
