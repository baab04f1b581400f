package com.assign.x.processors.matcher.strategies;

import com.assign.x.dto.AssignmentResult;
import com.assign.x.processors.instrumentation.SolverStepListener;
import com.assign.x.processors.matcher.hungarian.HungarianSolver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import static com.assign.x.utils.basic.Constant.HUNGARIAN;


@Component("hungarianMatchingStrategy")
@Slf4j
public class HungarianMatchingStrategy implements MatchingStrategy {

    @Override
    public AssignmentResult solve(double[][] costs, SolverStepListener listener) {
        HungarianSolver solver = new HungarianSolver(costs, listener);
        log.debug("Starting Hungarian assignment for {} rows", costs.length);
        return solver.solve();
    }

    @Override
    public boolean supports(String mode) {
        return HUNGARIAN.equalsIgnoreCase(mode);
    }

    @Override
    public String name() {
        return HUNGARIAN;
    }
}
