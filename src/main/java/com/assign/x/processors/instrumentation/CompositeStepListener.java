package com.assign.x.processors.instrumentation;

import com.assign.x.dto.SolverSnapshot;
import com.assign.x.models.SolverState;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

@Slf4j
public class CompositeStepListener implements SolverStepListener {

    private final List<SolverStepListener> delegates;

    public CompositeStepListener(List<SolverStepListener> delegates) {
        this.delegates = List.copyOf(delegates);
    }

    @Override
    public void onTransition(SolverState state, SolverSnapshot snapshot) {
        for (SolverStepListener delegate : delegates) {
            try {
                delegate.onTransition(state, snapshot);
            } catch (RuntimeException e) {
                log.warn("Step listener {} failed on {}: {}", delegate.getClass().getSimpleName(), state, e.getMessage());
            }
        }
    }
}
