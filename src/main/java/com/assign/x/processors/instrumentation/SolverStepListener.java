package com.assign.x.processors.instrumentation;

import com.assign.x.dto.SolverSnapshot;
import com.assign.x.models.SolverState;

/**
 * Observer notified by the Hungarian solver after each state transition.
 * <p>
 * Snapshots are copies; nothing a listener does can change the solve. Exceptions thrown here are logged
 * by the solver and otherwise ignored.
 * </p>
 */
@FunctionalInterface
public interface SolverStepListener {

    SolverStepListener NO_OP = (state, snapshot) -> { };

    void onTransition(SolverState state, SolverSnapshot snapshot);
}
