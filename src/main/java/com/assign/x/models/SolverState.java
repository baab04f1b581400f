package com.assign.x.models;

/**
 * Transitions of the Hungarian solver, reported to step listeners and attached to invariant failures.
 */
public enum SolverState {
    VALIDATION,
    REDUCED,
    INITIAL_SELECTION,
    SEARCH,
    ROW_HAS_SELECTION,
    BUILD_PATH,
    AUGMENTED,
    ADJUST_POTENTIALS,
    SOLVED
}
