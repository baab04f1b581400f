package com.assign.x.exceptions;

import com.assign.x.dto.SolverSnapshot;
import com.assign.x.models.SolverState;
import lombok.Getter;

/**
 * Thrown when a condition the Hungarian solver relies on does not hold at runtime.
 * <p>
 * Carries the {@link SolverState} the solver was in and, when the failure happened after the
 * working matrix was built, a {@link SolverSnapshot} of the matrix, coverage and matching.
 * </p>
 */
@Getter
public class InternalInvariantException extends InternalServerErrorException {

    private final SolverState state;
    private final transient SolverSnapshot snapshot;

    public InternalInvariantException(String message, SolverState state) {
        this(message, state, null, null);
    }

    public InternalInvariantException(String message, SolverState state, SolverSnapshot snapshot, Throwable cause) {
        super(message + " [state=" + state + "]", cause);
        this.state = state;
        this.snapshot = snapshot;
    }

    /**
     * Returns a copy of this exception enriched with the solver snapshot taken at the point of failure.
     */
    public InternalInvariantException withSnapshot(SolverSnapshot snapshot) {
        return new InternalInvariantException(rawMessage(), state, snapshot, this);
    }

    private String rawMessage() {
        String message = getMessage();
        int idx = message.lastIndexOf(" [state=");
        return idx < 0 ? message : message.substring(0, idx);
    }
}
