package com.assign.x.exceptions;

/**
 * Exception thrown when the server fails while processing a well-formed request.
 * <p>
 * Solver invariant failures are reported through the {@link InternalInvariantException} subtype;
 * infrastructure failures (interrupted or failed cost-matrix construction) use this type directly.
 * </p>
 */
public class InternalServerErrorException extends RuntimeException {

    /**
     * Constructs a new {@link InternalServerErrorException} with the specified error message.
     *
     * @param m the detail message explaining the error.
     */
    public InternalServerErrorException(String m) {
        super(m);
    }

    public InternalServerErrorException(String m, Throwable cause) {
        super(m, cause);
    }
}
