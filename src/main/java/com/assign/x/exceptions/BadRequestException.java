package com.assign.x.exceptions;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Custom exception thrown when an assignment request cannot be served as sent (HTTP 400).
 * <p>
 * Used for unknown strategy names, oversized matrices and, through {@link DimensionException},
 * malformed cost matrices.
 * </p>
 */
@ResponseStatus(HttpStatus.BAD_REQUEST)
public class BadRequestException extends RuntimeException {

    /**
     * Constructs a new BadRequestException with the specified detail message.
     *
     * @param message the detail message which explains the cause of the exception.
     */
    public BadRequestException(String message) {
        super(message);
    }
}
