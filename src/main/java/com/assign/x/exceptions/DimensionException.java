package com.assign.x.exceptions;

/**
 * Thrown when a cost matrix is not a non-empty square: no rows, a missing row, or a row whose
 * length differs from the number of rows. Always raised before the solver mutates anything.
 */
public class DimensionException extends BadRequestException {

    public DimensionException(String message) {
        super(message);
    }
}
