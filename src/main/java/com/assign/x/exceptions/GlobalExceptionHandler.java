package com.assign.x.exceptions;

import com.assign.x.models.Error;
import com.assign.x.utils.basic.ErrorUtility;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.BindingResult;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;


/**
 * Global exception handler for the assignment endpoints.
 * <p>
 * Each exception type is mapped to a specific HTTP status code and an {@link Error} body.
 * </p>
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * Handles {@link BadRequestException}, including {@link DimensionException}, with a HTTP 400 response.
     *
     * @param e the {@link BadRequestException} to be handled.
     * @return a {@link ResponseEntity} containing the error details and a HTTP 400 status.
     */
    @ExceptionHandler(BadRequestException.class)
    public ResponseEntity<Error> handleBadRequestException(BadRequestException e) {
        return new ResponseEntity<>(ErrorUtility.getError(e.getMessage(), HttpStatus.BAD_REQUEST), HttpStatus.BAD_REQUEST);
    }

    /**
     * Handles {@link MethodArgumentNotValidException} and returns a HTTP 400 Bad Request response with validation errors.
     *
     * @param ex the {@link MethodArgumentNotValidException} to be handled.
     * @return a {@link ResponseEntity} containing the validation errors and a HTTP 400 status.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Error> handleValidationException(MethodArgumentNotValidException ex) {
        BindingResult bindingResult = ex.getBindingResult();
        StringBuilder errorMessage = new StringBuilder("Invalid request parameters:");

        for (FieldError fieldError : bindingResult.getFieldErrors()) {
            errorMessage.append(" Field '").append(fieldError.getField())
                    .append("' ").append(fieldError.getDefaultMessage()).append("; ");
        }
        return new ResponseEntity<>(ErrorUtility.getError(errorMessage.toString(), HttpStatus.BAD_REQUEST), HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Error> handleUnreadableBody(HttpMessageNotReadableException e) {
        return new ResponseEntity<>(ErrorUtility.getError("Malformed request body", HttpStatus.BAD_REQUEST), HttpStatus.BAD_REQUEST);
    }

    /**
     * Handles {@link InternalInvariantException}; the message names the solver state that failed.
     *
     * @param e the {@link InternalInvariantException} to be handled.
     * @return a {@link ResponseEntity} containing the error details and a HTTP 500 status.
     */
    @ExceptionHandler(InternalInvariantException.class)
    public ResponseEntity<Error> handleInternalInvariantException(InternalInvariantException e) {
        return new ResponseEntity<>(ErrorUtility.getError(e.getMessage(), HttpStatus.INTERNAL_SERVER_ERROR), HttpStatus.INTERNAL_SERVER_ERROR);
    }

    /**
     * Handles {@link InternalServerErrorException} and returns a HTTP 500 Internal Server Error response with the error details.
     *
     * @param e the {@link InternalServerErrorException} to be handled.
     * @return a {@link ResponseEntity} containing the error details and a HTTP 500 status.
     */
    @ExceptionHandler(InternalServerErrorException.class)
    public ResponseEntity<Error> handleInternalServerErrorException(InternalServerErrorException e) {
        return new ResponseEntity<>(ErrorUtility.getError(e.getMessage(), HttpStatus.INTERNAL_SERVER_ERROR), HttpStatus.INTERNAL_SERVER_ERROR);
    }
}
