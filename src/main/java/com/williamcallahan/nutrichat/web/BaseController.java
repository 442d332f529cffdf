package com.williamcallahan.nutrichat.web;

import com.williamcallahan.nutrichat.domain.richtext.RichTextErrorResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/**
 * Base controller class providing common error handling patterns.
 */
public abstract class BaseController {

    protected final ExceptionResponseBuilder exceptionBuilder;

    /**
     * Creates a base controller wired to the shared exception response builder.
     */
    protected BaseController(ExceptionResponseBuilder exceptionBuilder) {
        this.exceptionBuilder = exceptionBuilder;
    }

    /**
     * Handles service exceptions with standardized error responses.
     *
     * @param exception The exception that occurred
     * @param operation Description of the operation that failed
     * @return Standardized error response
     */
    protected ResponseEntity<RichTextErrorResponse> handleServiceException(Exception exception, String operation) {
        return exceptionBuilder.buildErrorResponse(
                HttpStatus.INTERNAL_SERVER_ERROR, "Failed to " + operation, exception);
    }

    /**
     * Handles validation exceptions with bad request responses.
     *
     * @param validationException The validation exception
     * @return Bad request error response
     */
    protected ResponseEntity<RichTextErrorResponse> handleValidationException(
            IllegalArgumentException validationException) {
        return exceptionBuilder.buildErrorResponse(HttpStatus.BAD_REQUEST, validationException.getMessage());
    }
}
