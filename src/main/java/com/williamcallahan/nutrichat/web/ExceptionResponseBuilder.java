package com.williamcallahan.nutrichat.web;

import com.williamcallahan.nutrichat.domain.richtext.RichTextErrorResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;

/**
 * Centralized utility for building consistent error responses across controllers.
 */
@Component
public class ExceptionResponseBuilder {

    /**
     * Builds a standardized error response with status and message.
     *
     * @param status The HTTP status code
     * @param message The error message
     * @return ResponseEntity with error details
     */
    public ResponseEntity<RichTextErrorResponse> buildErrorResponse(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(new RichTextErrorResponse(message, null));
    }

    /**
     * Builds a standardized error response with status, message, and exception details.
     *
     * @param status The HTTP status code
     * @param message The error message
     * @param exception The exception that occurred
     * @return ResponseEntity with error details
     */
    public ResponseEntity<RichTextErrorResponse> buildErrorResponse(HttpStatus status, String message,
                                                                    Exception exception) {
        return ResponseEntity.status(status).body(new RichTextErrorResponse(message, describeException(exception)));
    }

    /**
     * Describes an exception for API clients without exposing a stack trace.
     *
     * @param exception exception to describe
     * @return exception type and message, or null when no exception is provided
     */
    public String describeException(Exception exception) {
        if (exception == null) {
            return null;
        }
        String message = exception.getMessage();
        String typeName = exception.getClass().getSimpleName();
        return message == null || message.isBlank() ? typeName : typeName + ": " + message;
    }
}
