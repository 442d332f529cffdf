package com.williamcallahan.nutrichat.web;

import com.williamcallahan.nutrichat.domain.richtext.RichTextErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps request binding failures to the shared error payload.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

    private final ExceptionResponseBuilder exceptionBuilder;

    public ApiExceptionHandler(ExceptionResponseBuilder exceptionBuilder) {
        this.exceptionBuilder = exceptionBuilder;
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<RichTextErrorResponse> handleUnreadableBody(HttpMessageNotReadableException exception) {
        logger.warn("Unreadable request body: {}", exception.getMessage());
        return exceptionBuilder.buildErrorResponse(HttpStatus.BAD_REQUEST, "Malformed request body");
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public ResponseEntity<RichTextErrorResponse> handleUnsupportedMediaType(
            HttpMediaTypeNotSupportedException exception) {
        logger.warn("Unsupported media type: {}", exception.getMessage());
        return exceptionBuilder.buildErrorResponse(
            HttpStatus.UNSUPPORTED_MEDIA_TYPE, "Unsupported media type", exception);
    }
}
