package com.placeguide.recommend.api;

import com.placeguide.recommend.api.dto.ErrorResponse;
import com.placeguide.recommend.query.InvalidTurnRequestException;
import com.placeguide.recommend.store.StoreRequestException;
import com.placeguide.recommend.store.StoreUnavailableException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler({
        HttpMessageNotReadableException.class,
        HttpMediaTypeNotSupportedException.class,
        MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<ErrorResponse> handleMalformed(Exception ex, HttpServletRequest request) {
        return ResponseEntity.badRequest().body(errorResponse("bad_request", "Invalid request", false, request));
    }

    @ExceptionHandler(InvalidTurnRequestException.class)
    public ResponseEntity<ErrorResponse> handleInvalid(InvalidTurnRequestException ex, HttpServletRequest request) {
        return ResponseEntity.badRequest().body(errorResponse("bad_request", ex.getMessage(), false, request));
    }

    @ExceptionHandler(StoreUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleStoreUnavailable(StoreUnavailableException ex, HttpServletRequest request) {
        log.warn("store unavailable method={} path={}: {}", request.getMethod(), request.getRequestURI(), ex.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(errorResponse("store_unavailable", "Storage is temporarily unavailable", true, request));
    }

    @ExceptionHandler(StoreRequestException.class)
    public ResponseEntity<ErrorResponse> handleStoreRequest(StoreRequestException ex, HttpServletRequest request) {
        log.error("store request failed method={} path={}", request.getMethod(), request.getRequestURI(), ex);
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
            .body(errorResponse("store_error", "Storage request failed", false, request));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex, HttpServletRequest request) {
        log.error("unexpected_exception method={} path={}", request.getMethod(), request.getRequestURI(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(errorResponse("internal_error", "Unexpected error", false, request));
    }

    private ErrorResponse errorResponse(String code, String message, boolean retryable, HttpServletRequest request) {
        return new ErrorResponse(
            code,
            message,
            retryable,
            RequestIdUtil.traceId(request),
            RequestIdUtil.requestId(request)
        );
    }
}
