package com.physio.search.api;

import com.physio.search.api.dto.ErrorResponse;
import com.physio.search.service.InvalidSearchRequestException;
import com.physio.search.store.ExerciseStoreException;
import jakarta.servlet.http.HttpServletRequest;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(InvalidSearchRequestException.class)
    public ResponseEntity<ErrorResponse> handleInvalidRequest(InvalidSearchRequestException ex, HttpServletRequest request) {
        ErrorResponse body = new ErrorResponse(
            "bad_request",
            ex.getMessage(),
            ex.getViolations(),
            RequestIdUtil.resolveTraceId(request),
            RequestIdUtil.resolveOrGenerate(request, "x-request-id")
        );
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, HttpMediaTypeNotSupportedException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex, HttpServletRequest request) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(errorResponse("bad_request", "Invalid request body", request));
    }

    @ExceptionHandler(ExerciseStoreException.class)
    public ResponseEntity<ErrorResponse> handleStoreUnavailable(ExerciseStoreException ex, HttpServletRequest request) {
        ErrorResponse body = errorResponse("store_unavailable", "Exercise store is unavailable", request);
        log.warn("exercise store unavailable trace_id={}: {}", body.getTraceId(), ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex, HttpServletRequest request) {
        ErrorResponse body = errorResponse("internal_error", "Unexpected error", request);
        log.error("unexpected search failure trace_id={}", body.getTraceId(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
    }

    private ErrorResponse errorResponse(String code, String message, HttpServletRequest request) {
        return new ErrorResponse(
            code,
            message,
            List.of(),
            RequestIdUtil.resolveTraceId(request),
            RequestIdUtil.resolveOrGenerate(request, "x-request-id")
        );
    }
}
