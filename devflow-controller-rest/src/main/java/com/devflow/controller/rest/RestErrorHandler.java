package com.devflow.controller.rest;

import com.devflow.process.error.AnalysisFaultException;
import com.devflow.process.error.EmptyEventLogException;
import com.devflow.process.error.EventValidationException;
import com.devflow.process.error.InvariantViolationException;
import java.time.Instant;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.ServletWebRequest;
import org.springframework.web.context.request.WebRequest;

/**
 * Maps analysis failures to client-visible errors. No report is produced for a failed input.
 */
@Slf4j
@RestControllerAdvice
public class RestErrorHandler {

    static final String CODE_UNREADABLE = "request.unreadable";
    static final String CODE_INVALID = "request.invalid";

    @ExceptionHandler(EventValidationException.class)
    public ResponseEntity<ErrorPayload> handleInvalidEvent(EventValidationException ex, WebRequest request) {
        log.warn("Rejected event log: {} (index={}, field={})", ex.getMessage(), ex.eventIndex(), ex.field());
        return build(HttpStatus.BAD_REQUEST, ex.errorCode(), ex.getMessage(), request);
    }

    @ExceptionHandler(EmptyEventLogException.class)
    public ResponseEntity<ErrorPayload> handleEmptyLog(EmptyEventLogException ex, WebRequest request) {
        log.warn("Rejected empty event log");
        return build(HttpStatus.UNPROCESSABLE_ENTITY, ex.errorCode(), ex.getMessage(), request);
    }

    @ExceptionHandler(InvariantViolationException.class)
    public ResponseEntity<ErrorPayload> handleInvariant(InvariantViolationException ex, WebRequest request) {
        log.error("Event ordering invariant violated in case {}", ex.caseId(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, ex.errorCode(), ex.getMessage(), request);
    }

    @ExceptionHandler(AnalysisFaultException.class)
    public ResponseEntity<ErrorPayload> handleFault(AnalysisFaultException ex, WebRequest request) {
        log.error("Process analysis failed internally", ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, ex.errorCode(), ex.getMessage(), request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorPayload> handleUnreadable(HttpMessageNotReadableException ex, WebRequest request) {
        return build(HttpStatus.BAD_REQUEST, CODE_UNREADABLE, "Request body could not be read", request);
    }

    @ExceptionHandler({IllegalArgumentException.class, IllegalStateException.class})
    public ResponseEntity<ErrorPayload> handleBadRequest(RuntimeException ex, WebRequest request) {
        return build(HttpStatus.BAD_REQUEST, CODE_INVALID, ex.getMessage(), request);
    }

    private ResponseEntity<ErrorPayload> build(HttpStatus status, String code, String message, WebRequest request) {
        String path = null;
        if (request instanceof ServletWebRequest servletRequest) {
            path = servletRequest.getRequest().getRequestURI();
        }
        ErrorPayload body =
                new ErrorPayload(Instant.now(), status.value(), status.getReasonPhrase(), code, message, path);
        return ResponseEntity.status(status).body(body);
    }
}
