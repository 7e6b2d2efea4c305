package com.pgokache.web;

import com.pgokache.api.ErrorResponse;
import com.pgokache.collector.HarvestException;
import com.pgokache.collector.ProbeCheckException;
import com.pgokache.crypto.InvalidCredentialException;
import com.pgokache.logging.MdcKeys;
import com.pgokache.service.InstanceConnectionException;
import com.pgokache.service.InstanceNotFoundException;
import com.pgokache.service.SetupNotReadyException;
import com.pgokache.service.SnapshotNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationExceptions(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return respond(HttpStatus.BAD_REQUEST, "VALIDATION_FAILED", "Input validation failed", details);
    }

    @ExceptionHandler({IllegalArgumentException.class, MethodArgumentTypeMismatchException.class,
            HttpMessageNotReadableException.class})
    public ResponseEntity<ErrorResponse> handleIllegalArgumentException(Exception ex) {
        return respond(HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT", ex.getMessage(), null);
    }

    @ExceptionHandler({InstanceNotFoundException.class, SnapshotNotFoundException.class})
    public ResponseEntity<ErrorResponse> handleRecordNotFound(RuntimeException ex) {
        return respond(HttpStatus.NOT_FOUND, "NOT_FOUND", ex.getMessage(), null);
    }

    @ExceptionHandler(SetupNotReadyException.class)
    public ResponseEntity<ErrorResponse> handleSetupNotReady(SetupNotReadyException ex) {
        return respond(HttpStatus.CONFLICT, "SETUP_NOT_READY", ex.getMessage(), null);
    }

    @ExceptionHandler(InvalidCredentialException.class)
    public ResponseEntity<ErrorResponse> handleInvalidCredential(InvalidCredentialException ex) {
        log.warn("Stored credential could not be decrypted: {}", ex.getMessage());
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, "INVALID_CREDENTIAL",
                "Stored credential could not be decrypted; re-enter the password", ex.getMessage());
    }

    @ExceptionHandler(InstanceConnectionException.class)
    public ResponseEntity<ErrorResponse> handleConnectionFailure(InstanceConnectionException ex) {
        return respond(HttpStatus.BAD_GATEWAY, "CONNECTION_FAILED", "Could not connect to instance", ex.getMessage());
    }

    @ExceptionHandler(ProbeCheckException.class)
    public ResponseEntity<ErrorResponse> handleProbeCheckFailure(ProbeCheckException ex) {
        log.error("Readiness check failed", ex);
        return respond(HttpStatus.BAD_GATEWAY, "PROBE_CHECK_FAILED", ex.getMessage(), causeMessage(ex));
    }

    @ExceptionHandler(HarvestException.class)
    public ResponseEntity<ErrorResponse> handleHarvestFailure(HarvestException ex) {
        log.error("Harvest failed", ex);
        return respond(HttpStatus.BAD_GATEWAY, "HARVEST_FAILED", ex.getMessage(), causeMessage(ex));
    }

    @ExceptionHandler({NoResourceFoundException.class, NoHandlerFoundException.class})
    public ResponseEntity<ErrorResponse> handleNotFoundException(Exception ex) {
        return respond(HttpStatus.NOT_FOUND, "NOT_FOUND", "Not found", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleAllExceptions(Exception ex) {
        log.error("Unhandled exception occurred", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_SERVER_ERROR", "An unexpected error occurred",
                ex.getMessage());
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String code, String message, String details) {
        ErrorResponse error = ErrorResponse.builder()
                .code(code)
                .message(message)
                .details(details)
                .traceId(MDC.get(MdcKeys.TRACE_ID))
                .build();
        return ResponseEntity.status(status).body(error);
    }

    private static String causeMessage(Throwable ex) {
        return ex.getCause() != null ? ex.getCause().getMessage() : null;
    }
}
