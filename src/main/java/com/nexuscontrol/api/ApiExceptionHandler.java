package com.nexuscontrol.api;

import com.nexuscontrol.contract.ContractViolationException;
import com.nexuscontrol.control.ImportRejectedException;
import com.nexuscontrol.dispatch.AdapterNotFoundException;
import com.nexuscontrol.dispatch.ApplyNotPermittedException;
import com.nexuscontrol.policy.PolicyViolationException;
import com.nexuscontrol.policy.TemplateNotFoundException;
import com.nexuscontrol.store.DecisionNotFoundException;
import com.nexuscontrol.store.EventStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Unified error body:
 * {
 *   "error_code": "POLICY_VIOLATION",
 *   "message": "...",
 *   "timestamp": "2026-...",
 *   "errors": ["..."]        // contract and policy violations only
 * }
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ContractViolationException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleContractViolation(ContractViolationException ex) {
        log.warn("Contract violation: {}", ex.getMessage());
        Map<String, Object> body = errorResponse("CONTRACT_VIOLATION", ex.getMessage());
        body.put("errors", ex.getViolations());
        return body;
    }

    @ExceptionHandler(PolicyViolationException.class)
    @ResponseStatus(HttpStatus.UNPROCESSABLE_ENTITY)
    public Map<String, Object> handlePolicyViolation(PolicyViolationException ex) {
        Map<String, Object> body = errorResponse("POLICY_VIOLATION", ex.getMessage());
        body.put("errors", ex.getErrors());
        return body;
    }

    @ExceptionHandler(ApplyNotPermittedException.class)
    @ResponseStatus(HttpStatus.FORBIDDEN)
    public Map<String, Object> handleApplyNotPermitted(ApplyNotPermittedException ex) {
        log.warn("Apply refused: {}", ex.getMessage());
        return errorResponse("APPLY_NOT_PERMITTED", ex.getMessage());
    }

    @ExceptionHandler(DecisionNotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Map<String, Object> handleDecisionNotFound(DecisionNotFoundException ex) {
        return errorResponse("DECISION_NOT_FOUND", ex.getMessage());
    }

    @ExceptionHandler(TemplateNotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Map<String, Object> handleTemplateNotFound(TemplateNotFoundException ex) {
        return errorResponse("TEMPLATE_NOT_FOUND", ex.getMessage());
    }

    @ExceptionHandler(AdapterNotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Map<String, Object> handleAdapterNotFound(AdapterNotFoundException ex) {
        return errorResponse("ADAPTER_NOT_FOUND", ex.getMessage());
    }

    @ExceptionHandler(ImportRejectedException.class)
    public ResponseEntity<Map<String, Object>> handleImportRejected(ImportRejectedException ex) {
        log.warn("Import rejected [{}]: {}", ex.getErrorCode(), ex.getMessage());
        HttpStatus status = ImportRejectedException.DECISION_EXISTS.equals(ex.getErrorCode())
            ? HttpStatus.CONFLICT
            : HttpStatus.UNPROCESSABLE_ENTITY;
        return ResponseEntity.status(status).body(errorResponse(ex.getErrorCode(), ex.getMessage()));
    }

    @ExceptionHandler(IllegalStateException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public Map<String, Object> handleIllegalState(IllegalStateException ex) {
        log.warn("Rejected state transition: {}", ex.getMessage());
        return errorResponse("INVALID_STATE", ex.getMessage());
    }

    @ExceptionHandler({
        MethodArgumentTypeMismatchException.class,
        HttpMessageNotReadableException.class
    })
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleParseErrors(Exception ex) {
        return errorResponse("BAD_REQUEST", "request format is invalid: " + ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleIllegalArgument(IllegalArgumentException ex) {
        return errorResponse("INVALID_ARGUMENT", ex.getMessage());
    }

    @ExceptionHandler(EventStoreException.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handleStoreFailure(EventStoreException ex) {
        log.error("Event store failure", ex);
        return errorResponse("STORE_FAILURE", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handleUnexpected(Exception ex) {
        log.error("Unexpected error", ex);
        return errorResponse("INTERNAL_ERROR", "an unexpected error occurred");
    }

    private Map<String, Object> errorResponse(String errorCode, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error_code", errorCode);
        body.put("message", message);
        body.put("timestamp", Instant.now().toString());
        return body;
    }
}
