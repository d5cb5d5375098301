package com.vibecoding.agentsandbox.exception;

import io.fabric8.kubernetes.client.KubernetesClientException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST API 예외 처리 핸들러
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(K8sResourceNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleResourceNotFound(K8sResourceNotFoundException ex) {
        log.warn("Resource not found: {}", ex.getMessage());
        return body(HttpStatus.NOT_FOUND, ex.getMessage());
    }

    @ExceptionHandler(ClaimValidationException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(ClaimValidationException ex) {
        log.warn("Claim validation failed: {}", ex.getMessage());
        return body(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler(K8sApiException.class)
    public ResponseEntity<Map<String, Object>> handleK8sApiException(K8sApiException ex) {
        log.error("Kubernetes API error: {}", ex.getMessage(), ex);
        return body(HttpStatus.BAD_GATEWAY, "Kubernetes API call failed: " + ex.getMessage());
    }

    @ExceptionHandler(KubernetesClientException.class)
    public ResponseEntity<Map<String, Object>> handleK8sClientException(KubernetesClientException ex) {
        log.error("Kubernetes client error: {}", ex.getMessage(), ex);

        if (ex.getCode() == 404) {
            return body(HttpStatus.NOT_FOUND, "Requested resource was not found");
        }
        if (ex.getCode() == 401 || ex.getCode() == 403) {
            return body(HttpStatus.BAD_GATEWAY, "Controller is not authorized against the cluster");
        }
        return body(HttpStatus.SERVICE_UNAVAILABLE, "Cannot reach the Kubernetes cluster: " + ex.getMessage());
    }

    @ExceptionHandler({ReconcileTimeoutException.class, HibernationTransitionException.class})
    public ResponseEntity<Map<String, Object>> handleTimeout(RuntimeException ex) {
        log.warn("Operation timed out: {}", ex.getMessage());
        return body(HttpStatus.GATEWAY_TIMEOUT, ex.getMessage());
    }

    @ExceptionHandler(WorkspacePersistenceException.class)
    public ResponseEntity<Map<String, Object>> handleWorkspace(WorkspacePersistenceException ex) {
        log.error("Workspace persistence error: {}", ex.getMessage(), ex);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex) {
        log.error("Unexpected error: {}", ex.getMessage(), ex);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "Unexpected error: " + ex.getMessage());
    }

    private ResponseEntity<Map<String, Object>> body(HttpStatus status, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", status.value());
        body.put("error", status.getReasonPhrase());
        body.put("message", message);
        return ResponseEntity.status(status).body(body);
    }
}
