package com.vibecoding.agentsandbox.exception;

/**
 * Kubernetes API 호출 중 발생하는 예외
 */
public class K8sApiException extends RuntimeException {

    private final int statusCode;

    public K8sApiException(String message) {
        this(message, 0, null);
    }

    public K8sApiException(String message, Throwable cause) {
        this(message, 0, cause);
    }

    public K8sApiException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }

    /**
     * resourceVersion 충돌 (409)
     */
    public boolean isConflict() {
        return statusCode == 409;
    }

    /**
     * 재시도해도 결과가 바뀌지 않는 요청 오류(400, 403, 422 등)는 false
     */
    public boolean isRetryable() {
        return statusCode == 0 || statusCode == 409 || statusCode == 429 || statusCode >= 500;
    }
}
