package com.vibecoding.agentsandbox.support;

import com.vibecoding.agentsandbox.config.SandboxControllerProperties;
import com.vibecoding.agentsandbox.exception.K8sApiException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Kubernetes API 호출 재시도 정책
 * - 적용(apply): 지수 백오프, 재시도 가능한 API 오류만
 * - 낙관적 동시성(read-modify-write): 409 충돌만 짧게 재시도
 */
@Component
public class ApiRetryPolicy {

    private static final Logger log = LoggerFactory.getLogger(ApiRetryPolicy.class);

    private static final int CONFLICT_MAX_ATTEMPTS = 5;
    private static final Duration CONFLICT_INTERVAL = Duration.ofMillis(100);

    private final RetryConfig backoffConfig;
    private final RetryConfig conflictConfig;

    public ApiRetryPolicy(SandboxControllerProperties properties) {
        this.backoffConfig = RetryConfig.custom()
            .maxAttempts(properties.getApplyMaxAttempts())
            .intervalFunction(IntervalFunction.ofExponentialBackoff(
                properties.getApplyInitialBackoff(), 2.0, properties.getApplyMaxBackoff()))
            .retryOnException(ApiRetryPolicy::isRetryable)
            .build();

        this.conflictConfig = RetryConfig.custom()
            .maxAttempts(CONFLICT_MAX_ATTEMPTS)
            .intervalFunction(IntervalFunction.of(CONFLICT_INTERVAL))
            .retryOnException(e -> e instanceof K8sApiException && ((K8sApiException) e).isConflict())
            .build();
    }

    /**
     * 지수 백오프로 재시도, 소진되면 마지막 예외를 그대로 던진다
     */
    public <T> T withBackoff(String operation, Supplier<T> call) {
        Retry retry = Retry.of(operation, backoffConfig);
        retry.getEventPublisher().onRetry(event -> log.warn("Retrying {} (attempt {}): {}",
            operation, event.getNumberOfRetryAttempts(),
            event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown"));
        return retry.executeSupplier(call);
    }

    /**
     * resourceVersion 충돌 시 다시 읽고 수정하도록 재시도
     * call 은 매 시도마다 최신 객체를 읽어야 한다.
     */
    public <T> T onConflict(String operation, Supplier<T> call) {
        Retry retry = Retry.of(operation, conflictConfig);
        retry.getEventPublisher().onRetry(event -> log.debug("Conflict on {}, re-reading (attempt {})",
            operation, event.getNumberOfRetryAttempts()));
        return retry.executeSupplier(call);
    }

    private static boolean isRetryable(Throwable e) {
        return e instanceof K8sApiException && ((K8sApiException) e).isRetryable();
    }
}
