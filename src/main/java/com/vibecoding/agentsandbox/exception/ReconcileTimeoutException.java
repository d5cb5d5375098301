package com.vibecoding.agentsandbox.exception;

import java.time.Duration;

/**
 * 제한 시간이 있는 대기(Ready, PVC 바인딩 등)가 만료됨
 */
public class ReconcileTimeoutException extends RuntimeException {

    public ReconcileTimeoutException(String what, Duration timeout) {
        super(String.format("Timed out after %ss waiting for %s", timeout.toSeconds(), what));
    }
}
