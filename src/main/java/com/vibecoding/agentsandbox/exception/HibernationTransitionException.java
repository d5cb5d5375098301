package com.vibecoding.agentsandbox.exception;

/**
 * 하이버네이션 전이가 제한 시간 안에 수렴하지 않음
 */
public class HibernationTransitionException extends RuntimeException {

    public HibernationTransitionException(String message) {
        super(message);
    }
}
