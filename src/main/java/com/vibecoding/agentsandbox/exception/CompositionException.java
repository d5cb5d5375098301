package com.vibecoding.agentsandbox.exception;

/**
 * 리소스 세트를 렌더링할 수 없을 때 발생하는 예외
 * 부분적인 리소스 세트는 만들어지지 않는다.
 */
public class CompositionException extends RuntimeException {

    public CompositionException(String message) {
        super(message);
    }
}
