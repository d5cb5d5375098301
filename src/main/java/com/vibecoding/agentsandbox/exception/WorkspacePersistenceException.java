package com.vibecoding.agentsandbox.exception;

/**
 * 워크스페이스 백업/복원 중 오브젝트 스토리지 또는 아카이브 오류
 */
public class WorkspacePersistenceException extends RuntimeException {

    public WorkspacePersistenceException(String message) {
        super(message);
    }

    public WorkspacePersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
