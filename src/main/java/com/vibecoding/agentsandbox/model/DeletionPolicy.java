package com.vibecoding.agentsandbox.model;

/**
 * 워크스페이스 PVC 삭제 정책
 * Delete 이면 클레임 삭제(Cold 전이)와 함께 스토리지가 회수된다.
 */
public enum DeletionPolicy {
    DELETE("Delete"),
    RETAIN("Retain");

    public static final String ANNOTATION = AgentSandboxService.GROUP + "/deletion-policy";

    private final String value;

    DeletionPolicy(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
