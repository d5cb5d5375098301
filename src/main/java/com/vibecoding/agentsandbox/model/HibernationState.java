package com.vibecoding.agentsandbox.model;

/**
 * 관측된 리소스로부터 계산되는 하이버네이션 분류 (저장하지 않음)
 */
public enum HibernationState {
    ACTIVE("Active", "클레임 존재, 레플리카 1 이상"),
    WARM("Warm", "클레임 존재, 레플리카 0, PVC 유지"),
    COLD("Cold", "클레임과 PVC 모두 회수됨"),
    PROVISIONING("Provisioning", "클레임 존재, PVC 아직 없음"),
    RECLAIMING("Reclaiming", "클레임 삭제됨, PVC 삭제 진행 중");

    private final String displayName;
    private final String description;

    HibernationState(String displayName, String description) {
        this.displayName = displayName;
        this.description = description;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getDescription() {
        return description;
    }
}
