package com.vibecoding.agentsandbox.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 하이버네이션 상태 조회 응답
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HibernationStatusView {
    private String namespace;
    private String name;
    private HibernationState state;
    private Integer poolReplicas;
    private boolean workspaceExists;
    private String lastActive;
    private Long idleSeconds;           // 하트비트가 없으면 null
    private ExpiryAction pendingAction;
}
