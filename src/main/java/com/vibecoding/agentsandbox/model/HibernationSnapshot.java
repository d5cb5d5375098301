package com.vibecoding.agentsandbox.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * 한 시점에 관측한 클레임/풀/PVC 상태
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HibernationSnapshot {
    private String namespace;
    private String claimName;
    private boolean claimExists;
    private Integer poolReplicas;       // 풀이 없으면 null
    private boolean workspaceExists;    // PVC 존재 여부
    private Instant lastActive;         // 하트비트 (없으면 null)
    private Instant createdAt;
}
