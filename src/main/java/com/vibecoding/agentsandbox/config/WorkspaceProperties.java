package com.vibecoding.agentsandbox.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * 워크스페이스 영속화 설정 (PVC 마운트 경로, 백업 오브젝트 위치, 백업 주기)
 */
@Configuration
@ConfigurationProperties(prefix = "sandbox.workspace")
@Data
public class WorkspaceProperties {

    private String path = "/workspace";
    private String volumeName = "workspace";
    private String claimName;                       // hydrate / backup-sidecar 역할에서 대상 클레임

    private String bucket = "deepagents-sandbox-workspaces";
    private String keyPrefix = "workspaces";
    private String archiveName = "workspace.tar.gz";
    private String region = "us-east-1";
    private String endpoint;                        // S3 호환 스토리지 엔드포인트 (선택)
    private Boolean pathStyleAccess = false;

    private Duration backupInterval = Duration.ofSeconds(30);
    private Integer sidecarPort = 8081;
    private String finalSyncPath = "/workspace/final-sync";
    private String drainPath = "/workspace/drain";
    private Duration drainTimeout = Duration.ofSeconds(50);   // 사이드카 preStop 최대 대기

    /**
     * 클레임 이름에 해당하는 백업 오브젝트 키
     */
    public String objectKey(String claim) {
        return keyPrefix + "/" + claim + "/" + archiveName;
    }

    public String requireClaimName() {
        if (claimName == null || claimName.isBlank()) {
            throw new IllegalStateException("sandbox.workspace.claim-name must be set for workspace roles");
        }
        return claimName;
    }
}
