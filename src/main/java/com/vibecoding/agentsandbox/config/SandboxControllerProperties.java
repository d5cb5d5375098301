package com.vibecoding.agentsandbox.config;

import jakarta.annotation.PostConstruct;
import lombok.Data;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;


@Configuration
@ConfigurationProperties(prefix = "sandbox.controller")
@Data
public class SandboxControllerProperties {

    private static final Logger log = LoggerFactory.getLogger(SandboxControllerProperties.class);

    private String namespace = "";                          // 감시할 네임스페이스 (빈 값이면 전체)
    private String platformSecretName = "aws-access-token"; // 오브젝트 스토리지 자격증명 Secret
    private Integer minStorageGb = 1;
    private Integer maxStorageGb = 1000;
    private String storageClassName;
    private Long terminationGracePeriodSeconds = 60L;

    // 워크스페이스 hydrate/backup 컨테이너 이미지와 실행 명령
    private String workspaceAgentImage = "ghcr.io/bizmatters/agent-sandbox-controller:latest";
    private List<String> workspaceAgentCommand = new ArrayList<>(List.of("java", "-jar", "/app/agent-sandbox-controller.jar"));

    private Boolean watchEnabled = true;
    private Integer reconcileWorkers = 4;
    private Duration resyncPeriod = Duration.ofMinutes(5);

    private Integer applyMaxAttempts = 5;
    private Duration applyInitialBackoff = Duration.ofMillis(500);
    private Duration applyMaxBackoff = Duration.ofSeconds(30);

    private Duration readyTimeout = Duration.ofMinutes(5);
    private Duration readyPollInterval = Duration.ofSeconds(2);

    @PostConstruct
    public void validateConfig() {
        if (platformSecretName == null || platformSecretName.isBlank()) {
            throw new IllegalStateException("sandbox.controller.platform-secret-name must be set");
        }
        if (minStorageGb == null || maxStorageGb == null || minStorageGb < 1 || minStorageGb > maxStorageGb) {
            throw new IllegalStateException(String.format(
                "Invalid storage bounds: min=%s, max=%s", minStorageGb, maxStorageGb));
        }
        if (applyMaxAttempts == null || applyMaxAttempts < 1) {
            throw new IllegalStateException("sandbox.controller.apply-max-attempts must be >= 1");
        }

        log.info("Sandbox controller configuration validated");
        log.info("  - Namespace: {}", namespace == null || namespace.isBlank() ? "<all>" : namespace);
        log.info("  - Platform secret: {}", platformSecretName);
        log.info("  - Storage bounds: {}Gi..{}Gi", minStorageGb, maxStorageGb);
        log.info("  - Workspace agent image: {}", workspaceAgentImage);
    }

    public boolean isAllNamespaces() {
        return namespace == null || namespace.isBlank();
    }
}
