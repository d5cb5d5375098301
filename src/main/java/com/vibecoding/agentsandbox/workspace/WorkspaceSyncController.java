package com.vibecoding.agentsandbox.workspace;

import com.vibecoding.agentsandbox.config.SandboxRoles;
import com.vibecoding.agentsandbox.config.WorkspaceProperties;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * preStop 훅 엔드포인트
 * - final-sync: 메인 컨테이너 훅, 업로드가 끝난 뒤에만 응답
 * - drain: 사이드카 자신의 훅, final-sync 가 끝나거나 drain-timeout 이 지날 때까지 응답을 미룬다
 */
@RestController
@ConditionalOnProperty(name = SandboxRoles.PROPERTY, havingValue = SandboxRoles.BACKUP_SIDECAR)
@RequiredArgsConstructor
public class WorkspaceSyncController {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceSyncController.class);

    private final WorkspaceBackupSidecar sidecar;
    private final WorkspaceProperties properties;

    @GetMapping("${sandbox.workspace.final-sync-path:/workspace/final-sync}")
    public ResponseEntity<Map<String, Object>> finalSync() {
        String claimName = properties.requireClaimName();
        log.info("Final sync requested for {}", claimName);

        Instant completedAt = sidecar.hookSync();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "synced");
        body.put("key", properties.objectKey(claimName));
        body.put("completedAt", completedAt.toString());
        return ResponseEntity.ok(body);
    }

    @GetMapping("${sandbox.workspace.drain-path:/workspace/drain}")
    public ResponseEntity<Map<String, Object>> drain() {
        log.info("Sidecar preStop: waiting up to {} for the final sync", properties.getDrainTimeout());
        boolean synced = sidecar.awaitHookSync(properties.getDrainTimeout());
        if (!synced) {
            log.warn("Final sync was not requested within {}, relying on shutdown sync", properties.getDrainTimeout());
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", synced ? "drained" : "timeout");
        return ResponseEntity.ok(body);
    }
}
