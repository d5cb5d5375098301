package com.vibecoding.agentsandbox.workspace;

import com.vibecoding.agentsandbox.config.SandboxRoles;
import com.vibecoding.agentsandbox.config.WorkspaceProperties;
import com.vibecoding.agentsandbox.exception.WorkspacePersistenceException;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * 백업 사이드카: 주기 백업 + 종료 시 마지막 동기화
 * 백업 실패는 로그만 남기고 다음 주기에 다시 시도한다.
 *
 * 종료 순서: 메인 컨테이너 preStop 이 final-sync 를 호출하고, 사이드카 preStop 은 그 동기화가
 * 끝날 때까지 drain 엔드포인트에서 기다린다. 그 뒤 SIGTERM 으로 @PreDestroy 동기화가 한 번 더 돈다.
 */
@Component
@ConditionalOnProperty(name = SandboxRoles.PROPERTY, havingValue = SandboxRoles.BACKUP_SIDECAR)
@RequiredArgsConstructor
public class WorkspaceBackupSidecar {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceBackupSidecar.class);

    private final WorkspaceBackupService backupService;
    private final WorkspaceProperties properties;

    private final CountDownLatch hookSyncFinished = new CountDownLatch(1);

    private volatile Instant lastSuccess;

    @Scheduled(fixedDelayString = "${sandbox.workspace.backup-interval:PT30S}",
        initialDelayString = "${sandbox.workspace.backup-interval:PT30S}")
    public void periodicBackup() {
        String claimName = properties.requireClaimName();
        try {
            lastSuccess = backupService.backup(claimName);
        } catch (WorkspacePersistenceException e) {
            log.warn("Periodic workspace backup for {} failed, retrying next cycle (last success: {}): {}",
                claimName, lastSuccess != null ? lastSuccess : "never", e.getMessage());
        }
    }

    /**
     * 메인 컨테이너 preStop 이 요청한 동기화 (성공/실패와 관계없이 drain 대기를 풀어 준다)
     *
     * @throws WorkspacePersistenceException 업로드 실패 (훅 호출자에게 그대로 전달)
     */
    public Instant hookSync() {
        String claimName = properties.requireClaimName();
        try {
            Instant completedAt = backupService.backup(claimName);
            lastSuccess = completedAt;
            return completedAt;
        } finally {
            hookSyncFinished.countDown();
        }
    }

    /**
     * 메인 컨테이너의 final-sync 가 끝날 때까지 대기
     *
     * @return 제한 시간 안에 끝났으면 true
     */
    public boolean awaitHookSync(Duration timeout) {
        try {
            return hookSyncFinished.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * 사이드카 종료 시 (preStop 훅이 실패했더라도) 한 번 더 동기화
     */
    @PreDestroy
    public void finalSync() {
        String claimName = properties.requireClaimName();
        log.info("Sidecar shutting down, running final workspace sync for {}", claimName);
        try {
            lastSuccess = backupService.backup(claimName);
            log.info("Final workspace sync for {} completed", claimName);
        } catch (WorkspacePersistenceException e) {
            log.error("Final workspace sync for {} failed: {}", claimName, e.getMessage(), e);
        }
    }

    public Instant getLastSuccess() {
        return lastSuccess;
    }
}
