package com.vibecoding.agentsandbox.workspace;

import com.vibecoding.agentsandbox.config.WorkspaceAgentRole;
import com.vibecoding.agentsandbox.config.WorkspaceProperties;
import com.vibecoding.agentsandbox.exception.WorkspacePersistenceException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 워크스페이스 전체를 아카이브해서 클레임의 백업 키에 업로드
 * 주기 백업과 final-sync 가 겹치지 않도록 한 번에 하나만 실행된다.
 */
@Service
@WorkspaceAgentRole
@RequiredArgsConstructor
public class WorkspaceBackupService {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceBackupService.class);

    private final WorkspaceObjectStore objectStore;
    private final WorkspaceArchiver archiver;
    private final WorkspaceProperties properties;
    private final Clock clock;

    private final ReentrantLock backupLock = new ReentrantLock();

    /**
     * @return 업로드가 끝난 시각
     * @throws WorkspacePersistenceException 아카이브 또는 업로드 실패
     */
    public Instant backup(String claimName) {
        String key = properties.objectKey(claimName);
        Path root = Path.of(properties.getPath());

        backupLock.lock();
        Path archive = null;
        try {
            if (!Files.isDirectory(root)) {
                throw new WorkspacePersistenceException("Workspace directory does not exist: " + root);
            }

            archive = Files.createTempFile("workspace-backup-", ".tar.gz");
            int entries = archiver.archive(root, archive);
            objectStore.upload(key, archive);

            Instant completedAt = clock.instant();
            log.debug("Workspace backup for {} uploaded to {} ({} entries)", claimName, key, entries);
            return completedAt;
        } catch (IOException e) {
            throw new WorkspacePersistenceException("Failed to archive workspace for " + claimName + ": " + e.getMessage(), e);
        } finally {
            WorkspaceHydrator.deleteQuietly(archive);
            backupLock.unlock();
        }
    }
}
