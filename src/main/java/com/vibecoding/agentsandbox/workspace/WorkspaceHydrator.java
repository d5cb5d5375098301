package com.vibecoding.agentsandbox.workspace;

import com.vibecoding.agentsandbox.config.WorkspaceAgentRole;
import com.vibecoding.agentsandbox.config.WorkspaceProperties;
import com.vibecoding.agentsandbox.exception.WorkspacePersistenceException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Pod 시작 전 백업 아카이브를 워크스페이스로 복원
 *
 * 백업이 없으면 볼륨을 그대로 둔다 (첫 실행).
 * 저장소 오류나 손상된 아카이브는 init 컨테이너를 실패시킨다.
 */
@Component
@WorkspaceAgentRole
@RequiredArgsConstructor
public class WorkspaceHydrator {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceHydrator.class);

    private final WorkspaceObjectStore objectStore;
    private final WorkspaceArchiver archiver;
    private final WorkspaceProperties properties;

    public HydrationOutcome hydrate(String claimName) {
        String key = properties.objectKey(claimName);
        Path root = Path.of(properties.getPath());
        log.info("Starting workspace hydration from S3: bucket={}, key={}, target={}",
            properties.getBucket(), key, root);

        Path download = null;
        try {
            download = Files.createTempFile("workspace-restore-", ".tar.gz");
            Optional<Path> archive = objectStore.download(key, download);
            if (archive.isEmpty()) {
                Files.createDirectories(root);
                log.info("No backup found for {}, starting with the existing volume (first run)", claimName);
                return HydrationOutcome.FIRST_RUN;
            }

            archiver.clear(root);
            int entries = archiver.extract(archive.get(), root);
            log.info("Workspace hydrated for {}: {} entries restored into {}", claimName, entries, root);
            return HydrationOutcome.RESTORED;
        } catch (IOException e) {
            throw new WorkspacePersistenceException("Failed to restore workspace for " + claimName + ": " + e.getMessage(), e);
        } finally {
            deleteQuietly(download);
        }
    }

    static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.debug("Could not delete temporary file {}: {}", file, e.getMessage());
        }
    }
}
