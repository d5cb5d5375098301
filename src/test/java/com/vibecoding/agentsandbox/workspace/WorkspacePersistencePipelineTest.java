package com.vibecoding.agentsandbox.workspace;

import com.vibecoding.agentsandbox.config.WorkspaceProperties;
import com.vibecoding.agentsandbox.exception.WorkspacePersistenceException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 백업 -> 복원 사이클을 메모리 저장소로 검증
 */
class WorkspacePersistencePipelineTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
    private static final String CLAIM = "acme";

    @TempDir
    Path tmp;

    private InMemoryObjectStore store;
    private WorkspaceProperties properties;
    private WorkspaceHydrator hydrator;
    private WorkspaceBackupService backupService;
    private Path workspace;

    @BeforeEach
    void setUp() {
        store = new InMemoryObjectStore();
        workspace = tmp.resolve("workspace");
        properties = new WorkspaceProperties();
        properties.setPath(workspace.toString());
        properties.setClaimName(CLAIM);

        WorkspaceArchiver archiver = new WorkspaceArchiver();
        hydrator = new WorkspaceHydrator(store, archiver, properties);
        backupService = new WorkspaceBackupService(store, archiver, properties, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    /** Pod 재시작: 볼륨이 새로 만들어진 것처럼 비운다 */
    private void freshVolume() throws IOException {
        new WorkspaceArchiver().clear(workspace);
    }

    @Test
    @DisplayName("first run with no backup leaves the volume alone")
    void firstRun() throws IOException {
        Files.createDirectories(workspace);
        Files.writeString(workspace.resolve("seed.txt"), "seed");

        assertEquals(HydrationOutcome.FIRST_RUN, hydrator.hydrate(CLAIM));
        assertEquals("seed", Files.readString(workspace.resolve("seed.txt")));
    }

    @Test
    @DisplayName("first run creates the workspace directory when missing")
    void firstRunCreatesDirectory() {
        assertEquals(HydrationOutcome.FIRST_RUN, hydrator.hydrate(CLAIM));
        assertTrue(Files.isDirectory(workspace));
    }

    @Test
    @DisplayName("backup then hydrate restores the workspace")
    void singleCycle() throws IOException {
        Files.createDirectories(workspace.resolve("notes"));
        Files.writeString(workspace.resolve("notes/todo.md"), "- ship it");

        assertEquals(NOW, backupService.backup(CLAIM));
        assertTrue(store.objects.containsKey("workspaces/acme/workspace.tar.gz"));

        freshVolume();
        assertEquals(HydrationOutcome.RESTORED, hydrator.hydrate(CLAIM));
        assertEquals("- ship it", Files.readString(workspace.resolve("notes/todo.md")));
    }

    @Test
    @DisplayName("state accumulates across restart cycles")
    void multipleCycles() throws IOException {
        Files.createDirectories(workspace);
        for (int cycle = 1; cycle <= 3; cycle++) {
            hydrator.hydrate(CLAIM);
            Files.writeString(workspace.resolve("cycle-" + cycle + ".txt"), "cycle " + cycle);
            backupService.backup(CLAIM);
            freshVolume();
        }

        hydrator.hydrate(CLAIM);
        for (int cycle = 1; cycle <= 3; cycle++) {
            assertEquals("cycle " + cycle, Files.readString(workspace.resolve("cycle-" + cycle + ".txt")));
        }
    }

    @Test
    @DisplayName("restore replaces stale files on the volume")
    void staleFilesRemoved() throws IOException {
        Files.createDirectories(workspace);
        Files.writeString(workspace.resolve("current.txt"), "current");
        backupService.backup(CLAIM);

        Files.writeString(workspace.resolve("stale.txt"), "stale");
        hydrator.hydrate(CLAIM);

        assertTrue(Files.exists(workspace.resolve("current.txt")));
        assertFalse(Files.exists(workspace.resolve("stale.txt")));
    }

    @Test
    @DisplayName("storage errors during hydration are fatal")
    void fetchErrorFatal() {
        store.failDownloads = true;

        assertThrows(WorkspacePersistenceException.class, () -> hydrator.hydrate(CLAIM));
    }

    @Test
    @DisplayName("backup of a missing workspace fails")
    void backupMissingWorkspace() {
        assertThrows(WorkspacePersistenceException.class, () -> backupService.backup(CLAIM));
        assertTrue(store.objects.isEmpty());
    }

    @Test
    @DisplayName("sidecar keeps running when a periodic backup fails")
    void sidecarBackupFailureNotFatal() throws IOException {
        Files.createDirectories(workspace);
        Files.writeString(workspace.resolve("a.txt"), "a");
        WorkspaceBackupSidecar sidecar = new WorkspaceBackupSidecar(backupService, properties);

        store.failUploads = true;
        assertDoesNotThrow(sidecar::periodicBackup);
        assertNull(sidecar.getLastSuccess());

        store.failUploads = false;
        sidecar.periodicBackup();
        assertEquals(NOW, sidecar.getLastSuccess());
    }

    @Test
    @DisplayName("sidecar drain waits until the main container's final sync has uploaded")
    void drainWaitsForHookSync() throws Exception {
        Files.createDirectories(workspace);
        Files.writeString(workspace.resolve("late.txt"), "written before shutdown");
        WorkspaceBackupSidecar sidecar = new WorkspaceBackupSidecar(backupService, properties);

        assertFalse(sidecar.awaitHookSync(Duration.ofMillis(20)));

        CompletableFuture<Boolean> drained = CompletableFuture.supplyAsync(
            () -> sidecar.awaitHookSync(Duration.ofSeconds(5)));
        assertFalse(drained.isDone());

        sidecar.hookSync();

        assertTrue(drained.get(5, TimeUnit.SECONDS));
        assertTrue(store.objects.containsKey("workspaces/acme/workspace.tar.gz"));
    }

    @Test
    @DisplayName("a failed final sync still releases the drain and reports the error")
    void failedHookSyncReleasesDrain() throws IOException {
        Files.createDirectories(workspace);
        WorkspaceBackupSidecar sidecar = new WorkspaceBackupSidecar(backupService, properties);
        store.failUploads = true;

        assertThrows(WorkspacePersistenceException.class, sidecar::hookSync);
        assertTrue(sidecar.awaitHookSync(Duration.ofMillis(10)));
    }

    @Test
    @DisplayName("final sync uploads the latest state")
    void finalSync() throws IOException {
        Files.createDirectories(workspace);
        Files.writeString(workspace.resolve("last.txt"), "last words");
        WorkspaceBackupSidecar sidecar = new WorkspaceBackupSidecar(backupService, properties);

        sidecar.finalSync();

        freshVolume();
        hydrator.hydrate(CLAIM);
        assertEquals("last words", Files.readString(workspace.resolve("last.txt")));
    }

    private static class InMemoryObjectStore implements WorkspaceObjectStore {

        private final Map<String, byte[]> objects = new HashMap<>();
        private boolean failDownloads;
        private boolean failUploads;

        @Override
        public Optional<Path> download(String key, Path target) {
            if (failDownloads) {
                throw new WorkspacePersistenceException("Access Denied");
            }
            byte[] bytes = objects.get(key);
            if (bytes == null) {
                return Optional.empty();
            }
            try {
                Files.write(target, bytes);
            } catch (IOException e) {
                throw new WorkspacePersistenceException(e.getMessage(), e);
            }
            return Optional.of(target);
        }

        @Override
        public void upload(String key, Path source) {
            if (failUploads) {
                throw new WorkspacePersistenceException("Service Unavailable");
            }
            try {
                objects.put(key, Files.readAllBytes(source));
            } catch (IOException e) {
                throw new WorkspacePersistenceException(e.getMessage(), e);
            }
        }
    }
}
