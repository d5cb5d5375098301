package com.vibecoding.agentsandbox.workspace;

import com.vibecoding.agentsandbox.exception.WorkspacePersistenceException;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;
import org.apache.commons.compress.archivers.tar.TarArchiveOutputStream;
import org.apache.commons.compress.archivers.tar.TarConstants;
import org.apache.commons.compress.compressors.gzip.GzipCompressorInputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.FileTime;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFilePermission;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 워크스페이스 디렉터리 <-> tar.gz 아카이브 변환
 *
 * 상대 경로, 일반 파일, 디렉터리, 심볼릭 링크, 파일 모드를 보존한다.
 * 압축 해제 시 루트 밖으로 나가는 항목은 거부한다.
 */
@Component
public class WorkspaceArchiver {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceArchiver.class);

    public static final String LOST_AND_FOUND = "lost+found";

    private static final int TYPE_FILE = 0100000;
    private static final int TYPE_DIR = 040000;
    private static final int TYPE_SYMLINK = 0120000;
    private static final int PERMISSION_BITS = 07777;

    /**
     * root 아래 전체를 archive 파일로 묶는다 (lost+found 제외)
     *
     * @return 아카이브에 포함된 항목 수
     */
    public int archive(Path root, Path archive) throws IOException {
        List<Path> paths;
        try (Stream<Path> walk = Files.walk(root)) {
            paths = walk
                .filter(path -> !path.equals(root))
                .filter(path -> !root.relativize(path).startsWith(LOST_AND_FOUND))
                .sorted()
                .collect(Collectors.toList());
        }

        try (OutputStream file = Files.newOutputStream(archive);
             OutputStream buffered = new BufferedOutputStream(file);
             GzipCompressorOutputStream gzip = new GzipCompressorOutputStream(buffered);
             TarArchiveOutputStream tar = new TarArchiveOutputStream(gzip)) {
            tar.setLongFileMode(TarArchiveOutputStream.LONGFILE_POSIX);
            tar.setBigNumberMode(TarArchiveOutputStream.BIGNUMBER_POSIX);

            for (Path path : paths) {
                writeEntry(tar, root, path);
            }
            tar.finish();
        }

        log.debug("Archived {} entries from {} into {}", paths.size(), root, archive);
        return paths.size();
    }

    /**
     * archive 를 root 에 풀어 놓는다 (같은 경로는 덮어쓰기)
     *
     * @return 풀어 놓은 항목 수
     * @throws WorkspacePersistenceException 루트 밖을 가리키는 항목
     */
    public int extract(Path archive, Path root) throws IOException {
        Files.createDirectories(root);
        Path normalizedRoot = root.toAbsolutePath().normalize();
        Map<Path, Integer> directoryModes = new LinkedHashMap<>();
        int count = 0;

        try (InputStream file = Files.newInputStream(archive);
             InputStream buffered = new BufferedInputStream(file);
             GzipCompressorInputStream gzip = new GzipCompressorInputStream(buffered);
             TarArchiveInputStream tar = new TarArchiveInputStream(gzip)) {

            TarArchiveEntry entry;
            while ((entry = tar.getNextEntry()) != null) {
                Path target = resolveInside(normalizedRoot, entry.getName());
                if (target.equals(normalizedRoot)) {
                    continue;
                }
                ensureParentInside(normalizedRoot, target);

                if (entry.isDirectory()) {
                    Files.createDirectories(target);
                    directoryModes.put(target, entry.getMode());
                } else if (entry.isSymbolicLink()) {
                    Files.deleteIfExists(target);
                    Files.createSymbolicLink(target, Path.of(entry.getLinkName()));
                } else if (entry.isFile()) {
                    Files.createDirectories(target.getParent());
                    if (Files.isSymbolicLink(target)) {
                        Files.delete(target);
                    }
                    Files.copy(tar, target, StandardCopyOption.REPLACE_EXISTING);
                    applyMode(target, entry.getMode());
                    Files.setLastModifiedTime(target, FileTime.from(entry.getModTime().toInstant()));
                } else {
                    log.debug("Skipping unsupported archive entry {}", entry.getName());
                    continue;
                }
                count++;
            }
        }

        // 읽기 전용 디렉터리에도 파일을 쓸 수 있도록 디렉터리 모드는 마지막에 적용
        List<Path> directories = new ArrayList<>(directoryModes.keySet());
        directories.sort(Comparator.reverseOrder());
        for (Path directory : directories) {
            applyMode(directory, directoryModes.get(directory));
        }

        log.debug("Extracted {} entries from {} into {}", count, archive, root);
        return count;
    }

    /**
     * root 내용을 비운다 (root 자체와 lost+found 는 유지)
     */
    public void clear(Path root) throws IOException {
        if (!Files.isDirectory(root)) {
            return;
        }

        List<Path> paths;
        try (Stream<Path> walk = Files.walk(root)) {
            paths = walk
                .filter(path -> !path.equals(root))
                .filter(path -> !root.relativize(path).startsWith(LOST_AND_FOUND))
                .sorted(Comparator.reverseOrder())
                .collect(Collectors.toList());
        }
        for (Path path : paths) {
            if (Files.isDirectory(path, LinkOption.NOFOLLOW_LINKS)) {
                // 쓰기 권한이 없는 디렉터리도 비울 수 있도록
                applyMode(path, 0700);
            }
        }
        for (Path path : paths) {
            Files.deleteIfExists(path);
        }
    }

    private void writeEntry(TarArchiveOutputStream tar, Path root, Path path) throws IOException {
        String name = toEntryName(root.relativize(path));

        if (Files.isSymbolicLink(path)) {
            TarArchiveEntry entry = new TarArchiveEntry(name, TarConstants.LF_SYMLINK);
            entry.setLinkName(Files.readSymbolicLink(path).toString());
            entry.setMode(TYPE_SYMLINK | 0777);
            tar.putArchiveEntry(entry);
            tar.closeArchiveEntry();
        } else if (Files.isDirectory(path)) {
            TarArchiveEntry entry = new TarArchiveEntry(name + "/");
            entry.setMode(TYPE_DIR | modeOf(path, 0755));
            entry.setModTime(Files.getLastModifiedTime(path));
            tar.putArchiveEntry(entry);
            tar.closeArchiveEntry();
        } else if (Files.isRegularFile(path)) {
            TarArchiveEntry entry = new TarArchiveEntry(name);
            entry.setSize(Files.size(path));
            entry.setMode(TYPE_FILE | modeOf(path, 0644));
            entry.setModTime(Files.getLastModifiedTime(path));
            tar.putArchiveEntry(entry);
            Files.copy(path, tar);
            tar.closeArchiveEntry();
        } else {
            log.debug("Skipping special file {}", path);
        }
    }

    private static String toEntryName(Path relative) {
        List<String> parts = new ArrayList<>();
        for (Path part : relative) {
            parts.add(part.toString());
        }
        return String.join("/", parts);
    }

    private static Path resolveInside(Path root, String entryName) {
        Path target = root.resolve(entryName).normalize();
        if (!target.startsWith(root)) {
            throw new WorkspacePersistenceException("Archive entry escapes workspace root: " + entryName);
        }
        return target;
    }

    /**
     * 이미 풀린 심볼릭 링크를 통해 루트 밖에 쓰는 것을 막는다
     */
    private static void ensureParentInside(Path root, Path target) throws IOException {
        Path parent = target.getParent();
        while (parent != null && !Files.exists(parent, LinkOption.NOFOLLOW_LINKS)) {
            parent = parent.getParent();
        }
        if (parent == null) {
            return;
        }
        Path realRoot = root.toRealPath();
        if (!parent.toRealPath().startsWith(realRoot)) {
            throw new WorkspacePersistenceException("Archive entry escapes workspace root via symlink: " + target);
        }
    }

    private static int modeOf(Path path, int fallback) throws IOException {
        PosixFileAttributeView view = Files.getFileAttributeView(path, PosixFileAttributeView.class);
        if (view == null) {
            return fallback;
        }
        int mode = 0;
        for (PosixFilePermission permission : view.readAttributes().permissions()) {
            mode |= 1 << (8 - permission.ordinal());
        }
        return mode;
    }

    private static void applyMode(Path path, int mode) throws IOException {
        PosixFileAttributeView view = Files.getFileAttributeView(path, PosixFileAttributeView.class, LinkOption.NOFOLLOW_LINKS);
        if (view == null) {
            return;
        }
        Set<PosixFilePermission> permissions = EnumSet.noneOf(PosixFilePermission.class);
        int bits = mode & PERMISSION_BITS;
        for (PosixFilePermission permission : PosixFilePermission.values()) {
            if ((bits & (1 << (8 - permission.ordinal()))) != 0) {
                permissions.add(permission);
            }
        }
        view.setPermissions(permissions);
    }
}
