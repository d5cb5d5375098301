package com.vibecoding.agentsandbox.workspace;

import java.nio.file.Path;
import java.util.Optional;

/**
 * 워크스페이스 아카이브 저장소
 */
public interface WorkspaceObjectStore {

    /**
     * 오브젝트를 target 파일로 내려받는다
     *
     * @return 오브젝트가 없으면 empty (첫 실행)
     * @throws com.vibecoding.agentsandbox.exception.WorkspacePersistenceException 저장소 오류
     */
    Optional<Path> download(String key, Path target);

    /**
     * source 파일을 key 에 업로드 (기존 오브젝트 덮어쓰기)
     */
    void upload(String key, Path source);
}
