package com.vibecoding.agentsandbox.config;

/**
 * 실행 역할 (sandbox.role)
 *
 * 같은 아티팩트가 컨트롤러, 워크스페이스 init 컨테이너, 백업 사이드카로 동작한다.
 */
public final class SandboxRoles {

    public static final String PROPERTY = "sandbox.role";

    public static final String CONTROLLER = "controller";
    public static final String HYDRATE = "hydrate";
    public static final String BACKUP_SIDECAR = "backup-sidecar";

    private SandboxRoles() {
    }
}
