package com.vibecoding.agentsandbox.service;

import com.vibecoding.agentsandbox.config.SandboxControllerProperties;
import com.vibecoding.agentsandbox.config.SandboxRoles;
import com.vibecoding.agentsandbox.config.WorkspaceProperties;
import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.ContainerBuilder;
import io.fabric8.kubernetes.api.model.EnvFromSource;
import io.fabric8.kubernetes.api.model.IntOrString;
import io.fabric8.kubernetes.api.model.Lifecycle;
import io.fabric8.kubernetes.api.model.LifecycleBuilder;
import io.fabric8.kubernetes.api.model.VolumeMount;
import io.fabric8.kubernetes.api.model.VolumeMountBuilder;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 워크스페이스 영속화 컨테이너 (hydrator init 컨테이너, 백업 사이드카, preStop 훅)
 *
 * 컨트롤러와 같은 아티팩트를 sandbox.role 만 바꿔서 실행한다.
 */
@Component
@RequiredArgsConstructor
public class WorkspaceContainerFactory {

    public static final String HYDRATOR_NAME = "workspace-hydrator";
    public static final String SIDECAR_NAME = "workspace-backup-sidecar";

    private static final long DRAIN_MARGIN_SECONDS = 10;
    private static final long MIN_DRAIN_SECONDS = 5;

    private final SandboxControllerProperties controllerProperties;
    private final WorkspaceProperties workspaceProperties;

    public VolumeMount workspaceMount() {
        return new VolumeMountBuilder()
            .withName(workspaceProperties.getVolumeName())
            .withMountPath(workspaceProperties.getPath())
            .build();
    }

    /**
     * 백업 오브젝트를 PVC 로 복원하는 init 컨테이너
     */
    public Container hydrator(String claimName, EnvFromSource platformSecret) {
        return new ContainerBuilder()
            .withName(HYDRATOR_NAME)
            .withImage(controllerProperties.getWorkspaceAgentImage())
            .withCommand(roleCommand(SandboxRoles.HYDRATE, claimName,
                "--spring.main.web-application-type=none"))
            .withEnvFrom(platformSecret)
            .withVolumeMounts(workspaceMount())
            .build();
    }

    /**
     * 주기적으로 워크스페이스를 업로드하고 final-sync 엔드포인트를 제공하는 사이드카
     */
    public Container backupSidecar(String claimName, EnvFromSource platformSecret) {
        return new ContainerBuilder()
            .withName(SIDECAR_NAME)
            .withImage(controllerProperties.getWorkspaceAgentImage())
            .withCommand(roleCommand(SandboxRoles.BACKUP_SIDECAR, claimName,
                "--server.port=" + workspaceProperties.getSidecarPort(),
                "--sandbox.workspace.drain-timeout=PT" + drainSeconds() + "S"))
            .withEnvFrom(platformSecret)
            .withVolumeMounts(workspaceMount())
            .addNewPort()
                .withName("sync")
                .withContainerPort(workspaceProperties.getSidecarPort())
            .endPort()
            .withLifecycle(drainHook())
            .build();
    }

    /**
     * 사이드카 자신의 preStop: 메인 컨테이너의 final-sync 가 끝날 때까지 SIGTERM 을 늦춘다
     */
    public Lifecycle drainHook() {
        return new LifecycleBuilder()
            .withNewPreStop()
                .withNewHttpGet()
                    .withPath(workspaceProperties.getDrainPath())
                    .withPort(new IntOrString(workspaceProperties.getSidecarPort()))
                .endHttpGet()
            .endPreStop()
            .build();
    }

    /**
     * 유예 시간 안에서 사이드카 종료 후 마지막 백업이 돌 여유를 남긴 대기 시간
     */
    long drainSeconds() {
        Long grace = controllerProperties.getTerminationGracePeriodSeconds();
        long available = grace != null ? grace - DRAIN_MARGIN_SECONDS : MIN_DRAIN_SECONDS;
        return Math.max(available, MIN_DRAIN_SECONDS);
    }

    /**
     * 메인 컨테이너 종료 전에 사이드카의 final-sync 를 호출 (응답은 업로드 완료 후)
     */
    public Lifecycle finalSyncHook() {
        return new LifecycleBuilder()
            .withNewPreStop()
                .withNewHttpGet()
                    .withPath(workspaceProperties.getFinalSyncPath())
                    .withPort(new IntOrString(workspaceProperties.getSidecarPort()))
                .endHttpGet()
            .endPreStop()
            .build();
    }

    private List<String> roleCommand(String role, String claimName, String... extraArgs) {
        List<String> command = new ArrayList<>(controllerProperties.getWorkspaceAgentCommand());
        command.add("--" + SandboxRoles.PROPERTY + "=" + role);
        command.addAll(Arrays.asList(extraArgs));
        command.add("--sandbox.workspace.claim-name=" + claimName);
        command.add("--sandbox.workspace.path=" + workspaceProperties.getPath());
        command.add("--sandbox.workspace.bucket=" + workspaceProperties.getBucket());
        command.add("--sandbox.workspace.region=" + workspaceProperties.getRegion());
        String endpoint = workspaceProperties.getEndpoint();
        if (endpoint != null && !endpoint.isBlank()) {
            command.add("--sandbox.workspace.endpoint=" + endpoint);
            command.add("--sandbox.workspace.path-style-access=" + workspaceProperties.getPathStyleAccess());
        }
        return command;
    }
}
