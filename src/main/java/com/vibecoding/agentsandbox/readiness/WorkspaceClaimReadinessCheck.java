package com.vibecoding.agentsandbox.readiness;

import com.vibecoding.agentsandbox.config.ControllerRole;
import com.vibecoding.agentsandbox.model.CompositeResourceSet;
import com.vibecoding.agentsandbox.service.SandboxClusterService;
import io.fabric8.kubernetes.api.model.PersistentVolumeClaim;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * 워크스페이스 PVC 바인딩 검사
 */
@Component
@ControllerRole
@RequiredArgsConstructor
public class WorkspaceClaimReadinessCheck implements ResourceReadinessCheck {

    static final String BOUND = "Bound";

    private final SandboxClusterService clusterService;

    @Override
    public String getResourceKind() {
        return "PersistentVolumeClaim";
    }

    @Override
    public boolean appliesTo(CompositeResourceSet resources) {
        return resources.getWorkspaceClaim() != null;
    }

    @Override
    public Optional<String> findBlocker(CompositeResourceSet resources) {
        String pvcName = resources.getWorkspaceClaim().getMetadata().getName();
        Optional<PersistentVolumeClaim> pvc = clusterService.findWorkspaceClaim(resources.getNamespace(), pvcName);
        if (pvc.isEmpty()) {
            return Optional.of("PVC " + pvcName + " does not exist yet");
        }

        String phase = pvc.get().getStatus() != null ? pvc.get().getStatus().getPhase() : null;
        if (!BOUND.equals(phase)) {
            return Optional.of("PVC " + pvcName + " is " + (phase != null ? phase : "Pending"));
        }
        return Optional.empty();
    }
}
