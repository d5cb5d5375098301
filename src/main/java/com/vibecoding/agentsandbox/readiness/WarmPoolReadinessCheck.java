package com.vibecoding.agentsandbox.readiness;

import com.vibecoding.agentsandbox.config.ControllerRole;
import com.vibecoding.agentsandbox.model.CompositeResourceSet;
import com.vibecoding.agentsandbox.service.SandboxClusterService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * 웜 풀 준비 검사
 * 풀이 존재하고 레플리카 수(0 이상)가 기록되어 있으면 준비된 것으로 본다.
 */
@Component
@ControllerRole
@RequiredArgsConstructor
public class WarmPoolReadinessCheck implements ResourceReadinessCheck {

    private final SandboxClusterService clusterService;

    @Override
    public String getResourceKind() {
        return SandboxClusterService.POOL_KIND;
    }

    @Override
    public boolean appliesTo(CompositeResourceSet resources) {
        return resources.getWarmPool() != null;
    }

    @Override
    public Optional<String> findBlocker(CompositeResourceSet resources) {
        Optional<Integer> replicas = clusterService.warmPoolReplicas(resources.getNamespace(), resources.getClaimName());
        if (replicas.isEmpty()) {
            return Optional.of("SandboxWarmPool " + resources.getClaimName() + " does not exist yet");
        }
        if (replicas.get() < 0) {
            return Optional.of("SandboxWarmPool " + resources.getClaimName() + " has no replica count");
        }
        return Optional.empty();
    }
}
