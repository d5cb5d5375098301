package com.vibecoding.agentsandbox.readiness;

import com.vibecoding.agentsandbox.config.ControllerRole;
import com.vibecoding.agentsandbox.model.CompositeResourceSet;
import com.vibecoding.agentsandbox.service.SandboxClusterService;
import io.fabric8.kubernetes.api.model.Service;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Service 준비 검사 (httpPort 가 설정된 클레임만)
 */
@Component
@ControllerRole
@RequiredArgsConstructor
public class ServiceReadinessCheck implements ResourceReadinessCheck {

    private final SandboxClusterService clusterService;

    @Override
    public String getResourceKind() {
        return "Service";
    }

    @Override
    public boolean appliesTo(CompositeResourceSet resources) {
        return resources.serviceIfRequested().isPresent();
    }

    @Override
    public Optional<String> findBlocker(CompositeResourceSet resources) {
        String name = resources.getService().getMetadata().getName();
        Optional<Service> service = clusterService.findService(resources.getNamespace(), name);
        if (service.isEmpty()) {
            return Optional.of("Service " + name + " does not exist yet");
        }

        String clusterIp = service.get().getSpec() != null ? service.get().getSpec().getClusterIP() : null;
        if (clusterIp == null || clusterIp.isBlank()) {
            return Optional.of("Service " + name + " has no ClusterIP assigned");
        }
        return Optional.empty();
    }
}
