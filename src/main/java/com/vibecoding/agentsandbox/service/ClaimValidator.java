package com.vibecoding.agentsandbox.service;

import com.vibecoding.agentsandbox.config.SandboxControllerProperties;
import com.vibecoding.agentsandbox.exception.ClaimValidationException;
import com.vibecoding.agentsandbox.model.AgentSandboxService;
import com.vibecoding.agentsandbox.model.AgentSandboxSpec;
import com.vibecoding.agentsandbox.model.NatsBinding;
import com.vibecoding.agentsandbox.model.SizeClass;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * 클레임 필수 필드 및 범위 검증
 * 위반 사항을 모두 모아 한 번에 보고한다.
 */
@Component
@RequiredArgsConstructor
public class ClaimValidator {

    public static final int DEFAULT_STORAGE_GB = 10;
    public static final String AFFINITY_NONE = "None";
    public static final String AFFINITY_CLIENT_IP = "ClientIP";

    private static final Set<String> SESSION_AFFINITIES = Set.of(AFFINITY_NONE, AFFINITY_CLIENT_IP);

    private final SandboxControllerProperties properties;

    public void validate(AgentSandboxService claim) {
        List<String> violations = new ArrayList<>();
        AgentSandboxSpec spec = claim.getSpec();

        if (spec == null) {
            throw new ClaimValidationException(claim.key(), List.of("spec is required"));
        }

        if (isBlank(spec.getImage())) {
            violations.add("image is required");
        }

        NatsBinding nats = spec.getNats();
        if (nats == null) {
            violations.add("nats.stream and nats.consumer are required");
        } else {
            if (isBlank(nats.getStream())) {
                violations.add("nats.stream is required");
            }
            if (isBlank(nats.getConsumer())) {
                violations.add("nats.consumer is required");
            }
        }

        if (SizeClass.fromValue(spec.getSize()).isEmpty()) {
            violations.add("size must be one of micro, small, medium, large (got '" + spec.getSize() + "')");
        }

        int storage = storageOf(spec);
        if (storage < properties.getMinStorageGb() || storage > properties.getMaxStorageGb()) {
            violations.add(String.format("storageGB must be within [%d, %d] (got %d)",
                properties.getMinStorageGb(), properties.getMaxStorageGb(), storage));
        }

        if (spec.getHttpPort() != null && (spec.getHttpPort() < 1 || spec.getHttpPort() > 65535)) {
            violations.add("httpPort must be within [1, 65535] (got " + spec.getHttpPort() + ")");
        }

        if (spec.getSessionAffinity() != null && !SESSION_AFFINITIES.contains(spec.getSessionAffinity())) {
            violations.add("sessionAffinity must be None or ClientIP (got '" + spec.getSessionAffinity() + "')");
        }

        if (!violations.isEmpty()) {
            throw new ClaimValidationException(claim.key(), violations);
        }
    }

    static int storageOf(AgentSandboxSpec spec) {
        return spec.getStorageGB() != null ? spec.getStorageGB() : DEFAULT_STORAGE_GB;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
