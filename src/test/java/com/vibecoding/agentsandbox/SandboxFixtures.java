package com.vibecoding.agentsandbox;

import com.vibecoding.agentsandbox.config.ScalerProperties;
import com.vibecoding.agentsandbox.config.SandboxControllerProperties;
import com.vibecoding.agentsandbox.config.WorkspaceProperties;
import com.vibecoding.agentsandbox.model.AgentSandboxService;
import com.vibecoding.agentsandbox.model.AgentSandboxSpec;
import com.vibecoding.agentsandbox.model.NatsBinding;
import com.vibecoding.agentsandbox.service.ResourceComposer;
import com.vibecoding.agentsandbox.service.SecretComposer;
import com.vibecoding.agentsandbox.service.WarmPoolScalerBinding;
import com.vibecoding.agentsandbox.service.WorkspaceContainerFactory;
import io.fabric8.kubernetes.api.model.ObjectMetaBuilder;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * 테스트용 클레임과 설정
 */
public final class SandboxFixtures {

    public static final String NAMESPACE = "team-a";
    public static final Instant CREATED_AT = Instant.parse("2026-01-01T00:00:00Z");

    private SandboxFixtures() {
    }

    public static AgentSandboxSpec.AgentSandboxSpecBuilder minimalSpec() {
        return AgentSandboxSpec.builder()
            .image("ghcr.io/acme/agent:1.0")
            .nats(NatsBinding.builder()
                .stream("acme-stream")
                .consumer("acme-consumer")
                .build());
    }

    public static AgentSandboxService claim(String name, AgentSandboxSpec spec) {
        return claim(name, "uid-" + name, spec);
    }

    public static AgentSandboxService claim(String name, String uid, AgentSandboxSpec spec) {
        AgentSandboxService claim = new AgentSandboxService();
        claim.setMetadata(new ObjectMetaBuilder()
            .withName(name)
            .withNamespace(NAMESPACE)
            .withUid(uid)
            .withGeneration(1L)
            .withResourceVersion("100")
            .withCreationTimestamp(CREATED_AT.toString())
            .build());
        claim.setSpec(spec);
        return claim;
    }

    public static AgentSandboxService withHeartbeat(AgentSandboxService claim, Instant lastActive) {
        Map<String, String> annotations = new HashMap<>();
        annotations.put(AgentSandboxService.LAST_ACTIVE_ANNOTATION, lastActive.toString());
        claim.getMetadata().setAnnotations(annotations);
        return claim;
    }

    public static SandboxControllerProperties controllerProperties() {
        SandboxControllerProperties properties = new SandboxControllerProperties();
        properties.setApplyMaxAttempts(3);
        properties.setApplyInitialBackoff(Duration.ofMillis(1));
        properties.setApplyMaxBackoff(Duration.ofMillis(5));
        properties.setReadyPollInterval(Duration.ofMillis(5));
        properties.setWorkspaceAgentImage("ghcr.io/acme/sandbox-controller:test");
        return properties;
    }

    public static ResourceComposer composer(SandboxControllerProperties properties) {
        return new ResourceComposer(properties,
            new SecretComposer(),
            new WarmPoolScalerBinding(new ScalerProperties()),
            new WorkspaceContainerFactory(properties, new WorkspaceProperties()));
    }
}
