package com.vibecoding.agentsandbox.service;

import com.vibecoding.agentsandbox.config.ScalerProperties;
import com.vibecoding.agentsandbox.model.AgentSandboxService;
import com.vibecoding.agentsandbox.model.NatsBinding;
import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.api.model.ObjectMeta;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 웜 풀에 KEDA ScaledObject 연결
 *
 * 브로커를 직접 폴링하지 않고 nats-jetstream 트리거만 선언한다.
 * 클레임당 에이전트 인스턴스는 하나 (0 ↔ 1).
 */
@Component
@RequiredArgsConstructor
public class WarmPoolScalerBinding {

    public static final String API_VERSION = "keda.sh/v1alpha1";
    public static final String KIND = "ScaledObject";
    public static final String TRIGGER_TYPE = "nats-jetstream";
    public static final String NAME_SUFFIX = "-scaler";
    public static final int MIN_REPLICAS = 0;
    public static final int MAX_REPLICAS = 1;

    private final ScalerProperties scalerProperties;

    public static String scaledObjectName(String claimName) {
        return claimName + NAME_SUFFIX;
    }

    public GenericKubernetesResource bind(AgentSandboxService claim, ObjectMeta baseMetadata) {
        String claimName = claim.getMetadata().getName();
        NatsBinding nats = claim.getSpec().getNats();

        Map<String, Object> scaleTargetRef = new LinkedHashMap<>();
        scaleTargetRef.put("apiVersion", SandboxClusterService.POOL_API_VERSION);
        scaleTargetRef.put("kind", SandboxClusterService.POOL_KIND);
        scaleTargetRef.put("name", claimName);

        Map<String, Object> triggerMetadata = new LinkedHashMap<>();
        triggerMetadata.put("natsServerMonitoringEndpoint", scalerProperties.getNatsMonitoringEndpoint());
        triggerMetadata.put("account", scalerProperties.getAccount());
        triggerMetadata.put("stream", nats.getStream());
        triggerMetadata.put("consumer", nats.getConsumer());
        triggerMetadata.put("lagThreshold", scalerProperties.getLagThreshold());

        Map<String, Object> trigger = new LinkedHashMap<>();
        trigger.put("type", TRIGGER_TYPE);
        trigger.put("metadata", triggerMetadata);

        Map<String, Object> spec = new LinkedHashMap<>();
        spec.put("scaleTargetRef", scaleTargetRef);
        spec.put("minReplicaCount", MIN_REPLICAS);
        spec.put("maxReplicaCount", MAX_REPLICAS);
        spec.put("pollingInterval", scalerProperties.getPollingInterval());
        spec.put("cooldownPeriod", scalerProperties.getCooldownPeriod());
        spec.put("triggers", List.of(trigger));

        return GenericResources.of(API_VERSION, KIND, baseMetadata, spec);
    }
}
