package com.vibecoding.agentsandbox.service;

import com.vibecoding.agentsandbox.config.SandboxControllerProperties;
import com.vibecoding.agentsandbox.model.AgentSandboxService;
import com.vibecoding.agentsandbox.model.AgentSandboxSpec;
import com.vibecoding.agentsandbox.model.CompositeResourceSet;
import com.vibecoding.agentsandbox.model.DeletionPolicy;
import com.vibecoding.agentsandbox.model.InitContainerOverride;
import com.vibecoding.agentsandbox.model.NatsBinding;
import com.vibecoding.agentsandbox.model.SizeClass;
import com.vibecoding.agentsandbox.exception.CompositionException;
import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.ContainerBuilder;
import io.fabric8.kubernetes.api.model.EnvFromSource;
import io.fabric8.kubernetes.api.model.EnvVar;
import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.api.model.IntOrString;
import io.fabric8.kubernetes.api.model.ObjectMeta;
import io.fabric8.kubernetes.api.model.ObjectMetaBuilder;
import io.fabric8.kubernetes.api.model.OwnerReference;
import io.fabric8.kubernetes.api.model.OwnerReferenceBuilder;
import io.fabric8.kubernetes.api.model.PersistentVolumeClaim;
import io.fabric8.kubernetes.api.model.PersistentVolumeClaimBuilder;
import io.fabric8.kubernetes.api.model.PodTemplateSpec;
import io.fabric8.kubernetes.api.model.PodTemplateSpecBuilder;
import io.fabric8.kubernetes.api.model.Probe;
import io.fabric8.kubernetes.api.model.ProbeBuilder;
import io.fabric8.kubernetes.api.model.Quantity;
import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.api.model.SecretBuilder;
import io.fabric8.kubernetes.api.model.Service;
import io.fabric8.kubernetes.api.model.ServiceAccount;
import io.fabric8.kubernetes.api.model.ServiceAccountBuilder;
import io.fabric8.kubernetes.api.model.ServiceBuilder;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 클레임 하나로부터 파생 리소스 세트를 렌더링
 *
 * 클러스터에 접근하지 않는 순수 변환이며, 실패 시 부분 결과 없이 CompositionException 을 던진다.
 * 템플릿, 풀, Service, ServiceAccount 는 클레임과 같은 이름을 쓴다 (재생성 시에도 동일한 식별자).
 */
@Component
@RequiredArgsConstructor
public class ResourceComposer {

    private static final Logger log = LoggerFactory.getLogger(ResourceComposer.class);

    public static final String LABEL_NAME = "app.kubernetes.io/name";
    public static final String LABEL_MANAGED_BY = "app.kubernetes.io/managed-by";
    public static final String LABEL_PART_OF = "app.kubernetes.io/part-of";
    public static final String MANAGED_BY = "agent-sandbox-controller";
    public static final String PART_OF = "agentsandbox";

    public static final String WORKSPACE_SUFFIX = "-workspace";
    public static final String CONNECTION_SUFFIX = "-conn";
    public static final String MAIN_CONTAINER = "main";
    public static final String USER_INIT_CONTAINER = "user-init";
    public static final String HTTP_PORT_NAME = "http";
    public static final String DEFAULT_HEALTH_PATH = "/health";
    public static final String DEFAULT_READY_PATH = "/ready";

    private final SandboxControllerProperties properties;
    private final SecretComposer secretComposer;
    private final WarmPoolScalerBinding scalerBinding;
    private final WorkspaceContainerFactory workspaceContainers;

    public static String workspaceClaimName(String claimName) {
        return claimName + WORKSPACE_SUFFIX;
    }

    public static String connectionSecretName(String claimName) {
        return claimName + CONNECTION_SUFFIX;
    }

    public static String storageRequest(int storageGb) {
        return storageGb + "Gi";
    }

    public CompositeResourceSet compose(AgentSandboxService claim) {
        return compose(claim, DeletionPolicy.DELETE);
    }

    public CompositeResourceSet compose(AgentSandboxService claim, DeletionPolicy deletionPolicy) {
        AgentSandboxSpec spec = claim.getSpec();
        if (spec == null) {
            throw new CompositionException("Claim " + claim.key() + " has no spec");
        }

        String name = claim.getMetadata().getName();
        String namespace = claim.getMetadata().getNamespace();

        SizeClass size = SizeClass.fromValue(spec.getSize())
            .orElseThrow(() -> new CompositionException("Unknown size class '" + spec.getSize() + "'"));
        int storageGb = checkedStorage(spec);
        Integer httpPort = checkedPort(spec);

        String platformSecret = spec.getPlatformSecretName() != null && !spec.getPlatformSecretName().isBlank()
            ? spec.getPlatformSecretName()
            : properties.getPlatformSecretName();

        List<EnvFromSource> envFrom;
        try {
            envFrom = secretComposer.compose(spec.userSecretSlots(), platformSecret);
        } catch (IllegalArgumentException e) {
            throw new CompositionException(e.getMessage());
        }

        Service service = httpPort != null ? service(claim, spec, httpPort) : null;
        PodTemplateSpec podTemplate = podTemplate(claim, spec, size, httpPort, envFrom, platformSecret);

        CompositeResourceSet resources = CompositeResourceSet.builder()
            .namespace(namespace)
            .claimName(name)
            .serviceAccount(serviceAccount(claim))
            .connectionSecret(connectionSecret(claim, httpPort))
            .workspaceClaim(workspaceClaim(claim, storageGb, deletionPolicy))
            .service(service)
            .podTemplate(podTemplate)
            .sandboxTemplate(sandboxTemplate(claim, podTemplate))
            .warmPool(warmPool(claim))
            .scaledObject(scalerBinding.bind(claim, metadata(claim, WarmPoolScalerBinding.scaledObjectName(name))))
            .build();

        log.debug("Composed resources for {}: size={}, storage={}Gi, service={}",
            claim.key(), size.getValue(), storageGb, service != null);
        return resources;
    }

    // ========== Metadata ==========

    Map<String, String> standardLabels(String claimName) {
        Map<String, String> labels = new LinkedHashMap<>();
        labels.put(LABEL_NAME, claimName);
        labels.put(LABEL_MANAGED_BY, MANAGED_BY);
        labels.put(LABEL_PART_OF, PART_OF);
        return labels;
    }

    private ObjectMeta metadata(AgentSandboxService claim, String resourceName) {
        return new ObjectMetaBuilder()
            .withName(resourceName)
            .withNamespace(claim.getMetadata().getNamespace())
            .withLabels(standardLabels(claim.getMetadata().getName()))
            .withOwnerReferences(ownerReference(claim))
            .build();
    }

    private OwnerReference ownerReference(AgentSandboxService claim) {
        return new OwnerReferenceBuilder()
            .withApiVersion(AgentSandboxService.API_VERSION)
            .withKind(AgentSandboxService.KIND)
            .withName(claim.getMetadata().getName())
            .withUid(claim.getMetadata().getUid())
            .withController(true)
            .withBlockOwnerDeletion(true)
            .build();
    }

    // ========== Validation ==========

    private int checkedStorage(AgentSandboxSpec spec) {
        int storageGb = ClaimValidator.storageOf(spec);
        if (storageGb < properties.getMinStorageGb() || storageGb > properties.getMaxStorageGb()) {
            throw new CompositionException(String.format("storageGB %d is outside [%d, %d]",
                storageGb, properties.getMinStorageGb(), properties.getMaxStorageGb()));
        }
        return storageGb;
    }

    private Integer checkedPort(AgentSandboxSpec spec) {
        Integer port = spec.getHttpPort();
        if (port != null && (port < 1 || port > 65535)) {
            throw new CompositionException("httpPort " + port + " is outside [1, 65535]");
        }
        return port;
    }

    // ========== Resources ==========

    private ServiceAccount serviceAccount(AgentSandboxService claim) {
        return new ServiceAccountBuilder()
            .withMetadata(metadata(claim, claim.getMetadata().getName()))
            .build();
    }

    private PersistentVolumeClaim workspaceClaim(AgentSandboxService claim, int storageGb, DeletionPolicy deletionPolicy) {
        ObjectMeta meta = metadata(claim, workspaceClaimName(claim.getMetadata().getName()));
        meta.setAnnotations(new LinkedHashMap<>(Map.of(DeletionPolicy.ANNOTATION, deletionPolicy.getValue())));

        String storageClass = properties.getStorageClassName();
        return new PersistentVolumeClaimBuilder()
            .withMetadata(meta)
            .withNewSpec()
                .withAccessModes("ReadWriteOnce")
                .withStorageClassName(storageClass == null || storageClass.isBlank() ? null : storageClass)
                .withNewResources()
                    .addToRequests("storage", new Quantity(storageRequest(storageGb)))
                .endResources()
            .endSpec()
            .build();
    }

    private Service service(AgentSandboxService claim, AgentSandboxSpec spec, int httpPort) {
        String name = claim.getMetadata().getName();
        ObjectMeta meta = metadata(claim, name);
        Map<String, String> annotations = new LinkedHashMap<>();
        annotations.put("prometheus.io/scrape", "true");
        annotations.put("prometheus.io/port", String.valueOf(httpPort));
        meta.setAnnotations(annotations);

        String affinity = spec.getSessionAffinity() != null ? spec.getSessionAffinity() : ClaimValidator.AFFINITY_NONE;
        return new ServiceBuilder()
            .withMetadata(meta)
            .withNewSpec()
                .withType("ClusterIP")
                .withSelector(Map.of(LABEL_NAME, name))
                .withSessionAffinity(affinity)
                .addNewPort()
                    .withName(HTTP_PORT_NAME)
                    .withProtocol("TCP")
                    .withPort(httpPort)
                    .withTargetPort(new IntOrString(httpPort))
                .endPort()
            .endSpec()
            .build();
    }

    private Secret connectionSecret(AgentSandboxService claim, Integer httpPort) {
        String name = claim.getMetadata().getName();
        String namespace = claim.getMetadata().getNamespace();

        Map<String, String> data = new LinkedHashMap<>();
        data.put("SANDBOX_SERVICE_NAME", name);
        data.put("SANDBOX_HTTP_ENDPOINT", httpPort != null
            ? String.format("http://%s.%s.svc:%d", name, namespace, httpPort)
            : "");
        data.put("SANDBOX_NAMESPACE", namespace);

        return new SecretBuilder()
            .withMetadata(metadata(claim, connectionSecretName(name)))
            .withType("Opaque")
            .withStringData(data)
            .build();
    }

    private PodTemplateSpec podTemplate(AgentSandboxService claim, AgentSandboxSpec spec, SizeClass size,
                                        Integer httpPort, List<EnvFromSource> envFrom, String platformSecret) {
        String name = claim.getMetadata().getName();
        EnvFromSource platformSource = secretComposer.platformSecretSource(platformSecret);

        List<Container> initContainers = new ArrayList<>();
        initContainers.add(workspaceContainers.hydrator(name, platformSource));
        if (spec.getInitContainer() != null) {
            initContainers.add(userInit(spec, envFrom));
        }

        return new PodTemplateSpecBuilder()
            .withNewMetadata()
                .withLabels(standardLabels(name))
            .endMetadata()
            .withNewSpec()
                .withServiceAccountName(name)
                .withTerminationGracePeriodSeconds(properties.getTerminationGracePeriodSeconds())
                .withImagePullSecrets(spec.getImagePullSecrets() != null ? spec.getImagePullSecrets() : List.of())
                .withInitContainers(initContainers)
                .withContainers(
                    mainContainer(claim, spec, size, httpPort, envFrom),
                    workspaceContainers.backupSidecar(name, platformSource))
                .addNewVolume()
                    .withName(workspaceContainers.workspaceMount().getName())
                    .withNewPersistentVolumeClaim()
                        .withClaimName(workspaceClaimName(name))
                    .endPersistentVolumeClaim()
                .endVolume()
            .endSpec()
            .build();
    }

    private Container mainContainer(AgentSandboxService claim, AgentSandboxSpec spec, SizeClass size,
                                    Integer httpPort, List<EnvFromSource> envFrom) {
        NatsBinding nats = spec.getNats();
        String natsUrl = nats.getUrl() != null && !nats.getUrl().isBlank() ? nats.getUrl() : NatsBinding.DEFAULT_URL;

        ContainerBuilder builder = new ContainerBuilder()
            .withName(MAIN_CONTAINER)
            .withImage(spec.getImage())
            .withCommand(spec.getCommand())
            .withArgs(spec.getArgs())
            .withEnvFrom(envFrom)
            .withEnv(
                new EnvVar("SANDBOX_NAME", claim.getMetadata().getName(), null),
                new EnvVar("SANDBOX_NAMESPACE", claim.getMetadata().getNamespace(), null),
                new EnvVar("NATS_URL", natsUrl, null),
                new EnvVar("NATS_STREAM", nats.getStream(), null),
                new EnvVar("NATS_CONSUMER", nats.getConsumer(), null))
            .withResources(size.toResourceRequirements())
            .withVolumeMounts(workspaceContainers.workspaceMount())
            .withLifecycle(workspaceContainers.finalSyncHook());

        if (httpPort != null) {
            builder.addNewPort()
                    .withName(HTTP_PORT_NAME)
                    .withContainerPort(httpPort)
                .endPort()
                .withLivenessProbe(httpProbe(orDefault(spec.getHealthPath(), DEFAULT_HEALTH_PATH), httpPort, 15))
                .withReadinessProbe(httpProbe(orDefault(spec.getReadyPath(), DEFAULT_READY_PATH), httpPort, 5));
        }
        return builder.build();
    }

    private Container userInit(AgentSandboxSpec spec, List<EnvFromSource> envFrom) {
        InitContainerOverride init = spec.getInitContainer();
        return new ContainerBuilder()
            .withName(USER_INIT_CONTAINER)
            .withImage(orDefault(init.getImage(), spec.getImage()))
            .withCommand(init.getCommand())
            .withArgs(init.getArgs())
            .withEnvFrom(envFrom)
            .withVolumeMounts(workspaceContainers.workspaceMount())
            .build();
    }

    private Probe httpProbe(String path, int port, int initialDelaySeconds) {
        return new ProbeBuilder()
            .withNewHttpGet()
                .withPath(path)
                .withPort(new IntOrString(port))
            .endHttpGet()
            .withInitialDelaySeconds(initialDelaySeconds)
            .withPeriodSeconds(10)
            .build();
    }

    private GenericKubernetesResource sandboxTemplate(AgentSandboxService claim, PodTemplateSpec podTemplate) {
        Map<String, Object> spec = new LinkedHashMap<>();
        spec.put("podTemplate", podTemplate);
        return GenericResources.of(SandboxClusterService.POOL_API_VERSION, SandboxClusterService.TEMPLATE_KIND,
            metadata(claim, claim.getMetadata().getName()), spec);
    }

    /**
     * replicas 는 생성 시 0, 이후에는 오토스케일러가 소유한다 (리컨실러가 기존 풀에서는 제외)
     */
    private GenericKubernetesResource warmPool(AgentSandboxService claim) {
        String name = claim.getMetadata().getName();
        Map<String, Object> spec = new LinkedHashMap<>();
        spec.put("replicas", 0);
        spec.put("sandboxTemplateRef", Map.of("name", name));
        spec.put("selector", Map.of("matchLabels", Map.of(LABEL_NAME, name)));
        return GenericResources.of(SandboxClusterService.POOL_API_VERSION, SandboxClusterService.POOL_KIND,
            metadata(claim, name), spec);
    }

    private static String orDefault(String value, String fallback) {
        return value != null && !value.isBlank() ? value : fallback;
    }
}
