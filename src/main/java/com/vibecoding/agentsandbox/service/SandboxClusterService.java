package com.vibecoding.agentsandbox.service;

import com.vibecoding.agentsandbox.config.ControllerRole;
import com.vibecoding.agentsandbox.exception.K8sApiException;
import com.vibecoding.agentsandbox.exception.K8sResourceNotFoundException;
import com.vibecoding.agentsandbox.model.AgentSandboxService;
import com.vibecoding.agentsandbox.support.ApiRetryPolicy;
import io.fabric8.kubernetes.api.model.DeletionPropagation;
import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.PersistentVolumeClaim;
import io.fabric8.kubernetes.api.model.Service;
import io.fabric8.kubernetes.api.model.StatusDetails;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.dsl.MixedOperation;
import io.fabric8.kubernetes.client.dsl.Resource;
import io.fabric8.kubernetes.client.informers.ResourceEventHandler;
import io.fabric8.kubernetes.client.informers.SharedIndexInformer;
import io.fabric8.kubernetes.api.model.KubernetesResourceList;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 샌드박스 리소스에 대한 Kubernetes API 접근 서비스
 * 모든 KubernetesClientException 은 K8sApiException 으로 변환된다.
 */
@org.springframework.stereotype.Service
@ControllerRole
@RequiredArgsConstructor
public class SandboxClusterService {

    private static final Logger log = LoggerFactory.getLogger(SandboxClusterService.class);

    public static final String POOL_API_VERSION = "extensions.agents.x-k8s.io/v1alpha1";
    public static final String POOL_KIND = "SandboxWarmPool";
    public static final String TEMPLATE_KIND = "SandboxTemplate";

    private final KubernetesClient client;
    private final ApiRetryPolicy retryPolicy;

    private MixedOperation<AgentSandboxService, KubernetesResourceList<AgentSandboxService>, Resource<AgentSandboxService>> claims() {
        return client.resources(AgentSandboxService.class);
    }

    // ========== Claim ==========

    public Optional<AgentSandboxService> findClaim(String namespace, String name) {
        try {
            return Optional.ofNullable(claims().inNamespace(namespace).withName(name).get());
        } catch (KubernetesClientException e) {
            log.error("Failed to get claim: {}/{}", namespace, name, e);
            throw new K8sApiException("Failed to get claim " + namespace + "/" + name, e.getCode(), e);
        }
    }

    public List<AgentSandboxService> listClaims(String namespace) {
        try {
            if (namespace == null || namespace.isBlank()) {
                return claims().inAnyNamespace().list().getItems();
            }
            return claims().inNamespace(namespace).list().getItems();
        } catch (KubernetesClientException e) {
            log.error("Failed to list claims in namespace: {}", namespace, e);
            throw new K8sApiException("Failed to list claims", e.getCode(), e);
        }
    }

    /**
     * status 서브리소스 갱신 (resourceVersion 기반, 충돌 시 409)
     */
    public AgentSandboxService updateClaimStatus(AgentSandboxService claim) {
        String namespace = claim.getMetadata().getNamespace();
        String name = claim.getMetadata().getName();
        try {
            return claims().inNamespace(namespace).resource(claim).updateStatus();
        } catch (KubernetesClientException e) {
            if (e.getCode() == 404) {
                throw new K8sResourceNotFoundException("Claim not found: " + namespace + "/" + name, e);
            }
            log.debug("Failed to update status of claim {}/{}: {}", namespace, name, e.getMessage());
            throw new K8sApiException("Failed to update status of claim " + namespace + "/" + name, e.getCode(), e);
        }
    }

    /**
     * 하트비트 어노테이션 기록 (read-modify-write, 충돌 시 재시도)
     */
    public AgentSandboxService stampHeartbeat(String namespace, String name, Instant at) {
        return retryPolicy.onConflict("heartbeat-" + namespace + "/" + name, () -> {
            AgentSandboxService claim = findClaim(namespace, name)
                .orElseThrow(() -> new K8sResourceNotFoundException(
                    String.format("Claim not found: %s/%s", namespace, name)));

            Map<String, String> annotations = claim.getMetadata().getAnnotations() != null
                ? new HashMap<>(claim.getMetadata().getAnnotations())
                : new HashMap<>();
            annotations.put(AgentSandboxService.LAST_ACTIVE_ANNOTATION, at.toString());
            claim.getMetadata().setAnnotations(annotations);

            try {
                AgentSandboxService updated = claims().inNamespace(namespace).resource(claim).update();
                log.debug("Heartbeat recorded for {}/{} at {}", namespace, name, at);
                return updated;
            } catch (KubernetesClientException e) {
                throw new K8sApiException("Failed to record heartbeat for " + namespace + "/" + name, e.getCode(), e);
            }
        });
    }

    /**
     * 클레임 삭제 (foreground 전파: 소유 리소스가 먼저 정리된다)
     * 이미 없으면 false
     */
    public boolean deleteClaim(String namespace, String name) {
        try {
            List<StatusDetails> details = claims().inNamespace(namespace).withName(name)
                .withPropagationPolicy(DeletionPropagation.FOREGROUND)
                .delete();
            boolean deleted = details != null && !details.isEmpty();
            log.info("Delete requested for claim {}/{} (found={})", namespace, name, deleted);
            return deleted;
        } catch (KubernetesClientException e) {
            log.error("Failed to delete claim: {}/{}", namespace, name, e);
            throw new K8sApiException("Failed to delete claim " + namespace + "/" + name, e.getCode(), e);
        }
    }

    public SharedIndexInformer<AgentSandboxService> informClaims(String namespace,
                                                                  ResourceEventHandler<AgentSandboxService> handler,
                                                                  long resyncMillis) {
        try {
            if (namespace == null || namespace.isBlank()) {
                return claims().inAnyNamespace().inform(handler, resyncMillis);
            }
            return claims().inNamespace(namespace).inform(handler, resyncMillis);
        } catch (KubernetesClientException e) {
            log.error("Failed to start claim informer for namespace: {}", namespace, e);
            throw new K8sApiException("Failed to watch claims", e.getCode(), e);
        }
    }

    // ========== Derived resources ==========

    /**
     * server-side apply (충돌 필드는 컨트롤러 소유로 강제)
     */
    public HasMetadata apply(HasMetadata resource) {
        String kind = resource.getKind();
        String namespace = resource.getMetadata().getNamespace();
        String name = resource.getMetadata().getName();
        try {
            HasMetadata applied = client.resource(resource).forceConflicts().serverSideApply();
            log.debug("Applied {} {}/{}", kind, namespace, name);
            return applied;
        } catch (KubernetesClientException e) {
            log.warn("Failed to apply {} {}/{}: {}", kind, namespace, name, e.getMessage());
            throw new K8sApiException(String.format("Failed to apply %s %s/%s: %s",
                kind, namespace, name, e.getMessage()), e.getCode(), e);
        }
    }

    public Optional<GenericKubernetesResource> findWarmPool(String namespace, String name) {
        try {
            return Optional.ofNullable(client.genericKubernetesResources(POOL_API_VERSION, POOL_KIND)
                .inNamespace(namespace)
                .withName(name)
                .get());
        } catch (KubernetesClientException e) {
            log.error("Failed to get warm pool: {}/{}", namespace, name, e);
            throw new K8sApiException("Failed to get warm pool " + namespace + "/" + name, e.getCode(), e);
        }
    }

    /**
     * 풀의 spec.replicas (풀이 없으면 empty, 필드가 없으면 0)
     */
    public Optional<Integer> warmPoolReplicas(String namespace, String name) {
        return findWarmPool(namespace, name).map(SandboxClusterService::replicasOf);
    }

    /**
     * 풀 레플리카 수 변경 (read-modify-write, 충돌 시 재시도)
     * 변경이 필요 없으면 false
     */
    public boolean scaleWarmPool(String namespace, String name, int replicas) {
        return retryPolicy.onConflict("scale-" + namespace + "/" + name, () -> {
            GenericKubernetesResource pool = findWarmPool(namespace, name)
                .orElseThrow(() -> new K8sResourceNotFoundException(
                    String.format("Warm pool not found: %s/%s", namespace, name)));

            if (replicasOf(pool) == replicas) {
                return false;
            }

            Map<String, Object> spec = specOf(pool);
            spec.put("replicas", replicas);
            pool.setAdditionalProperty("spec", spec);

            try {
                client.resource(pool).update();
                log.info("Scaled warm pool {}/{} to {} replicas", namespace, name, replicas);
                return true;
            } catch (KubernetesClientException e) {
                throw new K8sApiException("Failed to scale warm pool " + namespace + "/" + name, e.getCode(), e);
            }
        });
    }

    public Optional<PersistentVolumeClaim> findWorkspaceClaim(String namespace, String pvcName) {
        try {
            return Optional.ofNullable(client.persistentVolumeClaims()
                .inNamespace(namespace)
                .withName(pvcName)
                .get());
        } catch (KubernetesClientException e) {
            log.error("Failed to get PVC: {}/{}", namespace, pvcName, e);
            throw new K8sApiException("Failed to get PVC " + namespace + "/" + pvcName, e.getCode(), e);
        }
    }

    public Optional<Service> findService(String namespace, String name) {
        try {
            return Optional.ofNullable(client.services()
                .inNamespace(namespace)
                .withName(name)
                .get());
        } catch (KubernetesClientException e) {
            log.error("Failed to get service: {}/{}", namespace, name, e);
            throw new K8sApiException("Failed to get service " + namespace + "/" + name, e.getCode(), e);
        }
    }

    static Map<String, Object> specOf(GenericKubernetesResource resource) {
        Map<String, Object> copy = new HashMap<>();
        Object spec = resource.getAdditionalProperties().get("spec");
        if (spec instanceof Map) {
            ((Map<?, ?>) spec).forEach((key, value) -> {
                if (key instanceof String) {
                    copy.put((String) key, value);
                }
            });
        }
        return copy;
    }

    static int replicasOf(GenericKubernetesResource pool) {
        Object replicas = specOf(pool).get("replicas");
        if (replicas instanceof Number) {
            return ((Number) replicas).intValue();
        }
        return 0;
    }
}
