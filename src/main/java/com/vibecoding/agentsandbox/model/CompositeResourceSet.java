package com.vibecoding.agentsandbox.model;

import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.PersistentVolumeClaim;
import io.fabric8.kubernetes.api.model.PodTemplateSpec;
import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.api.model.Service;
import io.fabric8.kubernetes.api.model.ServiceAccount;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 클레임 하나에서 파생되는 리소스 세트
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompositeResourceSet {
    private String namespace;
    private String claimName;

    private ServiceAccount serviceAccount;
    private Secret connectionSecret;
    private PersistentVolumeClaim workspaceClaim;
    private Service service;                        // httpPort 미설정 시 null
    private PodTemplateSpec podTemplate;            // sandboxTemplate 안에 포함되는 Pod 템플릿
    private GenericKubernetesResource sandboxTemplate;
    private GenericKubernetesResource warmPool;
    private GenericKubernetesResource scaledObject;

    public Optional<Service> serviceIfRequested() {
        return Optional.ofNullable(service);
    }

    /**
     * 적용 순서: 의존되는 리소스부터
     */
    public List<HasMetadata> inApplyOrder() {
        List<HasMetadata> resources = new ArrayList<>();
        resources.add(serviceAccount);
        resources.add(connectionSecret);
        resources.add(workspaceClaim);
        if (service != null) {
            resources.add(service);
        }
        resources.add(sandboxTemplate);
        resources.add(warmPool);
        resources.add(scaledObject);
        return resources;
    }
}
