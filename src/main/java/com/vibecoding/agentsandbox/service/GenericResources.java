package com.vibecoding.agentsandbox.service;

import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.api.model.ObjectMeta;

import java.util.Map;

/**
 * 타입 모델이 없는 CRD (SandboxTemplate, SandboxWarmPool, ScaledObject) 생성 도우미
 */
final class GenericResources {

    private GenericResources() {
    }

    static GenericKubernetesResource of(String apiVersion, String kind, ObjectMeta metadata, Map<String, Object> spec) {
        GenericKubernetesResource resource = new GenericKubernetesResource();
        resource.setApiVersion(apiVersion);
        resource.setKind(kind);
        resource.setMetadata(metadata);
        resource.setAdditionalProperty("spec", spec);
        return resource;
    }
}
