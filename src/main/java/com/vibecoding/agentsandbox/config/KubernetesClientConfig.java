package com.vibecoding.agentsandbox.config;

import io.fabric8.kubernetes.client.Config;
import io.fabric8.kubernetes.client.ConfigBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Kubernetes 클라이언트 생성
 * in-cluster ServiceAccount 또는 ~/.kube/config 자동 설정을 사용한다.
 */
@Configuration
@ControllerRole
public class KubernetesClientConfig {

    private static final Logger log = LoggerFactory.getLogger(KubernetesClientConfig.class);

    @Bean(destroyMethod = "close")
    public KubernetesClient kubernetesClient() {
        try {
            Config k8sConfig = new ConfigBuilder()
                .withRequestTimeout(30000)   // 30초
                .withConnectionTimeout(10000) // 10초
                .build();

            KubernetesClient client = new KubernetesClientBuilder()
                .withConfig(k8sConfig)
                .build();

            log.info("Kubernetes client configured for API server: {}", client.getConfiguration().getMasterUrl());
            return client;
        } catch (Exception e) {
            log.error("Failed to create Kubernetes client", e);
            throw new IllegalStateException("Invalid Kubernetes client configuration: " + e.getMessage(), e);
        }
    }
}
