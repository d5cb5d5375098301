package com.vibecoding.agentsandbox.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * KEDA nats-jetstream 트리거 설정
 */
@Configuration
@ConfigurationProperties(prefix = "sandbox.scaler")
@Data
public class ScalerProperties {

    private String natsMonitoringEndpoint = "nats-headless.nats.svc.cluster.local:8222";
    private String account = "$G";
    private String lagThreshold = "5";
    private Integer pollingInterval = 15;   // seconds
    private Integer cooldownPeriod = 300;   // seconds
}
