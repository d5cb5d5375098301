package com.vibecoding.agentsandbox.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * NATS JetStream 바인딩 (KEDA 트리거 메타데이터로만 사용)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NatsBinding {
    public static final String DEFAULT_URL = "nats://nats.nats.svc:4222";

    private String url;
    private String stream;
    private String consumer;
}
