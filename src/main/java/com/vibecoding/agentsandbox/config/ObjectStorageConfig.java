package com.vibecoding.agentsandbox.config;

import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;

import java.net.URI;

/**
 * S3 호환 오브젝트 스토리지 클라이언트
 * 자격증명은 플랫폼 Secret(envFrom)으로 주입된 환경변수를 기본 체인으로 읽는다.
 */
@Configuration
@WorkspaceAgentRole
@RequiredArgsConstructor
public class ObjectStorageConfig {

    private static final Logger log = LoggerFactory.getLogger(ObjectStorageConfig.class);

    private final WorkspaceProperties workspaceProperties;

    @Bean(destroyMethod = "close")
    public S3Client s3Client() {
        S3ClientBuilder builder = S3Client.builder()
            .region(Region.of(workspaceProperties.getRegion()))
            .credentialsProvider(DefaultCredentialsProvider.create())
            .forcePathStyle(Boolean.TRUE.equals(workspaceProperties.getPathStyleAccess()));

        String endpoint = workspaceProperties.getEndpoint();
        if (endpoint != null && !endpoint.isBlank()) {
            builder.endpointOverride(URI.create(endpoint));
        }

        log.info("S3 client configured: bucket={}, region={}, endpoint={}",
            workspaceProperties.getBucket(), workspaceProperties.getRegion(),
            endpoint == null || endpoint.isBlank() ? "<aws>" : endpoint);
        return builder.build();
    }
}
