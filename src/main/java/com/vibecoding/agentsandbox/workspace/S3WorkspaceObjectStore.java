package com.vibecoding.agentsandbox.workspace;

import com.vibecoding.agentsandbox.config.WorkspaceAgentRole;
import com.vibecoding.agentsandbox.config.WorkspaceProperties;
import com.vibecoding.agentsandbox.exception.WorkspacePersistenceException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.core.sync.ResponseTransformer;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * S3 호환 오브젝트 스토리지 구현
 * 오브젝트가 없다는 확실한 응답(NoSuchKey, 404)만 empty 로 취급하고 나머지는 모두 오류.
 */
@Component
@WorkspaceAgentRole
@RequiredArgsConstructor
public class S3WorkspaceObjectStore implements WorkspaceObjectStore {

    private static final Logger log = LoggerFactory.getLogger(S3WorkspaceObjectStore.class);

    private static final String CONTENT_TYPE = "application/gzip";

    private final S3Client s3Client;
    private final WorkspaceProperties properties;

    @Override
    public Optional<Path> download(String key, Path target) {
        String bucket = properties.getBucket();
        GetObjectRequest request = GetObjectRequest.builder()
            .bucket(bucket)
            .key(key)
            .build();

        try {
            // ResponseTransformer.toFile 은 기존 파일이 있으면 실패한다
            Files.deleteIfExists(target);
            s3Client.getObject(request, ResponseTransformer.toFile(target));
            log.debug("Downloaded s3://{}/{} ({} bytes)", bucket, key, Files.size(target));
            return Optional.of(target);
        } catch (NoSuchKeyException e) {
            log.info("No workspace backup at s3://{}/{}", bucket, key);
            return Optional.empty();
        } catch (S3Exception e) {
            if (e.statusCode() == 404) {
                log.info("No workspace backup at s3://{}/{}", bucket, key);
                return Optional.empty();
            }
            throw new WorkspacePersistenceException(String.format("Failed to download s3://%s/%s (HTTP %d): %s",
                bucket, key, e.statusCode(), e.getMessage()), e);
        } catch (SdkException e) {
            throw new WorkspacePersistenceException(String.format("Failed to download s3://%s/%s: %s",
                bucket, key, e.getMessage()), e);
        } catch (IOException e) {
            throw new WorkspacePersistenceException("Failed to prepare download target " + target, e);
        }
    }

    @Override
    public void upload(String key, Path source) {
        String bucket = properties.getBucket();
        PutObjectRequest request = PutObjectRequest.builder()
            .bucket(bucket)
            .key(key)
            .contentType(CONTENT_TYPE)
            .build();

        try {
            s3Client.putObject(request, RequestBody.fromFile(source));
            log.debug("Uploaded {} to s3://{}/{}", source, bucket, key);
        } catch (SdkException e) {
            throw new WorkspacePersistenceException(String.format("Failed to upload s3://%s/%s: %s",
                bucket, key, e.getMessage()), e);
        }
    }
}
