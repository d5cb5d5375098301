package com.vibecoding.agentsandbox.service;

import io.fabric8.kubernetes.api.model.EnvFromSource;
import io.fabric8.kubernetes.api.model.EnvFromSourceBuilder;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 워크로드 컨테이너의 envFrom Secret 참조 구성
 *
 * 순서:
 * - 사용자 Secret: secret1..secret5 순서, 미설정 슬롯은 건너뜀, optional=true
 * - 플랫폼 Secret: 항상 마지막, optional=false (오브젝트 스토리지 자격증명)
 */
@Component
public class SecretComposer {

    public static final int MAX_USER_SECRETS = 5;

    /**
     * @param userSecretSlots secret1..secret5 순서의 슬롯 (null/빈 값은 미설정)
     */
    public List<EnvFromSource> compose(List<String> userSecretSlots, String platformSecretName) {
        if (platformSecretName == null || platformSecretName.isBlank()) {
            throw new IllegalArgumentException("Platform secret name is required");
        }
        if (userSecretSlots.size() > MAX_USER_SECRETS) {
            throw new IllegalArgumentException(
                "At most " + MAX_USER_SECRETS + " user secrets are supported, got " + userSecretSlots.size());
        }

        List<EnvFromSource> sources = new ArrayList<>(MAX_USER_SECRETS + 1);
        for (String secretName : userSecretSlots) {
            if (secretName != null && !secretName.isBlank()) {
                sources.add(secretRef(secretName, true));
            }
        }
        sources.add(platformSecretSource(platformSecretName));
        return sources;
    }

    /**
     * 플랫폼 Secret 참조 (없으면 Pod 생성 단계에서 실패해야 한다)
     */
    public EnvFromSource platformSecretSource(String platformSecretName) {
        return secretRef(platformSecretName, false);
    }

    private EnvFromSource secretRef(String name, boolean optional) {
        return new EnvFromSourceBuilder()
            .withNewSecretRef()
                .withName(name)
                .withOptional(optional)
            .endSecretRef()
            .build();
    }
}
