package com.vibecoding.agentsandbox.readiness;

import com.vibecoding.agentsandbox.model.CompositeResourceSet;

import java.util.Optional;

/**
 * 파생 리소스 준비 상태 검사 인터페이스
 */
public interface ResourceReadinessCheck {
    /**
     * 검사 대상 리소스 종류
     */
    String getResourceKind();

    /**
     * 이 리소스 세트에 해당 리소스가 포함되는지 확인
     */
    boolean appliesTo(CompositeResourceSet resources);

    /**
     * 준비되지 않았다면 그 이유, 준비되었으면 empty
     */
    Optional<String> findBlocker(CompositeResourceSet resources);
}
