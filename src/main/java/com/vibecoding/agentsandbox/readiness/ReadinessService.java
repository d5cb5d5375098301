package com.vibecoding.agentsandbox.readiness;

import com.vibecoding.agentsandbox.config.ControllerRole;
import com.vibecoding.agentsandbox.model.CompositeResourceSet;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 파생 리소스 준비 상태 집계 서비스
 * 검사기 자체가 실패하면 해당 리소스는 준비되지 않은 것으로 본다.
 */
@Service
@ControllerRole
@RequiredArgsConstructor
public class ReadinessService {

    private static final Logger log = LoggerFactory.getLogger(ReadinessService.class);

    private final List<ResourceReadinessCheck> checks;

    /**
     * 준비되지 않은 이유 목록 (비어 있으면 Ready)
     */
    public List<String> findBlockers(CompositeResourceSet resources) {
        log.debug("Checking readiness of {}/{}", resources.getNamespace(), resources.getClaimName());

        return checks.stream()
            .filter(check -> check.appliesTo(resources))
            .map(check -> {
                try {
                    return check.findBlocker(resources);
                } catch (RuntimeException e) {
                    log.warn("Readiness check for {} failed: {}", check.getResourceKind(), e.getMessage());
                    return Optional.of(check.getResourceKind() + " readiness could not be determined: " + e.getMessage());
                }
            })
            .flatMap(Optional::stream)
            .collect(Collectors.toList());
    }

    public boolean isReady(CompositeResourceSet resources) {
        return findBlockers(resources).isEmpty();
    }
}
