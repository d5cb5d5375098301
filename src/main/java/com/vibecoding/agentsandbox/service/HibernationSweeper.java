package com.vibecoding.agentsandbox.service;

import com.vibecoding.agentsandbox.config.ControllerRole;
import com.vibecoding.agentsandbox.config.HibernationProperties;
import com.vibecoding.agentsandbox.config.SandboxControllerProperties;
import com.vibecoding.agentsandbox.exception.K8sApiException;
import com.vibecoding.agentsandbox.model.AgentSandboxService;
import com.vibecoding.agentsandbox.model.HibernationState;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 주기적으로 모든 클레임의 하트비트를 TTL 과 비교
 */
@Component
@ControllerRole
@RequiredArgsConstructor
public class HibernationSweeper {

    private static final Logger log = LoggerFactory.getLogger(HibernationSweeper.class);

    private final SandboxClusterService clusterService;
    private final ClaimReconciler reconciler;
    private final HibernationProperties hibernationProperties;
    private final SandboxControllerProperties controllerProperties;

    @Scheduled(fixedDelayString = "${sandbox.hibernation.sweep-interval:PT1M}",
        initialDelayString = "${sandbox.hibernation.sweep-interval:PT1M}")
    public void sweep() {
        if (!Boolean.TRUE.equals(hibernationProperties.getEnabled())) {
            return;
        }

        List<AgentSandboxService> claims;
        try {
            claims = clusterService.listClaims(controllerProperties.getNamespace());
        } catch (K8sApiException e) {
            log.warn("Hibernation sweep skipped, cannot list claims: {}", e.getMessage());
            return;
        }

        Map<HibernationState, Integer> counts = new EnumMap<>(HibernationState.class);
        for (AgentSandboxService claim : claims) {
            String namespace = claim.getMetadata().getNamespace();
            String name = claim.getMetadata().getName();
            try {
                Optional<HibernationState> state = reconciler.sweepExpiry(namespace, name);
                state.ifPresent(s -> counts.merge(s, 1, Integer::sum));
            } catch (RuntimeException e) {
                log.warn("Hibernation sweep failed for {}/{}: {}", namespace, name, e.getMessage());
            }
        }

        log.debug("Hibernation sweep evaluated {} claims: {}", claims.size(), counts);
    }
}
