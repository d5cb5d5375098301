package com.vibecoding.agentsandbox.service;

import com.vibecoding.agentsandbox.config.ControllerRole;
import com.vibecoding.agentsandbox.config.HibernationProperties;
import com.vibecoding.agentsandbox.exception.HibernationTransitionException;
import com.vibecoding.agentsandbox.exception.K8sApiException;
import com.vibecoding.agentsandbox.exception.K8sResourceNotFoundException;
import com.vibecoding.agentsandbox.model.AgentSandboxService;
import com.vibecoding.agentsandbox.model.ExpiryAction;
import com.vibecoding.agentsandbox.model.HibernationSnapshot;
import com.vibecoding.agentsandbox.model.HibernationState;
import com.vibecoding.agentsandbox.model.HibernationStatusView;
import com.vibecoding.agentsandbox.model.TransitionOutcome;
import com.vibecoding.agentsandbox.repository.TransitionLedger;
import com.vibecoding.agentsandbox.support.BoundedPoller;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.Optional;

/**
 * 하이버네이션 상태 머신 (Active -> Warm -> Cold)
 *
 * 상태는 저장하지 않고 클레임, 풀 레플리카, PVC 존재 여부로부터 매번 계산한다.
 * - soft TTL 초과: 풀 레플리카 0 (PVC 유지)
 * - hard TTL 초과: 클레임 삭제 (foreground, PVC 까지 연쇄 삭제)
 * - Cold -> Active, Warm -> Active 는 외부(재생성, 오토스케일러)에서 일어난다
 */
@org.springframework.stereotype.Service
@ControllerRole
public class HibernationStateMachine {

    private static final Logger log = LoggerFactory.getLogger(HibernationStateMachine.class);

    private final SandboxClusterService clusterService;
    private final HibernationProperties properties;
    private final TransitionLedger ledger;
    private final Clock clock;
    private final BoundedPoller coldPoller;

    @Autowired
    public HibernationStateMachine(SandboxClusterService clusterService,
                                   HibernationProperties properties,
                                   TransitionLedger ledger,
                                   Clock clock) {
        this(clusterService, properties, ledger, clock,
            BoundedPoller.exponential(properties.getColdPollInterval(), properties.getColdMaxPollInterval()));
    }

    HibernationStateMachine(SandboxClusterService clusterService,
                            HibernationProperties properties,
                            TransitionLedger ledger,
                            Clock clock,
                            BoundedPoller coldPoller) {
        this.clusterService = clusterService;
        this.properties = properties;
        this.ledger = ledger;
        this.clock = clock;
        this.coldPoller = coldPoller;
    }

    // ========== Observation ==========

    public HibernationSnapshot observe(String namespace, String name) {
        Optional<AgentSandboxService> claim = clusterService.findClaim(namespace, name);
        Integer replicas = clusterService.warmPoolReplicas(namespace, name).orElse(null);
        boolean workspaceExists = clusterService
            .findWorkspaceClaim(namespace, ResourceComposer.workspaceClaimName(name))
            .isPresent();

        return HibernationSnapshot.builder()
            .namespace(namespace)
            .claimName(name)
            .claimExists(claim.isPresent())
            .poolReplicas(replicas)
            .workspaceExists(workspaceExists)
            .lastActive(claim.flatMap(HibernationStateMachine::lastActiveOf).orElse(null))
            .createdAt(claim.flatMap(HibernationStateMachine::createdAtOf).orElse(null))
            .build();
    }

    public static HibernationState classify(HibernationSnapshot snapshot) {
        if (snapshot.isClaimExists()) {
            if (snapshot.getPoolReplicas() != null && snapshot.getPoolReplicas() >= 1) {
                return HibernationState.ACTIVE;
            }
            return snapshot.isWorkspaceExists() ? HibernationState.WARM : HibernationState.PROVISIONING;
        }
        return snapshot.isWorkspaceExists() ? HibernationState.RECLAIMING : HibernationState.COLD;
    }

    /**
     * 하트비트 나이로 만료 판정
     * 하트비트가 없으면 soft 만료 대상이지만 hard 만료는 생성 시각부터 계산한다.
     */
    public ExpiryAction decide(Instant lastActive, Instant createdAt, Instant now) {
        Instant hardReference = lastActive != null ? lastActive : createdAt;
        if (hardReference != null && Duration.between(hardReference, now).compareTo(properties.getHardTtl()) > 0) {
            return ExpiryAction.HARD_EXPIRE;
        }
        if (lastActive == null || Duration.between(lastActive, now).compareTo(properties.getSoftTtl()) > 0) {
            return ExpiryAction.SOFT_EXPIRE;
        }
        return ExpiryAction.NONE;
    }

    public ExpiryAction decide(AgentSandboxService claim, Instant now) {
        return decide(lastActiveOf(claim).orElse(null), createdAtOf(claim).orElse(null), now);
    }

    // ========== Evaluation ==========

    /**
     * 클레임 하나의 TTL 평가 및 필요한 전이 실행
     *
     * @return 평가 후 관측된 상태 (COLD/RECLAIMING 이면 클레임이 삭제된 것)
     */
    public HibernationState evaluate(AgentSandboxService claim) {
        String namespace = claim.getMetadata().getNamespace();
        String name = claim.getMetadata().getName();

        HibernationSnapshot snapshot = observe(namespace, name);
        HibernationState state = classify(snapshot);
        if (!Boolean.TRUE.equals(properties.getEnabled()) || !snapshot.isClaimExists()) {
            return state;
        }

        ExpiryAction action = decide(snapshot.getLastActive(), snapshot.getCreatedAt(), clock.instant());
        log.debug("Hibernation evaluation for {}/{}: state={}, action={}", namespace, name, state, action);

        switch (action) {
            case HARD_EXPIRE:
                try {
                    TransitionOutcome outcome = hardExpire(namespace, name, state);
                    if (outcome == TransitionOutcome.APPLIED) {
                        return HibernationState.COLD;
                    }
                    // 삭제 실패나 NOOP 이면 실제 관측 상태를 그대로 보고
                    return classify(observe(namespace, name));
                } catch (HibernationTransitionException e) {
                    log.error("Hibernation transition stuck for {}/{}: {}", namespace, name, e.getMessage());
                    return classify(observe(namespace, name));
                }
            case SOFT_EXPIRE:
                if (state == HibernationState.ACTIVE) {
                    TransitionOutcome outcome = softExpire(namespace, name);
                    return outcome == TransitionOutcome.APPLIED ? HibernationState.WARM : state;
                }
                return state;
            default:
                return state;
        }
    }

    /**
     * Active -> Warm: 풀 레플리카를 0 으로 (이미 0 이면 NOOP)
     */
    public TransitionOutcome softExpire(String namespace, String name) {
        try {
            boolean scaled = clusterService.scaleWarmPool(namespace, name, 0);
            if (!scaled) {
                log.debug("Warm pool {}/{} already at 0 replicas", namespace, name);
                return TransitionOutcome.NOOP;
            }
            log.info("Soft expiry: {}/{} hibernated to Warm", namespace, name);
            ledger.record(namespace, name, HibernationState.ACTIVE, HibernationState.WARM,
                TransitionOutcome.APPLIED, "Idle past soft TTL " + properties.getSoftTtl());
            return TransitionOutcome.APPLIED;
        } catch (K8sResourceNotFoundException e) {
            log.debug("Warm pool {}/{} not found during soft expiry", namespace, name);
            return TransitionOutcome.NOOP;
        } catch (K8sApiException e) {
            log.warn("Soft expiry of {}/{} failed: {}", namespace, name, e.getMessage());
            ledger.record(namespace, name, HibernationState.ACTIVE, HibernationState.WARM,
                TransitionOutcome.FAILED, e.getMessage());
            return TransitionOutcome.FAILED;
        }
    }

    /**
     * Warm -> Cold: 클레임 삭제 후 클레임과 PVC 가 모두 사라질 때까지 대기
     *
     * @throws HibernationTransitionException cold-timeout 안에 수렴하지 않으면
     */
    public TransitionOutcome hardExpire(String namespace, String name, HibernationState from) {
        boolean deleted;
        try {
            deleted = clusterService.deleteClaim(namespace, name);
        } catch (K8sApiException e) {
            log.warn("Hard expiry of {}/{} failed: {}", namespace, name, e.getMessage());
            ledger.record(namespace, name, from, HibernationState.COLD, TransitionOutcome.FAILED, e.getMessage());
            return TransitionOutcome.FAILED;
        }
        if (!deleted) {
            return TransitionOutcome.NOOP;
        }

        log.info("Hard expiry: deleted claim {}/{}, waiting for Cold", namespace, name);
        awaitCold(namespace, name, from);
        ledger.record(namespace, name, from, HibernationState.COLD, TransitionOutcome.APPLIED,
            "Idle past hard TTL " + properties.getHardTtl());
        return TransitionOutcome.APPLIED;
    }

    /**
     * 클레임과 PVC 가 모두 없어질 때까지 폴링 (지수 백오프, cold-timeout 한도)
     */
    public void awaitCold(String namespace, String name, HibernationState from) {
        Optional<HibernationState> cold = coldPoller.poll(() -> {
            HibernationState state = classify(observe(namespace, name));
            return state == HibernationState.COLD ? Optional.of(state) : Optional.empty();
        }, properties.getColdTimeout());

        if (cold.isEmpty()) {
            String message = String.format("%s/%s did not reach Cold within %s", namespace, name,
                properties.getColdTimeout());
            ledger.record(namespace, name, from, HibernationState.COLD, TransitionOutcome.STUCK, message);
            throw new HibernationTransitionException(message);
        }
    }

    // ========== Query ==========

    public HibernationStatusView status(String namespace, String name) {
        HibernationSnapshot snapshot = observe(namespace, name);
        if (!snapshot.isClaimExists() && !snapshot.isWorkspaceExists()) {
            throw new K8sResourceNotFoundException(String.format("Claim not found: %s/%s", namespace, name));
        }

        Instant now = clock.instant();
        Instant lastActive = snapshot.getLastActive();
        return HibernationStatusView.builder()
            .namespace(namespace)
            .name(name)
            .state(classify(snapshot))
            .poolReplicas(snapshot.getPoolReplicas())
            .workspaceExists(snapshot.isWorkspaceExists())
            .lastActive(lastActive != null ? lastActive.toString() : null)
            .idleSeconds(lastActive != null ? Duration.between(lastActive, now).getSeconds() : null)
            .pendingAction(snapshot.isClaimExists()
                ? decide(lastActive, snapshot.getCreatedAt(), now)
                : ExpiryAction.NONE)
            .build();
    }

    // ========== Helpers ==========

    static Optional<Instant> lastActiveOf(AgentSandboxService claim) {
        Map<String, String> annotations = claim.getMetadata().getAnnotations();
        if (annotations == null) {
            return Optional.empty();
        }
        return parseInstant(annotations.get(AgentSandboxService.LAST_ACTIVE_ANNOTATION), claim.key());
    }

    static Optional<Instant> createdAtOf(AgentSandboxService claim) {
        return parseInstant(claim.getMetadata().getCreationTimestamp(), claim.key());
    }

    private static Optional<Instant> parseInstant(String value, String claimKey) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Instant.parse(value));
        } catch (DateTimeParseException e) {
            log.warn("Ignoring unparseable timestamp '{}' on claim {}", value, claimKey);
            return Optional.empty();
        }
    }
}
