package com.vibecoding.agentsandbox.service;

import com.vibecoding.agentsandbox.config.ControllerRole;
import com.vibecoding.agentsandbox.config.SandboxControllerProperties;
import com.vibecoding.agentsandbox.exception.ClaimValidationException;
import com.vibecoding.agentsandbox.exception.CompositionException;
import com.vibecoding.agentsandbox.exception.K8sApiException;
import com.vibecoding.agentsandbox.exception.K8sResourceNotFoundException;
import com.vibecoding.agentsandbox.exception.ReconcileTimeoutException;
import com.vibecoding.agentsandbox.model.AgentSandboxService;
import com.vibecoding.agentsandbox.model.AgentSandboxStatus;
import com.vibecoding.agentsandbox.model.CompositeResourceSet;
import com.vibecoding.agentsandbox.model.HibernationState;
import com.vibecoding.agentsandbox.model.ReconcileOutcome;
import com.vibecoding.agentsandbox.model.ReconcileResult;
import com.vibecoding.agentsandbox.model.SandboxCondition;
import com.vibecoding.agentsandbox.readiness.ReadinessService;
import com.vibecoding.agentsandbox.support.ApiRetryPolicy;
import com.vibecoding.agentsandbox.support.BoundedPoller;
import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.api.model.HasMetadata;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 클레임 리컨실 루프
 *
 * 검증 -> 하이버네이션 평가 -> 리소스 렌더링 -> server-side apply -> 준비 상태 확인 -> status 기록.
 * 같은 클레임은 직렬화되고, 다른 클레임은 병렬로 처리될 수 있다.
 */
@org.springframework.stereotype.Service
@ControllerRole
@RequiredArgsConstructor
public class ClaimReconciler {

    private static final Logger log = LoggerFactory.getLogger(ClaimReconciler.class);

    static final String REASON_APPLIED = "ResourcesApplied";
    static final String REASON_VALIDATION_FAILED = "ValidationFailed";
    static final String REASON_COMPOSITION_FAILED = "CompositionFailed";
    static final String REASON_APPLY_FAILED = "ApplyFailed";
    static final String REASON_READY = "ResourcesReady";
    static final String REASON_WAITING = "WaitingForResources";
    static final String REASON_NOT_SYNCED = "NotSynced";

    private final SandboxClusterService clusterService;
    private final ClaimValidator validator;
    private final ResourceComposer composer;
    private final ReadinessService readinessService;
    private final HibernationStateMachine hibernation;
    private final ApiRetryPolicy retryPolicy;
    private final SandboxControllerProperties properties;
    private final Clock clock;

    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public ReconcileResult reconcile(String namespace, String name) {
        ReentrantLock lock = acquire(namespace, name);
        try {
            return doReconcile(namespace, name);
        } catch (K8sResourceNotFoundException e) {
            log.info("Claim {}/{} disappeared during reconciliation", namespace, name);
            return result(namespace, name, ReconcileOutcome.DELETED, "Claim no longer exists", null);
        } finally {
            lock.unlock();
        }
    }

    /**
     * TTL 평가만 수행 (주기적 스윕)
     */
    public Optional<HibernationState> sweepExpiry(String namespace, String name) {
        ReentrantLock lock = acquire(namespace, name);
        try {
            return clusterService.findClaim(namespace, name)
                .filter(claim -> claim.getMetadata().getDeletionTimestamp() == null)
                .map(hibernation::evaluate);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Ready=True 가 될 때까지 대기
     *
     * @throws ReconcileTimeoutException 제한 시간 초과
     * @throws K8sResourceNotFoundException 대기 중 클레임이 사라짐
     */
    public AgentSandboxService awaitReady(String namespace, String name, Duration timeout) {
        BoundedPoller poller = BoundedPoller.linear(properties.getReadyPollInterval());
        return poller.poll(() -> {
                AgentSandboxService claim = clusterService.findClaim(namespace, name)
                    .orElseThrow(() -> new K8sResourceNotFoundException(
                        String.format("Claim not found: %s/%s", namespace, name)));
                boolean ready = claim.getStatus() != null && claim.getStatus().isTrue(SandboxCondition.READY);
                return ready ? Optional.of(claim) : Optional.<AgentSandboxService>empty();
            }, timeout)
            .orElseThrow(() -> new ReconcileTimeoutException("claim " + namespace + "/" + name + " to become Ready", timeout));
    }

    private ReconcileResult doReconcile(String namespace, String name) {
        Optional<AgentSandboxService> found = clusterService.findClaim(namespace, name);
        if (found.isEmpty()) {
            log.debug("Claim {}/{} not found, nothing to reconcile", namespace, name);
            return result(namespace, name, ReconcileOutcome.DELETED, "Claim no longer exists", null);
        }
        AgentSandboxService claim = found.get();
        if (claim.getMetadata().getDeletionTimestamp() != null) {
            log.debug("Claim {}/{} is being deleted, relying on owner-reference cascade", namespace, name);
            return result(namespace, name, ReconcileOutcome.DELETED, "Claim is being deleted", null);
        }

        try {
            validator.validate(claim);
        } catch (ClaimValidationException e) {
            log.warn("Claim {}/{} is invalid: {}", namespace, name, e.getMessage());
            writeStatus(namespace, name, notSynced(REASON_VALIDATION_FAILED, e.getMessage()), null);
            return result(namespace, name, ReconcileOutcome.INVALID, e.getMessage(), null);
        }

        HibernationState state;
        try {
            state = hibernation.evaluate(claim);
        } catch (K8sApiException e) {
            log.warn("Hibernation evaluation failed for {}/{}: {}", namespace, name, e.getMessage());
            state = null;
        }
        if (state == HibernationState.COLD || state == HibernationState.RECLAIMING) {
            return result(namespace, name, ReconcileOutcome.DELETED, "Claim expired and was reclaimed", state);
        }

        CompositeResourceSet resources;
        try {
            resources = composer.compose(claim);
        } catch (CompositionException e) {
            log.warn("Composition refused for {}/{}: {}", namespace, name, e.getMessage());
            writeStatus(namespace, name, notSynced(REASON_COMPOSITION_FAILED, e.getMessage()), state);
            return result(namespace, name, ReconcileOutcome.INVALID, e.getMessage(), state);
        }

        try {
            applyAll(resources);
        } catch (K8sApiException e) {
            log.error("Failed to apply resources for {}/{} after retries: {}", namespace, name, e.getMessage());
            writeStatus(namespace, name, notSynced(REASON_APPLY_FAILED, e.getMessage()), state);
            return result(namespace, name, ReconcileOutcome.FAILED, e.getMessage(), state);
        }

        List<String> blockers = readinessService.findBlockers(resources);
        boolean ready = blockers.isEmpty();
        String readyMessage = ready ? "All derived resources are ready" : String.join("; ", blockers);

        List<SandboxCondition> conditions = List.of(
            condition(SandboxCondition.SYNCED, true, REASON_APPLIED, "Derived resources applied"),
            condition(SandboxCondition.READY, ready, ready ? REASON_READY : REASON_WAITING, readyMessage));
        writeStatus(namespace, name, conditions, state);

        ReconcileOutcome outcome = ready ? ReconcileOutcome.SYNCED_READY : ReconcileOutcome.SYNCED_PENDING;
        log.info("Reconciled {}/{}: {} (hibernation={})", namespace, name, outcome, state);
        return result(namespace, name, outcome, readyMessage, state);
    }

    private void applyAll(CompositeResourceSet resources) {
        for (HasMetadata resource : resources.inApplyOrder()) {
            HasMetadata toApply = resource;
            if (resource == resources.getWarmPool()
                && clusterService.findWarmPool(resources.getNamespace(), resources.getClaimName()).isPresent()) {
                toApply = withoutReplicas(resources.getWarmPool());
            }

            HasMetadata target = toApply;
            String operation = String.format("apply-%s-%s/%s", resource.getKind(),
                resources.getNamespace(), resource.getMetadata().getName());
            retryPolicy.withBackoff(operation, () -> clusterService.apply(target));
        }
    }

    /**
     * 기존 풀의 레플리카 수는 오토스케일러/하이버네이션이 소유하므로 적용 대상에서 제외
     */
    static GenericKubernetesResource withoutReplicas(GenericKubernetesResource pool) {
        GenericKubernetesResource copy = new GenericKubernetesResource();
        copy.setApiVersion(pool.getApiVersion());
        copy.setKind(pool.getKind());
        copy.setMetadata(pool.getMetadata());
        Map<String, Object> spec = SandboxClusterService.specOf(pool);
        spec.remove("replicas");
        copy.setAdditionalProperty("spec", spec);
        return copy;
    }

    // ========== Status ==========

    private void writeStatus(String namespace, String name, List<SandboxCondition> conditions, HibernationState state) {
        retryPolicy.onConflict("status-" + namespace + "/" + name, () -> {
            AgentSandboxService latest = clusterService.findClaim(namespace, name)
                .orElseThrow(() -> new K8sResourceNotFoundException(
                    String.format("Claim not found: %s/%s", namespace, name)));

            AgentSandboxStatus current = latest.getStatus();
            AgentSandboxStatus desired = desiredStatus(current, conditions, latest.getMetadata().getGeneration(), state);
            if (sameStatus(current, desired)) {
                log.debug("Status of {}/{} unchanged", namespace, name);
                return latest;
            }

            latest.setStatus(desired);
            return clusterService.updateClaimStatus(latest);
        });
    }

    private AgentSandboxStatus desiredStatus(AgentSandboxStatus current, List<SandboxCondition> conditions,
                                             Long generation, HibernationState state) {
        List<SandboxCondition> merged = new ArrayList<>();
        for (SandboxCondition next : conditions) {
            Optional<SandboxCondition> previous = current != null ? current.condition(next.getType()) : Optional.empty();
            // 상태가 그대로면 전이 시각 유지
            if (previous.isPresent() && previous.get().sameState(next)) {
                next.setLastTransitionTime(previous.get().getLastTransitionTime());
            }
            merged.add(next);
        }

        String hibernationState = state != null
            ? state.getDisplayName()
            : current != null ? current.getHibernationState() : null;

        return AgentSandboxStatus.builder()
            .conditions(merged)
            .observedGeneration(generation)
            .hibernationState(hibernationState)
            .build();
    }

    private static boolean sameStatus(AgentSandboxStatus current, AgentSandboxStatus desired) {
        if (current == null || current.getConditions() == null) {
            return false;
        }
        if (!Objects.equals(current.getObservedGeneration(), desired.getObservedGeneration())
            || !Objects.equals(current.getHibernationState(), desired.getHibernationState())
            || current.getConditions().size() != desired.getConditions().size()) {
            return false;
        }
        return desired.getConditions().stream()
            .allMatch(c -> current.condition(c.getType()).map(c::sameState).orElse(false));
    }

    private List<SandboxCondition> notSynced(String reason, String message) {
        return List.of(
            condition(SandboxCondition.SYNCED, false, reason, message),
            condition(SandboxCondition.READY, false, REASON_NOT_SYNCED, "Resources are not synced"));
    }

    private SandboxCondition condition(String type, boolean status, String reason, String message) {
        return SandboxCondition.builder()
            .type(type)
            .status(status ? SandboxCondition.TRUE : SandboxCondition.FALSE)
            .reason(reason)
            .message(message)
            .lastTransitionTime(clock.instant().toString())
            .build();
    }

    /**
     * 삭제된 클레임의 락을 정리 (사용 중이거나 대기자가 있으면 유지)
     */
    public void forget(String namespace, String name) {
        locks.computeIfPresent(namespace + "/" + name,
            (key, lock) -> lock.isLocked() || lock.hasQueuedThreads() ? lock : null);
    }

    int trackedClaims() {
        return locks.size();
    }

    /**
     * 클레임별 락 획득. 획득 사이에 forget 으로 맵에서 빠진 락이면 다시 시도한다.
     */
    private ReentrantLock acquire(String namespace, String name) {
        String key = namespace + "/" + name;
        while (true) {
            ReentrantLock lock = locks.computeIfAbsent(key, k -> new ReentrantLock());
            lock.lock();
            if (locks.get(key) == lock) {
                return lock;
            }
            lock.unlock();
        }
    }

    private ReconcileResult result(String namespace, String name, ReconcileOutcome outcome, String message,
                                   HibernationState state) {
        return ReconcileResult.builder()
            .namespace(namespace)
            .name(name)
            .outcome(outcome)
            .message(message)
            .hibernationState(state)
            .build();
    }
}
