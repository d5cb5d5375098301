package com.vibecoding.agentsandbox.service;

import com.vibecoding.agentsandbox.SandboxFixtures;
import com.vibecoding.agentsandbox.config.SandboxControllerProperties;
import com.vibecoding.agentsandbox.exception.K8sApiException;
import com.vibecoding.agentsandbox.exception.K8sResourceNotFoundException;
import com.vibecoding.agentsandbox.exception.ReconcileTimeoutException;
import com.vibecoding.agentsandbox.model.AgentSandboxService;
import com.vibecoding.agentsandbox.model.AgentSandboxStatus;
import com.vibecoding.agentsandbox.model.HibernationState;
import com.vibecoding.agentsandbox.model.ReconcileOutcome;
import com.vibecoding.agentsandbox.model.ReconcileResult;
import com.vibecoding.agentsandbox.model.SandboxCondition;
import com.vibecoding.agentsandbox.readiness.ReadinessService;
import com.vibecoding.agentsandbox.support.ApiRetryPolicy;
import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.api.model.HasMetadata;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class ClaimReconcilerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private SandboxClusterService clusterService;
    private ReadinessService readinessService;
    private HibernationStateMachine hibernation;
    private ClaimReconciler reconciler;

    @BeforeEach
    void setUp() {
        clusterService = mock(SandboxClusterService.class);
        readinessService = mock(ReadinessService.class);
        hibernation = mock(HibernationStateMachine.class);

        SandboxControllerProperties properties = SandboxFixtures.controllerProperties();
        reconciler = new ClaimReconciler(clusterService,
            new ClaimValidator(properties),
            SandboxFixtures.composer(properties),
            readinessService,
            hibernation,
            new ApiRetryPolicy(properties),
            properties,
            Clock.fixed(NOW, ZoneOffset.UTC));

        when(clusterService.apply(any())).thenAnswer(invocation -> invocation.getArgument(0));
        when(clusterService.updateClaimStatus(any())).thenAnswer(invocation -> invocation.getArgument(0));
        when(clusterService.findWarmPool(anyString(), anyString())).thenReturn(Optional.empty());
        when(hibernation.evaluate(any())).thenReturn(HibernationState.ACTIVE);
        when(readinessService.findBlockers(any())).thenReturn(List.of());
    }

    private AgentSandboxService givenClaim(AgentSandboxService claim) {
        when(clusterService.findClaim("team-a", claim.getMetadata().getName())).thenReturn(Optional.of(claim));
        return claim;
    }

    private AgentSandboxStatus capturedStatus() {
        ArgumentCaptor<AgentSandboxService> captor = ArgumentCaptor.forClass(AgentSandboxService.class);
        verify(clusterService, atLeastOnce()).updateClaimStatus(captor.capture());
        return captor.getValue().getStatus();
    }

    @Test
    @DisplayName("valid claim is applied in order and reported Synced and Ready")
    void syncedAndReady() {
        givenClaim(SandboxFixtures.claim("acme", SandboxFixtures.minimalSpec().build()));

        ReconcileResult result = reconciler.reconcile("team-a", "acme");

        assertEquals(ReconcileOutcome.SYNCED_READY, result.getOutcome());
        assertEquals(HibernationState.ACTIVE, result.getHibernationState());

        ArgumentCaptor<HasMetadata> applied = ArgumentCaptor.forClass(HasMetadata.class);
        verify(clusterService, times(6)).apply(applied.capture());
        assertEquals(List.of("ServiceAccount", "Secret", "PersistentVolumeClaim", "SandboxTemplate",
                "SandboxWarmPool", "ScaledObject"),
            applied.getAllValues().stream().map(HasMetadata::getKind).collect(Collectors.toList()));

        AgentSandboxStatus status = capturedStatus();
        assertTrue(status.isTrue(SandboxCondition.SYNCED));
        assertTrue(status.isTrue(SandboxCondition.READY));
        assertEquals(1L, status.getObservedGeneration());
        assertEquals("Active", status.getHibernationState());
    }

    @Test
    @DisplayName("existing warm pool is applied without replicas")
    void existingPoolKeepsReplicas() {
        givenClaim(SandboxFixtures.claim("acme", SandboxFixtures.minimalSpec().build()));
        when(clusterService.findWarmPool("team-a", "acme")).thenReturn(Optional.of(new GenericKubernetesResource()));

        reconciler.reconcile("team-a", "acme");

        ArgumentCaptor<HasMetadata> applied = ArgumentCaptor.forClass(HasMetadata.class);
        verify(clusterService, atLeastOnce()).apply(applied.capture());
        GenericKubernetesResource pool = (GenericKubernetesResource) applied.getAllValues().stream()
            .filter(r -> "SandboxWarmPool".equals(r.getKind()))
            .findFirst()
            .orElseThrow();
        Map<String, Object> spec = SandboxClusterService.specOf(pool);
        assertFalse(spec.containsKey("replicas"));
        assertEquals(Map.of("name", "acme"), spec.get("sandboxTemplateRef"));
    }

    @Test
    @DisplayName("pending readiness is reported Synced but not Ready")
    void syncedPending() {
        givenClaim(SandboxFixtures.claim("acme", SandboxFixtures.minimalSpec().build()));
        when(readinessService.findBlockers(any())).thenReturn(List.of("PVC acme-workspace is Pending"));

        ReconcileResult result = reconciler.reconcile("team-a", "acme");

        assertEquals(ReconcileOutcome.SYNCED_PENDING, result.getOutcome());
        AgentSandboxStatus status = capturedStatus();
        assertTrue(status.isTrue(SandboxCondition.SYNCED));
        SandboxCondition ready = status.condition(SandboxCondition.READY).orElseThrow();
        assertFalse(ready.isTrue());
        assertEquals(ClaimReconciler.REASON_WAITING, ready.getReason());
        assertEquals("PVC acme-workspace is Pending", ready.getMessage());
    }

    @Test
    @DisplayName("invalid claim is not applied and reports ValidationFailed")
    void invalidClaim() {
        givenClaim(SandboxFixtures.claim("acme", SandboxFixtures.minimalSpec().image(null).build()));

        ReconcileResult result = reconciler.reconcile("team-a", "acme");

        assertEquals(ReconcileOutcome.INVALID, result.getOutcome());
        verify(clusterService, never()).apply(any());
        SandboxCondition synced = capturedStatus().condition(SandboxCondition.SYNCED).orElseThrow();
        assertFalse(synced.isTrue());
        assertEquals(ClaimReconciler.REASON_VALIDATION_FAILED, synced.getReason());
        assertTrue(synced.getMessage().contains("image is required"));
    }

    @Test
    @DisplayName("retryable apply errors are retried then surface as ApplyFailed")
    void retryableApplyFailure() {
        givenClaim(SandboxFixtures.claim("acme", SandboxFixtures.minimalSpec().build()));
        when(clusterService.apply(any())).thenThrow(new K8sApiException("apiserver unavailable", 503, null));

        ReconcileResult result = reconciler.reconcile("team-a", "acme");

        assertEquals(ReconcileOutcome.FAILED, result.getOutcome());
        verify(clusterService, times(3)).apply(any());
        SandboxCondition synced = capturedStatus().condition(SandboxCondition.SYNCED).orElseThrow();
        assertEquals(ClaimReconciler.REASON_APPLY_FAILED, synced.getReason());
        assertTrue(synced.getMessage().contains("apiserver unavailable"));
    }

    @Test
    @DisplayName("non-retryable apply errors fail on the first attempt")
    void nonRetryableApplyFailure() {
        givenClaim(SandboxFixtures.claim("acme", SandboxFixtures.minimalSpec().build()));
        when(clusterService.apply(any())).thenThrow(new K8sApiException("field is immutable", 422, null));

        assertEquals(ReconcileOutcome.FAILED, reconciler.reconcile("team-a", "acme").getOutcome());
        verify(clusterService, times(1)).apply(any());
    }

    @Test
    @DisplayName("missing claim ends quietly as DELETED")
    void missingClaim() {
        when(clusterService.findClaim("team-a", "ghost")).thenReturn(Optional.empty());

        assertEquals(ReconcileOutcome.DELETED, reconciler.reconcile("team-a", "ghost").getOutcome());
        verify(clusterService, never()).apply(any());
    }

    @Test
    @DisplayName("claim deleted before the status write ends as DELETED")
    void claimDeletedDuringReconcile() {
        givenClaim(SandboxFixtures.claim("acme", SandboxFixtures.minimalSpec().build()));
        when(clusterService.updateClaimStatus(any())).thenThrow(new K8sResourceNotFoundException("gone"));

        assertEquals(ReconcileOutcome.DELETED, reconciler.reconcile("team-a", "acme").getOutcome());
    }

    @Test
    @DisplayName("hard-expired claim is not re-applied")
    void expiredClaim() {
        givenClaim(SandboxFixtures.claim("acme", SandboxFixtures.minimalSpec().build()));
        when(hibernation.evaluate(any())).thenReturn(HibernationState.COLD);

        ReconcileResult result = reconciler.reconcile("team-a", "acme");

        assertEquals(ReconcileOutcome.DELETED, result.getOutcome());
        verify(clusterService, never()).apply(any());
    }

    @Test
    @DisplayName("unchanged status is not written again")
    void statusWrittenOnlyOnChange() {
        givenClaim(SandboxFixtures.claim("acme", SandboxFixtures.minimalSpec().build()));

        reconciler.reconcile("team-a", "acme");
        reconciler.reconcile("team-a", "acme");

        verify(clusterService, times(1)).updateClaimStatus(any());
    }

    @Test
    @DisplayName("status conflict is retried against a fresh read")
    void statusConflictRetried() {
        when(clusterService.findClaim("team-a", "acme"))
            .thenAnswer(invocation -> Optional.of(SandboxFixtures.claim("acme", SandboxFixtures.minimalSpec().build())));
        when(clusterService.updateClaimStatus(any()))
            .thenThrow(new K8sApiException("conflict", 409, null))
            .thenAnswer(invocation -> invocation.getArgument(0));

        assertEquals(ReconcileOutcome.SYNCED_READY, reconciler.reconcile("team-a", "acme").getOutcome());
        verify(clusterService, times(2)).updateClaimStatus(any());
    }

    @Test
    @DisplayName("awaitReady returns once Ready is true")
    void awaitReady() {
        AgentSandboxService claim = givenClaim(SandboxFixtures.claim("acme", SandboxFixtures.minimalSpec().build()));
        claim.setStatus(AgentSandboxStatus.builder()
            .conditions(List.of(SandboxCondition.builder().type(SandboxCondition.READY).status(SandboxCondition.TRUE).build()))
            .build());

        assertSame(claim, reconciler.awaitReady("team-a", "acme", Duration.ofSeconds(1)));
    }

    @Test
    @DisplayName("awaitReady times out when Ready never becomes true")
    void awaitReadyTimeout() {
        givenClaim(SandboxFixtures.claim("acme", SandboxFixtures.minimalSpec().build()));

        assertThrows(ReconcileTimeoutException.class,
            () -> reconciler.awaitReady("team-a", "acme", Duration.ofMillis(50)));
    }

    @Test
    @DisplayName("sweep skips claims that are being deleted")
    void sweepSkipsDeleting() {
        AgentSandboxService claim = givenClaim(SandboxFixtures.claim("acme", SandboxFixtures.minimalSpec().build()));
        claim.getMetadata().setDeletionTimestamp(NOW.toString());

        assertTrue(reconciler.sweepExpiry("team-a", "acme").isEmpty());
        verify(hibernation, never()).evaluate(any());
    }

    @Test
    @DisplayName("reconciles of the same claim run one at a time")
    void sameClaimSerialized() throws Exception {
        givenClaim(SandboxFixtures.claim("acme", SandboxFixtures.minimalSpec().build()));
        CountDownLatch firstEntered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger findCalls = new AtomicInteger();
        when(clusterService.findClaim("team-a", "acme")).thenAnswer(invocation -> {
            findCalls.incrementAndGet();
            return Optional.of(SandboxFixtures.claim("acme", SandboxFixtures.minimalSpec().build()));
        });
        when(clusterService.apply(any())).thenAnswer(invocation -> {
            firstEntered.countDown();
            assertTrue(release.await(5, TimeUnit.SECONDS));
            return invocation.getArgument(0);
        });

        CompletableFuture<ReconcileResult> first = CompletableFuture.supplyAsync(() -> reconciler.reconcile("team-a", "acme"));
        assertTrue(firstEntered.await(5, TimeUnit.SECONDS));
        int findsWhileHeld = findCalls.get();

        CompletableFuture<ReconcileResult> second = CompletableFuture.supplyAsync(() -> reconciler.reconcile("team-a", "acme"));
        Thread.sleep(100);
        assertFalse(second.isDone());
        assertEquals(findsWhileHeld, findCalls.get());

        release.countDown();
        assertEquals(ReconcileOutcome.SYNCED_READY, first.get(5, TimeUnit.SECONDS).getOutcome());
        assertEquals(ReconcileOutcome.SYNCED_READY, second.get(5, TimeUnit.SECONDS).getOutcome());
        assertTrue(findCalls.get() > findsWhileHeld);
    }

    @Test
    @DisplayName("reconciles of different claims run in parallel")
    void differentClaimsParallel() throws Exception {
        givenClaim(SandboxFixtures.claim("acme", SandboxFixtures.minimalSpec().build()));
        givenClaim(SandboxFixtures.claim("beta", SandboxFixtures.minimalSpec().build()));
        CountDownLatch bothEntered = new CountDownLatch(2);
        when(clusterService.apply(any())).thenAnswer(invocation -> {
            bothEntered.countDown();
            if (!bothEntered.await(5, TimeUnit.SECONDS)) {
                throw new IllegalStateException("other claim never entered apply");
            }
            return invocation.getArgument(0);
        });

        CompletableFuture<ReconcileResult> acme = CompletableFuture.supplyAsync(() -> reconciler.reconcile("team-a", "acme"));
        CompletableFuture<ReconcileResult> beta = CompletableFuture.supplyAsync(() -> reconciler.reconcile("team-a", "beta"));

        assertTrue(bothEntered.await(5, TimeUnit.SECONDS));
        assertEquals(ReconcileOutcome.SYNCED_READY, acme.get(10, TimeUnit.SECONDS).getOutcome());
        assertEquals(ReconcileOutcome.SYNCED_READY, beta.get(10, TimeUnit.SECONDS).getOutcome());
    }

    @Test
    @DisplayName("forgetting a deleted claim drops its lock")
    void forgetDropsLock() {
        givenClaim(SandboxFixtures.claim("acme", SandboxFixtures.minimalSpec().build()));
        reconciler.reconcile("team-a", "acme");
        assertEquals(1, reconciler.trackedClaims());

        reconciler.forget("team-a", "acme");

        assertEquals(0, reconciler.trackedClaims());
        assertEquals(ReconcileOutcome.SYNCED_READY, reconciler.reconcile("team-a", "acme").getOutcome());
    }

    @Test
    @DisplayName("forget keeps a lock that is still held")
    void forgetKeepsHeldLock() throws Exception {
        givenClaim(SandboxFixtures.claim("acme", SandboxFixtures.minimalSpec().build()));
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(clusterService.apply(any())).thenAnswer(invocation -> {
            entered.countDown();
            assertTrue(release.await(5, TimeUnit.SECONDS));
            return invocation.getArgument(0);
        });

        CompletableFuture<ReconcileResult> running = CompletableFuture.supplyAsync(() -> reconciler.reconcile("team-a", "acme"));
        assertTrue(entered.await(5, TimeUnit.SECONDS));
        reconciler.forget("team-a", "acme");
        assertEquals(1, reconciler.trackedClaims());

        release.countDown();
        running.get(5, TimeUnit.SECONDS);
    }
}
