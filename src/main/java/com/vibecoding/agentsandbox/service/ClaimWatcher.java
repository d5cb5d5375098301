package com.vibecoding.agentsandbox.service;

import com.vibecoding.agentsandbox.config.ControllerRole;
import com.vibecoding.agentsandbox.config.SandboxControllerProperties;
import com.vibecoding.agentsandbox.model.AgentSandboxService;
import com.vibecoding.agentsandbox.model.ReconcileResult;
import io.fabric8.kubernetes.client.informers.ResourceEventHandler;
import io.fabric8.kubernetes.client.informers.SharedIndexInformer;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 클레임 informer
 *
 * 추가/변경 이벤트와 주기적 resync 마다 리컨실을 워커 풀에 넣는다.
 * 같은 클레임이 이미 대기 중이면 다시 넣지 않는다.
 */
@Component
@ControllerRole
@RequiredArgsConstructor
public class ClaimWatcher implements ResourceEventHandler<AgentSandboxService> {

    private static final Logger log = LoggerFactory.getLogger(ClaimWatcher.class);

    private final SandboxClusterService clusterService;
    private final ClaimReconciler reconciler;
    private final SandboxControllerProperties properties;

    private final Set<String> pending = ConcurrentHashMap.newKeySet();
    private ExecutorService workers;
    private SharedIndexInformer<AgentSandboxService> informer;

    @PostConstruct
    public void start() {
        if (!Boolean.TRUE.equals(properties.getWatchEnabled())) {
            log.info("Claim watch disabled (sandbox.controller.watch-enabled=false)");
            return;
        }

        AtomicInteger threadCount = new AtomicInteger();
        workers = Executors.newFixedThreadPool(properties.getReconcileWorkers(), runnable -> {
            Thread thread = new Thread(runnable, "reconcile-worker-" + threadCount.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });

        informer = clusterService.informClaims(properties.getNamespace(), this,
            properties.getResyncPeriod().toMillis());
        log.info("Watching AgentSandboxService claims in {} with {} workers (resync {})",
            properties.isAllNamespaces() ? "all namespaces" : properties.getNamespace(),
            properties.getReconcileWorkers(), properties.getResyncPeriod());
    }

    @PreDestroy
    public void stop() {
        if (informer != null) {
            informer.close();
        }
        if (workers != null) {
            workers.shutdown();
            try {
                if (!workers.awaitTermination(10, TimeUnit.SECONDS)) {
                    workers.shutdownNow();
                }
            } catch (InterruptedException e) {
                workers.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        log.info("Claim watcher stopped");
    }

    @Override
    public void onAdd(AgentSandboxService claim) {
        enqueue(claim);
    }

    @Override
    public void onUpdate(AgentSandboxService oldClaim, AgentSandboxService newClaim) {
        if (requiresReconcile(oldClaim, newClaim)) {
            enqueue(newClaim);
        }
    }

    @Override
    public void onDelete(AgentSandboxService claim, boolean deletedFinalStateUnknown) {
        log.info("Claim {} deleted, owned resources are removed by cascade", claim.key());
        reconciler.forget(claim.getMetadata().getNamespace(), claim.getMetadata().getName());
    }

    /**
     * status/어노테이션만 바뀐 업데이트는 무시 (status 기록이 다시 리컨실을 부르지 않도록)
     * resync (같은 resourceVersion) 는 항상 리컨실
     */
    static boolean requiresReconcile(AgentSandboxService oldClaim, AgentSandboxService newClaim) {
        if (Objects.equals(oldClaim.getMetadata().getResourceVersion(), newClaim.getMetadata().getResourceVersion())) {
            return true;
        }
        if (newClaim.getMetadata().getDeletionTimestamp() != null) {
            return true;
        }
        return !Objects.equals(oldClaim.getMetadata().getGeneration(), newClaim.getMetadata().getGeneration());
    }

    void enqueue(AgentSandboxService claim) {
        String namespace = claim.getMetadata().getNamespace();
        String name = claim.getMetadata().getName();
        String key = claim.key();
        if (workers == null || !pending.add(key)) {
            return;
        }

        try {
            workers.submit(() -> {
                pending.remove(key);
                try {
                    ReconcileResult result = reconciler.reconcile(namespace, name);
                    log.debug("Reconcile of {} finished: {}", key, result.getOutcome());
                } catch (RuntimeException e) {
                    log.error("Reconcile of {} failed: {}", key, e.getMessage(), e);
                }
            });
        } catch (RejectedExecutionException e) {
            pending.remove(key);
            log.warn("Reconcile of {} rejected, worker pool is shutting down", key);
        }
    }
}
