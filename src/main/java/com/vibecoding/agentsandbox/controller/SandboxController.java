package com.vibecoding.agentsandbox.controller;

import com.vibecoding.agentsandbox.config.ControllerRole;
import com.vibecoding.agentsandbox.model.AgentSandboxService;
import com.vibecoding.agentsandbox.model.HibernationStatusView;
import com.vibecoding.agentsandbox.model.HibernationTransitionRecord;
import com.vibecoding.agentsandbox.model.ReconcileResult;
import com.vibecoding.agentsandbox.repository.TransitionLedger;
import com.vibecoding.agentsandbox.service.ClaimReconciler;
import com.vibecoding.agentsandbox.service.HibernationStateMachine;
import com.vibecoding.agentsandbox.service.SandboxClusterService;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 샌드박스 REST API (게이트웨이용)
 */
@RestController
@RequestMapping("/api/sandboxes/{namespace}/{name}")
@ControllerRole
@RequiredArgsConstructor
public class SandboxController {

    private static final Logger log = LoggerFactory.getLogger(SandboxController.class);

    private final SandboxClusterService clusterService;
    private final ClaimReconciler reconciler;
    private final HibernationStateMachine hibernation;
    private final TransitionLedger ledger;
    private final Clock clock;

    /**
     * 하트비트 기록
     */
    @PostMapping("/heartbeat")
    public ResponseEntity<Map<String, Object>> heartbeat(@PathVariable String namespace, @PathVariable String name) {
        Instant now = clock.instant();
        AgentSandboxService claim = clusterService.stampHeartbeat(namespace, name, now);
        log.debug("Heartbeat for {}/{}", namespace, name);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("namespace", namespace);
        body.put("name", name);
        body.put("lastActive", claim.getMetadata().getAnnotations().get(AgentSandboxService.LAST_ACTIVE_ANNOTATION));
        return ResponseEntity.ok(body);
    }

    /**
     * 파생 하이버네이션 상태 조회
     */
    @GetMapping("/state")
    public ResponseEntity<HibernationStatusView> state(@PathVariable String namespace, @PathVariable String name) {
        return ResponseEntity.ok(hibernation.status(namespace, name));
    }

    /**
     * 즉시 리컨실
     */
    @PostMapping("/reconcile")
    public ResponseEntity<ReconcileResult> reconcile(@PathVariable String namespace, @PathVariable String name) {
        log.info("Manual reconcile requested for {}/{}", namespace, name);
        return ResponseEntity.ok(reconciler.reconcile(namespace, name));
    }

    /**
     * 전이 이력 (최신순)
     */
    @GetMapping("/transitions")
    public ResponseEntity<List<HibernationTransitionRecord>> transitions(@PathVariable String namespace,
                                                                         @PathVariable String name) {
        return ResponseEntity.ok(ledger.history(namespace, name));
    }
}
