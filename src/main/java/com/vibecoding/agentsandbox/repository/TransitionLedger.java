package com.vibecoding.agentsandbox.repository;

import com.vibecoding.agentsandbox.model.HibernationState;
import com.vibecoding.agentsandbox.model.HibernationTransitionRecord;
import com.vibecoding.agentsandbox.model.TransitionOutcome;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.util.List;

/**
 * 하이버네이션 전이 원장
 * - 전이 자체는 클러스터 상태로부터 계산되며, 이 원장은 감사 기록 용도로만 사용
 * - 기록 실패는 전이 결과에 영향을 주지 않는다
 */
@Repository
@RequiredArgsConstructor
public class TransitionLedger {

    private static final Logger log = LoggerFactory.getLogger(TransitionLedger.class);

    private final HibernationTransitionRepository transitionRepository;
    private final Clock clock;

    /**
     * 전이 기록
     */
    public void record(String namespace, String claimName, HibernationState from, HibernationState to,
                       TransitionOutcome outcome, String detail) {
        HibernationTransitionRecord record = HibernationTransitionRecord.builder()
            .namespace(namespace)
            .claimName(claimName)
            .fromState(from)
            .toState(to)
            .outcome(outcome)
            .detail(truncate(detail))
            .occurredAt(clock.instant())
            .build();

        try {
            transitionRepository.save(record);
            log.debug("Recorded transition {}/{}: {} -> {} ({})", namespace, claimName, from, to, outcome);
        } catch (RuntimeException e) {
            log.warn("Failed to record transition {}/{}: {} -> {} ({}): {}",
                namespace, claimName, from, to, outcome, e.getMessage());
        }
    }

    /**
     * 클레임의 전이 이력 (최신순)
     */
    public List<HibernationTransitionRecord> history(String namespace, String claimName) {
        return transitionRepository.findByNamespaceAndClaimNameOrderByOccurredAtDesc(namespace, claimName);
    }

    private String truncate(String detail) {
        if (detail == null || detail.length() <= 2000) {
            return detail;
        }
        return detail.substring(0, 1997) + "...";
    }
}
