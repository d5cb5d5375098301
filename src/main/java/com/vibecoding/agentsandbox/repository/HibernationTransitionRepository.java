package com.vibecoding.agentsandbox.repository;

import com.vibecoding.agentsandbox.model.HibernationTransitionRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * 하이버네이션 전이 기록 저장소 (JPA)
 */
@Repository
public interface HibernationTransitionRepository extends JpaRepository<HibernationTransitionRecord, Long> {

    List<HibernationTransitionRecord> findByNamespaceAndClaimNameOrderByOccurredAtDesc(String namespace, String claimName);
}
