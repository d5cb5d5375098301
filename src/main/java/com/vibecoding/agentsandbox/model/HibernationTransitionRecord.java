package com.vibecoding.agentsandbox.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * 하이버네이션 전이 기록
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "hibernation_transition",
    indexes = @Index(name = "idx_transition_claim", columnList = "namespace, claimName"))
public class HibernationTransitionRecord {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String namespace;

    @Column(nullable = false)
    private String claimName;

    @Enumerated(EnumType.STRING)
    private HibernationState fromState;

    @Enumerated(EnumType.STRING)
    private HibernationState toState;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private TransitionOutcome outcome;

    @Column(length = 2000)
    private String detail;

    @Column(nullable = false)
    private Instant occurredAt;
}
