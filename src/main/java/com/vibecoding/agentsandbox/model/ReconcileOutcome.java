package com.vibecoding.agentsandbox.model;

/**
 * 리컨실 결과
 */
public enum ReconcileOutcome {
    SYNCED_READY,
    SYNCED_PENDING,
    INVALID,
    FAILED,
    DELETED
}
