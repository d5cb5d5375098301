package com.vibecoding.agentsandbox.model;

public enum TransitionOutcome {
    APPLIED,
    NOOP,
    STUCK,
    FAILED
}
