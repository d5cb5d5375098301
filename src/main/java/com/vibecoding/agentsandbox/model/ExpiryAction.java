package com.vibecoding.agentsandbox.model;

/**
 * 하트비트 나이에 따른 만료 판정
 */
public enum ExpiryAction {
    NONE,
    SOFT_EXPIRE,    // Active -> Warm
    HARD_EXPIRE     // Warm -> Cold
}
