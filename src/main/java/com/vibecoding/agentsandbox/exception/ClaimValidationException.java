package com.vibecoding.agentsandbox.exception;

import java.util.List;

/**
 * 클레임 필드 검증 실패 (재시도하지 않음)
 */
public class ClaimValidationException extends RuntimeException {

    private final List<String> violations;

    public ClaimValidationException(String claimKey, List<String> violations) {
        super("Invalid claim " + claimKey + ": " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
