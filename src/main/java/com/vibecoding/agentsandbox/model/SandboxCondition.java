package com.vibecoding.agentsandbox.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 상태 조건 (Synced, Ready)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SandboxCondition {
    public static final String SYNCED = "Synced";
    public static final String READY = "Ready";

    public static final String TRUE = "True";
    public static final String FALSE = "False";

    private String type;
    private String status;              // True, False
    private String reason;
    private String message;
    private String lastTransitionTime;  // ISO-8601

    @JsonIgnore
    public boolean isTrue() {
        return TRUE.equals(status);
    }

    /**
     * 시각을 제외한 내용이 같은지 비교
     */
    public boolean sameState(SandboxCondition other) {
        return other != null
            && java.util.Objects.equals(type, other.type)
            && java.util.Objects.equals(status, other.status)
            && java.util.Objects.equals(reason, other.reason)
            && java.util.Objects.equals(message, other.message);
    }
}
