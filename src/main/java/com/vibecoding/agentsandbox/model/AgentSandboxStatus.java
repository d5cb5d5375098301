package com.vibecoding.agentsandbox.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 클레임 status (플랫폼만 갱신)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentSandboxStatus {
    @Builder.Default
    private List<SandboxCondition> conditions = new ArrayList<>();
    private Long observedGeneration;
    private String hibernationState;    // 참고용 미러, 입력으로 읽지 않음

    public Optional<SandboxCondition> condition(String type) {
        if (conditions == null) {
            return Optional.empty();
        }
        return conditions.stream()
            .filter(c -> type.equals(c.getType()))
            .findFirst();
    }

    public boolean isTrue(String type) {
        return condition(type).map(SandboxCondition::isTrue).orElse(false);
    }
}
