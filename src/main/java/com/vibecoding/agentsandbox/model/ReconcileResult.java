package com.vibecoding.agentsandbox.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReconcileResult {
    private String namespace;
    private String name;
    private ReconcileOutcome outcome;
    private String message;
    private HibernationState hibernationState;  // DELETED/INVALID 에서는 null 가능
}
