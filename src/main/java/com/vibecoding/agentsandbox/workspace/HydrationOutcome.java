package com.vibecoding.agentsandbox.workspace;

public enum HydrationOutcome {
    FIRST_RUN,      // 백업 오브젝트 없음, 볼륨 그대로 사용
    RESTORED
}
