package com.vibecoding.agentsandbox.workspace;

import com.vibecoding.agentsandbox.config.SandboxRoles;
import com.vibecoding.agentsandbox.config.WorkspaceProperties;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * hydrate 역할의 진입점 (init 컨테이너)
 * 예외는 그대로 전파되어 컨테이너가 non-zero 로 종료된다.
 */
@Component
@ConditionalOnProperty(name = SandboxRoles.PROPERTY, havingValue = SandboxRoles.HYDRATE)
@RequiredArgsConstructor
public class HydrationRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(HydrationRunner.class);

    private final WorkspaceHydrator hydrator;
    private final WorkspaceProperties properties;

    @Override
    public void run(String... args) {
        String claimName = properties.requireClaimName();
        HydrationOutcome outcome = hydrator.hydrate(claimName);
        log.info("Hydration finished for {}: {}", claimName, outcome);
    }
}
