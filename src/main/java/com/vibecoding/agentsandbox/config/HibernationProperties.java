package com.vibecoding.agentsandbox.config;

import jakarta.annotation.PostConstruct;
import lombok.Data;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * 하이버네이션 TTL 설정
 */
@Configuration
@ConfigurationProperties(prefix = "sandbox.hibernation")
@Data
public class HibernationProperties {

    private static final Logger log = LoggerFactory.getLogger(HibernationProperties.class);

    private Boolean enabled = true;
    private Duration softTtl = Duration.ofMinutes(30);      // Active -> Warm
    private Duration hardTtl = Duration.ofHours(24);        // Warm -> Cold
    private Duration sweepInterval = Duration.ofMinutes(1);
    private Duration coldTimeout = Duration.ofMinutes(5);   // Cold 수렴 대기 한도
    private Duration coldPollInterval = Duration.ofSeconds(2);
    private Duration coldMaxPollInterval = Duration.ofSeconds(15);

    @PostConstruct
    public void validateConfig() {
        if (softTtl == null || hardTtl == null || softTtl.isNegative() || softTtl.isZero()) {
            throw new IllegalStateException("sandbox.hibernation.soft-ttl and hard-ttl must be positive");
        }
        if (hardTtl.compareTo(softTtl) <= 0) {
            throw new IllegalStateException(String.format(
                "sandbox.hibernation.hard-ttl (%s) must be greater than soft-ttl (%s)", hardTtl, softTtl));
        }
        if (coldTimeout == null || coldTimeout.isNegative()) {
            throw new IllegalStateException("sandbox.hibernation.cold-timeout must not be negative");
        }

        log.info("Hibernation policy: enabled={}, softTtl={}, hardTtl={}, coldTimeout={}",
            enabled, softTtl, hardTtl, coldTimeout);
    }
}
