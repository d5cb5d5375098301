package com.vibecoding.agentsandbox.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * 샌드박스 Pod 내부(hydrate, backup-sidecar)에서만 등록되는 빈
 */
@Target({ElementType.TYPE, ElementType.METHOD})
@Retention(RetentionPolicy.RUNTIME)
@Documented
@ConditionalOnExpression("'${sandbox.role:controller}' != 'controller'")
public @interface WorkspaceAgentRole {
}
