package com.vibecoding.agentsandbox.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * 컨트롤러 역할에서만 등록되는 빈 (기본 역할)
 */
@Target({ElementType.TYPE, ElementType.METHOD})
@Retention(RetentionPolicy.RUNTIME)
@Documented
@ConditionalOnProperty(name = SandboxRoles.PROPERTY, havingValue = SandboxRoles.CONTROLLER, matchIfMissing = true)
public @interface ControllerRole {
}
