package com.vibecoding.agentsandbox.model;

import io.fabric8.kubernetes.api.model.Quantity;
import io.fabric8.kubernetes.api.model.ResourceRequirements;
import io.fabric8.kubernetes.api.model.ResourceRequirementsBuilder;

import java.util.Arrays;
import java.util.Optional;

/**
 * 사이즈 클래스별 CPU/메모리 요청 및 제한
 */
public enum SizeClass {
    MICRO("micro", "100m", "256Mi", "500m", "1Gi"),
    SMALL("small", "250m", "512Mi", "1000m", "2Gi"),
    MEDIUM("medium", "500m", "1Gi", "2000m", "4Gi"),
    LARGE("large", "1000m", "2Gi", "4000m", "8Gi");

    public static final SizeClass DEFAULT = MICRO;

    private final String value;
    private final String cpuRequest;
    private final String memoryRequest;
    private final String cpuLimit;
    private final String memoryLimit;

    SizeClass(String value, String cpuRequest, String memoryRequest, String cpuLimit, String memoryLimit) {
        this.value = value;
        this.cpuRequest = cpuRequest;
        this.memoryRequest = memoryRequest;
        this.cpuLimit = cpuLimit;
        this.memoryLimit = memoryLimit;
    }

    /**
     * 클레임의 size 값으로 조회 (null/빈 값은 기본값)
     */
    public static Optional<SizeClass> fromValue(String value) {
        if (value == null || value.isBlank()) {
            return Optional.of(DEFAULT);
        }
        return Arrays.stream(values())
            .filter(size -> size.value.equals(value))
            .findFirst();
    }

    public ResourceRequirements toResourceRequirements() {
        return new ResourceRequirementsBuilder()
            .addToRequests("cpu", new Quantity(cpuRequest))
            .addToRequests("memory", new Quantity(memoryRequest))
            .addToLimits("cpu", new Quantity(cpuLimit))
            .addToLimits("memory", new Quantity(memoryLimit))
            .build();
    }

    public String getValue() {
        return value;
    }

    public String getCpuRequest() {
        return cpuRequest;
    }

    public String getMemoryRequest() {
        return memoryRequest;
    }

    public String getCpuLimit() {
        return cpuLimit;
    }

    public String getMemoryLimit() {
        return memoryLimit;
    }
}
