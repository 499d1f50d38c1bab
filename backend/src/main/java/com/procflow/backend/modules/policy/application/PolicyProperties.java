package com.procflow.backend.modules.policy.application;

import java.util.List;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "procflow.policy")
public record PolicyProperties(Map<String, List<String>> roleOperations, List<String> superRoles) {

    public PolicyProperties {
        roleOperations = roleOperations != null ? Map.copyOf(roleOperations) : Map.of();
        superRoles = superRoles != null ? List.copyOf(superRoles) : List.of("ADMIN");
    }
}
