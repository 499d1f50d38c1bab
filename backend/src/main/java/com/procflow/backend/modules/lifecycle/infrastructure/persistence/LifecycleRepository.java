package com.procflow.backend.modules.lifecycle.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;

import com.procflow.backend.modules.lifecycle.domain.Lifecycle;

public interface LifecycleRepository extends JpaRepository<Lifecycle, UUID> {

    Optional<Lifecycle> findByTenantIdAndCodeAndActiveTrue(UUID tenantId, String code);
}
